package com.walletscore.features;

import com.walletscore.common.StablecoinRegistry;
import com.walletscore.domain.ActivityRecord;
import com.walletscore.domain.FeatureSnapshot;
import com.walletscore.domain.FetchError;
import com.walletscore.domain.TimeWindow;
import com.walletscore.ingestion.activity.WalletActivity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns fetched wallet activity into a {@link FeatureSnapshot}. Pure: same activity and same now give the
 * same snapshot. Counterparties, tokens and stablecoin share are read from token transfers only.
 */
@Component
@RequiredArgsConstructor
public class FeatureExtractor {

    private static final int RATIO_SCALE = 4;

    private final StablecoinRegistry stablecoinRegistry;

    public FeatureSnapshot extract(String wallet, int windowDays, int offsetDays, WalletActivity activity, long nowTs) {
        Map<String, FetchError> errors = activity.errors();

        List<ActivityRecord> normal = activity.normal().records();
        List<ActivityRecord> internal = activity.internal().records();
        List<ActivityRecord> token = activity.token().records();

        long walletAgeDays = activity.firstActivity().firstTimestamp().isPresent()
                ? Math.max(0L, (nowTs - activity.firstActivity().firstTimestamp().getAsLong()) / TimeWindow.SECONDS_PER_DAY)
                : 0L;

        int activeDays = countActiveDays(Stream.of(normal, internal, token).flatMap(List::stream).toList());
        double consistencyScore = round4(activeDays / (double) Math.max(1, windowDays));

        String self = normalize(wallet);
        Set<String> tokens = new HashSet<>();
        Set<String> counterparties = new HashSet<>();
        int stableCount = 0;
        for (ActivityRecord transfer : token) {
            String contract = normalize(transfer.contractAddress());
            if (!contract.isEmpty()) {
                tokens.add(contract);
            }
            String from = normalize(transfer.from());
            String to = normalize(transfer.to());
            if (from.equals(self) && !to.isEmpty()) {
                counterparties.add(to);
            } else if (to.equals(self) && !from.isEmpty()) {
                counterparties.add(from);
            }
            if (stablecoinRegistry.isStablecoinSymbol(transfer.tokenSymbol())) {
                stableCount++;
            }
        }
        double stablecoinRatio = token.isEmpty() ? 0.0 : round4(stableCount / (double) token.size());

        return new FeatureSnapshot(
                wallet,
                windowDays,
                offsetDays,
                walletAgeDays,
                activeDays,
                consistencyScore,
                tokens.size(),
                counterparties.size(),
                stablecoinRatio,
                normal.size(),
                internal.size(),
                token.size(),
                errors.isEmpty(),
                activity.anyTruncated(),
                errors);
    }

    private static int countActiveDays(List<ActivityRecord> records) {
        Set<LocalDate> days = new HashSet<>();
        for (ActivityRecord record : records) {
            days.add(LocalDate.ofInstant(Instant.ofEpochSecond(record.timestamp()), ZoneOffset.UTC));
        }
        return days.size();
    }

    private static String normalize(String address) {
        return address == null ? "" : address.strip().toLowerCase(Locale.ROOT);
    }

    static double round4(double value) {
        return BigDecimal.valueOf(value).setScale(RATIO_SCALE, RoundingMode.HALF_UP).doubleValue();
    }
}
