package com.walletscore.trajectory;

import com.walletscore.domain.FeatureSnapshot;
import com.walletscore.domain.RiskDirection;
import com.walletscore.domain.TrajectoryReport;
import com.walletscore.domain.TrajectoryTrend;
import com.walletscore.domain.WindowAssessment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compares a wallet's current window against the window before it.
 * Relative deltas drive the qualitative trend; the absolute score delta drives the risk direction.
 */
@Component
public class TrajectoryComparator {

    public static final String TX_COUNT = "tx_count";
    public static final String STABLECOIN_RATIO = "stablecoin_ratio";
    public static final String UNIQUE_COUNTERPARTIES = "unique_counterparties";
    public static final String TOKEN_DIVERSITY = "token_diversity";
    public static final String PROTOCOL_INTERACTIONS = "protocol_interactions";
    public static final String CONSISTENCY_SCORE = "consistency_score";
    public static final String SCORE = "score";

    static final double STABLECOIN_DROP_THRESHOLD = -0.25;
    static final double COUNTERPARTY_SPIKE_THRESHOLD = 0.50;
    static final double TX_SPIKE_THRESHOLD = 1.0;
    static final double STABLECOIN_GAIN_THRESHOLD = 0.20;

    public TrajectoryReport compare(WindowAssessment current, WindowAssessment previous) {
        Map<String, Double> curr = metrics(current);
        Map<String, Double> prev = metrics(previous);

        Map<String, Double> deltas = new LinkedHashMap<>();
        Map<String, Double> absoluteDeltas = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : curr.entrySet()) {
            double c = e.getValue();
            double p = prev.get(e.getKey());
            deltas.put(e.getKey(), relativeChange(c, p));
            absoluteDeltas.put(e.getKey(), c - p);
        }

        List<String> drivers = new ArrayList<>();
        if (deltas.get(STABLECOIN_RATIO) < STABLECOIN_DROP_THRESHOLD) {
            drivers.add("stablecoin usage dropping fast");
        }
        if (deltas.get(UNIQUE_COUNTERPARTIES) > COUNTERPARTY_SPIKE_THRESHOLD) {
            drivers.add("counterparties spiking");
        }
        if (deltas.get(TX_COUNT) > TX_SPIKE_THRESHOLD) {
            drivers.add("tx activity spike");
        }

        TrajectoryTrend trend;
        if (drivers.size() >= 2) {
            trend = TrajectoryTrend.DETERIORATING;
        } else if (deltas.get(STABLECOIN_RATIO) > STABLECOIN_GAIN_THRESHOLD) {
            trend = TrajectoryTrend.IMPROVING;
        } else {
            trend = TrajectoryTrend.STABLE;
        }

        double scoreDelta = absoluteDeltas.get(SCORE);
        RiskDirection direction = scoreDelta > 0 ? RiskDirection.IMPROVING
                : scoreDelta < 0 ? RiskDirection.WORSENING
                : RiskDirection.FLAT;

        return new TrajectoryReport(deltas, absoluteDeltas, drivers, trend, direction);
    }

    static double relativeChange(double current, double previous) {
        if (previous == 0.0) {
            return 0.0;
        }
        return (current - previous) / previous;
    }

    private static Map<String, Double> metrics(WindowAssessment assessment) {
        FeatureSnapshot f = assessment.features();
        Map<String, Double> m = new LinkedHashMap<>();
        m.put(TX_COUNT, (double) f.totalTxCount());
        m.put(STABLECOIN_RATIO, f.stablecoinRatio());
        m.put(UNIQUE_COUNTERPARTIES, (double) f.uniqueCounterparties());
        m.put(TOKEN_DIVERSITY, (double) f.uniqueTokens());
        m.put(PROTOCOL_INTERACTIONS, (double) f.internalTxCount());
        m.put(CONSISTENCY_SCORE, f.consistencyScore());
        m.put(SCORE, (double) assessment.score().score());
        return m;
    }
}
