package com.walletscore.scoring;

import com.walletscore.domain.FactorScore;
import com.walletscore.domain.FeatureSnapshotFixture;
import com.walletscore.domain.FlagSeverity;
import com.walletscore.domain.LendingDecision;
import com.walletscore.domain.RiskFlag;
import com.walletscore.domain.RiskTier;
import com.walletscore.domain.ScoreResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();

    @Test
    @DisplayName("established active wallet scores LOW risk and is allowed")
    void strongWallet() {
        ScoreResult result = engine.score(FeatureSnapshotFixture.strongWallet().build());

        // 20 base + 25 active days + 6 tokens + 10 counterparties + 10 age + 5 stablecoins
        assertThat(result.score()).isEqualTo(76);
        assertThat(result.tier()).isEqualTo(RiskTier.LOW);
        assertThat(result.decision()).isEqualTo(LendingDecision.ALLOW);
        assertThat(result.hardGated()).isFalse();
        assertThat(result.flags()).isEmpty();
        assertThat(result.factors()).extracting(FactorScore::factor).containsExactly(
                "base", "active_days", "token_diversity", "counterparties", "wallet_age", "stablecoin_share");
    }

    @Test
    @DisplayName("no token transfers: hard gated, denied, flagged high")
    void zeroTokenWallet() {
        FeatureSnapshotFixture f = FeatureSnapshotFixture.strongWallet();
        f.erc20TxCount = 0;
        f.uniqueTokens = 0;
        f.uniqueCounterparties = 0;
        f.stablecoinRatio = 0.0;

        ScoreResult result = engine.score(f.build());

        assertThat(result.hardGated()).isTrue();
        assertThat(result.decision()).isEqualTo(LendingDecision.DENY);
        assertThat(result.flags()).contains(new RiskFlag("no_erc20_activity_in_window", FlagSeverity.HIGH,
                "No ERC20 transfers in the selected window."));
        assertThat(result.factors()).extracting(FactorScore::factor).contains("no_token_activity");
    }

    @Test
    @DisplayName("token rows without any resolvable token are still hard gated")
    void tokenRowsWithoutTokensGated() {
        FeatureSnapshotFixture f = FeatureSnapshotFixture.strongWallet();
        f.uniqueTokens = 0;

        ScoreResult result = engine.score(f.build());

        assertThat(f.erc20TxCount).isPositive();
        assertThat(result.tier()).isEqualTo(RiskTier.LOW);
        assertThat(result.hardGated()).isTrue();
        assertThat(result.decision()).isEqualTo(LendingDecision.DENY);
    }

    @Test
    @DisplayName("failed first-activity lookup reports the age as unknown")
    void unknownAgeFlagNote() {
        FeatureSnapshotFixture f = FeatureSnapshotFixture.strongWallet().failed("age");
        f.walletAgeDays = 0;

        ScoreResult result = engine.score(f.build());

        assertThat(result.flags()).extracting(RiskFlag::flag).containsExactly("data_unavailable", "wallet_too_young");
        assertThat(result.flags().get(1).note())
                .startsWith("Wallet age unknown")
                .doesNotContain("0 days");
    }

    @Test
    @DisplayName("base factor names the policy version")
    void baseFactorCarriesPolicyVersion() {
        ScoreResult result = engine.score(FeatureSnapshotFixture.strongWallet().build());

        assertThat(result.factors().get(0).note()).isEqualTo("baseline, policy " + ScoringPolicy.VERSION);
    }

    @Test
    @DisplayName("young wallet is denied regardless of score")
    void youngWalletGated() {
        FeatureSnapshotFixture f = FeatureSnapshotFixture.strongWallet();
        f.walletAgeDays = 10;

        ScoreResult result = engine.score(f.build());

        assertThat(result.score()).isGreaterThanOrEqualTo(60);
        assertThat(result.tier()).isEqualTo(RiskTier.LOW);
        assertThat(result.hardGated()).isTrue();
        assertThat(result.decision()).isEqualTo(LendingDecision.DENY);
        assertThat(result.flags()).extracting(RiskFlag::flag).containsExactly("wallet_too_young");
    }

    @Test
    @DisplayName("score stays in [0, 100] at both extremes")
    void scoreBounds() {
        FeatureSnapshotFixture empty = new FeatureSnapshotFixture();
        empty.walletAgeDays = 0;
        empty.activeDays = 0;
        empty.uniqueTokens = 0;
        empty.uniqueCounterparties = 0;
        empty.stablecoinRatio = 0.0;
        empty.normalTxCount = 0;
        empty.internalTxCount = 0;
        empty.erc20TxCount = 0;
        empty.truncated = true;
        assertThat(engine.score(empty.build()).score()).isZero();

        FeatureSnapshotFixture maxed = FeatureSnapshotFixture.strongWallet();
        maxed.activeDays = 365;
        maxed.uniqueTokens = 1_000;
        maxed.uniqueCounterparties = 10_000;
        maxed.walletAgeDays = 5_000;
        maxed.stablecoinRatio = 1.0;
        assertThat(engine.score(maxed.build()).score()).isBetween(0, 100);
    }

    @Test
    @DisplayName("more counterparties never lowers the score")
    void counterpartyMonotonic() {
        FeatureSnapshotFixture f = FeatureSnapshotFixture.strongWallet();
        int previous = -1;
        for (int counterparties = 0; counterparties <= 400; counterparties += 5) {
            f.uniqueCounterparties = counterparties;
            int score = engine.score(f.build()).score();
            assertThat(score).isGreaterThanOrEqualTo(previous);
            previous = score;
        }
    }

    @Test
    @DisplayName("incomplete data gives UNKNOWN tier and DENY")
    void incompleteData() {
        ScoreResult result = engine.score(FeatureSnapshotFixture.strongWallet().failed("erc20").build());

        assertThat(result.tier()).isEqualTo(RiskTier.UNKNOWN);
        assertThat(result.decision()).isEqualTo(LendingDecision.DENY);
        assertThat(result.flags().get(0).flag()).isEqualTo("data_unavailable");
        assertThat(result.flags().get(0).note()).contains("erc20");
    }

    @Test
    @DisplayName("flags come out in fixed order")
    void flagOrder() {
        FeatureSnapshotFixture f = new FeatureSnapshotFixture().failed("normal");
        f.walletAgeDays = 5;
        f.normalTxCount = 0;
        f.internalTxCount = 0;
        f.erc20TxCount = 0;
        f.truncated = true;

        ScoreResult result = engine.score(f.build());

        assertThat(result.flags()).extracting(RiskFlag::flag).containsExactly(
                "data_unavailable",
                "wallet_too_young",
                "no_eth_activity_in_window",
                "no_erc20_activity_in_window",
                "history_truncated");
    }

    @Test
    @DisplayName("tier thresholds and point bands")
    void thresholds() {
        assertThat(ScoringEngine.tierFor(60)).isEqualTo(RiskTier.LOW);
        assertThat(ScoringEngine.tierFor(59)).isEqualTo(RiskTier.MEDIUM);
        assertThat(ScoringEngine.tierFor(35)).isEqualTo(RiskTier.MEDIUM);
        assertThat(ScoringEngine.tierFor(34)).isEqualTo(RiskTier.HIGH);
        assertThat(ScoringEngine.counterpartyPoints(9)).isZero();
        assertThat(ScoringEngine.counterpartyPoints(10)).isEqualTo(5);
        assertThat(ScoringEngine.counterpartyPoints(200)).isEqualTo(15);
        assertThat(ScoringEngine.agePoints(89)).isZero();
        assertThat(ScoringEngine.agePoints(180)).isEqualTo(6);
        assertThat(ScoringEngine.stablecoinPoints(0.2)).isEqualTo(2);
    }
}
