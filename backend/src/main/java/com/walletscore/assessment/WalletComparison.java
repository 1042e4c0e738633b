package com.walletscore.assessment;

/**
 * Two wallets scored under the same profile and window. winner is null on equal scores.
 */
public record WalletComparison(WalletAssessment a, WalletAssessment b, String winner, int scoreMargin) {
}
