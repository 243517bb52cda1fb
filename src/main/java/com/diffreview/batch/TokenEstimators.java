package com.diffreview.batch;

import java.util.Locale;

public final class TokenEstimators {
    private TokenEstimators() {
    }

    /**
     * {@code bpe} (default) counts real BPE tokens; {@code chars} approximates with one token per four characters.
     */
    public static TokenEstimator named(String estimator, String encoding) {
        String kind = estimator == null || estimator.isBlank() ? "bpe" : estimator.trim().toLowerCase(Locale.ROOT);
        return switch (kind) {
            case "bpe" -> BpeTokenEstimator.forEncoding(encoding);
            case "chars" -> new CharacterRatioTokenEstimator();
            default -> throw new IllegalArgumentException("Unknown token estimator: " + estimator + " (expected bpe or chars)");
        };
    }
}
