package com.diffreview.batch;

public class CharacterRatioTokenEstimator implements TokenEstimator {
    private final int charsPerToken;

    public CharacterRatioTokenEstimator() {
        this(4);
    }

    public CharacterRatioTokenEstimator(int charsPerToken) {
        if (charsPerToken < 1) {
            throw new IllegalArgumentException("charsPerToken must be >= 1");
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public int estimate(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + charsPerToken - 1) / charsPerToken;
    }

    @Override
    public String name() {
        return "chars-per-" + charsPerToken;
    }
}
