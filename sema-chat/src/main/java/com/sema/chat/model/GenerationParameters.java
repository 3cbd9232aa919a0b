package com.sema.chat.model;

/**
 * Sampling parameters for one generation call. Out-of-range values are clamped by
 * {@link #normalized()}, never rejected.
 */
public record GenerationParameters(
        double temperature,
        int maxTokens,
        double topP,
        int topK
) {
    public static final int MAX_TOKENS_UPPER_BOUND = 2048;

    public static GenerationParameters defaults() {
        return new GenerationParameters(0.7, 512, 0.9, 50);
    }

    public GenerationParameters normalized() {
        return new GenerationParameters(
                clamp(temperature, 0.0, 1.0),
                Math.max(1, Math.min(MAX_TOKENS_UPPER_BOUND, maxTokens)),
                clamp(topP, 0.0, 1.0),
                Math.max(1, topK));
    }

    public GenerationParameters withOverrides(Double temperature, Integer maxTokens, Double topP, Integer topK) {
        return new GenerationParameters(
                temperature != null ? temperature : this.temperature,
                maxTokens != null ? maxTokens : this.maxTokens,
                topP != null ? topP : this.topP,
                topK != null ? topK : this.topK);
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return min;
        }
        return Math.max(min, Math.min(max, value));
    }
}
