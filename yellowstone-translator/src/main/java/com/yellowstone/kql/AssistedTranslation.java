package com.yellowstone.kql;

/**
 * Answer of an {@link AssistedTranslationHandler}.
 *
 * @param kql the translated query, null on failure
 * @param confidence the collaborator's confidence in [0, 1]
 * @param message explanation, required on failure
 */
public record AssistedTranslation(String kql, double confidence,
        String message) {

    public AssistedTranslation {
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                "Confidence must be within [0, 1]: " + confidence);
        }
        if (kql == null && (message == null || message.isBlank())) {
            throw new IllegalArgumentException(
                "A failed assisted translation needs a message");
        }
    }

    /**
     * A successful answer.
     *
     * @param kql the translated query
     * @param confidence confidence in [0, 1]
     * @return the answer
     */
    public static AssistedTranslation success(final String kql,
            final double confidence) {
        return new AssistedTranslation(kql, confidence, null);
    }

    /**
     * A failed answer.
     *
     * @param message why no translation was produced
     * @return the answer
     */
    public static AssistedTranslation failure(final String message) {
        return new AssistedTranslation(null, 0.0, message);
    }

    /**
     * Whether a query was produced.
     *
     * @return true when {@link #kql()} is set
     */
    public boolean isSuccess() {
        return kql != null;
    }
}
