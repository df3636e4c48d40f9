package de.anton.pl.analyser.pl_analyzer.model;

/**
 * Normalization applied as the last preprocessing stage.
 */
public enum NormalizationMethod {
    MAX("max"),   // divide by the maximum intensity
    AREA("area"); // divide by the trapezoidal area

    private final String key;

    NormalizationMethod(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    @Override
    public String toString() {
        return key;
    }

    public static NormalizationMethod fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (NormalizationMethod method : values()) {
            if (method.key.equalsIgnoreCase(key.trim())) {
                return method;
            }
        }
        return null;
    }
}
