package de.anton.pl.analyser.pl_analyzer.model;

/**
 * Baseline estimation methods. ALS (asymmetric least squares) is accepted in
 * configurations but not implemented; selecting it leaves the spectrum unchanged.
 */
public enum BaselineMethod {
    POLYNOMIAL("polynomial", true),
    ALS("als", false);

    private final String key;
    private final boolean implemented;

    BaselineMethod(String key, boolean implemented) {
        this.key = key;
        this.implemented = implemented;
    }

    public String getKey() {
        return key;
    }

    public boolean isImplemented() {
        return implemented;
    }

    @Override
    public String toString() {
        return key;
    }

    public static BaselineMethod fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (BaselineMethod method : values()) {
            if (method.key.equalsIgnoreCase(key.trim())) {
                return method;
            }
        }
        return null;
    }
}
