package de.anton.pl.analyser.pl_analyzer.model;

/**
 * Line-shape models available for curve synthesis.
 * VOIGT has no profile of its own yet and is rendered with the Gaussian profile.
 */
public enum PeakModel {
    GAUSSIAN("gaussian"),
    LORENTZIAN("lorentzian"),
    VOIGT("voigt");

    private final String key;

    PeakModel(String key) {
        this.key = key;
    }

    /** Lower-case key used in stored results and reports. */
    public String getKey() {
        return key;
    }

    /** The profile actually evaluated for this model. */
    public PeakModel profile() {
        return this == VOIGT ? GAUSSIAN : this;
    }

    /** True if the model is computed with another model's profile. */
    public boolean isApproximated() {
        return profile() != this;
    }

    @Override
    public String toString() {
        return key;
    }

    /**
     * Finds a model by its key (case-insensitive).
     *
     * @return the matching model, or null if there is none.
     */
    public static PeakModel fromKey(String key) {
        if (key == null) {
            return null;
        }
        for (PeakModel model : values()) {
            if (model.key.equalsIgnoreCase(key.trim())) {
                return model;
            }
        }
        return null;
    }
}
