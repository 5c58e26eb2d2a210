package org.puneet.fdrbench.statistical;

/**
 * Per-replicate metrics produced by the {@link Standardizer}.
 */
public enum Metric {
    FDR("FDR", true),
    TPR("TPR", true),
    FWER("FWER", true),
    TNR("TNR", true),
    REJECTIONS("rejections", false),
    REJECTPROP("rejectprop", false);

    private final String label;
    private final boolean requiresTruth;

    Metric(String label, boolean requiresTruth) {
        this.label = label;
        this.requiresTruth = requiresTruth;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether the metric can only be computed when truth labels are known.
     */
    public boolean requiresTruth() {
        return requiresTruth;
    }

    public static Metric fromLabel(String label) {
        for (Metric metric : values()) {
            if (metric.label.equalsIgnoreCase(label)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown metric: " + label);
    }
}
