package com.autopar.core.detect;

/** Analysis outcome taxonomy. Every value is an ordinary result, never a thrown failure. */
public enum ResultCategory {
    /** Something unknown forced a conservative rejection. */
    ANALYSIS_INCONCLUSIVE("AnalysisInconclusive"),
    /** A concrete hazard was found. */
    UNSAFE_REGION("UnsafeRegion"),
    NOT_PROFITABLE("NotProfitable");

    private final String label;

    ResultCategory(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
