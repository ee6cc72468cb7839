package com.autopar.core.detect;

public enum RejectionReason {
    UNKNOWN_CALL("UnknownCall", ResultCategory.ANALYSIS_INCONCLUSIVE),
    UNKNOWN_SYMBOL_WRITE("UnknownSymbolWrite", ResultCategory.ANALYSIS_INCONCLUSIVE),
    NOT_COUNTABLE("NotCountable", ResultCategory.ANALYSIS_INCONCLUSIVE),
    LOOP_CARRIED_DEPENDENCE("LoopCarriedDependence", ResultCategory.UNSAFE_REGION),
    SHARED_IO("SharedIo", ResultCategory.UNSAFE_REGION),
    EARLY_EXIT("EarlyExit", ResultCategory.UNSAFE_REGION),
    IMPURE_RECURSION("ImpureRecursion", ResultCategory.UNSAFE_REGION),
    TOO_SMALL("TooSmall", ResultCategory.NOT_PROFITABLE),
    ENCLOSED_BY_PARALLEL_REGION("EnclosedByParallelRegion", ResultCategory.NOT_PROFITABLE);

    private final String label;
    private final ResultCategory category;

    RejectionReason(String label, ResultCategory category) {
        this.label = label;
        this.category = category;
    }

    public String label() {
        return label;
    }

    public ResultCategory category() {
        return category;
    }
}
