package com.autopar.adapter.report;

import com.autopar.adapter.static_analysis.ConvertedUnit;
import com.autopar.core.detect.DetectionResult;
import com.autopar.core.transform.TransformResult;

import java.util.List;

/** What the analysis decided for one compilation unit. {@code outcomes} is empty without {@code --apply}. */
public record UnitAnalysis(ConvertedUnit unit, DetectionResult detection, List<TransformResult> outcomes) {

    public UnitAnalysis {
        outcomes = List.copyOf(outcomes);
    }
}
