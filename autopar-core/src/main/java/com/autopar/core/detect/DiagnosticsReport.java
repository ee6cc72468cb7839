package com.autopar.core.detect;

import java.util.List;

/** Every candidate considered, in rank order. Rejections are never dropped. */
public record DiagnosticsReport(List<DiagnosticEntry> entries) {

    public DiagnosticsReport {
        entries = List.copyOf(entries);
    }

    public long acceptedCount() {
        return entries.stream().filter(e -> e.decision() == Verdict.ACCEPTED).count();
    }

    public long rejectedCount() {
        return entries.size() - acceptedCount();
    }
}
