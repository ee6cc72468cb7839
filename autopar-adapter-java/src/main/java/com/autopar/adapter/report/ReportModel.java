package com.autopar.adapter.report;

import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * POJOs for {@code parallel_report.json}.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ReportModel {

    private ReportModel() {}

    public static class ReportRoot {
        @SerializedName("report_version")  public String reportVersion;
        @SerializedName("language")        public String language;
        @SerializedName("source")          public String source;
        @SerializedName("applied")         public boolean applied;
        @SerializedName("summary")         public Summary summary;
        @SerializedName("files")           public List<FileEntry> files;
        @SerializedName("regions")         public List<RegionEntry> regions;
        @SerializedName("transforms")      public List<TransformEntry> transforms;
    }

    public static class Summary {
        @SerializedName("candidates") public int candidates;
        @SerializedName("accepted")   public int accepted;
        @SerializedName("rejected")   public int rejected;
        @SerializedName("applied")    public int applied;
    }

    public static class FileEntry {
        @SerializedName("path")        public String path;
        @SerializedName("program")     public String program;
        @SerializedName("unsupported") public int unsupported;
        @SerializedName("version")     public int version;
    }

    public static class RegionEntry {
        @SerializedName("file")                public String file;
        @SerializedName("location")            public String location;
        @SerializedName("function")            public String function;   // nullable
        @SerializedName("line")                public int line;
        @SerializedName("column")              public int column;
        @SerializedName("kind")                public String kind;       // LOOP, RECURSION
        @SerializedName("decision")            public String decision;   // ACCEPTED, REJECTED
        @SerializedName("reason")              public String reason;     // nullable
        @SerializedName("category")            public String category;   // nullable
        @SerializedName("detail")              public String detail;     // nullable
        @SerializedName("trip_estimate")       public int tripEstimate;
        @SerializedName("cost_per_iteration")  public double costPerIteration;
        @SerializedName("benefit")             public double benefit;
        @SerializedName("combine")             public String combine;    // nullable
        @SerializedName("accumulation_target") public String accumulationTarget;
        @SerializedName("profile")             public String profile;
        @SerializedName("suggested_backend")   public String suggestedBackend;
        @SerializedName("privatized")          public List<String> privatized;
        @SerializedName("captures")            public List<String> captures;
        @SerializedName("evidence")            public List<String> evidence;
    }

    public static class TransformEntry {
        @SerializedName("file")     public String file;
        @SerializedName("location") public String location;
        @SerializedName("outcome")  public String outcome;   // applied, backend_mismatch, aborted
        @SerializedName("combine")  public String combine;   // nullable
        @SerializedName("workers")  public int workers;
        @SerializedName("reason")   public String reason;    // nullable
    }
}
