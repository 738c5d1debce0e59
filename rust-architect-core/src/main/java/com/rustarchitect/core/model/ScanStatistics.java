package com.rustarchitect.core.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Statistics collected while scanning and extracting a project.
 *
 * <p>Provides transparency into how many files were seen, read and processed,
 * and why the others were skipped.
 *
 * @param filesDiscovered source files found under the source root
 * @param filesExcluded files dropped by the exclusion rules
 * @param filesScanned files read and decoded
 * @param filesFailed files that could not be read or processed
 * @param errorCounts map of error types to their occurrence counts
 * @param topErrors most significant error messages (max 10)
 */
public record ScanStatistics(
    int filesDiscovered,
    int filesExcluded,
    int filesScanned,
    int filesFailed,
    Map<String, Integer> errorCounts,
    List<String> topErrors
) {
    private static final int MAX_TOP_ERRORS = 10;

    /**
     * Compact constructor with validation and defaults.
     */
    public ScanStatistics {
        filesDiscovered = Math.max(0, filesDiscovered);
        filesExcluded = Math.max(0, filesExcluded);
        filesScanned = Math.max(0, filesScanned);
        filesFailed = Math.max(0, filesFailed);
        errorCounts = errorCounts == null ? Map.of() : Map.copyOf(errorCounts);
        topErrors = topErrors == null ? List.of() : List.copyOf(topErrors);
    }

    /**
     * Creates an empty statistics instance (no files processed).
     *
     * @return empty statistics
     */
    public static ScanStatistics empty() {
        return new ScanStatistics(0, 0, 0, 0, Map.of(), List.of());
    }

    /**
     * Returns true if at least one file failed.
     *
     * @return true on failures
     */
    public boolean hasFailures() {
        return filesFailed > 0;
    }

    /**
     * Returns a copy with additional failures merged in.
     *
     * @param other failures to add (only failure fields are merged)
     * @return merged statistics
     */
    public ScanStatistics withFailures(ScanStatistics other) {
        Builder builder = toBuilder();
        builder.filesFailed += other.filesFailed;
        other.errorCounts.forEach((type, count) -> builder.errorCounts.merge(type, count, Integer::sum));
        for (String error : other.topErrors) {
            if (builder.topErrors.size() < MAX_TOP_ERRORS) {
                builder.topErrors.add(error);
            }
        }
        return builder.build();
    }

    /**
     * Returns a human-readable summary of the statistics.
     *
     * @return summary string
     */
    public String summary() {
        return String.format("Discovered: %d, Excluded: %d, Scanned: %d, Failed: %d",
            filesDiscovered, filesExcluded, filesScanned, filesFailed);
    }

    private Builder toBuilder() {
        Builder builder = new Builder();
        builder.filesDiscovered = filesDiscovered;
        builder.filesExcluded = filesExcluded;
        builder.filesScanned = filesScanned;
        builder.filesFailed = filesFailed;
        builder.errorCounts.putAll(errorCounts);
        builder.topErrors.addAll(topErrors);
        return builder;
    }

    /**
     * Builder for constructing ScanStatistics incrementally.
     */
    public static class Builder {
        private int filesDiscovered = 0;
        private int filesExcluded = 0;
        private int filesScanned = 0;
        private int filesFailed = 0;
        private final Map<String, Integer> errorCounts = new HashMap<>();
        private final List<String> topErrors = new ArrayList<>();

        public Builder incrementFilesDiscovered() {
            this.filesDiscovered++;
            return this;
        }

        public Builder incrementFilesExcluded() {
            this.filesExcluded++;
            return this;
        }

        public Builder incrementFilesScanned() {
            this.filesScanned++;
            return this;
        }

        public Builder incrementFilesFailed() {
            this.filesFailed++;
            return this;
        }

        public Builder addError(String errorType, String errorDetail) {
            errorCounts.merge(errorType, 1, Integer::sum);
            if (topErrors.size() < MAX_TOP_ERRORS) {
                topErrors.add(errorDetail);
            }
            return this;
        }

        public ScanStatistics build() {
            return new ScanStatistics(
                filesDiscovered,
                filesExcluded,
                filesScanned,
                filesFailed,
                errorCounts,
                topErrors
            );
        }
    }
}
