package com.pixelscript;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Line counters for one file run. */
public final class RunStats {

    private int totalLines;
    private int processedLines;
    private int successLines;
    private int failedLines;
    private int advancedFeaturesUsed;
    private final List<String> failureDetails = new ArrayList<>();

    void setTotalLines(int totalLines) { this.totalLines = totalLines; }

    void recordSuccess() {
        processedLines++;
        successLines++;
    }

    void recordFailure(int lineNumber, String line) {
        processedLines++;
        failedLines++;
        failureDetails.add("line " + lineNumber + ": " + line);
    }

    void recordAdvancedFeature() { advancedFeaturesUsed++; }

    public int totalLines() { return totalLines; }
    public int processedLines() { return processedLines; }
    public int successLines() { return successLines; }
    public int failedLines() { return failedLines; }
    public int advancedFeaturesUsed() { return advancedFeaturesUsed; }
    public List<String> failureDetails() { return Collections.unmodifiableList(failureDetails); }

    /** Percentage of processed lines that succeeded; 0 when nothing was processed. */
    public double successRate() {
        return processedLines == 0 ? 0.0 : successLines * 100.0 / processedLines;
    }

    @Override
    public String toString() {
        return String.format("total=%d processed=%d success=%d failed=%d (%.2f%%)",
                totalLines, processedLines, successLines, failedLines, successRate());
    }
}
