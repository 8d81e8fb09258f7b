package com.pixelscript;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Settings for the CLI and batch mode. Defaults can be overridden from a
 * JSON file:
 *
 * <pre>
 * { "input": "input", "output": "output", "report": "output/processing_report.json",
 *   "verbose": false, "expressionCache": true }
 * </pre>
 */
public final class RunnerConfig {

    private static final ObjectMapper om = new ObjectMapper();

    public static final String REPORT_NAME = "processing_report.json";

    private Path inputDir = Path.of("input");
    private Path outputDir = Path.of("output");
    private Path reportFile = null;
    private boolean verbose = false;
    private boolean expressionCache = true;

    public static RunnerConfig defaults() {
        return new RunnerConfig();
    }

    public static RunnerConfig load(Path json) throws IOException {
        return fromJson(om.readTree(Files.readString(json, StandardCharsets.UTF_8)));
    }

    public static RunnerConfig fromJson(JsonNode node) throws IOException {
        if (node == null || !node.isObject()) {
            throw new IOException("Config must be a JSON object");
        }
        RunnerConfig c = new RunnerConfig();
        if (node.hasNonNull("input")) c.inputDir = Path.of(node.get("input").asText());
        if (node.hasNonNull("output")) c.outputDir = Path.of(node.get("output").asText());
        if (node.hasNonNull("report")) c.reportFile = Path.of(node.get("report").asText());
        c.verbose = node.path("verbose").asBoolean(c.verbose);
        c.expressionCache = node.path("expressionCache").asBoolean(c.expressionCache);
        return c;
    }

    public ObjectNode toJson() {
        ObjectNode n = om.createObjectNode();
        n.put("input", inputDir.toString());
        n.put("output", outputDir.toString());
        n.put("report", reportFile().toString());
        n.put("verbose", verbose);
        n.put("expressionCache", expressionCache);
        return n;
    }

    public Path inputDir() { return inputDir; }
    public Path outputDir() { return outputDir; }

    /** Explicit report path, or {@value #REPORT_NAME} inside the output directory. */
    public Path reportFile() {
        return reportFile != null ? reportFile : outputDir.resolve(REPORT_NAME);
    }

    public boolean verbose() { return verbose; }
    public boolean expressionCache() { return expressionCache; }

    public RunnerConfig withInputDir(Path dir) { this.inputDir = dir; return this; }
    public RunnerConfig withOutputDir(Path dir) { this.outputDir = dir; return this; }
    public RunnerConfig withReportFile(Path file) { this.reportFile = file; return this; }
    public RunnerConfig withVerbose(boolean verbose) { this.verbose = verbose; return this; }
    public RunnerConfig withExpressionCache(boolean enabled) { this.expressionCache = enabled; return this; }
}
