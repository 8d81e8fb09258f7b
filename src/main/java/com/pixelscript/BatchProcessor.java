package com.pixelscript;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostic;
import com.pixelscript.image.PngImageWriter;
import com.pixelscript.render.CommandRegistry;

/**
 * Renders every {@code .txt} script of a directory to {@code <name>.png} and
 * writes a JSON report with per-file and overall line statistics.
 */
public final class BatchProcessor {

    private static final String TAG = "pixelscript.batch";
    private static final ObjectMapper om = new ObjectMapper();

    private final RunnerConfig config;

    public BatchProcessor(RunnerConfig config) {
        this.config = config;
    }

    /** Processes the input directory; the returned report has also been written to disk. */
    public ObjectNode run() throws IOException {
        Path in = config.inputDir();
        Path out = config.outputDir();
        if (!Files.isDirectory(in)) {
            throw new IOException("Input directory not found: " + in);
        }
        Files.createDirectories(out);

        List<Path> scripts;
        try (Stream<Path> s = Files.list(in)) {
            scripts = s.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".txt"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        Debug.get().i(TAG, "found " + scripts.size() + " scripts in " + in);

        ObjectNode report = om.createObjectNode();
        report.put("input", in.toString());
        report.put("output", out.toString());
        ArrayNode files = report.putArray("files");

        int successFiles = 0;
        long totalLines = 0;
        long processedLines = 0;
        long successLines = 0;
        long failedLines = 0;
        long started = System.currentTimeMillis();

        ScriptRunner runner = new ScriptRunner(CommandRegistry.withDefaults(), config.expressionCache());
        for (int i = 0; i < scripts.size(); i++) {
            Path script = scripts.get(i);
            String name = script.getFileName().toString();
            Path png = out.resolve(name.substring(0, name.length() - ".txt".length()) + ".png");
            Debug.get().i(TAG, "[" + (i + 1) + "/" + scripts.size() + "] " + name);

            ObjectNode entry = files.addObject();
            entry.put("file", name);
            try {
                RenderResult result = runner.runFile(script);
                boolean written = false;
                if (result.hasImage()) {
                    PngImageWriter.write(result.buffer(), png);
                    written = true;
                    entry.put("image", png.toString());
                } else {
                    Debug.get().w(TAG, name + ": no canvas configured, nothing written");
                }
                putStats(entry, result.stats());
                entry.put("diagnostics", result.diagnostics().size());
                ArrayNode details = entry.putArray("diagnosticDetails");
                for (Diagnostic d : result.diagnostics()) details.add(d.toString());
                entry.put("success", written);

                if (written) successFiles++;
                totalLines += result.stats().totalLines();
                processedLines += result.stats().processedLines();
                successLines += result.stats().successLines();
                failedLines += result.stats().failedLines();
            } catch (IOException e) {
                Debug.get().e(TAG, name + ": " + e.getMessage(), e);
                entry.put("success", false);
                entry.put("error", e.getMessage());
            }
        }

        ObjectNode overall = report.putObject("overall");
        overall.put("totalFiles", scripts.size());
        overall.put("successFiles", successFiles);
        overall.put("failedFiles", scripts.size() - successFiles);
        overall.put("totalLines", totalLines);
        overall.put("processedLines", processedLines);
        overall.put("successLines", successLines);
        overall.put("failedLines", failedLines);
        overall.put("lineSuccessRate", processedLines == 0 ? 0.0 : successLines * 100.0 / processedLines);
        overall.put("elapsedMillis", System.currentTimeMillis() - started);

        Path reportFile = config.reportFile();
        Path parent = reportFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(reportFile, om.writerWithDefaultPrettyPrinter().writeValueAsString(report),
                StandardCharsets.UTF_8);
        Debug.get().i(TAG, "report written to " + reportFile);
        return report;
    }

    private static void putStats(ObjectNode entry, RunStats stats) {
        entry.put("totalLines", stats.totalLines());
        entry.put("processedLines", stats.processedLines());
        entry.put("successLines", stats.successLines());
        entry.put("failedLines", stats.failedLines());
        entry.put("advancedFeaturesUsed", stats.advancedFeaturesUsed());
        ArrayNode failures = entry.putArray("failures");
        for (String f : stats.failureDetails()) failures.add(f);
    }
}
