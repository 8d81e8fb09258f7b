package com.pixelscript;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Slf4jDebugSink;
import com.pixelscript.image.PngImageWriter;
import com.pixelscript.render.CommandRegistry;

/**
 * Command line entry point.
 *
 * <pre>
 *   PixelScriptCli &lt;script.txt&gt; [out.png] [--no-cache] [--verbose]
 *   PixelScriptCli --batch [--input dir] [--output dir] [--report file] [--config file.json]
 * </pre>
 *
 * Exit status: 0 image written, 1 processing failed, 2 usage error, 3 I/O error.
 */
public final class PixelScriptCli {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;
    static final int EXIT_IO = 3;

    private static final String USAGE =
            "Usage: PixelScriptCli <script.txt> [out.png] [--no-cache] [--verbose]\n"
          + "       PixelScriptCli --batch [--input dir] [--output dir] [--report file] [--config file.json]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        Map<String, String> flags = new HashMap<>();
        List<String> positional = new ArrayList<>();
        if (!parseArgs(args, flags, positional)) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }

        RunnerConfig config;
        try {
            config = flags.containsKey("config")
                    ? RunnerConfig.load(Path.of(flags.get("config")))
                    : RunnerConfig.defaults();
        } catch (IOException e) {
            System.err.println("Failed to read config: " + e.getMessage());
            return EXIT_IO;
        }
        if (flags.containsKey("input")) config.withInputDir(Path.of(flags.get("input")));
        if (flags.containsKey("output")) config.withOutputDir(Path.of(flags.get("output")));
        if (flags.containsKey("report")) config.withReportFile(Path.of(flags.get("report")));
        if (flags.containsKey("no-cache")) config.withExpressionCache(false);
        if (flags.containsKey("verbose")) config.withVerbose(true);

        installLogging(config.verbose());

        if (flags.containsKey("batch")) {
            if (!positional.isEmpty()) {
                System.err.println(USAGE);
                return EXIT_USAGE;
            }
            return runBatch(config);
        }
        if (positional.isEmpty() || positional.size() > 2) {
            System.err.println(USAGE);
            return EXIT_USAGE;
        }
        Path script = Path.of(positional.get(0));
        Path png = positional.size() == 2 ? Path.of(positional.get(1)) : defaultOutput(script);
        return runSingle(script, png, config);
    }

    private static int runSingle(Path script, Path png, RunnerConfig config) {
        if (!Files.isRegularFile(script)) {
            System.err.println("Script file not found: " + script);
            return EXIT_IO;
        }
        ScriptRunner runner = new ScriptRunner(CommandRegistry.withDefaults(), config.expressionCache());
        RenderResult result;
        try {
            result = runner.runFile(script);
        } catch (IOException e) {
            System.err.println("Failed to read script file: " + script);
            e.printStackTrace(System.err);
            return EXIT_IO;
        }

        RunStats stats = result.stats();
        System.out.println(script + ": " + stats);
        for (String failure : stats.failureDetails()) {
            System.out.println("  failed " + failure);
        }

        if (!result.hasImage()) {
            System.err.println("No image produced: the script never configured a canvas");
            return EXIT_FAILED;
        }
        try {
            PngImageWriter.write(result.buffer(), png);
        } catch (IOException e) {
            System.err.println("Failed to write image: " + png);
            e.printStackTrace(System.err);
            return EXIT_IO;
        }
        System.out.println("Wrote " + png + " (" + result.width() + "x" + result.height() + ")");
        return EXIT_OK;
    }

    private static int runBatch(RunnerConfig config) {
        ObjectNode report;
        try {
            report = new BatchProcessor(config).run();
        } catch (IOException e) {
            System.err.println("Batch processing failed: " + e.getMessage());
            return EXIT_IO;
        }
        JsonNode overall = report.path("overall");
        System.out.println("Files: " + overall.path("successFiles").asInt() + "/" + overall.path("totalFiles").asInt()
                + " ok, lines: " + overall.path("successLines").asLong() + "/" + overall.path("processedLines").asLong()
                + " ok. Report: " + config.reportFile());
        return overall.path("failedFiles").asInt() == 0 ? EXIT_OK : EXIT_FAILED;
    }

    private static void installLogging(boolean verbose) {
        if (verbose) {
            System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
        }
        Debug.get().setSink(new Slf4jDebugSink());
    }

    static Path defaultOutput(Path script) {
        String name = script.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = dot > 0 ? name.substring(0, dot) : name;
        return script.resolveSibling(base + ".png");
    }

    /**
     * Accepts {@code --name value}, {@code --name=value} and bare switches
     * ({@code --batch}, {@code --no-cache}, {@code --verbose}).
     * Returns false on an unknown flag or a missing value.
     */
    static boolean parseArgs(String[] args, Map<String, String> flags, List<String> positional) {
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--")) {
                positional.add(a);
                continue;
            }
            String name = a.substring(2);
            String value = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            }
            switch (name) {
                case "batch":
                case "no-cache":
                case "verbose":
                    flags.put(name, "true");
                    break;
                case "input":
                case "output":
                case "report":
                case "config":
                    if (value == null) {
                        if (i + 1 >= args.length) return false;
                        value = args[++i];
                    }
                    flags.put(name, value);
                    break;
                default:
                    return false;
            }
        }
        return true;
    }

    private PixelScriptCli() {}
}
