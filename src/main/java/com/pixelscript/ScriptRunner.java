package com.pixelscript;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.pixelscript.debug.Debug;
import com.pixelscript.debug.Diagnostics;
import com.pixelscript.image.PixelBuffer;
import com.pixelscript.render.CommandException;
import com.pixelscript.render.CommandRegistry;
import com.pixelscript.render.DrawingContext;
import com.pixelscript.render.PixelCommand;
import com.pixelscript.script.AdvancedProcessor;
import com.pixelscript.script.LineExecutor;
import com.pixelscript.script.LineResult;
import com.pixelscript.script.VariableStore;

/**
 * Runs a PixelScript file line by line.
 *
 * {@code if:} and {@code loop:} go to the {@link AdvancedProcessor}, which
 * calls back into {@link #execute} for every leaf instruction it produces.
 * Everything else is split into parameters and handed to a registered
 * command. A failing line never stops the run.
 */
public class ScriptRunner implements LineExecutor {

    private static final String TAG = "pixelscript.run";

    private final CommandRegistry commands;
    private final DrawingContext drawing;
    private final Diagnostics diagnostics;
    private final AdvancedProcessor advanced;

    private RunStats stats = new RunStats();

    public ScriptRunner() {
        this(CommandRegistry.withDefaults(), true);
    }

    public ScriptRunner(CommandRegistry commands, boolean expressionCache) {
        this.commands = commands;
        this.diagnostics = new Diagnostics();
        VariableStore variables = new VariableStore();
        this.drawing = new DrawingContext(variables);
        this.advanced = new AdvancedProcessor(variables, diagnostics);
        this.advanced.cache().setEnabled(expressionCache);
    }

    public RenderResult runFile(Path file) throws IOException {
        Debug.get().i(TAG, "processing " + file);
        return runSource(Files.readString(file, StandardCharsets.UTF_8));
    }

    public RenderResult runSource(String source) {
        reset();
        String[] lines = source.isEmpty() ? new String[0] : source.split("\\R");
        stats.setTotalLines(lines.length);

        PixelBuffer buffer = new PixelBuffer(1, 1);
        int width = 1;
        int height = 1;

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String original = lines[i].trim();
            if (original.isEmpty() || original.startsWith("#")) continue;

            String line = stripComment(original);
            diagnostics.setCurrentLine(lineNumber);
            LineResult r = execute(line, buffer, width, height, lineNumber);
            buffer = r.buffer();
            width = r.width();
            height = r.height();

            if (r.success()) {
                stats.recordSuccess();
                Debug.get().i(TAG, "line " + lineNumber + " ok: " + original);
            } else {
                stats.recordFailure(lineNumber, original);
                Debug.get().w(TAG, "line " + lineNumber + " failed: " + original);
            }
        }

        Debug.get().i(TAG, "done: " + stats);
        return new RenderResult(buffer, width, height, stats, new ArrayList<>(diagnostics.entries()));
    }

    /** Dispatches one instruction; also the callback used by if/loop expansion. */
    @Override
    public LineResult execute(String line, PixelBuffer buffer, int width, int height, int lineNumber) {
        int colon = line.indexOf(':');
        if (colon < 0) {
            diagnostics.syntax("missing ':' in '" + line + "'");
            return LineResult.failed(buffer, width, height);
        }
        String command = line.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        String param = line.substring(colon + 1);

        if (command.equals("if")) {
            stats.recordAdvancedFeature();
            return advanced.processIf(param, buffer, width, height, lineNumber, this);
        }
        if (command.equals("loop")) {
            stats.recordAdvancedFeature();
            return advanced.processLoop(param, buffer, width, height, lineNumber, this);
        }

        PixelCommand handler = commands.get(command);
        if (handler == null) {
            Debug.get().w(TAG, "line " + lineNumber + ": unknown command '" + command + "'");
            return LineResult.failed(buffer, width, height);
        }

        List<String> params = advanced.splitParams(param);
        try {
            return handler.apply(params, drawing, buffer, width, height);
        } catch (CommandException e) {
            Debug.get().w(TAG, "line " + lineNumber + ": " + e.getMessage());
            return LineResult.failed(buffer, width, height);
        } catch (RuntimeException e) {
            Debug.get().e(TAG, "line " + lineNumber + ": " + command + " crashed", e);
            return LineResult.failed(buffer, width, height);
        }
    }

    /** Cuts an inline {@code #} comment that sits outside quotes. */
    static String stripComment(String line) {
        char quote = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"' || c == '\'') {
                if (quote == 0) quote = c;
                else if (quote == c) quote = 0;
            } else if (c == '#' && quote == 0) {
                return line.substring(0, i).trim();
            }
        }
        return line;
    }

    public void reset() {
        drawing.clear();
        advanced.reset();
        stats = new RunStats();
    }

    public DrawingContext drawing() { return drawing; }
    public AdvancedProcessor advanced() { return advanced; }
    public Diagnostics diagnostics() { return diagnostics; }
    public RunStats stats() { return stats; }
}
