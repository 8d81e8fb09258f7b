package com.pixelscript;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RunnerConfigTest {

    private static final ObjectMapper om = new ObjectMapper();

    @Test
    void defaults() {
        RunnerConfig c = RunnerConfig.defaults();
        assertEquals(Path.of("input"), c.inputDir());
        assertEquals(Path.of("output"), c.outputDir());
        assertEquals(Path.of("output", "processing_report.json"), c.reportFile());
        assertFalse(c.verbose());
        assertTrue(c.expressionCache());
    }

    @Test
    void reportFollowsOutputUnlessSetExplicitly() {
        RunnerConfig c = RunnerConfig.defaults().withOutputDir(Path.of("renders"));
        assertEquals(Path.of("renders", "processing_report.json"), c.reportFile());
        c.withReportFile(Path.of("r.json"));
        assertEquals(Path.of("r.json"), c.reportFile());
    }

    @Test
    void loadsPartialJson(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pixelscript.json");
        Files.writeString(file, "{\"input\":\"scripts\",\"expressionCache\":false}", StandardCharsets.UTF_8);

        RunnerConfig c = RunnerConfig.load(file);
        assertEquals(Path.of("scripts"), c.inputDir());
        assertEquals(Path.of("output"), c.outputDir());
        assertFalse(c.expressionCache());
        assertFalse(c.verbose());
    }

    @Test
    void rejectsNonObjectJson() throws IOException {
        assertThrows(IOException.class, () -> RunnerConfig.fromJson(om.readTree("[1,2]")));
    }

    @Test
    void toJsonReflectsSettings() throws IOException {
        ObjectNode json = RunnerConfig.defaults().withVerbose(true).withInputDir(Path.of("in")).toJson();
        assertEquals("in", json.get("input").asText());
        assertTrue(json.get("verbose").asBoolean());

        RunnerConfig back = RunnerConfig.fromJson(json);
        assertEquals(Path.of("in"), back.inputDir());
        assertTrue(back.verbose());
    }
}
