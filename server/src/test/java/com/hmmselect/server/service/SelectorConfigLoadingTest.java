package com.hmmselect.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hmmselect.server.ai.SelectorConfig;
import com.hmmselect.server.util.ConfigPathResolver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class SelectorConfigLoadingTest {

    @AfterEach
    public void clearProperty() {
        System.clearProperty(ConfigPathResolver.CONFIG_PROPERTY);
    }

    @Test
    public void testConfigParsing() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        InputStream is = getClass().getResourceAsStream("/selector_config.json");
        assertNotNull(is, "selector_config.json not found in test classpath");

        SelectorConfig config = mapper.readValue(is, SelectorConfig.class);

        assertEquals("bic", config.selector);
        assertEquals(2, config.minComponents);
        assertEquals(10, config.maxComponents);
        assertEquals(3, config.nConstant);
        assertEquals(14L, config.randomSeed);
        assertEquals(3, config.cvFolds);
    }

    @Test
    public void testLoadConfigFromDefaultFile() {
        SelectorConfig config = ModelSelectionService.loadConfigOrDefault();
        assertNotNull(config);
        assertEquals(1000, config.maxIterations);
        assertEquals(1.0e-3, config.minCovar, 1e-12);
    }

    @Test
    public void testSystemPropertyOverridesClasspath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("custom.json");
        Files.writeString(file, "{\"selector\": \"dic\", \"minComponents\": 3, \"maxComponents\": 5,"
                + " \"nConstant\": 4, \"verbose\": true}");
        System.setProperty(ConfigPathResolver.CONFIG_PROPERTY, file.toString());

        SelectorConfig config = ModelSelectionService.loadConfigOrDefault();

        assertEquals("dic", config.selector);
        assertEquals(3, config.minComponents);
        assertEquals(5, config.maxComponents);
        assertEquals(4, config.nConstant);
        assertTrue(config.verbose);
        // fields absent from the file keep their defaults
        assertEquals(3, config.cvFolds);
    }

    @Test
    public void testInvalidFileFallsBackToDefaults(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("bad.json");
        Files.writeString(file, "{\"minComponents\": 8, \"maxComponents\": 4}");
        System.setProperty(ConfigPathResolver.CONFIG_PROPERTY, file.toString());

        SelectorConfig config = ModelSelectionService.loadConfigOrDefault();

        assertEquals(2, config.minComponents);
        assertEquals(10, config.maxComponents);
    }

    @Test
    public void testValidation() {
        SelectorConfig config = SelectorConfig.defaults();
        config.validate();

        SelectorConfig badFolds = SelectorConfig.defaults();
        badFolds.cvFolds = 1;
        assertThrows(IllegalArgumentException.class, badFolds::validate);

        SelectorConfig badConstant = SelectorConfig.defaults();
        badConstant.nConstant = 0;
        assertThrows(IllegalArgumentException.class, badConstant::validate);
    }
}
