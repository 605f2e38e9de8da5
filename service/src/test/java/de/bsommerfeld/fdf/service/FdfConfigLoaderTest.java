package de.bsommerfeld.fdf.service;

import de.bsommerfeld.fdf.core.config.FdfConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FdfConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final FdfConfigLoader loader = new FdfConfigLoader(name -> null);

    @Test
    void load_shouldReadAllSections() throws IOException {
        Path file = tempDir.resolve("fdf.toml");
        Files.writeString(file, """
                [layout]
                canvas-width = 1.0
                canvas-height = 0.75
                fallback-size = 0.3
                resolve-inheritance = false

                [export]
                indent = "  "
                include-header = false
                decimal-places = 4
                """);

        FdfConfig config = loader.load(file);

        assertEquals(1.0, config.getLayout().getCanvasWidth(), 1e-9);
        assertEquals(0.75, config.getLayout().getCanvasHeight(), 1e-9);
        assertEquals(0.3, config.getLayout().getFallbackSize(), 1e-9);
        assertFalse(config.getLayout().isResolveInheritance());
        assertEquals("  ", config.getExport().getIndent());
        assertFalse(config.getExport().isIncludeHeader());
        assertEquals(4, config.getExport().getDecimalPlaces());
    }

    @Test
    void load_shouldKeepDefaultsForMissingKeys() throws IOException {
        Path file = tempDir.resolve("partial.toml");
        Files.writeString(file, """
                [layout]
                default-width = 0.2
                unknown-key = "ignored"
                """);

        FdfConfig config = loader.load(file);

        assertEquals(0.2, config.getLayout().getDefaultWidth(), 1e-9);
        assertEquals(0.1, config.getLayout().getDefaultHeight(), 1e-9);
        assertEquals("\t", config.getExport().getIndent());
    }

    @Test
    void load_shouldUseDefaultsWhenFileIsMissing() {
        FdfConfig config = loader.load(tempDir.resolve("missing.toml"));

        assertEquals(0.8, config.getLayout().getCanvasWidth(), 1e-9);
        assertTrue(config.getExport().isIncludeHeader());
    }

    @Test
    void load_shouldUseDefaultsWithoutAnySource() {
        FdfConfig config = loader.load(null);

        assertEquals(6, config.getExport().getDecimalPlaces());
    }

    @Test
    void load_shouldFailOnMalformedFile() throws IOException {
        Path file = tempDir.resolve("broken.toml");
        Files.writeString(file, """
                [layout]
                canvas-width = "wide"
                """);

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.load(file));

        assertTrue(e.getMessage().contains("broken.toml"), e.getMessage());
        assertNotNull(e.getCause());
    }

    // -- lookup order --

    @Test
    void load_shouldFallBackToEnvironmentVariable() throws IOException {
        Path file = tempDir.resolve("env.toml");
        Files.writeString(file, """
                [export]
                decimal-places = 3
                """);
        FdfConfigLoader envLoader = new FdfConfigLoader(Map.of(FdfConfigLoader.ENVIRONMENT, file.toString())::get);

        assertEquals(3, envLoader.load(null).getExport().getDecimalPlaces());
    }

    @Test
    void load_shouldPreferSystemPropertyOverEnvironment() throws IOException {
        Path propertyFile = tempDir.resolve("property.toml");
        Files.writeString(propertyFile, """
                [export]
                decimal-places = 2
                """);
        Path envFile = tempDir.resolve("env.toml");
        Files.writeString(envFile, """
                [export]
                decimal-places = 3
                """);
        FdfConfigLoader envLoader = new FdfConfigLoader(Map.of(FdfConfigLoader.ENVIRONMENT, envFile.toString())::get);

        System.setProperty(FdfConfigLoader.PROPERTY, propertyFile.toString());
        try {
            assertEquals(2, envLoader.load(null).getExport().getDecimalPlaces());
        } finally {
            System.clearProperty(FdfConfigLoader.PROPERTY);
        }
    }

    @Test
    void load_shouldPreferExplicitPath() throws IOException {
        Path explicit = tempDir.resolve("explicit.toml");
        Files.writeString(explicit, """
                [export]
                decimal-places = 5
                """);
        Path envFile = tempDir.resolve("env.toml");
        Files.writeString(envFile, """
                [export]
                decimal-places = 3
                """);
        FdfConfigLoader envLoader = new FdfConfigLoader(Map.of(FdfConfigLoader.ENVIRONMENT, envFile.toString())::get);

        assertEquals(5, envLoader.load(explicit).getExport().getDecimalPlaces());
    }
}
