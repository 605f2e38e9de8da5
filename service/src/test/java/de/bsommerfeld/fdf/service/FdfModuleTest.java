package de.bsommerfeld.fdf.service;

import com.google.inject.Guice;
import com.google.inject.Injector;
import de.bsommerfeld.fdf.core.config.ExportConfig;
import de.bsommerfeld.fdf.core.config.FdfConfig;
import de.bsommerfeld.fdf.core.config.LayoutConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FdfModuleTest {

    @TempDir
    Path tempDir;

    @Test
    void injector_shouldBindConfigurationSections() throws IOException {
        Path file = tempDir.resolve("fdf.toml");
        Files.writeString(file, """
                [layout]
                canvas-width = 1.0

                [export]
                include-header = false
                """);

        Injector injector = Guice.createInjector(new FdfModule(file, IncludeResolver.none()));

        FdfConfig config = injector.getInstance(FdfConfig.class);
        assertSame(config.getLayout(), injector.getInstance(LayoutConfig.class));
        assertSame(config.getExport(), injector.getInstance(ExportConfig.class));
        assertEquals(1.0, injector.getInstance(LayoutConfig.class).getCanvasWidth(), 1e-9);
    }

    @Test
    void injector_shouldProvideSingletonService() {
        Injector injector = Guice.createInjector(new FdfModule(tempDir.resolve("missing.toml"),
                IncludeResolver.none()));

        FdfService service = injector.getInstance(FdfService.class);

        assertSame(service, injector.getInstance(FdfService.class));
    }

    @Test
    void injector_shouldWireConfiguredServiceAndResolver() throws IOException {
        Path file = tempDir.resolve("fdf.toml");
        Files.writeString(file, """
                [export]
                include-header = false
                indent = "  "
                """);
        IncludeResolver resolver = path -> Optional.of("""
                Frame "FRAME" "Template" {
                    Width 0.25,
                }
                """);

        FdfService service = Guice.createInjector(new FdfModule(file, resolver)).getInstance(FdfService.class);
        String text = service.format("""
                IncludeFile "templates.fdf",
                Frame "FRAME" "Panel" INHERITS "Template" {
                }
                """);

        assertTrue(text.startsWith("IncludeFile \"templates.fdf\",\n"), text);
        assertTrue(text.contains("\n  Width 0.25,\n"), text);
    }
}
