package de.bsommerfeld.fdf.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryIncludeResolverTest {

    @TempDir
    Path tempDir;

    @Test
    void resolve_shouldTreatBackslashesAsSeparators() throws IOException {
        Path dir = Files.createDirectories(tempDir.resolve("UI/FrameDef/UI"));
        Files.writeString(dir.resolve("EscMenuTemplates.fdf"), "Frame \"FRAME\" \"T\" { }");

        IncludeResolver resolver = new DirectoryIncludeResolver(tempDir);

        assertEquals(Optional.of("Frame \"FRAME\" \"T\" { }"),
                resolver.resolve("UI\\FrameDef\\UI\\EscMenuTemplates.fdf"));
    }

    @Test
    void resolve_shouldReturnEmptyForMissingFile() {
        assertTrue(new DirectoryIncludeResolver(tempDir).resolve("missing.fdf").isEmpty());
    }

    @Test
    void resolve_shouldRejectPathsOutsideBaseDirectory() throws IOException {
        Path base = Files.createDirectories(tempDir.resolve("base"));
        Files.writeString(tempDir.resolve("secret.fdf"), "Frame \"FRAME\" \"S\" { }");

        assertTrue(new DirectoryIncludeResolver(base).resolve("..\\secret.fdf").isEmpty());
    }

    @Test
    void resolve_shouldThrowResolutionExceptionForUnreadableFile() throws IOException {
        Files.write(tempDir.resolve("broken.fdf"), new byte[]{(byte) 0xC3, (byte) 0x28});

        IncludeResolutionException ex = assertThrows(IncludeResolutionException.class,
                () -> new DirectoryIncludeResolver(tempDir).resolve("broken.fdf"));

        assertTrue(ex.getMessage().startsWith("Failed to read include file"));
        assertInstanceOf(IOException.class, ex.getCause());
        assertTrue(ex.getChain().isEmpty());
    }

    @Test
    void resolve_shouldThrowResolutionExceptionForInvalidPath() {
        IncludeResolutionException ex = assertThrows(IncludeResolutionException.class,
                () -> new DirectoryIncludeResolver(tempDir).resolve("UI\\bad\u0000name.fdf"));

        assertInstanceOf(InvalidPathException.class, ex.getCause());
    }

    @Test
    void none_shouldResolveNothing() {
        assertTrue(IncludeResolver.none().resolve("anything.fdf").isEmpty());
    }
}
