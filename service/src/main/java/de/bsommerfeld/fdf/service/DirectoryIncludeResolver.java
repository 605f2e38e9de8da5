package de.bsommerfeld.fdf.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Resolves include paths against a base directory, for example an extracted
 * game data folder. Backslashes in the written path are treated as directory
 * separators. A path the file system cannot represent or a file that cannot
 * be read fails with {@link IncludeResolutionException}.
 */
public class DirectoryIncludeResolver implements IncludeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(DirectoryIncludeResolver.class);

    private final Path baseDirectory;

    public DirectoryIncludeResolver(Path baseDirectory) {
        this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
    }

    @Override
    public Optional<String> resolve(String path) {
        Path file;
        try {
            file = baseDirectory.resolve(path.replace('\\', '/')).normalize();
        } catch (InvalidPathException e) {
            throw new IncludeResolutionException("Invalid include path '" + path + "'", e);
        }
        if (!file.startsWith(baseDirectory)) {
            LOG.warn("Include path '{}' points outside of {}", path, baseDirectory);
            return Optional.empty();
        }
        if (!Files.isRegularFile(file)) {
            LOG.debug("Include file {} does not exist", file);
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IncludeResolutionException("Failed to read include file " + file, e);
        }
    }

    public Path getBaseDirectory() {
        return baseDirectory;
    }
}
