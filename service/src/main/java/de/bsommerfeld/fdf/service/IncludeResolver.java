package de.bsommerfeld.fdf.service;

import java.util.Optional;

/**
 * Supplies the text of files named by {@code IncludeFile} directives. The
 * parsing and layout components never read files themselves.
 */
@FunctionalInterface
public interface IncludeResolver {

    /**
     * @param path include path exactly as written in the document
     * @return the FDF text of the file, or empty if it is not available
     * @throws IncludeResolutionException if the file is there but cannot be read
     */
    Optional<String> resolve(String path);

    /** A resolver that knows no files. */
    static IncludeResolver none() {
        return path -> Optional.empty();
    }
}
