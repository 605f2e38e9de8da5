package de.bsommerfeld.fdf.core.ast;

/**
 * {@code IncludeFile "path"} directive. The path is kept verbatim, including
 * Windows-style backslashes.
 *
 * @param path included file path as written
 * @param line source line of the directive
 */
public record Include(String path, int line) implements Statement {
}
