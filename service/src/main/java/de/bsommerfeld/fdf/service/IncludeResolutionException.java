package de.bsommerfeld.fdf.service;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Thrown when a chain of {@code IncludeFile} directives includes a file that is
 * already being included, or when an include file exists but cannot be read.
 */
public class IncludeResolutionException extends RuntimeException {

    private final List<String> chain;

    /**
     * @param chain include paths from the outermost include to the repeated one
     */
    public IncludeResolutionException(List<String> chain) {
        super("Include cycle: " + String.join(" -> ", chain));
        this.chain = ImmutableList.copyOf(chain);
    }

    public IncludeResolutionException(String message, Throwable cause) {
        super(message, cause);
        this.chain = ImmutableList.of();
    }

    /** The include cycle, empty if the failure was not a cycle. */
    public List<String> getChain() {
        return chain;
    }
}
