package de.bsommerfeld.fdf.core.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Root of a parsed FDF document: top-level items in source order.
 */
public record Program(List<Statement> statements) {

    public Program {
        statements = ImmutableList.copyOf(statements);
    }

    public List<FrameDefinition> frames() {
        return statements.stream()
                .filter(FrameDefinition.class::isInstance)
                .map(FrameDefinition.class::cast)
                .toList();
    }

    public List<Include> includes() {
        return statements.stream()
                .filter(Include.class::isInstance)
                .map(Include.class::cast)
                .toList();
    }
}
