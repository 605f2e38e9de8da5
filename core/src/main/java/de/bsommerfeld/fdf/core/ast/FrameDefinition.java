package de.bsommerfeld.fdf.core.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Top-level {@code Frame "TYPE" "Name" [INHERITS [WITHCHILDREN] "Template"] { ... }}.
 */
public record FrameDefinition(
        String frameType,
        String name,
        String inherits,
        boolean withChildren,
        List<BlockItem> items,
        int line) implements Statement, FrameBlock {

    public FrameDefinition {
        items = ImmutableList.copyOf(items);
    }
}
