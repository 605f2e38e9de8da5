package de.bsommerfeld.fdf.core.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Locale;

/**
 * A block inside a frame body. Either one of the two reserved blocks
 * ({@code Texture { ... }}, {@code String { ... }}) whose properties belong to
 * the containing frame, or a nested {@code Frame "TYPE" "Name" { ... }} that
 * becomes a child frame of its container.
 */
public record NestedFrame(
        String frameType,
        String name,
        String inherits,
        boolean withChildren,
        List<BlockItem> items,
        int line) implements BlockItem, FrameBlock {

    public static final String TEXTURE = "TEXTURE";
    public static final String STRING = "STRING";

    public NestedFrame {
        items = ImmutableList.copyOf(items);
    }

    /** Whether the block type names one of the reserved {@code Texture}/{@code String} blocks. */
    public static boolean isReservedBlock(String type) {
        String upper = type.toUpperCase(Locale.ROOT);
        return TEXTURE.equals(upper) || STRING.equals(upper);
    }

    public boolean isTextureBlock() {
        return TEXTURE.equalsIgnoreCase(frameType);
    }

    public boolean isStringBlock() {
        return STRING.equalsIgnoreCase(frameType);
    }

    /** Whether this block is a real child frame rather than a reserved block. */
    public boolean isChildFrame() {
        return !isReservedBlock(frameType);
    }
}
