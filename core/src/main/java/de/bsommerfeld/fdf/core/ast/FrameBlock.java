package de.bsommerfeld.fdf.core.ast;

import java.util.List;
import java.util.Optional;

/**
 * Shape shared by top-level frame definitions and nested blocks:
 * a type, an optional name, an optional template and an ordered body.
 */
public interface FrameBlock {

    String frameType();

    /** Block name, {@code null} for anonymous blocks such as {@code Texture { ... }}. */
    String name();

    /** Template name from {@code INHERITS}, {@code null} if absent. */
    String inherits();

    /** Whether the template reference was written as {@code INHERITS WITHCHILDREN}. */
    boolean withChildren();

    List<BlockItem> items();

    int line();

    default List<Property> properties() {
        return items().stream()
                .filter(Property.class::isInstance)
                .map(Property.class::cast)
                .toList();
    }

    default List<NestedFrame> nestedFrames() {
        return items().stream()
                .filter(NestedFrame.class::isInstance)
                .map(NestedFrame.class::cast)
                .toList();
    }

    /** Last property with the given name (case-insensitive). */
    default Optional<Property> property(String name) {
        Property found = null;
        for (Property p : properties()) {
            if (p.name().equalsIgnoreCase(name))
                found = p;
        }
        return Optional.ofNullable(found);
    }
}
