package de.bsommerfeld.fdf.core.model;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A resolved UI control with absolute geometry.
 *
 * <p>
 * Coordinates are normalized canvas units with the origin at the bottom-left
 * of the 0.8 x 0.6 safe area; {@code (x, y)} is the frame's own bottom-left
 * corner. {@code parentId} and {@code children} describe ownership and are
 * exact inverses across a transform result.
 *
 * @param id       unique id within one transform result
 * @param name     name used for textual cross-references, not necessarily unique
 * @param type     control kind
 * @param x        left edge
 * @param y        bottom edge
 * @param width    width
 * @param height   height
 * @param z        paint order
 * @param parentId owning frame's id, {@code null} for roots
 * @param children ids of owned frames, in declaration order
 * @param anchors  layout constraints, the first one is the primary anchor
 * @param style    presentation fields
 * @param metadata source details for re-export
 */
public record Frame(
        String id,
        String name,
        FrameType type,
        double x,
        double y,
        double width,
        double height,
        int z,
        String parentId,
        List<String> children,
        List<Anchor> anchors,
        FrameStyle style,
        FdfMetadata metadata) {

    public Frame {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        children = ImmutableList.copyOf(children);
        anchors = ImmutableList.copyOf(anchors);
        style = style == null ? FrameStyle.EMPTY : style;
        metadata = metadata == null ? FdfMetadata.EMPTY : metadata;
    }

    public boolean isRoot() {
        return parentId == null;
    }

    /** The anchor that positions this frame, {@code null} only for frames built outside a transform. */
    public Anchor primaryAnchor() {
        return anchors.isEmpty() ? null : anchors.get(0);
    }
}
