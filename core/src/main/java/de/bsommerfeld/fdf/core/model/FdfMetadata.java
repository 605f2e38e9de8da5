package de.bsommerfeld.fdf.core.model;

import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import de.bsommerfeld.fdf.core.ast.FdfValue;

/**
 * Source details of a frame that have no typed field but are needed to write
 * the frame back as FDF.
 *
 * @param declaredType  type keyword exactly as written (e.g. {@code "GLUETEXTBUTTON"}),
 *                      {@code null} for synthesized frames
 * @param inherits      template name from {@code INHERITS}, {@code null} if none
 * @param withChildren  whether the template was inherited {@code WITHCHILDREN}
 * @param setAllPoints  whether the frame declared {@code SetAllPoints}; its first
 *                      two anchors are the ones it produced
 * @param defaultAnchor whether the frame declared no anchor and its only anchor
 *                      is the {@code CENTER} on its parent added in its place
 * @param properties    unmodeled properties in source order, by original name,
 *                      repeated names kept
 */
public record FdfMetadata(
        String declaredType,
        String inherits,
        boolean withChildren,
        boolean setAllPoints,
        boolean defaultAnchor,
        ImmutableListMultimap<String, FdfValue> properties) {

    public static final FdfMetadata EMPTY = new FdfMetadata(null, null, false, false, false,
            ImmutableListMultimap.of());

    public FdfMetadata {
        properties = properties == null ? ImmutableListMultimap.of() : properties;
    }

    public FdfMetadata(String declaredType, String inherits, boolean withChildren, boolean setAllPoints,
                       boolean defaultAnchor, ListMultimap<String, FdfValue> properties) {
        this(declaredType, inherits, withChildren, setAllPoints, defaultAnchor,
                properties == null ? null : ImmutableListMultimap.copyOf(properties));
    }

    public FdfMetadata withInherits(String inherits, boolean withChildren) {
        return new FdfMetadata(declaredType, inherits, withChildren, setAllPoints, defaultAnchor, properties);
    }
}
