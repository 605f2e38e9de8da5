package de.bsommerfeld.fdf.layout;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import de.bsommerfeld.fdf.core.ast.FdfValue;
import de.bsommerfeld.fdf.core.model.Anchor;
import de.bsommerfeld.fdf.core.model.FdfMetadata;
import de.bsommerfeld.fdf.core.model.Frame;
import de.bsommerfeld.fdf.core.model.FrameStyle;
import de.bsommerfeld.fdf.core.model.FrameType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mutable frame under construction. Only the transformer writes drafts; callers
 * only ever see the {@link Frame} built from a finished draft.
 */
final class FrameDraft {

    final String id;
    final String name;
    FrameType type;
    String declaredType;
    final int line;

    double width;
    double height;
    boolean widthSet;
    boolean heightSet;

    String parentId;
    final List<String> children = new ArrayList<>();
    final List<Anchor> anchors = new ArrayList<>();

    FrameStyle.Builder style = FrameStyle.builder();
    final ListMultimap<String, FdfValue> properties = LinkedListMultimap.create();
    private final Set<String> inheritedProperties = new HashSet<>();

    String inherits;
    boolean withChildren;
    boolean setAllPoints;
    boolean defaultAnchor;

    FrameDraft(String id, String name, FrameType type, String declaredType, int line) {
        this.id = id;
        this.name = name;
        this.type = type;
        this.declaredType = declaredType;
        this.line = line;
    }

    /**
     * Copies type, size and presentation fields of a template over this
     * frame's own. Whether the size counts as authored is copied along, so a
     * template that never set one still gets the fallback size.
     */
    void inheritFrom(Template template) {
        type = template.type();
        declaredType = template.declaredType();
        width = template.width();
        height = template.height();
        widthSet = template.widthSet();
        heightSet = template.heightSet();
        style = template.style().toBuilder();
        properties.putAll(template.properties());
        inheritedProperties.addAll(template.properties().keySet());
    }

    /** Adds an unmodeled property; the frame's own values replace inherited ones of that name. */
    void putProperty(String propertyName, FdfValue value) {
        if (inheritedProperties.remove(propertyName))
            properties.removeAll(propertyName);
        properties.put(propertyName, value);
    }

    boolean sizeAuthored() {
        return widthSet || heightSet;
    }

    Frame toFrame(Bounds bounds, int z) {
        FdfMetadata metadata = new FdfMetadata(declaredType, inherits, withChildren, setAllPoints, defaultAnchor,
                properties);
        return new Frame(id, name, type, bounds.x(), bounds.y(), bounds.width(), bounds.height(), z,
                parentId, children, anchors, style.build(), metadata);
    }

    @Override
    public String toString() {
        return id + " \"" + name + "\"";
    }
}
