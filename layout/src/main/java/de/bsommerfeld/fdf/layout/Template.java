package de.bsommerfeld.fdf.layout;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;
import de.bsommerfeld.fdf.core.ast.FdfValue;
import de.bsommerfeld.fdf.core.ast.NestedFrame;
import de.bsommerfeld.fdf.core.model.FrameStyle;
import de.bsommerfeld.fdf.core.model.FrameType;

import java.util.List;

/**
 * Snapshot of a frame registered for {@code INHERITS}, taken when the frame's
 * own properties have been applied.
 *
 * @param name         template name
 * @param type         resolved frame type
 * @param declaredType type keyword as written
 * @param width        width at registration
 * @param height       height at registration
 * @param widthSet     whether the width was authored (directly or through its own template)
 * @param heightSet    whether the height was authored
 * @param style        presentation fields
 * @param properties   unmodeled properties
 * @param children     nested child frame definitions, instantiated by {@code INHERITS WITHCHILDREN}
 */
public record Template(
        String name,
        FrameType type,
        String declaredType,
        double width,
        double height,
        boolean widthSet,
        boolean heightSet,
        FrameStyle style,
        ListMultimap<String, FdfValue> properties,
        List<NestedFrame> children) {

    public Template {
        properties = ImmutableListMultimap.copyOf(properties);
        children = ImmutableList.copyOf(children);
    }

    static Template of(FrameDraft draft, List<NestedFrame> children) {
        return new Template(draft.name, draft.type, draft.declaredType, draft.width, draft.height,
                draft.widthSet, draft.heightSet, draft.style.build(), draft.properties, children);
    }
}
