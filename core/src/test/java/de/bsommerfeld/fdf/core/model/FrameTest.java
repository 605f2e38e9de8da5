package de.bsommerfeld.fdf.core.model;

import com.google.common.collect.LinkedListMultimap;
import com.google.common.collect.ListMultimap;
import de.bsommerfeld.fdf.core.ast.FdfValue;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FrameTest {

    @Test
    void constructor_shouldDefaultMissingStyleAndMetadata() {
        Frame frame = new Frame("frame_1", "Panel", FrameType.FRAME, 0, 0, 0.1, 0.1, 0, null,
                List.of(), List.of(), null, null);

        assertSame(FrameStyle.EMPTY, frame.style());
        assertSame(FdfMetadata.EMPTY, frame.metadata());
        assertTrue(frame.isRoot());
        assertNull(frame.primaryAnchor());
    }

    @Test
    void constructor_shouldCopyLists() {
        List<String> children = new ArrayList<>(List.of("frame_2"));
        Frame frame = new Frame("frame_1", "Panel", FrameType.FRAME, 0, 0, 0.1, 0.1, 0, null,
                children, List.of(Anchor.absolute(FramePoint.CENTER, 0.4, 0.3)), null, null);
        children.add("frame_3");

        assertEquals(List.of("frame_2"), frame.children());
        assertThrows(UnsupportedOperationException.class, () -> frame.children().add("frame_4"));
        assertEquals(FramePoint.CENTER, frame.primaryAnchor().point());
    }

    @Test
    void constructor_shouldRequireIdAndType() {
        assertThrows(NullPointerException.class, () -> new Frame(null, "Panel", FrameType.FRAME, 0, 0, 0, 0, 0,
                null, List.of(), List.of(), null, null));
        assertThrows(NullPointerException.class, () -> new Frame("frame_1", "Panel", null, 0, 0, 0, 0, 0,
                null, List.of(), List.of(), null, null));
    }

    // -- anchors --

    @Test
    void anchor_toParentShouldPinSamePoint() {
        Anchor anchor = Anchor.toParent(FramePoint.TOPLEFT);

        assertTrue(anchor.isRelative());
        assertTrue(anchor.targetsParent());
        assertEquals(FramePoint.TOPLEFT, anchor.effectiveRelativePoint());
    }

    @Test
    void anchor_withPositionShouldBecomeAbsolute() {
        Anchor anchor = Anchor.relative(FramePoint.LEFT, "frame_2", FramePoint.RIGHT, 0.01, 0)
                .withPosition(0.3, 0.2);

        assertFalse(anchor.isRelative());
        assertNull(anchor.relativePoint());
        assertEquals(FramePoint.LEFT, anchor.effectiveRelativePoint());
        assertEquals(0.3, anchor.x());
    }

    @Test
    void anchor_asExternalShouldDifferFromResolvedAnchor() {
        Anchor resolved = Anchor.relative(FramePoint.TOP, "frame_1", FramePoint.TOP, 0, 0);
        Anchor external = resolved.asExternal();

        assertTrue(external.external());
        assertFalse(resolved.external());
        assertEquals("frame_1", external.relativeTo());
        assertNotEquals(resolved, external);
    }

    @Test
    void metadata_shouldKeepRepeatedProperties() {
        ListMultimap<String, FdfValue> properties = LinkedListMultimap.create();
        properties.put("MenuItem", new FdfValue.StringLiteral("Easy"));
        properties.put("MenuItem", new FdfValue.StringLiteral("Hard"));

        FdfMetadata metadata = new FdfMetadata("POPUPMENU", null, false, false, false, properties);
        properties.clear();

        assertEquals(2, metadata.properties().get("MenuItem").size());
    }

    // -- style --

    @Test
    void style_toBuilderShouldKeepFields() {
        FrameStyle style = FrameStyle.builder()
                .texture("UI\\bg.blp")
                .cornerFlags(BackdropCornerFlag.parse("UL|UR"))
                .fontColor(Rgba.WHITE)
                .build();

        FrameStyle copy = style.toBuilder().text("Hello").build();

        assertEquals("UI\\bg.blp", copy.texture());
        assertEquals(style.cornerFlags(), copy.cornerFlags());
        assertEquals(Rgba.WHITE, copy.fontColor());
        assertEquals("Hello", copy.text());
        assertNull(style.text());
    }

    @Test
    void style_shouldNormalizeMissingCollections() {
        assertTrue(FrameStyle.EMPTY.cornerFlags().isEmpty());
        assertTrue(FrameStyle.EMPTY.backgroundInsets().isEmpty());
        assertTrue(FrameStyle.EMPTY.texCoord().isEmpty());
    }
}
