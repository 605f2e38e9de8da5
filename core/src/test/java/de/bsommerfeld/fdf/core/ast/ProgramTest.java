package de.bsommerfeld.fdf.core.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProgramTest {

    private static FrameDefinition frame(String name, List<BlockItem> items) {
        return new FrameDefinition("FRAME", name, null, false, items, 1);
    }

    @Test
    void frames_shouldSkipIncludes() {
        Program program = new Program(List.of(
                new Include("UI\\FrameDef\\UI\\EscMenuTemplates.fdf", 1),
                frame("A", List.of()),
                frame("B", List.of())));

        assertEquals(List.of("A", "B"), program.frames().stream().map(FrameDefinition::name).toList());
        assertEquals(1, program.includes().size());
        assertEquals("UI\\FrameDef\\UI\\EscMenuTemplates.fdf", program.includes().get(0).path());
    }

    @Test
    void property_shouldReturnLastOccurrenceCaseInsensitively() {
        FrameDefinition definition = frame("A", List.of(
                new Property("Width", new FdfValue.NumberLiteral(0.1), 2),
                new Property("WIDTH", new FdfValue.NumberLiteral(0.2), 3)));

        Property width = definition.property("width").orElseThrow();
        assertEquals(0.2, width.value().number().orElseThrow());
        assertEquals(3, width.line());
    }

    @Test
    void nestedFrames_shouldKeepBodyOrder() {
        NestedFrame texture = new NestedFrame("Texture", null, null, false, List.of(), 3);
        NestedFrame child = new NestedFrame("TEXT", "Label", null, false, List.of(), 4);
        FrameDefinition definition = frame("A", List.of(texture,
                new Property("Width", new FdfValue.NumberLiteral(0.1), 5), child));

        assertEquals(List.of(texture, child), definition.nestedFrames());
        assertTrue(texture.isTextureBlock());
        assertFalse(child.isTextureBlock());
        assertTrue(NestedFrame.isReservedBlock("string"));
        assertFalse(NestedFrame.isReservedBlock("Frame"));
    }

    // -- values --

    @Test
    void numberLiteral_textShouldBePlainDecimal() {
        assertEquals("0.5", new FdfValue.NumberLiteral(0.5).text());
        assertEquals("-0.25", new FdfValue.NumberLiteral(-0.25).text());
        assertEquals("1", new FdfValue.NumberLiteral(1.0).text());
    }

    @Test
    void arrayValue_shouldExposeElements() {
        FdfValue array = new FdfValue.ArrayValue(List.of(
                new FdfValue.NumberLiteral(1.0), new FdfValue.Identifier("TOPLEFT")));

        assertEquals(2, array.elements().size());
        assertTrue(array.number().isEmpty());
        assertEquals(List.of(FdfValue.FLAG), FdfValue.FLAG.elements());
    }
}
