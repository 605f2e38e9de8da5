package de.bsommerfeld.fdf.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BackdropCornerFlagTest {

    @Test
    void parse_shouldKeepOrderOfAppearance() {
        Set<BackdropCornerFlag> flags = BackdropCornerFlag.parse("UL|UR|BL|BR|T|L|B|R");

        assertEquals(List.of(BackdropCornerFlag.values()), List.copyOf(flags));
    }

    @Test
    void parse_shouldIgnoreUnknownAndEmptySegments() {
        Set<BackdropCornerFlag> flags = BackdropCornerFlag.parse("ul||X| br");

        assertEquals(List.of(BackdropCornerFlag.UL, BackdropCornerFlag.BR), List.copyOf(flags));
    }

    @Test
    void parse_shouldReturnEmptySetForNull() {
        assertTrue(BackdropCornerFlag.parse(null).isEmpty());
    }

    @Test
    void join_shouldWritePipeDelimited() {
        assertEquals("T|B", BackdropCornerFlag.join(BackdropCornerFlag.parse("T|B")));
        assertEquals("", BackdropCornerFlag.join(Set.of()));
    }
}
