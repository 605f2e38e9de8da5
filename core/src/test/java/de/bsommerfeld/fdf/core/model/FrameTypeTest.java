package de.bsommerfeld.fdf.core.model;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FrameTypeTest {

    @Test
    void fromFdf_shouldMapCanonicalKeywords() {
        assertEquals(Optional.of(FrameType.BACKDROP), FrameType.fromFdf("BACKDROP"));
        assertEquals(Optional.of(FrameType.TEXT_FRAME), FrameType.fromFdf("TEXT"));
        assertEquals(Optional.of(FrameType.GLUETEXTBUTTON), FrameType.fromFdf("GLUETEXTBUTTON"));
        assertEquals(Optional.of(FrameType.FRAME), FrameType.fromFdf("FRAME"));
    }

    @Test
    void fromFdf_shouldIgnoreCaseAndWhitespace() {
        assertEquals(Optional.of(FrameType.SPRITE), FrameType.fromFdf("sprite"));
        assertEquals(Optional.of(FrameType.EDITBOX), FrameType.fromFdf(" EditBox "));
    }

    @Test
    void fromFdf_shouldMapAliases() {
        assertEquals(Optional.of(FrameType.TEXT_FRAME), FrameType.fromFdf("TEXTBUTTON"));
        assertEquals(Optional.of(FrameType.CHECKBOX), FrameType.fromFdf("GLUECHECKBOX"));
        assertEquals(Optional.of(FrameType.CHECKBOX), FrameType.fromFdf("SIMPLECHECKBOX"));
        assertEquals(Optional.of(FrameType.EDITBOX), FrameType.fromFdf("GLUEEDITBOX"));
        assertEquals(Optional.of(FrameType.EDITBOX), FrameType.fromFdf("SLASHCHATBOX"));
        assertEquals(Optional.of(FrameType.POPUPMENU), FrameType.fromFdf("GLUEPOPUPMENU"));
        assertEquals(Optional.of(FrameType.TEXTAREA), FrameType.fromFdf("CHATDISPLAY"));
    }

    @Test
    void fromFdf_shouldRejectUnknownKeywords() {
        assertTrue(FrameType.fromFdf("HOLOGRAM").isEmpty());
        assertTrue(FrameType.fromFdf(null).isEmpty());
    }

    @Test
    void fromFdf_shouldNeverYieldOrigin() {
        assertNotEquals(Optional.of(FrameType.ORIGIN), FrameType.fromFdf("FRAME"));
    }

    @Test
    void isTextLike_shouldOnlyCoverSingleLineText() {
        assertTrue(FrameType.TEXT_FRAME.isTextLike());
        assertTrue(FrameType.SIMPLEFONTSTRING.isTextLike());
        assertFalse(FrameType.TEXTAREA.isTextLike());
        assertFalse(FrameType.BUTTON.isTextLike());
    }

    @Test
    void fdfName_shouldBeExportKeyword() {
        assertEquals("TEXT", FrameType.TEXT_FRAME.fdfName());
        assertEquals("FRAME", FrameType.ORIGIN.fdfName());
        assertEquals("BROWSER_BUTTON", FrameType.BROWSER_BUTTON.fdfName());
    }
}
