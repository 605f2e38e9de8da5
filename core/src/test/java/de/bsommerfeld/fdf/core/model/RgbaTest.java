package de.bsommerfeld.fdf.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RgbaTest {

    @Test
    void fromChannels_shouldDefaultAlphaToOpaque() {
        Rgba color = Rgba.fromChannels(List.of(1.0, 0.8, 0.0)).orElseThrow();
        assertEquals(new Rgba(1.0, 0.8, 0.0, 1.0), color);
    }

    @Test
    void fromChannels_shouldRejectTooFewChannels() {
        assertTrue(Rgba.fromChannels(List.of(1.0, 1.0)).isEmpty());
    }

    @Test
    void toHex_shouldOmitAlphaWhenOpaque() {
        assertEquals("#ffcc00", new Rgba(1.0, 0.8, 0.0, 1.0).toHex());
        assertEquals("#ffffff", Rgba.WHITE.toHex());
    }

    @Test
    void toHex_shouldAppendAlphaWhenTranslucent() {
        assertEquals("#00000080", new Rgba(0.0, 0.0, 0.0, 0.5).toHex());
    }

    @Test
    void toHex_shouldClampOutOfRangeChannels() {
        assertEquals("#ff0000", new Rgba(1.5, -0.2, 0.0, 1.0).toHex());
    }
}
