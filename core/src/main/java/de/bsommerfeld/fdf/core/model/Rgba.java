package de.bsommerfeld.fdf.core.model;

import java.util.List;
import java.util.Optional;

/**
 * Color with 0.0–1.0 channels, as written in FDF color properties
 * ({@code FontColor 1.0 0.8 0.0 1.0}).
 */
public record Rgba(double r, double g, double b, double a) {

    public static final Rgba WHITE = new Rgba(1.0, 1.0, 1.0, 1.0);

    /** Builds a color from three or four channel values; alpha defaults to 1.0. */
    public static Optional<Rgba> fromChannels(List<Double> channels) {
        if (channels.size() < 3)
            return Optional.empty();
        double alpha = channels.size() >= 4 ? channels.get(3) : 1.0;
        return Optional.of(new Rgba(channels.get(0), channels.get(1), channels.get(2), alpha));
    }

    public List<Double> channels() {
        return List.of(r, g, b, a);
    }

    /**
     * CSS-style hex form {@code #rrggbb}, with an alpha byte appended only when
     * the color is translucent.
     */
    public String toHex() {
        String hex = "#" + toHexByte(r) + toHexByte(g) + toHexByte(b);
        return a < 1.0 ? hex + toHexByte(a) : hex;
    }

    private static String toHexByte(double channel) {
        long value = Math.round(Math.max(0.0, Math.min(1.0, channel)) * 255);
        return String.format("%02x", value);
    }
}
