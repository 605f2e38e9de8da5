package de.bsommerfeld.fdf.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The nine named points of a frame rectangle.
 *
 * <p>
 * Each point carries its position as a fraction of the frame's width and
 * height, measured from the bottom-left corner (y grows upwards).
 */
public enum FramePoint {

    TOPLEFT(0.0, 1.0),
    TOP(0.5, 1.0),
    TOPRIGHT(1.0, 1.0),
    LEFT(0.0, 0.5),
    CENTER(0.5, 0.5),
    RIGHT(1.0, 0.5),
    BOTTOMLEFT(0.0, 0.0),
    BOTTOM(0.5, 0.0),
    BOTTOMRIGHT(1.0, 0.0);

    private final double fractionX;
    private final double fractionY;

    FramePoint(double fractionX, double fractionY) {
        this.fractionX = fractionX;
        this.fractionY = fractionY;
    }

    public double fractionX() {
        return fractionX;
    }

    public double fractionY() {
        return fractionY;
    }

    /** X coordinate of this point on a rectangle with bottom-left origin. */
    public double xOn(double x, double width) {
        return x + width * fractionX;
    }

    /** Y coordinate of this point on a rectangle with bottom-left origin. */
    public double yOn(double y, double height) {
        return y + height * fractionY;
    }

    /** Looks up a point by its FDF name, case-insensitively. */
    public static Optional<FramePoint> lookup(String name) {
        if (name == null)
            return Optional.empty();
        try {
            return Optional.of(valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
