package de.bsommerfeld.fdf.layout;

import de.bsommerfeld.fdf.core.config.LayoutConfig;
import de.bsommerfeld.fdf.core.model.FramePoint;

/**
 * Axis-aligned rectangle with bottom-left origin.
 */
record Bounds(double x, double y, double width, double height) {

    /** The whole canvas; anchor targets that are not frames resolve against it. */
    static Bounds canvas(LayoutConfig config) {
        return new Bounds(0.0, 0.0, config.getCanvasWidth(), config.getCanvasHeight());
    }

    Position pointAt(FramePoint point) {
        return new Position(point.xOn(x, width), point.yOn(y, height));
    }

    /**
     * Places a rectangle of the given size so that its {@code point} lies on
     * {@code anchor}.
     */
    static Bounds placed(FramePoint point, Position anchor, double width, double height) {
        return new Bounds(anchor.x() - width * point.fractionX(), anchor.y() - height * point.fractionY(),
                width, height);
    }
}
