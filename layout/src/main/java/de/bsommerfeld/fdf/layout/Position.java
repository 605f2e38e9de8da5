package de.bsommerfeld.fdf.layout;

/** An absolute canvas coordinate. */
public record Position(double x, double y) {

    public Position offset(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
