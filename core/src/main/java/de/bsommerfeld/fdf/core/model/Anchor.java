package de.bsommerfeld.fdf.core.model;

/**
 * Constraint pinning one of a frame's nine points to a position.
 *
 * <p>
 * Without {@code relativeTo} the anchor is absolute and {@code (x, y)} is a
 * canvas coordinate. With {@code relativeTo} the anchor is pinned to
 * {@code relativePoint} of the referenced frame, shifted by {@code (x, y)}.
 * After transformation {@code relativeTo} holds either the id of a frame in the
 * same result or an opaque name that could not be resolved (for example an
 * engine frame such as {@code "UIParent"}), flagged {@code external} since
 * such a name may look exactly like a frame id.
 *
 * @param point         the point of the owning frame being pinned
 * @param relativeTo    frame id or name, {@code null} for absolute anchors
 * @param relativePoint point on the referenced frame, {@code null} for absolute anchors
 * @param x             horizontal offset (or absolute coordinate)
 * @param y             vertical offset (or absolute coordinate), y grows upwards
 * @param external      whether {@code relativeTo} names a frame outside the result
 */
public record Anchor(FramePoint point, String relativeTo, FramePoint relativePoint, double x, double y,
                     boolean external) {

    /**
     * Placeholder target meaning "the lexical parent of the owning frame".
     * Only exists while a transform is running; resolved frames never carry it.
     */
    public static final String PARENT = "<parent>";

    public static Anchor absolute(FramePoint point, double x, double y) {
        return new Anchor(point, null, null, x, y, false);
    }

    public static Anchor relative(FramePoint point, String relativeTo, FramePoint relativePoint, double x, double y) {
        return new Anchor(point, relativeTo, relativePoint, x, y, false);
    }

    /** Anchor pinning {@code point} to the same point of the lexical parent. */
    public static Anchor toParent(FramePoint point) {
        return new Anchor(point, PARENT, point, 0.0, 0.0, false);
    }

    public boolean isRelative() {
        return relativeTo != null;
    }

    public boolean targetsParent() {
        return PARENT.equals(relativeTo);
    }

    /** The point on the referenced frame, falling back to this anchor's own point. */
    public FramePoint effectiveRelativePoint() {
        return relativePoint != null ? relativePoint : point;
    }

    public Anchor withRelativeTo(String target) {
        return new Anchor(point, target, relativePoint, x, y, false);
    }

    public Anchor withPosition(double x, double y) {
        return new Anchor(point, null, null, x, y, false);
    }

    /** This anchor with its target kept as an opaque name outside the result. */
    public Anchor asExternal() {
        return new Anchor(point, relativeTo, relativePoint, x, y, true);
    }
}
