package de.bsommerfeld.fdf.layout;

import de.bsommerfeld.fdf.core.config.LayoutConfig;
import de.bsommerfeld.fdf.core.model.Anchor;
import de.bsommerfeld.fdf.core.model.FramePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Computes absolute bounds for every frame from its anchors.
 *
 * <h3>Order</h3>
 * A frame's bounds are solved in two steps: first its size (explicit, or
 * derived from an opposing anchor pair), then its position from the primary
 * anchor. Both steps read the bounds of the referenced frames, which are
 * solved first, recursively, and memoized. The result therefore does not
 * depend on declaration order.
 *
 * <h3>Cycles</h3>
 * The frames currently being solved are tracked in order. Reaching one of them
 * again means the anchor references form a cycle, which is reported as a
 * {@link LayoutCycleException} carrying the cycle's frame names.
 *
 * <p>
 * Anchor targets that are not frames of this document (engine frames such as
 * {@code "UIParent"}) resolve against the canvas.
 */
final class LayoutSolver {

    private static final Logger LOG = LoggerFactory.getLogger(LayoutSolver.class);

    private final FrameIndex index;
    private final Bounds canvas;
    private final Map<String, Bounds> solved = new HashMap<>();
    private final LinkedHashSet<FrameDraft> inProgress = new LinkedHashSet<>();

    LayoutSolver(FrameIndex index, LayoutConfig config) {
        this.index = index;
        this.canvas = Bounds.canvas(config);
    }

    Bounds solve(FrameDraft draft) {
        Bounds known = solved.get(draft.id);
        if (known != null)
            return known;
        if (inProgress.contains(draft))
            throw new LayoutCycleException(cycleEndingAt(draft));

        inProgress.add(draft);
        double[] size = resolveSize(draft);
        Bounds bounds = resolvePosition(draft, size[0], size[1]);
        inProgress.remove(draft);

        solved.put(draft.id, bounds);
        LOG.trace("Solved {} -> {}", draft, bounds);
        return bounds;
    }

    /**
     * Width and height, overridden by the distance between two opposing anchors
     * on the same target: TOPLEFT/BOTTOMRIGHT or TOPRIGHT/BOTTOMLEFT for both,
     * TOPLEFT/TOPRIGHT for the width, TOPLEFT/BOTTOMLEFT for the height.
     */
    private double[] resolveSize(FrameDraft draft) {
        double width = draft.width;
        double height = draft.height;

        Anchor topLeft = find(draft, FramePoint.TOPLEFT);
        Anchor topRight = find(draft, FramePoint.TOPRIGHT);
        Anchor bottomLeft = find(draft, FramePoint.BOTTOMLEFT);
        Anchor bottomRight = find(draft, FramePoint.BOTTOMRIGHT);

        if (sameTarget(topLeft, bottomRight)) {
            Position tl = anchorPosition(topLeft);
            Position br = anchorPosition(bottomRight);
            width = Math.abs(br.x() - tl.x());
            height = Math.abs(tl.y() - br.y());
        } else if (sameTarget(topRight, bottomLeft)) {
            Position tr = anchorPosition(topRight);
            Position bl = anchorPosition(bottomLeft);
            width = Math.abs(tr.x() - bl.x());
            height = Math.abs(tr.y() - bl.y());
        } else {
            if (sameTarget(topLeft, topRight))
                width = Math.abs(anchorPosition(topRight).x() - anchorPosition(topLeft).x());
            if (sameTarget(topLeft, bottomLeft))
                height = Math.abs(anchorPosition(topLeft).y() - anchorPosition(bottomLeft).y());
        }
        return new double[]{width, height};
    }

    private Bounds resolvePosition(FrameDraft draft, double width, double height) {
        if (draft.anchors.isEmpty())
            return new Bounds(0.0, 0.0, width, height);
        Anchor primary = draft.anchors.get(0);
        return Bounds.placed(primary.point(), anchorPosition(primary), width, height);
    }

    /** Absolute canvas position an anchor pins its point to. */
    Position anchorPosition(Anchor anchor) {
        if (!anchor.isRelative())
            return new Position(anchor.x(), anchor.y());

        Bounds target = anchor.external()
                ? canvas
                : index.byId(anchor.relativeTo()).map(this::solve).orElse(canvas);
        Position position = target.pointAt(anchor.effectiveRelativePoint()).offset(anchor.x(), anchor.y());
        LOG.trace("Anchor {} -> {} {} resolves to {}", anchor.point(), anchor.relativeTo(),
                anchor.effectiveRelativePoint(), position);
        return position;
    }

    private static Anchor find(FrameDraft draft, FramePoint point) {
        for (Anchor anchor : draft.anchors) {
            if (anchor.point() == point)
                return anchor;
        }
        return null;
    }

    private static boolean sameTarget(Anchor first, Anchor second) {
        return first != null && second != null && first.external() == second.external()
                && Objects.equals(first.relativeTo(), second.relativeTo());
    }

    private List<String> cycleEndingAt(FrameDraft repeated) {
        List<String> names = new ArrayList<>();
        boolean inCycle = false;
        for (FrameDraft draft : inProgress) {
            if (draft == repeated)
                inCycle = true;
            if (inCycle)
                names.add(draft.name);
        }
        names.add(repeated.name);
        return names;
    }
}
