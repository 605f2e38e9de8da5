package de.bsommerfeld.fdf.layout;

import com.google.common.collect.ImmutableList;
import de.bsommerfeld.fdf.core.ast.BlockItem;
import de.bsommerfeld.fdf.core.ast.FrameBlock;
import de.bsommerfeld.fdf.core.ast.FrameDefinition;
import de.bsommerfeld.fdf.core.ast.NestedFrame;
import de.bsommerfeld.fdf.core.ast.Program;
import de.bsommerfeld.fdf.core.ast.Property;
import de.bsommerfeld.fdf.core.config.LayoutConfig;
import de.bsommerfeld.fdf.core.model.Anchor;
import de.bsommerfeld.fdf.core.model.Frame;
import de.bsommerfeld.fdf.core.model.FramePoint;
import de.bsommerfeld.fdf.core.model.FrameType;
import de.bsommerfeld.fdf.layout.TransformWarning.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Turns a parsed FDF {@link Program} into resolved {@link Frame}s.
 *
 * <h3>Passes</h3>
 * <ol>
 * <li>Build a draft per frame definition in document order: map the type,
 * apply the default size, copy the {@code INHERITS} template (type, size and
 * presentation) if one was registered earlier, then apply the frame's own
 * properties. Top-level frames
 * are registered as templates once built.</li>
 * <li>Flatten nested frame definitions into the same list, linked to their
 * container through {@code parentId}/{@code children}.</li>
 * <li>Give every frame without anchors a {@code CENTER} anchor on its parent;
 * such a frame still at the generic default size grows to the fallback size.</li>
 * <li>Resolve anchor targets: the parent placeholder becomes the parent's id
 * (or, for roots, an absolute canvas point), names become ids. Names matching
 * no frame stay as they are and are marked external.</li>
 * <li>Size frames from opposing anchors and position them from their primary
 * anchor ({@link LayoutSolver}).</li>
 * </ol>
 *
 * <p>
 * Templates only resolve backwards: {@code INHERITS} naming a frame declared
 * later in the document inherits nothing and is reported as a warning.
 *
 * <p>
 * An instance keeps the warnings and templates of its last {@link #transform}
 * call and must not be shared between threads.
 */
public final class FdfTransformer {

    private static final Logger LOG = LoggerFactory.getLogger(FdfTransformer.class);

    private final LayoutConfig config;
    private final TemplateRegistry seed;
    private final PropertyApplier applier;

    private final List<TransformWarning> warnings = new ArrayList<>();
    private final Deque<String> expanding = new ArrayDeque<>();
    private TemplateRegistry templates;
    private List<FrameDraft> drafts;

    public FdfTransformer() {
        this(new LayoutConfig());
    }

    public FdfTransformer(LayoutConfig config) {
        this(config, new TemplateRegistry());
    }

    /**
     * @param config layout defaults
     * @param seed   templates available before the first frame of each document,
     *               for example those of included files
     */
    public FdfTransformer(LayoutConfig config, TemplateRegistry seed) {
        this.config = config;
        this.seed = TemplateRegistry.copyOf(seed);
        this.applier = new PropertyApplier(this::warn);
        this.templates = TemplateRegistry.copyOf(seed);
    }

    /**
     * Resolves all frames of {@code program}, nested ones included, in document
     * (pre-order) order.
     *
     * @throws LayoutCycleException if anchor references form a cycle
     */
    public ImmutableList<Frame> transform(Program program) {
        warnings.clear();
        expanding.clear();
        templates = TemplateRegistry.copyOf(seed);
        drafts = new ArrayList<>();

        for (FrameDefinition definition : program.frames()) {
            FrameDraft draft = buildDraft(definition, null);
            List<NestedFrame> childDefinitions = collectChildren(draft, definition);
            templates.register(Template.of(draft, childDefinitions));
        }
        LOG.debug("Built {} frames, {} templates registered", drafts.size(), templates.size());

        injectDefaultAnchors();

        FrameIndex index = new FrameIndex(drafts);
        resolveTargets(index);

        LayoutSolver solver = new LayoutSolver(index, config);
        ImmutableList.Builder<Frame> frames = ImmutableList.builder();
        for (int z = 0; z < drafts.size(); z++) {
            FrameDraft draft = drafts.get(z);
            frames.add(draft.toFrame(solver.solve(draft), z));
        }
        LOG.debug("Resolved layout of {} frames with {} warnings", drafts.size(), warnings.size());
        return frames.build();
    }

    /** Warnings of the last {@link #transform} call. */
    public ImmutableList<TransformWarning> warnings() {
        return ImmutableList.copyOf(warnings);
    }

    /** Templates registered by the last {@link #transform} call, seeded ones included. */
    public TemplateRegistry templates() {
        return TemplateRegistry.copyOf(templates);
    }

    // -- pass 1: drafts --

    private FrameDraft buildDraft(FrameBlock block, FrameDraft parent) {
        FrameType type = FrameType.fromFdf(block.frameType()).orElseGet(() -> {
            warn(Kind.UNKNOWN_FRAME_TYPE, block.name(),
                    "Unknown frame type '" + block.frameType() + "' at line " + block.line() + ", using FRAME");
            return FrameType.FRAME;
        });

        FrameDraft draft = new FrameDraft("frame_" + (drafts.size() + 1), block.name(), type, block.frameType(),
                block.line());
        draft.width = config.getDefaultWidth();
        draft.height = type.isTextLike() ? config.getTextDefaultHeight() : config.getDefaultHeight();
        draft.inherits = block.inherits();
        draft.withChildren = block.withChildren();
        drafts.add(draft);

        if (parent != null) {
            draft.parentId = parent.id;
            parent.children.add(draft.id);
        }

        template(draft).ifPresent(draft::inheritFrom);
        applyProperties(draft, block.items());
        return draft;
    }

    private Optional<Template> template(FrameDraft draft) {
        if (draft.inherits == null || !config.isResolveInheritance())
            return Optional.empty();
        Optional<Template> template = templates.find(draft.inherits);
        if (template.isEmpty())
            warn(Kind.MISSING_TEMPLATE, draft.name, "Template '" + draft.inherits + "' is not defined before line "
                    + draft.line + ", nothing inherited");
        return template;
    }

    /** Properties of the frame and of its {@code Texture}/{@code String} blocks. */
    private void applyProperties(FrameDraft draft, List<BlockItem> items) {
        for (BlockItem item : items) {
            if (item instanceof Property property) {
                applier.apply(draft, property);
            } else if (item instanceof NestedFrame nested && !nested.isChildFrame()) {
                applyProperties(draft, nested.items());
            }
        }
    }

    // -- pass 2: nested frames --

    /**
     * Builds the child frames of {@code draft}, depth-first, and returns the
     * child definitions it would pass on as a template.
     */
    private List<NestedFrame> collectChildren(FrameDraft draft, FrameBlock block) {
        List<NestedFrame> definitions = new ArrayList<>();
        boolean expands = false;
        if (draft.withChildren && config.isResolveInheritance()) {
            Optional<Template> template = templates.find(draft.inherits);
            if (template.isPresent() && expanding.contains(draft.inherits)) {
                warn(Kind.RECURSIVE_TEMPLATE, draft.name, "Template '" + draft.inherits
                        + "' is already being expanded, its children are not repeated");
            } else if (template.isPresent()) {
                definitions.addAll(template.get().children());
                expanding.push(draft.inherits);
                expands = true;
            }
        }
        collectChildFrames(block.items(), definitions);

        try {
            for (NestedFrame definition : definitions) {
                FrameDraft child = buildDraft(definition, draft);
                collectChildren(child, definition);
            }
        } finally {
            if (expands)
                expanding.pop();
        }
        return definitions;
    }

    private static void collectChildFrames(List<BlockItem> items, List<NestedFrame> into) {
        for (BlockItem item : items) {
            if (item instanceof NestedFrame nested) {
                if (nested.isChildFrame())
                    into.add(nested);
                else
                    collectChildFrames(nested.items(), into);
            }
        }
    }

    // -- pass 3: default anchors --

    private void injectDefaultAnchors() {
        int injected = 0;
        for (FrameDraft draft : drafts) {
            if (!draft.anchors.isEmpty())
                continue;
            draft.anchors.add(Anchor.toParent(FramePoint.CENTER));
            draft.defaultAnchor = true;
            if (!draft.sizeAuthored() && !draft.type.isTextLike()) {
                draft.width = config.getFallbackSize();
                draft.height = config.getFallbackSize();
            }
            injected++;
        }
        LOG.debug("Injected default CENTER anchor into {} frames", injected);
    }

    // -- pass 4: anchor targets --

    private void resolveTargets(FrameIndex index) {
        Bounds canvas = Bounds.canvas(config);
        for (FrameDraft draft : drafts) {
            for (int i = 0; i < draft.anchors.size(); i++) {
                Anchor anchor = draft.anchors.get(i);
                if (!anchor.isRelative())
                    continue;
                draft.anchors.set(i, resolveTarget(draft, anchor, index, canvas));
            }
        }
    }

    private Anchor resolveTarget(FrameDraft draft, Anchor anchor, FrameIndex index, Bounds canvas) {
        if (anchor.targetsParent()) {
            if (draft.parentId != null)
                return anchor.withRelativeTo(draft.parentId);
            Position point = canvas.pointAt(anchor.effectiveRelativePoint()).offset(anchor.x(), anchor.y());
            return anchor.withPosition(point.x(), point.y());
        }

        Optional<FrameDraft> target = index.resolveName(anchor.relativeTo(), draft);
        if (target.isPresent())
            return anchor.withRelativeTo(target.get().id);

        warn(Kind.UNRESOLVED_REFERENCE, draft.name,
                "Anchor target '" + anchor.relativeTo() + "' is not a frame of this document, using the canvas");
        return anchor.asExternal();
    }

    private void warn(Kind kind, String frameName, String message) {
        warn(new TransformWarning(kind, frameName, message));
    }

    private void warn(TransformWarning warning) {
        LOG.warn("{}", warning);
        warnings.add(warning);
    }
}
