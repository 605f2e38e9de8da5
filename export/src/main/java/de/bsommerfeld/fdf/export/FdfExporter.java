package de.bsommerfeld.fdf.export;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import de.bsommerfeld.fdf.core.ast.FdfValue;
import de.bsommerfeld.fdf.core.config.ExportConfig;
import de.bsommerfeld.fdf.core.model.Anchor;
import de.bsommerfeld.fdf.core.model.BackdropCornerFlag;
import de.bsommerfeld.fdf.core.model.FdfMetadata;
import de.bsommerfeld.fdf.core.model.FontSpec;
import de.bsommerfeld.fdf.core.model.Frame;
import de.bsommerfeld.fdf.core.model.FramePoint;
import de.bsommerfeld.fdf.core.model.FrameStyle;
import de.bsommerfeld.fdf.core.model.FrameType;
import de.bsommerfeld.fdf.core.model.Rgba;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Writes resolved frames back as FDF text.
 *
 * <h3>Output style</h3>
 * Output is canonical: one {@code Frame} block per root in list order, child
 * frames nested inside their parent, one property per line ending with a
 * comma, a fixed property order. Source formatting and comments are not
 * preserved.
 *
 * <h3>Round trip</h3>
 * The text is written so that parsing and transforming it again yields the
 * same frames: the resolved size is always written, anchor targets are written
 * as frame names, children inherited {@code WITHCHILDREN} are written out and
 * the template is referenced with a plain {@code INHERITS}. Anchors on the
 * parent that the frame never declared itself are left out and come back
 * from the nesting.
 *
 * <p>
 * Export never fails; missing optional fields are omitted.
 */
public final class FdfExporter {

    private static final Logger LOG = LoggerFactory.getLogger(FdfExporter.class);

    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Set<String> KEYWORDS = Set.of("FRAME", "INHERITS", "WITHCHILDREN", "INCLUDEFILE");

    private final ExportConfig config;
    private final NumberFormatting numbers;

    public FdfExporter() {
        this(new ExportConfig());
    }

    public FdfExporter(ExportConfig config) {
        this.config = config;
        this.numbers = new NumberFormatting(config.getDecimalPlaces());
    }

    public String export(List<Frame> frames) {
        return export(frames, List.of());
    }

    /**
     * Writes {@code frames} preceded by {@code IncludeFile} directives for
     * {@code includes}, so templates of included files stay available when the
     * text is read again.
     */
    public String export(List<Frame> frames, List<String> includes) {
        if (frames == null)
            frames = List.of();

        Map<String, Frame> byId = new HashMap<>();
        for (Frame frame : frames)
            byId.put(frame.id(), frame);

        ImmutableListMultimap.Builder<String, Frame> children = ImmutableListMultimap.builder();
        List<Frame> roots = new ArrayList<>();
        for (Frame frame : frames) {
            if (frame.parentId() != null && byId.containsKey(frame.parentId()))
                children.put(frame.parentId(), frame);
            else
                roots.add(frame);
        }

        Writer writer = new Writer(ImmutableMap.copyOf(byId), children.build());
        if (config.isIncludeHeader())
            writer.out.append("// Generated by FDF Toolkit\n\n");
        if (includes != null && !includes.isEmpty()) {
            for (String include : includes)
                writer.out.append("IncludeFile ").append(FdfEscaper.quote(include)).append(",\n");
            writer.out.append('\n');
        }
        for (Frame root : roots)
            writer.writeRoot(root);
        // frames whose parent chain never reaches a root
        for (Frame frame : frames)
            writer.writeRoot(frame);
        LOG.debug("Exported {} frames ({} roots)", frames.size(), roots.size());
        return writer.out.toString();
    }

    /** Per-export state: lookups and the output buffer. */
    private final class Writer {

        private final StringBuilder out = new StringBuilder();
        private final Map<String, Frame> byId;
        private final ImmutableListMultimap<String, Frame> children;
        private final Set<String> written = new HashSet<>();

        Writer(Map<String, Frame> byId, ImmutableListMultimap<String, Frame> children) {
            this.byId = byId;
            this.children = children;
        }

        void writeRoot(Frame frame) {
            if (written.contains(frame.id()))
                return;
            if (!written.isEmpty())
                out.append('\n');
            writeFrame(frame, 0);
        }

        void writeFrame(Frame frame, int depth) {
            if (!written.add(frame.id()))
                return;

            indent(depth);
            out.append("Frame ").append(FdfEscaper.quote(typeKeyword(frame)))
                    .append(' ').append(FdfEscaper.quote(Strings.nullToEmpty(frame.name())));
            if (frame.metadata().inherits() != null)
                out.append(" INHERITS ").append(FdfEscaper.quote(frame.metadata().inherits()));
            out.append(" {\n");

            int inner = depth + 1;
            property(inner, "Width", numbers.format(frame.width()));
            property(inner, "Height", numbers.format(frame.height()));
            writeAnchors(frame, inner);
            writeStyle(frame, inner);
            writeUnmodeled(frame.metadata(), inner);
            writeTextureBlock(frame, inner);

            for (Frame child : children.get(frame.id())) {
                out.append('\n');
                writeFrame(child, inner);
            }

            indent(depth);
            out.append("}\n");
        }

        /**
         * Anchors a frame got from the parent placeholder are not written as
         * {@code SetPoint}s: names of parents need not be unique, and reading
         * the frame again nested in its parent recreates them.
         */
        private void writeAnchors(Frame frame, int depth) {
            List<Anchor> anchors = frame.anchors();
            int skipped = 0;
            if (frame.metadata().setAllPoints() && fillsParent(frame)) {
                property(depth, "SetAllPoints", null);
                skipped = 2;
            } else if (frame.metadata().defaultAnchor() && anchors.size() == 1
                    && anchors.get(0).point() == FramePoint.CENTER) {
                skipped = 1;
            }
            for (Anchor anchor : anchors.subList(skipped, anchors.size())) {
                if (anchor.isRelative()) {
                    property(depth, "SetPoint", anchor.point() + ", "
                            + FdfEscaper.quote(targetName(anchor)) + ", "
                            + anchor.effectiveRelativePoint() + ", "
                            + numbers.format(anchor.x()) + ", " + numbers.format(anchor.y()));
                } else {
                    property(depth, "Anchor", anchor.point() + ", "
                            + numbers.format(anchor.x()) + ", " + numbers.format(anchor.y()));
                }
            }
        }

        /** Leading TOPLEFT/BOTTOMRIGHT pair as {@code SetAllPoints} produces it, on the parent or the canvas. */
        private static boolean fillsParent(Frame frame) {
            List<Anchor> anchors = frame.anchors();
            if (anchors.size() < 2)
                return false;
            Anchor topLeft = anchors.get(0);
            Anchor bottomRight = anchors.get(1);
            if (topLeft.point() != FramePoint.TOPLEFT || bottomRight.point() != FramePoint.BOTTOMRIGHT)
                return false;
            if (frame.parentId() == null)
                return !topLeft.isRelative() && !bottomRight.isRelative();
            return onParent(topLeft, frame.parentId()) && onParent(bottomRight, frame.parentId());
        }

        private static boolean onParent(Anchor anchor, String parentId) {
            return anchor.point() == anchor.effectiveRelativePoint() && !anchor.external()
                    && parentId.equals(anchor.relativeTo()) && anchor.x() == 0.0 && anchor.y() == 0.0;
        }

        private void writeStyle(Frame frame, int depth) {
            FrameStyle style = frame.style();
            if (style.text() != null)
                property(depth, "Text", FdfEscaper.quote(style.text()));
            if (style.font() != null)
                property(depth, "Font", font(style.font()));
            if (style.fontFlags() != null)
                property(depth, "FontFlags", FdfEscaper.quote(style.fontFlags()));
            color(depth, "FontColor", style.fontColor());
            color(depth, "FontHighlightColor", style.fontHighlightColor());
            color(depth, "FontDisabledColor", style.fontDisabledColor());
            color(depth, "FontShadowColor", style.fontShadowColor());
            if (style.justificationH() != null)
                property(depth, "FontJustificationH", word(style.justificationH()));
            if (style.justificationV() != null)
                property(depth, "FontJustificationV", word(style.justificationV()));

            if (style.texture() != null && frame.type() == FrameType.BACKDROP)
                property(depth, "BackdropBackground", FdfEscaper.quote(style.texture()));
            if (style.tileBackground())
                property(depth, "BackdropTileBackground", null);
            if (style.backgroundSize() != null)
                property(depth, "BackdropBackgroundSize", numbers.format(style.backgroundSize()));
            if (style.cornerSize() != null)
                property(depth, "BackdropCornerSize", numbers.format(style.cornerSize()));
            if (!style.cornerFlags().isEmpty())
                property(depth, "BackdropCornerFlags", FdfEscaper.quote(BackdropCornerFlag.join(style.cornerFlags())));
            if (!style.backgroundInsets().isEmpty())
                property(depth, "BackdropBackgroundInsets", spaced(style.backgroundInsets()));
            if (style.backdropEdgeFile() != null)
                property(depth, "BackdropEdgeFile", FdfEscaper.quote(style.backdropEdgeFile()));
            if (style.blendAll())
                property(depth, "BackdropBlendAll", null);
        }

        private void writeUnmodeled(FdfMetadata metadata, int depth) {
            metadata.properties().forEach((name, value) ->
                    property(depth, name, FdfValue.FLAG.equals(value) ? null : value(value)));
        }

        /** File of non-backdrop frames plus the texture-only properties. */
        private void writeTextureBlock(Frame frame, int depth) {
            FrameStyle style = frame.style();
            boolean file = style.texture() != null && frame.type() != FrameType.BACKDROP;
            if (!file && style.texCoord().isEmpty() && style.alphaMode() == null)
                return;

            indent(depth);
            out.append("Texture {\n");
            if (file)
                property(depth + 1, "File", FdfEscaper.quote(style.texture()));
            if (!style.texCoord().isEmpty())
                property(depth + 1, "TexCoord", joined(style.texCoord()));
            if (style.alphaMode() != null)
                property(depth + 1, "AlphaMode", FdfEscaper.quote(style.alphaMode()));
            indent(depth);
            out.append("}\n");
        }

        private String targetName(Anchor anchor) {
            Frame target = anchor.external() ? null : byId.get(anchor.relativeTo());
            return target != null ? Strings.nullToEmpty(target.name()) : anchor.relativeTo();
        }

        private void color(int depth, String name, Rgba color) {
            if (color != null)
                property(depth, name, spaced(color.channels()));
        }

        private String font(FontSpec font) {
            String text = FdfEscaper.quote(font.name()) + ", " + numbers.format(font.height());
            return font.flags() != null ? text + ", " + FdfEscaper.quote(font.flags()) : text;
        }

        private String value(FdfValue value) {
            if (value instanceof FdfValue.StringLiteral literal)
                return FdfEscaper.quote(literal.value());
            if (value instanceof FdfValue.Identifier identifier)
                return word(identifier.name());
            if (value instanceof FdfValue.ArrayValue array) {
                List<String> parts = new ArrayList<>();
                for (FdfValue element : array.values())
                    parts.add(value(element));
                return String.join(", ", parts);
            }
            return value.text();
        }

        private String spaced(List<Double> values) {
            List<String> parts = new ArrayList<>();
            for (Double v : values)
                parts.add(numbers.format(v));
            return String.join(" ", parts);
        }

        private String joined(List<Double> values) {
            List<String> parts = new ArrayList<>();
            for (Double v : values)
                parts.add(numbers.format(v));
            return String.join(", ", parts);
        }

        private void property(int depth, String name, String value) {
            indent(depth);
            out.append(name);
            if (value != null)
                out.append(' ').append(value);
            out.append(",\n");
        }

        private void indent(int depth) {
            out.append(Strings.repeat(config.getIndent(), depth));
        }
    }

    /** The declared keyword when it still maps to the frame's type, otherwise the canonical one. */
    private static String typeKeyword(Frame frame) {
        String declared = frame.metadata().declaredType();
        if (declared != null && FrameType.fromFdf(declared).filter(t -> t == frame.type()).isPresent())
            return declared;
        return frame.type().fdfName();
    }

    /** Identifiers are written bare; anything else is quoted. */
    private static String word(String text) {
        if (WORD.matcher(text).matches() && !KEYWORDS.contains(text.toUpperCase(Locale.ROOT)))
            return text;
        return FdfEscaper.quote(text);
    }
}
