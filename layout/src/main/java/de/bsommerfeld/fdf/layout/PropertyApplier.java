package de.bsommerfeld.fdf.layout;

import de.bsommerfeld.fdf.core.ast.FdfValue;
import de.bsommerfeld.fdf.core.ast.Property;
import de.bsommerfeld.fdf.core.model.Anchor;
import de.bsommerfeld.fdf.core.model.BackdropCornerFlag;
import de.bsommerfeld.fdf.core.model.FontSpec;
import de.bsommerfeld.fdf.core.model.FramePoint;
import de.bsommerfeld.fdf.core.model.Rgba;
import de.bsommerfeld.fdf.layout.TransformWarning.Kind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Writes FDF properties into a {@link FrameDraft}.
 *
 * <p>
 * Known properties land in typed fields; a known property whose value has the
 * wrong shape is reported and skipped. Everything else is kept verbatim in the
 * draft's unmodeled property bag so the exporter can write it back.
 */
final class PropertyApplier {

    private final Consumer<TransformWarning> warnings;

    PropertyApplier(Consumer<TransformWarning> warnings) {
        this.warnings = warnings;
    }

    void apply(FrameDraft draft, Property property) {
        FdfValue value = property.value();
        switch (property.name().toLowerCase(Locale.ROOT)) {
            case "width" -> firstNumber(value).ifPresentOrElse(w -> {
                draft.width = w;
                draft.widthSet = true;
            }, () -> malformed(draft, property));
            case "height" -> firstNumber(value).ifPresentOrElse(h -> {
                draft.height = h;
                draft.heightSet = true;
            }, () -> malformed(draft, property));
            case "setpoint", "anchor" -> applyAnchor(draft, property);
            case "setallpoints" -> {
                if (isSet(value)) {
                    draft.setAllPoints = true;
                    draft.anchors.clear();
                    draft.anchors.add(Anchor.toParent(FramePoint.TOPLEFT));
                    draft.anchors.add(Anchor.toParent(FramePoint.BOTTOMRIGHT));
                }
            }

            case "text" -> draft.style.text(value.text());
            case "fontcolor" -> color(draft, property).ifPresent(draft.style::fontColor);
            case "fonthighlightcolor" -> color(draft, property).ifPresent(draft.style::fontHighlightColor);
            case "fontdisabledcolor" -> color(draft, property).ifPresent(draft.style::fontDisabledColor);
            case "fontshadowcolor" -> color(draft, property).ifPresent(draft.style::fontShadowColor);
            case "fontjustificationh" -> draft.style.justificationH(value.text());
            case "fontjustificationv" -> draft.style.justificationV(value.text());
            case "font", "framefont" -> applyFont(draft, property);
            case "fontflags" -> draft.style.fontFlags(value.text());

            case "backdropbackground", "file" -> draft.style.texture(value.text());
            case "backdropedgefile" -> draft.style.backdropEdgeFile(value.text());
            case "backdropcornerflags" -> draft.style.cornerFlags(BackdropCornerFlag.parse(value.text()));
            case "backdropcornersize" -> firstNumber(value)
                    .ifPresentOrElse(draft.style::cornerSize, () -> malformed(draft, property));
            case "backdropbackgroundsize" -> firstNumber(value)
                    .ifPresentOrElse(draft.style::backgroundSize, () -> malformed(draft, property));
            case "backdroptilebackground" -> draft.style.tileBackground(isSet(value));
            case "backdropblendall" -> draft.style.blendAll(isSet(value));
            case "backdropbackgroundinsets" -> numbers(value, 4)
                    .ifPresentOrElse(draft.style::backgroundInsets, () -> malformed(draft, property));

            case "texcoord" -> numbers(value, 4)
                    .ifPresentOrElse(draft.style::texCoord, () -> malformed(draft, property));
            case "alphamode" -> draft.style.alphaMode(value.text());

            default -> draft.putProperty(property.name(), value);
        }
    }

    /**
     * {@code SetPoint point, "Target", relativePoint, x, y} or the absolute
     * {@code Anchor point, x, y}.
     */
    private void applyAnchor(FrameDraft draft, Property property) {
        List<FdfValue> values = property.value().elements();
        if (values.size() != 3 && values.size() < 5) {
            malformed(draft, property);
            return;
        }

        FramePoint point = framePoint(draft, values.get(0).text());
        if (values.size() == 3) {
            Optional<Double> x = values.get(1).number();
            Optional<Double> y = values.get(2).number();
            if (x.isEmpty() || y.isEmpty()) {
                malformed(draft, property);
                return;
            }
            draft.anchors.add(Anchor.absolute(point, x.get(), y.get()));
            return;
        }

        String relativeTo = values.get(1).text();
        FramePoint relativePoint = framePoint(draft, values.get(2).text());
        Optional<Double> x = values.get(3).number();
        Optional<Double> y = values.get(4).number();
        if (x.isEmpty() || y.isEmpty()) {
            malformed(draft, property);
            return;
        }
        draft.anchors.add(Anchor.relative(point, relativeTo, relativePoint, x.get(), y.get()));
    }

    private FramePoint framePoint(FrameDraft draft, String name) {
        return FramePoint.lookup(name).orElseGet(() -> {
            warn(draft, Kind.MALFORMED_PROPERTY, "Unknown frame point '" + name + "', using TOPLEFT");
            return FramePoint.TOPLEFT;
        });
    }

    /** {@code Font "name", height[, "flags"]}. */
    private void applyFont(FrameDraft draft, Property property) {
        List<FdfValue> values = property.value().elements();
        Optional<Double> height = values.size() >= 2 ? values.get(1).number() : Optional.empty();
        if (height.isEmpty()) {
            malformed(draft, property);
            return;
        }
        String flags = values.size() >= 3 ? values.get(2).text() : null;
        draft.style.font(new FontSpec(values.get(0).text(), height.get(), flags));
    }

    private Optional<Rgba> color(FrameDraft draft, Property property) {
        Optional<Rgba> color = allNumbers(property.value()).flatMap(Rgba::fromChannels);
        if (color.isEmpty())
            malformed(draft, property);
        return color;
    }

    private static Optional<Double> firstNumber(FdfValue value) {
        return value.elements().get(0).number();
    }

    private static Optional<List<Double>> numbers(FdfValue value, int count) {
        return allNumbers(value).filter(n -> n.size() == count);
    }

    private static Optional<List<Double>> allNumbers(FdfValue value) {
        List<Double> result = new ArrayList<>();
        for (FdfValue element : value.elements()) {
            Optional<Double> number = element.number();
            if (number.isEmpty())
                return Optional.empty();
            result.add(number.get());
        }
        return Optional.of(result);
    }

    /** Flags are set unless written with an explicit {@code false}. */
    private static boolean isSet(FdfValue value) {
        return !"false".equalsIgnoreCase(value.text());
    }

    private void malformed(FrameDraft draft, Property property) {
        warn(draft, Kind.MALFORMED_PROPERTY,
                "Ignoring " + property.name() + " with value '" + property.value().text() + "' at line " + property.line());
    }

    private void warn(FrameDraft draft, Kind kind, String message) {
        warnings.accept(new TransformWarning(kind, draft.name, message));
    }
}
