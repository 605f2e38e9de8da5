package de.bsommerfeld.fdf.core.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Set;

/**
 * Presentation fields of a frame. None of them take part in layout; they are
 * carried through transformation so editors can display them and the exporter
 * can write them back. Every field is optional ({@code null} or empty when the
 * source did not set it).
 *
 * @param text               {@code Text} of text-like frames
 * @param texture            {@code BackdropBackground} or texture-block {@code File}
 * @param backdropEdgeFile   {@code BackdropEdgeFile}
 * @param cornerFlags        parsed {@code BackdropCornerFlags}
 * @param cornerSize         {@code BackdropCornerSize}
 * @param backgroundSize     {@code BackdropBackgroundSize}
 * @param tileBackground     {@code BackdropTileBackground} flag
 * @param blendAll           {@code BackdropBlendAll} flag
 * @param backgroundInsets   {@code BackdropBackgroundInsets} (four numbers)
 * @param fontColor          {@code FontColor}
 * @param fontHighlightColor {@code FontHighlightColor}
 * @param fontDisabledColor  {@code FontDisabledColor}
 * @param fontShadowColor    {@code FontShadowColor}
 * @param justificationH     {@code FontJustificationH} identifier
 * @param justificationV     {@code FontJustificationV} identifier
 * @param font               {@code Font} / {@code FrameFont}
 * @param fontFlags          {@code FontFlags}
 * @param texCoord           texture-block {@code TexCoord} (four numbers)
 * @param alphaMode          texture-block {@code AlphaMode}
 */
public record FrameStyle(
        String text,
        String texture,
        String backdropEdgeFile,
        Set<BackdropCornerFlag> cornerFlags,
        Double cornerSize,
        Double backgroundSize,
        boolean tileBackground,
        boolean blendAll,
        List<Double> backgroundInsets,
        Rgba fontColor,
        Rgba fontHighlightColor,
        Rgba fontDisabledColor,
        Rgba fontShadowColor,
        String justificationH,
        String justificationV,
        FontSpec font,
        String fontFlags,
        List<Double> texCoord,
        String alphaMode) {

    public static final FrameStyle EMPTY = builder().build();

    public FrameStyle {
        cornerFlags = cornerFlags == null ? ImmutableSet.of() : ImmutableSet.copyOf(cornerFlags);
        backgroundInsets = backgroundInsets == null ? ImmutableList.of() : ImmutableList.copyOf(backgroundInsets);
        texCoord = texCoord == null ? ImmutableList.of() : ImmutableList.copyOf(texCoord);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .text(text)
                .texture(texture)
                .backdropEdgeFile(backdropEdgeFile)
                .cornerFlags(cornerFlags)
                .cornerSize(cornerSize)
                .backgroundSize(backgroundSize)
                .tileBackground(tileBackground)
                .blendAll(blendAll)
                .backgroundInsets(backgroundInsets)
                .fontColor(fontColor)
                .fontHighlightColor(fontHighlightColor)
                .fontDisabledColor(fontDisabledColor)
                .fontShadowColor(fontShadowColor)
                .justificationH(justificationH)
                .justificationV(justificationV)
                .font(font)
                .fontFlags(fontFlags)
                .texCoord(texCoord)
                .alphaMode(alphaMode);
    }

    public static final class Builder {

        private String text;
        private String texture;
        private String backdropEdgeFile;
        private Set<BackdropCornerFlag> cornerFlags = ImmutableSet.of();
        private Double cornerSize;
        private Double backgroundSize;
        private boolean tileBackground;
        private boolean blendAll;
        private List<Double> backgroundInsets = ImmutableList.of();
        private Rgba fontColor;
        private Rgba fontHighlightColor;
        private Rgba fontDisabledColor;
        private Rgba fontShadowColor;
        private String justificationH;
        private String justificationV;
        private FontSpec font;
        private String fontFlags;
        private List<Double> texCoord = ImmutableList.of();
        private String alphaMode;

        private Builder() {
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder texture(String texture) {
            this.texture = texture;
            return this;
        }

        public Builder backdropEdgeFile(String backdropEdgeFile) {
            this.backdropEdgeFile = backdropEdgeFile;
            return this;
        }

        public Builder cornerFlags(Set<BackdropCornerFlag> cornerFlags) {
            this.cornerFlags = cornerFlags;
            return this;
        }

        public Builder cornerSize(Double cornerSize) {
            this.cornerSize = cornerSize;
            return this;
        }

        public Builder backgroundSize(Double backgroundSize) {
            this.backgroundSize = backgroundSize;
            return this;
        }

        public Builder tileBackground(boolean tileBackground) {
            this.tileBackground = tileBackground;
            return this;
        }

        public Builder blendAll(boolean blendAll) {
            this.blendAll = blendAll;
            return this;
        }

        public Builder backgroundInsets(List<Double> backgroundInsets) {
            this.backgroundInsets = backgroundInsets;
            return this;
        }

        public Builder fontColor(Rgba fontColor) {
            this.fontColor = fontColor;
            return this;
        }

        public Builder fontHighlightColor(Rgba fontHighlightColor) {
            this.fontHighlightColor = fontHighlightColor;
            return this;
        }

        public Builder fontDisabledColor(Rgba fontDisabledColor) {
            this.fontDisabledColor = fontDisabledColor;
            return this;
        }

        public Builder fontShadowColor(Rgba fontShadowColor) {
            this.fontShadowColor = fontShadowColor;
            return this;
        }

        public Builder justificationH(String justificationH) {
            this.justificationH = justificationH;
            return this;
        }

        public Builder justificationV(String justificationV) {
            this.justificationV = justificationV;
            return this;
        }

        public Builder font(FontSpec font) {
            this.font = font;
            return this;
        }

        public Builder fontFlags(String fontFlags) {
            this.fontFlags = fontFlags;
            return this;
        }

        public Builder texCoord(List<Double> texCoord) {
            this.texCoord = texCoord;
            return this;
        }

        public Builder alphaMode(String alphaMode) {
            this.alphaMode = alphaMode;
            return this;
        }

        public FrameStyle build() {
            return new FrameStyle(text, texture, backdropEdgeFile, cornerFlags, cornerSize, backgroundSize,
                    tileBackground, blendAll, backgroundInsets, fontColor, fontHighlightColor, fontDisabledColor,
                    fontShadowColor, justificationH, justificationV, font, fontFlags, texCoord, alphaMode);
        }
    }
}
