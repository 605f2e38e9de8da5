package de.bsommerfeld.fdf.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class LayoutConfig {

    // 4:3 safe area
    @JsonProperty("canvas-width")
    private double canvasWidth = 0.8;

    @JsonProperty("canvas-height")
    private double canvasHeight = 0.6;

    @JsonProperty("default-width")
    private double defaultWidth = 0.1;

    @JsonProperty("default-height")
    private double defaultHeight = 0.1;

    @JsonProperty("text-default-height")
    private double textDefaultHeight = 0.012;

    // Size of unanchored frames still at the generic default
    @JsonProperty("fallback-size")
    private double fallbackSize = 0.4;

    @JsonProperty("resolve-inheritance")
    private boolean resolveInheritance = true;

    public double getCanvasWidth() {
        return canvasWidth;
    }

    public void setCanvasWidth(double canvasWidth) {
        this.canvasWidth = canvasWidth;
    }

    public double getCanvasHeight() {
        return canvasHeight;
    }

    public void setCanvasHeight(double canvasHeight) {
        this.canvasHeight = canvasHeight;
    }

    public double getDefaultWidth() {
        return defaultWidth;
    }

    public void setDefaultWidth(double defaultWidth) {
        this.defaultWidth = defaultWidth;
    }

    public double getDefaultHeight() {
        return defaultHeight;
    }

    public void setDefaultHeight(double defaultHeight) {
        this.defaultHeight = defaultHeight;
    }

    public double getTextDefaultHeight() {
        return textDefaultHeight;
    }

    public void setTextDefaultHeight(double textDefaultHeight) {
        this.textDefaultHeight = textDefaultHeight;
    }

    public double getFallbackSize() {
        return fallbackSize;
    }

    public void setFallbackSize(double fallbackSize) {
        this.fallbackSize = fallbackSize;
    }

    public boolean isResolveInheritance() {
        return resolveInheritance;
    }

    public void setResolveInheritance(boolean resolveInheritance) {
        this.resolveInheritance = resolveInheritance;
    }
}
