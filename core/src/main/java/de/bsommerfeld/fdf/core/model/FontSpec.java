package de.bsommerfeld.fdf.core.model;

/**
 * Font reference of {@code Font "Name", 0.011[, "flags"]} /
 * {@code FrameFont ...}.
 *
 * @param name   font name or path
 * @param height font height in normalized units
 * @param flags  font flags, {@code null} if not given
 */
public record FontSpec(String name, double height, String flags) {
}
