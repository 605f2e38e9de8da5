package de.bsommerfeld.fdf.core.ast;

/**
 * A single property line such as {@code Width 0.25} or
 * {@code SetPoint TOPLEFT, "Parent", TOPLEFT, 0.0, 0.0}.
 *
 * <p>
 * A property written without values is a flag and carries
 * {@link FdfValue#FLAG}. One value is stored as that scalar; two or more are
 * wrapped in an {@link FdfValue.ArrayValue}.
 *
 * @param name  property name as written (matching is case-insensitive downstream)
 * @param value the property value
 * @param line  source line of the property name
 */
public record Property(String name, FdfValue value, int line) implements BlockItem {
}
