package de.bsommerfeld.fdf.core.ast;

/**
 * An entry inside a frame body: a property line or a nested block.
 */
public sealed interface BlockItem permits Property, NestedFrame {
}
