package de.bsommerfeld.fdf.core.ast;

/**
 * A top-level item of an FDF document.
 */
public sealed interface Statement permits Include, FrameDefinition {
}
