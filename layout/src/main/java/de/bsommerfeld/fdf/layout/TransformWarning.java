package de.bsommerfeld.fdf.layout;

/**
 * A non-fatal problem found while transforming a document. The transform
 * continues with the documented fallback for each kind.
 *
 * @param kind      what degraded
 * @param frameName name of the frame the problem belongs to
 * @param message   human-readable description
 */
public record TransformWarning(Kind kind, String frameName, String message) {

    public enum Kind {
        /** Type keyword not known; the frame becomes a generic FRAME. */
        UNKNOWN_FRAME_TYPE,
        /** INHERITS names no template registered so far; nothing is inherited. */
        MISSING_TEMPLATE,
        /** INHERITS WITHCHILDREN reached a template already being expanded; its children are not repeated. */
        RECURSIVE_TEMPLATE,
        /** Anchor target name matches no frame; kept as an opaque name and resolved against the canvas. */
        UNRESOLVED_REFERENCE,
        /** A known property carries a value of the wrong shape; the property is ignored. */
        MALFORMED_PROPERTY,
        /** An IncludeFile directive could not be resolved; its templates are not available. */
        MISSING_INCLUDE
    }

    @Override
    public String toString() {
        return kind + " [" + frameName + "]: " + message;
    }
}
