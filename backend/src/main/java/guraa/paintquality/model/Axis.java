package guraa.paintquality.model;

/**
 * The three independent measurement axes.
 * Declaration order is the tie-break precedence used when two axes
 * contribute equally to a fused severity.
 */
public enum Axis {
    COLOR,
    COVERAGE,
    TEXTURE
}
