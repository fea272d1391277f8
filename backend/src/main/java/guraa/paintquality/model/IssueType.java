package guraa.paintquality.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The closed set of issue labels a problem region can carry.
 */
public enum IssueType {
    UNEVEN_COVERAGE("uneven_coverage"),
    COLOR_INCONSISTENCY("color_inconsistency"),
    OVER_APPLICATION("over_application"),
    TEXTURE_VARIATION("texture_variation");

    private final String label;

    IssueType(String label) {
        this.label = label;
    }

    /**
     * Get the wire label of this issue type.
     *
     * @return The snake_case label (e.g. "uneven_coverage")
     */
    @JsonValue
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
