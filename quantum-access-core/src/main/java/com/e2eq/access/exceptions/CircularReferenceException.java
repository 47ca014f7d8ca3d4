package com.e2eq.access.exceptions;

/**
 * Thrown when a group to group mapping would make a group a member of itself, either directly or through
 * other groups.
 */
public class CircularReferenceException extends AccessManagerException {
    private static final long serialVersionUID = 1L;

    private final String fromGroup;
    private final String toGroup;

    public CircularReferenceException(String fromGroup, String toGroup) {
        super(fromGroup.equals(toGroup)
                ? String.format("Group '%s' cannot be mapped to itself.", fromGroup)
                : String.format("A mapping between groups '%s' and '%s' cannot be created as it would cause a circular reference.", fromGroup, toGroup));
        this.fromGroup = fromGroup;
        this.toGroup = toGroup;
    }

    public String getFromGroup() {
        return fromGroup;
    }

    public String getToGroup() {
        return toGroup;
    }
}
