package com.e2eq.access.exceptions;

/**
 * The kinds of element held by the access manager, used to describe which element an error refers to.
 */
public enum ElementKind {
    USER("User"),
    GROUP("Group"),
    ENTITY_TYPE("Entity type"),
    ENTITY("Entity"),
    USER_TO_GROUP_MAPPING("User to group mapping"),
    GROUP_TO_GROUP_MAPPING("Group to group mapping"),
    COMPONENT_MAPPING("Component mapping"),
    ENTITY_MAPPING("Entity mapping");

    private final String displayName;

    ElementKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
