package com.e2eq.access.exceptions;

/**
 * Thrown when adding a user, group, membership edge, mapping, entity type or entity which already exists.
 * <p>
 * Adds are never idempotent; callers either check with the matching {@code contains*} method first or handle
 * this exception.
 * </p>
 */
public class DuplicateElementException extends AccessManagerException {
    private static final long serialVersionUID = 1L;

    private final ElementKind elementKind;
    private final String element;

    public DuplicateElementException(ElementKind elementKind, String element) {
        super(String.format("%s '%s' already exists.", elementKind.displayName(), element));
        this.elementKind = elementKind;
        this.element = element;
    }

    public DuplicateElementException(ElementKind elementKind, String element, String message) {
        super(message);
        this.elementKind = elementKind;
        this.element = element;
    }

    public ElementKind getElementKind() {
        return elementKind;
    }

    /**
     * The string form of the duplicate element.
     */
    public String getElement() {
        return element;
    }
}
