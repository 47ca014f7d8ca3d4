package com.e2eq.access.exceptions;

/**
 * Thrown when an edge or mapping is added with an endpoint that does not exist.
 * <p>
 * This is a specialisation of {@link ElementNotFoundException}; {@link #getParameterName()} identifies which
 * endpoint was missing (e.g. {@code fromGroup} or {@code toGroup}).
 * </p>
 */
public class InvalidReferenceException extends ElementNotFoundException {
    private static final long serialVersionUID = 1L;

    private final ElementKind referencingKind;

    public InvalidReferenceException(ElementKind referencingKind, ElementKind elementKind, String element, String parameterName) {
        super(elementKind, element, parameterName,
                String.format("Cannot create %s: %s '%s' in argument '%s' does not exist.",
                        referencingKind.displayName().toLowerCase(), elementKind.displayName(), element, parameterName));
        this.referencingKind = referencingKind;
    }

    /**
     * The kind of edge or mapping which held the invalid reference.
     */
    public ElementKind getReferencingKind() {
        return referencingKind;
    }
}
