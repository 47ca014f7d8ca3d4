package com.e2eq.access.exceptions;

/**
 * Thrown when an operation references a user, group, entity type, entity or mapping which does not exist.
 * <p>
 * Queries raise this for an unknown subject rather than answering "no access"; removals raise it when the
 * target is already gone.
 * </p>
 */
public class ElementNotFoundException extends AccessManagerException {
    private static final long serialVersionUID = 1L;

    private final ElementKind elementKind;
    private final String element;
    private final String parameterName;

    public ElementNotFoundException(ElementKind elementKind, String element, String parameterName) {
        super(buildMessage(elementKind, element, parameterName));
        this.elementKind = elementKind;
        this.element = element;
        this.parameterName = parameterName;
    }

    protected ElementNotFoundException(ElementKind elementKind, String element, String parameterName, String message) {
        super(message);
        this.elementKind = elementKind;
        this.element = element;
        this.parameterName = parameterName;
    }

    private static String buildMessage(ElementKind elementKind, String element, String parameterName) {
        if (parameterName == null) {
            return String.format("%s '%s' does not exist.", elementKind.displayName(), element);
        }
        return String.format("%s '%s' in argument '%s' does not exist.", elementKind.displayName(), element, parameterName);
    }

    public ElementKind getElementKind() {
        return elementKind;
    }

    /**
     * The string form of the missing element.
     */
    public String getElement() {
        return element;
    }

    /**
     * The name of the argument which held the missing element, or null when the element is a mapping.
     */
    public String getParameterName() {
        return parameterName;
    }
}
