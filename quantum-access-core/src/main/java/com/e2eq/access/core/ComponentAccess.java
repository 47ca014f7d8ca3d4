package com.e2eq.access.core;

import java.util.Objects;

/**
 * An application component paired with a level of access to it.
 *
 * @param component   the application component
 * @param accessLevel the level of access to the component
 * @param <C>         the type of application components
 * @param <A>         the type of access levels
 */
public record ComponentAccess<C, A>(C component, A accessLevel) {

    public ComponentAccess {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(accessLevel, "accessLevel");
    }

    @Override
    public String toString() {
        return component + ":" + accessLevel;
    }
}
