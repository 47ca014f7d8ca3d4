package com.e2eq.access.serialization;

import java.util.Objects;

/**
 * {@link UniqueStringifier} for enum constants, using the constant name.
 *
 * @param <E> the enum type
 */
public class EnumUniqueStringifier<E extends Enum<E>> implements UniqueStringifier<E> {

    private final Class<E> enumType;

    public EnumUniqueStringifier(Class<E> enumType) {
        this.enumType = Objects.requireNonNull(enumType, "enumType");
    }

    @Override
    public String toString(E value) {
        return Objects.requireNonNull(value, "value").name();
    }

    @Override
    public E fromString(String stringified) {
        Objects.requireNonNull(stringified, "stringified");
        try {
            return Enum.valueOf(enumType, stringified);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    String.format("String '%s' could not be converted to a value of enum %s.", stringified, enumType.getSimpleName()), e);
        }
    }
}
