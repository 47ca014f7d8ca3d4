package com.e2eq.access.serialization;

/**
 * Converts objects of a type to and from strings which uniquely identify them.
 * <p>
 * {@code fromString(toString(x))} must be equal to {@code x}, and distinct objects must produce distinct
 * strings.
 * </p>
 *
 * @param <T> the type of objects to convert
 */
public interface UniqueStringifier<T> {

    String toString(T value);

    /**
     * @throws IllegalArgumentException if the string does not identify an object of the type
     */
    T fromString(String stringified);
}
