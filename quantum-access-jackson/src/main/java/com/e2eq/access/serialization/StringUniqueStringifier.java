package com.e2eq.access.serialization;

import java.util.Objects;

/**
 * Identity {@link UniqueStringifier} for string keys.
 */
public class StringUniqueStringifier implements UniqueStringifier<String> {

    @Override
    public String toString(String value) {
        return Objects.requireNonNull(value, "value");
    }

    @Override
    public String fromString(String stringified) {
        return Objects.requireNonNull(stringified, "stringified");
    }
}
