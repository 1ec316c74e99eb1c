package io.computeorchestrator.models;

import lombok.Value;

/**
 * A stored value together with the version it was read at. Version 0 means the key did not exist.
 */
@Value
public class Versioned<T> {
    T value;
    long version;

    public static <T> Versioned<T> absent() {
        return new Versioned<>(null, 0L);
    }

    public boolean isPresent() {
        return value != null;
    }
}
