package com.tessera.search.interner;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only store handing out a fresh handle for every pushed value.
 *
 * <p>Used for values that are never looked up by content, such as query terms.
 *
 * @param <T> type of the stored values
 */
public final class Interner<T> {

    private final List<T> values = new ArrayList<>();

    public Interned<T> push(T value) {
        values.add(Objects.requireNonNull(value, "Cannot intern null"));
        return new Interned<>(values.size() - 1);
    }

    /**
     * @throws IllegalArgumentException if the handle was not produced by this interner
     */
    public T get(Interned<T> handle) {
        int index = handle.index();
        if (index >= values.size()) {
            throw new IllegalArgumentException(
                String.format("Handle %s is out of range for an interner of size %d", handle, values.size()));
        }
        return values.get(index);
    }

    public int size() {
        return values.size();
    }
}
