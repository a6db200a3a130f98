package com.tessera.search.interner;

import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Deduplicating store mapping values to small stable integer handles.
 *
 * <p>Inserting a value equal to one already stored returns the existing handle;
 * otherwise the value is appended and its handle is the previous size of the store.
 * The store only grows. Not thread-safe: one instance belongs to one search request.
 *
 * @param <T> type of the interned values, which must implement {@code equals} and {@code hashCode}
 */
public final class DedupInterner<T> {

    private final Object2IntMap<T> valueToId = new Object2IntOpenHashMap<>();
    private final List<T> idToValue = new ArrayList<>();

    public DedupInterner() {
        valueToId.defaultReturnValue(-1);
    }

    /**
     * Interns a value.
     *
     * @return the handle of the stored value equal to {@code value}
     */
    public Interned<T> insert(T value) {
        Objects.requireNonNull(value, "Cannot intern null");
        int id = valueToId.getInt(value);
        if (id < 0) {
            id = idToValue.size();
            idToValue.add(value);
            valueToId.put(value, id);
        }
        return new Interned<>(id);
    }

    /**
     * Returns the value of a handle.
     *
     * @throws IllegalArgumentException if the handle was not produced by this interner
     */
    public T get(Interned<T> handle) {
        int index = handle.index();
        if (index >= idToValue.size()) {
            throw new IllegalArgumentException(
                String.format("Handle %s is out of range for an interner of size %d", handle, idToValue.size()));
        }
        return idToValue.get(index);
    }

    public int size() {
        return idToValue.size();
    }
}
