package com.tessera.search.interner;

/**
 * Handle to a value stored in an {@link Interner} or {@link DedupInterner}.
 *
 * <p>Handles are plain indexes: cheap to copy, hash and order. A handle is only
 * meaningful for the interner that produced it.
 *
 * @param <T> type of the interned value
 */
public record Interned<T>(int index) implements Comparable<Interned<T>> {

    public Interned {
        if (index < 0) {
            throw new IllegalArgumentException("Interned index must be >= 0: " + index);
        }
    }

    @Override
    public int compareTo(Interned<T> other) {
        return Integer.compare(index, other.index);
    }

    @Override
    public String toString() {
        return "#" + index;
    }
}
