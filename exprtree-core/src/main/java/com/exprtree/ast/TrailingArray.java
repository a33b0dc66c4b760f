package com.exprtree.ast;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

/**
 * Fixed-count, read-only view over the elements stored after a node header.
 *
 * <p>The count is fixed when the node is built and never changes.</p>
 */
public final class TrailingArray<T> extends AbstractList<T> implements RandomAccess {

    private final Object[] storage;
    private final int offset;
    private final int count;

    private TrailingArray(Object[] storage, int offset, int count) {
        this.count = count;
        this.offset = offset;
        this.storage = storage;
    }

    /**
     * Copies {@code elements} into a new trailing region.
     *
     * @throws IllegalArgumentException if an element is null
     */
    public static <T> TrailingArray<T> copyOf(List<? extends T> elements) {
        Object[] storage = new Object[elements.size()];
        for (int i = 0; i < storage.length; i++) {
            T element = elements.get(i);
            if (element == null) {
                throw new IllegalArgumentException("Trailing element " + i + " is null");
            }
            storage[i] = element;
        }
        return new TrailingArray<>(storage, 0, storage.length);
    }

    @Override
    @SuppressWarnings("unchecked")
    public T get(int index) {
        Objects.checkIndex(index, count);
        return (T) storage[offset + index];
    }

    @Override
    public int size() {
        return count;
    }

    /**
     * A view of elements {@code [from, to)} sharing this array's storage.
     */
    public TrailingArray<T> slice(int from, int to) {
        Objects.checkFromToIndex(from, to, count);
        return new TrailingArray<>(storage, offset + from, to - from);
    }

    public T last() {
        if (count == 0) {
            throw new IllegalStateException("Empty trailing array has no last element");
        }
        return get(count - 1);
    }
}
