package com.github.rudygunawan.memo.key;

import java.util.Arrays;

/**
 * A flattened, immutable sequence of key parts whose hash code is computed once at construction.
 *
 * <p>A miss probes the store map several times with the same key (lookup, membership check after
 * the computation, insert), so the hash is cached here instead of being recomputed over all parts.
 */
final class CompositeKey {

    private final Object[] parts;
    private final int hash;

    CompositeKey(Object[] parts) {
        this.parts = parts;
        this.hash = Arrays.hashCode(parts);
    }

    int length() {
        return parts.length;
    }

    Object part(int index) {
        return parts[index];
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof CompositeKey)) {
            return false;
        }
        CompositeKey other = (CompositeKey) obj;
        return hash == other.hash && Arrays.equals(parts, other.parts);
    }

    @Override
    public String toString() {
        return "CompositeKey" + Arrays.toString(parts);
    }
}
