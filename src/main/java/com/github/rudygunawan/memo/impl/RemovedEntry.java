package com.github.rudygunawan.memo.impl;

/**
 * A key and result taken out of a {@link RecencyStore}, held until removal listeners have seen them.
 */
final class RemovedEntry<V> {
    final Object key;
    final V result;

    RemovedEntry(Object key, V result) {
        this.key = key;
        this.result = result;
    }
}
