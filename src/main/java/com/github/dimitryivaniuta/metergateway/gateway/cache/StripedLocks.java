package com.github.dimitryivaniuta.metergateway.gateway.cache;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed array of locks selected by key hash. Keys on different stripes never contend.
 */
final class StripedLocks {

    private final ReentrantLock[] locks;
    private final int mask;

    StripedLocks(int stripes) {
        int size = Integer.highestOneBit(Math.max(1, stripes - 1)) << 1;
        this.locks = new ReentrantLock[size];
        this.mask = size - 1;
        for (int i = 0; i < size; i++) {
            locks[i] = new ReentrantLock();
        }
    }

    Lock forKey(String key) {
        int h = key.hashCode();
        h ^= (h >>> 16);
        return locks[h & mask];
    }

    int stripes() {
        return locks.length;
    }
}
