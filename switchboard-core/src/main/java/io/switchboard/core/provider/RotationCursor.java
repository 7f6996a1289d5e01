package io.switchboard.core.provider;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide round-robin position of one provider. Outlives configuration reloads.
 */
final class RotationCursor {
    private final ReentrantLock lock = new ReentrantLock();
    private int index;

    String advance(List<String> keys) {
        lock.lock();
        try {
            int size = keys.size();
            int current = index % size;
            index = (current + 1) % size;
            return keys.get(current);
        } finally {
            lock.unlock();
        }
    }

    int position() {
        lock.lock();
        try {
            return index;
        } finally {
            lock.unlock();
        }
    }
}
