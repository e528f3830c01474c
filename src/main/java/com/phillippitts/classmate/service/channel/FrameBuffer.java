package com.phillippitts.classmate.service.channel;

import com.phillippitts.classmate.domain.AudioFrame;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Bounded FIFO of audio frames held while the backend is unreachable. When full, the oldest
 * frame is dropped. Thread-safe.
 */
final class FrameBuffer {

    private final ArrayDeque<AudioFrame> frames = new ArrayDeque<>();
    private final int capacity;
    private long dropped = 0;

    FrameBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
        }
        this.capacity = capacity;
    }

    int capacity() {
        return capacity;
    }

    synchronized void add(AudioFrame frame) {
        if (frames.size() >= capacity) {
            frames.pollFirst();
            dropped++;
        }
        frames.addLast(frame);
    }

    /** Removes and returns all buffered frames, oldest first. */
    synchronized List<AudioFrame> drain() {
        List<AudioFrame> out = new ArrayList<>(frames);
        frames.clear();
        return out;
    }

    /**
     * Puts frames that could not be sent back at the head, keeping their order. Frames beyond
     * capacity are dropped from the old end.
     */
    synchronized void requeue(List<AudioFrame> unsent) {
        for (int i = unsent.size() - 1; i >= 0; i--) {
            frames.addFirst(unsent.get(i));
        }
        while (frames.size() > capacity) {
            frames.pollFirst();
            dropped++;
        }
    }

    synchronized int size() {
        return frames.size();
    }

    /** Frames discarded since creation because the buffer was full. */
    synchronized long dropped() {
        return dropped;
    }

    synchronized void clear() {
        frames.clear();
    }
}
