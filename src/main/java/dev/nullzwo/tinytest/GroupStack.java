package dev.nullzwo.tinytest;

/**
 * Bounded stack of {@link Group} frames. All frames are allocated up front and reused across push/pop.
 */
final class GroupStack {
    private final Group[] frames;
    private int length;

    GroupStack(int capacity) {
        frames = new Group[capacity];
        for (int i = 0; i < capacity; i++) {
            frames[i] = new Group();
        }
    }

    int size() {
        return length;
    }

    boolean isEmpty() {
        return length == 0;
    }

    boolean isFull() {
        return length >= frames.length;
    }

    Group push(String name) {
        if (isFull()) {
            throw new IllegalStateException("group stack is full");
        }
        var frame = frames[length++];
        frame.reset(name);
        return frame;
    }

    Group pop() {
        if (isEmpty()) {
            throw new IllegalStateException("group stack is empty");
        }
        return frames[--length];
    }

    Group top() {
        return fromTop(0);
    }

    /**
     * @param depth 0 is the innermost group, {@code size() - 1} the root group
     */
    Group fromTop(int depth) {
        if (depth < 0 || depth >= length) {
            throw new IndexOutOfBoundsException("depth " + depth + " of " + length);
        }
        return frames[length - 1 - depth];
    }

    boolean hasOpenTest() {
        return !isEmpty() && top().test.isOpen();
    }
}
