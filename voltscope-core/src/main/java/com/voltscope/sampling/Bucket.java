package com.voltscope.sampling;

/** Half-open index range {@code [start, end)} over a series. */
public record Bucket(int start, int end) {

    public Bucket {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid bucket range [" + start + ", " + end + ")");
        }
    }

    public int size() {
        return end - start;
    }

    public boolean isEmpty() {
        return start == end;
    }
}
