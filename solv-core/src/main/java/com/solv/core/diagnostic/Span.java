package com.solv.core.diagnostic;

/**
 * Half-open {@code [start, end)} range of character offsets into a source buffer.
 *
 * @param start first offset covered
 * @param end offset just past the range; equal to {@code start} for a point
 */
public record Span(int start, int end) {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    /**
     * Creates a zero-length span.
     *
     * @param offset position of the span
     * @return span starting and ending at {@code offset}
     */
    public static Span at(int offset) {
        return new Span(offset, offset);
    }

    public int length() {
        return end - start;
    }
}
