package com.jreinhal.scrubber.model;

/**
 * Half-open range {@code [start, end)} inside one addressable content unit.
 */
public record Span(int start, int end) implements Comparable<Span> {

    public Span {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean overlaps(Span other) {
        return !(this.end <= other.start || other.end <= this.start);
    }

    public boolean fitsWithin(int contentLength) {
        return end <= contentLength;
    }

    @Override
    public int compareTo(Span other) {
        int byStart = Integer.compare(this.start, other.start);
        return byStart != 0 ? byStart : Integer.compare(this.end, other.end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")";
    }
}
