package com.jreinhal.scrubber.model;

/**
 * One addressable piece of content. Flat text is a single unit without a coordinate;
 * cell-addressed documents supply one unit per populated cell (e.g. {@code Sheet1!B7}).
 */
public record ContentUnit(String coordinate, String text) {

    public static ContentUnit flat(String text) {
        return new ContentUnit(null, text);
    }

    public boolean isStructural() {
        return coordinate != null;
    }
}
