package com.voltscope.sampling;

/** A record projected onto chart geometry. {@code x} is epoch milliseconds for time-based series. */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);
}
