package com.gaussjordan;

/** Fixed floating-point tolerance shared by every zero/one comparison in elimination. */
public final class Tolerance {
    public static final double EPSILON = 1e-9;

    private Tolerance() {}

    public static boolean isZero(double v) { return Math.abs(v) <= EPSILON; }

    public static boolean isOne(double v) { return Math.abs(v - 1.0) <= EPSILON; }

    /** Display-time cleanup only; stored matrix entries are never rounded. */
    public static double clean(double v) { return Math.abs(v) < EPSILON ? 0.0 : v; }
}
