package com.jcmt.hetitc.domain;

/**
 * Empirical observing-overhead coefficients for one mode combination.
 *
 * @param a            overhead per observing block (s)
 * @param b            on-source multiplier per point
 * @param c            multiplier on √n per row (shared off position)
 * @param d            constant per row (s)
 * @param e            overall factor (continuum mode)
 * @param blockMinutes length of an observing block
 */
public record DurationParam(double a, double b, double c, double d, double e, double blockMinutes) {

    public DurationParam withE(double value) {
        return new DurationParam(a, b, c, d, value, blockMinutes);
    }

    public double blockSeconds() {
        return blockMinutes * 60.0;
    }
}
