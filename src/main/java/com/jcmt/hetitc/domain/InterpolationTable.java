package com.jcmt.hetitc.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Linear interpolation over (x, y) pairs sorted by x.
 * Outside the range the first or last y value is returned.
 */
@ToString
@EqualsAndHashCode
public final class InterpolationTable implements TemperatureCurve {

    private final double[] xs;
    private final double[] ys;

    public InterpolationTable(double[] xs, double[] ys) {
        if (xs.length != ys.length || xs.length == 0) {
            throw new IllegalArgumentException("Interpolation table needs matching, non-empty columns");
        }
        this.xs = xs.clone();
        this.ys = ys.clone();
    }

    public static InterpolationTable of(List<double[]> pairs) {
        double[] x = new double[pairs.size()];
        double[] y = new double[pairs.size()];
        for (int i = 0; i < pairs.size(); i++) {
            x[i] = pairs.get(i)[0];
            y[i] = pairs.get(i)[1];
        }
        return new InterpolationTable(x, y);
    }

    @Override
    public double valueAt(double x) {
        for (int i = 0; i < xs.length; i++) {
            if (x <= xs[i]) {
                if (i == 0) return ys[0];
                return ys[i - 1] + (ys[i] - ys[i - 1]) * (x - xs[i - 1]) / (xs[i] - xs[i - 1]);
            }
        }
        return ys[ys.length - 1];
    }
}
