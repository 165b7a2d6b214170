package com.jcmt.hetitc.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;

/**
 * Fitted receiver temperature: c0 + Σ_k [a_k sin(kx) + b_k cos(kx)],
 * x = scale · (freq − offset).
 */
@ToString
@EqualsAndHashCode
public final class HarmonicModel implements TemperatureCurve {

    private final double offset;
    private final double scale;
    private final double constant;
    private final double[] sinTerms;
    private final double[] cosTerms;

    public HarmonicModel(double offset, double scale, double constant, double[] sinTerms, double[] cosTerms) {
        if (sinTerms.length != cosTerms.length) {
            throw new IllegalArgumentException("Harmonic model needs a cos term for every sin term");
        }
        this.offset = offset;
        this.scale = scale;
        this.constant = constant;
        this.sinTerms = sinTerms.clone();
        this.cosTerms = cosTerms.clone();
    }

    /** Parses the flat catalog form [offset, scale, c0, a1, b1, a2, b2, ...]. */
    public static HarmonicModel fromCoefficients(List<Double> values) {
        if (values.size() < 3 || (values.size() - 3) % 2 != 0) {
            throw new IllegalArgumentException("Harmonic model needs offset, scale, c0 and (sin, cos) pairs: " + values);
        }
        int n = (values.size() - 3) / 2;
        double[] a = new double[n];
        double[] b = new double[n];
        for (int k = 0; k < n; k++) {
            a[k] = values.get(3 + 2 * k);
            b[k] = values.get(4 + 2 * k);
        }
        return new HarmonicModel(values.get(0), values.get(1), values.get(2), a, b);
    }

    @Override
    public double valueAt(double freq) {
        double x = scale * (freq - offset);
        double value = constant;
        for (int k = 0; k < sinTerms.length; k++) {
            value += sinTerms[k] * Math.sin((k + 1) * x) + cosTerms[k] * Math.cos((k + 1) * x);
        }
        return value;
    }

    public int order() {
        return sinTerms.length;
    }
}
