package com.jcmt.hetitc.domain;

import com.jcmt.hetitc.error.ErrorKind;
import com.jcmt.hetitc.error.HeterodyneItcException;

/** Arithmetic that checks its arguments instead of producing Infinity/NaN. */
public final class Maths {

    private Maths() {
    }

    public static double div(double num, double den) {
        if (den == 0.0 || Double.isNaN(den)) {
            throw new HeterodyneItcException(ErrorKind.NUMERIC_DOMAIN,
                    "The calculation failed: division by zero.");
        }
        return num / den;
    }

    public static double sqrt(double v) {
        if (!(v >= 0.0)) {
            throw new HeterodyneItcException(ErrorKind.NUMERIC_DOMAIN,
                    "The calculation failed: square root of a negative number.");
        }
        return Math.sqrt(v);
    }

    public static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    public static int clamp(int v, int lo, int hi) {
        return Math.max(lo, Math.min(hi, v));
    }

    /** Noise of independent observations of the same sky: (Σ rms⁻²)^(-1/2). */
    public static double combineRms(double... values) {
        double sum = 0.0;
        for (double rms : values) {
            sum += div(1.0, rms * rms);
        }
        return div(1.0, sqrt(sum));
    }
}
