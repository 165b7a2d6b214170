package com.jcmt.hetitc.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Empirical system temperature in good weather:
 * c2·Δf² + c1·Δf + c0·scale, with Δf measured from a reference line
 * and the constant term scaled per frequency band.
 */
@Value
@Builder
public class TSysFit {
    double referenceFreq;
    double quadratic;
    double linear;
    double constant;
    double maxTau;
    double maxZenith;
    /** Ascending by upper frequency. */
    @Singular List<Band> bands;

    public record Band(double upperFreq, double scale) {}

    public boolean appliesTo(double tau225, double zenithAngle) {
        return tau225 <= maxTau && zenithAngle <= maxZenith;
    }

    public double evaluate(double freq) {
        double offset = freq - referenceFreq;
        return quadratic * offset * offset + linear * offset + constant * constantScale(freq);
    }

    double constantScale(double freq) {
        if (bands.isEmpty()) return 1.0;
        for (Band band : bands) {
            if (freq < band.upperFreq()) return band.scale();
        }
        return bands.get(bands.size() - 1).scale();
    }
}
