package com.jcmt.hetitc.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/** Focal-plane array layout. Sizes in arcsec, tilt in degrees. */
@Value
@Builder(toBuilder = true)
public class ArrayInfo {
    double size;
    double tiltAngle;
    /** Fraction of the array's receptors in working order. */
    @Builder.Default double fractionAvailable = 1.0;
    @Singular Map<String, Double> scanSpacings;
    @Singular Map<String, Integer> jigglePatterns;

    /** Extent of the array perpendicular to the scan direction. */
    public double getFootprint() {
        return size * Math.cos(Math.toRadians(tiltAngle));
    }
}
