package com.jcmt.hetitc.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** Intermediate values of a calculation, for display and diagnostics. */
@Value
@Builder(toBuilder = true)
public class CalculationExtra {
    double tRx;
    double tSys;
    double tau;
    double etaSky;
    Double ifFreq;
    Double loFreq;
    Sideband sideband;
    boolean tSysFitApplied;
    Double calibrationFactor;

    /** Integration time per point, summed over the scan directions. */
    double intTime;
    double elapsedTime;
    double rms;

    @Singular List<ScanPass> passes;
    @Singular List<Double> passIntTimes;
    @Singular List<Double> passElapsedTimes;
    @Singular List<Double> passRmsValues;
    /** Share of the elapsed time given to the first basket-weave direction. */
    Double basketWeaveFraction;
}
