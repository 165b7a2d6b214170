package com.jcmt.hetitc.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Physical parameters of one receiver. Frequencies in GHz.
 * <p>
 * Receiver temperature is given either by {@link #tRx} (indexed by sky
 * frequency) or by the per-sideband curves {@link #tRxLsb} / {@link #tRxUsb}
 * (indexed by LO frequency), optionally with an IF-dependent correction.
 */
@Value
@Builder(toBuilder = true)
public class ReceiverInfo {
    String name;
    double freqMin;
    double freqMax;
    int mixers;
    boolean ssbAvailable;
    boolean dsbAvailable;
    boolean frswAvailable;
    double etaTel;

    TemperatureCurve tRx;
    TemperatureCurve tRxLsb;
    TemperatureCurve tRxUsb;
    InterpolationTable tRxIf;

    Double ifFreq;
    Double ifMin;
    Double ifMax;
    Double loMin;
    Double loMax;
    /** Alternating LSB/USB breakpoints in sky frequency, the first interval being LSB. */
    @Singular("sidebandBreak") List<Double> sidebandPreference;

    ArrayInfo array;
    TSysFit tSysFit;
    CalibrationLoads calibration;

    public boolean isLoIndexed() {
        return tRxLsb != null || tRxUsb != null;
    }

    public boolean isArray() {
        return array != null;
    }

    public TemperatureCurve sidebandCurve(Sideband sideband) {
        return sideband == Sideband.LSB ? tRxLsb : tRxUsb;
    }
}
