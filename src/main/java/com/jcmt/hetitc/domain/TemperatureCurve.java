package com.jcmt.hetitc.domain;

/** Receiver temperature (K) as a function of frequency (GHz). */
public interface TemperatureCurve {

    double valueAt(double freq);
}
