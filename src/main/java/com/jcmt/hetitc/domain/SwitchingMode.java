package com.jcmt.hetitc.domain;

/** Calibration scheme: position-, beam- or frequency-switched. */
public enum SwitchingMode {
    PSSW,
    BMSW,
    FRSW
}
