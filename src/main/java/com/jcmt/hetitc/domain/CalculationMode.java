package com.jcmt.hetitc.domain;

/**
 * The quantity a caller supplies. The engine solves for the other two:
 * RMS gives elapsed time, ELAPSED_TIME and INT_TIME give RMS.
 */
public enum CalculationMode {
    RMS,
    ELAPSED_TIME,
    INT_TIME
}
