package com.jcmt.hetitc.domain;

import lombok.Value;

@Value
public class CalculationResult {
    /** The quantity that was solved for: ELAPSED_TIME or RMS. */
    CalculationMode solved;
    double value;
    CalculationExtra extra;
}
