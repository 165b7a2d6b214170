package com.jcmt.hetitc.domain;

import lombok.Value;

/** Physical temperatures (K) of the chopper-wheel calibration. */
@Value
public class CalibrationLoads {
    double load;
    double spill;
    double air;
}
