package com.jcmt.hetitc.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Observing parameters shared by all calculation directions.
 * Frequencies in GHz, resolution in MHz, zenith angle in degrees.
 */
@Value
@Builder(toBuilder = true)
public class CalculationRequest {
    String receiver;
    MapMode mapMode;
    SwitchingMode switchingMode;
    double freq;
    double freqRes;
    double tau225;
    double zenithAngle;
    boolean dsb;
    boolean dualPolarization;
    /** Grid or jiggle points; unused for rasters. */
    Integer pointCount;
    RasterSpec raster;
    boolean basketWeave;
    boolean separateOffs;
    boolean continuum;
    Double ifFreq;
    Sideband sideband;
}
