package com.jcmt.hetitc.domain;

import lombok.Builder;
import lombok.Value;

/** Raster map geometry in arcsec; x is the scan direction of the first pass. */
@Value
@Builder(toBuilder = true)
public class RasterSpec {
    double width;
    double height;
    double dx;
    double dy;
    boolean overscan;
}
