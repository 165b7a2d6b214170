package com.jcmt.hetitc.domain;

/**
 * One scan direction of an observation.
 *
 * @param points    points per row (or in total, for grids and jiggles)
 * @param rows      number of rows
 * @param dy        effective row spacing (arcsec), 0 when not a raster
 * @param multiscan noise factor from overlapping array rows
 */
public record ScanPass(int points, int rows, double dy, double multiscan) {

    public static ScanPass single(int points) {
        return new ScanPass(points, 1, 0.0, 1.0);
    }
}
