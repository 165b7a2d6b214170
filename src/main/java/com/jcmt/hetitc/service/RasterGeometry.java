package com.jcmt.hetitc.service;

import com.jcmt.hetitc.domain.ArrayInfo;
import com.jcmt.hetitc.domain.RasterSpec;
import com.jcmt.hetitc.domain.ReceiverInfo;
import com.jcmt.hetitc.domain.ScanPass;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.jcmt.hetitc.domain.Maths.div;
import static com.jcmt.hetitc.domain.Maths.sqrt;

/** Points, rows and row spacing of raster scans. */
@Component
public class RasterGeometry {

    /**
     * One pass, or two orthogonal passes when basket weaving. The second pass
     * scans along the height, keeping the pixel size along the scan and the
     * row spacing across it.
     */
    public List<ScanPass> passes(ReceiverInfo receiver, RasterSpec raster, boolean basketWeave) {
        ScanPass first = pass(receiver.getArray(), raster.getWidth(), raster.getHeight(),
                raster.getDx(), raster.getDy(), raster.isOverscan());
        if (!basketWeave) return List.of(first);

        ScanPass second = pass(receiver.getArray(), raster.getHeight(), raster.getWidth(),
                raster.getDx(), raster.getDy(), raster.isOverscan());
        return List.of(first, second);
    }

    /**
     * @param width  extent along the scan direction
     * @param height extent across it
     * @param array  null for single-pixel receivers
     */
    public ScanPass pass(ArrayInfo array, double width, double height, double dx, double dy, boolean overscan) {
        double margin = (overscan && array != null) ? array.getFootprint() / 2.0 : 0.0;

        int points = (int) Math.floor(div(width + 2.0 * margin, dx)) + 1;

        int rows;
        double rowSpacing = dy;
        if (array != null && height + 2.0 * margin <= array.getFootprint()) {
            rows = 1;
            rowSpacing = array.getFootprint();
        } else {
            rows = (int) Math.floor(div(height + 2.0 * margin, dy)) + 1;
        }

        double multiscan = (array == null)
                ? 1.0
                : sqrt(div(rowSpacing, array.getFootprint() * array.getFractionAvailable()));

        return new ScanPass(points, rows, rowSpacing, multiscan);
    }
}
