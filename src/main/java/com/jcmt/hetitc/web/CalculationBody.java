package com.jcmt.hetitc.web;

import com.jcmt.hetitc.domain.CalculationRequest;
import com.jcmt.hetitc.domain.MapMode;
import com.jcmt.hetitc.domain.RasterSpec;
import com.jcmt.hetitc.domain.Sideband;
import com.jcmt.hetitc.domain.SwitchingMode;
import lombok.Data;

/**
 * JSON body of the calculation endpoints: the observing parameters plus the
 * one input quantity the endpoint expects (rms, elapsedTime or intTime).
 */
@Data
public class CalculationBody {
    private String receiver;
    private MapMode mapMode;
    private SwitchingMode switchingMode;
    private Double freq;
    private Double freqRes;
    private Double tau225;
    private Double zenithAngle;
    private boolean dsb;
    private boolean dualPolarization;

    private Integer pointCount;

    // raster geometry (arcsec)
    private Double width;
    private Double height;
    private Double dx;
    private Double dy;
    private boolean overscan;

    private boolean basketWeave;
    private boolean separateOffs;
    private boolean continuum;
    private Double ifFreq;
    private Sideband sideband;

    private Double rms;
    private Double elapsedTime;
    private Double intTime;

    /** Expects freq, freqRes, tau225 and zenithAngle to be present. */
    public CalculationRequest toRequest() {
        RasterSpec raster = null;
        if (width != null && height != null && dx != null && dy != null) {
            raster = RasterSpec.builder()
                    .width(width).height(height)
                    .dx(dx).dy(dy)
                    .overscan(overscan)
                    .build();
        }
        return CalculationRequest.builder()
                .receiver(receiver)
                .mapMode(mapMode)
                .switchingMode(switchingMode)
                .freq(freq)
                .freqRes(freqRes)
                .tau225(tau225)
                .zenithAngle(zenithAngle)
                .dsb(dsb)
                .dualPolarization(dualPolarization)
                .pointCount(pointCount)
                .raster(raster)
                .basketWeave(basketWeave)
                .separateOffs(separateOffs)
                .continuum(continuum)
                .ifFreq(ifFreq)
                .sideband(sideband)
                .build();
    }
}
