package com.jcmt.hetitc.service;

import com.jcmt.hetitc.domain.MapMode;
import com.jcmt.hetitc.domain.SwitchingMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.jcmt.hetitc.domain.Maths.clamp;
import static com.jcmt.hetitc.domain.Maths.div;
import static com.jcmt.hetitc.domain.Maths.sqrt;

/**
 * Radiometer equation with the shared-reference penalty:
 * <pre>
 *   rms = multiscan · fudge · dfact · √(1 + 1/√n_shared) · T_sys / √(Δν · t)
 * </pre>
 * For position-switched grids the number of points sharing one reference
 * depends on t, so the inverse is solved by fixed-point iteration.
 */
@Slf4j
@Component
public class RmsTimeConverter {

    private static final double SQRT2 = Math.sqrt(2.0);

    private final ItcSettings settings;

    public RmsTimeConverter(ItcSettings settings) {
        this.settings = settings;
    }

    /**
     * @param freqRes   frequency resolution (MHz)
     * @param points    points in the map (per row for rasters)
     * @param multiscan array row overlap factor, 1 when not applicable
     */
    public record Context(double tSys, double freqRes, int points, MapMode mapMode, SwitchingMode switchingMode,
                          boolean separateOffs, boolean dualPolarization, double multiscan) {

        boolean refsTimed() {
            return mapMode == MapMode.GRID && switchingMode == SwitchingMode.PSSW;
        }
    }

    public int sharedPoints(Context ctx, double intTime) {
        if (ctx.separateOffs() || ctx.switchingMode() == SwitchingMode.FRSW) return 1;
        if (ctx.refsTimed()) {
            return clamp((int) Math.floor(div(settings.getRefsInterval(), intTime)), 1, ctx.points());
        }
        return ctx.points();
    }

    public double rms(Context ctx, double intTime) {
        return rms(ctx, intTime, sharedPoints(ctx, intTime));
    }

    double rms(Context ctx, double intTime, int shared) {
        double value = ctx.multiscan() * settings.getFudge() * settings.getDfact()
                * sqrt(1.0 + div(1.0, sqrt(shared)))
                * div(ctx.tSys(), sqrt(ctx.freqRes() * 1.0E6 * intTime));
        return ctx.dualPolarization() ? value / SQRT2 : value;
    }

    /** Integration time per point reaching {@code targetRms}. */
    public double intTime(Context ctx, double targetRms) {
        double t = 1.0;
        int shared = sharedPoints(ctx, t);
        for (int i = 0; i < settings.getMaxIterations(); i++) {
            double ratio = div(rms(ctx, t, shared), targetRms);
            t *= ratio * ratio;
            if (!ctx.refsTimed()) break;

            int next = sharedPoints(ctx, t);
            log.trace("intTime iteration {}: t={} shared={} -> {}", i, t, shared, next);
            if (next == shared) break;
            shared = next;
        }
        return t;
    }
}
