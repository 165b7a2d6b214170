package com.jcmt.hetitc.service;

import com.jcmt.hetitc.domain.DurationParam;
import com.jcmt.hetitc.domain.MapMode;
import com.jcmt.hetitc.domain.SwitchingMode;
import com.jcmt.hetitc.error.ErrorKind;
import com.jcmt.hetitc.error.HeterodyneItcException;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

import static com.jcmt.hetitc.domain.Maths.div;
import static com.jcmt.hetitc.domain.Maths.sqrt;

/**
 * Empirical observing overheads. For one scan direction:
 * <pre>
 *   src     = rows · (b·n·t + c·√n·t + d)
 *   elapsed = e · (src + a · ⌈src / block⌉)
 * </pre>
 */
@Component
public class DurationModel {

    private static final double CONTINUUM_FACTOR = 1.2;

    /** Coefficients with e = 1, as {shared, not shared}. */
    private final Map<MapMode, Map<SwitchingMode, DurationParam[]>> table = new EnumMap<>(MapMode.class);

    public DurationModel() {
        put(MapMode.GRID, SwitchingMode.PSSW, p(2.65, 0, 0, 90), p(2.45, 0, 0, 90));
        put(MapMode.GRID, SwitchingMode.BMSW, p(2.40, 0, 0, 90), p(2.39, 0, 0, 90));
        put(MapMode.GRID, SwitchingMode.FRSW, p(1.25, 0, 0, 90), p(1.25, 0, 0, 90));
        put(MapMode.JIGGLE, SwitchingMode.PSSW, p(1.75, 0, 0, 90), p(2.45, 0, 0, 90));
        put(MapMode.JIGGLE, SwitchingMode.BMSW, p(1.28, 1.26, 0, 90), p(2.30, 0, 0, 90));
        put(MapMode.JIGGLE, SwitchingMode.FRSW, p(1.20, 0, 0, 90), p(1.20, 0, 0, 90));
        put(MapMode.RASTER, SwitchingMode.PSSW, p(1.10, 1.00, 17, 40), p(1.10, 1.00, 17, 40));
        put(MapMode.RASTER, SwitchingMode.FRSW, p(1.05, 0, 17, 40), p(1.05, 0, 17, 40));
    }

    private static DurationParam p(double b, double c, double d, double blockMinutes) {
        return new DurationParam(80.0, b, c, d, 1.0, blockMinutes);
    }

    private void put(MapMode map, SwitchingMode sw, DurationParam shared, DurationParam notShared) {
        table.computeIfAbsent(map, k -> new EnumMap<>(SwitchingMode.class)).put(sw, new DurationParam[]{shared, notShared});
    }

    public DurationParam parameters(MapMode mapMode, SwitchingMode switchingMode, int points,
                                    boolean separateOffs, boolean continuum) {
        Map<SwitchingMode, DurationParam[]> bySwitching = table.get(mapMode);
        DurationParam[] entry = (bySwitching == null) ? null : bySwitching.get(switchingMode);
        if (entry == null) {
            throw new HeterodyneItcException(ErrorKind.INVALID_MODE,
                    "Unsupported combination of map mode " + mapMode + " and switching mode " + switchingMode + ".");
        }
        boolean shared = !separateOffs && points > 1;
        DurationParam param = shared ? entry[0] : entry[1];
        return continuum ? param.withE(CONTINUUM_FACTOR) : param;
    }

    /** On-source time without block overhead (s). */
    double sourceTime(DurationParam p, int points, int rows, double intTime) {
        return rows * (p.b() * points * intTime + p.c() * Math.sqrt(points) * intTime + p.d());
    }

    public double elapsedTime(DurationParam p, int points, int rows, double intTime) {
        double src = sourceTime(p, points, rows, intTime);
        double blocks = Math.ceil(div(src, p.blockSeconds()));
        return p.e() * (src + p.a() * blocks);
    }

    public double intTime(DurationParam p, int points, int rows, double elapsedTime) {
        double total = div(elapsedTime, p.e());
        double blocks = Math.ceil(div(total, p.blockSeconds() + p.a()));
        double src = total - p.a() * blocks;
        return div(div(src, rows) - p.d(), p.b() * points + p.c() * sqrt(points));
    }
}
