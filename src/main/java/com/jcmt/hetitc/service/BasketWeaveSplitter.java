package com.jcmt.hetitc.service;

import com.jcmt.hetitc.error.ErrorKind;
import com.jcmt.hetitc.error.HeterodyneItcException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Divides an elapsed-time budget between the two directions of a basket-weave
 * raster so that both reach about the same noise. Coarse-to-fine grid search
 * over the fraction f given to the first direction.
 */
@Slf4j
@Component
public class BasketWeaveSplitter {

    private static final double INITIAL_CENTER = 0.5;
    private static final double INITIAL_STEP = 0.05;
    private static final int HALF_WIDTH = 10;

    private final ItcSettings settings;

    public BasketWeaveSplitter(ItcSettings settings) {
        this.settings = settings;
    }

    /** RMS of one direction given its share of the budget; empty when the share is too short. */
    @FunctionalInterface
    public interface DirectionRms {
        OptionalDouble rms(double budget);
    }

    /**
     * @param fraction  share of the budget for the first direction
     * @param firstRms  noise reached by the first direction
     * @param secondRms noise reached by the second direction
     */
    public record Split(double fraction, double firstRms, double secondRms) {}

    public Split split(double budget, DirectionRms first, DirectionRms second) {
        double center = INITIAL_CENTER;
        double step = INITIAL_STEP;
        Split best = null;
        double bestDistance = Double.POSITIVE_INFINITY;

        for (int round = 0; round < settings.getSplitRounds(); round++) {
            for (int k = -HALF_WIDTH; k <= HALF_WIDTH; k++) {
                double f = center + k * step;
                if (f <= 0.0 || f > 1.0) continue;

                OptionalDouble rms1 = first.rms(f * budget);
                if (rms1.isEmpty()) continue;
                OptionalDouble rms2 = second.rms((1.0 - f) * budget);
                if (rms2.isEmpty()) continue;

                double distance = Math.abs(rms1.getAsDouble() / rms2.getAsDouble() - 1.0);
                if (distance < bestDistance) {
                    bestDistance = distance;
                    best = new Split(f, rms1.getAsDouble(), rms2.getAsDouble());
                }
            }
            if (best == null) break;
            center = best.fraction();
            step /= 10.0;
        }

        if (best == null) {
            throw new HeterodyneItcException(ErrorKind.BASKET_WEAVE_SPLIT_FAILED,
                    "Could not divide the time between the basket weave directions. "
                            + "Please try increasing the time or disabling basket weaving.");
        }
        log.debug("Basket weave split: f={} rms={} / {}", best.fraction(), best.firstRms(), best.secondRms());
        return best;
    }
}
