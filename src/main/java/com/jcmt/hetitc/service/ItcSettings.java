package com.jcmt.hetitc.service;

import lombok.Getter;
import lombok.ToString;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Engine constants that operators may tune without a rebuild. */
@Getter
@ToString
@Component
public class ItcSettings {

    /** Empirical correction on the radiometer equation. */
    private final double fudge;
    /** Digital autocorrelation spectrometer efficiency factor. */
    private final double dfact;
    /** Per-point integration floor (s), doubled under basket weave. */
    private final double intTimeMinimum;
    /** Time between reference observations for shared-off grids (s). */
    private final double refsInterval;
    private final int maxIterations;
    private final int splitRounds;

    public ItcSettings(@Value("${itc.fudge:1.04}") double fudge,
                       @Value("${itc.dfact:1.23}") double dfact,
                       @Value("${itc.int-time-minimum:0.1}") double intTimeMinimum,
                       @Value("${itc.refs-interval:30}") double refsInterval,
                       @Value("${itc.max-iterations:5}") int maxIterations,
                       @Value("${itc.split-rounds:4}") int splitRounds) {
        this.fudge = fudge;
        this.dfact = dfact;
        this.intTimeMinimum = intTimeMinimum;
        this.refsInterval = refsInterval;
        this.maxIterations = maxIterations;
        this.splitRounds = splitRounds;
    }

    public static ItcSettings defaults() {
        return new ItcSettings(1.04, 1.23, 0.1, 30.0, 5, 4);
    }

    public double intTimeMinimum(boolean basketWeave) {
        return basketWeave ? 2.0 * intTimeMinimum : intTimeMinimum;
    }
}
