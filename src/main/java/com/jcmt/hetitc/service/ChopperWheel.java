package com.jcmt.hetitc.service;

import com.jcmt.hetitc.domain.CalibrationLoads;

import static com.jcmt.hetitc.domain.Maths.div;

/**
 * Correction of the chopper-wheel (hot load) calibration for a receiver
 * whose load, spillover and ambient temperatures differ.
 */
final class ChopperWheel {

    private static final double PLANCK = 6.62607015E-34;
    private static final double BOLTZMANN = 1.380649E-23;
    /** Atmosphere is taken this much colder than the ambient air. */
    private static final double ATMOSPHERE_OFFSET = 10.0;

    private ChopperWheel() {
    }

    /** Rayleigh-Jeans equivalent (Planck) brightness temperature at {@code freqGhz}. */
    static double brightness(double freqGhz, double temperature) {
        double hvk = PLANCK * freqGhz * 1.0E9 / BOLTZMANN;
        return div(hvk, Math.expm1(div(hvk, temperature)));
    }

    /**
     * @param airmass 1 / cos(zenith angle)
     */
    static double factor(CalibrationLoads loads, double freqGhz, double tau, double airmass, double etaTel) {
        double jLoad = brightness(freqGhz, loads.getLoad());
        double jSpill = brightness(freqGhz, loads.getSpill());
        double jAtm = brightness(freqGhz, loads.getAir() - ATMOSPHERE_OFFSET);
        double attenuation = Math.exp(tau * airmass);

        return 1.0
                + div(1.0 - etaTel, etaTel) * div(jLoad - jSpill, jLoad) * attenuation
                + div(jLoad - jAtm, jLoad) * (attenuation - 1.0);
    }
}
