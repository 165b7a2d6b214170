package com.jcmt.hetitc.service;

import com.jcmt.hetitc.catalog.ReceiverCatalog;
import com.jcmt.hetitc.catalog.ReceiverCatalog.TRxLookup;
import com.jcmt.hetitc.domain.ReceiverInfo;
import com.jcmt.hetitc.domain.Sideband;
import com.jcmt.hetitc.domain.TSysFit;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.jcmt.hetitc.domain.Maths.div;

/**
 * System temperature from receiver noise, sky and telescope emission.
 * <pre>
 *   η_sky = exp(−τ / cos za)
 *   T_sky = J_m (1 − η_sky),  T_tel = J_tel (1 − η_tel)
 *   T_sys = (T_rx + η_tel T_sky + T_tel) / (η_sky η_tel)     (SSB, doubled for DSB)
 * </pre>
 */
@Slf4j
@Component
public class SystemTemperatureModel {

    static final double J_SKY = 260.0;
    static final double J_TEL = 265.0;

    private final ReceiverCatalog catalog;

    public SystemTemperatureModel(ReceiverCatalog catalog) {
        this.catalog = catalog;
    }

    public SystemTemperature calculate(ReceiverInfo receiver, double freq, double tau225, double zenithAngle,
                                       boolean dsb, Double ifFreq, Sideband sideband) {
        TRxLookup tRx = catalog.interpolatedTRx(receiver, freq, ifFreq, sideband);
        double tau = catalog.interpolatedOpacity(tau225, freq);
        Atmosphere atm = atmosphere(tau, zenithAngle, receiver.getEtaTel());

        TSysFit fit = receiver.getTSysFit();
        boolean fitApplied = fit != null && fit.appliesTo(tau225, zenithAngle);

        double tSys = fitApplied
                ? fit.evaluate(freq)
                : div(tRx.value() + receiver.getEtaTel() * atm.tSky() + atm.tTel(),
                      atm.etaSky() * receiver.getEtaTel());

        Double calibrationFactor = null;
        if (receiver.getCalibration() != null) {
            calibrationFactor = ChopperWheel.factor(receiver.getCalibration(), freq, tau,
                    airmass(zenithAngle), receiver.getEtaTel());
            tSys *= calibrationFactor;
        }

        if (dsb) tSys *= 2.0;

        log.debug("T_sys {} @ {} GHz: tRx={} tau={} etaSky={} fit={} cal={} dsb={} -> {}",
                receiver.getName(), freq, tRx.value(), tau, atm.etaSky(), fitApplied, calibrationFactor, dsb, tSys);

        return SystemTemperature.builder()
                .tSys(tSys)
                .tRx(tRx.value())
                .tau(tau)
                .etaSky(atm.etaSky())
                .ifFreq(tRx.ifFreq())
                .loFreq(tRx.loFreq())
                .sideband(tRx.sideband())
                .fitApplied(fitApplied)
                .calibrationFactor(calibrationFactor)
                .build();
    }

    /**
     * Receiver temperature that would produce the measured {@code tSys}
     * under the given weather; the inverse of {@link #calculate} without the empirical fit.
     */
    public double impliedReceiverTemperature(ReceiverInfo receiver, double tSys, double freq, double tau225,
                                             double zenithAngle, boolean dsb) {
        double tau = catalog.interpolatedOpacity(tau225, freq);
        Atmosphere atm = atmosphere(tau, zenithAngle, receiver.getEtaTel());

        double tSysSsb = dsb ? tSys / 2.0 : tSys;
        if (receiver.getCalibration() != null) {
            tSysSsb = div(tSysSsb, ChopperWheel.factor(receiver.getCalibration(), freq, tau,
                    airmass(zenithAngle), receiver.getEtaTel()));
        }
        return tSysSsb * atm.etaSky() * receiver.getEtaTel()
                - receiver.getEtaTel() * atm.tSky() - atm.tTel();
    }

    static Atmosphere atmosphere(double tau, double zenithAngle, double etaTel) {
        double etaSky = Math.exp(-tau * airmass(zenithAngle));
        return new Atmosphere(etaSky, J_SKY * (1.0 - etaSky), J_TEL * (1.0 - etaTel));
    }

    static double airmass(double zenithAngle) {
        return div(1.0, Math.cos(Math.toRadians(zenithAngle)));
    }

    record Atmosphere(double etaSky, double tSky, double tTel) {}

    @Getter
    @Builder
    public static class SystemTemperature {
        private final double tSys;
        private final double tRx;
        private final double tau;
        private final double etaSky;
        private final Double ifFreq;
        private final Double loFreq;
        private final Sideband sideband;
        private final boolean fitApplied;
        private final Double calibrationFactor;
    }
}
