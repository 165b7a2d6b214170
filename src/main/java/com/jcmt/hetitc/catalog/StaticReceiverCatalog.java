package com.jcmt.hetitc.catalog;

import com.jcmt.hetitc.domain.InterpolationTable;
import com.jcmt.hetitc.domain.ReceiverInfo;
import com.jcmt.hetitc.domain.Sideband;
import com.jcmt.hetitc.domain.TemperatureCurve;
import com.jcmt.hetitc.error.ErrorKind;
import com.jcmt.hetitc.error.FrequencyRangeException;
import com.jcmt.hetitc.error.HeterodyneItcException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/** Catalog held entirely in memory, built once and never modified. */
public final class StaticReceiverCatalog implements ReceiverCatalog {

    private final Map<String, ReceiverInfo> receivers;
    private final NavigableMap<Double, InterpolationTable> opacity;

    /**
     * @param receivers receivers by id, in display order
     * @param opacity   opacity-vs-frequency tables keyed by 225 GHz opacity (at least two)
     */
    public StaticReceiverCatalog(Map<String, ReceiverInfo> receivers, Map<Double, InterpolationTable> opacity) {
        if (opacity.size() < 2) {
            throw new IllegalArgumentException("Need at least two opacity tables, got " + opacity.size());
        }
        this.receivers = Collections.unmodifiableMap(new LinkedHashMap<>(receivers));
        this.opacity = Collections.unmodifiableNavigableMap(new TreeMap<>(opacity));
    }

    @Override
    public ReceiverInfo getReceiverInfo(String id) {
        ReceiverInfo info = (id == null) ? null : receivers.get(id);
        if (info == null) {
            throw new HeterodyneItcException(ErrorKind.INVALID_PARAMETER, "Unknown receiver: " + id);
        }
        return info;
    }

    @Override
    public List<String> getReceiverIds() {
        return List.copyOf(receivers.keySet());
    }

    public List<Double> getOpacityReferences() {
        return List.copyOf(opacity.keySet());
    }

    @Override
    public TRxLookup interpolatedTRx(ReceiverInfo receiver, double skyFreq, Double ifFreq, Sideband sideband) {
        if (!receiver.isLoIndexed()) {
            return new TRxLookup(receiver.getTRx().valueAt(skyFreq), null, null, null);
        }

        double ifUsed = resolveIf(receiver, ifFreq);
        Sideband sb = resolveSideband(receiver, skyFreq, sideband);
        double lo = (sb == Sideband.USB) ? skyFreq - ifUsed : skyFreq + ifUsed;

        if (receiver.getLoMin() != null && receiver.getLoMax() != null
                && (lo < receiver.getLoMin() || lo > receiver.getLoMax())) {
            throw new FrequencyRangeException("local oscillator frequency", lo, receiver.getLoMin(), receiver.getLoMax());
        }

        double value = receiver.sidebandCurve(sb).valueAt(lo);
        if (receiver.getTRxIf() != null) {
            value += receiver.getTRxIf().valueAt(ifUsed);
        }
        return new TRxLookup(value, ifUsed, lo, sb);
    }

    private static double resolveIf(ReceiverInfo receiver, Double ifFreq) {
        if (ifFreq == null) {
            if (receiver.getIfFreq() == null) {
                throw new IllegalStateException("Receiver " + receiver.getName() + " has no default IF frequency");
            }
            return receiver.getIfFreq();
        }
        if (receiver.getIfMin() != null && receiver.getIfMax() != null
                && (ifFreq < receiver.getIfMin() || ifFreq > receiver.getIfMax())) {
            throw new FrequencyRangeException("intermediate frequency", ifFreq, receiver.getIfMin(), receiver.getIfMax());
        }
        return ifFreq;
    }

    private static Sideband resolveSideband(ReceiverInfo receiver, double skyFreq, Sideband requested) {
        TemperatureCurve lsb = receiver.getTRxLsb();
        TemperatureCurve usb = receiver.getTRxUsb();

        // Only one sideband has data: it is the only choice.
        if (lsb == null || usb == null) {
            Sideband only = (lsb != null) ? Sideband.LSB : Sideband.USB;
            if (requested != null && requested != only) {
                throw new HeterodyneItcException(ErrorKind.UNSUPPORTED_RECEIVER_OPTION,
                        "The " + requested + " sideband is not available with receiver " + receiver.getName() + ".");
            }
            return only;
        }

        if (requested != null) return requested;

        Sideband sb = Sideband.LSB;
        for (double breakpoint : receiver.getSidebandPreference()) {
            if (skyFreq < breakpoint) break;
            sb = sb.other();
        }
        return sb;
    }

    /**
     * Interpolates in frequency within the two tables bracketing {@code tau225},
     * then linearly between (or beyond) their reference opacities.
     */
    @Override
    public double interpolatedOpacity(double tau225, double freq) {
        List<Double> refs = new ArrayList<>(opacity.keySet());
        double lower = refs.get(refs.size() - 2);
        double upper = refs.get(refs.size() - 1);
        for (int i = 0; i < refs.size(); i++) {
            if (refs.get(i) >= tau225) {
                lower = (i == 0) ? refs.get(0) : refs.get(i - 1);
                upper = (i == 0) ? refs.get(1) : refs.get(i);
                break;
            }
        }

        double tauLower = opacity.get(lower).valueAt(freq);
        double tauUpper = opacity.get(upper).valueAt(freq);
        return tauLower + (tau225 - lower) * (tauUpper - tauLower) / (upper - lower);
    }
}
