package com.jcmt.hetitc.catalog;

import com.jcmt.hetitc.domain.ReceiverInfo;
import com.jcmt.hetitc.domain.Sideband;

import java.util.List;

/**
 * Read-only access to receiver parameters and atmospheric opacity.
 * Implementations are immutable once built and safe to share between threads.
 */
public interface ReceiverCatalog {

    /** @throws com.jcmt.hetitc.error.HeterodyneItcException if the id has no entry */
    ReceiverInfo getReceiverInfo(String id);

    /** Receiver ids in catalog order. */
    List<String> getReceiverIds();

    /**
     * Receiver temperature at a sky frequency. For LO-indexed receivers the
     * IF frequency and sideband are resolved first (receiver defaults when null).
     */
    TRxLookup interpolatedTRx(ReceiverInfo receiver, double skyFreq, Double ifFreq, Sideband sideband);

    /** Zenith opacity at {@code freq} for weather given by the 225 GHz opacity. */
    double interpolatedOpacity(double tau225, double freq);

    /**
     * @param value    receiver temperature (K)
     * @param ifFreq   resolved IF frequency, null for sky-indexed receivers
     * @param loFreq   resolved LO frequency, null for sky-indexed receivers
     * @param sideband resolved sideband, null for sky-indexed receivers
     */
    record TRxLookup(double value, Double ifFreq, Double loFreq, Sideband sideband) {}
}
