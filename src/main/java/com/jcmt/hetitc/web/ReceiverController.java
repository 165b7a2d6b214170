package com.jcmt.hetitc.web;

import com.jcmt.hetitc.catalog.ReceiverCatalog;
import com.jcmt.hetitc.domain.ArrayInfo;
import com.jcmt.hetitc.domain.ReceiverInfo;
import com.jcmt.hetitc.error.HeterodyneItcException;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

@RestController
public class ReceiverController {

    private final ReceiverCatalog catalog;

    public ReceiverController(ReceiverCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping("/receivers")
    public List<ReceiverView> receivers() {
        return catalog.getReceiverIds().stream()
                .map(id -> ReceiverView.of(catalog.getReceiverInfo(id)))
                .toList();
    }

    @GetMapping("/receivers/{id}")
    public ReceiverView receiver(@PathVariable("id") String id) {
        try {
            return ReceiverView.of(catalog.getReceiverInfo(id));
        } catch (HeterodyneItcException e) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, e.getMessage(), e);
        }
    }

    /** Public receiver parameters; array fields are null for single-pixel receivers. */
    public record ReceiverView(String name, double freqMin, double freqMax, int mixers,
                               boolean ssbAvailable, boolean dsbAvailable, boolean frswAvailable,
                               double etaTel, Double ifFreq, Double ifMin, Double ifMax,
                               Double footprint, Double fractionAvailable,
                               Map<String, Double> scanSpacings, Map<String, Integer> jigglePatterns) {

        static ReceiverView of(ReceiverInfo r) {
            ArrayInfo a = r.getArray();
            return new ReceiverView(r.getName(), r.getFreqMin(), r.getFreqMax(), r.getMixers(),
                    r.isSsbAvailable(), r.isDsbAvailable(), r.isFrswAvailable(),
                    r.getEtaTel(), r.getIfFreq(), r.getIfMin(), r.getIfMax(),
                    a == null ? null : a.getFootprint(),
                    a == null ? null : a.getFractionAvailable(),
                    a == null ? Map.of() : a.getScanSpacings(),
                    a == null ? Map.of() : a.getJigglePatterns());
        }
    }
}
