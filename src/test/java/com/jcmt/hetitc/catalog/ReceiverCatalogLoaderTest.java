package com.jcmt.hetitc.catalog;

import com.jcmt.hetitc.domain.ArrayInfo;
import com.jcmt.hetitc.domain.HarmonicModel;
import com.jcmt.hetitc.domain.InterpolationTable;
import com.jcmt.hetitc.domain.ReceiverInfo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ReceiverCatalogLoaderTest {

    static StaticReceiverCatalog catalog;

    @BeforeAll
    static void load() throws IOException {
        catalog = new ReceiverCatalogLoader("receiver_info.json", "tau").load();
    }

    @Test
    void keeps_catalog_order() {
        assertThat(catalog.getReceiverIds()).containsExactly("A3", "HARP", "WD", "UU", "AWEOWEO");
        assertThat(catalog.getOpacityReferences()).containsExactly(0.03, 0.05, 0.065, 0.1, 0.16, 0.2, 0.25);
    }

    @Test
    void parses_array_presets() {
        ReceiverInfo harp = catalog.getReceiverInfo("HARP");
        ArrayInfo array = harp.getArray();

        assertThat(harp.isArray()).isTrue();
        assertThat(array.getFootprint()).isCloseTo(116.415, within(1e-3));
        assertThat(array.getFractionAvailable()).isEqualTo(0.875);
        assertThat(array.getScanSpacings().keySet())
                .containsExactly("Nyquist", "1/8 array", "1/4 array", "1/2 array", "Full array");
        assertThat(array.getJigglePatterns()).containsEntry("HARP5", 25);
        assertThat(harp.getTSysFit().getBands()).hasSize(3);
    }

    @Test
    void distinguishes_tables_from_harmonic_models() {
        assertThat(catalog.getReceiverInfo("A3").getTRx()).isInstanceOf(InterpolationTable.class);
        assertThat(catalog.getReceiverInfo("HARP").getTRx()).isInstanceOf(HarmonicModel.class);

        ReceiverInfo awe = catalog.getReceiverInfo("AWEOWEO");
        assertThat(awe.isLoIndexed()).isTrue();
        assertThat(awe.getTRxLsb()).isNull();
        assertThat(awe.getTRxUsb()).isInstanceOf(HarmonicModel.class);
        assertThat(awe.getCalibration().getLoad()).isEqualTo(293.0);
    }

    @Test
    void missing_resource_is_reported() {
        assertThatThrownBy(() -> new ReceiverCatalogLoader("nope.json", "tau").load())
                .isInstanceOf(IOException.class)
                .hasMessageContaining("nope.json");
    }
}
