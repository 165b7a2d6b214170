package com.jcmt.hetitc.service;

import com.jcmt.hetitc.domain.DurationParam;
import com.jcmt.hetitc.domain.MapMode;
import com.jcmt.hetitc.domain.SwitchingMode;
import com.jcmt.hetitc.error.ErrorKind;
import com.jcmt.hetitc.error.HeterodyneItcException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DurationModelTest {

    private final DurationModel model = new DurationModel();

    @Test
    void shared_offs_select_shared_coefficients() {
        assertThat(model.parameters(MapMode.GRID, SwitchingMode.PSSW, 25, false, false).b()).isEqualTo(2.65);
        assertThat(model.parameters(MapMode.GRID, SwitchingMode.PSSW, 1, false, false).b()).isEqualTo(2.45);
        assertThat(model.parameters(MapMode.JIGGLE, SwitchingMode.BMSW, 16, true, false).b()).isEqualTo(2.30);

        DurationParam jiggle = model.parameters(MapMode.JIGGLE, SwitchingMode.BMSW, 16, false, false);
        assertThat(jiggle.b()).isEqualTo(1.28);
        assertThat(jiggle.c()).isEqualTo(1.26);

        DurationParam raster = model.parameters(MapMode.RASTER, SwitchingMode.PSSW, 80, false, false);
        assertThat(raster.d()).isEqualTo(17.0);
        assertThat(raster.blockMinutes()).isEqualTo(40.0);
    }

    @Test
    void continuum_mode_scales_everything() {
        DurationParam plain = model.parameters(MapMode.GRID, SwitchingMode.FRSW, 1, false, false);
        DurationParam continuum = model.parameters(MapMode.GRID, SwitchingMode.FRSW, 1, false, true);

        assertThat(model.elapsedTime(plain, 1, 1, 100.0)).isCloseTo(125.0 + 80.0, within(1e-9));
        assertThat(model.elapsedTime(continuum, 1, 1, 100.0)).isCloseTo(1.2 * 205.0, within(1e-9));
    }

    @Test
    void block_overhead_counts_started_blocks() {
        DurationParam p = model.parameters(MapMode.GRID, SwitchingMode.FRSW, 1, false, false);
        // 90 min block = 5400 s of source time
        assertThat(model.elapsedTime(p, 1, 1, 5400.0 / 1.25)).isCloseTo(5400.0 + 80.0, within(1e-6));
        assertThat(model.elapsedTime(p, 1, 1, 5401.0 / 1.25)).isCloseTo(5401.0 + 160.0, within(1e-6));
    }

    @Test
    void grid_scenario_elapsed_time() {
        DurationParam p = model.parameters(MapMode.GRID, SwitchingMode.PSSW, 25, false, false);
        assertThat(model.elapsedTime(p, 25, 1, 77.10011900749184)).isCloseTo(5187.88, within(0.01));
    }

    @Test
    void int_time_inverts_elapsed_time() {
        DurationParam grid = model.parameters(MapMode.GRID, SwitchingMode.PSSW, 25, false, false);
        double elapsed = model.elapsedTime(grid, 25, 1, 77.1);
        assertThat(model.intTime(grid, 25, 1, elapsed)).isCloseTo(77.1, within(1e-9));

        DurationParam raster = model.parameters(MapMode.RASTER, SwitchingMode.PSSW, 83, false, true);
        double rasterElapsed = model.elapsedTime(raster, 83, 11, 1.5);
        assertThat(model.intTime(raster, 83, 11, rasterElapsed)).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void unsupported_pair_is_named() {
        assertThatThrownBy(() -> model.parameters(MapMode.RASTER, SwitchingMode.BMSW, 10, false, false))
                .isInstanceOfSatisfying(HeterodyneItcException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INVALID_MODE))
                .hasMessageContaining("RASTER")
                .hasMessageContaining("BMSW");
    }
}
