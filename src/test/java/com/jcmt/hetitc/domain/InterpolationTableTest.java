package com.jcmt.hetitc.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class InterpolationTableTest {

    private final InterpolationTable table = InterpolationTable.of(List.of(
            new double[]{10.0, 100.0},
            new double[]{20.0, 200.0},
            new double[]{30.0, 150.0}));

    @Test
    void interpolates_between_points() {
        assertThat(table.valueAt(15.0)).isCloseTo(150.0, within(1e-9));
        assertThat(table.valueAt(25.0)).isCloseTo(175.0, within(1e-9));
        assertThat(table.valueAt(20.0)).isEqualTo(200.0);
    }

    @Test
    void clamps_outside_range() {
        assertThat(table.valueAt(0.0)).isEqualTo(100.0);
        assertThat(table.valueAt(99.0)).isEqualTo(150.0);
    }

    @Test
    void rejects_mismatched_columns() {
        assertThatThrownBy(() -> new InterpolationTable(new double[]{1, 2}, new double[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
