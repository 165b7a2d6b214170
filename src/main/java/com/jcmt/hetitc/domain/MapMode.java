package com.jcmt.hetitc.domain;

import java.util.EnumSet;
import java.util.Set;

/** Spatial observing pattern. */
public enum MapMode {
    GRID(EnumSet.of(SwitchingMode.PSSW, SwitchingMode.BMSW, SwitchingMode.FRSW)),
    JIGGLE(EnumSet.of(SwitchingMode.PSSW, SwitchingMode.BMSW, SwitchingMode.FRSW)),
    RASTER(EnumSet.of(SwitchingMode.PSSW, SwitchingMode.FRSW));

    private final Set<SwitchingMode> switchingModes;

    MapMode(Set<SwitchingMode> switchingModes) {
        this.switchingModes = switchingModes;
    }

    public boolean allows(SwitchingMode switchingMode) {
        return switchingMode != null && switchingModes.contains(switchingMode);
    }
}
