package com.jcmt.hetitc.domain;

public enum Sideband {
    LSB,
    USB;

    public Sideband other() {
        return this == LSB ? USB : LSB;
    }
}
