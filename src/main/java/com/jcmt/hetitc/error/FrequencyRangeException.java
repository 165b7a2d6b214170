package com.jcmt.hetitc.error;

import lombok.Getter;

import java.util.Locale;

@Getter
public class FrequencyRangeException extends HeterodyneItcException {

    private final String what;
    private final double value;
    private final double min;
    private final double max;

    public FrequencyRangeException(String what, double value, double min, double max) {
        super(ErrorKind.FREQUENCY_OUT_OF_RANGE, String.format(Locale.ROOT,
                "The %s (%.3f GHz) is not within the available range (%.1f - %.1f GHz).",
                what, value, min, max));
        this.what = what;
        this.value = value;
        this.min = min;
        this.max = max;
    }
}
