package com.jcmt.hetitc.error;

import lombok.Getter;

import java.util.Locale;

/**
 * Integration time per point under the sampling floor.
 * {@code origin} names the input that led to it, or is null when the
 * integration time itself was requested.
 */
@Getter
public class MinimumSampleTimeException extends HeterodyneItcException {

    private final String origin;
    private final double intTime;
    private final double minimum;
    private final boolean basketWeave;

    public MinimumSampleTimeException(String origin, double intTime, double minimum, boolean basketWeave) {
        super(ErrorKind.BELOW_MINIMUM_SAMPLE_TIME, message(origin, intTime, minimum, basketWeave));
        this.origin = origin;
        this.intTime = intTime;
        this.minimum = minimum;
        this.basketWeave = basketWeave;
    }

    private static String message(String origin, double intTime, double minimum, boolean basketWeave) {
        String text = (origin == null)
                ? String.format(Locale.ROOT,
                        "The requested integration time per point is less than the minimum (%.1f s).",
                        minimum)
                : String.format(Locale.ROOT,
                        "The %s led to an integration time per point of %.3f s, which is less than the minimum (%.1f s).",
                        origin, intTime, minimum);
        if (basketWeave) {
            text += " The minimum is doubled when basket weaving, as each scan direction gets roughly half of the points.";
        }
        return text;
    }
}
