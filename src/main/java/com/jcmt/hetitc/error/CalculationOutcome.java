package com.jcmt.hetitc.error;

import com.jcmt.hetitc.domain.CalculationResult;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Result of a calculation at the engine boundary: either a {@link CalculationResult}
 * or an {@link ErrorKind} with its message.
 */
@ToString
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class CalculationOutcome {

    private final CalculationResult result;
    private final ErrorKind errorKind;
    private final String message;

    public static CalculationOutcome success(CalculationResult result) {
        return new CalculationOutcome(result, null, null);
    }

    public static CalculationOutcome failure(ErrorKind kind, String message) {
        return new CalculationOutcome(null, kind, message);
    }

    public boolean isSuccess() {
        return result != null;
    }

    public CalculationResult getResult() {
        if (result == null) throw new IllegalStateException("No result: " + errorKind + " " + message);
        return result;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    public String getMessage() {
        return message;
    }

    /** Unwraps the result, re-raising a failure as {@link HeterodyneItcException}. */
    public CalculationResult orElseThrow() {
        if (result == null) throw new HeterodyneItcException(errorKind, message);
        return result;
    }
}
