package com.jcmt.hetitc.error;

import lombok.Getter;

/** Recoverable calculation failure with a user-facing message. */
@Getter
public class HeterodyneItcException extends RuntimeException {

    private final ErrorKind kind;

    public HeterodyneItcException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
