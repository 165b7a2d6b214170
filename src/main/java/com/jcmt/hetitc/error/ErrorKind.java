package com.jcmt.hetitc.error;

public enum ErrorKind {
    /** Unsupported map/switching combination or separate-offs misuse. */
    INVALID_MODE,
    /** Sideband, polarization or frequency switching not offered by the receiver. */
    UNSUPPORTED_RECEIVER_OPTION,
    FREQUENCY_OUT_OF_RANGE,
    BELOW_MINIMUM_SAMPLE_TIME,
    BASKET_WEAVE_SPLIT_FAILED,
    /** Division by zero or square root of a negative number during the physical computation. */
    NUMERIC_DOMAIN,
    /** Missing or out-of-range request parameter, unknown receiver. */
    INVALID_PARAMETER
}
