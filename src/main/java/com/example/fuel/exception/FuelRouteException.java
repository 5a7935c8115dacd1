package com.example.fuel.exception;

import lombok.Getter;

import java.util.Objects;

/**
 * Request-level failure with a deterministic reason code.
 *
 * <p>Messages are prefixed with the reason code, for example
 * {@code [GEOCODE_NOT_FOUND] Could not geocode start location: Nowhere}.</p>
 */
@Getter
public class FuelRouteException extends RuntimeException {
    private final String reasonCode;

    public FuelRouteException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    public FuelRouteException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = requireReasonCode(reasonCode);
    }

    /**
     * Message without the reason-code prefix, as shown to API clients.
     */
    public String getDetail() {
        String message = getMessage();
        int close = message.indexOf("] ");
        return close < 0 ? message : message.substring(close + 2);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
