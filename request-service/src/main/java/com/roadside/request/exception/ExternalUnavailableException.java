package com.roadside.request.exception;

/**
 * GeoIndex or payment gateway could not be reached. Callers decide whether to keep waiting.
 */
public class ExternalUnavailableException extends RequestException {

    public static final String CODE = "EXTERNAL_UNAVAILABLE";

    public ExternalUnavailableException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
