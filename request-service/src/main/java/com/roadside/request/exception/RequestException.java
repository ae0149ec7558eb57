package com.roadside.request.exception;

public class RequestException extends RuntimeException {

    public static final String REQUEST_NOT_FOUND = "REQUEST_NOT_FOUND";
    public static final String NOT_A_PARTY = "NOT_A_PARTY";
    public static final String REQUEST_BUSY = "REQUEST_BUSY";
    public static final String SERVICE_UNAVAILABLE = "SERVICE_UNAVAILABLE";
    public static final String ACTIVE_REQUEST_EXISTS = "ACTIVE_REQUEST_EXISTS";
    public static final String PROVIDER_BUSY = "PROVIDER_BUSY";
    public static final String PAYMENT_ATTEMPT_NOT_FOUND = "PAYMENT_ATTEMPT_NOT_FOUND";

    private final String code;

    public RequestException(String code, String message) {
        super(message);
        this.code = code;
    }

    public RequestException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
