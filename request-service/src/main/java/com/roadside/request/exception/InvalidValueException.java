package com.roadside.request.exception;

public class InvalidValueException extends RequestException {

    public static final String CODE = "INVALID_VALUE";

    public InvalidValueException(String message) {
        super(CODE, message);
    }
}
