package com.baykanat.insider.analytics.domain.exception;

/** Hatalı, belirsiz veya tanınmayan istek parametresi; 400 döner, sorgu inşasına ulaşmaz. */
public class InvalidParameterException extends RuntimeException {

    private final String field;

    public InvalidParameterException(String field, String message) {
        super(message);
        this.field = field;
    }

    public InvalidParameterException(String field, String message, Throwable cause) {
        super(message, cause);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
