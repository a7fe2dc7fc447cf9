package com.example.routereport.util;

/**
 * A report request that cannot be rendered as submitted. The message is safe
 * to return to the caller.
 */
public class ReportRequestException extends RuntimeException {

    public ReportRequestException(String message) {
        super(message);
    }

    public ReportRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
