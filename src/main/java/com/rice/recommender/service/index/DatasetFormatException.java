package com.rice.recommender.service.index;

/** The recipe dataset cannot be read into recipes (missing columns, unreadable file). */
public class DatasetFormatException extends RuntimeException {
    public DatasetFormatException(String message) {
        super(message);
    }

    public DatasetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
