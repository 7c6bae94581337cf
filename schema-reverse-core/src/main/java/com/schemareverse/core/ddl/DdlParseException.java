package com.schemareverse.core.ddl;

/**
 * Raised when a DDL statement is malformed.
 *
 * <p>The engine excludes the offending statement and keeps going.
 *
 * @since 1.0.0
 */
public class DdlParseException extends Exception {

    public DdlParseException(String message) {
        super(message);
    }

    public DdlParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
