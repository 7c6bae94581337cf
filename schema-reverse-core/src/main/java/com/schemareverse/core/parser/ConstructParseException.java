package com.schemareverse.core.parser;

import java.util.Objects;

/**
 * Raised by a construct parser that cannot interpret its construct.
 *
 * <p>The coordinator converts every instance into a failed {@link ParserResult};
 * it never reaches the coordinator's callers.
 *
 * @since 1.0.0
 */
public class ConstructParseException extends Exception {

    private final ConstructKind construct;
    private final ParseErrorKind errorKind;

    public ConstructParseException(ConstructKind construct, ParseErrorKind errorKind, String message) {
        this(construct, errorKind, message, null);
    }

    public ConstructParseException(ConstructKind construct, ParseErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.construct = Objects.requireNonNull(construct, "construct must not be null");
        this.errorKind = Objects.requireNonNull(errorKind, "errorKind must not be null");
    }

    public ConstructKind getConstruct() {
        return construct;
    }

    public ParseErrorKind getErrorKind() {
        return errorKind;
    }
}
