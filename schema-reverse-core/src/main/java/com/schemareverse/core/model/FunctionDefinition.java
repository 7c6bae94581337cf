package com.schemareverse.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A parsed {@code CREATE FUNCTION} or {@code CREATE PROCEDURE} statement.
 *
 * @param schema schema name ({@code public} when unqualified)
 * @param name routine name
 * @param procedure true for procedures
 * @param parameters parameter declarations as written (e.g. {@code p_email TEXT})
 * @param returnType declared return type, null for procedures
 * @param language routine language in lower case (e.g. {@code plpgsql})
 * @param body dollar-quoted body
 *
 * @since 1.0.0
 */
public record FunctionDefinition(
    String schema,
    String name,
    boolean procedure,
    List<String> parameters,
    String returnType,
    String language,
    String body
) {
    /**
     * Compact constructor with validation.
     */
    public FunctionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(body, "body must not be null");
        if (schema == null || schema.isBlank()) {
            schema = "public";
        }
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
    }

    public String qualifiedName() {
        return schema + "." + name;
    }
}
