package com.schemareverse.core.parser;

import java.util.List;
import java.util.Map;

/**
 * Strategy interface implemented once per {@link ConstructKind}.
 *
 * <p>A parser looks at the full text of a function or procedure body and extracts the
 * steps of its own construct only. Parsers are self-contained: none depends on another.
 *
 * <p><b>Contract:</b>
 * <ul>
 *   <li>{@link #parse(String)} returns an empty list when the construct is absent</li>
 *   <li>it throws {@link ConstructParseException} when the construct is present but
 *       cannot be interpreted; no other exception may escape</li>
 *   <li>{@link #describe(String, List)} reports at least one discriminating fact the
 *       coordinator uses for confidence tuning</li>
 * </ul>
 *
 * @see com.schemareverse.core.parser.base.AbstractConstructParser
 * @see ParserCoordinator
 * @since 1.0.0
 */
public interface ConstructParser {

    /**
     * Returns the construct this parser handles.
     *
     * @return construct kind
     */
    ConstructKind getKind();

    /**
     * Extracts the construct's steps.
     *
     * @param text function or procedure body (a full CREATE FUNCTION statement is accepted)
     * @return ordered steps, empty if the construct is absent
     * @throws ConstructParseException if the construct cannot be interpreted
     */
    List<ConstructStep> parse(String text) throws ConstructParseException;

    /**
     * Computes metadata for a successful parse.
     *
     * @param text the text that was parsed
     * @param steps the steps {@link #parse(String)} returned
     * @return string-keyed facts; values are Boolean, Integer, String or List of String
     */
    Map<String, Object> describe(String text, List<ConstructStep> steps);
}
