package com.schemareverse.core.ddl;

import com.schemareverse.core.model.FunctionDefinition;
import com.schemareverse.core.util.SqlText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for {@code CREATE [OR REPLACE] FUNCTION|PROCEDURE} statements.
 *
 * <p>The body is the dollar-quoted section ({@code $$ ... $$} or {@code $tag$ ... $tag$});
 * a single-quoted body ({@code AS '...'}) is accepted as well. The return type and
 * language are read from the text outside the body.
 *
 * @since 1.0.0
 */
public class FunctionDefinitionParser {

    private static final Logger log = LoggerFactory.getLogger(FunctionDefinitionParser.class);

    private static final Pattern HEADER = Pattern.compile(
        "^\\s*CREATE\\s+(?:OR\\s+REPLACE\\s+)?(FUNCTION|PROCEDURE)\\s+(?:(\"?)(\\w+)\\2\\.)?(\"?)(\\w+)\\4\\s*\\(",
        Pattern.CASE_INSENSITIVE);
    private static final Pattern DOLLAR_TAG = Pattern.compile("\\$(?:[A-Za-z_][A-Za-z0-9_]*)?\\$");
    private static final Pattern RETURNS = Pattern.compile(
        "\\s*RETURNS\\s+(.+?)(?=\\s+(?:AS|LANGUAGE|IMMUTABLE|STABLE|VOLATILE|SECURITY|STRICT|CALLED|PARALLEL|"
            + "COST|ROWS|SET|LEAKPROOF|WINDOW)\\b|\\s*$)",
        Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern LANGUAGE = Pattern.compile("\\bLANGUAGE\\s+'?(\\w+)'?", Pattern.CASE_INSENSITIVE);
    private static final Pattern QUOTED_BODY = Pattern.compile("\\bAS\\s+(?=')", Pattern.CASE_INSENSITIVE);

    /**
     * Parses a routine definition.
     *
     * @param sql statement text
     * @return parsed routine
     * @throws DdlParseException if the text is not a CREATE FUNCTION/PROCEDURE statement or has no body
     */
    public FunctionDefinition parse(String sql) throws DdlParseException {
        if (sql == null || sql.isBlank()) {
            throw new DdlParseException("Empty statement");
        }
        String masked = SqlText.mask(sql);
        Matcher header = HEADER.matcher(masked);
        if (!header.find()) {
            throw new DdlParseException("Not a CREATE FUNCTION or CREATE PROCEDURE statement: "
                + SqlText.squash(sql.substring(0, Math.min(sql.length(), 60))));
        }
        boolean procedure = "PROCEDURE".equalsIgnoreCase(header.group(1));
        String schema = header.group(3);
        String name = header.group(5);

        int open = header.end() - 1;
        int close = SqlText.findClosingParen(sql, open);
        if (close < 0) {
            throw new DdlParseException("Unbalanced parameter list in " + name);
        }
        List<String> parameters = SqlText.splitTopLevel(sql.substring(open + 1, close)).stream()
            .map(SqlText::squash)
            .toList();

        int bodyStart;
        int bodyEnd;
        String body;
        Matcher tag = DOLLAR_TAG.matcher(masked);
        if (tag.find(close)) {
            int closing = masked.indexOf(tag.group(), tag.end());
            if (closing < 0) {
                throw new DdlParseException("Unterminated body in " + name);
            }
            bodyStart = tag.start();
            bodyEnd = closing + tag.group().length();
            body = sql.substring(tag.end(), closing);
        } else {
            Matcher quoted = QUOTED_BODY.matcher(sql);
            Optional<String> literal = quoted.find(close)
                ? SqlText.literalAt(sql, quoted.end())
                : Optional.empty();
            if (literal.isEmpty()) {
                throw new DdlParseException("Routine " + name + " has no body");
            }
            bodyStart = quoted.end();
            bodyEnd = SqlText.literalEnd(sql, bodyStart);
            body = literal.get();
        }

        String outside = sql.substring(close + 1, bodyStart) + " " + sql.substring(bodyEnd);
        String returnType = null;
        Matcher returns = RETURNS.matcher(outside);
        if (!procedure && returns.lookingAt()) {
            returnType = SqlText.squash(returns.group(1));
        }
        Matcher language = LANGUAGE.matcher(outside);
        String lang = language.find() ? language.group(1).toLowerCase(Locale.ROOT) : "sql";

        log.debug("Parsed {} {} ({} parameter(s), language {})",
            procedure ? "procedure" : "function", name, parameters.size(), lang);
        return new FunctionDefinition(schema, name, procedure, parameters, returnType, lang, body);
    }
}
