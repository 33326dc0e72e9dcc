package com.example.cronpurge.compiler;

import java.util.regex.Pattern;

/**
 * Allow-list checks for caller supplied names that end up inside generated SQL text.
 */
final class SqlIdentifiers {

    // schema, table and column names are emitted bare or inside double quotes
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // job and database names only appear inside single-quoted literals
    private static final Pattern LITERAL_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    private SqlIdentifiers() {
    }

    static String requireIdentifier(String field, String value) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw JobCompilerException.invalidIdentifier(field, value);
        }
        return value;
    }

    static String requireLiteralName(String field, String value) {
        if (value == null || !LITERAL_NAME.matcher(value).matches()) {
            throw JobCompilerException.invalidIdentifier(field, value);
        }
        return value;
    }
}
