package org.carball.pgmaint.execution;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Identifier handling for generated maintenance statements.
 */
public final class SqlIdentifiers {

    /** PostgreSQL NAMEDATALEN - 1. */
    public static final int MAX_IDENTIFIER_BYTES = 63;

    private static final Pattern PLAIN_IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_$]*");
    private static final Pattern NAME_UNSAFE = Pattern.compile("[^a-z0-9_]+");

    private static final Set<String> RESERVED = Set.of(
            "all", "analyse", "analyze", "and", "any", "array", "as", "asc", "asymmetric", "both", "case",
            "cast", "check", "collate", "column", "constraint", "create", "current_catalog", "current_date",
            "current_role", "current_time", "current_timestamp", "current_user", "default", "deferrable",
            "desc", "distinct", "do", "else", "end", "except", "false", "fetch", "for", "foreign", "from",
            "grant", "group", "having", "in", "initially", "intersect", "into", "lateral", "leading", "limit",
            "localtime", "localtimestamp", "not", "null", "offset", "on", "only", "or", "order", "placing",
            "primary", "references", "returning", "select", "session_user", "some", "symmetric", "table",
            "then", "to", "trailing", "true", "union", "unique", "user", "using", "variadic", "when",
            "where", "window", "with");

    private SqlIdentifiers() {
    }

    /**
     * Quotes the identifier unless it is a plain lower-case name that is not a reserved word.
     */
    public static String quote(String identifier) {
        if (PLAIN_IDENTIFIER.matcher(identifier).matches() && !RESERVED.contains(identifier)) {
            return identifier;
        }
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String qualify(String schema, String name) {
        if (schema == null || schema.isBlank() || "public".equals(schema)) {
            return quote(name);
        }
        return quote(schema) + "." + quote(name);
    }

    public static String columnList(List<String> columns) {
        return String.join(", ", columns.stream().map(SqlIdentifiers::quote).toList());
    }

    /**
     * Deterministic index name {@code idx_<table>_<col>[_<col>...]}, truncated to fit the identifier limit.
     */
    public static String indexName(String table, List<String> columns) {
        StringBuilder name = new StringBuilder("idx_").append(sanitize(table));
        for (String column : columns) {
            name.append('_').append(sanitize(column));
        }
        return truncate(name.toString());
    }

    static String truncate(String identifier) {
        byte[] bytes = identifier.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= MAX_IDENTIFIER_BYTES) {
            return identifier;
        }
        StringBuilder truncated = new StringBuilder();
        int used = 0;
        for (int i = 0; i < identifier.length(); ) {
            int codePoint = identifier.codePointAt(i);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (used + width > MAX_IDENTIFIER_BYTES) {
                break;
            }
            truncated.appendCodePoint(codePoint);
            used += width;
            i += Character.charCount(codePoint);
        }
        return truncated.toString();
    }

    private static String sanitize(String part) {
        return NAME_UNSAFE.matcher(part.toLowerCase(Locale.ROOT)).replaceAll("_");
    }
}
