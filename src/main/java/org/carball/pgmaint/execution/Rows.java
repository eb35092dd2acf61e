package org.carball.pgmaint.execution;

import java.sql.Timestamp;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed access to the column maps returned by {@link SqlExecutor#queryForList}.
 * Values of an unexpected type raise {@link IllegalArgumentException} naming the column.
 */
public final class Rows {

    private Rows() {
    }

    public static String string(Map<String, Object> row, String column) {
        Object value = row.get(column);
        return value == null ? null : value.toString();
    }

    public static String requiredString(Map<String, Object> row, String column) {
        String value = string(row, column);
        if (value == null) {
            throw new IllegalArgumentException("Column '" + column + "' is null");
        }
        return value;
    }

    /**
     * Numeric column as long; SQL NULL reads as 0, the way unset statistics counters behave.
     */
    public static long longValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Column '" + column + "' is not numeric: " + value, e);
        }
    }

    public static double doubleValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return 0d;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Column '" + column + "' is not numeric: " + value, e);
        }
    }

    public static boolean bool(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean flag) {
            return flag;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "t", "true", "1", "y", "yes" -> true;
            case "f", "false", "0", "n", "no" -> false;
            default -> throw new IllegalArgumentException("Column '" + column + "' is not boolean: " + value);
        };
    }

    public static OffsetDateTime timestamp(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof OffsetDateTime dateTime) {
            return dateTime;
        }
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant().atOffset(ZoneOffset.UTC);
        }
        try {
            return OffsetDateTime.parse(value.toString());
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Column '" + column + "' is not a timestamp: " + value, e);
        }
    }

    /**
     * Array column as a list of strings. Accepts a converted list, a Java array or PostgreSQL's text form {@code {a,b}}.
     */
    public static List<String> stringList(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> collection) {
            List<String> values = new ArrayList<>(collection.size());
            collection.forEach(element -> values.add(String.valueOf(element)));
            return values;
        }
        if (value instanceof Object[] array) {
            return Arrays.stream(array).map(String::valueOf).toList();
        }
        String text = value.toString().trim();
        if (text.startsWith("{") && text.endsWith("}")) {
            String body = text.substring(1, text.length() - 1);
            if (body.isBlank()) {
                return List.of();
            }
            return Arrays.stream(body.split(","))
                    .map(element -> element.trim().replaceAll("^\"|\"$", ""))
                    .toList();
        }
        throw new IllegalArgumentException("Column '" + column + "' is not an array: " + value);
    }
}
