package org.carball.pgmaint.execution;

import org.junit.jupiter.api.Test;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RowsTest {

    private static Map<String, Object> row(String column, Object value) {
        Map<String, Object> row = new HashMap<>();
        row.put(column, value);
        return row;
    }

    @Test
    void shouldReadNullCountersAsZero() {
        assertThat(Rows.longValue(row("n_dead_tup", null), "n_dead_tup")).isZero();
        assertThat(Rows.longValue(row("n_dead_tup", 42), "n_dead_tup")).isEqualTo(42L);
        assertThat(Rows.longValue(row("n_dead_tup", " 17 "), "n_dead_tup")).isEqualTo(17L);
        assertThat(Rows.doubleValue(row("mean_ms", "1500.5"), "mean_ms")).isEqualTo(1500.5);
    }

    @Test
    void shouldNameColumnWhenValueIsNotNumeric() {
        assertThatThrownBy(() -> Rows.longValue(row("idx_scan", "many"), "idx_scan"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("idx_scan");
    }

    @Test
    void shouldRequireNonNullStrings() {
        assertThat(Rows.string(row("table_name", null), "table_name")).isNull();
        assertThatThrownBy(() -> Rows.requiredString(row("table_name", null), "table_name"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Column 'table_name' is null");
    }

    @Test
    void shouldAcceptPostgresBooleanText() {
        assertThat(Rows.bool(row("indisunique", "t"), "indisunique")).isTrue();
        assertThat(Rows.bool(row("indisunique", "f"), "indisunique")).isFalse();
        assertThat(Rows.bool(row("indisunique", Boolean.TRUE), "indisunique")).isTrue();
        assertThatThrownBy(() -> Rows.bool(row("indisunique", "maybe"), "indisunique"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldReadBooleanTextIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertThat(Rows.bool(row("indisprimary", "TRUE"), "indisprimary")).isTrue();
            assertThat(Rows.bool(row("indisprimary", "NO"), "indisprimary")).isFalse();
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void shouldReadTimestampsAsUtc() {
        Timestamp timestamp = Timestamp.from(Instant.parse("2024-05-01T10:15:30Z"));

        assertThat(Rows.timestamp(row("last_vacuum", timestamp), "last_vacuum"))
                .isEqualTo(OffsetDateTime.of(2024, 5, 1, 10, 15, 30, 0, ZoneOffset.UTC));
        assertThat(Rows.timestamp(row("last_vacuum", null), "last_vacuum")).isNull();
    }

    @Test
    void shouldReadArrayColumnsInEveryShape() {
        assertThat(Rows.stringList(row("columns", List.of("a", "b")), "columns")).containsExactly("a", "b");
        assertThat(Rows.stringList(row("columns", new String[]{"a"}), "columns")).containsExactly("a");
        assertThat(Rows.stringList(row("columns", "{tenant_id,\"Created At\"}"), "columns"))
                .containsExactly("tenant_id", "Created At");
        assertThat(Rows.stringList(row("columns", "{}"), "columns")).isEmpty();
        assertThat(Rows.stringList(row("columns", null), "columns")).isEmpty();
    }
}
