package io.specrouter.core.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class LaxTemporalParsersTest {

    @Test
    void secondsTimestampAtMidnight() {
        assertThat(LaxTemporalParsers.parseDate(LongNode.valueOf(1_757_548_800L))).isEqualTo(LocalDate.of(2025, 9, 11));
    }

    @Test
    void millisecondsTimestampAtMidnight() {
        assertThat(LaxTemporalParsers.parseDate(TextNode.valueOf("1757548800000"))).isEqualTo(LocalDate.of(2025, 9, 11));
    }

    @Test
    void timestampOffMidnightIsInexact() {
        assertThatThrownBy(() -> LaxTemporalParsers.parseDate(LongNode.valueOf(1_757_548_801L)))
                .isInstanceOfSatisfying(
                        TemporalFormatException.class,
                        e -> assertThat(e.type()).isEqualTo("date_from_datetime_inexact"));
    }

    @Test
    void shortTextRejected() {
        assertThatThrownBy(() -> LaxTemporalParsers.parseDate(TextNode.valueOf("2025-1-1")))
                .isInstanceOfSatisfying(TemporalFormatException.class, e -> {
                    assertThat(e.type()).isEqualTo("date_from_datetime_parsing");
                    assertThat(e.ctx()).containsEntry("error", "input is too short");
                });
    }

    @Test
    void booleanIsNotADate() {
        assertThatThrownBy(() -> LaxTemporalParsers.parseDate(BooleanNode.TRUE))
                .isInstanceOfSatisfying(TemporalFormatException.class, e -> assertThat(e.type()).isEqualTo("date_type"));
    }

    @Test
    void naiveDateTimeStaysNaive() {
        assertThat(LaxTemporalParsers.parseDateTime(TextNode.valueOf("2025-01-01 08:30")))
                .isEqualTo(LocalDateTime.of(2025, 1, 1, 8, 30));
    }

    @Test
    void compactOffsetAccepted() {
        assertThat(LaxTemporalParsers.parseDateTime(TextNode.valueOf("2025-01-01T08:30:00+0200")))
                .isEqualTo(OffsetDateTime.of(2025, 1, 1, 8, 30, 0, 0, ZoneOffset.ofHours(2)));
    }

    @Test
    void timestampIsUtc() {
        assertThat(LaxTemporalParsers.parseDateTime(LongNode.valueOf(0L)))
                .isEqualTo(OffsetDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC));
    }

    @Test
    void dateOnlyIsStartOfDay() {
        assertThat(LaxTemporalParsers.parseDateTime(TextNode.valueOf("2025-01-01")))
                .isEqualTo(LocalDateTime.of(2025, 1, 1, 0, 0));
    }

    @Test
    void invalidTextRejected() {
        assertThatThrownBy(() -> LaxTemporalParsers.parseDateTime(TextNode.valueOf("2025-01-01T10:61:00Z")))
                .isInstanceOfSatisfying(
                        TemporalFormatException.class,
                        e -> assertThat(e.type()).isEqualTo("datetime_from_date_parsing"));
    }
}
