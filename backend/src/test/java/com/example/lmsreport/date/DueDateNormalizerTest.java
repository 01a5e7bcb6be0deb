package com.example.lmsreport.date;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class DueDateNormalizerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final DueDateNormalizer normalizer = new DueDateNormalizer(clock);

    @Test
    void normalize_dayFirstNumericDate() {
        assertThat(normalizer.normalize("15/03/2026")).contains(LocalDate.of(2026, 3, 15));
        assertThat(normalizer.normalize("15-03-2026")).contains(LocalDate.of(2026, 3, 15));
    }

    @Test
    void normalize_twoDigitYearUsesPivot() {
        assertThat(normalizer.normalize("15/03/26")).contains(LocalDate.of(2026, 3, 15));
        // 1900年代に展開されるため範囲外
        assertThat(normalizer.normalize("15/03/99")).isEmpty();
    }

    @Test
    void normalize_monthNameForms() {
        assertThat(normalizer.normalize("March 15, 2026")).contains(LocalDate.of(2026, 3, 15));
        assertThat(normalizer.normalize("15 de marzo de 2026")).contains(LocalDate.of(2026, 3, 15));
        assertThat(normalizer.normalize("Due: Tuesday, 17 March 2026, 11:59 PM")).contains(LocalDate.of(2026, 3, 17));
    }

    @Test
    void normalize_extractsDateFromSurroundingText() {
        assertThat(normalizer.normalize("Cierre: 2026-04-02 23:59")).contains(LocalDate.of(2026, 4, 2));
        assertThat(normalizer.normalize("vence el 02/04/2026 a las 23:59")).contains(LocalDate.of(2026, 4, 2));
    }

    @Test
    void normalize_roundTripsCanonicalRenderings() {
        List<DateTimeFormatter> renderings = List.of(
                DateTimeFormatter.ISO_LOCAL_DATE,
                DateTimeFormatter.ofPattern("dd/MM/uuuu"),
                DateTimeFormatter.ofPattern("d-M-uuuu"),
                DateTimeFormatter.ofPattern("MMMM d, uuuu", Locale.ENGLISH),
                DateTimeFormatter.ofPattern("d MMMM uuuu", Locale.ENGLISH));
        List<LocalDate> dates = List.of(
                LocalDate.of(2020, 1, 1), LocalDate.of(2024, 2, 29), LocalDate.of(2026, 3, 5),
                LocalDate.of(2026, 12, 31), LocalDate.of(2028, 7, 14));

        for (DateTimeFormatter rendering : renderings) {
            for (LocalDate date : dates) {
                assertThat(normalizer.normalize(date.format(rendering)))
                        .as("%s", date.format(rendering))
                        .contains(date);
            }
        }
    }

    @Test
    void normalize_rejectsUnsetSentinelAnywhereInText() {
        assertThat(normalizer.normalize("1969-12-31")).isEmpty();
        assertThat(normalizer.normalize("Due: 31/12/1969 21:00")).isEmpty();
        assertThat(normalizer.normalize("31-12-1969")).isEmpty();
    }

    @Test
    void normalize_rejectsYearsOutsideRange() {
        assertThat(normalizer.normalize("2019-12-31")).isEmpty();
        assertThat(normalizer.normalize("2029-01-01")).isEmpty();
        assertThat(normalizer.normalize("2028-12-31")).contains(LocalDate.of(2028, 12, 31));
    }

    @Test
    void normalize_skipsOutOfRangeCandidateAndKeepsLooking() {
        assertThat(normalizer.normalize("opened 2015-01-01, due 2026-03-20")).contains(LocalDate.of(2026, 3, 20));
    }

    @Test
    void normalize_returnsEmptyForGarbage() {
        assertThat(normalizer.normalize(null)).isEmpty();
        assertThat(normalizer.normalize("   ")).isEmpty();
        assertThat(normalizer.normalize("no due date")).isEmpty();
        assertThat(normalizer.normalize("31/02/2026")).isEmpty();
    }

    @Test
    void extractDateFromText_returnsFirstGroupOfFirstMatchingPattern() {
        List<String> patterns = List.of("due[:\\s]+(\\d{1,2}/\\d{1,2}/\\d{4})", "\\d{4}-\\d{2}-\\d{2}");

        assertThat(DueDateNormalizer.extractDateFromText("Quiz 1 DUE: 20/03/2026 23:59", patterns)).contains("20/03/2026");
        assertThat(DueDateNormalizer.extractDateFromText("closes 2026-03-20", patterns)).contains("2026-03-20");
        assertThat(DueDateNormalizer.extractDateFromText("nothing here", patterns)).isEmpty();
    }

    @Test
    void extractDateFromText_skipsInvalidPattern() {
        assertThat(DueDateNormalizer.extractDateFromText("2026-03-20", List.of("([", "(\\d{4}-\\d{2}-\\d{2})")))
                .contains("2026-03-20");
    }
}
