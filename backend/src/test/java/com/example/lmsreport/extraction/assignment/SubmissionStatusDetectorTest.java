package com.example.lmsreport.extraction.assignment;

import com.example.lmsreport.date.DueDateNormalizer;
import com.example.lmsreport.dto.SubmissionStatus;
import com.example.lmsreport.profile.PortalProfile;
import com.example.lmsreport.profile.PortalProfileLoader;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SubmissionStatusDetectorTest {

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-12T09:00:00Z"), ZoneOffset.UTC);
    private final SubmissionStatusDetector detector = new SubmissionStatusDetector(
            new DueDateNormalizer(clock), clock,
            List.of("entregado", "submitted", "✓"),
            List.of("not submitted", "no submission", "sin entregar"),
            List.of("(\\d{1,2}/\\d{1,2}/\\d{4})", "(\\d{4}-\\d{1,2}-\\d{1,2})"));

    @Test
    void detect_submittedWithDate() {
        SubmissionStatus status = detector.detect("Submitted for grading on 10/03/2026");

        assertThat(status.submitted()).isTrue();
        assertThat(status.daysAgo()).isEqualTo(2);
        assertThat(status.statusText()).contains("submitted");
    }

    @Test
    void detect_submittedWithoutDateHasUnknownDaysAgo() {
        SubmissionStatus status = detector.detect("Estado: Entregado ✓");

        assertThat(status.submitted()).isTrue();
        assertThat(status.daysAgo()).isNull();
    }

    @Test
    void detect_negativePhraseWins() {
        assertThat(detector.detect("Submission status: Not submitted").submitted()).isFalse();
        assertThat(detector.detect("Sin entregar").submitted()).isFalse();
    }

    @Test
    void detect_futureSubmissionDateIsUnknown() {
        assertThat(detector.detect("submitted 2026-03-20").daysAgo()).isNull();
    }

    @Test
    void detect_blankTextIsNotSubmitted() {
        assertThat(detector.detect("")).isEqualTo(SubmissionStatus.notSubmitted());
        assertThat(detector.detect(null)).isEqualTo(SubmissionStatus.notSubmitted());
    }

    @Test
    void detect_dueDateIsNotTakenAsSubmissionDate() {
        Clock octoberClock = Clock.fixed(Instant.parse("2026-10-18T09:00:00Z"), ZoneOffset.UTC);
        PortalProfile.SubmissionProfile submission = new PortalProfileLoader().load("moodle_default").submission();
        SubmissionStatusDetector moodleDetector = new SubmissionStatusDetector(
                new DueDateNormalizer(octoberClock), octoberClock,
                submission.indicators(), submission.negativeIndicators(), submission.datePatterns());

        SubmissionStatus undated = moodleDetector.detect("Ensayo final Entregado Due: 2026-10-15");
        SubmissionStatus dated = moodleDetector.detect("Ensayo final Entregado el 2026-10-16. Due: 2026-10-15");

        assertThat(undated.submitted()).isTrue();
        assertThat(undated.daysAgo()).isNull();
        assertThat(dated.daysAgo()).isEqualTo(2);
    }

    @Test
    void defaultSubmissionPatternsRequireSubmissionKeyword() {
        PortalProfile.SubmissionProfile defaults = new PortalProfile.SubmissionProfile(null, null, null);
        SubmissionStatusDetector defaultDetector = new SubmissionStatusDetector(
                new DueDateNormalizer(clock), clock,
                defaults.indicators(), defaults.negativeIndicators(), defaults.datePatterns());

        assertThat(defaultDetector.detect("✓ Closes 2026-03-11").daysAgo()).isNull();
        assertThat(defaultDetector.detect("Submitted 11/03/2026").daysAgo()).isEqualTo(1);
    }
}
