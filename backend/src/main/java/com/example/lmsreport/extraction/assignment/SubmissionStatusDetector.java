package com.example.lmsreport.extraction.assignment;

import com.example.lmsreport.date.DueDateNormalizer;
import com.example.lmsreport.dto.SubmissionStatus;

import java.time.Clock;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * 活動リンク周辺のテキストから提出済みかどうかと提出日を判定する。
 * 「未提出」を表す否定表現が含まれる場合は、提出済みの語があっても未提出とみなす。
 */
public class SubmissionStatusDetector {

    private final DueDateNormalizer normalizer;
    private final Clock clock;
    private final List<String> indicators;
    private final List<String> negativeIndicators;
    private final List<String> datePatterns;

    public SubmissionStatusDetector(DueDateNormalizer normalizer, Clock clock, List<String> indicators,
                                    List<String> negativeIndicators, List<String> datePatterns) {
        this.normalizer = normalizer;
        this.clock = clock;
        this.indicators = lower(indicators);
        this.negativeIndicators = lower(negativeIndicators);
        this.datePatterns = List.copyOf(datePatterns);
    }

    public SubmissionStatus detect(String surroundingText) {
        if (surroundingText == null || surroundingText.isBlank()) {
            return SubmissionStatus.notSubmitted();
        }
        String lower = surroundingText.toLowerCase(Locale.ROOT);
        if (negativeIndicators.stream().anyMatch(lower::contains)) {
            return SubmissionStatus.notSubmitted();
        }
        Optional<String> matched = indicators.stream().filter(lower::contains).findFirst();
        if (matched.isEmpty()) {
            return SubmissionStatus.notSubmitted();
        }
        Integer daysAgo = DueDateNormalizer.extractDateFromText(surroundingText, datePatterns)
                .flatMap(normalizer::normalize)
                .map(this::daysSince)
                .orElse(null);
        return new SubmissionStatus(true, "Submitted (" + matched.get() + ")", daysAgo);
    }

    // 未来日付は提出日として不正なので不明扱い
    private Integer daysSince(LocalDate submittedOn) {
        long days = ChronoUnit.DAYS.between(submittedOn, LocalDate.now(clock));
        return days < 0 ? null : (int) days;
    }

    private static List<String> lower(List<String> values) {
        return values.stream().map(v -> v.toLowerCase(Locale.ROOT)).toList();
    }
}
