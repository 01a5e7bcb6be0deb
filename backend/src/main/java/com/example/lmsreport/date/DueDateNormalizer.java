package com.example.lmsreport.date;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.format.TextStyle;
import java.time.temporal.ChronoField;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 自由形式の日付文字列を LocalDate に正規化するクラス。
 * 判定順: 未設定値(1969-12-31)の除外 → 完全一致フォーマット → 正規表現による部分抽出。
 * どの候補も年の範囲チェック (2020 〜 今年+2) を通過しなければ空を返す。
 */
@Component
public class DueDateNormalizer {

    private static final Logger log = LoggerFactory.getLogger(DueDateNormalizer.class);

    static final int MIN_YEAR = 2020;
    private static final int YEARS_AHEAD = 2;
    private static final int TWO_DIGIT_YEAR_BASE = 1950;

    // エポック0がUTC-xxで表示された値。元システムの「未設定」を意味する
    private static final List<String> UNSET_SENTINELS = List.of(
            "1969-12-31", "31-12-1969", "31/12/1969", "12/31/1969"
    );

    private static final Locale SPANISH = Locale.forLanguageTag("es");

    private static final List<DateTimeFormatter> EXACT_FORMATS = List.of(
            strict("uuuu-M-d", Locale.ROOT),
            strict("d/M/uuuu", Locale.ROOT),
            strict("d-M-uuuu", Locale.ROOT),
            twoDigitYear("/"),
            twoDigitYear("-"),
            strict("MMMM d, uuuu", Locale.ENGLISH),
            strict("MMM d, uuuu", Locale.ENGLISH),
            strict("d MMMM uuuu", Locale.ENGLISH),
            strict("d 'de' MMMM 'de' uuuu", SPANISH),
            strict("uuuu/M/d", Locale.ROOT),
            strict("uuuu年M月d日", Locale.JAPANESE),
            strict("uuuu-MM-dd HH:mm:ss", Locale.ROOT),
            strict("d/M/uuuu HH:mm", Locale.ROOT)
    );

    private static final List<Pattern> YEAR_FIRST = List.of(
            Pattern.compile("(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?!\\d)")
    );

    private static final List<Pattern> DAY_FIRST = List.of(
            Pattern.compile("(?<!\\d)(\\d{1,2})/(\\d{1,2})/(\\d{4})(?!\\d)"),
            Pattern.compile("(?<!\\d)(\\d{1,2})-(\\d{1,2})-(\\d{4})(?!\\d)"),
            Pattern.compile("(?<!\\d)(\\d{1,2})/(\\d{1,2})/(\\d{2})(?!\\d)"),
            Pattern.compile("(?<!\\d)(\\d{1,2})-(\\d{1,2})-(\\d{2})(?!\\d)")
    );

    // "Tuesday, 17 March 2026, 11:59 PM" のように文中に埋め込まれた月名表記
    private static final Pattern DAY_MONTH_NAME_YEAR = Pattern.compile(
            "(?<!\\d)(\\d{1,2})\\s+(?:de\\s+)?(\\p{L}+)\\.?,?\\s+(?:de\\s+)?(\\d{4})(?!\\d)");
    private static final Pattern MONTH_NAME_DAY_YEAR = Pattern.compile(
            "(\\p{L}+)\\.?\\s+(\\d{1,2}),?\\s+(\\d{4})(?!\\d)");

    private static final Map<String, Integer> MONTH_NAMES = buildMonthNames();

    private final Clock clock;

    public DueDateNormalizer(Clock clock) {
        this.clock = clock;
    }

    /**
     * 日付文字列を正規化します。前後に他の語を含んでいても構いません。
     * @param text 任意のテキスト
     * @return 範囲内の日付。解析できない場合は空 (例外は投げない)
     */
    public Optional<LocalDate> normalize(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String cleaned = text.replace('　', ' ').trim();
        if (containsUnsetSentinel(cleaned)) {
            log.debug("未設定の日付値のため除外します: {}", text);
            return Optional.empty();
        }

        for (DateTimeFormatter formatter : EXACT_FORMATS) {
            try {
                LocalDate parsed = formatter.parse(cleaned, LocalDate::from);
                if (isInRange(parsed)) {
                    return Optional.of(parsed);
                }
            } catch (DateTimeParseException ignored) {
                // 次のフォーマットを試す
            }
        }

        for (Pattern pattern : YEAR_FIRST) {
            Matcher m = pattern.matcher(cleaned);
            while (m.find()) {
                Optional<LocalDate> candidate = toDate(m.group(1), m.group(2), m.group(3));
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
        }
        for (Pattern pattern : DAY_FIRST) {
            Matcher m = pattern.matcher(cleaned);
            while (m.find()) {
                Optional<LocalDate> candidate = toDate(m.group(3), m.group(2), m.group(1));
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
        }
        return findMonthNameDate(cleaned);
    }

    /**
     * 呼び出し側が指定した正規表現を順に適用し、最初に見つかった日付部分を返します。
     * キャプチャグループがあれば1番目のグループ、なければマッチ全体を返します。
     * @param text 検索対象のテキスト
     * @param patterns 大文字小文字を区別しない正規表現のリスト
     */
    public static Optional<String> extractDateFromText(String text, List<String> patterns) {
        if (text == null || text.isEmpty() || patterns == null) {
            return Optional.empty();
        }
        for (String regex : patterns) {
            try {
                Matcher m = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE).matcher(text);
                if (m.find()) {
                    String found = m.groupCount() >= 1 && m.group(1) != null ? m.group(1) : m.group();
                    return Optional.of(found.trim());
                }
            } catch (PatternSyntaxException e) {
                log.warn("日付パターンが不正なためスキップします: {}", regex);
            }
        }
        return Optional.empty();
    }

    boolean isInRange(LocalDate date) {
        int maxYear = LocalDate.now(clock).getYear() + YEARS_AHEAD;
        return date.getYear() >= MIN_YEAR && date.getYear() <= maxYear;
    }

    private Optional<LocalDate> toDate(String yearText, String monthText, String dayText) {
        try {
            int year = Integer.parseInt(yearText);
            if (yearText.length() == 2) {
                year += year >= 50 ? 1900 : 2000;
            }
            LocalDate date = LocalDate.of(year, Integer.parseInt(monthText), Integer.parseInt(dayText));
            return isInRange(date) ? Optional.of(date) : Optional.empty();
        } catch (DateTimeException | NumberFormatException e) {
            return Optional.empty();
        }
    }

    private Optional<LocalDate> findMonthNameDate(String text) {
        Matcher m = DAY_MONTH_NAME_YEAR.matcher(text);
        while (m.find()) {
            Integer month = MONTH_NAMES.get(m.group(2).toLowerCase(Locale.ROOT));
            if (month != null) {
                Optional<LocalDate> candidate = toDate(m.group(3), String.valueOf(month), m.group(1));
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
        }
        m = MONTH_NAME_DAY_YEAR.matcher(text);
        while (m.find()) {
            Integer month = MONTH_NAMES.get(m.group(1).toLowerCase(Locale.ROOT));
            if (month != null) {
                Optional<LocalDate> candidate = toDate(m.group(3), String.valueOf(month), m.group(2));
                if (candidate.isPresent()) {
                    return candidate;
                }
            }
        }
        return Optional.empty();
    }

    private static Map<String, Integer> buildMonthNames() {
        Map<String, Integer> names = new HashMap<>();
        for (Locale locale : List.of(Locale.ENGLISH, SPANISH)) {
            for (Month month : Month.values()) {
                for (TextStyle style : List.of(TextStyle.FULL, TextStyle.SHORT)) {
                    String name = month.getDisplayName(style, locale).toLowerCase(Locale.ROOT);
                    names.putIfAbsent(name.endsWith(".") ? name.substring(0, name.length() - 1) : name, month.getValue());
                }
            }
        }
        return Map.copyOf(names);
    }

    private static boolean containsUnsetSentinel(String text) {
        for (String sentinel : UNSET_SENTINELS) {
            if (text.contains(sentinel)) {
                return true;
            }
        }
        return false;
    }

    private static DateTimeFormatter strict(String pattern, Locale locale) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(locale)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    // 2桁の年: 50以上は1900年代、それ未満は2000年代
    private static DateTimeFormatter twoDigitYear(String separator) {
        return new DateTimeFormatterBuilder()
                .appendPattern("d" + separator + "M" + separator)
                .appendValueReduced(ChronoField.YEAR, 2, 2, TWO_DIGIT_YEAR_BASE)
                .toFormatter(Locale.ROOT)
                .withResolverStyle(ResolverStyle.STRICT);
    }
}
