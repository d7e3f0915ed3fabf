package com.example.videostatcrawling.service.text;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 화면 표시 텍스트 → 숫자/날짜 변환 유틸리티
 * 
 * 모든 메서드는 예외를 던지지 않으며, 알 수 없는 형식이면 value=null 과 원문을 돌려줍니다.
 * 
 * 지원 형식:
 * - 숫자: "1234", "1,234", "12.3K", "1.5M", "2B", "3.2万", "1億"
 * - 상대 날짜: "3d ago", "5h ago", "2w ago", "10m ago", "30s ago", "3 days ago", "1 hour ago"
 * - 절대 날짜: "2023-5-12" (yyyy-M-d), "5-12" (M-d, 수집 연도 기준)
 * 
 * 현지화된 일(day) 단위 표기(예: "3日前")는 패턴에 없으므로 null 이 됩니다. (알려진 미해결 항목)
 */
public final class TextNormalizer {

    private static final Pattern COUNT_PATTERN =
            Pattern.compile("^(\\d+(?:\\.\\d+)?)\\s*([KMB万億]?)$", Pattern.CASE_INSENSITIVE);

    private static final Map<String, BigDecimal> SUFFIX_FACTORS = Map.of(
            "", BigDecimal.ONE,
            "K", BigDecimal.TEN.pow(3),
            "M", BigDecimal.TEN.pow(6),
            "B", BigDecimal.TEN.pow(9),
            "万", BigDecimal.TEN.pow(4),
            "億", BigDecimal.TEN.pow(8)
    );

    private static final Pattern RELATIVE_SHORT_PATTERN =
            Pattern.compile("^(\\d+)\\s*([smhdw])\\s+ago$", Pattern.CASE_INSENSITIVE);

    private static final Pattern RELATIVE_LONG_PATTERN =
            Pattern.compile("^(\\d+)\\s+(second|minute|hour|day|week)s?\\s+ago$", Pattern.CASE_INSENSITIVE);

    private static final Pattern FULL_DATE_PATTERN = Pattern.compile("^(\\d{4})-(\\d{1,2})-(\\d{1,2})$");

    private static final Pattern MONTH_DAY_PATTERN = Pattern.compile("^(\\d{1,2})-(\\d{1,2})$");

    private static final Map<String, ChronoUnit> RELATIVE_UNITS = Map.of(
            "s", ChronoUnit.SECONDS,
            "m", ChronoUnit.MINUTES,
            "h", ChronoUnit.HOURS,
            "d", ChronoUnit.DAYS,
            "w", ChronoUnit.WEEKS,
            "second", ChronoUnit.SECONDS,
            "minute", ChronoUnit.MINUTES,
            "hour", ChronoUnit.HOURS,
            "day", ChronoUnit.DAYS,
            "week", ChronoUnit.WEEKS
    );

    /** 인스턴스화 방지 */
    private TextNormalizer() {}

    /**
     * 축약 표기 숫자를 정수로 변환
     * 
     * 접미사가 있으면 숫자 부분 × 접미사 배수 (소수점 이하는 버림), 없으면 일반 정수로 읽습니다.
     * 접미사 없는 소수("1.5")는 정수가 아니므로 null 입니다.
     *
     * @param raw 화면 원문 (null 가능)
     * @return 원문 + 파싱 값
     */
    public static ParsedValue<Long> parseCount(String raw) {
        if (raw == null) {
            return ParsedValue.unparsed(null);
        }
        String text = raw.trim().replace(",", "");
        Matcher matcher = COUNT_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return ParsedValue.unparsed(raw);
        }
        String number = matcher.group(1);
        String suffix = matcher.group(2).toUpperCase(Locale.ROOT);
        if (suffix.isEmpty() && number.contains(".")) {
            return ParsedValue.unparsed(raw);
        }
        try {
            BigDecimal value = new BigDecimal(number)
                    .multiply(SUFFIX_FACTORS.get(suffix))
                    .setScale(0, RoundingMode.DOWN);
            return ParsedValue.of(raw, value.longValueExact());
        } catch (ArithmeticException e) {
            return ParsedValue.unparsed(raw);
        }
    }

    /**
     * 게시일 텍스트를 날짜/시간으로 변환
     * 
     * 상대 표기는 수집 시간(capturedAt)에서 해당 기간을 뺀 값, 절대 표기는 그 날짜 0시입니다.
     * 연도 없는 "M-d" 가 수집일보다 뒤면 작년 날짜로 봅니다.
     *
     * @param raw 화면 원문 (null 가능)
     * @param capturedAt 수집 시간
     * @return 원문 + 파싱 값
     */
    public static ParsedValue<LocalDateTime> parseDate(String raw, LocalDateTime capturedAt) {
        if (raw == null) {
            return ParsedValue.unparsed(null);
        }
        String text = raw.trim();
        try {
            Matcher relative = RELATIVE_SHORT_PATTERN.matcher(text);
            if (!relative.matches()) {
                relative = RELATIVE_LONG_PATTERN.matcher(text);
            }
            if (relative.matches()) {
                long amount = Long.parseLong(relative.group(1));
                ChronoUnit unit = RELATIVE_UNITS.get(relative.group(2).toLowerCase(Locale.ROOT));
                return ParsedValue.of(raw, capturedAt.minus(amount, unit));
            }

            Matcher full = FULL_DATE_PATTERN.matcher(text);
            if (full.matches()) {
                LocalDate date = LocalDate.of(
                        Integer.parseInt(full.group(1)), Integer.parseInt(full.group(2)), Integer.parseInt(full.group(3)));
                return ParsedValue.of(raw, date.atStartOfDay());
            }

            Matcher monthDay = MONTH_DAY_PATTERN.matcher(text);
            if (monthDay.matches()) {
                LocalDate date = LocalDate.of(
                        capturedAt.getYear(), Integer.parseInt(monthDay.group(1)), Integer.parseInt(monthDay.group(2)));
                if (date.isAfter(capturedAt.toLocalDate())) {
                    date = date.minusYears(1);
                }
                return ParsedValue.of(raw, date.atStartOfDay());
            }
        } catch (DateTimeException | ArithmeticException | NumberFormatException e) {
            // 2월 30일, 범위를 넘는 숫자 등
            return ParsedValue.unparsed(raw);
        }
        return ParsedValue.unparsed(raw);
    }
}
