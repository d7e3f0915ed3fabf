package com.example.videostatcrawling.service.text;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * TextNormalizer 테스트
 */
class TextNormalizerTest {

    private static final LocalDateTime CAPTURED_AT = LocalDateTime.of(2024, 3, 10, 12, 0);

    @Test
    void shouldParseSuffixedCounts() {
        assertThat(TextNormalizer.parseCount("1.5M").getValue()).isEqualTo(1_500_000L);
        assertThat(TextNormalizer.parseCount("2.3M").getValue()).isEqualTo(2_300_000L);
        assertThat(TextNormalizer.parseCount("12.3K").getValue()).isEqualTo(12_300L);
        assertThat(TextNormalizer.parseCount("2B").getValue()).isEqualTo(2_000_000_000L);
        assertThat(TextNormalizer.parseCount("3.2万").getValue()).isEqualTo(32_000L);
        assertThat(TextNormalizer.parseCount("1億").getValue()).isEqualTo(100_000_000L);
    }

    @Test
    void shouldTruncateFractionalResult() {
        assertThat(TextNormalizer.parseCount("1.2345K").getValue()).isEqualTo(1234L);
    }

    @Test
    void shouldAcceptLowerCaseSuffixAndGroupingCommas() {
        assertThat(TextNormalizer.parseCount("4.7k").getValue()).isEqualTo(4700L);
        assertThat(TextNormalizer.parseCount("1,234").getValue()).isEqualTo(1234L);
        assertThat(TextNormalizer.parseCount(" 987 ").getValue()).isEqualTo(987L);
    }

    @Test
    void shouldKeepRawTextWhenUnparseable() {
        ParsedValue<Long> parsed = TextNormalizer.parseCount("??");

        assertThat(parsed.getValue()).isNull();
        assertThat(parsed.getRaw()).isEqualTo("??");
    }

    @Test
    void shouldRejectUnsuffixedDecimalAndUnknownSuffix() {
        assertThat(TextNormalizer.parseCount("1.5").getValue()).isNull();
        assertThat(TextNormalizer.parseCount("3T").getValue()).isNull();
        assertThat(TextNormalizer.parseCount("").getValue()).isNull();
    }

    @Test
    void shouldReturnNullRawForMissingElement() {
        ParsedValue<Long> parsed = TextNormalizer.parseCount(null);

        assertThat(parsed.getRaw()).isNull();
        assertThat(parsed.getValue()).isNull();
    }

    @Test
    void shouldSubtractRelativeOffsetsFromCaptureTime() {
        assertThat(TextNormalizer.parseDate("3d ago", CAPTURED_AT).getValue()).isEqualTo(CAPTURED_AT.minusDays(3));
        assertThat(TextNormalizer.parseDate("5h ago", CAPTURED_AT).getValue()).isEqualTo(CAPTURED_AT.minusHours(5));
        assertThat(TextNormalizer.parseDate("2w ago", CAPTURED_AT).getValue()).isEqualTo(CAPTURED_AT.minusWeeks(2));
        assertThat(TextNormalizer.parseDate("10m ago", CAPTURED_AT).getValue()).isEqualTo(CAPTURED_AT.minusMinutes(10));
        assertThat(TextNormalizer.parseDate("1 hour ago", CAPTURED_AT).getValue()).isEqualTo(CAPTURED_AT.minusHours(1));
        assertThat(TextNormalizer.parseDate("4 days ago", CAPTURED_AT).getValue()).isEqualTo(CAPTURED_AT.minusDays(4));
    }

    @Test
    void shouldParseAbsoluteDates() {
        assertThat(TextNormalizer.parseDate("2023-5-12", CAPTURED_AT).getValue())
                .isEqualTo(LocalDateTime.of(2023, 5, 12, 0, 0));
        assertThat(TextNormalizer.parseDate("2-28", CAPTURED_AT).getValue())
                .isEqualTo(LocalDateTime.of(2024, 2, 28, 0, 0));
    }

    @Test
    void shouldRollMonthDayAfterCaptureBackOneYear() {
        assertThat(TextNormalizer.parseDate("12-25", CAPTURED_AT).getValue())
                .isEqualTo(LocalDateTime.of(2023, 12, 25, 0, 0));
    }

    @Test
    void shouldReturnNullForUnsupportedFormats() {
        ParsedValue<LocalDateTime> localized = TextNormalizer.parseDate("3日前", CAPTURED_AT);

        assertThat(localized.getValue()).isNull();
        assertThat(localized.getRaw()).isEqualTo("3日前");
        assertThat(TextNormalizer.parseDate("3y ago", CAPTURED_AT).getValue()).isNull();
        assertThat(TextNormalizer.parseDate("2023-2-30", CAPTURED_AT).getValue()).isNull();
        assertThat(TextNormalizer.parseDate("yesterday", CAPTURED_AT).getValue()).isNull();
    }
}
