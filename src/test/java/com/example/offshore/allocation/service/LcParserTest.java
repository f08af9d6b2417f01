package com.example.offshore.allocation.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("LcParser")
class LcParserTest {

    private final LcParser parser = new LcParser();

    @ParameterizedTest(name = "{0} tokens split to 100%")
    @ValueSource(ints = {1, 2, 3, 4, 5, 7, 9})
    @DisplayName("Equal split always sums to 100")
    void equalSplitSumsToHundred(int tokenCount) {
        // Given
        String chargeCode = IntStream.rangeClosed(1, tokenCount)
                .mapToObj(i -> String.valueOf(10000 + i))
                .collect(Collectors.joining(", "));

        // When
        LcSplit split = parser.parse(chargeCode);

        // Then
        assertThat(split.allocations()).hasSize(tokenCount);
        assertThat(split.totalPercentage()).isCloseTo(100.0, within(0.01));
        assertThat(split.allocations())
                .allSatisfy(allocation -> assertThat(allocation.percentage()).isCloseTo(100.0 / tokenCount, within(1e-9)));
    }

    @Test
    @DisplayName("Comma, slash, semicolon and pipe are all delimiters")
    void splitsOnEveryDelimiter() {
        LcSplit split = parser.parse(" 7777 / 8888;9999 ,1111|2222 ");

        assertThat(split.lcNumbers()).containsExactly("7777", "8888", "9999", "1111", "2222");
    }

    @Test
    @DisplayName("Duplicate and empty tokens are dropped, order is kept")
    void dropsDuplicatesAndEmptyTokens() {
        LcSplit split = parser.parse("9358,,10137, 9358 ,");

        assertThat(split.lcNumbers()).containsExactly("9358", "10137");
        assertThat(split.allocations()).allSatisfy(allocation -> assertThat(allocation.percentage()).isEqualTo(50.0));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", ",", " ; / "})
    @DisplayName("Blank input is a single unallocated unit")
    void blankInputIsUnallocated(String chargeCode) {
        LcSplit split = parser.parse(chargeCode);

        assertThat(split.isUnallocated()).isTrue();
        assertThat(split.totalPercentage()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Explicit shares are kept and the remainder goes to unmarked tokens")
    void explicitSharesWithRemainder() {
        // When
        LcSplit split = parser.parse("9358 45, 10137 12%, 10101");

        // Then
        assertThat(split.lcNumbers()).containsExactly("9358", "10137", "10101");
        assertThat(split.allocations().get(0).percentage()).isCloseTo(45.0, within(0.001));
        assertThat(split.allocations().get(1).percentage()).isCloseTo(12.0, within(0.001));
        assertThat(split.allocations().get(2).percentage()).isCloseTo(43.0, within(0.001));
    }

    @Test
    @DisplayName("Explicit shares over 100 are normalized proportionally")
    void explicitSharesAreNormalized() {
        LcSplit split = parser.parse("1000 80; 2000 80");

        assertThat(split.totalPercentage()).isCloseTo(100.0, within(0.01));
        assertThat(split.allocations().get(0).percentage()).isCloseTo(50.0, within(0.001));
        assertThat(split.allocations().get(1).percentage()).isCloseTo(50.0, within(0.001));
    }

    @Test
    @DisplayName("Unmarked tokens get nothing when explicit shares already reach 100")
    void noRemainderLeavesUnmarkedTokensAtZero() {
        LcSplit split = parser.parse("1000 60, 2000 40, 3000");

        assertThat(split.allocations().get(2).percentage()).isZero();
        assertThat(split.totalPercentage()).isCloseTo(100.0, within(0.01));
    }

    @Test
    @DisplayName("All-zero explicit shares fall back to the equal split")
    void zeroSharesFallBackToEqualSplit() {
        LcSplit split = parser.parse("1000 0, 2000 0");

        assertThat(split.allocations()).allSatisfy(allocation -> assertThat(allocation.percentage()).isEqualTo(50.0));
    }

    @Test
    @DisplayName("A trailing number above 100 is part of the LC, not a share")
    void largeTrailingNumberIsNotAShare() {
        LcSplit split = parser.parse("WBS 12345");

        assertThat(split.lcNumbers()).containsExactly("WBS 12345");
        assertThat(split.totalPercentage()).isEqualTo(100.0);
    }
}
