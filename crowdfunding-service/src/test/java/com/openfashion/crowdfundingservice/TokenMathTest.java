package com.openfashion.crowdfundingservice;

import com.openfashion.crowdfundingservice.core.exceptions.ConservationViolationException;
import com.openfashion.crowdfundingservice.core.exceptions.InvalidInputException;
import com.openfashion.crowdfundingservice.core.util.TokenMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenMathTest {

    @ParameterizedTest
    @CsvSource({
            "1000, 100, 10",
            "600, 100, 6",
            "99, 100, 0",
            "199, 100, 1",
            "1000, 0, 0",
            "1000, 10000, 1000",
            "12345, 250, 308"
    })
    @DisplayName("Fee is the floor of amount * rate / 10000")
    void testFeeOf(String amount, int rate, String expected) {
        assertThat(TokenMath.feeOf(new BigInteger(amount), rate)).isEqualTo(new BigInteger(expected));
    }

    @Test
    @DisplayName("Should reject rates outside basis point range")
    void testFeeOf_InvalidRate() {
        assertThatThrownBy(() -> TokenMath.feeOf(BigInteger.TEN, 10_001))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> TokenMath.feeOf(BigInteger.TEN, -1))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    @DisplayName("Addition past uint256 fails instead of wrapping")
    void testAdd_Overflow() {
        assertThatThrownBy(() -> TokenMath.add(TokenMath.MAX_UINT256, BigInteger.ONE))
                .isInstanceOf(ConservationViolationException.class)
                .hasMessageContaining("Overflow");
    }

    @Test
    @DisplayName("Subtraction below zero fails instead of clamping")
    void testSub_Underflow() {
        assertThatThrownBy(() -> TokenMath.sub(BigInteger.ONE, BigInteger.TWO))
                .isInstanceOf(ConservationViolationException.class)
                .hasMessageContaining("Underflow");
    }

    @Test
    @DisplayName("Fee on a huge amount overflows in the multiplication")
    void testFeeOf_Overflow() {
        assertThatThrownBy(() -> TokenMath.feeOf(TokenMath.MAX_UINT256, 100))
                .isInstanceOf(ConservationViolationException.class);
    }

    @Test
    @DisplayName("Percent is integer division and zero for a zero goal")
    void testPercentOf() {
        assertThat(TokenMath.percentOf(BigInteger.valueOf(999), BigInteger.valueOf(1000))).isEqualTo(BigInteger.valueOf(99));
        assertThat(TokenMath.percentOf(BigInteger.valueOf(2500), BigInteger.valueOf(1000))).isEqualTo(BigInteger.valueOf(250));
        assertThat(TokenMath.percentOf(BigInteger.TEN, BigInteger.ZERO)).isZero();
    }

    @Test
    @DisplayName("Null operands count as zero, negatives are rejected")
    void testOperandRange() {
        assertThat(TokenMath.add(null, BigInteger.TEN)).isEqualTo(BigInteger.TEN);
        assertThatThrownBy(() -> TokenMath.add(BigInteger.valueOf(-1), BigInteger.TEN))
                .isInstanceOf(ConservationViolationException.class);
        assertThat(TokenMath.isPositive(null)).isFalse();
        assertThat(TokenMath.isPositive(BigInteger.ZERO)).isFalse();
        assertThat(TokenMath.isPositive(BigInteger.ONE)).isTrue();
    }
}
