package com.lendkeeper.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WadTest {

  @Test
  void scalesSixDecimalTokenUpExactly() {
    assertThat(Wad.fromTokenAmount(BigInteger.valueOf(1_500_000), 6))
        .isEqualTo(new BigInteger("1500000000000000000"));
  }

  @Test
  void truncatesTowardZeroWhenScalingDown() {
    BigInteger wad = new BigInteger("1234567999999999999");

    assertThat(Wad.toTokenAmount(wad, 6)).isEqualTo(BigInteger.valueOf(1_234_567));
  }

  @Test
  void keepsEighteenDecimalTokensUnchanged() {
    BigInteger wad = new BigInteger("42");

    assertThat(Wad.fromTokenAmount(wad, 18)).isEqualTo(wad);
    assertThat(Wad.toTokenAmount(wad, 18)).isEqualTo(wad);
  }

  @Test
  void convertsDecimalsBothWays() {
    BigInteger wad = Wad.fromDecimal(new BigDecimal("101.25"));

    assertThat(wad).isEqualTo(new BigInteger("101250000000000000000"));
    assertThat(Wad.toDecimal(wad)).isEqualByComparingTo("101.25");
  }

  @Test
  void multipliesByDecimalFactorRoundingDown() {
    assertThat(Wad.multiply(BigInteger.valueOf(1000), new BigDecimal("1.0199"))).isEqualTo(BigInteger.valueOf(1019));
  }

  @Test
  void multipliesAndDividesWadsRoundingDown() {
    BigInteger exchangeRate = Wad.fromDecimal(new BigDecimal("1.05"));
    BigInteger lp = Wad.fromDecimal(new BigDecimal("10"));

    assertThat(Wad.toDecimal(Wad.mul(lp, exchangeRate))).isEqualByComparingTo("10.5");
    assertThat(Wad.toDecimal(Wad.div(Wad.fromDecimal(new BigDecimal("10.5")), exchangeRate))).isEqualByComparingTo("10");
    assertThat(Wad.div(BigInteger.ONE, Wad.fromDecimal(new BigDecimal("3")))).isZero();
  }

  @Test
  void rejectsNegativeDecimals() {
    assertThatThrownBy(() -> Wad.toTokenAmount(BigInteger.ONE, -1)).isInstanceOf(IllegalArgumentException.class);
  }
}
