package com.lendkeeper.executor.pool;

import com.lendkeeper.domain.Wad;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Price/bucket-index conversion for the pool's fixed price grid: {@code price(i) = 1.005^(4156 - i)}.
 */
public final class BucketMath {

  public static final int MAX_BUCKET_INDEX = 4156;
  public static final int MIN_BUCKET_INDEX = -3232;
  public static final int MAX_FENWICK_INDEX = 7388;

  private static final double FLOAT_STEP = 1.005;

  private BucketMath() {
  }

  /**
   * Index of the bucket whose price is the closest at or above {@code price}, clamped to the grid.
   */
  public static int indexOf(BigDecimal price) {
    if (price == null || price.signum() <= 0) {
      throw new IllegalArgumentException("price must be positive: " + price);
    }
    double exponent = Math.log(price.doubleValue()) / Math.log(FLOAT_STEP);
    double ceil = Math.ceil(exponent);
    int index;
    if (exponent < 0 && ceil - exponent > 0.5) {
      index = (int) (MAX_BUCKET_INDEX + 1 - ceil);
    } else {
      index = (int) (MAX_BUCKET_INDEX - ceil);
    }
    return Math.max(0, Math.min(MAX_FENWICK_INDEX, index));
  }

  public static int indexOfWad(BigInteger priceWad) {
    return indexOf(Wad.toDecimal(priceWad));
  }

  public static BigDecimal priceAt(int index) {
    if (index < 0 || index > MAX_FENWICK_INDEX) {
      throw new IllegalArgumentException("bucket index out of range: " + index);
    }
    return BigDecimal.valueOf(Math.pow(FLOAT_STEP, MAX_BUCKET_INDEX - index));
  }
}
