package com.lendkeeper.domain;

import lombok.NonNull;

import java.math.BigInteger;

/**
 * A borrower position that is not in liquidation. Monetary fields are WAD.
 */
public record Loan(
    @NonNull String borrower,
    @NonNull BigInteger thresholdPrice,
    @NonNull BigInteger liquidationBond,
    @NonNull BigInteger neutralPrice,
    @NonNull BigInteger debt
) {
}
