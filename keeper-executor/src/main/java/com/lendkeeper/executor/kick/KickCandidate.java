package com.lendkeeper.executor.kick;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * A loan that passed every kick filter.
 *
 * @param estimatedRemainingBond this loan's bond plus the bonds of every lower-ranked loan in the same scan (WAD)
 * @param limitPrice             resolved market price; its bucket index bounds the kick's neutral price
 */
public record KickCandidate(
    String poolName,
    String poolAddress,
    String borrower,
    BigInteger liquidationBond,
    BigInteger estimatedRemainingBond,
    BigDecimal limitPrice
) {
}
