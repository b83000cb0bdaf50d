package com.lendkeeper.domain;

import lombok.NonNull;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Point-in-time view of a pool as reported by the ledger service. Never reused across cycles.
 *
 * <p>{@code hpb} and {@code hpbIndex} describe the highest-priced bucket whose deposit exceeds the configured
 * minimum, not the pool's raw highest bucket; both are zero when no bucket qualifies.
 */
public record PoolSnapshot(
    @NonNull String poolAddress,
    @NonNull BigInteger lup,
    @NonNull BigInteger hpb,
    int hpbIndex,
    @NonNull List<Loan> loans,
    @NonNull List<Auction> auctions,
    @NonNull Instant fetchedAt
) {

  public PoolSnapshot {
    loans = List.copyOf(loans);
    auctions = List.copyOf(auctions);
  }

  public Optional<Auction> auction(String borrower) {
    return auctions.stream().filter(a -> a.borrower().equalsIgnoreCase(borrower)).findFirst();
  }
}
