package com.lendkeeper.executor.auction;

import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.domain.Auction;
import com.lendkeeper.domain.Wad;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Pure eligibility rules for auctions. Prices are decimals in quote token per collateral token.
 */
public final class AuctionEvaluator {

  private AuctionEvaluator() {
  }

  public static boolean settlementPending(Auction auction, PoolConfig.Settlement settlement, Instant now) {
    if (auction.settled() || !auction.hasBadDebt()) {
      return false;
    }
    return auction.age(now).compareTo(Duration.ofSeconds(settlement.minAuctionAge())) >= 0;
  }

  public static boolean worthTaking(BigDecimal collateral, PoolConfig.Take take) {
    return collateral.compareTo(take.minCollateral()) > 0;
  }

  public static boolean externalTakeEligible(BigDecimal auctionPrice, BigDecimal marketPrice, PoolConfig.Take take) {
    if (!take.externalTakeEnabled() || marketPrice == null) {
      return false;
    }
    return auctionPrice.compareTo(marketPrice.multiply(take.marketPriceFactor())) <= 0;
  }

  public static boolean arbTakeEligible(BigDecimal auctionPrice, BigDecimal hpb, PoolConfig.Take take) {
    if (!take.arbTakeEnabled() || hpb == null || hpb.signum() <= 0) {
      return false;
    }
    return auctionPrice.compareTo(hpb.multiply(take.hpbPriceFactor())) <= 0;
  }

  /**
   * Phases an auction is in given what the cycle learned about it. {@code marketPrice} may be null when no
   * quote was obtained.
   */
  public static Set<AuctionPhase> phases(
      Auction auction,
      PoolConfig pool,
      BigDecimal auctionPrice,
      BigDecimal marketPrice,
      BigDecimal hpb,
      Instant now
  ) {
    if (auction.settled()) {
      return EnumSet.of(AuctionPhase.SETTLED);
    }
    Set<AuctionPhase> phases = EnumSet.of(AuctionPhase.ACTIVE);
    PoolConfig.Take take = pool.take();
    if (take != null && auctionPrice != null && worthTaking(Wad.toDecimal(auction.collateralRemaining()), take)) {
      if (externalTakeEligible(auctionPrice, marketPrice, take)) {
        phases.add(AuctionPhase.EXTERNAL_TAKE_ELIGIBLE);
      }
      if (arbTakeEligible(auctionPrice, hpb, take)) {
        phases.add(AuctionPhase.ARB_TAKE_ELIGIBLE);
      }
    }
    if (pool.settlementEnabled() && settlementPending(auction, pool.settlement(), now)) {
      phases.add(AuctionPhase.SETTLEMENT_PENDING);
    }
    return phases;
  }
}
