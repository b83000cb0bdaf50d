package com.lendkeeper.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Per-pool keeper configuration. A missing {@code kick}, {@code take} or {@code settlement} section
 * disables that activity for the pool.
 */
public record PoolConfig(
    @NotBlank String name,
    @NotBlank String address,
    @NotNull @Valid PriceSpec price,
    @Valid Kick kick,
    @Valid Take take,
    @Valid Settlement settlement,
    @NotNull Boolean collectBond,
    /**
     * Poke the pool's interest accrual when it has not been updated for a week.
     */
    @NotNull Boolean updateInterest,
    List<@Valid Reward> rewards,
    /**
     * Redeem LP this account earns from bucket takes, as taker or as kicker.
     */
    @Valid CollectLpReward collectLpReward
) {

  public PoolConfig {
    if (collectBond == null) {
      collectBond = false;
    }
    if (updateInterest == null) {
      updateInterest = false;
    }
    rewards = rewards == null ? List.of() : rewards.stream().filter(Objects::nonNull).toList();
  }

  public boolean kickEnabled() {
    return kick != null;
  }

  public boolean takeEnabled() {
    return take != null;
  }

  public boolean settlementEnabled() {
    return settlement != null && settlement.enabled();
  }

  public boolean collectLpEnabled() {
    return collectLpReward != null;
  }

  public record Kick(
      /**
       * Loans with less debt (in quote token) are not worth the gas.
       */
      @NotNull @PositiveOrZero BigDecimal minDebt,
      /**
       * Kick only when neutralPrice * priceFactor is at or above the resolved market price.
       */
      @NotNull @DecimalMin("0.0") BigDecimal priceFactor
  ) {
  }

  public record Take(
      /**
       * Auctions with this much collateral or less are ignored.
       */
      @NotNull @PositiveOrZero BigDecimal minCollateral,
      /**
       * When set, arb-take once auctionPrice <= hpb * hpbPriceFactor.
       */
      @DecimalMin("0.0") BigDecimal hpbPriceFactor,
      @NotNull LiquiditySource liquiditySource,
      /**
       * External take once auctionPrice <= marketPrice * marketPriceFactor.
       */
      @DecimalMin("0.0") BigDecimal marketPriceFactor,
      /**
       * Optional pool variant hint for routers that distinguish pool flavours.
       */
      PoolVariant poolVariant,
      @NotNull @Min(0) @Max(10_000) Integer slippageBps
  ) {
    public Take {
      if (minCollateral == null) {
        minCollateral = BigDecimal.ZERO;
      }
      if (liquiditySource == null) {
        liquiditySource = LiquiditySource.NONE;
      }
      if (slippageBps == null) {
        slippageBps = 50;
      }
    }

    public boolean externalTakeEnabled() {
      return liquiditySource != LiquiditySource.NONE && marketPriceFactor != null;
    }

    public boolean arbTakeEnabled() {
      return hpbPriceFactor != null;
    }
  }

  public record Settlement(
      @NotNull Boolean enabled,
      /**
       * Seconds an auction must have run before its bad debt is settled.
       */
      @NotNull @PositiveOrZero Long minAuctionAge,
      /**
       * Buckets processed per settle call.
       */
      @NotNull @Min(1) Integer maxBucketDepth,
      /**
       * Settle calls per auction per cycle.
       */
      @NotNull @Min(1) Integer maxIterations,
      /**
       * Only settle auctions this account kicked and still holds a bond in.
       */
      @NotNull Boolean checkBotIncentive
  ) {
    public Settlement {
      if (enabled == null) {
        enabled = true;
      }
      if (minAuctionAge == null) {
        minAuctionAge = 3_600L;
      }
      if (maxBucketDepth == null) {
        maxBucketDepth = 50;
      }
      if (maxIterations == null) {
        maxIterations = 10;
      }
      if (checkBotIncentive == null) {
        checkBotIncentive = true;
      }
    }
  }

  public record CollectLpReward(
      @NotNull TokenToCollect redeemFirst,
      /**
       * Quote token redemptions at or below this amount (token units) are not sent.
       */
      @NotNull @PositiveOrZero BigDecimal minAmountQuote,
      @NotNull @PositiveOrZero BigDecimal minAmountCollateral
  ) {
    public CollectLpReward {
      if (redeemFirst == null) {
        redeemFirst = TokenToCollect.QUOTE;
      }
      if (minAmountQuote == null) {
        minAmountQuote = BigDecimal.ZERO;
      }
      if (minAmountCollateral == null) {
        minAmountCollateral = BigDecimal.ZERO;
      }
    }

    public enum TokenToCollect {
      QUOTE,
      COLLATERAL
    }
  }

  public record Reward(
      @NotBlank String token,
      @NotNull Action action,
      String targetToken,
      @NotNull LiquiditySource liquiditySource,
      /**
       * Minimum balance (token units) before a swap or transfer is attempted.
       */
      @NotNull @PositiveOrZero BigDecimal minAmount,
      @NotNull @Min(0) @Max(10_000) Integer slippageBps,
      /**
       * Recipient for the TRANSFER action.
       */
      String transferTo
  ) {
    public Reward {
      if (action == null) {
        action = Action.HOLD;
      }
      if (liquiditySource == null) {
        liquiditySource = LiquiditySource.NONE;
      }
      if (minAmount == null) {
        minAmount = BigDecimal.ZERO;
      }
      if (slippageBps == null) {
        slippageBps = 50;
      }
    }

    public enum Action {
      HOLD,
      SWAP,
      TRANSFER
    }
  }
}
