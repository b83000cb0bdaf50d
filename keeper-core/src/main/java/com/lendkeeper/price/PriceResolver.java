package com.lendkeeper.price;

import com.lendkeeper.config.PriceSpec;
import com.lendkeeper.domain.PoolSnapshot;
import com.lendkeeper.domain.Wad;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves a {@link PriceSpec} by trying its tiers strictly in order: primary market source, fallback market
 * source, fixed value, pool reference. The first tier that yields a positive price wins.
 */
@Slf4j
public class PriceResolver {

  private static final MathContext PRECISION = MathContext.DECIMAL128;

  private final MarketPriceSource primary;
  private final MarketPriceSource fallback;

  public PriceResolver(@NonNull MarketPriceSource primary, @NonNull MarketPriceSource fallback) {
    this.primary = primary;
    this.fallback = fallback;
  }

  public PriceOutcome resolve(@NonNull PriceSpec spec, @NonNull PriceContext context) {
    List<String> failures = new ArrayList<>();
    for (PriceSpec.Source tier : tiers(spec)) {
      BigDecimal price;
      try {
        price = resolveTier(tier, spec, context);
      } catch (RuntimeException e) {
        log.warn("price tier {} failed for pool={}: {}", tier, context.poolName(), e.getMessage());
        failures.add(tier + ": " + e.getMessage());
        continue;
      }
      if (price == null || price.signum() <= 0) {
        failures.add(tier + ": non-positive price " + price);
        continue;
      }
      BigDecimal out = spec.invert() ? BigDecimal.ONE.divide(price, PRECISION) : price;
      log.debug("price resolved pool={} tier={} price={} inverted={}", context.poolName(), tier, out, spec.invert());
      return new PriceOutcome.Resolved(out, tier);
    }
    log.warn("price unavailable for pool={} (tried {})", context.poolName(), failures);
    return new PriceOutcome.Unavailable(failures);
  }

  List<PriceSpec.Source> tiers(PriceSpec spec) {
    List<PriceSpec.Source> tiers = new ArrayList<>();
    switch (spec.source()) {
      case COINGECKO -> {
        tiers.add(PriceSpec.Source.COINGECKO);
        tiers.add(PriceSpec.Source.ALCHEMY);
      }
      case ALCHEMY -> tiers.add(PriceSpec.Source.ALCHEMY);
      case FIXED, POOL -> {
      }
    }
    if (spec.value() != null) {
      tiers.add(PriceSpec.Source.FIXED);
    }
    if (spec.reference() != null || spec.source() == PriceSpec.Source.POOL) {
      tiers.add(PriceSpec.Source.POOL);
    }
    return tiers;
  }

  private BigDecimal resolveTier(PriceSpec.Source tier, PriceSpec spec, PriceContext context) {
    return switch (tier) {
      case COINGECKO -> market(primary, spec);
      case ALCHEMY -> market(fallback, spec);
      case FIXED -> spec.value();
      case POOL -> poolReference(spec, context.snapshot());
    };
  }

  private static BigDecimal market(MarketPriceSource source, PriceSpec spec) {
    if (!source.configured()) {
      throw new IllegalStateException(source.source() + " not configured");
    }
    if (spec.isPair()) {
      BigDecimal collateral = source.usdPrice(spec.collateralId());
      BigDecimal quote = source.usdPrice(spec.quoteId());
      if (quote.signum() <= 0) {
        throw new IllegalStateException("non-positive quote token price for " + spec.quoteId());
      }
      return collateral.divide(quote, PRECISION);
    }
    if (spec.tokenId() == null || spec.tokenId().isBlank()) {
      throw new IllegalStateException("market price spec names no token");
    }
    return source.usdPrice(spec.tokenId());
  }

  private static BigDecimal poolReference(PriceSpec spec, PoolSnapshot snapshot) {
    if (snapshot == null) {
      throw new IllegalStateException("pool reference price needs a snapshot");
    }
    PriceSpec.PoolReference reference = spec.reference() == null ? PriceSpec.PoolReference.LUP : spec.reference();
    return switch (reference) {
      case LUP -> Wad.toDecimal(snapshot.lup());
      case HPB -> Wad.toDecimal(snapshot.hpb());
    };
  }
}
