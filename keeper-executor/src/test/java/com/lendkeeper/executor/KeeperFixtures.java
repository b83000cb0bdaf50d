package com.lendkeeper.executor;

import com.lendkeeper.config.KeeperProperties;
import com.lendkeeper.config.LiquiditySource;
import com.lendkeeper.config.PoolConfig;
import com.lendkeeper.config.PriceSpec;
import com.lendkeeper.domain.Auction;
import com.lendkeeper.domain.Loan;
import com.lendkeeper.domain.PoolSnapshot;
import com.lendkeeper.domain.Wad;
import com.lendkeeper.executor.chain.ChainProperties;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Shared builders for executor tests. Decimal arguments are converted to WAD.
 */
public final class KeeperFixtures {

  public static final Credentials KEEPER =
      Credentials.create("0x4c0883a69102937d6231471b5dbb6204fe5129617082792ae468d01a3f362318");
  public static final String POOL = "0x1111111111111111111111111111111111111111";
  public static final String QUOTE_TOKEN = "0x2222222222222222222222222222222222222222";
  public static final String COLLATERAL_TOKEN = "0x3333333333333333333333333333333333333333";
  public static final String TAKER = "0x4444444444444444444444444444444444444444";
  public static final String ALICE = "0xa11ce00000000000000000000000000000000001";
  public static final String BOB = "0xb0b0000000000000000000000000000000000002";
  public static final String CAROL = "0xca40100000000000000000000000000000000003";

  private KeeperFixtures() {
  }

  public static KeeperProperties keeperProperties(boolean dryRun, List<PoolConfig> pools) {
    return new KeeperProperties(dryRun, 8453L, "", null, null, null,
        new KeeperProperties.Cycle(30_000L, 0L, 1, true), null, pools);
  }

  public static ChainProperties chainProperties(String takerAddress) {
    return new ChainProperties(null, null, null, null, "0x5555555555555555555555555555555555555555", takerAddress,
        null, null, null, null, null);
  }

  public static PoolConfig pool(PoolConfig.Kick kick, PoolConfig.Take take, PoolConfig.Settlement settlement) {
    return new PoolConfig("weth-usdc", POOL, PriceSpec.fixed(new BigDecimal("100")), kick, take, settlement,
        false, false, List.of(), null);
  }

  public static PoolConfig.Kick kick(String minDebt, String priceFactor) {
    return new PoolConfig.Kick(new BigDecimal(minDebt), new BigDecimal(priceFactor));
  }

  public static PoolConfig.Take take(LiquiditySource source, String marketPriceFactor, String hpbPriceFactor) {
    return new PoolConfig.Take(new BigDecimal("0.01"),
        hpbPriceFactor == null ? null : new BigDecimal(hpbPriceFactor),
        source,
        marketPriceFactor == null ? null : new BigDecimal(marketPriceFactor),
        null, 100);
  }

  public static PoolConfig.Settlement settlement(long minAuctionAge, int maxIterations, boolean checkBotIncentive) {
    return new PoolConfig.Settlement(true, minAuctionAge, 50, maxIterations, checkBotIncentive);
  }

  public static Loan loan(String borrower, String tp, String bond, String np, String debt) {
    return new Loan(borrower, wad(tp), wad(bond), wad(np), wad(debt));
  }

  public static Auction auction(String borrower, String collateral, String debt, Instant kickTime) {
    return new Auction(borrower, wad(collateral), wad(debt), wad("120"), kickTime, false);
  }

  public static PoolSnapshot snapshot(String lup, String hpb, List<Loan> loans, List<Auction> auctions) {
    return new PoolSnapshot(POOL, wad(lup), wad(hpb), 2990, loans, auctions, Instant.EPOCH);
  }

  public static BigInteger wad(String decimal) {
    return Wad.fromDecimal(new BigDecimal(decimal));
  }
}
