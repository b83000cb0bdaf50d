package com.lendkeeper.executor.liquidity;

import com.lendkeeper.config.LiquiditySource;
import com.lendkeeper.config.PoolVariant;
import com.lendkeeper.executor.chain.AbiWords;
import com.lendkeeper.executor.chain.ChainGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AerodromeRouterTest {

  private static final String WETH = "0x4200000000000000000000000000000000000006";
  private static final String USDC = "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913";
  private static final String VOLATILE_POOL = "0xcdac0d6c6c59727a65f871236188350531885c43";
  private static final String STABLE_POOL = "0x0000000000000000000000000000000000005ab1";
  private static final String ZERO = "0x0000000000000000000000000000000000000000";

  @Mock
  private ChainGateway gateway;

  private DexProperties dexProperties;
  private AerodromeRouter router;

  @BeforeEach
  void setUp() {
    dexProperties = new DexProperties(null, null, null, null);
    router = new AerodromeRouter(gateway, dexProperties);
  }

  @Test
  void shouldPickVolatilePoolWhenBothVariantsExist() throws Exception {
    givenPools(VOLATILE_POOL, STABLE_POOL);

    PoolLookup lookup = router.poolExists(WETH, USDC, null);

    assertThat(lookup.exists()).isTrue();
    assertThat(lookup.variant()).isEqualTo(PoolVariant.VOLATILE);
    assertThat(lookup.address()).isEqualToIgnoringCase(VOLATILE_POOL);
  }

  @Test
  void shouldFallBackToStablePool() throws Exception {
    givenPools(ZERO, STABLE_POOL);

    PoolLookup lookup = router.poolExists(WETH, USDC, null);

    assertThat(lookup.variant()).isEqualTo(PoolVariant.STABLE);
    assertThat(lookup.address()).isEqualToIgnoringCase(STABLE_POOL);
  }

  @Test
  void shouldHonorVariantHint() throws Exception {
    givenPools(VOLATILE_POOL, STABLE_POOL);

    PoolLookup lookup = router.poolExists(WETH, USDC, PoolVariant.STABLE);

    assertThat(lookup.variant()).isEqualTo(PoolVariant.STABLE);
  }

  @Test
  void shouldTryStablePoolWhenVolatileLookupFails() throws Exception {
    when(gateway.call(eq(dexProperties.aerodrome().factoryAddress()), anyString())).thenAnswer(inv -> {
      String data = inv.getArgument(1);
      if (!data.endsWith("1")) {
        throw new IOException("rpc timeout");
      }
      return AbiWords.hex(AbiWords.address(STABLE_POOL));
    });

    PoolLookup lookup = router.poolExists(WETH, USDC, null);

    assertThat(lookup.exists()).isTrue();
    assertThat(lookup.variant()).isEqualTo(PoolVariant.STABLE);
  }

  @Test
  void shouldReportReadFailureOnlyWhenEveryVariantFails() throws Exception {
    when(gateway.call(eq(dexProperties.aerodrome().factoryAddress()), anyString()))
        .thenThrow(new IOException("rpc timeout"));

    PoolLookup lookup = router.poolExists(WETH, USDC, null);

    assertThat(lookup.exists()).isFalse();
    assertThat(lookup.reason()).contains("factory read failed").contains("rpc timeout");
  }

  @Test
  void shouldReportMissingPoolWhenOneVariantFailsAndOtherIsAbsent() throws Exception {
    when(gateway.call(eq(dexProperties.aerodrome().factoryAddress()), anyString())).thenAnswer(inv -> {
      String data = inv.getArgument(1);
      if (data.endsWith("1")) {
        throw new IOException("rpc timeout");
      }
      return AbiWords.hex(AbiWords.address(ZERO));
    });

    PoolLookup lookup = router.poolExists(WETH, USDC, null);

    assertThat(lookup.exists()).isFalse();
    assertThat(lookup.reason()).contains("no aerodrome pool");
  }

  @Test
  void shouldReportNoLiquidityWhenNoPoolExists() throws Exception {
    givenPools(ZERO, ZERO);

    QuoteOutcome outcome = router.getQuote(BigInteger.TEN, WETH, USDC, null);

    assertThat(outcome).isInstanceOf(QuoteOutcome.NoLiquidity.class);
    assertThat(((QuoteOutcome.NoLiquidity) outcome).reason()).contains("no aerodrome pool");
  }

  @Test
  void shouldQuoteLastHopAmount() throws Exception {
    givenPools(VOLATILE_POOL, STABLE_POOL);
    when(gateway.call(eq(dexProperties.aerodrome().routerAddress()), anyString())).thenReturn(AbiWords.hex(
        AbiWords.uint(32), AbiWords.uint(2), AbiWords.uint(1_000_000_000_000_000_000L), AbiWords.uint(3_200_000_000L)));

    Quote quote = router.getQuote(BigInteger.TEN.pow(18), WETH, USDC, null).quoteIfPresent().orElseThrow();

    assertThat(quote.amountOut()).isEqualTo(BigInteger.valueOf(3_200_000_000L));
    assertThat(quote.poolVariant()).isEqualTo(PoolVariant.VOLATILE);
    assertThat(quote.source()).isEqualTo(LiquiditySource.AERODROME);
  }

  @Test
  void shouldBuildSwapToRecipientWithDeadline() {
    Quote quote = new Quote(LiquiditySource.AERODROME, WETH, USDC, BigInteger.TEN,
        BigInteger.valueOf(100), PoolVariant.STABLE, STABLE_POOL, null);
    String recipient = "0x4444444444444444444444444444444444444444";

    SwapInstruction swap = router.buildSwapInstruction(quote, BigInteger.valueOf(99), Instant.ofEpochSecond(1_800_000_000L), recipient);

    assertThat(swap.router()).isEqualTo(dexProperties.aerodrome().routerAddress());
    assertThat(swap.value()).isZero();
    assertThat(swap.calldata())
        .startsWith(AbiWords.selectorHex(
            "swapExactTokensForTokens(uint256,uint256,(address,address,bool,address)[],address,uint256)"))
        .contains("4444444444444444444444444444444444444444")
        .contains(Long.toHexString(1_800_000_000L));
  }

  /**
   * Factory getPool answers by the trailing {@code stable} flag of the calldata.
   */
  private void givenPools(String volatilePool, String stablePool) throws IOException {
    when(gateway.call(eq(dexProperties.aerodrome().factoryAddress()), anyString())).thenAnswer(inv -> {
      String data = inv.getArgument(1);
      boolean stable = data.endsWith("1");
      return AbiWords.hex(AbiWords.address(stable ? stablePool : volatilePool));
    });
  }
}
