package com.lendkeeper.executor.liquidity;

import com.lendkeeper.config.LiquiditySource;
import com.lendkeeper.config.PoolVariant;
import com.lendkeeper.executor.chain.AbiWords;
import com.lendkeeper.executor.chain.ChainGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UniswapV3RouterTest {

  private static final String WETH = "0x4200000000000000000000000000000000000006";
  private static final String USDC = "0x833589fcd6edb6e08f4c7c32d4f71b54bda02913";
  private static final String POOL_500 = "0xd0b53d9277642d899df5c87a3966a349a798f224";
  private static final String ZERO = "0x0000000000000000000000000000000000000000";

  @Mock
  private ChainGateway gateway;

  private DexProperties dex;

  @Test
  void shouldTryDefaultFeeTierFirstWithoutDuplicates() {
    UniswapV3Router router = router(10_000);

    assertThat(router.feeTierOrder()).containsExactly(10_000, 500, 3000, 100);
  }

  @Test
  void shouldFindFirstExistingFeeTierInLookupOrder() throws Exception {
    UniswapV3Router router = router(3000);
    List<Integer> queried = new ArrayList<>();
    when(gateway.call(eq(dex.uniswap().factoryAddress()), anyString())).thenAnswer(inv -> {
      String data = inv.getArgument(1);
      int fee = new BigInteger(data.substring(data.length() - 64), 16).intValueExact();
      queried.add(fee);
      return AbiWords.hex(AbiWords.address(fee == 500 ? POOL_500 : ZERO));
    });

    PoolLookup lookup = router.poolExists(WETH, USDC, null);

    assertThat(lookup.exists()).isTrue();
    assertThat(lookup.feeTier()).isEqualTo(500);
    assertThat(lookup.variant()).isEqualTo(PoolVariant.CONCENTRATED);
    assertThat(queried).containsExactly(3000, 500);
  }

  @Test
  void shouldKeepSearchingFeeTiersAfterFailedFactoryRead() throws Exception {
    UniswapV3Router router = router(3000);
    when(gateway.call(eq(dex.uniswap().factoryAddress()), anyString())).thenAnswer(inv -> {
      String data = inv.getArgument(1);
      int fee = new BigInteger(data.substring(data.length() - 64), 16).intValueExact();
      if (fee == 3000) {
        throw new IOException("rpc timeout");
      }
      return AbiWords.hex(AbiWords.address(fee == 500 ? POOL_500 : ZERO));
    });

    PoolLookup lookup = router.poolExists(WETH, USDC, null);

    assertThat(lookup.exists()).isTrue();
    assertThat(lookup.feeTier()).isEqualTo(500);
  }

  @Test
  void shouldWrapSwapInMulticallWithDeadline() {
    UniswapV3Router router = router(3000);
    Quote quote = new Quote(LiquiditySource.UNISWAP_V3, WETH, USDC, BigInteger.TEN, BigInteger.valueOf(100),
        PoolVariant.CONCENTRATED, POOL_500, 500);

    SwapInstruction swap = router.buildSwapInstruction(quote, BigInteger.valueOf(99),
        Instant.ofEpochSecond(1_800_000_000L), "0x4444444444444444444444444444444444444444");

    assertThat(swap.router()).isEqualTo(dex.uniswap().routerAddress());
    assertThat(swap.calldata())
        .startsWith(AbiWords.selectorHex("multicall(uint256,bytes[])"))
        .contains(AbiWords.selectorHex(
            "exactInputSingle((address,address,uint24,address,uint256,uint256,uint160))").substring(2));
  }

  @Test
  void shouldRefuseSwapWithoutFeeTier() {
    Quote quote = new Quote(LiquiditySource.UNISWAP_V3, WETH, USDC, BigInteger.TEN, BigInteger.TEN,
        PoolVariant.CONCENTRATED, null, null);

    assertThatThrownBy(() -> router(3000).buildSwapInstruction(quote, BigInteger.ONE, Instant.EPOCH, WETH))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private UniswapV3Router router(int defaultFeeTier) {
    dex = new DexProperties(null, null, new DexProperties.Uniswap(null, null, null, defaultFeeTier), null);
    return new UniswapV3Router(gateway, dex);
  }
}
