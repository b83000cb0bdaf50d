package com.lendkeeper.executor.liquidity;

import com.lendkeeper.config.LiquiditySource;
import com.lendkeeper.config.PoolVariant;
import com.lendkeeper.executor.chain.AbiWords;
import com.lendkeeper.executor.chain.ChainGateway;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint160;
import org.web3j.abi.datatypes.generated.Uint24;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint32;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Uniswap V3 single-hop routing. The pool variant is the fee tier; the configured default tier is tried
 * first, then the remaining standard tiers in a fixed order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UniswapV3Router implements LiquidityRouter {

  static final List<Integer> STANDARD_FEE_TIERS = List.of(500, 3000, 10000, 100);

  private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  private static final byte[] QUOTE_EXACT_INPUT_SINGLE =
      AbiWords.selector("quoteExactInputSingle((address,address,uint256,uint24,uint160))");
  private static final byte[] EXACT_INPUT_SINGLE =
      AbiWords.selector("exactInputSingle((address,address,uint24,address,uint256,uint256,uint160))");
  private static final byte[] MULTICALL_WITH_DEADLINE =
      AbiWords.selector("multicall(uint256,bytes[])");

  private final @NonNull ChainGateway gateway;
  private final @NonNull DexProperties dexProperties;

  @Override
  public LiquiditySource source() {
    return LiquiditySource.UNISWAP_V3;
  }

  @Override
  public PoolLookup poolExists(String tokenA, String tokenB, PoolVariant hint) {
    List<Integer> tiers = feeTierOrder();
    int failures = 0;
    IOException lastFailure = null;
    for (int fee : tiers) {
      try {
        String pool = getPool(tokenA, tokenB, fee);
        if (!ZERO_ADDRESS.equalsIgnoreCase(pool)) {
          return PoolLookup.found(PoolVariant.CONCENTRATED, pool, fee);
        }
      } catch (IOException e) {
        log.warn("uniswap getPool failed {}/{} fee={}: {}", tokenA, tokenB, fee, e.toString());
        failures++;
        lastFailure = e;
      }
    }
    if (failures == tiers.size()) {
      return PoolLookup.notFound("uniswap factory read failed: " + lastFailure.getMessage());
    }
    return PoolLookup.notFound("no uniswap v3 pool for " + tokenA + "/" + tokenB + " in tiers " + tiers);
  }

  @Override
  public QuoteOutcome getQuote(BigInteger amountIn, String tokenIn, String tokenOut, PoolVariant hint) {
    PoolLookup lookup = poolExists(tokenIn, tokenOut, hint);
    if (!lookup.exists()) {
      return new QuoteOutcome.NoLiquidity(lookup.reason());
    }
    String calldata = AbiWords.hex(
        QUOTE_EXACT_INPUT_SINGLE,
        AbiWords.address(tokenIn),
        AbiWords.address(tokenOut),
        AbiWords.uint(amountIn),
        AbiWords.uint(lookup.feeTier()),
        AbiWords.uint(0)
    );
    BigInteger amountOut;
    try {
      amountOut = firstAmount(gateway.call(dexProperties.uniswap().quoterAddress(), calldata));
    } catch (IOException | RuntimeException e) {
      log.warn("uniswap quote failed {}->{} fee={}: {}", tokenIn, tokenOut, lookup.feeTier(), e.toString());
      return new QuoteOutcome.NoLiquidity("uniswap quote failed: " + e.getMessage());
    }
    if (amountOut.signum() <= 0) {
      return new QuoteOutcome.NoLiquidity("uniswap quoted zero output for " + tokenIn + "->" + tokenOut);
    }
    return new QuoteOutcome.Quoted(new Quote(LiquiditySource.UNISWAP_V3, tokenIn, tokenOut, amountIn, amountOut,
        PoolVariant.CONCENTRATED, lookup.address(), lookup.feeTier()));
  }

  @Override
  public SwapInstruction buildSwapInstruction(Quote quote, BigInteger minOut, Instant deadline, String recipient) {
    if (quote.feeTier() == null) {
      throw new IllegalArgumentException("uniswap quote carries no fee tier");
    }
    byte[] exactInputSingle = AbiWords.concat(
        EXACT_INPUT_SINGLE,
        AbiWords.address(quote.tokenIn()),
        AbiWords.address(quote.tokenOut()),
        AbiWords.uint(quote.feeTier()),
        AbiWords.address(recipient),
        AbiWords.uint(quote.amountIn()),
        AbiWords.uint(minOut),
        AbiWords.uint(0)
    );
    // SwapRouter02's exactInputSingle has no deadline; the multicall overload enforces it.
    String calldata = AbiWords.hex(
        MULTICALL_WITH_DEADLINE,
        AbiWords.uint(deadline.getEpochSecond()),
        AbiWords.uint(2L * AbiWords.WORD),
        AbiWords.bytesArray(List.of(exactInputSingle))
    );
    return new SwapInstruction(dexProperties.uniswap().routerAddress(), calldata, BigInteger.ZERO);
  }

  List<Integer> feeTierOrder() {
    Set<Integer> order = new LinkedHashSet<>();
    order.add(dexProperties.uniswap().defaultFeeTier());
    order.addAll(STANDARD_FEE_TIERS);
    return List.copyOf(order);
  }

  private String getPool(String tokenA, String tokenB, int fee) throws IOException {
    Function fn = new Function(
        "getPool",
        List.of(new Address(tokenA), new Address(tokenB), new Uint24(fee)),
        List.of(new TypeReference<Address>() {
        })
    );
    String value = gateway.call(dexProperties.uniswap().factoryAddress(), FunctionEncoder.encode(fn));
    List<Type> decoded = FunctionReturnDecoder.decode(value, fn.getOutputParameters());
    if (decoded == null || decoded.isEmpty()) {
      return ZERO_ADDRESS;
    }
    return decoded.get(0).getValue().toString();
  }

  private static BigInteger firstAmount(String value) {
    Function shape = new Function("quoteExactInputSingle", List.of(), List.of(
        new TypeReference<Uint256>() {
        },
        new TypeReference<Uint160>() {
        },
        new TypeReference<Uint32>() {
        },
        new TypeReference<Uint256>() {
        }
    ));
    List<Type> decoded = FunctionReturnDecoder.decode(value, shape.getOutputParameters());
    if (decoded == null || decoded.isEmpty()) {
      return BigInteger.ZERO;
    }
    return (BigInteger) decoded.get(0).getValue();
  }
}
