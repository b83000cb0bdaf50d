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
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.DynamicArray;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;

/**
 * Aerodrome (Solidly-style) pools come in a stable and a volatile flavour per pair. Without a hint the
 * volatile pool is looked up first and wins whenever it exists; the stable pool is used only when it is the
 * sole pool for the pair. A failed factory read moves on to the next variant.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AerodromeRouter implements LiquidityRouter {

  static final List<PoolVariant> DEFAULT_LOOKUP_ORDER = List.of(PoolVariant.VOLATILE, PoolVariant.STABLE);

  private static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

  private static final byte[] GET_AMOUNTS_OUT =
      AbiWords.selector("getAmountsOut(uint256,(address,address,bool,address)[])");
  private static final byte[] SWAP_EXACT_TOKENS_FOR_TOKENS =
      AbiWords.selector("swapExactTokensForTokens(uint256,uint256,(address,address,bool,address)[],address,uint256)");

  private final @NonNull ChainGateway gateway;
  private final @NonNull DexProperties dexProperties;

  @Override
  public LiquiditySource source() {
    return LiquiditySource.AERODROME;
  }

  @Override
  public PoolLookup poolExists(String tokenA, String tokenB, PoolVariant hint) {
    List<PoolVariant> order = lookupOrder(hint);
    int failures = 0;
    IOException lastFailure = null;
    for (PoolVariant variant : order) {
      try {
        String pool = getPool(tokenA, tokenB, variant == PoolVariant.STABLE);
        if (!isZero(pool)) {
          return PoolLookup.found(variant, pool);
        }
      } catch (IOException e) {
        log.warn("aerodrome getPool failed {}/{} {}: {}", tokenA, tokenB, variant, e.toString());
        failures++;
        lastFailure = e;
      }
    }
    if (failures == order.size()) {
      return PoolLookup.notFound("aerodrome factory read failed: " + lastFailure.getMessage());
    }
    return PoolLookup.notFound("no aerodrome pool for " + tokenA + "/" + tokenB + " among " + order);
  }

  @Override
  public QuoteOutcome getQuote(BigInteger amountIn, String tokenIn, String tokenOut, PoolVariant hint) {
    PoolLookup lookup = poolExists(tokenIn, tokenOut, hint);
    if (!lookup.exists()) {
      return new QuoteOutcome.NoLiquidity(lookup.reason());
    }
    boolean stable = lookup.variant() == PoolVariant.STABLE;
    String calldata = AbiWords.hex(
        GET_AMOUNTS_OUT,
        AbiWords.uint(amountIn),
        AbiWords.uint(2L * AbiWords.WORD),
        AbiWords.staticArray(List.of(route(tokenIn, tokenOut, stable)))
    );
    BigInteger amountOut;
    try {
      amountOut = lastAmount(gateway.call(dexProperties.aerodrome().routerAddress(), calldata));
    } catch (IOException | RuntimeException e) {
      log.warn("aerodrome quote failed {}->{} ({}): {}", tokenIn, tokenOut, lookup.variant(), e.toString());
      return new QuoteOutcome.NoLiquidity("aerodrome quote failed: " + e.getMessage());
    }
    if (amountOut.signum() <= 0) {
      return new QuoteOutcome.NoLiquidity("aerodrome quoted zero output for " + tokenIn + "->" + tokenOut);
    }
    return new QuoteOutcome.Quoted(new Quote(
        LiquiditySource.AERODROME, tokenIn, tokenOut, amountIn, amountOut, lookup.variant(), lookup.address(), null));
  }

  @Override
  public SwapInstruction buildSwapInstruction(Quote quote, BigInteger minOut, Instant deadline, String recipient) {
    boolean stable = quote.poolVariant() == PoolVariant.STABLE;
    String calldata = AbiWords.hex(
        SWAP_EXACT_TOKENS_FOR_TOKENS,
        AbiWords.uint(quote.amountIn()),
        AbiWords.uint(minOut),
        AbiWords.uint(5L * AbiWords.WORD),
        AbiWords.address(recipient),
        AbiWords.uint(deadline.getEpochSecond()),
        AbiWords.staticArray(List.of(route(quote.tokenIn(), quote.tokenOut(), stable)))
    );
    return new SwapInstruction(dexProperties.aerodrome().routerAddress(), calldata, BigInteger.ZERO);
  }

  static List<PoolVariant> lookupOrder(PoolVariant hint) {
    if (hint == PoolVariant.VOLATILE || hint == PoolVariant.STABLE) {
      return List.of(hint);
    }
    return DEFAULT_LOOKUP_ORDER;
  }

  private byte[] route(String from, String to, boolean stable) {
    return AbiWords.concat(
        AbiWords.address(from),
        AbiWords.address(to),
        AbiWords.bool(stable),
        AbiWords.address(dexProperties.aerodrome().factoryAddress())
    );
  }

  private String getPool(String tokenA, String tokenB, boolean stable) throws IOException {
    Function fn = new Function(
        "getPool",
        List.of(new Address(tokenA), new Address(tokenB), new Bool(stable)),
        List.of(new TypeReference<Address>() {
        })
    );
    String value = gateway.call(dexProperties.aerodrome().factoryAddress(), FunctionEncoder.encode(fn));
    List<Type> decoded = FunctionReturnDecoder.decode(value, fn.getOutputParameters());
    if (decoded == null || decoded.isEmpty()) {
      return ZERO_ADDRESS;
    }
    return decoded.get(0).getValue().toString();
  }

  private static BigInteger lastAmount(String value) {
    List<TypeReference<?>> outputs = List.of(new TypeReference<DynamicArray<Uint256>>() {
    });
    List<Type> decoded = FunctionReturnDecoder.decode(value, Utils.convert(outputs));
    if (decoded == null || decoded.isEmpty()) {
      return BigInteger.ZERO;
    }
    List<?> amounts = (List<?>) decoded.get(0).getValue();
    return amounts.isEmpty() ? BigInteger.ZERO : ((Uint256) amounts.get(amounts.size() - 1)).getValue();
  }

  private static boolean isZero(String address) {
    return address == null || ZERO_ADDRESS.equalsIgnoreCase(address) || address.isBlank();
  }
}
