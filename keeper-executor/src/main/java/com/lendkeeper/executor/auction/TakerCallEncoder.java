package com.lendkeeper.executor.auction;

import com.lendkeeper.executor.chain.AbiWords;
import lombok.NonNull;
import org.web3j.utils.Numeric;

import java.math.BigInteger;

/**
 * <pre>
 * function takeWithAtomicSwap(address pool, address borrower, uint256 auctionPrice, uint256 maxAmount,
 *                             address swapRouter, bytes swapCalldata)
 * </pre>
 */
final class TakerCallEncoder {

  private static final byte[] SELECTOR =
      AbiWords.selector("takeWithAtomicSwap(address,address,uint256,uint256,address,bytes)");

  private TakerCallEncoder() {
  }

  static String encodeTakeWithAtomicSwap(
      @NonNull String pool,
      @NonNull String borrower,
      @NonNull BigInteger auctionPrice,
      @NonNull BigInteger maxAmount,
      @NonNull String swapRouter,
      @NonNull String swapCalldataHex
  ) {
    return AbiWords.hex(
        SELECTOR,
        AbiWords.address(pool),
        AbiWords.address(borrower),
        AbiWords.uint(auctionPrice),
        AbiWords.uint(maxAmount),
        AbiWords.address(swapRouter),
        AbiWords.uint(6L * AbiWords.WORD),
        AbiWords.bytes(Numeric.hexStringToByteArray(swapCalldataHex))
    );
  }
}
