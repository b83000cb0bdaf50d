package com.lendkeeper.executor.pool;

import lombok.NonNull;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.generated.Uint256;

import java.math.BigInteger;
import java.util.List;

/**
 * Calldata for the ERC-20 pool and the PoolInfoUtils read helper.
 */
final class AjnaPoolCallEncoder {

  private AjnaPoolCallEncoder() {
  }

  static String encodeKick(@NonNull String borrower, int npLimitIndex) {
    return encode("kick", List.of(new Address(borrower), new Uint256(npLimitIndex)));
  }

  static String encodeBucketTake(@NonNull String borrower, boolean depositTake, int bucketIndex) {
    return encode("bucketTake", List.of(new Address(borrower), new Bool(depositTake), new Uint256(bucketIndex)));
  }

  static String encodeSettle(@NonNull String borrower, int maxDepth) {
    return encode("settle", List.of(new Address(borrower), new Uint256(maxDepth)));
  }

  static String encodeWithdrawBonds(@NonNull String recipient, @NonNull BigInteger maxAmount) {
    return encode("withdrawBonds", List.of(new Address(recipient), new Uint256(maxAmount)));
  }

  static String encodeRemoveQuoteToken(@NonNull BigInteger maxAmount, int bucketIndex) {
    return encode("removeQuoteToken", List.of(new Uint256(maxAmount), new Uint256(bucketIndex)));
  }

  static String encodeRemoveCollateral(@NonNull BigInteger maxAmount, int bucketIndex) {
    return encode("removeCollateral", List.of(new Uint256(maxAmount), new Uint256(bucketIndex)));
  }

  static String encodeUpdateInterest() {
    return encode("updateInterest", List.of());
  }

  static Function auctionInfo(@NonNull String borrower) {
    return new Function("auctionInfo", List.of(new Address(borrower)), List.of(
        new TypeReference<Address>() {
        },
        uint(), uint(), uint(), uint(), uint(), uint(),
        new TypeReference<Address>() {
        },
        new TypeReference<Address>() {
        },
        new TypeReference<Address>() {
        }
    ));
  }

  static Function kickerInfo(@NonNull String kicker) {
    return new Function("kickerInfo", List.of(new Address(kicker)), List.of(uint(), uint()));
  }

  static Function lenderInfo(int bucketIndex, @NonNull String lender) {
    return new Function("lenderInfo", List.of(new Uint256(bucketIndex), new Address(lender)), List.of(uint(), uint()));
  }

  static Function inflatorInfo() {
    return new Function("inflatorInfo", List.of(), List.of(uint(), uint()));
  }

  static Function quoteTokenAddress() {
    return new Function("quoteTokenAddress", List.of(), List.of(new TypeReference<Address>() {
    }));
  }

  static Function collateralAddress() {
    return new Function("collateralAddress", List.of(), List.of(new TypeReference<Address>() {
    }));
  }

  /**
   * PoolInfoUtils.auctionStatus(pool, borrower).
   */
  static Function auctionStatus(@NonNull String pool, @NonNull String borrower) {
    return new Function("auctionStatus", List.of(new Address(pool), new Address(borrower)), List.of(
        uint(), uint(), uint(),
        new TypeReference<Bool>() {
        },
        uint(), uint(), uint(), uint(), uint()
    ));
  }

  /**
   * PoolInfoUtils.bucketInfo(pool, index).
   */
  static Function bucketInfo(@NonNull String pool, int bucketIndex) {
    return new Function("bucketInfo", List.of(new Address(pool), new Uint256(bucketIndex)), List.of(
        uint(), uint(), uint(), uint(), uint(), uint()
    ));
  }

  private static String encode(String name, List<Type> inputs) {
    return FunctionEncoder.encode(new Function(name, inputs, List.of()));
  }

  private static TypeReference<Uint256> uint() {
    return new TypeReference<Uint256>() {
    };
  }
}
