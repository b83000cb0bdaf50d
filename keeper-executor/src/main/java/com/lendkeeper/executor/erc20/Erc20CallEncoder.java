package com.lendkeeper.executor.erc20;

import lombok.NonNull;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Address;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;

import java.math.BigInteger;
import java.util.List;

final class Erc20CallEncoder {

  private Erc20CallEncoder() {
  }

  static Function balanceOf(@NonNull String owner) {
    return new Function("balanceOf", List.of(new Address(owner)), List.of(new TypeReference<Uint256>() {
    }));
  }

  static Function allowance(@NonNull String owner, @NonNull String spender) {
    return new Function("allowance", List.of(new Address(owner), new Address(spender)), List.of(new TypeReference<Uint256>() {
    }));
  }

  static Function decimals() {
    return new Function("decimals", List.of(), List.of(new TypeReference<Uint8>() {
    }));
  }

  static String encodeApprove(@NonNull String spender, @NonNull BigInteger amount) {
    Function function = new Function(
        "approve",
        List.of(new Address(spender), new Uint256(amount)),
        List.of(new TypeReference<Bool>() {
        })
    );
    return FunctionEncoder.encode(function);
  }

  static String encodeTransfer(@NonNull String to, @NonNull BigInteger amount) {
    Function function = new Function(
        "transfer",
        List.of(new Address(to), new Uint256(amount)),
        List.of(new TypeReference<Bool>() {
        })
    );
    return FunctionEncoder.encode(function);
  }
}
