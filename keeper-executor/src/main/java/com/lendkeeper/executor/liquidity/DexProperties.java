package com.lendkeeper.executor.liquidity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "keeper.dex")
public record DexProperties(
    /**
     * Swap deadline horizon. Instructions are rebuilt per attempt, so this only bounds mempool time.
     */
    @NotNull @Min(60) Long swapDeadlineSeconds,
    @Valid Aerodrome aerodrome,
    @Valid Uniswap uniswap,
    @Valid OneInch oneInch
) {
  public DexProperties {
    if (swapDeadlineSeconds == null) {
      swapDeadlineSeconds = 1_800L;
    }
    if (aerodrome == null) {
      aerodrome = new Aerodrome(null, null);
    }
    if (uniswap == null) {
      uniswap = new Uniswap(null, null, null, null);
    }
    if (oneInch == null) {
      oneInch = new OneInch(null, null, null);
    }
  }

  public record Aerodrome(String routerAddress, String factoryAddress) {
    public Aerodrome {
      // Base mainnet deployments.
      if (routerAddress == null || routerAddress.isBlank()) {
        routerAddress = "0xcF77a3Ba9A5CA399B7c97c74d54e5b1Beb874E43";
      }
      if (factoryAddress == null || factoryAddress.isBlank()) {
        factoryAddress = "0x420DD381b31aEf6683db6B902084cB0FFECe40Da";
      }
    }
  }

  public record Uniswap(
      /**
       * QuoterV2.
       */
      String quoterAddress,
      /**
       * SwapRouter02.
       */
      String routerAddress,
      String factoryAddress,
      /**
       * Fee tier tried first, in hundredths of a basis point.
       */
      @NotNull Integer defaultFeeTier
  ) {
    public Uniswap {
      // Base mainnet deployments.
      if (quoterAddress == null || quoterAddress.isBlank()) {
        quoterAddress = "0x3d4e44Eb1374240CE5F1B871ab261CD16335B76a";
      }
      if (routerAddress == null || routerAddress.isBlank()) {
        routerAddress = "0x2626664c2603336E57B271c5C0b26F421741e481";
      }
      if (factoryAddress == null || factoryAddress.isBlank()) {
        factoryAddress = "0x33128a8fC17869897dcE68Ed026d694621f6FDfD";
      }
      if (defaultFeeTier == null) {
        defaultFeeTier = 3000;
      }
    }
  }

  public record OneInch(
      String baseUrl,
      @JsonIgnore String apiKey,
      /**
       * Minimum spacing between two API calls.
       */
      @NotNull @Min(0) Long minDelayMillis
  ) {
    public OneInch {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api.1inch.dev/swap/v6.0";
      }
      if (apiKey == null) {
        apiKey = "";
      }
      if (minDelayMillis == null) {
        minDelayMillis = 1_000L;
      }
    }

    public boolean configured() {
      return !apiKey.isBlank();
    }
  }
}
