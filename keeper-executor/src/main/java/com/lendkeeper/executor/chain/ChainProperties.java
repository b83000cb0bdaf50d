package com.lendkeeper.executor.chain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.net.URI;

@Validated
@ConfigurationProperties(prefix = "keeper.chain")
public record ChainProperties(
    /**
     * JSON-RPC endpoint used for reads and for broadcasting signed transactions.
     */
    URI rpcUrl,
    /**
     * Hex private key of the keeper account. Takes precedence over the keystore.
     */
    @JsonIgnore String privateKey,
    String keystorePath,
    @JsonIgnore String keystorePassword,
    /**
     * PoolInfoUtils deployment, used to read auction prices.
     */
    String poolInfoUtilsAddress,
    /**
     * Keeper taker contract that performs take + swap atomically. External takes are skipped without it.
     */
    String takerAddress,
    /**
     * Fallback gas limit when estimation fails.
     */
    @NotNull @Min(21_000) Long fallbackGasLimit,
    /**
     * Multiplier applied to eth_estimateGas result.
     */
    @NotNull @DecimalMin("1.0") Double gasLimitMultiplier,
    /**
     * Multiplier applied to eth_gasPrice.
     */
    @NotNull @DecimalMin("1.0") Double gasPriceMultiplier,
    @NotNull @Min(100) Long receiptPollIntervalMillis,
    @NotNull @Min(1) Integer receiptPollAttempts
) {
  public ChainProperties {
    if (rpcUrl == null) {
      rpcUrl = URI.create("https://mainnet.base.org");
    }
    if (poolInfoUtilsAddress == null) {
      poolInfoUtilsAddress = "";
    }
    if (takerAddress == null) {
      takerAddress = "";
    }
    if (fallbackGasLimit == null) {
      fallbackGasLimit = 1_000_000L;
    }
    if (gasLimitMultiplier == null) {
      gasLimitMultiplier = 1.3;
    }
    if (gasPriceMultiplier == null) {
      gasPriceMultiplier = 1.15;
    }
    if (receiptPollIntervalMillis == null) {
      receiptPollIntervalMillis = 1_000L;
    }
    if (receiptPollAttempts == null) {
      receiptPollAttempts = 120;
    }
  }

  public boolean hasTaker() {
    return !takerAddress.isBlank();
  }

  @Override
  public String toString() {
    return "ChainProperties[rpcUrl=" + rpcUrl + ", poolInfoUtilsAddress=" + poolInfoUtilsAddress
        + ", takerAddress=" + takerAddress + ", fallbackGasLimit=" + fallbackGasLimit
        + ", gasLimitMultiplier=" + gasLimitMultiplier + ", gasPriceMultiplier=" + gasPriceMultiplier
        + ", receiptPollIntervalMillis=" + receiptPollIntervalMillis + ", receiptPollAttempts=" + receiptPollAttempts + "]";
  }
}
