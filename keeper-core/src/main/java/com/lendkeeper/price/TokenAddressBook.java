package com.lendkeeper.price;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves market token ids to contract addresses for sources that price by address.
 * User-configured entries win over the built-in per-chain table.
 */
public final class TokenAddressBook {

  private static final Map<Long, Map<String, String>> BUILT_IN = Map.of(
      8453L, Map.of(
          "ethereum", "0x4200000000000000000000000000000000000006",
          "weth", "0x4200000000000000000000000000000000000006",
          "usd-coin", "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913",
          "usdc", "0x833589fCD6eDb6E08f4c7C32D4f71b54bdA02913",
          "dai", "0x50c5725949A6F0c72E6C4a641F24049A917DB0Cb",
          "tether", "0xfde4C96c8593536E31F229EA8f37b2ADa2699bb2",
          "usdt", "0xfde4C96c8593536E31F229EA8f37b2ADa2699bb2",
          "wrapped-bitcoin", "0xcbB7C0000aB88B473b1f5aFd9ef808440eed33Bf",
          "wbtc", "0xcbB7C0000aB88B473b1f5aFd9ef808440eed33Bf"
      ),
      1L, Map.of(
          "ethereum", "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2",
          "weth", "0xC02aaA39b223FE8D0A0e5C4F27eAD9083C756Cc2",
          "usd-coin", "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48",
          "usdc", "0xA0b86991c6218b36c1d19D4a2e9Eb0cE3606eB48",
          "dai", "0x6B175474E89094C44Da98b954EedeAC495271d0F",
          "tether", "0xdAC17F958D2ee523a2206206994597C13D831ec7",
          "usdt", "0xdAC17F958D2ee523a2206206994597C13D831ec7",
          "wrapped-bitcoin", "0x2260FAC5E5542a773Aa44fBCfeDf7C193bc2C599",
          "wbtc", "0x2260FAC5E5542a773Aa44fBCfeDf7C193bc2C599"
      ),
      43114L, Map.of(
          "avalanche-2", "0xB31f66AA3C1e785363F0875A1B74E27b85FD66c7",
          "avax", "0xB31f66AA3C1e785363F0875A1B74E27b85FD66c7",
          "wavax", "0xB31f66AA3C1e785363F0875A1B74E27b85FD66c7",
          "usd-coin", "0xB97EF9Ef8734C71904D8002F8b6Bc66Dd9c48a6E",
          "usdc", "0xB97EF9Ef8734C71904D8002F8b6Bc66Dd9c48a6E",
          "ethereum", "0x49D5c2BdFfac6CE2BFdB6640F4F80f226bc10bAB",
          "weth", "0x49D5c2BdFfac6CE2BFdB6640F4F80f226bc10bAB"
      ),
      42161L, Map.of(
          "ethereum", "0x82aF49447D8a07e3bd95BD0d56f35241523fBab1",
          "weth", "0x82aF49447D8a07e3bd95BD0d56f35241523fBab1",
          "usd-coin", "0xaf88d065e77c8cC2239327C5EDb3A432268e5831",
          "usdc", "0xaf88d065e77c8cC2239327C5EDb3A432268e5831",
          "dai", "0xDA10009cBd5D07dd0CeCc66161FC93D7c9000da1",
          "tether", "0xFd086bC7CD5C481DCC9C85ebE478A1C0b69FCbb9",
          "usdt", "0xFd086bC7CD5C481DCC9C85ebE478A1C0b69FCbb9"
      )
  );

  private final long chainId;
  private final Map<String, String> configured;

  public TokenAddressBook(long chainId, Map<String, String> configured) {
    this.chainId = chainId;
    this.configured = configured == null ? Map.of() : configured;
  }

  public Optional<String> addressOf(String tokenId) {
    if (tokenId == null || tokenId.isBlank()) {
      return Optional.empty();
    }
    String key = tokenId.trim().toLowerCase(Locale.ROOT);
    String user = configured.get(key);
    if (user != null) {
      return Optional.of(user);
    }
    return Optional.ofNullable(BUILT_IN.getOrDefault(chainId, Map.of()).get(key));
  }

  public long chainId() {
    return chainId;
  }
}
