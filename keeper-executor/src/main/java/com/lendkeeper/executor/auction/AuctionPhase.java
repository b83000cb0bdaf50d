package com.lendkeeper.executor.auction;

public enum AuctionPhase {
  ACTIVE,
  EXTERNAL_TAKE_ELIGIBLE,
  ARB_TAKE_ELIGIBLE,
  SETTLEMENT_PENDING,
  SETTLED
}
