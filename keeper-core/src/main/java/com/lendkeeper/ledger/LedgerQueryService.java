package com.lendkeeper.ledger;

import com.lendkeeper.domain.PoolSnapshot;

/**
 * Read-only source of pool snapshots. Results are eventually consistent and re-fetched every cycle.
 */
public interface LedgerQueryService {

  /**
   * @throws LedgerQueryException when the snapshot cannot be fetched or the pool is unknown
   */
  PoolSnapshot snapshot(String poolAddress);
}
