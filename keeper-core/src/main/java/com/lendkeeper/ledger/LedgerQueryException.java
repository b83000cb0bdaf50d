package com.lendkeeper.ledger;

public class LedgerQueryException extends RuntimeException {

  public LedgerQueryException(String message) {
    super(message);
  }

  public LedgerQueryException(String message, Throwable cause) {
    super(message, cause);
  }
}
