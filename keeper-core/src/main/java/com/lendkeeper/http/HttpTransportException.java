package com.lendkeeper.http;

public class HttpTransportException extends RuntimeException {

  private final int statusCode;

  public HttpTransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public HttpTransportException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public int statusCode() {
    return statusCode;
  }
}
