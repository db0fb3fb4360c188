package com.soldexhub.integration.solana.codec;

/** Binary payload does not match the layout it was read with. Always local to one event. */
public class DecodeException extends RuntimeException {
  public DecodeException(String message) {
    super(message);
  }

  public DecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
