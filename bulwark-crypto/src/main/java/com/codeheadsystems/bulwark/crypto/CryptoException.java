package com.codeheadsystems.bulwark.crypto;

/**
 * Thrown by the primitive providers when a cryptographic operation fails.
 */
public class CryptoException extends RuntimeException {

  /**
   * Instantiates a new Crypto exception.
   *
   * @param message the message
   */
  public CryptoException(String message) {
    super(message);
  }

  /**
   * Instantiates a new Crypto exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public CryptoException(String message, Throwable cause) {
    super(message, cause);
  }
}
