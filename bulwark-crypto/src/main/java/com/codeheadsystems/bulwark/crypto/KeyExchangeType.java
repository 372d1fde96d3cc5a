package com.codeheadsystems.bulwark.crypto;

/**
 * Key exchange mechanisms.
 */
public enum KeyExchangeType {
  /** Elliptic-curve Diffie-Hellman. */
  ECDH("EC"),
  /** RSA key encapsulation: a random secret wrapped under the peer's RSA key. */
  RSA("RSA"),
  /** Finite-field Diffie-Hellman. */
  DH("DH");

  private final String keyAlgorithm;

  KeyExchangeType(String keyAlgorithm) {
    this.keyAlgorithm = keyAlgorithm;
  }

  public String keyAlgorithm() {
    return keyAlgorithm;
  }
}
