package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.crypto.KeyExchangeType;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Shared secret establishment: Diffie-Hellman style agreement and RSA key encapsulation.
 */
public interface KeyAgreementProvider {

  /**
   * Computes the raw shared secret for ECDH or DH.
   *
   * @param privateKey   our private key
   * @param remoteKey    the peer's public key
   * @param exchangeType ECDH or DH
   * @return the shared secret, to be zeroed by the caller
   */
  byte[] agree(PrivateKey privateKey, PublicKey remoteKey, KeyExchangeType exchangeType);

  /**
   * Creates a random secret and wraps it under the peer's RSA key.
   *
   * @param remoteKey the peer's RSA public key
   * @return the encapsulation
   */
  Encapsulation encapsulate(PublicKey remoteKey);

  /**
   * Recovers the secret created by {@link #encapsulate(PublicKey)}.
   *
   * @param privateKey    our RSA private key
   * @param encapsulation the wrapped secret
   * @return the shared secret
   */
  byte[] decapsulate(PrivateKey privateKey, byte[] encapsulation);

  /**
   * Result of an RSA encapsulation.
   *
   * @param sharedSecret  the secret, kept locally
   * @param encapsulation the wrapped secret, sent to the peer
   */
  record Encapsulation(byte[] sharedSecret, byte[] encapsulation) {
  }
}
