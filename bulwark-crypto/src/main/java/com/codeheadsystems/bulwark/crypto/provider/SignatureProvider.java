package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.crypto.SignatureAlgorithm;
import java.security.PrivateKey;
import java.security.PublicKey;

/**
 * Digital signatures.
 */
public interface SignatureProvider {

  /**
   * Signs the data.
   *
   * @param data       the data
   * @param privateKey the private key
   * @param algorithm  the algorithm
   * @return the signature
   */
  byte[] sign(byte[] data, PrivateKey privateKey, SignatureAlgorithm algorithm);

  /**
   * Verifies a signature. A malformed signature yields {@code false} rather than an exception.
   *
   * @param data      the data
   * @param signature the signature
   * @param publicKey the public key
   * @param algorithm the algorithm
   * @return true if the signature is valid
   */
  boolean verify(byte[] data, byte[] signature, PublicKey publicKey, SignatureAlgorithm algorithm);
}
