package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.crypto.KeyExchangeType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import java.security.KeyPair;
import java.security.PublicKey;

/**
 * Asymmetric key pair generation and public key decoding.
 */
public interface KeyPairProvider {

  /**
   * Generates a fresh key pair.
   *
   * @param keyType the key type
   * @return the key pair
   */
  KeyPair generateKeyPair(KeyType keyType);

  /**
   * Generates a key pair on the same curve, DH group or modulus size as the given key.
   *
   * @param remoteKey the peer's public key
   * @return the key pair
   */
  KeyPair generateCompatibleKeyPair(PublicKey remoteKey);

  /**
   * Classifies a public key.
   *
   * @param publicKey the public key
   * @return the key type
   * @throws com.codeheadsystems.bulwark.crypto.CryptoException if the key is not a supported type
   */
  KeyType keyTypeOf(PublicKey publicKey);

  /**
   * Decodes an X.509 SubjectPublicKeyInfo encoding.
   *
   * @param encoded      the encoded key
   * @param exchangeType the exchange the key is intended for
   * @return the public key
   */
  PublicKey decodePublicKey(byte[] encoded, KeyExchangeType exchangeType);
}
