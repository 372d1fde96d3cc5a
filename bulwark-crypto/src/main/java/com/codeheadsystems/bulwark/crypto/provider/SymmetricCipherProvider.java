package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.crypto.EncryptionType;
import javax.crypto.SecretKey;

/**
 * Authenticated symmetric encryption. Output layout is {@code nonce || ciphertext || tag}.
 * <p>
 * Implementations are stateless and thread-safe. Failures, including authentication
 * failures on decrypt, throw {@link com.codeheadsystems.bulwark.crypto.CryptoException}.
 */
public interface SymmetricCipherProvider {

  /**
   * Encrypt byte [ ].
   *
   * @param plaintext the plaintext
   * @param key       the key, its length must match the type
   * @param type      a symmetric encryption type
   * @return the byte [ ]
   */
  byte[] encrypt(byte[] plaintext, SecretKey key, EncryptionType type);

  /**
   * Decrypt byte [ ].
   *
   * @param ciphertext the ciphertext
   * @param key        the key
   * @param type       a symmetric encryption type
   * @return the byte [ ]
   */
  byte[] decrypt(byte[] ciphertext, SecretKey key, EncryptionType type);
}
