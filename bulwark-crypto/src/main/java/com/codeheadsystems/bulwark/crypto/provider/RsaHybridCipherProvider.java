package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.common.ByteUtils;
import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.key.DestroyableSecretKey;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.RSAKey;
import java.util.Arrays;

/**
 * RSA hybrid encryption: RSA-OAEP wraps a fresh AES-256 key and AES-GCM encrypts the payload.
 * <p>
 * Layout: {@code I2OSP(len(wrappedKey), 2) || wrappedKey || nonce || ciphertext || tag}.
 */
public class RsaHybridCipherProvider implements AsymmetricCipherProvider {

  private static final int PREFIX_LENGTH = 2;

  private final SymmetricCipherProvider symmetric;
  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Rsa hybrid cipher provider.
   *
   * @param symmetric      the symmetric cipher used for the payload
   * @param randomProvider the random provider
   */
  public RsaHybridCipherProvider(SymmetricCipherProvider symmetric, RandomProvider randomProvider) {
    this.symmetric = symmetric;
    this.randomProvider = randomProvider;
  }

  @Override
  public byte[] encrypt(byte[] plaintext, PublicKey recipientKey, EncryptionType type) {
    checkModulus(recipientKey, type);
    byte[] contentKey = randomProvider.randomBytes(EncryptionType.AES_256_GCM.keyLengthBytes());
    try (DestroyableSecretKey key = new DestroyableSecretKey(contentKey, "AES")) {
      byte[] wrapped = RsaOaep.wrap(contentKey, recipientKey, randomProvider);
      byte[] body = symmetric.encrypt(plaintext, key, EncryptionType.AES_256_GCM);
      return ByteUtils.concat(ByteUtils.I2OSP(wrapped.length, PREFIX_LENGTH), wrapped, body);
    } finally {
      ByteUtils.zero(contentKey);
    }
  }

  @Override
  public byte[] decrypt(byte[] ciphertext, PrivateKey privateKey, EncryptionType type) {
    checkModulus(privateKey, type);
    if (ciphertext == null || ciphertext.length < PREFIX_LENGTH) {
      throw new CryptoException("Ciphertext too short");
    }
    int wrappedLength = ByteUtils.OS2IP(ciphertext, 0, PREFIX_LENGTH);
    if (ciphertext.length < PREFIX_LENGTH + wrappedLength) {
      throw new CryptoException("Ciphertext truncated");
    }
    byte[] wrapped = Arrays.copyOfRange(ciphertext, PREFIX_LENGTH, PREFIX_LENGTH + wrappedLength);
    byte[] body = Arrays.copyOfRange(ciphertext, PREFIX_LENGTH + wrappedLength, ciphertext.length);
    byte[] contentKey = RsaOaep.unwrap(wrapped, privateKey);
    try (DestroyableSecretKey key = new DestroyableSecretKey(contentKey, "AES")) {
      return symmetric.decrypt(body, key, EncryptionType.AES_256_GCM);
    } finally {
      ByteUtils.zero(contentKey);
    }
  }

  private static void checkModulus(Object key, EncryptionType type) {
    if (type.isSymmetric()) {
      throw new CryptoException("Not an asymmetric type: " + type);
    }
    if (!(key instanceof RSAKey rsaKey) || rsaKey.getModulus().bitLength() != type.keySizeBits()) {
      throw new CryptoException("Key does not match " + type);
    }
  }
}
