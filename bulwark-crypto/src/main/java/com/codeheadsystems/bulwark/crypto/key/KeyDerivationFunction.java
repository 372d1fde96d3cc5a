package com.codeheadsystems.bulwark.crypto.key;

import com.codeheadsystems.bulwark.crypto.EncryptionType;

/**
 * Derives symmetric keys from shared secrets.
 */
public interface KeyDerivationFunction {

  /**
   * Raw derivation.
   *
   * @param inputKeyMaterial the secret input
   * @param salt             optional salt, may be null
   * @param info             context label
   * @param length           output length in bytes
   * @return the derived bytes
   */
  byte[] derive(byte[] inputKeyMaterial, byte[] salt, byte[] info, int length);

  /**
   * Derives a key for the given symmetric type. The derivation is deterministic so two
   * peers holding the same shared secret obtain the same key.
   *
   * @param sharedSecret   the shared secret
   * @param encryptionType a symmetric encryption type
   * @return the key
   */
  DestroyableSecretKey deriveKey(byte[] sharedSecret, EncryptionType encryptionType);
}
