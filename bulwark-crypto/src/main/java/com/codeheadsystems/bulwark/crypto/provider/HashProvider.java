package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.crypto.HashAlgorithm;

/**
 * Message digests and keyed MACs.
 */
public interface HashProvider {

  byte[] hash(byte[] data, HashAlgorithm algorithm);

  /**
   * Keyed MAC: HMAC for the SHA family, keyed BLAKE2b for {@link HashAlgorithm#BLAKE2B}.
   *
   * @param key       the key
   * @param data      the data
   * @param algorithm the algorithm
   * @return the mac
   */
  byte[] hmac(byte[] key, byte[] data, HashAlgorithm algorithm);
}
