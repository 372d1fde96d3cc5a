package com.codeheadsystems.bulwark.crypto;

/**
 * Signature algorithms, mapped to JCA names.
 */
public enum SignatureAlgorithm {
  RSA_SHA256("SHA256withRSA", "RSA"),
  RSA_SHA512("SHA512withRSA", "RSA"),
  ECDSA_SHA256("SHA256withECDSA", "EC"),
  ECDSA_SHA512("SHA512withECDSA", "EC");

  private final String jcaName;
  private final String keyAlgorithm;

  SignatureAlgorithm(String jcaName, String keyAlgorithm) {
    this.jcaName = jcaName;
    this.keyAlgorithm = keyAlgorithm;
  }

  public String jcaName() {
    return jcaName;
  }

  public String keyAlgorithm() {
    return keyAlgorithm;
  }

  /**
   * The SHA-256 variant matching a key type, or null if the key type cannot sign.
   *
   * @param keyType the key type
   * @return the default algorithm for the key
   */
  public static SignatureAlgorithm defaultFor(KeyType keyType) {
    return switch (keyType) {
      case RSA_2048, RSA_4096 -> RSA_SHA256;
      case EC_P256, EC_P384 -> ECDSA_SHA256;
      case DH_2048 -> null;
    };
  }
}
