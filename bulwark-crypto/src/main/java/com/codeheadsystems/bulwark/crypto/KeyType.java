package com.codeheadsystems.bulwark.crypto;

/**
 * Asymmetric key pair types.
 */
public enum KeyType {
  RSA_2048("RSA", 2048, null, KeyExchangeType.RSA),
  RSA_4096("RSA", 4096, null, KeyExchangeType.RSA),
  EC_P256("EC", 256, "secp256r1", KeyExchangeType.ECDH),
  EC_P384("EC", 384, "secp384r1", KeyExchangeType.ECDH),
  DH_2048("DH", 2048, null, KeyExchangeType.DH);

  private final String algorithm;
  private final int keySizeBits;
  private final String curveName;
  private final KeyExchangeType keyExchangeType;

  KeyType(String algorithm, int keySizeBits, String curveName, KeyExchangeType keyExchangeType) {
    this.algorithm = algorithm;
    this.keySizeBits = keySizeBits;
    this.curveName = curveName;
    this.keyExchangeType = keyExchangeType;
  }

  public String algorithm() {
    return algorithm;
  }

  public int keySizeBits() {
    return keySizeBits;
  }

  /**
   * The named curve, only for EC types.
   *
   * @return the curve name or null
   */
  public String curveName() {
    return curveName;
  }

  public KeyExchangeType keyExchangeType() {
    return keyExchangeType;
  }

  /**
   * Whether a key pair of this type can produce signatures. DH keys cannot.
   *
   * @return true if signing is possible
   */
  public boolean canSign() {
    return this != DH_2048;
  }

  /**
   * Whether this key type can decrypt the given asymmetric encryption type.
   *
   * @param encryptionType the encryption type
   * @return true if the modulus size matches
   */
  public boolean supports(EncryptionType encryptionType) {
    return !encryptionType.isSymmetric()
        && "RSA".equals(algorithm)
        && keySizeBits == encryptionType.keySizeBits();
  }

  /**
   * Whether signatures of the given algorithm can be produced with this key type.
   *
   * @param signatureAlgorithm the signature algorithm
   * @return true if compatible
   */
  public boolean supports(SignatureAlgorithm signatureAlgorithm) {
    return canSign() && algorithm.equals(signatureAlgorithm.keyAlgorithm());
  }
}
