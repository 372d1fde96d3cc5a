package com.codeheadsystems.bulwark.crypto;

/**
 * Encryption algorithms selectable for a transmission. The name is the tag carried on the wire.
 */
public enum EncryptionType {
  AES_256_GCM(true, 256, "AES"),
  AES_128_GCM(true, 128, "AES"),
  CHACHA20_POLY1305(true, 256, "ChaCha20"),
  RSA_2048(false, 2048, "RSA"),
  RSA_4096(false, 4096, "RSA");

  private final boolean symmetric;
  private final int keySizeBits;
  private final String keyAlgorithm;

  EncryptionType(boolean symmetric, int keySizeBits, String keyAlgorithm) {
    this.symmetric = symmetric;
    this.keySizeBits = keySizeBits;
    this.keyAlgorithm = keyAlgorithm;
  }

  public boolean isSymmetric() {
    return symmetric;
  }

  public int keySizeBits() {
    return keySizeBits;
  }

  /**
   * Symmetric key length in bytes.
   *
   * @return the length
   * @throws IllegalStateException for asymmetric types
   */
  public int keyLengthBytes() {
    if (!symmetric) {
      throw new IllegalStateException(name() + " has no symmetric key length");
    }
    return keySizeBits / 8;
  }

  public String keyAlgorithm() {
    return keyAlgorithm;
  }

  /**
   * Looks up a type by its wire tag.
   *
   * @param name the name
   * @return the encryption type
   * @throws IllegalArgumentException if the tag is unknown
   */
  public static EncryptionType fromName(String name) {
    if (name == null) {
      throw new IllegalArgumentException("Encryption type is required");
    }
    return switch (name) {
      case "AES_256_GCM" -> AES_256_GCM;
      case "AES_128_GCM" -> AES_128_GCM;
      case "CHACHA20_POLY1305" -> CHACHA20_POLY1305;
      case "RSA_2048" -> RSA_2048;
      case "RSA_4096" -> RSA_4096;
      default -> throw new IllegalArgumentException("Unsupported encryption type: " + name);
    };
  }
}
