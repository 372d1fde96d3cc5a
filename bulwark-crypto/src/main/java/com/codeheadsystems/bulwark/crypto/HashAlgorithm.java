package com.codeheadsystems.bulwark.crypto;

/**
 * Hash algorithms. BLAKE2B is a 512-bit BLAKE2b digest and has no HMAC variant.
 */
public enum HashAlgorithm {
  SHA256("SHA-256", "HmacSHA256", 32),
  SHA512("SHA-512", "HmacSHA512", 64),
  BLAKE2B(null, null, 64);

  private final String jcaName;
  private final String hmacName;
  private final int digestLength;

  HashAlgorithm(String jcaName, String hmacName, int digestLength) {
    this.jcaName = jcaName;
    this.hmacName = hmacName;
    this.digestLength = digestLength;
  }

  /**
   * JCA {@link java.security.MessageDigest} name, null when the digest comes from BouncyCastle.
   *
   * @return the name
   */
  public String jcaName() {
    return jcaName;
  }

  public String hmacName() {
    return hmacName;
  }

  public int digestLength() {
    return digestLength;
  }
}
