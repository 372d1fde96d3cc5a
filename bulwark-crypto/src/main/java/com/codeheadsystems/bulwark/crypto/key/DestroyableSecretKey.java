package com.codeheadsystems.bulwark.crypto.key;

import static java.util.Objects.requireNonNull;

import com.codeheadsystems.bulwark.common.ByteUtils;
import java.util.Arrays;
import java.util.Locale;
import javax.crypto.SecretKey;

/**
 * A {@link SecretKey} whose {@link #destroy()} zeroes the key bytes. The JDK's
 * {@link javax.crypto.spec.SecretKeySpec} keeps its bytes until garbage collection.
 */
public final class DestroyableSecretKey implements SecretKey, AutoCloseable {

  private volatile boolean destroyed = false;

  private final String algorithm;
  private final byte[] keyBytes;

  /**
   * Copies the given bytes into a new key.
   *
   * @param key       the key bytes, copied
   * @param algorithm the JCA algorithm name, e.g. {@code AES}
   */
  public DestroyableSecretKey(byte[] key, String algorithm) {
    this.algorithm = requireNonNull(algorithm, "algorithm");
    this.keyBytes = Arrays.copyOf(requireNonNull(key, "key"), key.length);
  }

  @Override
  public String getAlgorithm() {
    return algorithm;
  }

  @Override
  public String getFormat() {
    return "RAW";
  }

  @Override
  public byte[] getEncoded() {
    if (destroyed) {
      throw new IllegalStateException("Key has been destroyed");
    }
    return keyBytes.clone();
  }

  /**
   * Key length in bytes.
   *
   * @return the length
   */
  public int length() {
    return keyBytes.length;
  }

  @Override
  public void destroy() {
    Arrays.fill(keyBytes, (byte) 0);
    this.destroyed = true;
  }

  @Override
  public boolean isDestroyed() {
    return destroyed;
  }

  @Override
  public void close() {
    destroy();
  }

  @Override
  public boolean equals(Object other) {
    if (!(other instanceof SecretKey that)) {
      return false;
    }
    if (this.isDestroyed() || that.isDestroyed()) {
      return false;
    }
    if (!this.getAlgorithm().equalsIgnoreCase(that.getAlgorithm()) || !"RAW".equals(that.getFormat())) {
      return false;
    }
    byte[] otherKeyBytes = that.getEncoded();
    try {
      return ByteUtils.constantTimeEquals(this.keyBytes, otherKeyBytes);
    } finally {
      ByteUtils.zero(otherKeyBytes);
    }
  }

  @Override
  public int hashCode() {
    // Compatible with SecretKeySpec.hashCode()
    int retval = 0;
    for (int i = 1; i < this.keyBytes.length; i++) {
      retval += this.keyBytes[i] * i;
    }
    return retval ^ this.algorithm.toLowerCase(Locale.ENGLISH).hashCode();
  }

  @Override
  public String toString() {
    return "DestroyableSecretKey{destroyed=" + destroyed + ", algorithm='" + algorithm + "', bits="
        + keyBytes.length * 8 + '}';
  }
}
