package com.codeheadsystems.bulwark.crypto.key;

import com.codeheadsystems.bulwark.common.ByteUtils;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;

/**
 * HKDF-SHA256 (RFC 5869) backed by BouncyCastle.
 */
public class HkdfKeyDerivation implements KeyDerivationFunction {

  static final String INFO_PREFIX = "bulwark-v1 key-exchange ";

  @Override
  public byte[] derive(byte[] inputKeyMaterial, byte[] salt, byte[] info, int length) {
    if (length <= 0 || length > 255 * 32) {
      throw new IllegalArgumentException("Invalid HKDF output length: " + length);
    }
    HKDFBytesGenerator generator = new HKDFBytesGenerator(new SHA256Digest());
    generator.init(new HKDFParameters(inputKeyMaterial, salt, info));
    byte[] out = new byte[length];
    generator.generateBytes(out, 0, length);
    return out;
  }

  @Override
  public DestroyableSecretKey deriveKey(byte[] sharedSecret, EncryptionType encryptionType) {
    if (!encryptionType.isSymmetric()) {
      throw new IllegalArgumentException("Cannot derive a key for " + encryptionType);
    }
    byte[] info = (INFO_PREFIX + encryptionType.name()).getBytes(StandardCharsets.UTF_8);
    byte[] okm = derive(sharedSecret, null, info, encryptionType.keyLengthBytes());
    try {
      return new DestroyableSecretKey(okm, encryptionType.keyAlgorithm());
    } finally {
      ByteUtils.zero(okm);
    }
  }
}
