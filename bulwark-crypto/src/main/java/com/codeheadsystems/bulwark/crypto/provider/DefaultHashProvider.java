package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.HashAlgorithm;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.bouncycastle.crypto.digests.Blake2bDigest;

/**
 * SHA-2 through the JCA, BLAKE2b through BouncyCastle.
 */
public class DefaultHashProvider implements HashProvider {

  private static final int BLAKE2B_MAX_KEY = 64;

  @Override
  public byte[] hash(byte[] data, HashAlgorithm algorithm) {
    if (algorithm == HashAlgorithm.BLAKE2B) {
      return blake2b(null, data);
    }
    try {
      return MessageDigest.getInstance(algorithm.jcaName()).digest(data);
    } catch (NoSuchAlgorithmException e) {
      throw new CryptoException(algorithm.jcaName() + " not available", e);
    }
  }

  @Override
  public byte[] hmac(byte[] key, byte[] data, HashAlgorithm algorithm) {
    if (key == null || key.length == 0) {
      throw new IllegalArgumentException("MAC key is required");
    }
    if (algorithm == HashAlgorithm.BLAKE2B) {
      if (key.length > BLAKE2B_MAX_KEY) {
        throw new IllegalArgumentException("BLAKE2b key longer than " + BLAKE2B_MAX_KEY + " bytes");
      }
      return blake2b(key, data);
    }
    try {
      Mac mac = Mac.getInstance(algorithm.hmacName());
      mac.init(new SecretKeySpec(key, algorithm.hmacName()));
      return mac.doFinal(data);
    } catch (GeneralSecurityException e) {
      throw new CryptoException(algorithm.hmacName() + " failed", e);
    }
  }

  private static byte[] blake2b(byte[] key, byte[] data) {
    Blake2bDigest digest = new Blake2bDigest(key, HashAlgorithm.BLAKE2B.digestLength(), null, null);
    digest.update(data, 0, data.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }
}
