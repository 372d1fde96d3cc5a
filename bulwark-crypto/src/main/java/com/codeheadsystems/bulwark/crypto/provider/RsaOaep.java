package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.spec.MGF1ParameterSpec;
import javax.crypto.Cipher;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;

/**
 * RSA-OAEP with SHA-256 and MGF1-SHA-256.
 */
final class RsaOaep {

  private static final String TRANSFORMATION = "RSA/ECB/OAEPPadding";
  private static final OAEPParameterSpec OAEP_SHA256 = new OAEPParameterSpec(
      "SHA-256", "MGF1", MGF1ParameterSpec.SHA256, PSource.PSpecified.DEFAULT);

  private RsaOaep() {
  }

  static byte[] wrap(byte[] secret, PublicKey publicKey, RandomProvider randomProvider) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.ENCRYPT_MODE, publicKey, OAEP_SHA256, randomProvider.random());
      return cipher.doFinal(secret);
    } catch (GeneralSecurityException e) {
      throw new CryptoException("RSA-OAEP wrap failed", e);
    }
  }

  static byte[] unwrap(byte[] wrapped, PrivateKey privateKey) {
    try {
      Cipher cipher = Cipher.getInstance(TRANSFORMATION);
      cipher.init(Cipher.DECRYPT_MODE, privateKey, OAEP_SHA256);
      return cipher.doFinal(wrapped);
    } catch (GeneralSecurityException e) {
      throw new CryptoException("RSA-OAEP unwrap failed", e);
    }
  }
}
