package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.SignatureAlgorithm;
import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.SignatureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RSA PKCS#1 v1.5 and ECDSA signatures through {@link Signature}.
 */
public class JcaSignatureProvider implements SignatureProvider {

  private static final Logger log = LoggerFactory.getLogger(JcaSignatureProvider.class);

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Jca signature provider.
   *
   * @param randomProvider the random provider
   */
  public JcaSignatureProvider(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  @Override
  public byte[] sign(byte[] data, PrivateKey privateKey, SignatureAlgorithm algorithm) {
    try {
      Signature signature = Signature.getInstance(algorithm.jcaName());
      signature.initSign(privateKey, randomProvider.random());
      signature.update(data);
      return signature.sign();
    } catch (GeneralSecurityException e) {
      throw new CryptoException("Signing with " + algorithm + " failed", e);
    }
  }

  @Override
  public boolean verify(byte[] data, byte[] signature, PublicKey publicKey, SignatureAlgorithm algorithm) {
    Signature verifier;
    try {
      verifier = Signature.getInstance(algorithm.jcaName());
      verifier.initVerify(publicKey);
    } catch (NoSuchAlgorithmException | InvalidKeyException e) {
      throw new CryptoException("Cannot verify with " + algorithm, e);
    }
    try {
      verifier.update(data);
      return verifier.verify(signature);
    } catch (SignatureException e) {
      log.debug("Malformed {} signature: {}", algorithm, e.getMessage());
      return false;
    }
  }
}
