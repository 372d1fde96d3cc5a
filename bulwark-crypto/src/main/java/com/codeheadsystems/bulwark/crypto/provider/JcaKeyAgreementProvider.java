package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.KeyExchangeType;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import javax.crypto.KeyAgreement;

/**
 * ECDH and DH through {@link KeyAgreement}; RSA key encapsulation through RSA-OAEP.
 */
public class JcaKeyAgreementProvider implements KeyAgreementProvider {

  static final int KEM_SECRET_LENGTH = 32;

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Jca key agreement provider.
   *
   * @param randomProvider the random provider
   */
  public JcaKeyAgreementProvider(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  @Override
  public byte[] agree(PrivateKey privateKey, PublicKey remoteKey, KeyExchangeType exchangeType) {
    String algorithm = switch (exchangeType) {
      case ECDH -> "ECDH";
      case DH -> "DH";
      case RSA -> throw new CryptoException("RSA key exchange uses encapsulation, not agreement");
    };
    try {
      KeyAgreement agreement = KeyAgreement.getInstance(algorithm);
      agreement.init(privateKey, randomProvider.random());
      agreement.doPhase(remoteKey, true);
      return agreement.generateSecret();
    } catch (GeneralSecurityException | IllegalStateException e) {
      throw new CryptoException(algorithm + " key agreement failed", e);
    }
  }

  @Override
  public Encapsulation encapsulate(PublicKey remoteKey) {
    byte[] secret = randomProvider.randomBytes(KEM_SECRET_LENGTH);
    return new Encapsulation(secret, RsaOaep.wrap(secret, remoteKey, randomProvider));
  }

  @Override
  public byte[] decapsulate(PrivateKey privateKey, byte[] encapsulation) {
    byte[] secret = RsaOaep.unwrap(encapsulation, privateKey);
    if (secret.length != KEM_SECRET_LENGTH) {
      throw new CryptoException("Unexpected encapsulated secret length");
    }
    return secret;
  }
}
