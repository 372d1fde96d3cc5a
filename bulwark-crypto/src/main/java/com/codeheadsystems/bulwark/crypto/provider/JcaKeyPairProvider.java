package com.codeheadsystems.bulwark.crypto.provider;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.KeyExchangeType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.interfaces.ECPublicKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.RSAKeyGenParameterSpec;
import java.security.spec.X509EncodedKeySpec;
import javax.crypto.interfaces.DHPublicKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Key pair generation through {@link KeyPairGenerator}. All randomness comes from the
 * injected {@link RandomProvider}.
 */
public class JcaKeyPairProvider implements KeyPairProvider {

  private static final Logger log = LoggerFactory.getLogger(JcaKeyPairProvider.class);

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Jca key pair provider.
   *
   * @param randomProvider the random provider
   */
  public JcaKeyPairProvider(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  @Override
  public KeyPair generateKeyPair(KeyType keyType) {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance(keyType.algorithm());
      switch (keyType) {
        case RSA_2048, RSA_4096 -> generator.initialize(
            new RSAKeyGenParameterSpec(keyType.keySizeBits(), RSAKeyGenParameterSpec.F4), randomProvider.random());
        case EC_P256, EC_P384 -> generator.initialize(
            new ECGenParameterSpec(keyType.curveName()), randomProvider.random());
        case DH_2048 -> generator.initialize(keyType.keySizeBits(), randomProvider.random());
        default -> throw new CryptoException("Unsupported key type: " + keyType);
      }
      KeyPair keyPair = generator.generateKeyPair();
      log.debug("Generated {} key pair", keyType);
      return keyPair;
    } catch (GeneralSecurityException e) {
      throw new CryptoException("Key pair generation failed for " + keyType, e);
    }
  }

  @Override
  public KeyPair generateCompatibleKeyPair(PublicKey remoteKey) {
    if (remoteKey instanceof DHPublicKey dhKey) {
      try {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("DH");
        generator.initialize(dhKey.getParams(), randomProvider.random());
        return generator.generateKeyPair();
      } catch (GeneralSecurityException e) {
        throw new CryptoException("DH key pair generation failed", e);
      }
    }
    return generateKeyPair(keyTypeOf(remoteKey));
  }

  @Override
  public KeyType keyTypeOf(PublicKey publicKey) {
    if (publicKey instanceof RSAPublicKey rsa) {
      int bits = rsa.getModulus().bitLength();
      if (bits == 2048) {
        return KeyType.RSA_2048;
      } else if (bits == 4096) {
        return KeyType.RSA_4096;
      }
      throw new CryptoException("Unsupported RSA modulus size: " + bits);
    } else if (publicKey instanceof ECPublicKey ec) {
      int fieldSize = ec.getParams().getCurve().getField().getFieldSize();
      if (fieldSize == 256) {
        return KeyType.EC_P256;
      } else if (fieldSize == 384) {
        return KeyType.EC_P384;
      }
      throw new CryptoException("Unsupported EC field size: " + fieldSize);
    } else if (publicKey instanceof DHPublicKey dh) {
      int bits = dh.getParams().getP().bitLength();
      if (bits == 2048) {
        return KeyType.DH_2048;
      }
      throw new CryptoException("Unsupported DH group size: " + bits);
    }
    throw new CryptoException("Unsupported public key: " + (publicKey == null ? "null" : publicKey.getAlgorithm()));
  }

  @Override
  public PublicKey decodePublicKey(byte[] encoded, KeyExchangeType exchangeType) {
    try {
      return KeyFactory.getInstance(exchangeType.keyAlgorithm()).generatePublic(new X509EncodedKeySpec(encoded));
    } catch (GeneralSecurityException | IllegalArgumentException e) {
      throw new CryptoException("Invalid " + exchangeType + " public key encoding", e);
    }
  }
}
