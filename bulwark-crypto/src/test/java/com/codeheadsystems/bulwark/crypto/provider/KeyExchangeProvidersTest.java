package com.codeheadsystems.bulwark.crypto.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.KeyExchangeType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import java.security.KeyPair;
import org.junit.jupiter.api.Test;

/**
 * Key pair generation and key agreement exercised together.
 */
class KeyExchangeProvidersTest {

  private final RandomProvider random = new RandomProvider();
  private final JcaKeyPairProvider keyPairs = new JcaKeyPairProvider(random);
  private final JcaKeyAgreementProvider agreement = new JcaKeyAgreementProvider(random);

  @Test
  void ecdh_bothSidesAgree() {
    KeyPair alice = keyPairs.generateKeyPair(KeyType.EC_P256);
    KeyPair bob = keyPairs.generateCompatibleKeyPair(alice.getPublic());

    byte[] aliceSecret = agreement.agree(alice.getPrivate(), bob.getPublic(), KeyExchangeType.ECDH);
    byte[] bobSecret = agreement.agree(bob.getPrivate(), alice.getPublic(), KeyExchangeType.ECDH);

    assertThat(aliceSecret).hasSize(32).isEqualTo(bobSecret);
  }

  @Test
  void dh_compatiblePairSharesGroup() {
    KeyPair alice = keyPairs.generateKeyPair(KeyType.DH_2048);
    KeyPair bob = keyPairs.generateCompatibleKeyPair(alice.getPublic());

    assertThat(keyPairs.keyTypeOf(bob.getPublic())).isEqualTo(KeyType.DH_2048);
    assertThat(agreement.agree(alice.getPrivate(), bob.getPublic(), KeyExchangeType.DH))
        .isEqualTo(agreement.agree(bob.getPrivate(), alice.getPublic(), KeyExchangeType.DH));
  }

  @Test
  void rsaKem_decapsulatesSameSecret() {
    KeyPair bob = keyPairs.generateKeyPair(KeyType.RSA_2048);

    KeyAgreementProvider.Encapsulation encapsulation = agreement.encapsulate(bob.getPublic());

    assertThat(agreement.decapsulate(bob.getPrivate(), encapsulation.encapsulation()))
        .isEqualTo(encapsulation.sharedSecret());
  }

  @Test
  void agree_rsa_isRejected() {
    KeyPair bob = keyPairs.generateKeyPair(KeyType.RSA_2048);
    assertThatThrownBy(() -> agreement.agree(bob.getPrivate(), bob.getPublic(), KeyExchangeType.RSA))
        .isInstanceOf(CryptoException.class);
  }

  @Test
  void agree_mismatchedCurves_fails() {
    KeyPair p256 = keyPairs.generateKeyPair(KeyType.EC_P256);
    KeyPair p384 = keyPairs.generateKeyPair(KeyType.EC_P384);

    assertThatThrownBy(() -> agreement.agree(p256.getPrivate(), p384.getPublic(), KeyExchangeType.ECDH))
        .isInstanceOf(CryptoException.class);
  }

  @Test
  void keyTypeOf_classifiesGeneratedKeys() {
    assertThat(keyPairs.keyTypeOf(keyPairs.generateKeyPair(KeyType.EC_P384).getPublic())).isEqualTo(KeyType.EC_P384);
    assertThat(keyPairs.keyTypeOf(keyPairs.generateKeyPair(KeyType.RSA_2048).getPublic())).isEqualTo(KeyType.RSA_2048);
  }

  @Test
  void decodePublicKey_roundTripsX509() {
    KeyPair ec = keyPairs.generateKeyPair(KeyType.EC_P256);

    assertThat(keyPairs.decodePublicKey(ec.getPublic().getEncoded(), KeyExchangeType.ECDH))
        .isEqualTo(ec.getPublic());
    assertThatThrownBy(() -> keyPairs.decodePublicKey(new byte[]{1, 2, 3}, KeyExchangeType.ECDH))
        .isInstanceOf(CryptoException.class);
  }
}
