package com.codeheadsystems.bulwark.crypto.key;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bulwark.crypto.EncryptionType;
import java.util.Arrays;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class HkdfKeyDerivationTest {

  private final HkdfKeyDerivation hkdf = new HkdfKeyDerivation();

  @Test
  void derive_rfc5869TestCase1() {
    byte[] ikm = new byte[22];
    Arrays.fill(ikm, (byte) 0x0b);
    byte[] salt = Hex.decode("000102030405060708090a0b0c");
    byte[] info = Hex.decode("f0f1f2f3f4f5f6f7f8f9");

    byte[] okm = hkdf.derive(ikm, salt, info, 42);

    assertThat(Hex.toHexString(okm)).isEqualTo(
        "3cb25f25faacd57a90434f64d0362f2a2d2d0a90cf1a5a4c5db02d56ecc4c5bf34007208d5b887185865");
  }

  @Test
  void deriveKey_isDeterministicAndTypeSeparated() {
    byte[] secret = Hex.decode("00112233445566778899aabbccddeeff");

    DestroyableSecretKey a = hkdf.deriveKey(secret, EncryptionType.AES_256_GCM);
    DestroyableSecretKey b = hkdf.deriveKey(secret, EncryptionType.AES_256_GCM);
    DestroyableSecretKey chacha = hkdf.deriveKey(secret, EncryptionType.CHACHA20_POLY1305);

    assertThat(a).isEqualTo(b);
    assertThat(a.getAlgorithm()).isEqualTo("AES");
    assertThat(a.getEncoded()).isNotEqualTo(chacha.getEncoded());
    assertThat(hkdf.deriveKey(secret, EncryptionType.AES_128_GCM).length()).isEqualTo(16);
  }

  @Test
  void deriveKey_asymmetricType_throws() {
    assertThatThrownBy(() -> hkdf.deriveKey(new byte[32], EncryptionType.RSA_2048))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
