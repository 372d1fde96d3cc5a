package com.codeheadsystems.bulwark.crypto.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.key.DestroyableSecretKey;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class AeadSymmetricCipherProviderTest {

  private static final byte[] MESSAGE = "attack at dawn".getBytes(StandardCharsets.UTF_8);

  private final RandomProvider random = new RandomProvider();
  private final AeadSymmetricCipherProvider provider = new AeadSymmetricCipherProvider(random);

  private DestroyableSecretKey keyFor(EncryptionType type) {
    return new DestroyableSecretKey(random.randomBytes(type.keyLengthBytes()), type.keyAlgorithm());
  }

  @ParameterizedTest
  @EnumSource(value = EncryptionType.class, names = {"AES_256_GCM", "AES_128_GCM", "CHACHA20_POLY1305"})
  void encryptThenDecrypt_recoversPlaintext(EncryptionType type) {
    DestroyableSecretKey key = keyFor(type);

    byte[] ciphertext = provider.encrypt(MESSAGE, key, type);

    assertThat(ciphertext).hasSize(AeadSymmetricCipherProvider.NONCE_LENGTH + MESSAGE.length
        + AeadSymmetricCipherProvider.TAG_LENGTH);
    assertThat(provider.decrypt(ciphertext, key, type)).isEqualTo(MESSAGE);
  }

  @ParameterizedTest
  @EnumSource(value = EncryptionType.class, names = {"AES_256_GCM", "CHACHA20_POLY1305"})
  void decrypt_tamperedCiphertext_fails(EncryptionType type) {
    DestroyableSecretKey key = keyFor(type);
    byte[] ciphertext = provider.encrypt(MESSAGE, key, type);
    ciphertext[ciphertext.length - 1] ^= 0x01;

    assertThatThrownBy(() -> provider.decrypt(ciphertext, key, type))
        .isInstanceOf(CryptoException.class)
        .hasMessageContaining("authentication failed");
  }

  @ParameterizedTest
  @EnumSource(value = EncryptionType.class, names = {"AES_256_GCM", "CHACHA20_POLY1305"})
  void decrypt_wrongKey_fails(EncryptionType type) {
    byte[] ciphertext = provider.encrypt(MESSAGE, keyFor(type), type);

    assertThatThrownBy(() -> provider.decrypt(ciphertext, keyFor(type), type))
        .isInstanceOf(CryptoException.class);
  }

  @ParameterizedTest
  @EnumSource(value = EncryptionType.class, names = {"AES_256_GCM", "AES_128_GCM"})
  void encrypt_keyLengthMismatch_fails(EncryptionType type) {
    DestroyableSecretKey wrongSize = new DestroyableSecretKey(new byte[24], "AES");

    assertThatThrownBy(() -> provider.encrypt(MESSAGE, wrongSize, type))
        .isInstanceOf(CryptoException.class)
        .hasMessageContaining("Key length");
  }

  @ParameterizedTest
  @EnumSource(value = EncryptionType.class, names = {"RSA_2048"})
  void encrypt_asymmetricType_fails(EncryptionType type) {
    assertThatThrownBy(() -> provider.encrypt(MESSAGE, keyFor(EncryptionType.AES_256_GCM), type))
        .isInstanceOf(CryptoException.class);
  }

  @ParameterizedTest
  @EnumSource(value = EncryptionType.class, names = {"AES_256_GCM"})
  void decrypt_truncatedInput_fails(EncryptionType type) {
    assertThatThrownBy(() -> provider.decrypt(new byte[10], keyFor(type), type))
        .isInstanceOf(CryptoException.class)
        .hasMessageContaining("too short");
  }
}
