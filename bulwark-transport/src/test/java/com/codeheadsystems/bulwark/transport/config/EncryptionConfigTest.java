package com.codeheadsystems.bulwark.transport.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import com.codeheadsystems.bulwark.crypto.SignatureAlgorithm;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class EncryptionConfigTest {

  @Test
  void forClient_appliesDefaults() {
    EncryptionConfig config = EncryptionConfig.forClient("alice");

    assertThat(config.defaultEncryptionType()).isEqualTo(EncryptionType.AES_256_GCM);
    assertThat(config.defaultKeyType()).isEqualTo(KeyType.RSA_2048);
    assertThat(config.keyRotationIntervalMs()).isEqualTo(Duration.ofHours(24).toMillis());
    assertThat(config.maxPacketAgeMs()).isEqualTo(Duration.ofMinutes(5).toMillis());
    assertThat(config.enablePerfectForwardSecrecy()).isTrue();
    assertThat(config.enableKeyEscrow()).isFalse();
  }

  @Test
  void constructor_blankClientId_throws() {
    assertThatThrownBy(() -> EncryptionConfig.forClient(" "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("clientId");
  }

  @Test
  void withMaxPacketAge_nonPositive_throws() {
    EncryptionConfig config = EncryptionConfig.forClient("alice");

    assertThatThrownBy(() -> config.withMaxPacketAge(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void withGeneratedClientId_usesClockAndRandomSuffix() {
    Clock clock = Clock.fixed(Instant.ofEpochMilli(1234L), ZoneOffset.UTC);

    EncryptionConfig config = EncryptionConfig.withGeneratedClientId(clock, new RandomProvider());

    assertThat(config.clientId()).matches("client_1234_[0-9a-f]{8}");
  }

  @Test
  void withKeyType_ec_switchesToEcdsa() {
    EncryptionConfig config = EncryptionConfig.forClient("alice").withKeyType(KeyType.EC_P384);

    assertThat(config.defaultSignatureAlgorithm()).isEqualTo(SignatureAlgorithm.ECDSA_SHA256);
  }

  @Test
  void signatureAlgorithmFor_prefersConfiguredDefaultWhenCompatible() {
    EncryptionConfig config = EncryptionConfig.forClient("alice")
        .withDefaultSignatureAlgorithm(SignatureAlgorithm.RSA_SHA512);

    assertThat(config.signatureAlgorithmFor(KeyType.RSA_4096)).isEqualTo(SignatureAlgorithm.RSA_SHA512);
    assertThat(config.signatureAlgorithmFor(KeyType.EC_P256)).isEqualTo(SignatureAlgorithm.ECDSA_SHA256);
    assertThat(config.signatureAlgorithmFor(KeyType.DH_2048)).isNull();
  }
}
