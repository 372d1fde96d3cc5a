package com.codeheadsystems.bulwark.transport.config;

import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import com.codeheadsystems.bulwark.crypto.SignatureAlgorithm;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for a {@link com.codeheadsystems.bulwark.transport.SecureTransportManager}.
 * Built once and never mutated; the {@code with...} methods return copies.
 *
 * @param clientId                    identifier written as the sender of outgoing packets
 * @param defaultEncryptionType       type used when a caller does not name one
 * @param keyRotationIntervalMs       how long keys live before rotation is due
 * @param maxPacketAgeMs              largest accepted clock distance between packet and receiver
 * @param enablePerfectForwardSecrecy discard exchange-derived keys on rotation
 * @param enableKeyEscrow             keep retired key material for recovery
 * @param defaultKeyType              key pair type generated on initialization
 * @param defaultSignatureAlgorithm   preferred signature algorithm when the key type allows it
 */
public record EncryptionConfig(
    String clientId,
    EncryptionType defaultEncryptionType,
    long keyRotationIntervalMs,
    long maxPacketAgeMs,
    boolean enablePerfectForwardSecrecy,
    boolean enableKeyEscrow,
    KeyType defaultKeyType,
    SignatureAlgorithm defaultSignatureAlgorithm
) {

  public static final long DEFAULT_KEY_ROTATION_INTERVAL_MS = Duration.ofHours(24).toMillis();
  public static final long DEFAULT_MAX_PACKET_AGE_MS = Duration.ofMinutes(5).toMillis();

  /**
   * Instantiates a new Encryption config.
   */
  public EncryptionConfig {
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("clientId is required");
    }
    Objects.requireNonNull(defaultEncryptionType, "defaultEncryptionType");
    Objects.requireNonNull(defaultKeyType, "defaultKeyType");
    Objects.requireNonNull(defaultSignatureAlgorithm, "defaultSignatureAlgorithm");
    if (keyRotationIntervalMs <= 0) {
      throw new IllegalArgumentException("keyRotationIntervalMs must be positive");
    }
    if (maxPacketAgeMs <= 0) {
      throw new IllegalArgumentException("maxPacketAgeMs must be positive");
    }
  }

  /**
   * Defaults for the given client id: AES-256-GCM, RSA-2048 keys, 24h rotation, 5 minute packet
   * age, forward secrecy on, escrow off.
   *
   * @param clientId the client id
   * @return the encryption config
   */
  public static EncryptionConfig forClient(String clientId) {
    return new EncryptionConfig(clientId, EncryptionType.AES_256_GCM, DEFAULT_KEY_ROTATION_INTERVAL_MS,
        DEFAULT_MAX_PACKET_AGE_MS, true, false, KeyType.RSA_2048, SignatureAlgorithm.RSA_SHA256);
  }

  /**
   * Defaults with a generated client id of the form {@code client_<millis>_<hex>}.
   *
   * @param clock          the clock
   * @param randomProvider the random provider
   * @return the encryption config
   */
  public static EncryptionConfig withGeneratedClientId(Clock clock, RandomProvider randomProvider) {
    return forClient("client_" + clock.millis() + "_" + randomProvider.randomHex(4));
  }

  public EncryptionConfig withClientId(String clientId) {
    return new EncryptionConfig(clientId, defaultEncryptionType, keyRotationIntervalMs, maxPacketAgeMs,
        enablePerfectForwardSecrecy, enableKeyEscrow, defaultKeyType, defaultSignatureAlgorithm);
  }

  public EncryptionConfig withDefaultEncryptionType(EncryptionType type) {
    return new EncryptionConfig(clientId, type, keyRotationIntervalMs, maxPacketAgeMs,
        enablePerfectForwardSecrecy, enableKeyEscrow, defaultKeyType, defaultSignatureAlgorithm);
  }

  public EncryptionConfig withKeyRotationInterval(Duration interval) {
    return new EncryptionConfig(clientId, defaultEncryptionType, interval.toMillis(), maxPacketAgeMs,
        enablePerfectForwardSecrecy, enableKeyEscrow, defaultKeyType, defaultSignatureAlgorithm);
  }

  public EncryptionConfig withMaxPacketAge(Duration maxPacketAge) {
    return new EncryptionConfig(clientId, defaultEncryptionType, keyRotationIntervalMs, maxPacketAge.toMillis(),
        enablePerfectForwardSecrecy, enableKeyEscrow, defaultKeyType, defaultSignatureAlgorithm);
  }

  public EncryptionConfig withPerfectForwardSecrecy(boolean enabled) {
    return new EncryptionConfig(clientId, defaultEncryptionType, keyRotationIntervalMs, maxPacketAgeMs,
        enabled, enableKeyEscrow, defaultKeyType, defaultSignatureAlgorithm);
  }

  public EncryptionConfig withKeyEscrow(boolean enabled) {
    return new EncryptionConfig(clientId, defaultEncryptionType, keyRotationIntervalMs, maxPacketAgeMs,
        enablePerfectForwardSecrecy, enabled, defaultKeyType, defaultSignatureAlgorithm);
  }

  /**
   * Copy with a key type and the matching default signature algorithm.
   *
   * @param keyType the key type
   * @return the encryption config
   */
  public EncryptionConfig withKeyType(KeyType keyType) {
    SignatureAlgorithm signature = keyType.supports(defaultSignatureAlgorithm) || !keyType.canSign()
        ? defaultSignatureAlgorithm
        : SignatureAlgorithm.defaultFor(keyType);
    return new EncryptionConfig(clientId, defaultEncryptionType, keyRotationIntervalMs, maxPacketAgeMs,
        enablePerfectForwardSecrecy, enableKeyEscrow, keyType, signature);
  }

  public EncryptionConfig withDefaultSignatureAlgorithm(SignatureAlgorithm algorithm) {
    return new EncryptionConfig(clientId, defaultEncryptionType, keyRotationIntervalMs, maxPacketAgeMs,
        enablePerfectForwardSecrecy, enableKeyEscrow, defaultKeyType, algorithm);
  }

  /**
   * The signature algorithm used with a key of the given type: the configured default when
   * compatible, otherwise the SHA-256 variant for the key. Null for keys that cannot sign.
   *
   * @param keyType the key type
   * @return the signature algorithm
   */
  public SignatureAlgorithm signatureAlgorithmFor(KeyType keyType) {
    if (!keyType.canSign()) {
      return null;
    }
    return keyType.supports(defaultSignatureAlgorithm)
        ? defaultSignatureAlgorithm
        : SignatureAlgorithm.defaultFor(keyType);
  }
}
