package com.codeheadsystems.bulwark.server;

import com.codeheadsystems.bulwark.access.policy.DynamicPolicy;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import com.codeheadsystems.bulwark.crypto.SignatureAlgorithm;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * YAML configuration of a {@link BulwarkNode}. Every key has a default, so an empty file is a
 * valid development configuration.
 * <p>
 * For production, supply {@code clientId} and {@code jwtSecretHex} so that peers and issued
 * tokens survive restarts. Generate the secret with: {@code openssl rand -hex 32}
 */
public class BulwarkConfiguration {

  /**
   * Client id this node signs and receives packets as.
   * Leave empty to generate {@code client_<millis>_<hex>} on startup.
   */
  private String clientId = "";

  /**
   * Encryption used when a transmission does not name one.
   */
  private EncryptionType defaultEncryptionType = EncryptionType.AES_256_GCM;

  /**
   * Key pair type generated on startup. Use {@code EC_P256} or {@code EC_P384} for ECDH peers.
   */
  private KeyType keyType = KeyType.RSA_2048;

  /**
   * Preferred signature algorithm. Must match the peers' configuration.
   * Leave unset to use the SHA-256 variant for the key type.
   */
  private SignatureAlgorithm signatureAlgorithm;

  /**
   * Seconds between scheduled key rotations.
   */
  private long keyRotationIntervalSeconds = 86_400;

  /**
   * Packets whose timestamp differs from the local clock by more than this are rejected.
   */
  private long maxPacketAgeSeconds = 300;

  /**
   * Drop exchange-derived keys on rotation.
   */
  private boolean perfectForwardSecrecy = true;

  /**
   * Keep retired key material for recovery instead of destroying it.
   */
  private boolean keyEscrow = false;

  /**
   * How long a permission decision is served from cache.
   */
  private long cacheTimeoutSeconds = 300;

  /**
   * Idle timeout of sessions.
   */
  private long sessionTimeoutSeconds = 1_800;

  /**
   * Absolute lifetime of sessions regardless of activity.
   */
  private long maxSessionLifetimeSeconds = 86_400;

  /**
   * Audit entries older than this are pruned by the cleanup.
   */
  private long auditLogRetentionDays = 30;

  /**
   * Period of the background cleanup of sessions, cache and audit log.
   */
  private long cleanupIntervalSeconds = 3_600;

  /**
   * Permission cache capacity.
   */
  private int maxCacheSize = 10_000;

  /**
   * Audit log capacity; the oldest entries are dropped first.
   */
  private int maxAuditEntries = 100_000;

  /**
   * Record permission checks in the audit log.
   */
  private boolean enableAuditLog = true;

  /**
   * Cache permission decisions.
   */
  private boolean enablePermissionCache = true;

  /**
   * Hex-encoded HMAC-SHA256 signing secret for session tokens, at least 32 bytes.
   * Leave empty for random generation (dev only, tokens become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Session token time-to-live in seconds.
   */
  private long jwtTtlSeconds = 3_600;

  /**
   * Session token issuer claim.
   */
  private String jwtIssuer = "bulwark";

  /**
   * Dynamic policies installed on startup.
   */
  private List<DynamicPolicy> policies = new ArrayList<>();

  /**
   * Gets client id.
   *
   * @return the client id
   */
  @JsonProperty
  public String getClientId() {
    return clientId;
  }

  /**
   * Sets client id.
   *
   * @param clientId the client id
   */
  @JsonProperty
  public void setClientId(String clientId) {
    this.clientId = clientId;
  }

  /**
   * Gets default encryption type.
   *
   * @return the default encryption type
   */
  @JsonProperty
  public EncryptionType getDefaultEncryptionType() {
    return defaultEncryptionType;
  }

  /**
   * Sets default encryption type.
   *
   * @param defaultEncryptionType the default encryption type
   */
  @JsonProperty
  public void setDefaultEncryptionType(EncryptionType defaultEncryptionType) {
    this.defaultEncryptionType = defaultEncryptionType;
  }

  /**
   * Gets key type.
   *
   * @return the key type
   */
  @JsonProperty
  public KeyType getKeyType() {
    return keyType;
  }

  /**
   * Sets key type.
   *
   * @param keyType the key type
   */
  @JsonProperty
  public void setKeyType(KeyType keyType) {
    this.keyType = keyType;
  }

  /**
   * Gets signature algorithm.
   *
   * @return the signature algorithm
   */
  @JsonProperty
  public SignatureAlgorithm getSignatureAlgorithm() {
    return signatureAlgorithm;
  }

  /**
   * Sets signature algorithm.
   *
   * @param signatureAlgorithm the signature algorithm
   */
  @JsonProperty
  public void setSignatureAlgorithm(SignatureAlgorithm signatureAlgorithm) {
    this.signatureAlgorithm = signatureAlgorithm;
  }

  /**
   * Gets key rotation interval seconds.
   *
   * @return the key rotation interval seconds
   */
  @JsonProperty
  public long getKeyRotationIntervalSeconds() {
    return keyRotationIntervalSeconds;
  }

  /**
   * Sets key rotation interval seconds.
   *
   * @param keyRotationIntervalSeconds the key rotation interval seconds
   */
  @JsonProperty
  public void setKeyRotationIntervalSeconds(long keyRotationIntervalSeconds) {
    this.keyRotationIntervalSeconds = keyRotationIntervalSeconds;
  }

  /**
   * Gets max packet age seconds.
   *
   * @return the max packet age seconds
   */
  @JsonProperty
  public long getMaxPacketAgeSeconds() {
    return maxPacketAgeSeconds;
  }

  /**
   * Sets max packet age seconds.
   *
   * @param maxPacketAgeSeconds the max packet age seconds
   */
  @JsonProperty
  public void setMaxPacketAgeSeconds(long maxPacketAgeSeconds) {
    this.maxPacketAgeSeconds = maxPacketAgeSeconds;
  }

  /**
   * Gets perfect forward secrecy.
   *
   * @return the perfect forward secrecy
   */
  @JsonProperty
  public boolean isPerfectForwardSecrecy() {
    return perfectForwardSecrecy;
  }

  /**
   * Sets perfect forward secrecy.
   *
   * @param perfectForwardSecrecy the perfect forward secrecy
   */
  @JsonProperty
  public void setPerfectForwardSecrecy(boolean perfectForwardSecrecy) {
    this.perfectForwardSecrecy = perfectForwardSecrecy;
  }

  /**
   * Gets key escrow.
   *
   * @return the key escrow
   */
  @JsonProperty
  public boolean isKeyEscrow() {
    return keyEscrow;
  }

  /**
   * Sets key escrow.
   *
   * @param keyEscrow the key escrow
   */
  @JsonProperty
  public void setKeyEscrow(boolean keyEscrow) {
    this.keyEscrow = keyEscrow;
  }

  /**
   * Gets cache timeout seconds.
   *
   * @return the cache timeout seconds
   */
  @JsonProperty
  public long getCacheTimeoutSeconds() {
    return cacheTimeoutSeconds;
  }

  /**
   * Sets cache timeout seconds.
   *
   * @param cacheTimeoutSeconds the cache timeout seconds
   */
  @JsonProperty
  public void setCacheTimeoutSeconds(long cacheTimeoutSeconds) {
    this.cacheTimeoutSeconds = cacheTimeoutSeconds;
  }

  /**
   * Gets session timeout seconds.
   *
   * @return the session timeout seconds
   */
  @JsonProperty
  public long getSessionTimeoutSeconds() {
    return sessionTimeoutSeconds;
  }

  /**
   * Sets session timeout seconds.
   *
   * @param sessionTimeoutSeconds the session timeout seconds
   */
  @JsonProperty
  public void setSessionTimeoutSeconds(long sessionTimeoutSeconds) {
    this.sessionTimeoutSeconds = sessionTimeoutSeconds;
  }

  /**
   * Gets max session lifetime seconds.
   *
   * @return the max session lifetime seconds
   */
  @JsonProperty
  public long getMaxSessionLifetimeSeconds() {
    return maxSessionLifetimeSeconds;
  }

  /**
   * Sets max session lifetime seconds.
   *
   * @param maxSessionLifetimeSeconds the max session lifetime seconds
   */
  @JsonProperty
  public void setMaxSessionLifetimeSeconds(long maxSessionLifetimeSeconds) {
    this.maxSessionLifetimeSeconds = maxSessionLifetimeSeconds;
  }

  /**
   * Gets audit log retention days.
   *
   * @return the audit log retention days
   */
  @JsonProperty
  public long getAuditLogRetentionDays() {
    return auditLogRetentionDays;
  }

  /**
   * Sets audit log retention days.
   *
   * @param auditLogRetentionDays the audit log retention days
   */
  @JsonProperty
  public void setAuditLogRetentionDays(long auditLogRetentionDays) {
    this.auditLogRetentionDays = auditLogRetentionDays;
  }

  /**
   * Gets cleanup interval seconds.
   *
   * @return the cleanup interval seconds
   */
  @JsonProperty
  public long getCleanupIntervalSeconds() {
    return cleanupIntervalSeconds;
  }

  /**
   * Sets cleanup interval seconds.
   *
   * @param cleanupIntervalSeconds the cleanup interval seconds
   */
  @JsonProperty
  public void setCleanupIntervalSeconds(long cleanupIntervalSeconds) {
    this.cleanupIntervalSeconds = cleanupIntervalSeconds;
  }

  /**
   * Gets max cache size.
   *
   * @return the max cache size
   */
  @JsonProperty
  public int getMaxCacheSize() {
    return maxCacheSize;
  }

  /**
   * Sets max cache size.
   *
   * @param maxCacheSize the max cache size
   */
  @JsonProperty
  public void setMaxCacheSize(int maxCacheSize) {
    this.maxCacheSize = maxCacheSize;
  }

  /**
   * Gets max audit entries.
   *
   * @return the max audit entries
   */
  @JsonProperty
  public int getMaxAuditEntries() {
    return maxAuditEntries;
  }

  /**
   * Sets max audit entries.
   *
   * @param maxAuditEntries the max audit entries
   */
  @JsonProperty
  public void setMaxAuditEntries(int maxAuditEntries) {
    this.maxAuditEntries = maxAuditEntries;
  }

  /**
   * Gets enable audit log.
   *
   * @return the enable audit log
   */
  @JsonProperty
  public boolean isEnableAuditLog() {
    return enableAuditLog;
  }

  /**
   * Sets enable audit log.
   *
   * @param enableAuditLog the enable audit log
   */
  @JsonProperty
  public void setEnableAuditLog(boolean enableAuditLog) {
    this.enableAuditLog = enableAuditLog;
  }

  /**
   * Gets enable permission cache.
   *
   * @return the enable permission cache
   */
  @JsonProperty
  public boolean isEnablePermissionCache() {
    return enablePermissionCache;
  }

  /**
   * Sets enable permission cache.
   *
   * @param enablePermissionCache the enable permission cache
   */
  @JsonProperty
  public void setEnablePermissionCache(boolean enablePermissionCache) {
    this.enablePermissionCache = enablePermissionCache;
  }

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets policies.
   *
   * @return the policies
   */
  @JsonProperty
  public List<DynamicPolicy> getPolicies() {
    return policies;
  }

  /**
   * Sets policies.
   *
   * @param policies the policies
   */
  @JsonProperty
  public void setPolicies(List<DynamicPolicy> policies) {
    this.policies = policies;
  }
}
