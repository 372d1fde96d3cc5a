package com.codeheadsystems.bulwark.server;

import com.codeheadsystems.bulwark.access.auth.SessionTokenManager;
import com.codeheadsystems.bulwark.access.config.PermissionConfig;
import com.codeheadsystems.bulwark.access.manager.PermissionManager;
import com.codeheadsystems.bulwark.access.policy.PolicyEngine;
import com.codeheadsystems.bulwark.access.session.ClientContext;
import com.codeheadsystems.bulwark.access.session.SessionManager;
import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.common.SecurityResult;
import com.codeheadsystems.bulwark.common.audit.AuditLogger;
import com.codeheadsystems.bulwark.common.audit.LoggingAuditFailureHandler;
import com.codeheadsystems.bulwark.crypto.provider.CryptoProviders;
import com.codeheadsystems.bulwark.model.PacketCodec;
import com.codeheadsystems.bulwark.transport.KeyManager;
import com.codeheadsystems.bulwark.transport.KeyPairHandle;
import com.codeheadsystems.bulwark.transport.PeerKeyDirectory;
import com.codeheadsystems.bulwark.transport.SecureTransportManager;
import com.codeheadsystems.bulwark.transport.config.EncryptionConfig;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composition root: builds every component from a {@link BulwarkConfiguration} and owns their
 * lifecycles.
 * <p>
 * On construction the node generates its key pair, installs the configured dynamic policies and
 * starts a daemon thread that rotates keys when the rotation interval has elapsed.
 * {@link #shutdown()} stops the background threads and destroys all key material.
 */
public class BulwarkNode {

  private static final Logger log = LoggerFactory.getLogger(BulwarkNode.class);

  private final Clock clock;
  private final RandomProvider randomProvider;
  private final AuditLogger auditLogger;
  private final PacketCodec codec;
  private final SecureTransportManager transport;
  private final SessionManager sessionManager;
  private final PermissionManager permissionManager;
  private final SessionTokenManager tokenManager;
  private final SecureRequestHandler requestHandler;

  private final ScheduledExecutorService rotationReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "key-rotation-reaper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Builds a node on the system clock.
   *
   * @param configuration the configuration
   * @return the node
   */
  public static BulwarkNode create(BulwarkConfiguration configuration) {
    return new BulwarkNode(configuration, Clock.systemUTC(), new RandomProvider());
  }

  /**
   * Instantiates a new Bulwark node.
   *
   * @param configuration  the configuration
   * @param clock          the clock shared by every component
   * @param randomProvider the random provider
   * @throws IllegalStateException if the initial key pair cannot be generated
   */
  public BulwarkNode(BulwarkConfiguration configuration, Clock clock, RandomProvider randomProvider) {
    this.clock = clock;
    this.randomProvider = randomProvider;
    this.codec = new PacketCodec();

    PermissionConfig permissionConfig = buildPermissionConfig(configuration);
    this.auditLogger = new AuditLogger(clock, permissionConfig.maxAuditEntries(), new LoggingAuditFailureHandler());

    EncryptionConfig encryptionConfig = buildEncryptionConfig(configuration);
    CryptoProviders crypto = CryptoProviders.defaults(randomProvider);
    KeyManager keyManager = new KeyManager(crypto.keyPairs(), crypto.keyDerivation(), randomProvider,
        encryptionConfig, clock);
    this.transport = new SecureTransportManager(encryptionConfig, keyManager, crypto, codec,
        new PeerKeyDirectory(), auditLogger, clock);

    this.sessionManager = new SessionManager(clock, randomProvider, permissionConfig.sessionTimeout(),
        permissionConfig.maxSessionLifetime());
    this.tokenManager = buildTokenManager(configuration);
    this.permissionManager = new PermissionManager(permissionConfig, sessionManager, new PolicyEngine(),
        auditLogger, clock);
    if (configuration.getPolicies() != null) {
      configuration.getPolicies().forEach(permissionManager::addDynamicPolicy);
    }
    this.requestHandler = new SecureRequestHandler(transport, tokenManager, permissionManager, codec, auditLogger);

    SecurityResult<KeyPairHandle> initialized = transport.initialize();
    if (initialized.isFailure()) {
      rotationReaper.shutdown();
      permissionManager.shutdown();
      throw new IllegalStateException("Unable to initialize transport keys: " + initialized.error());
    }
    long intervalMs = encryptionConfig.keyRotationIntervalMs();
    rotationReaper.scheduleAtFixedRate(this::rotateIfDue, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    log.info("Node {} ready with key {}", encryptionConfig.clientId(), initialized.value().keyId());
  }

  /**
   * Opens a session for an authenticated subject and issues its bearer token.
   *
   * @param subject       the subject (user id)
   * @param clientContext the client context
   * @return the session token
   */
  public String openSession(String subject, ClientContext clientContext) {
    String sessionId = sessionManager.createSession(subject, clientContext);
    return tokenManager.issueToken(sessionId);
  }

  /**
   * Stops background work and destroys all key material. Safe to call more than once.
   */
  public void shutdown() {
    rotationReaper.shutdown();
    permissionManager.shutdown();
    transport.secureClear();
    log.info("Node {} shut down", transport.clientId());
  }

  public SecureTransportManager transport() {
    return transport;
  }

  public PermissionManager permissionManager() {
    return permissionManager;
  }

  public SessionManager sessionManager() {
    return sessionManager;
  }

  public SessionTokenManager tokenManager() {
    return tokenManager;
  }

  public SecureRequestHandler requestHandler() {
    return requestHandler;
  }

  public AuditLogger auditLogger() {
    return auditLogger;
  }

  public PacketCodec codec() {
    return codec;
  }

  private void rotateIfDue() {
    try {
      if (transport.rotationDue()) {
        SecurityResult<KeyPairHandle> rotated = transport.rotateKeys();
        if (rotated.isFailure()) {
          log.warn("Scheduled key rotation failed: {}", rotated.error());
        }
      }
    } catch (RuntimeException e) {
      log.warn("Scheduled key rotation failed", e);
    }
  }

  private EncryptionConfig buildEncryptionConfig(BulwarkConfiguration configuration) {
    String clientId = configuration.getClientId();
    EncryptionConfig base = clientId == null || clientId.isBlank()
        ? EncryptionConfig.withGeneratedClientId(clock, randomProvider)
        : EncryptionConfig.forClient(clientId);
    EncryptionConfig encryptionConfig = base
        .withDefaultEncryptionType(configuration.getDefaultEncryptionType())
        .withKeyType(configuration.getKeyType())
        .withKeyRotationInterval(Duration.ofSeconds(configuration.getKeyRotationIntervalSeconds()))
        .withMaxPacketAge(Duration.ofSeconds(configuration.getMaxPacketAgeSeconds()))
        .withPerfectForwardSecrecy(configuration.isPerfectForwardSecrecy())
        .withKeyEscrow(configuration.isKeyEscrow());
    return configuration.getSignatureAlgorithm() == null
        ? encryptionConfig
        : encryptionConfig.withDefaultSignatureAlgorithm(configuration.getSignatureAlgorithm());
  }

  private static PermissionConfig buildPermissionConfig(BulwarkConfiguration configuration) {
    return new PermissionConfig(
        Duration.ofSeconds(configuration.getCacheTimeoutSeconds()),
        Duration.ofSeconds(configuration.getSessionTimeoutSeconds()),
        Duration.ofSeconds(configuration.getMaxSessionLifetimeSeconds()),
        Duration.ofDays(configuration.getAuditLogRetentionDays()),
        Duration.ofSeconds(configuration.getCleanupIntervalSeconds()),
        configuration.getMaxCacheSize(),
        configuration.getMaxAuditEntries(),
        configuration.isEnableAuditLog(),
        configuration.isEnablePermissionCache());
  }

  private SessionTokenManager buildTokenManager(BulwarkConfiguration configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No token secret configured, generating randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      secret = randomProvider.randomBytes(32);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new SessionTokenManager(secret, configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getJwtTtlSeconds()), sessionManager, clock);
  }
}
