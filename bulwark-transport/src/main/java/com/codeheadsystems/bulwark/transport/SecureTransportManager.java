package com.codeheadsystems.bulwark.transport;

import com.codeheadsystems.bulwark.common.ByteUtils;
import com.codeheadsystems.bulwark.common.SecurityErrorCode;
import com.codeheadsystems.bulwark.common.SecurityResult;
import com.codeheadsystems.bulwark.common.audit.AuditEventType;
import com.codeheadsystems.bulwark.common.audit.AuditLogger;
import com.codeheadsystems.bulwark.common.audit.AuditOutcome;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.HashAlgorithm;
import com.codeheadsystems.bulwark.crypto.KeyExchangeType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import com.codeheadsystems.bulwark.crypto.SignatureAlgorithm;
import com.codeheadsystems.bulwark.crypto.key.DestroyableSecretKey;
import com.codeheadsystems.bulwark.crypto.provider.CryptoProviders;
import com.codeheadsystems.bulwark.crypto.provider.KeyAgreementProvider.Encapsulation;
import com.codeheadsystems.bulwark.model.MalformedPacketException;
import com.codeheadsystems.bulwark.model.PacketCodec;
import com.codeheadsystems.bulwark.model.SecureTransmissionPacket;
import com.codeheadsystems.bulwark.transport.config.EncryptionConfig;
import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import javax.crypto.interfaces.DHPublicKey;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Packages payloads into signed, encrypted packets and unpacks them again.
 * <p>
 * All logical operations of one instance are serialized by a fair operation lock; waiting
 * for it is interruptible and an interrupted caller gets {@code OPERATION_CANCELLED}. Each
 * operation captures one {@link KeyMaterial} snapshot and completes against it, even if a
 * rotation is requested meanwhile. In-progress states are always cleared in a
 * {@code finally} block, so observers never see a stale {@code ENCRYPTING} or
 * {@code EXCHANGING_KEYS} after a failure.
 * <p>
 * <strong>Result contract</strong>: operations return {@link SecurityResult} and throw only
 * {@link IllegalArgumentException} for missing arguments.
 * <ul>
 *   <li>{@code KEY_UNAVAILABLE}: the needed key is missing or has the wrong shape</li>
 *   <li>{@code MALFORMED_PACKET} / {@code STALE_PACKET}: rejected before any cryptography</li>
 *   <li>{@code VERIFICATION_FAILED}: any decrypt or signature failure on receive; the
 *       specific reason is only in the audit trail</li>
 * </ul>
 */
@Singleton
public class SecureTransportManager {

  private static final Logger log = LoggerFactory.getLogger(SecureTransportManager.class);

  /**
   * Symmetric type derived by key exchanges.
   */
  public static final EncryptionType EXCHANGE_KEY_TYPE = EncryptionType.AES_256_GCM;

  private final EncryptionConfig config;
  private final KeyManager keyManager;
  private final CryptoProviders crypto;
  private final PacketCodec codec;
  private final PeerKeyDirectory peers;
  private final AuditLogger auditLogger;
  private final Clock clock;

  private final ReentrantLock operationLock = new ReentrantLock(true);
  private final AtomicReference<EncryptionState> encryptionState = new AtomicReference<>(EncryptionState.IDLE);
  private final AtomicReference<KeyExchangeState> keyExchangeState =
      new AtomicReference<>(KeyExchangeState.NOT_STARTED);
  private final AtomicReference<TransmissionStats> stats = new AtomicReference<>(TransmissionStats.EMPTY);
  private final List<TransportStateListener> listeners = new CopyOnWriteArrayList<>();
  private volatile long lastRotationAt;

  /**
   * Instantiates a new Secure transport manager.
   *
   * @param config      the config
   * @param keyManager  the key manager, owned by this instance
   * @param crypto      the crypto primitives
   * @param codec       the packet codec
   * @param peers       known peer public keys
   * @param auditLogger the audit logger
   * @param clock       the clock
   */
  @Inject
  public SecureTransportManager(EncryptionConfig config,
                                KeyManager keyManager,
                                CryptoProviders crypto,
                                PacketCodec codec,
                                PeerKeyDirectory peers,
                                AuditLogger auditLogger,
                                Clock clock) {
    this.config = config;
    this.keyManager = keyManager;
    this.crypto = crypto;
    this.codec = codec;
    this.peers = peers;
    this.auditLogger = auditLogger;
    this.clock = clock;
    this.lastRotationAt = clock.millis();
  }

  // ── Keys ────────────────────────────────────────────────────────────────

  /**
   * Generates the configured default key pair and a full set of symmetric keys.
   *
   * @return the key pair handle
   */
  public SecurityResult<KeyPairHandle> initialize() {
    return exclusive("initialize", () -> {
      SecurityResult<KeyPairHandle> result = generateKeyPairLocked(config.defaultKeyType());
      if (result.isSuccess()) {
        keyManager.generateSymmetricKeys();
      }
      return result;
    });
  }

  /**
   * Generates and installs a key pair: {@code GENERATING_KEYS -> KEYS_READY}.
   *
   * @param keyType the key type
   * @return the key pair handle, or {@code KEY_GENERATION_FAILED}
   */
  public SecurityResult<KeyPairHandle> generateKeyPair(KeyType keyType) {
    return exclusive("generateKeyPair", () -> generateKeyPairLocked(keyType));
  }

  private SecurityResult<KeyPairHandle> generateKeyPairLocked(KeyType keyType) {
    transitionKeyExchange(KeyExchangeState.GENERATING_KEYS);
    KeyExchangeState outcome = KeyExchangeState.ERROR;
    try {
      SecurityResult<KeyPairHandle> result = keyManager.generateKeyPair(keyType);
      if (result.isSuccess()) {
        outcome = KeyExchangeState.KEYS_READY;
        audit(AuditEventType.KEY_GENERATED, keyType.name(), AuditOutcome.SUCCESS,
            Map.of("version", Long.toString(result.value().version())));
      } else {
        audit(AuditEventType.KEY_GENERATED, keyType.name(), AuditOutcome.FAILURE,
            Map.of("reason", result.error().message()));
      }
      return result;
    } finally {
      transitionKeyExchange(outcome);
    }
  }

  /**
   * Replaces all generated keys. With forward secrecy on, exchange-derived keys are dropped
   * and a new exchange is needed.
   *
   * @return the new key pair handle
   */
  public SecurityResult<KeyPairHandle> rotateKeys() {
    return exclusive("rotateKeys", () -> {
      long previousVersion = keyManager.version();
      SecurityResult<KeyPairHandle> result = keyManager.rotate();
      if (result.isFailure()) {
        audit(AuditEventType.KEY_ROTATED, "", AuditOutcome.FAILURE, Map.of("reason", result.error().message()));
        return result;
      }
      stats.updateAndGet(TransmissionStats::recordRotation);
      lastRotationAt = clock.millis();
      boolean keepExchange = !config.enablePerfectForwardSecrecy()
          && keyExchangeState.get() == KeyExchangeState.EXCHANGE_COMPLETE;
      if (!keepExchange) {
        transitionKeyExchange(KeyExchangeState.KEYS_READY);
      }
      audit(AuditEventType.KEY_ROTATED, "", AuditOutcome.SUCCESS, Map.of(
          "fromVersion", Long.toString(previousVersion),
          "toVersion", Long.toString(result.value().version())));
      return result;
    });
  }

  /**
   * Whether the configured rotation interval has elapsed since the last rotation.
   *
   * @return true if rotation is due
   */
  public boolean rotationDue() {
    return clock.millis() - lastRotationAt >= config.keyRotationIntervalMs();
  }

  /**
   * Destroys all keys and resets counters and states. Idempotent and never throws; waits
   * uninterruptibly for any running operation.
   */
  public void secureClear() {
    operationLock.lock();
    try {
      keyManager.clearAllKeys();
      peers.clear();
      stats.set(TransmissionStats.EMPTY);
      transitionEncryption(EncryptionState.IDLE);
      transitionKeyExchange(KeyExchangeState.NOT_STARTED);
      lastRotationAt = clock.millis();
      audit(AuditEventType.KEYS_CLEARED, "", AuditOutcome.SUCCESS, Map.of());
    } finally {
      operationLock.unlock();
    }
  }

  // ── Key exchange ────────────────────────────────────────────────────────

  /**
   * Establishes a shared symmetric key with a peer.
   * <p>
   * For ECDH and DH a key pair compatible with the remote key is generated first when
   * needed. For RSA a random secret is encapsulated under the remote key; the result's
   * encapsulation must reach the peer's {@link #completeKeyExchange(byte[])}. A generated key
   * pair and the derived key are published together, and only when every step succeeded.
   *
   * @param remotePublicKey the peer's public key
   * @param exchangeType    the mechanism
   * @return the exchange result, or {@code KEY_EXCHANGE_FAILED}
   */
  public SecurityResult<KeyExchangeResult> performKeyExchange(PublicKey remotePublicKey, KeyExchangeType exchangeType) {
    return exclusive("performKeyExchange", () -> {
      KeyExchangeState outcome = KeyExchangeState.ERROR;
      byte[] sharedSecret = null;
      try {
        if (remotePublicKey == null || !exchangeType.keyAlgorithm().equals(remotePublicKey.getAlgorithm())) {
          return exchangeFailure(exchangeType, "Remote key is not a " + exchangeType + " key");
        }
        KeyMaterial material = keyManager.snapshot();
        KeyPair localPair = material.hasKeyPair() ? material.keyPair() : null;
        KeyPair generatedPair = null;
        KeyType generatedType = null;
        if (exchangeType != KeyExchangeType.RSA && !compatible(material, remotePublicKey)) {
          transitionKeyExchange(KeyExchangeState.GENERATING_KEYS);
          generatedPair = crypto.keyPairs().generateCompatibleKeyPair(remotePublicKey);
          generatedType = crypto.keyPairs().keyTypeOf(generatedPair.getPublic());
          localPair = generatedPair;
          transitionKeyExchange(KeyExchangeState.KEYS_READY);
        }
        transitionKeyExchange(KeyExchangeState.EXCHANGING_KEYS);
        byte[] encapsulation = null;
        if (exchangeType == KeyExchangeType.RSA) {
          Encapsulation encapsulated = crypto.keyAgreement().encapsulate(remotePublicKey);
          sharedSecret = encapsulated.sharedSecret();
          encapsulation = encapsulated.encapsulation();
        } else {
          sharedSecret = crypto.keyAgreement().agree(localPair.getPrivate(), remotePublicKey, exchangeType);
        }
        long version = storeExchangeKey(generatedPair, generatedType, sharedSecret);
        byte[] localPublicKey = localPair != null ? localPair.getPublic().getEncoded() : null;
        outcome = KeyExchangeState.EXCHANGE_COMPLETE;
        audit(AuditEventType.KEY_EXCHANGE, exchangeType.name(), AuditOutcome.SUCCESS,
            Map.of("version", Long.toString(version)));
        return SecurityResult.success(
            new KeyExchangeResult(exchangeType, EXCHANGE_KEY_TYPE, localPublicKey, encapsulation, version));
      } catch (CryptoException e) {
        return exchangeFailure(exchangeType, e.getMessage());
      } finally {
        ByteUtils.zero(sharedSecret);
        transitionKeyExchange(outcome);
      }
    });
  }

  /**
   * Completes an RSA exchange started by a peer's {@link #performKeyExchange}.
   *
   * @param encapsulation the wrapped secret produced by the peer
   * @return the exchange result
   */
  public SecurityResult<KeyExchangeResult> completeKeyExchange(byte[] encapsulation) {
    return exclusive("completeKeyExchange", () -> {
      KeyMaterial material = keyManager.snapshot();
      if (!material.hasKeyPair() || material.keyType().keyExchangeType() != KeyExchangeType.RSA) {
        return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "No RSA key pair to decapsulate with");
      }
      transitionKeyExchange(KeyExchangeState.EXCHANGING_KEYS);
      KeyExchangeState outcome = KeyExchangeState.ERROR;
      byte[] sharedSecret = null;
      try {
        sharedSecret = crypto.keyAgreement().decapsulate(material.keyPair().getPrivate(), encapsulation);
        long version = storeExchangeKey(null, null, sharedSecret);
        outcome = KeyExchangeState.EXCHANGE_COMPLETE;
        audit(AuditEventType.KEY_EXCHANGE, KeyExchangeType.RSA.name(), AuditOutcome.SUCCESS,
            Map.of("version", Long.toString(version)));
        return SecurityResult.success(new KeyExchangeResult(KeyExchangeType.RSA, EXCHANGE_KEY_TYPE,
            material.keyPair().getPublic().getEncoded(), null, version));
      } catch (CryptoException e) {
        return exchangeFailure(KeyExchangeType.RSA, e.getMessage());
      } finally {
        ByteUtils.zero(sharedSecret);
        transitionKeyExchange(outcome);
      }
    });
  }

  private long storeExchangeKey(KeyPair generatedPair, KeyType generatedType, byte[] sharedSecret) {
    DestroyableSecretKey derived = keyManager.deriveSymmetricKey(sharedSecret, EXCHANGE_KEY_TYPE);
    long version = keyManager.installExchange(generatedPair, generatedType, EXCHANGE_KEY_TYPE, derived);
    stats.updateAndGet(TransmissionStats::recordKeyExchange);
    return version;
  }

  private <T> SecurityResult<T> exchangeFailure(KeyExchangeType exchangeType, String reason) {
    log.warn("Key exchange {} failed: {}", exchangeType, reason);
    audit(AuditEventType.KEY_EXCHANGE, exchangeType.name(), AuditOutcome.FAILURE, Map.of("reason", reason));
    return SecurityResult.failure(SecurityErrorCode.KEY_EXCHANGE_FAILED, reason);
  }

  private boolean compatible(KeyMaterial material, PublicKey remotePublicKey) {
    if (!material.hasKeyPair() || crypto.keyPairs().keyTypeOf(remotePublicKey) != material.keyType()) {
      return false;
    }
    if (remotePublicKey instanceof DHPublicKey remote
        && material.keyPair().getPublic() instanceof DHPublicKey local) {
      return remote.getParams().getP().equals(local.getParams().getP())
          && remote.getParams().getG().equals(local.getParams().getG());
    }
    return true;
  }

  // ── Primitive operations ────────────────────────────────────────────────

  /**
   * Encrypts with the local key of the given type. Asymmetric types encrypt to our own
   * public key.
   *
   * @param data the data
   * @param type the type
   * @return the ciphertext
   */
  public SecurityResult<byte[]> encrypt(byte[] data, EncryptionType type) {
    require(data, "data");
    require(type, "type");
    return exclusive("encrypt", () -> encryptLocked(keyManager.snapshot(), data, type, null));
  }

  /**
   * Decrypts with the local key of the given type.
   *
   * @param data the data
   * @param type the type
   * @return the plaintext
   */
  public SecurityResult<byte[]> decrypt(byte[] data, EncryptionType type) {
    require(data, "data");
    require(type, "type");
    return exclusive("decrypt", () -> decryptLocked(keyManager.snapshot(), data, type));
  }

  /**
   * Signs with the local key pair.
   *
   * @param data      the data
   * @param algorithm the algorithm, null for the configured default for our key
   * @return the signature
   */
  public SecurityResult<byte[]> sign(byte[] data, SignatureAlgorithm algorithm) {
    require(data, "data");
    return exclusive("sign", () -> signLocked(keyManager.snapshot(), data, algorithm));
  }

  /**
   * Verifies a signature. Succeeds only for a valid signature.
   *
   * @param data      the data
   * @param signature the signature
   * @param publicKey the signer's key, null for our own
   * @param algorithm the algorithm, null for the configured default for the key
   * @return success(true), or {@code VERIFICATION_FAILED}
   */
  public SecurityResult<Boolean> verifySignature(byte[] data, byte[] signature, PublicKey publicKey,
                                                 SignatureAlgorithm algorithm) {
    require(data, "data");
    require(signature, "signature");
    return exclusive("verifySignature",
        () -> verifyLocked(keyManager.snapshot(), data, signature, publicKey, algorithm));
  }

  /**
   * Hashes data. Stateless, does not take the operation lock.
   *
   * @param data      the data
   * @param algorithm the algorithm
   * @return the digest
   */
  public SecurityResult<byte[]> computeHash(byte[] data, HashAlgorithm algorithm) {
    require(data, "data");
    require(algorithm, "algorithm");
    try {
      return SecurityResult.success(crypto.hashes().hash(data, algorithm));
    } catch (CryptoException e) {
      return SecurityResult.failure(SecurityErrorCode.HASH_FAILED, e.getMessage());
    }
  }

  private SecurityResult<byte[]> encryptLocked(KeyMaterial material, byte[] data, EncryptionType type,
                                               PublicKey recipientKey) {
    return inEncryptionState(EncryptionState.ENCRYPTING, () -> {
      SecurityResult<byte[]> result = type.isSymmetric()
          ? encryptSymmetric(material, data, type)
          : encryptAsymmetric(material, data, type, recipientKey);
      if (result.isSuccess()) {
        stats.updateAndGet(s -> s.recordEncryption(data.length));
      }
      return result;
    });
  }

  private SecurityResult<byte[]> encryptSymmetric(KeyMaterial material, byte[] data, EncryptionType type) {
    Optional<DestroyableSecretKey> key = material.symmetricKey(type);
    if (key.isEmpty()) {
      return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "No " + type + " key");
    }
    try {
      return SecurityResult.success(crypto.symmetric().encrypt(data, key.get(), type));
    } catch (CryptoException e) {
      return SecurityResult.failure(SecurityErrorCode.ENCRYPTION_FAILED, e.getMessage());
    }
  }

  private SecurityResult<byte[]> encryptAsymmetric(KeyMaterial material, byte[] data, EncryptionType type,
                                                   PublicKey recipientKey) {
    PublicKey target = recipientKey;
    if (target == null) {
      if (!material.hasKeyPair()) {
        return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "No key pair");
      }
      target = material.keyPair().getPublic();
    }
    if (!supports(target, type)) {
      return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "Public key cannot be used for " + type);
    }
    try {
      return SecurityResult.success(crypto.asymmetric().encrypt(data, target, type));
    } catch (CryptoException e) {
      return SecurityResult.failure(SecurityErrorCode.ENCRYPTION_FAILED, e.getMessage());
    }
  }

  private boolean supports(PublicKey key, EncryptionType type) {
    try {
      return crypto.keyPairs().keyTypeOf(key).supports(type);
    } catch (CryptoException e) {
      log.debug("Unsupported key for {}: {}", type, e.getMessage());
      return false;
    }
  }

  private SecurityResult<byte[]> decryptLocked(KeyMaterial material, byte[] data, EncryptionType type) {
    return inEncryptionState(EncryptionState.DECRYPTING, () -> {
      SecurityResult<byte[]> result;
      if (type.isSymmetric()) {
        Optional<DestroyableSecretKey> key = material.symmetricKey(type);
        if (key.isEmpty()) {
          return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "No " + type + " key");
        }
        result = decryptWith(() -> crypto.symmetric().decrypt(data, key.get(), type));
      } else {
        if (!material.hasKeyPair() || !material.keyType().supports(type)) {
          return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "No key pair for " + type);
        }
        result = decryptWith(() -> crypto.asymmetric().decrypt(data, material.keyPair().getPrivate(), type));
      }
      if (result.isSuccess()) {
        int length = result.value().length;
        stats.updateAndGet(s -> s.recordDecryption(length));
      }
      return result;
    });
  }

  private static SecurityResult<byte[]> decryptWith(Supplier<byte[]> decryption) {
    try {
      return SecurityResult.success(decryption.get());
    } catch (CryptoException e) {
      return SecurityResult.failure(SecurityErrorCode.DECRYPTION_FAILED, e.getMessage());
    }
  }

  private SecurityResult<byte[]> signLocked(KeyMaterial material, byte[] data, SignatureAlgorithm requested) {
    return inEncryptionState(EncryptionState.SIGNING, () -> {
      if (!material.hasKeyPair()) {
        return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "No key pair");
      }
      KeyType keyType = material.keyType();
      SignatureAlgorithm algorithm = requested != null ? requested : config.signatureAlgorithmFor(keyType);
      if (algorithm == null || !keyType.supports(algorithm)) {
        return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, keyType + " key cannot sign"
            + (algorithm == null ? "" : " with " + algorithm));
      }
      try {
        byte[] signature = crypto.signatures().sign(data, material.keyPair().getPrivate(), algorithm);
        stats.updateAndGet(TransmissionStats::recordSignature);
        return SecurityResult.success(signature);
      } catch (CryptoException e) {
        return SecurityResult.failure(SecurityErrorCode.SIGNATURE_FAILED, e.getMessage());
      }
    });
  }

  private SecurityResult<Boolean> verifyLocked(KeyMaterial material, byte[] data, byte[] signature,
                                               PublicKey publicKey, SignatureAlgorithm requested) {
    return inEncryptionState(EncryptionState.VERIFYING, () -> {
      PublicKey key = publicKey;
      if (key == null) {
        if (!material.hasKeyPair()) {
          return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "No key pair");
        }
        key = material.keyPair().getPublic();
      }
      try {
        KeyType keyType = crypto.keyPairs().keyTypeOf(key);
        SignatureAlgorithm algorithm = requested != null ? requested : config.signatureAlgorithmFor(keyType);
        if (algorithm == null || !keyType.supports(algorithm)) {
          return SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, keyType + " key cannot verify");
        }
        if (!crypto.signatures().verify(data, signature, key, algorithm)) {
          return SecurityResult.failure(SecurityErrorCode.VERIFICATION_FAILED, "Signature is not valid");
        }
        stats.updateAndGet(TransmissionStats::recordVerification);
        return SecurityResult.success(Boolean.TRUE);
      } catch (CryptoException e) {
        return SecurityResult.failure(SecurityErrorCode.VERIFICATION_FAILED, e.getMessage());
      }
    });
  }

  // ── Packets ─────────────────────────────────────────────────────────────

  /**
   * Encrypts the payload, signs the ciphertext and serializes the packet.
   * Each failing step reports its own error kind.
   *
   * @param payload   the payload
   * @param recipient the recipient's client id
   * @param type      the encryption type, null for the configured default
   * @return the packet bytes
   */
  public SecurityResult<byte[]> secureTransmit(byte[] payload, String recipient, EncryptionType type) {
    require(payload, "payload");
    if (recipient == null || recipient.isBlank()) {
      throw new IllegalArgumentException("Missing required argument: recipient");
    }
    EncryptionType effective = type != null ? type : config.defaultEncryptionType();
    return exclusive("secureTransmit", () -> {
      KeyMaterial material = keyManager.snapshot();
      PublicKey recipientKey = null;
      if (!effective.isSymmetric()) {
        recipientKey = peers.lookup(recipient).orElse(null);
        if (recipientKey == null) {
          return transmitFailure(recipient,
              SecurityResult.failure(SecurityErrorCode.KEY_UNAVAILABLE, "No public key for " + recipient));
        }
      }
      SecurityResult<byte[]> ciphertext = encryptLocked(material, payload, effective, recipientKey);
      if (ciphertext.isFailure()) {
        return transmitFailure(recipient, ciphertext);
      }
      SecurityResult<byte[]> signature = signLocked(material, ciphertext.value(), null);
      if (signature.isFailure()) {
        return transmitFailure(recipient, signature);
      }
      SecureTransmissionPacket packet = new SecureTransmissionPacket(ciphertext.value(), signature.value(),
          effective, clock.millis(), config.clientId(), recipient);
      byte[] bytes = codec.encode(packet);
      stats.updateAndGet(TransmissionStats::recordSent);
      audit(AuditEventType.PACKET_SENT, recipient, AuditOutcome.SUCCESS,
          Map.of("encryptionType", effective.name(), "bytes", Integer.toString(payload.length)));
      return SecurityResult.success(bytes);
    });
  }

  private SecurityResult<byte[]> transmitFailure(String recipient, SecurityResult<byte[]> failure) {
    audit(AuditEventType.PACKET_SENT, recipient, AuditOutcome.FAILURE,
        Map.of("reason", failure.error().code().name()));
    return failure;
  }

  /**
   * Decodes, checks freshness, decrypts and verifies a packet.
   * <p>
   * Freshness is checked before any cryptographic work. Decryption and signature
   * verification both always run; if either fails the caller only learns
   * {@code VERIFICATION_FAILED}.
   *
   * @param packetBytes     the packet bytes
   * @param senderPublicKey the sender's key, null to look it up in the peer directory
   * @return the received message
   */
  public SecurityResult<ReceivedMessage> secureReceive(byte[] packetBytes, PublicKey senderPublicKey) {
    return exclusive("secureReceive", () -> {
      SecureTransmissionPacket packet;
      try {
        packet = codec.decode(packetBytes);
      } catch (MalformedPacketException e) {
        return reject(null, SecurityErrorCode.MALFORMED_PACKET, "malformed: " + e.getMessage());
      }
      long age = Math.abs(clock.millis() - packet.timestampMillis());
      if (age > config.maxPacketAgeMs()) {
        return reject(packet.sender(), SecurityErrorCode.STALE_PACKET, "stale: age " + age + "ms");
      }
      PublicKey verificationKey = senderPublicKey != null
          ? senderPublicKey
          : peers.lookup(packet.sender()).orElse(null);
      if (verificationKey == null) {
        return reject(packet.sender(), SecurityErrorCode.KEY_UNAVAILABLE, "unknown sender");
      }
      KeyMaterial material = keyManager.snapshot();
      byte[] ciphertext = packet.encryptedData();
      SecurityResult<byte[]> plaintext = decryptLocked(material, ciphertext, packet.encryptionType());
      SecurityResult<Boolean> verified = verifyLocked(material, ciphertext, packet.signature(), verificationKey, null);

      List<String> reasons = new ArrayList<>();
      if (!config.clientId().equals(packet.recipient())) {
        reasons.add("recipient mismatch");
      }
      plaintext.errorCode().ifPresent(code -> reasons.add("decrypt: " + code));
      verified.errorCode().ifPresent(code -> reasons.add("signature: " + code));
      if (!reasons.isEmpty()) {
        transitionEncryption(EncryptionState.ERROR);
        return reject(packet.sender(), SecurityErrorCode.VERIFICATION_FAILED, String.join(", ", reasons));
      }
      stats.updateAndGet(TransmissionStats::recordReceived);
      audit(AuditEventType.PACKET_RECEIVED, packet.sender(), AuditOutcome.SUCCESS,
          Map.of("encryptionType", packet.encryptionTypeName()));
      return SecurityResult.success(new ReceivedMessage(plaintext.value(), packet));
    });
  }

  private SecurityResult<ReceivedMessage> reject(String sender, SecurityErrorCode code, String reason) {
    stats.updateAndGet(TransmissionStats::recordRejected);
    log.debug("Rejected packet from {}: {}", sender, reason);
    audit(AuditEventType.PACKET_REJECTED, sender, AuditOutcome.FAILURE, Map.of("reason", reason));
    String callerMessage = code == SecurityErrorCode.VERIFICATION_FAILED ? "Packet rejected" : reason;
    return SecurityResult.failure(code, callerMessage);
  }

  // ── Peers, observers and snapshots ──────────────────────────────────────

  public void registerPeer(String clientId, PublicKey publicKey) {
    peers.register(clientId, publicKey);
  }

  /**
   * Our X.509-encoded public key.
   *
   * @return the encoded key, empty without a key pair
   */
  public Optional<byte[]> exportPublicKey() {
    return keyManager.publicKey().map(PublicKey::getEncoded);
  }

  public Optional<PublicKey> publicKey() {
    return keyManager.publicKey();
  }

  public String clientId() {
    return config.clientId();
  }

  public void addListener(TransportStateListener listener) {
    listeners.add(listener);
  }

  public void removeListener(TransportStateListener listener) {
    listeners.remove(listener);
  }

  public EncryptionState getEncryptionState() {
    return encryptionState.get();
  }

  public KeyExchangeState getKeyExchangeState() {
    return keyExchangeState.get();
  }

  public TransmissionStats getTransmissionStats() {
    return stats.get();
  }

  /**
   * Totals and current states in one snapshot.
   *
   * @return the encryption stats
   */
  public EncryptionStats getEncryptionStats() {
    return EncryptionStats.of(stats.get(), encryptionState.get(), keyExchangeState.get(),
        keyManager.version(), keyManager.hasKeyPair());
  }

  // ── Internals ───────────────────────────────────────────────────────────

  private <T> SecurityResult<T> exclusive(String operation, Supplier<SecurityResult<T>> body) {
    try {
      operationLock.lockInterruptibly();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("{} cancelled while waiting for the operation lock", operation);
      return SecurityResult.failure(SecurityErrorCode.OPERATION_CANCELLED, operation + " was cancelled");
    }
    try {
      return body.get();
    } finally {
      operationLock.unlock();
    }
  }

  private <T> SecurityResult<T> inEncryptionState(EncryptionState state, Supplier<SecurityResult<T>> step) {
    transitionEncryption(state);
    EncryptionState outcome = EncryptionState.ERROR;
    try {
      SecurityResult<T> result = step.get();
      if (result.isSuccess()) {
        outcome = EncryptionState.IDLE;
      }
      return result;
    } finally {
      transitionEncryption(outcome);
    }
  }

  private void transitionEncryption(EncryptionState next) {
    EncryptionState previous = encryptionState.getAndSet(next);
    if (previous != next) {
      for (TransportStateListener listener : listeners) {
        try {
          listener.onEncryptionStateChanged(previous, next);
        } catch (RuntimeException e) {
          log.warn("State listener failed on {} -> {}", previous, next, e);
        }
      }
    }
  }

  private void transitionKeyExchange(KeyExchangeState next) {
    KeyExchangeState previous = keyExchangeState.getAndSet(next);
    if (previous != next) {
      for (TransportStateListener listener : listeners) {
        try {
          listener.onKeyExchangeStateChanged(previous, next);
        } catch (RuntimeException e) {
          log.warn("State listener failed on {} -> {}", previous, next, e);
        }
      }
    }
  }

  private void audit(AuditEventType type, String resource, AuditOutcome outcome, Map<String, String> details) {
    auditLogger.log(type, config.clientId(), resource, outcome, details);
  }

  private static void require(Object value, String name) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required argument: " + name);
    }
  }
}
