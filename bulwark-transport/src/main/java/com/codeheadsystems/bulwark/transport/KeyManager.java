package com.codeheadsystems.bulwark.transport;

import com.codeheadsystems.bulwark.common.ByteUtils;
import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.common.SecurityErrorCode;
import com.codeheadsystems.bulwark.common.SecurityResult;
import com.codeheadsystems.bulwark.crypto.CryptoException;
import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import com.codeheadsystems.bulwark.crypto.key.DestroyableSecretKey;
import com.codeheadsystems.bulwark.crypto.key.KeyDerivationFunction;
import com.codeheadsystems.bulwark.crypto.provider.KeyPairProvider;
import com.codeheadsystems.bulwark.transport.KeyMaterial.SymmetricKeyEntry;
import com.codeheadsystems.bulwark.transport.config.EncryptionConfig;
import java.security.KeyPair;
import java.security.PublicKey;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sole owner of key material.
 * <p>
 * Reads are lock-free against the published {@link KeyMaterial} snapshot. Every mutation
 * takes the mutation lock, builds a complete new snapshot and swaps it in one step, so
 * there is never a moment without a valid key. Keys that are no longer referenced are
 * destroyed (zeroed) as soon as they are retired.
 * <p>
 * With key escrow enabled the material retired by {@link #rotate()} is kept in a ring of the
 * {@value #ESCROW_CAPACITY} most recent versions.
 * <p>
 * Private keys are only reachable from this package.
 */
public class KeyManager {

  private static final Logger log = LoggerFactory.getLogger(KeyManager.class);

  static final int ESCROW_CAPACITY = 5;

  private final KeyPairProvider keyPairs;
  private final KeyDerivationFunction keyDerivation;
  private final RandomProvider randomProvider;
  private final EncryptionConfig config;
  private final Clock clock;

  private final AtomicReference<KeyMaterial> current = new AtomicReference<>(KeyMaterial.EMPTY);
  private final ReentrantLock mutationLock = new ReentrantLock();
  // guarded by mutationLock
  private final Deque<KeyMaterial> escrow = new ArrayDeque<>();
  private long lastVersion = 0L;

  /**
   * Instantiates a new Key manager.
   *
   * @param keyPairs       the key pair provider
   * @param keyDerivation  the key derivation function
   * @param randomProvider the random provider
   * @param config         the config
   * @param clock          the clock
   */
  public KeyManager(KeyPairProvider keyPairs, KeyDerivationFunction keyDerivation, RandomProvider randomProvider,
                    EncryptionConfig config, Clock clock) {
    this.keyPairs = keyPairs;
    this.keyDerivation = keyDerivation;
    this.randomProvider = randomProvider;
    this.config = config;
    this.clock = clock;
  }

  // ── Reads ───────────────────────────────────────────────────────────────

  KeyMaterial snapshot() {
    return current.get();
  }

  public boolean hasKeyPair() {
    return current.get().hasKeyPair();
  }

  public Optional<PublicKey> publicKey() {
    KeyMaterial material = current.get();
    return material.hasKeyPair() ? Optional.of(material.keyPair().getPublic()) : Optional.empty();
  }

  public Optional<KeyType> keyType() {
    return Optional.ofNullable(current.get().keyType());
  }

  /**
   * Version of the active material; 0 when no key has been created.
   *
   * @return the version
   */
  public long version() {
    return current.get().version();
  }

  /**
   * The active key pair's public description.
   *
   * @return the handle, empty without a key pair
   */
  public Optional<KeyPairHandle> keyPairHandle() {
    KeyMaterial material = current.get();
    return material.hasKeyPair() ? Optional.of(handle(material)) : Optional.empty();
  }

  /**
   * Whether a symmetric key of the type is loaded.
   *
   * @param type the type
   * @return true if available
   */
  public boolean hasSymmetricKey(EncryptionType type) {
    return current.get().symmetricKey(type).isPresent();
  }

  /**
   * Versions of retired material held in escrow, oldest first.
   *
   * @return the versions
   */
  public List<Long> escrowedVersions() {
    mutationLock.lock();
    try {
      return escrow.stream().map(KeyMaterial::version).toList();
    } finally {
      mutationLock.unlock();
    }
  }

  // ── Generation ──────────────────────────────────────────────────────────

  /**
   * Generates and installs a new key pair. Symmetric keys are kept.
   *
   * @param keyType the key type
   * @return the new key pair handle, or {@code KEY_GENERATION_FAILED}
   */
  public SecurityResult<KeyPairHandle> generateKeyPair(KeyType keyType) {
    KeyPair keyPair;
    try {
      keyPair = keyPairs.generateKeyPair(keyType);
    } catch (CryptoException e) {
      log.warn("Key pair generation failed for {}: {}", keyType, e.getMessage());
      return SecurityResult.failure(SecurityErrorCode.KEY_GENERATION_FAILED, e.getMessage());
    }
    return SecurityResult.success(installKeyPair(keyPair, keyType));
  }

  KeyPairHandle installKeyPair(KeyPair keyPair, KeyType keyType) {
    mutationLock.lock();
    try {
      KeyMaterial next = current.get().withKeyPair(++lastVersion, randomProvider.randomHex(8), keyPair, keyType,
          clock.millis());
      current.set(next);
      log.info("Installed {} key pair, version={}", keyType, next.version());
      return handle(next);
    } finally {
      mutationLock.unlock();
    }
  }

  /**
   * Replaces every symmetric key with fresh random keys.
   *
   * @return the new material version
   */
  public long generateSymmetricKeys() {
    mutationLock.lock();
    try {
      KeyMaterial old = current.get();
      KeyMaterial next = new KeyMaterial(++lastVersion, old.keyId(), old.keyPair(), old.keyType(),
          freshSymmetricKeys(), clock.millis());
      current.set(next);
      destroyUnreferenced(old);
      log.debug("Generated symmetric keys, version={}", next.version());
      return next.version();
    } finally {
      mutationLock.unlock();
    }
  }

  /**
   * Derives a symmetric key from a shared secret.
   *
   * @param sharedSecret the shared secret
   * @param type         a symmetric type
   * @return the derived key
   */
  public DestroyableSecretKey deriveSymmetricKey(byte[] sharedSecret, EncryptionType type) {
    return keyDerivation.deriveKey(sharedSecret, type);
  }

  long storeSymmetricKey(EncryptionType type, DestroyableSecretKey key, boolean derived) {
    if (!type.isSymmetric()) {
      throw new IllegalArgumentException("Not a symmetric type: " + type);
    }
    mutationLock.lock();
    try {
      KeyMaterial old = current.get();
      KeyMaterial next = old.withSymmetricKey(++lastVersion, type, new SymmetricKeyEntry(key, derived),
          clock.millis());
      current.set(next);
      destroyUnreferenced(old);
      return next.version();
    } finally {
      mutationLock.unlock();
    }
  }

  /**
   * Publishes the result of a key exchange: an exchange-derived symmetric key and, when the
   * exchange needed one, the key pair it was computed with. Both appear in the same snapshot.
   *
   * @param keyPair the key pair generated for the exchange, or null to keep the current one
   * @param keyType the type of {@code keyPair}
   * @param type    a symmetric type
   * @param key     the derived key
   * @return the new material version
   */
  long installExchange(KeyPair keyPair, KeyType keyType, EncryptionType type, DestroyableSecretKey key) {
    if (!type.isSymmetric()) {
      throw new IllegalArgumentException("Not a symmetric type: " + type);
    }
    mutationLock.lock();
    try {
      KeyMaterial old = current.get();
      long version = ++lastVersion;
      long now = clock.millis();
      KeyMaterial base = keyPair == null
          ? old
          : old.withKeyPair(version, randomProvider.randomHex(8), keyPair, keyType, now);
      KeyMaterial next = base.withSymmetricKey(version, type, new SymmetricKeyEntry(key, true), now);
      current.set(next);
      destroyUnreferenced(old);
      if (keyPair != null) {
        log.info("Installed {} key pair for key exchange, version={}", keyType, version);
      }
      return version;
    } finally {
      mutationLock.unlock();
    }
  }

  // ── Rotation ────────────────────────────────────────────────────────────

  /**
   * Replaces the key pair and all generated symmetric keys. The new material is complete
   * before it is published. Exchange-derived keys are dropped when forward secrecy is on.
   *
   * @return the new key pair handle, or {@code KEY_GENERATION_FAILED} with the old material intact
   */
  public SecurityResult<KeyPairHandle> rotate() {
    mutationLock.lock();
    try {
      KeyMaterial old = current.get();
      KeyType keyType = old.keyType() != null ? old.keyType() : config.defaultKeyType();
      KeyPair keyPair;
      try {
        keyPair = keyPairs.generateKeyPair(keyType);
      } catch (CryptoException e) {
        log.warn("Key rotation failed, keeping version {}: {}", old.version(), e.getMessage());
        return SecurityResult.failure(SecurityErrorCode.KEY_GENERATION_FAILED, e.getMessage());
      }
      Map<EncryptionType, SymmetricKeyEntry> keys = new EnumMap<>(EncryptionType.class);
      if (!config.enablePerfectForwardSecrecy()) {
        old.symmetricKeys().forEach((type, entry) -> {
          if (entry.derived() && !entry.key().isDestroyed()) {
            keys.put(type, entry);
          }
        });
      }
      freshSymmetricKeys().forEach(keys::putIfAbsent);
      KeyMaterial next = new KeyMaterial(++lastVersion, randomProvider.randomHex(8), keyPair, keyType, keys,
          clock.millis());
      current.set(next);
      if (config.enableKeyEscrow() && old.version() > 0) {
        escrow.addLast(old);
        while (escrow.size() > ESCROW_CAPACITY) {
          destroyUnreferenced(escrow.removeFirst());
        }
      } else {
        destroyUnreferenced(old);
      }
      log.info("Rotated keys: version {} -> {}", old.version(), next.version());
      return SecurityResult.success(handle(next));
    } finally {
      mutationLock.unlock();
    }
  }

  // ── Destruction ─────────────────────────────────────────────────────────

  /**
   * Destroys all current and escrowed material. Idempotent and never throws.
   */
  public void clearAllKeys() {
    mutationLock.lock();
    try {
      KeyMaterial old = current.getAndSet(KeyMaterial.EMPTY);
      old.secretKeys().forEach(DestroyableSecretKey::destroy);
      escrow.forEach(material -> material.secretKeys().forEach(DestroyableSecretKey::destroy));
      escrow.clear();
      lastVersion = 0L;
      log.info("Cleared all key material");
    } finally {
      mutationLock.unlock();
    }
  }

  // guarded by mutationLock
  private void destroyUnreferenced(KeyMaterial retired) {
    KeyMaterial live = current.get();
    for (DestroyableSecretKey key : retired.secretKeys()) {
      boolean referenced = live.references(key) || escrow.stream().anyMatch(m -> m.references(key));
      if (!referenced) {
        key.destroy();
      }
    }
  }

  private Map<EncryptionType, SymmetricKeyEntry> freshSymmetricKeys() {
    Map<EncryptionType, SymmetricKeyEntry> keys = new EnumMap<>(EncryptionType.class);
    for (EncryptionType type : EncryptionType.values()) {
      if (type.isSymmetric()) {
        byte[] raw = randomProvider.randomBytes(type.keyLengthBytes());
        keys.put(type, new SymmetricKeyEntry(new DestroyableSecretKey(raw, type.keyAlgorithm()), false));
        ByteUtils.zero(raw);
      }
    }
    return keys;
  }

  private static KeyPairHandle handle(KeyMaterial material) {
    return new KeyPairHandle(material.keyId(), material.keyType(), material.version(),
        material.keyPair().getPublic(), material.createdAt());
  }
}
