package com.codeheadsystems.bulwark.transport;

import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import com.codeheadsystems.bulwark.crypto.key.DestroyableSecretKey;
import java.security.KeyPair;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of all keys held by a {@link KeyManager}. A new snapshot is built for
 * every change and published atomically; an operation that captured a snapshot keeps using
 * it to completion.
 */
final class KeyMaterial {

  static final KeyMaterial EMPTY = new KeyMaterial(0L, null, null, null, Map.of(), 0L);

  /**
   * A symmetric key and how it was obtained.
   *
   * @param key     the key
   * @param derived true when derived from a key exchange rather than generated locally
   */
  record SymmetricKeyEntry(DestroyableSecretKey key, boolean derived) {
  }

  private final long version;
  private final String keyId;
  private final KeyPair keyPair;
  private final KeyType keyType;
  private final Map<EncryptionType, SymmetricKeyEntry> symmetricKeys;
  private final long createdAt;

  KeyMaterial(long version, String keyId, KeyPair keyPair, KeyType keyType,
              Map<EncryptionType, SymmetricKeyEntry> symmetricKeys, long createdAt) {
    this.version = version;
    this.keyId = keyId;
    this.keyPair = keyPair;
    this.keyType = keyType;
    EnumMap<EncryptionType, SymmetricKeyEntry> copy = new EnumMap<>(EncryptionType.class);
    copy.putAll(symmetricKeys);
    this.symmetricKeys = Collections.unmodifiableMap(copy);
    this.createdAt = createdAt;
  }

  long version() {
    return version;
  }

  String keyId() {
    return keyId;
  }

  KeyPair keyPair() {
    return keyPair;
  }

  KeyType keyType() {
    return keyType;
  }

  long createdAt() {
    return createdAt;
  }

  boolean hasKeyPair() {
    return keyPair != null;
  }

  Map<EncryptionType, SymmetricKeyEntry> symmetricKeys() {
    return symmetricKeys;
  }

  Optional<DestroyableSecretKey> symmetricKey(EncryptionType type) {
    SymmetricKeyEntry entry = symmetricKeys.get(type);
    if (entry == null || entry.key().isDestroyed()) {
      return Optional.empty();
    }
    return Optional.of(entry.key());
  }

  KeyMaterial withKeyPair(long newVersion, String newKeyId, KeyPair newKeyPair, KeyType newKeyType, long now) {
    return new KeyMaterial(newVersion, newKeyId, newKeyPair, newKeyType, symmetricKeys, now);
  }

  KeyMaterial withSymmetricKey(long newVersion, EncryptionType type, SymmetricKeyEntry entry, long now) {
    EnumMap<EncryptionType, SymmetricKeyEntry> keys = new EnumMap<>(EncryptionType.class);
    keys.putAll(symmetricKeys);
    keys.put(type, entry);
    return new KeyMaterial(newVersion, keyId, keyPair, keyType, keys, now);
  }

  boolean references(DestroyableSecretKey key) {
    for (SymmetricKeyEntry entry : symmetricKeys.values()) {
      if (entry.key() == key) {
        return true;
      }
    }
    return false;
  }

  Collection<DestroyableSecretKey> secretKeys() {
    return symmetricKeys.values().stream().map(SymmetricKeyEntry::key).toList();
  }

  List<EncryptionType> symmetricTypes() {
    return List.copyOf(symmetricKeys.keySet());
  }
}
