package com.codeheadsystems.bulwark.transport;

import com.codeheadsystems.bulwark.crypto.KeyType;
import java.security.PublicKey;

/**
 * Public description of the active key pair. Never carries the private key.
 *
 * @param keyId     random identifier of the key pair
 * @param keyType   the key type
 * @param version   key material version that introduced the pair
 * @param publicKey the public key
 * @param createdAt epoch milliseconds
 */
public record KeyPairHandle(String keyId, KeyType keyType, long version, PublicKey publicKey, long createdAt) {
}
