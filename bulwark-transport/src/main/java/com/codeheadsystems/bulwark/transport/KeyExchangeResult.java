package com.codeheadsystems.bulwark.transport;

import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.codeheadsystems.bulwark.crypto.KeyExchangeType;

/**
 * Outcome of a completed key exchange.
 *
 * @param exchangeType   the mechanism used
 * @param derivedKeyType the symmetric key type that was derived and stored
 * @param localPublicKey our X.509-encoded public key, for the peer's side of the exchange
 * @param encapsulation  for RSA, the wrapped secret the peer passes to
 *                       {@link SecureTransportManager#completeKeyExchange(byte[])}; otherwise null
 * @param keyVersion     key material version after the exchange
 */
public record KeyExchangeResult(
    KeyExchangeType exchangeType,
    EncryptionType derivedKeyType,
    byte[] localPublicKey,
    byte[] encapsulation,
    long keyVersion) {
}
