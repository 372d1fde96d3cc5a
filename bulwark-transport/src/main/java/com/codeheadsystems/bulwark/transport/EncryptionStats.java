package com.codeheadsystems.bulwark.transport;

/**
 * Snapshot for dashboards: totals plus the current machine states.
 *
 * @param totalOperations  encryptions, decryptions, signatures and verifications combined
 * @param transmission     the raw counters
 * @param encryptionState  current encryption state
 * @param keyExchangeState current key exchange state
 * @param keyVersion       version of the active key material, 0 when empty
 * @param hasKeyPair       whether an asymmetric key pair is loaded
 */
public record EncryptionStats(
    long totalOperations,
    TransmissionStats transmission,
    EncryptionState encryptionState,
    KeyExchangeState keyExchangeState,
    long keyVersion,
    boolean hasKeyPair) {

  static EncryptionStats of(TransmissionStats stats, EncryptionState encryptionState,
                            KeyExchangeState keyExchangeState, long keyVersion, boolean hasKeyPair) {
    long total = stats.totalEncrypted() + stats.totalDecrypted() + stats.totalSigned() + stats.totalVerified();
    return new EncryptionStats(total, stats, encryptionState, keyExchangeState, keyVersion, hasKeyPair);
  }
}
