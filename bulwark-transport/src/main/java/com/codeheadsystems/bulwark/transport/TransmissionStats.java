package com.codeheadsystems.bulwark.transport;

/**
 * Immutable counters for a transport manager. Updated by replacing the whole snapshot.
 *
 * @param totalEncrypted  successful encryptions
 * @param totalDecrypted  successful decryptions
 * @param totalSigned     signatures produced
 * @param totalVerified   signatures verified as valid
 * @param bytesEncrypted  plaintext bytes encrypted
 * @param bytesDecrypted  plaintext bytes recovered
 * @param keyRotations    completed key rotations
 * @param keyExchanges    completed key exchanges
 * @param packetsSent     packets produced by secure transmit
 * @param packetsReceived packets accepted by secure receive
 * @param packetsRejected packets refused by secure receive
 */
public record TransmissionStats(
    long totalEncrypted,
    long totalDecrypted,
    long totalSigned,
    long totalVerified,
    long bytesEncrypted,
    long bytesDecrypted,
    long keyRotations,
    long keyExchanges,
    long packetsSent,
    long packetsReceived,
    long packetsRejected) {

  public static final TransmissionStats EMPTY = new TransmissionStats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);

  TransmissionStats recordEncryption(long bytes) {
    return new TransmissionStats(totalEncrypted + 1, totalDecrypted, totalSigned, totalVerified,
        bytesEncrypted + bytes, bytesDecrypted, keyRotations, keyExchanges, packetsSent, packetsReceived,
        packetsRejected);
  }

  TransmissionStats recordDecryption(long bytes) {
    return new TransmissionStats(totalEncrypted, totalDecrypted + 1, totalSigned, totalVerified,
        bytesEncrypted, bytesDecrypted + bytes, keyRotations, keyExchanges, packetsSent, packetsReceived,
        packetsRejected);
  }

  TransmissionStats recordSignature() {
    return new TransmissionStats(totalEncrypted, totalDecrypted, totalSigned + 1, totalVerified,
        bytesEncrypted, bytesDecrypted, keyRotations, keyExchanges, packetsSent, packetsReceived, packetsRejected);
  }

  TransmissionStats recordVerification() {
    return new TransmissionStats(totalEncrypted, totalDecrypted, totalSigned, totalVerified + 1,
        bytesEncrypted, bytesDecrypted, keyRotations, keyExchanges, packetsSent, packetsReceived, packetsRejected);
  }

  TransmissionStats recordRotation() {
    return new TransmissionStats(totalEncrypted, totalDecrypted, totalSigned, totalVerified,
        bytesEncrypted, bytesDecrypted, keyRotations + 1, keyExchanges, packetsSent, packetsReceived,
        packetsRejected);
  }

  TransmissionStats recordKeyExchange() {
    return new TransmissionStats(totalEncrypted, totalDecrypted, totalSigned, totalVerified,
        bytesEncrypted, bytesDecrypted, keyRotations, keyExchanges + 1, packetsSent, packetsReceived,
        packetsRejected);
  }

  TransmissionStats recordSent() {
    return new TransmissionStats(totalEncrypted, totalDecrypted, totalSigned, totalVerified,
        bytesEncrypted, bytesDecrypted, keyRotations, keyExchanges, packetsSent + 1, packetsReceived,
        packetsRejected);
  }

  TransmissionStats recordReceived() {
    return new TransmissionStats(totalEncrypted, totalDecrypted, totalSigned, totalVerified,
        bytesEncrypted, bytesDecrypted, keyRotations, keyExchanges, packetsSent, packetsReceived + 1,
        packetsRejected);
  }

  TransmissionStats recordRejected() {
    return new TransmissionStats(totalEncrypted, totalDecrypted, totalSigned, totalVerified,
        bytesEncrypted, bytesDecrypted, keyRotations, keyExchanges, packetsSent, packetsReceived,
        packetsRejected + 1);
  }
}
