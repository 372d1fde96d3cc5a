package com.codeheadsystems.bulwark.transport;

import com.codeheadsystems.bulwark.model.SecureTransmissionPacket;

/**
 * A packet accepted by secure receive.
 *
 * @param plaintext the decrypted payload
 * @param packet    the verified packet
 */
public record ReceivedMessage(byte[] plaintext, SecureTransmissionPacket packet) {

  public String sender() {
    return packet.sender();
  }
}
