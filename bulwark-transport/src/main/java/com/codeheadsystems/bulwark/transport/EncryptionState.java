package com.codeheadsystems.bulwark.transport;

/**
 * Lifecycle of cryptographic operations on a transport manager. {@link #ERROR} is
 * recoverable: the next operation starts from it.
 */
public enum EncryptionState {
  IDLE,
  ENCRYPTING,
  DECRYPTING,
  SIGNING,
  VERIFYING,
  ERROR;

  public boolean inProgress() {
    return this == ENCRYPTING || this == DECRYPTING || this == SIGNING || this == VERIFYING;
  }
}
