package com.codeheadsystems.bulwark.transport;

/**
 * Observer of state transitions. Callbacks run on the thread performing the operation while
 * the manager's operation lock is held, in transition order; they must not block.
 */
public interface TransportStateListener {

  default void onEncryptionStateChanged(EncryptionState previous, EncryptionState current) {
  }

  default void onKeyExchangeStateChanged(KeyExchangeState previous, KeyExchangeState current) {
  }
}
