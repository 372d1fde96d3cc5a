package com.codeheadsystems.bulwark.transport;

/**
 * Lifecycle of key generation and key exchange.
 */
public enum KeyExchangeState {
  NOT_STARTED,
  GENERATING_KEYS,
  KEYS_READY,
  EXCHANGING_KEYS,
  EXCHANGE_COMPLETE,
  ERROR;

  public boolean inProgress() {
    return this == GENERATING_KEYS || this == EXCHANGING_KEYS;
  }
}
