package com.codeheadsystems.bulwark.common;

/**
 * Failure kinds reported by the transport and access-control pipelines.
 */
public enum SecurityErrorCode {
  /** The key required for the operation does not exist or is of the wrong shape. */
  KEY_UNAVAILABLE,
  /** Key pair or symmetric key generation failed. */
  KEY_GENERATION_FAILED,
  /** Key agreement or encapsulation failed; nothing was stored. */
  KEY_EXCHANGE_FAILED,
  ENCRYPTION_FAILED,
  DECRYPTION_FAILED,
  SIGNATURE_FAILED,
  /** A signature did not verify, or a received packet was rejected. */
  VERIFICATION_FAILED,
  HASH_FAILED,
  /** Packet bytes could not be decoded into a well-formed packet. */
  MALFORMED_PACKET,
  /** Packet timestamp is outside the accepted age window. */
  STALE_PACKET,
  SESSION_EXPIRED,
  /** A policy condition could not be evaluated; treated as deny. */
  POLICY_EVALUATION_ERROR,
  /** The calling thread was interrupted while waiting for the operation. */
  OPERATION_CANCELLED,
  /** Access was evaluated and refused. */
  ACCESS_DENIED
}
