package com.codeheadsystems.bulwark.common.audit;

/**
 * Kinds of security-relevant events recorded in the audit trail.
 */
public enum AuditEventType {
  PERMISSION_CHECK,
  PERMISSION_DECISION,
  SESSION_CREATED,
  SESSION_TERMINATED,
  KEY_GENERATED,
  KEY_ROTATED,
  KEY_EXCHANGE,
  KEYS_CLEARED,
  ENCRYPTION,
  DECRYPTION,
  SIGNATURE,
  VERIFICATION,
  PACKET_SENT,
  PACKET_RECEIVED,
  PACKET_REJECTED,
  POLICY_CHANGED,
  ROLE_CHANGED,
  USER_CHANGED
}
