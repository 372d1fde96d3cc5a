package com.codeheadsystems.bulwark.common.audit;

/**
 * Result recorded with an audit entry.
 */
public enum AuditOutcome {
  ATTEMPT,
  SUCCESS,
  FAILURE,
  GRANTED,
  DENIED
}
