package com.codeheadsystems.bulwark.common;

import java.util.Objects;

/**
 * A typed failure carried by {@link SecurityResult}.
 *
 * @param code    the failure kind
 * @param message human readable detail, never containing key material
 */
public record SecurityError(SecurityErrorCode code, String message) {

  /**
   * Instantiates a new Security error.
   *
   * @param code    the code
   * @param message the message
   */
  public SecurityError {
    Objects.requireNonNull(code, "code");
    message = message == null ? code.name() : message;
  }

  /**
   * Of security error.
   *
   * @param code    the code
   * @param message the message
   * @return the security error
   */
  public static SecurityError of(SecurityErrorCode code, String message) {
    return new SecurityError(code, message);
  }
}
