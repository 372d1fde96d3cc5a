package com.codeheadsystems.bulwark.server;

/**
 * Thrown when a configuration file cannot be read or bound.
 */
public class ConfigurationException extends RuntimeException {

  /**
   * Instantiates a new Configuration exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
