package com.codeheadsystems.bulwark.model;

/**
 * Thrown when bytes cannot be decoded into a well-formed wire message.
 */
public class MalformedPacketException extends IllegalArgumentException {

  public MalformedPacketException(String message) {
    super(message);
  }

  public MalformedPacketException(String message, Throwable cause) {
    super(message, cause);
  }
}
