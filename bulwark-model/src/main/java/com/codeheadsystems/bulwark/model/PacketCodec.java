package com.codeheadsystems.bulwark.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;

/**
 * JSON encoding of wire messages. Unknown fields are ignored so that newer senders can add
 * fields without breaking older receivers; missing required fields are errors.
 * <p>
 * Thread-safe: the underlying {@link ObjectMapper} is configured once and never mutated.
 */
public class PacketCodec {

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Packet codec with its own mapper.
   */
  public PacketCodec() {
    this(new ObjectMapper());
  }

  /**
   * Instantiates a new Packet codec using a copy of the given mapper.
   *
   * @param objectMapper the object mapper
   */
  public PacketCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
  }

  /**
   * Encode bytes.
   *
   * @param packet the packet
   * @return the UTF-8 JSON bytes
   */
  public byte[] encode(SecureTransmissionPacket packet) {
    return write(packet.validate());
  }

  /**
   * Decodes and validates a packet.
   *
   * @param bytes the bytes
   * @return the packet
   * @throws MalformedPacketException if the input is not a complete, well-formed packet
   */
  public SecureTransmissionPacket decode(byte[] bytes) {
    SecureTransmissionPacket packet = read(bytes, SecureTransmissionPacket.class);
    try {
      return packet.validate();
    } catch (IllegalArgumentException e) {
      throw new MalformedPacketException(e.getMessage(), e);
    }
  }

  /**
   * Writes any wire message.
   *
   * @param message the message
   * @return the bytes
   */
  public byte[] write(Object message) {
    try {
      return objectMapper.writeValueAsBytes(Objects.requireNonNull(message, "message"));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Unable to serialize " + message.getClass().getSimpleName(), e);
    }
  }

  /**
   * Reads any wire message.
   *
   * @param <T>   the type parameter
   * @param bytes the bytes
   * @param type  the message type
   * @return the message
   * @throws MalformedPacketException if the input is not valid JSON for the type
   */
  public <T> T read(byte[] bytes, Class<T> type) {
    if (bytes == null || bytes.length == 0) {
      throw new MalformedPacketException("Empty " + type.getSimpleName());
    }
    try {
      T value = objectMapper.readValue(bytes, type);
      if (value == null) {
        throw new MalformedPacketException("Null " + type.getSimpleName());
      }
      return value;
    } catch (IOException e) {
      throw new MalformedPacketException("Unparseable " + type.getSimpleName(), e);
    }
  }
}
