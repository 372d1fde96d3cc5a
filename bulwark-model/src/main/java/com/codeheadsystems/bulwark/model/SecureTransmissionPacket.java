package com.codeheadsystems.bulwark.model;

import com.codeheadsystems.bulwark.crypto.EncryptionType;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Base64;

/**
 * Wire model for one signed, encrypted transmission.
 * <p>
 * The signature covers {@code encryptedData} (the ciphertext), so a receiver can reject a
 * forged packet before trusting anything inside it. Binary fields are base64-encoded;
 * the timestamp is epoch milliseconds from the sender's clock and is checked against the
 * receiver's maximum packet age.
 *
 * @param encryptedDataBase64 base64-encoded ciphertext
 * @param signatureBase64     base64-encoded signature over the ciphertext
 * @param encryptionTypeName  the {@link EncryptionType} tag
 * @param timestamp           creation time in epoch milliseconds
 * @param sender              sender client id
 * @param recipient           recipient client id
 */
public record SecureTransmissionPacket(
    @JsonProperty("encryptedData") String encryptedDataBase64,
    @JsonProperty("signature") String signatureBase64,
    @JsonProperty("encryptionType") String encryptionTypeName,
    @JsonProperty("timestamp") Long timestamp,
    @JsonProperty("sender") String sender,
    @JsonProperty("recipient") String recipient) {

  /**
   * Builds a packet from domain values.
   *
   * @param encryptedData  the ciphertext
   * @param signature      the signature
   * @param encryptionType the encryption type
   * @param timestamp      the timestamp
   * @param sender         the sender
   * @param recipient      the recipient
   */
  public SecureTransmissionPacket(byte[] encryptedData, byte[] signature, EncryptionType encryptionType,
                                  long timestamp, String sender, String recipient) {
    this(Base64.getEncoder().encodeToString(encryptedData),
        Base64.getEncoder().encodeToString(signature),
        encryptionType.name(),
        timestamp,
        sender,
        recipient);
  }

  /**
   * Decoded ciphertext.
   *
   * @return the bytes
   * @throws IllegalArgumentException if missing or not valid base64
   */
  public byte[] encryptedData() {
    return decode(encryptedDataBase64, "encryptedData");
  }

  /**
   * Decoded signature.
   *
   * @return the bytes
   * @throws IllegalArgumentException if missing or not valid base64
   */
  public byte[] signature() {
    return decode(signatureBase64, "signature");
  }

  /**
   * The encryption type.
   *
   * @return the type
   * @throws IllegalArgumentException if missing or unknown
   */
  public EncryptionType encryptionType() {
    return EncryptionType.fromName(encryptionTypeName);
  }

  /**
   * The timestamp, required.
   *
   * @return epoch milliseconds
   * @throws IllegalArgumentException if missing
   */
  public long timestampMillis() {
    if (timestamp == null) {
      throw new IllegalArgumentException("Missing required field: timestamp");
    }
    return timestamp;
  }

  /**
   * Checks that every required field is present and decodable.
   *
   * @return this packet
   * @throws IllegalArgumentException on the first invalid field
   */
  public SecureTransmissionPacket validate() {
    encryptedData();
    signature();
    encryptionType();
    timestampMillis();
    requireText(sender, "sender");
    requireText(recipient, "recipient");
    return this;
  }

  private static void requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
  }

  private static byte[] decode(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + field);
    }
    try {
      return Base64.getDecoder().decode(value);
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in field: " + field, e);
    }
  }
}
