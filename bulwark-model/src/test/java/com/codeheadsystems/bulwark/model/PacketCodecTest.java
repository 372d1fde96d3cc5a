package com.codeheadsystems.bulwark.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bulwark.crypto.EncryptionType;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class PacketCodecTest {

  private final PacketCodec codec = new PacketCodec();

  private static byte[] json(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void encode_producesDocumentedWireFields() {
    SecureTransmissionPacket packet = new SecureTransmissionPacket(
        new byte[]{1, 2, 3}, new byte[]{4, 5}, EncryptionType.CHACHA20_POLY1305, 1234L, "alice", "bob");

    String encoded = new String(codec.encode(packet), StandardCharsets.UTF_8);

    assertThat(encoded)
        .contains("\"encryptedData\":\"AQID\"")
        .contains("\"signature\":\"BAU=\"")
        .contains("\"encryptionType\":\"CHACHA20_POLY1305\"")
        .contains("\"timestamp\":1234")
        .contains("\"sender\":\"alice\"")
        .contains("\"recipient\":\"bob\"");
  }

  @Test
  void decode_readsAllFields() {
    SecureTransmissionPacket packet = codec.decode(json(
        "{\"encryptedData\":\"AQID\",\"signature\":\"BAU=\",\"encryptionType\":\"AES_256_GCM\","
            + "\"timestamp\":99,\"sender\":\"a\",\"recipient\":\"b\"}"));

    assertThat(packet.encryptedData()).containsExactly(1, 2, 3);
    assertThat(packet.signature()).containsExactly(4, 5);
    assertThat(packet.encryptionType()).isEqualTo(EncryptionType.AES_256_GCM);
    assertThat(packet.timestampMillis()).isEqualTo(99L);
  }

  @Test
  void decode_ignoresUnknownFields() {
    SecureTransmissionPacket packet = codec.decode(json(
        "{\"encryptedData\":\"AQID\",\"signature\":\"BAU=\",\"encryptionType\":\"AES_128_GCM\","
            + "\"timestamp\":1,\"sender\":\"a\",\"recipient\":\"b\",\"compression\":\"zstd\",\"v\":2}"));

    assertThat(packet.sender()).isEqualTo("a");
  }

  @Test
  void decode_missingTimestamp_isMalformed() {
    assertThatThrownBy(() -> codec.decode(json(
        "{\"encryptedData\":\"AQID\",\"signature\":\"BAU=\",\"encryptionType\":\"AES_128_GCM\","
            + "\"sender\":\"a\",\"recipient\":\"b\"}")))
        .isInstanceOf(MalformedPacketException.class)
        .hasMessageContaining("timestamp");
  }

  @Test
  void decode_unknownEncryptionType_isMalformed() {
    assertThatThrownBy(() -> codec.decode(json(
        "{\"encryptedData\":\"AQID\",\"signature\":\"BAU=\",\"encryptionType\":\"ROT13\","
            + "\"timestamp\":1,\"sender\":\"a\",\"recipient\":\"b\"}")))
        .isInstanceOf(MalformedPacketException.class)
        .hasMessageContaining("Unsupported encryption type");
  }

  @Test
  void decode_invalidBase64_isMalformed() {
    assertThatThrownBy(() -> codec.decode(json(
        "{\"encryptedData\":\"not!base64\",\"signature\":\"BAU=\",\"encryptionType\":\"AES_128_GCM\","
            + "\"timestamp\":1,\"sender\":\"a\",\"recipient\":\"b\"}")))
        .isInstanceOf(MalformedPacketException.class)
        .hasMessageContaining("Invalid base64 in field: encryptedData");
  }

  @Test
  void decode_notJson_isMalformed() {
    assertThatThrownBy(() -> codec.decode(json("hello"))).isInstanceOf(MalformedPacketException.class);
    assertThatThrownBy(() -> codec.decode(json("null"))).isInstanceOf(MalformedPacketException.class);
    assertThatThrownBy(() -> codec.decode(new byte[0])).isInstanceOf(MalformedPacketException.class);
    assertThatThrownBy(() -> codec.decode(json("{\"sender\":\"a\"} trailing")))
        .isInstanceOf(MalformedPacketException.class);
  }

  @Test
  void encode_incompletePacket_throws() {
    SecureTransmissionPacket packet = new SecureTransmissionPacket("AQID", "BAU=", "AES_256_GCM", 1L, "a", null);

    assertThatThrownBy(() -> codec.encode(packet))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("recipient");
  }
}
