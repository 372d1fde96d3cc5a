package com.codeheadsystems.bulwark.crypto.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bulwark.crypto.HashAlgorithm;
import java.nio.charset.StandardCharsets;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

class DefaultHashProviderTest {

  private static final byte[] ABC = "abc".getBytes(StandardCharsets.US_ASCII);

  private final DefaultHashProvider provider = new DefaultHashProvider();

  @Test
  void sha256_knownAnswer() {
    assertThat(Hex.toHexString(provider.hash(ABC, HashAlgorithm.SHA256)))
        .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
  }

  @Test
  void sha512_length() {
    assertThat(provider.hash(ABC, HashAlgorithm.SHA512)).hasSize(64);
  }

  @Test
  void blake2b_knownAnswer() {
    assertThat(Hex.toHexString(provider.hash(ABC, HashAlgorithm.BLAKE2B))).isEqualTo(
        "ba80a53f981c4d0d6a2797b69f12f6e94c212f14685ac4b74b12bb6fdbffa2d1"
            + "7d87c5392aab792dc252d5de4533cc9518d38aa8dbf1925ab92386edd4009923");
  }

  @Test
  void hmacSha256_rfc4231TestCase2() {
    byte[] mac = provider.hmac("Jefe".getBytes(StandardCharsets.US_ASCII),
        "what do ya want for nothing?".getBytes(StandardCharsets.US_ASCII), HashAlgorithm.SHA256);

    assertThat(Hex.toHexString(mac))
        .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
  }

  @Test
  void keyedBlake2b_dependsOnKey() {
    byte[] a = provider.hmac(new byte[]{1}, ABC, HashAlgorithm.BLAKE2B);
    byte[] b = provider.hmac(new byte[]{2}, ABC, HashAlgorithm.BLAKE2B);
    assertThat(a).hasSize(64).isNotEqualTo(b);
  }

  @Test
  void hmac_rejectsEmptyAndOversizedKeys() {
    assertThatThrownBy(() -> provider.hmac(new byte[0], ABC, HashAlgorithm.SHA256))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> provider.hmac(new byte[65], ABC, HashAlgorithm.BLAKE2B))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
