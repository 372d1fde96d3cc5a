package com.codeheadsystems.bulwark.common;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.security.SecureRandom;
import org.junit.jupiter.api.Test;

class RandomProviderTest {

  @Test
  void customRandom_isPreserved() {
    SecureRandom custom = new SecureRandom();
    RandomProvider rp = new RandomProvider(custom);
    assertThat(rp.random()).isSameAs(custom);
  }

  @Test
  void randomBytes_returnsCorrectLength() {
    RandomProvider rp = new RandomProvider();
    assertThat(rp.randomBytes(0)).isEmpty();
    assertThat(rp.randomBytes(12)).hasSize(12);
    assertThat(rp.randomBytes(32)).hasSize(32);
  }

  @Test
  void randomBytes_negativeLength_throws() {
    assertThatThrownBy(() -> new RandomProvider().randomBytes(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void randomHex_isTwiceTheByteCount() {
    String hex = new RandomProvider().randomHex(8);
    assertThat(hex).hasSize(16).matches("[0-9a-f]+");
  }
}
