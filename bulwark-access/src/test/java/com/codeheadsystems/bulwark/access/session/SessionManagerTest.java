package com.codeheadsystems.bulwark.access.session;

import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.bulwark.access.MutableClock;
import com.codeheadsystems.bulwark.common.RandomProvider;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionManagerTest {

  private MutableClock clock;
  private SessionManager sessionManager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(0L);
    sessionManager = new SessionManager(clock, new RandomProvider(), Duration.ofMinutes(30), Duration.ofHours(8));
  }

  @Test
  void createSession_isValidForSubject() {
    String sessionId = sessionManager.createSession("alice", ClientContext.fromIp("10.0.0.1"));

    assertThat(sessionId).startsWith("session_");
    assertThat(sessionManager.isValid("alice")).isTrue();
    assertThat(sessionManager.isValid("bob")).isFalse();
    assertThat(sessionManager.getSession(sessionId).orElseThrow().clientContext().clientIp()).isEqualTo("10.0.0.1");
  }

  @Test
  void touch_slidesIdleWindow() {
    String sessionId = sessionManager.createSession("alice", ClientContext.UNKNOWN);

    clock.advance(Duration.ofMinutes(29));
    assertThat(sessionManager.touch(sessionId)).isTrue();
    clock.advance(Duration.ofMinutes(29));

    assertThat(sessionManager.isSessionValid(sessionId)).isTrue();

    clock.advance(Duration.ofMinutes(1));
    assertThat(sessionManager.isSessionValid(sessionId)).isFalse();
    assertThat(sessionManager.touch(sessionId)).isFalse();
  }

  @Test
  void isValid_pastMaxLifetime_invalidDespiteActivity() {
    String sessionId = sessionManager.createSession("alice", ClientContext.UNKNOWN);
    for (int i = 0; i < 16; i++) {
      clock.advance(Duration.ofMinutes(29));
      sessionManager.touch(sessionId);
    }
    clock.advance(Duration.ofMinutes(29));

    assertThat(sessionManager.isSessionValid(sessionId)).isFalse();
  }

  @Test
  void terminate_softDeletesUntilSweep() {
    String sessionId = sessionManager.createSession("alice", ClientContext.UNKNOWN);

    assertThat(sessionManager.terminate(sessionId)).isTrue();
    assertThat(sessionManager.terminate(sessionId)).isFalse();

    assertThat(sessionManager.isValid("alice")).isFalse();
    assertThat(sessionManager.getSession(sessionId)).isPresent();
    assertThat(sessionManager.sweepExpired()).isEqualTo(1);
    assertThat(sessionManager.getSession(sessionId)).isEmpty();
  }

  @Test
  void terminateAllForSubject_leavesOtherSubjects() {
    sessionManager.createSession("alice", ClientContext.UNKNOWN);
    sessionManager.createSession("alice", ClientContext.UNKNOWN);
    sessionManager.createSession("bob", ClientContext.UNKNOWN);

    assertThat(sessionManager.terminateAllForSubject("alice")).isEqualTo(2);

    assertThat(sessionManager.activeSessions("alice")).isEmpty();
    assertThat(sessionManager.activeSessions("bob")).hasSize(1);
  }

  @Test
  void sweepExpired_removesIdleSessionsAtTimeout() {
    sessionManager.createSession("alice", ClientContext.UNKNOWN);
    clock.advance(Duration.ofMinutes(10));
    sessionManager.createSession("bob", ClientContext.UNKNOWN);

    clock.advance(Duration.ofMinutes(20));

    assertThat(sessionManager.sweepExpired()).isEqualTo(1);
    assertThat(sessionManager.size()).isEqualTo(1);
    assertThat(sessionManager.isValid("bob")).isTrue();
  }
}
