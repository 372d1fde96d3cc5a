package com.codeheadsystems.bulwark.access.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.codeheadsystems.bulwark.access.session.SessionManager;
import com.codeheadsystems.bulwark.access.session.UserSession;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies bearer tokens for sessions.
 * <p>
 * Tokens are signed with HMAC-SHA256. Each token's JTI is the session id, so terminating the
 * session revokes every token issued for it. The token's own expiry is an absolute bound; the
 * session's idle timeout slides on every successful verification.
 */
public class SessionTokenManager {

  private static final Logger log = LoggerFactory.getLogger(SessionTokenManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final SessionManager sessionManager;
  private final String issuer;
  private final Duration ttl;
  private final Clock clock;

  /**
   * Creates a new SessionTokenManager.
   *
   * @param secret         HMAC-SHA256 signing secret
   * @param issuer         JWT issuer claim
   * @param ttl            token time-to-live
   * @param sessionManager backing sessions
   * @param clock          the clock, also used for expiry checks
   */
  public SessionTokenManager(byte[] secret, String issuer, Duration ttl, SessionManager sessionManager, Clock clock) {
    if (secret == null || secret.length < 32) {
      throw new IllegalArgumentException("Token secret must be at least 32 bytes");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer)).build(clock);
    this.sessionManager = sessionManager;
    this.issuer = issuer;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Issues a token for a valid session.
   *
   * @param sessionId the session id
   * @return signed JWT string
   * @throws IllegalArgumentException if the session is unknown or no longer valid
   */
  public String issueToken(String sessionId) {
    UserSession session = sessionManager.getSession(sessionId)
        .filter(s -> sessionManager.isSessionValid(s.sessionId()))
        .orElseThrow(() -> new IllegalArgumentException("No valid session: " + sessionId));
    Instant now = clock.instant();
    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(session.sessionId())
        .withSubject(session.subject())
        .withIssuedAt(now)
        .withExpiresAt(now.plus(ttl))
        .sign(algorithm);
    log.debug("Issued token for session {}", sessionId);
    return token;
  }

  /**
   * Result of a successful verification.
   *
   * @param subject   the token subject
   * @param sessionId the session id (JTI)
   */
  public record VerifiedSession(String subject, String sessionId) {
  }

  /**
   * Verifies the token and that its session is still valid, then touches the session.
   *
   * @param token JWT string
   * @return the verified session, empty if invalid, expired or revoked
   */
  public Optional<VerifiedSession> verify(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      String sessionId = decoded.getId();
      if (sessionId == null || !sessionManager.touch(sessionId)) {
        log.debug("Token session {} is no longer valid", sessionId);
        return Optional.empty();
      }
      return Optional.of(new VerifiedSession(decoded.getSubject(), sessionId));
    } catch (JWTVerificationException e) {
      log.debug("Token verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }

  /**
   * Terminates the session behind a genuine token.
   *
   * @param token JWT string
   * @return true if a session was terminated
   */
  public boolean revoke(String token) {
    try {
      String sessionId = verifier.verify(token).getId();
      return sessionId != null && sessionManager.terminate(sessionId);
    } catch (JWTVerificationException e) {
      log.debug("Refusing to revoke with an invalid token: {}", e.getMessage());
      return false;
    }
  }
}
