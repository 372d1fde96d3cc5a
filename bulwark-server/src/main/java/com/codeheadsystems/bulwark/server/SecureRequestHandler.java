package com.codeheadsystems.bulwark.server;

import com.codeheadsystems.bulwark.access.auth.SessionTokenManager;
import com.codeheadsystems.bulwark.access.manager.PermissionManager;
import com.codeheadsystems.bulwark.access.model.PermissionCheck;
import com.codeheadsystems.bulwark.access.policy.EvaluationContext;
import com.codeheadsystems.bulwark.common.SecurityResult;
import com.codeheadsystems.bulwark.common.audit.AuditEventType;
import com.codeheadsystems.bulwark.common.audit.AuditLogger;
import com.codeheadsystems.bulwark.common.audit.AuditOutcome;
import com.codeheadsystems.bulwark.model.PacketCodec;
import com.codeheadsystems.bulwark.model.access.AccessRequest;
import com.codeheadsystems.bulwark.model.access.AccessResponse;
import com.codeheadsystems.bulwark.transport.ReceivedMessage;
import com.codeheadsystems.bulwark.transport.SecureTransportManager;
import java.security.PublicKey;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers {@link AccessRequest}s that arrive inside secure packets.
 * <p>
 * A packet that fails reception (malformed, stale, unknown sender, failed verification) is not
 * answered: its sender cannot be trusted. Once a packet is authenticated every outcome is
 * answered with an encrypted {@link AccessResponse}. Failures after that point are answered with
 * a generic denial and their reason goes to the audit log only.
 */
@Singleton
public class SecureRequestHandler {

  private static final Logger log = LoggerFactory.getLogger(SecureRequestHandler.class);

  static final String GENERIC_DENIAL = "Access denied";

  private final SecureTransportManager transport;
  private final SessionTokenManager tokenManager;
  private final PermissionManager permissionManager;
  private final PacketCodec codec;
  private final AuditLogger auditLogger;

  /**
   * Instantiates a new Secure request handler.
   *
   * @param transport         the transport
   * @param tokenManager      the token manager
   * @param permissionManager the permission manager
   * @param codec             the codec
   * @param auditLogger       the audit logger
   */
  @Inject
  public SecureRequestHandler(SecureTransportManager transport,
                              SessionTokenManager tokenManager,
                              PermissionManager permissionManager,
                              PacketCodec codec,
                              AuditLogger auditLogger) {
    this.transport = transport;
    this.tokenManager = tokenManager;
    this.permissionManager = permissionManager;
    this.codec = codec;
    this.auditLogger = auditLogger;
  }

  /**
   * Handles one request packet.
   *
   * @param packetBytes     the request packet
   * @param senderPublicKey the sender's key, null to look it up among registered peers
   * @return the encoded response packet addressed to the sender, or the reception failure
   */
  public SecurityResult<byte[]> handle(byte[] packetBytes, PublicKey senderPublicKey) {
    SecurityResult<ReceivedMessage> received = transport.secureReceive(packetBytes, senderPublicKey);
    if (received.isFailure()) {
      log.debug("Dropping request: {}", received.error());
      return SecurityResult.failure(received.error());
    }
    ReceivedMessage message = received.value();
    AccessResponse response = authorize(message);
    return transport.secureTransmit(codec.write(response), message.sender(), message.packet().encryptionType());
  }

  private AccessResponse authorize(ReceivedMessage message) {
    String sender = message.sender();
    AccessRequest request;
    try {
      request = codec.read(message.plaintext(), AccessRequest.class).validate();
    } catch (IllegalArgumentException e) {
      return deny(sender, sender, "", "malformed request: " + e.getMessage());
    }

    Optional<SessionTokenManager.VerifiedSession> session = tokenManager.verify(request.sessionToken());
    if (session.isEmpty()) {
      return deny(sender, sender, request.resource(), "invalid or expired session token");
    }
    String subject = session.get().subject();

    Map<String, String> context = new HashMap<>(request.attributes());
    if (request.clientIp() != null) {
      context.put(EvaluationContext.CLIENT_IP, request.clientIp());
    }
    SecurityResult<PermissionCheck> check =
        permissionManager.checkPermission(subject, request.resource(), request.action(), context);
    if (check.isFailure()) {
      return deny(sender, subject, request.resource(), check.error().code() + ": " + check.error().message());
    }
    PermissionCheck decision = check.value();
    log.debug("{} {} {} from {}: {}", subject, request.action(), request.resource(), sender, decision.granted());
    return new AccessResponse(decision.granted(), decision.reason(), decision.matchedPolicies());
  }

  private AccessResponse deny(String sender, String subject, String resource, String reason) {
    auditLogger.log(AuditEventType.PERMISSION_DECISION, subject, resource, AuditOutcome.DENIED,
        Map.of("sender", sender, "reason", reason));
    return AccessResponse.denied(GENERIC_DENIAL);
  }
}
