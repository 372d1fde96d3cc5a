package com.codeheadsystems.bulwark.server;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import com.codeheadsystems.bulwark.access.session.ClientContext;
import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.common.SecurityErrorCode;
import com.codeheadsystems.bulwark.common.SecurityResult;
import com.codeheadsystems.bulwark.common.audit.AuditEventType;
import com.codeheadsystems.bulwark.common.audit.AuditLogEntry;
import com.codeheadsystems.bulwark.common.audit.AuditOutcome;
import com.codeheadsystems.bulwark.common.audit.AuditQuery;
import com.codeheadsystems.bulwark.crypto.KeyExchangeType;
import com.codeheadsystems.bulwark.crypto.KeyType;
import com.codeheadsystems.bulwark.crypto.provider.CryptoProviders;
import com.codeheadsystems.bulwark.model.PacketCodec;
import com.codeheadsystems.bulwark.model.access.AccessRequest;
import com.codeheadsystems.bulwark.model.access.AccessResponse;
import com.codeheadsystems.bulwark.transport.KeyManager;
import com.codeheadsystems.bulwark.transport.PeerKeyDirectory;
import com.codeheadsystems.bulwark.transport.SecureTransportManager;
import com.codeheadsystems.bulwark.transport.config.EncryptionConfig;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SecureRequestHandlerTest {

  private final RandomProvider random = new RandomProvider();
  private final PacketCodec codec = new PacketCodec();

  private MutableClock clock;
  private BulwarkNode node;
  private SecureTransportManager app;
  private String aliceToken;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(1_700_000_000_000L);
    node = new BulwarkNode(new ConfigurationLoader().loadResource("bulwark-test.yml"), clock, random);
    app = client("app");
    pair(app);

    node.permissionManager().createUser("alice", "alice", "alice@example.com", Set.of("user"), Map.of());
    aliceToken = node.openSession("alice", ClientContext.fromIp("10.0.0.7"));
  }

  @AfterEach
  void tearDown() {
    node.shutdown();
  }

  private SecureTransportManager client(String clientId) {
    EncryptionConfig config = EncryptionConfig.forClient(clientId).withKeyType(KeyType.EC_P256);
    CryptoProviders crypto = CryptoProviders.defaults(random);
    KeyManager keyManager = new KeyManager(crypto.keyPairs(), crypto.keyDerivation(), random, config, clock);
    SecureTransportManager transport = new SecureTransportManager(config, keyManager, crypto, codec,
        new PeerKeyDirectory(), node.auditLogger(), clock);
    assertThat(transport.initialize().isSuccess()).isTrue();
    return transport;
  }

  private void pair(SecureTransportManager client) {
    SecureTransportManager server = node.transport();
    assertThat(client.performKeyExchange(server.publicKey().orElseThrow(), KeyExchangeType.ECDH).isSuccess()).isTrue();
    assertThat(server.performKeyExchange(client.publicKey().orElseThrow(), KeyExchangeType.ECDH).isSuccess()).isTrue();
    client.registerPeer(server.clientId(), server.publicKey().orElseThrow());
    server.registerPeer(client.clientId(), client.publicKey().orElseThrow());
  }

  private byte[] requestPacket(byte[] payload) {
    return app.secureTransmit(payload, "gateway", null).value();
  }

  private byte[] requestPacket(AccessRequest request) {
    return requestPacket(codec.write(request));
  }

  private AccessResponse exchange(AccessRequest request) {
    return open(node.requestHandler().handle(requestPacket(request), null));
  }

  private AccessResponse open(SecurityResult<byte[]> responsePacket) {
    assertThat(responsePacket.isSuccess()).as("response packet").isTrue();
    byte[] plaintext = app.secureReceive(responsePacket.value(), null).value().plaintext();
    return codec.read(plaintext, AccessResponse.class);
  }

  private List<AuditLogEntry> deniedDecisions() {
    return node.auditLogger().getLogs(AuditQuery.all().withEventType(AuditEventType.PERMISSION_DECISION), 50)
        .stream()
        .filter(entry -> entry.outcome() == AuditOutcome.DENIED)
        .toList();
  }

  @Test
  void handle_permittedRead_granted() {
    AccessResponse response = exchange(new AccessRequest(aliceToken, "data", "read", "10.0.0.7", Map.of()));

    assertThat(response.granted()).isTrue();
    assertThat(response.matchedPolicies()).containsExactly("static:read_data");
  }

  @Test
  void handle_actionOutsideRole_deniedWithReason() {
    AccessResponse response = exchange(new AccessRequest(aliceToken, "data", "delete", "10.0.0.7", Map.of()));

    assertThat(response.granted()).isFalse();
    assertThat(response.reason()).contains("delete");
  }

  @Test
  void handle_configuredPolicy_grantsInsideNetworkOnly() {
    AccessResponse inside = exchange(new AccessRequest(aliceToken, "reports/q3", "read", "10.2.3.4", Map.of()));
    AccessResponse outside = exchange(new AccessRequest(aliceToken, "reports/q4", "read", "203.0.113.9", Map.of()));

    assertThat(inside.granted()).isTrue();
    assertThat(inside.matchedPolicies()).containsExactly("office-reports");
    assertThat(outside.granted()).isFalse();
  }

  @Test
  void handle_invalidToken_genericDenialAndAuditedReason() {
    AccessResponse response = exchange(new AccessRequest("not-a-token", "data", "read", "10.0.0.7", Map.of()));

    assertThat(response.granted()).isFalse();
    assertThat(response.reason()).isEqualTo(SecureRequestHandler.GENERIC_DENIAL);
    assertThat(deniedDecisions()).extracting(entry -> entry.details().get("reason"))
        .contains("invalid or expired session token");
  }

  @Test
  void handle_revokedSession_denied() {
    assertThat(node.tokenManager().revoke(aliceToken)).isTrue();

    AccessResponse response = exchange(new AccessRequest(aliceToken, "data", "read", "10.0.0.7", Map.of()));

    assertThat(response.reason()).isEqualTo(SecureRequestHandler.GENERIC_DENIAL);
  }

  @Test
  void handle_idleSession_denied() {
    clock.advance(Duration.ofMinutes(16));

    AccessResponse response = exchange(new AccessRequest(aliceToken, "data", "read", "10.0.0.7", Map.of()));

    assertThat(response.granted()).isFalse();
  }

  @Test
  void handle_malformedRequest_genericDenial() {
    AccessResponse response = open(node.requestHandler().handle(requestPacket("not json".getBytes(UTF_8)), null));

    assertThat(response.reason()).isEqualTo(SecureRequestHandler.GENERIC_DENIAL);
    assertThat(deniedDecisions()).extracting(entry -> entry.details().get("reason"))
        .anyMatch(reason -> reason.startsWith("malformed request"));
  }

  @Test
  void handle_missingAction_genericDenial() {
    AccessResponse response = exchange(new AccessRequest(aliceToken, "data", null, "10.0.0.7", Map.of()));

    assertThat(response.reason()).isEqualTo(SecureRequestHandler.GENERIC_DENIAL);
  }

  @Test
  void handle_replayedStalePacket_notAnswered() {
    byte[] packet = requestPacket(new AccessRequest(aliceToken, "data", "read", "10.0.0.7", Map.of()));
    clock.advance(Duration.ofMinutes(6));

    SecurityResult<byte[]> result = node.requestHandler().handle(packet, null);

    assertThat(result.errorCode()).contains(SecurityErrorCode.STALE_PACKET);
  }

  @Test
  void handle_unregisteredSender_notAnswered() {
    SecureTransportManager stranger = client("stranger");
    byte[] packet = stranger.secureTransmit("{}".getBytes(UTF_8), "gateway", null).value();

    SecurityResult<byte[]> result = node.requestHandler().handle(packet, null);

    assertThat(result.errorCode()).contains(SecurityErrorCode.KEY_UNAVAILABLE);
  }

  @Test
  void shutdown_destroysKeys() {
    node.shutdown();

    assertThat(node.transport().publicKey()).isEmpty();
    assertThat(node.requestHandler().handle(requestPacket(
        new AccessRequest(aliceToken, "data", "read", "10.0.0.7", Map.of())), null).isFailure()).isTrue();
  }
}
