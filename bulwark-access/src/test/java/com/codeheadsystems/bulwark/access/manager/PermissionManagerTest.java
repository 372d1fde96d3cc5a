package com.codeheadsystems.bulwark.access.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.bulwark.access.MutableClock;
import com.codeheadsystems.bulwark.access.config.PermissionConfig;
import com.codeheadsystems.bulwark.access.model.BatchCheckItem;
import com.codeheadsystems.bulwark.access.model.CleanupReport;
import com.codeheadsystems.bulwark.access.model.Permission;
import com.codeheadsystems.bulwark.access.model.PermissionCheck;
import com.codeheadsystems.bulwark.access.model.PermissionRequest;
import com.codeheadsystems.bulwark.access.model.PermissionStatistics;
import com.codeheadsystems.bulwark.access.policy.DynamicPolicy;
import com.codeheadsystems.bulwark.access.policy.IpRangeCondition;
import com.codeheadsystems.bulwark.access.policy.PolicyEngine;
import com.codeheadsystems.bulwark.access.session.ClientContext;
import com.codeheadsystems.bulwark.access.session.SessionManager;
import com.codeheadsystems.bulwark.common.RandomProvider;
import com.codeheadsystems.bulwark.common.SecurityErrorCode;
import com.codeheadsystems.bulwark.common.SecurityResult;
import com.codeheadsystems.bulwark.common.audit.AuditEventType;
import com.codeheadsystems.bulwark.common.audit.AuditLogEntry;
import com.codeheadsystems.bulwark.common.audit.AuditLogger;
import com.codeheadsystems.bulwark.common.audit.AuditOutcome;
import com.codeheadsystems.bulwark.common.audit.AuditQuery;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PermissionManagerTest {

  private MutableClock clock;
  private SessionManager sessionManager;
  private AuditLogger auditLogger;
  private PermissionManager permissionManager;

  @BeforeEach
  void setUp() {
    build(PermissionConfig.defaults());
  }

  @AfterEach
  void tearDown() {
    permissionManager.shutdown();
  }

  private void build(PermissionConfig config) {
    if (permissionManager != null) {
      permissionManager.shutdown();
    }
    clock = new MutableClock(1_700_000_000_000L);
    sessionManager = new SessionManager(clock, new RandomProvider(), config.sessionTimeout(),
        config.maxSessionLifetime());
    auditLogger = new AuditLogger(clock);
    permissionManager = new PermissionManager(config, sessionManager, new PolicyEngine(), auditLogger, clock);
  }

  private void aliceWithSession(String... roles) {
    permissionManager.createUser("alice", "alice", "alice@example.com", Set.of(roles), Map.of("department", "eng"));
    sessionManager.createSession("alice", ClientContext.fromIp("10.0.0.1"));
  }

  private PermissionCheck check(String resource, String action) {
    SecurityResult<PermissionCheck> result = permissionManager.checkPermission("alice", resource, action, Map.of());
    assertThat(result.isSuccess()).as("check %s %s", resource, action).isTrue();
    return result.value();
  }

  @Test
  void defaults_installRolesAndPermissions() {
    assertThat(permissionManager.getRole("admin")).isPresent();
    assertThat(permissionManager.getRole("editor")).isPresent();
    assertThat(permissionManager.getRole("user").orElseThrow().permissions()).containsExactly("read_data");

    PermissionStatistics statistics = permissionManager.getStatistics();
    assertThat(statistics.totalRoles()).isEqualTo(3);
    assertThat(statistics.totalPermissions()).isEqualTo(3);
  }

  @Test
  void checkPermission_userRole_readGrantedWriteDenied() {
    aliceWithSession("user");

    PermissionCheck read = check("data", "read");
    PermissionCheck write = check("data", "write");

    assertThat(read.granted()).isTrue();
    assertThat(read.matchedPolicies()).containsExactly("static:read_data");
    assertThat(read.fromCache()).isFalse();
    assertThat(write.granted()).isFalse();
    assertThat(write.reason()).contains("write");
  }

  @Test
  void checkPermission_withoutSession_sessionExpired() {
    permissionManager.createUser("alice", "alice", "alice@example.com", Set.of("admin"), Map.of());

    SecurityResult<PermissionCheck> result = permissionManager.checkPermission("alice", "data", "read", Map.of());

    assertThat(result.errorCode()).contains(SecurityErrorCode.SESSION_EXPIRED);
  }

  @Test
  void checkPermission_sessionIdleTooLong_sessionExpired() {
    aliceWithSession("user");
    clock.advance(Duration.ofMinutes(31));

    SecurityResult<PermissionCheck> result = permissionManager.checkPermission("alice", "data", "write", Map.of());

    assertThat(result.errorCode()).contains(SecurityErrorCode.SESSION_EXPIRED);
  }

  @Test
  void checkPermission_unknownSubject_denied() {
    SecurityResult<PermissionCheck> result = permissionManager.checkPermission("mallory", "data", "read", Map.of());

    assertThat(result.value().granted()).isFalse();
    assertThat(result.value().reason()).isEqualTo("Unknown subject");
    assertThat(permissionManager.cache().size()).isZero();
  }

  @Test
  void checkPermission_disabledSubject_deniedUntilEnabled() {
    aliceWithSession("admin");

    assertThat(permissionManager.setUserActive("alice", false)).isTrue();
    assertThat(check("data", "read").reason()).isEqualTo("Subject is disabled");

    assertThat(permissionManager.setUserActive("alice", true)).isTrue();
    assertThat(check("data", "read").granted()).isTrue();
  }

  @Test
  void checkPermission_repeated_servedFromCache() {
    aliceWithSession("user");

    check("data", "read");
    PermissionCheck second = check("data", "read");

    assertThat(second.granted()).isTrue();
    assertThat(second.fromCache()).isTrue();
    assertThat(permissionManager.getStatistics().cacheHitRate()).isEqualTo(0.5);
  }

  @Test
  void checkPermission_cacheDisabled_alwaysEvaluates() {
    build(PermissionConfig.defaults().withPermissionCache(false));
    aliceWithSession("user");

    check("data", "read");

    assertThat(check("data", "read").fromCache()).isFalse();
    assertThat(permissionManager.cache().size()).isZero();
  }

  @Test
  void assignRole_invalidatesCachedDenial() {
    aliceWithSession("user");
    assertThat(check("data", "write").granted()).isFalse();

    assertThat(permissionManager.assignRole("alice", "editor")).isTrue();
    assertThat(permissionManager.assignRole("alice", "editor")).isFalse();

    PermissionCheck write = check("data", "write");
    assertThat(write.granted()).isTrue();
    assertThat(write.fromCache()).isFalse();
  }

  @Test
  void revokeRole_andRoleDeactivation_removeGrants() {
    aliceWithSession("user", "editor");
    assertThat(check("data", "write").granted()).isTrue();

    assertThat(permissionManager.setRoleActive("editor", false)).isTrue();
    assertThat(check("data", "write").granted()).isFalse();

    assertThat(permissionManager.revokeRole("alice", "user")).isTrue();
    assertThat(check("data", "read").granted()).isFalse();
  }

  @Test
  void grantPermission_direct_grants() {
    aliceWithSession();
    permissionManager.createPermission(Permission.of("export", "reports", "export"));

    assertThat(permissionManager.grantPermission("alice", "export")).isTrue();

    assertThat(check("reports", "export").matchedPolicies()).containsExactly("static:export");
  }

  @Test
  void registry_rejectsDuplicatesAndUnknownIds() {
    aliceWithSession("user");

    assertThatThrownBy(() -> permissionManager.createUser("alice", "a", "a@example.com", Set.of(), Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> permissionManager.createUser("bob", "b", "b@example.com", Set.of("root"), Map.of()))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> permissionManager.assignRole("bob", "user"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> permissionManager.grantPermission("alice", "missing"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void getUserPermissions_unionOfDirectAndActiveRoles() {
    aliceWithSession("editor");
    permissionManager.grantPermission("alice", "delete_data");

    assertThat(permissionManager.getUserPermissions("alice"))
        .extracting(Permission::id)
        .containsExactly("delete_data", "read_data", "write_data");
    assertThat(permissionManager.getUserPermissions("nobody")).isEmpty();
  }

  @Test
  void dynamicPolicy_grantsWithinNetworkAndClearsCacheOnRemoval() {
    aliceWithSession("user");
    permissionManager.addDynamicPolicy(new DynamicPolicy("reports-office", "Reports", "", "reports/*",
        Set.of("read"), List.of(new IpRangeCondition(List.of("10.0.0.0/8"))), 10, true));

    SecurityResult<PermissionCheck> inside =
        permissionManager.checkPermission("alice", "reports/q1", "read", Map.of("clientIP", "10.1.2.3"));
    SecurityResult<PermissionCheck> outside =
        permissionManager.checkPermission("alice", "reports/q2", "read", Map.of("clientIP", "192.168.0.1"));

    assertThat(inside.value().granted()).isTrue();
    assertThat(inside.value().matchedPolicies()).containsExactly("reports-office");
    assertThat(outside.value().granted()).isFalse();

    assertThat(permissionManager.removeDynamicPolicy("reports-office")).isTrue();
    assertThat(permissionManager.cache().size()).isZero();
    assertThat(permissionManager.checkPermission("alice", "reports/q1", "read", Map.of("clientIP", "10.1.2.3"))
        .value().granted()).isFalse();
  }

  @Test
  void dynamicPolicy_ipRestrictedDecision_notReusedForAnotherAddress() {
    aliceWithSession("user");
    permissionManager.addDynamicPolicy(new DynamicPolicy("reports-desk", "Reports", "", "reports/*",
        Set.of("read"), List.of(new IpRangeCondition(List.of("10.0.0.1"))), 10, true));

    SecurityResult<PermissionCheck> allowed =
        permissionManager.checkPermission("alice", "reports/q1", "read", Map.of("clientIP", "10.0.0.1"));
    SecurityResult<PermissionCheck> other =
        permissionManager.checkPermission("alice", "reports/q1", "read", Map.of("clientIP", "10.0.0.2"));
    SecurityResult<PermissionCheck> again =
        permissionManager.checkPermission("alice", "reports/q1", "read", Map.of("clientIP", "10.0.0.1"));

    assertThat(allowed.value().granted()).isTrue();
    assertThat(other.value().granted()).isFalse();
    assertThat(other.value().fromCache()).isFalse();
    assertThat(again.value().granted()).isTrue();
    assertThat(again.value().fromCache()).isFalse();
    assertThat(permissionManager.cache().size()).isZero();
  }

  @Test
  void staticGrantWithCondition_deniedDecisionNotCached() {
    aliceWithSession("user");
    permissionManager.createPermission(new Permission("office_read", "Office read", "", "ledger", Set.of("read"),
        List.of(new IpRangeCondition(List.of("10.0.0.0/8"))), true));
    permissionManager.grantPermission("alice", "office_read");

    SecurityResult<PermissionCheck> outside =
        permissionManager.checkPermission("alice", "ledger", "read", Map.of("clientIP", "192.168.0.1"));
    SecurityResult<PermissionCheck> inside =
        permissionManager.checkPermission("alice", "ledger", "read", Map.of("clientIP", "10.4.4.4"));

    assertThat(outside.value().granted()).isFalse();
    assertThat(inside.value().granted()).isTrue();
    assertThat(inside.value().fromCache()).isFalse();
  }

  @Test
  void batchCheck_reportsEachRequestInOrder() {
    aliceWithSession("user");

    List<BatchCheckItem> items = permissionManager.batchCheck("alice", List.of(
        new PermissionRequest("data", "read", null),
        new PermissionRequest("data", "delete", null)));

    assertThat(items).extracting(BatchCheckItem::action).containsExactly("read", "delete");
    assertThat(items).extracting(BatchCheckItem::granted).containsExactly(true, false);
  }

  @Test
  void batchCheck_failedCheck_reportedAsDenial() {
    permissionManager.createUser("alice", "alice", "alice@example.com", Set.of("user"), Map.of());

    List<BatchCheckItem> items =
        permissionManager.batchCheck("alice", List.of(new PermissionRequest("data", "read", Map.of())));

    assertThat(items.get(0).granted()).isFalse();
    assertThat(items.get(0).reason()).contains("alice");
  }

  @Test
  void getStatistics_countsDecisions() {
    aliceWithSession("user");
    check("data", "read");
    check("data", "read");
    check("data", "write");

    PermissionStatistics statistics = permissionManager.getStatistics();

    assertThat(statistics.totalUsers()).isEqualTo(1);
    assertThat(statistics.activeUsers()).isEqualTo(1);
    assertThat(statistics.totalChecks()).isEqualTo(3);
    assertThat(statistics.grantedChecks()).isEqualTo(2);
    assertThat(statistics.deniedChecks()).isEqualTo(1);
    assertThat(statistics.cache().totalEntries()).isEqualTo(2);
  }

  @Test
  void cleanupExpiredData_sweepsSessionsAndCache() {
    aliceWithSession("user");
    check("data", "read");
    clock.advance(Duration.ofMinutes(31));

    CleanupReport report = permissionManager.cleanupExpiredData();

    assertThat(report.sessions()).isEqualTo(1);
    assertThat(report.cacheEntries()).isEqualTo(1);
    assertThat(report.auditEntries()).isZero();
    assertThat(permissionManager.getStatistics().cleanupRuns()).isEqualTo(1);
  }

  @Test
  void checkPermission_auditsAttemptAndDecision() {
    aliceWithSession("user");
    check("data", "read");

    List<AuditLogEntry> entries = permissionManager.getAuditLogs(AuditQuery.forSubject("alice").withResource("data"), 10);

    assertThat(entries).extracting(AuditLogEntry::eventType)
        .contains(AuditEventType.PERMISSION_CHECK, AuditEventType.PERMISSION_DECISION);
    assertThat(entries).filteredOn(e -> e.eventType() == AuditEventType.PERMISSION_DECISION)
        .extracting(AuditLogEntry::outcome)
        .containsExactly(AuditOutcome.GRANTED);
  }
}
