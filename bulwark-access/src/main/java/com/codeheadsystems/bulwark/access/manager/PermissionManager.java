package com.codeheadsystems.bulwark.access.manager;

import com.codeheadsystems.bulwark.access.cache.PermissionCache;
import com.codeheadsystems.bulwark.access.cache.PermissionCacheEntry;
import com.codeheadsystems.bulwark.access.config.PermissionConfig;
import com.codeheadsystems.bulwark.access.model.BatchCheckItem;
import com.codeheadsystems.bulwark.access.model.CleanupReport;
import com.codeheadsystems.bulwark.access.model.Permission;
import com.codeheadsystems.bulwark.access.model.PermissionCheck;
import com.codeheadsystems.bulwark.access.model.PermissionRequest;
import com.codeheadsystems.bulwark.access.model.PermissionStatistics;
import com.codeheadsystems.bulwark.access.model.Role;
import com.codeheadsystems.bulwark.access.model.User;
import com.codeheadsystems.bulwark.access.policy.DynamicPolicy;
import com.codeheadsystems.bulwark.access.policy.EvaluationContext;
import com.codeheadsystems.bulwark.access.policy.PolicyDecision;
import com.codeheadsystems.bulwark.access.policy.PolicyEngine;
import com.codeheadsystems.bulwark.access.session.SessionManager;
import com.codeheadsystems.bulwark.common.SecurityErrorCode;
import com.codeheadsystems.bulwark.common.SecurityResult;
import com.codeheadsystems.bulwark.common.audit.AuditEventType;
import com.codeheadsystems.bulwark.common.audit.AuditLogEntry;
import com.codeheadsystems.bulwark.common.audit.AuditLogger;
import com.codeheadsystems.bulwark.common.audit.AuditOutcome;
import com.codeheadsystems.bulwark.common.audit.AuditQuery;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Role-based access control over users, roles and permissions, combined with dynamic
 * policies, sessions, a decision cache and the audit log.
 * <p>
 * A check runs: audit the attempt, serve a cached decision, deny unknown or disabled
 * subjects, require a valid session, evaluate static grants and dynamic policies, cache the
 * decision and audit it. Denials are successful results with {@code granted == false};
 * failures are {@code SESSION_EXPIRED} and {@code POLICY_EVALUATION_ERROR}.
 * <p>
 * Administrative changes that affect a subject's grants drop that subject's cached
 * decisions; policy changes drop the whole cache.
 */
@Singleton
public class PermissionManager {

  private static final Logger log = LoggerFactory.getLogger(PermissionManager.class);

  private final PermissionConfig config;
  private final SessionManager sessionManager;
  private final PolicyEngine policyEngine;
  private final AuditLogger auditLogger;
  private final Clock clock;
  private final PermissionCache cache;

  private final ConcurrentHashMap<String, User> users = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Role> roles = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Permission> permissions = new ConcurrentHashMap<>();

  private final AtomicLong totalChecks = new AtomicLong();
  private final AtomicLong grantedChecks = new AtomicLong();
  private final AtomicLong deniedChecks = new AtomicLong();
  private final AtomicLong cacheHits = new AtomicLong();
  private final AtomicLong cleanupRuns = new AtomicLong();

  private final ScheduledExecutorService cleanupReaper =
      Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "permission-cleanup-reaper");
        t.setDaemon(true);
        return t;
      });

  /**
   * Instantiates a new Permission manager with the default permissions and roles, and starts
   * the background cleanup.
   *
   * @param config         the config
   * @param sessionManager the session manager
   * @param policyEngine   the policy engine
   * @param auditLogger    the audit logger
   * @param clock          the clock
   */
  @Inject
  public PermissionManager(PermissionConfig config,
                           SessionManager sessionManager,
                           PolicyEngine policyEngine,
                           AuditLogger auditLogger,
                           Clock clock) {
    this.config = config;
    this.sessionManager = sessionManager;
    this.policyEngine = policyEngine;
    this.auditLogger = auditLogger;
    this.clock = clock;
    this.cache = new PermissionCache(clock, config.maxCacheSize());
    installDefaults();
    long intervalMs = config.cleanupInterval().toMillis();
    cleanupReaper.scheduleAtFixedRate(this::runScheduledCleanup, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Stops the background cleanup thread.
   */
  public void shutdown() {
    cleanupReaper.shutdown();
  }

  // ── Checks ──────────────────────────────────────────────────────────────

  /**
   * Checks whether the subject may perform the action on the resource.
   *
   * @param subject  the subject (user id)
   * @param resource the resource
   * @param action   the action
   * @param context  request context, such as {@code clientIP}
   * @return the check, or {@code SESSION_EXPIRED} / {@code POLICY_EVALUATION_ERROR}
   */
  public SecurityResult<PermissionCheck> checkPermission(String subject,
                                                         String resource,
                                                         String action,
                                                         Map<String, String> context) {
    if (subject == null || resource == null || action == null) {
      throw new IllegalArgumentException("subject, resource and action are required");
    }
    Map<String, String> requestContext = context == null ? Map.of() : context;
    audit(AuditEventType.PERMISSION_CHECK, subject, resource, AuditOutcome.ATTEMPT, Map.of("action", action));

    if (config.enablePermissionCache()) {
      Optional<Boolean> cached = cache.get(subject, resource, action);
      if (cached.isPresent()) {
        cacheHits.incrementAndGet();
        return decided(subject, resource, action,
            new PermissionCheck(cached.get(), "Cached decision", List.of(), true));
      }
    }

    User user = users.get(subject);
    if (user == null) {
      return decided(subject, resource, action, PermissionCheck.denied("Unknown subject"));
    }
    if (!user.active()) {
      return decided(subject, resource, action, PermissionCheck.denied("Subject is disabled"));
    }
    if (!sessionManager.isValid(subject)) {
      audit(AuditEventType.PERMISSION_DECISION, subject, resource, AuditOutcome.DENIED,
          Map.of("action", action, "reason", "session expired"));
      return SecurityResult.failure(SecurityErrorCode.SESSION_EXPIRED, "No valid session for " + subject);
    }

    EvaluationContext evaluationContext =
        new EvaluationContext(subject, user.attributes(), requestContext, clock.millis());
    SecurityResult<PolicyDecision> evaluated =
        policyEngine.evaluate(subject, resource, action, evaluationContext, staticGrants(user));
    if (evaluated.isFailure()) {
      audit(AuditEventType.PERMISSION_DECISION, subject, resource, AuditOutcome.FAILURE,
          Map.of("action", action, "reason", evaluated.error().message()));
      return SecurityResult.failure(evaluated.error());
    }
    PolicyDecision decision = evaluated.value();
    if (config.enablePermissionCache() && !decision.contextDependent()) {
      cache.put(new PermissionCacheEntry(subject, resource, action, decision.granted(), clock.millis(),
          config.cacheTimeout().toMillis()));
    }
    return decided(subject, resource, action,
        new PermissionCheck(decision.granted(), decision.reason(), decision.matchedPolicies(), false));
  }

  /**
   * Checks several requests for one subject. Failed checks are reported as denials carrying
   * the error message.
   *
   * @param subject  the subject
   * @param requests the requests
   * @return one item per request, in order
   */
  public List<BatchCheckItem> batchCheck(String subject, List<PermissionRequest> requests) {
    List<BatchCheckItem> items = new ArrayList<>(requests.size());
    for (PermissionRequest request : requests) {
      SecurityResult<PermissionCheck> result =
          checkPermission(subject, request.resource(), request.action(), request.context());
      items.add(result.isSuccess()
          ? new BatchCheckItem(request.resource(), request.action(), result.value().granted(), result.value().reason())
          : new BatchCheckItem(request.resource(), request.action(), false, result.error().message()));
    }
    return items;
  }

  private SecurityResult<PermissionCheck> decided(String subject, String resource, String action,
                                                  PermissionCheck check) {
    totalChecks.incrementAndGet();
    (check.granted() ? grantedChecks : deniedChecks).incrementAndGet();
    audit(AuditEventType.PERMISSION_DECISION, subject, resource,
        check.granted() ? AuditOutcome.GRANTED : AuditOutcome.DENIED,
        Map.of("action", action, "reason", check.reason()));
    return SecurityResult.success(check);
  }

  private List<Permission> staticGrants(User user) {
    Set<String> ids = new TreeSet<>(user.directPermissions());
    for (String roleId : user.roles()) {
      Role role = roles.get(roleId);
      if (role != null && role.active()) {
        ids.addAll(role.permissions());
      }
    }
    List<Permission> grants = new ArrayList<>(ids.size());
    for (String id : ids) {
      Permission permission = permissions.get(id);
      if (permission != null) {
        grants.add(permission);
      }
    }
    return grants;
  }

  // ── Registry ────────────────────────────────────────────────────────────

  /**
   * Registers a user.
   *
   * @param id         the id
   * @param username   the username
   * @param email      the email
   * @param roleIds    initial roles, all of which must exist
   * @param attributes subject attributes
   * @return the user
   * @throws IllegalArgumentException if the user exists or a role is unknown
   */
  public User createUser(String id, String username, String email, Set<String> roleIds,
                         Map<String, String> attributes) {
    Set<String> initialRoles = roleIds == null ? Set.of() : roleIds;
    for (String roleId : initialRoles) {
      requireRole(roleId);
    }
    User user = new User(id, username, email, initialRoles, Set.of(), true, clock.millis(), attributes);
    if (users.putIfAbsent(id, user) != null) {
      throw new IllegalArgumentException("User already exists: " + id);
    }
    audit(AuditEventType.USER_CHANGED, id, "", AuditOutcome.SUCCESS, Map.of("change", "created"));
    return user;
  }

  /**
   * Registers a role.
   *
   * @param role the role
   * @return the role
   * @throws IllegalArgumentException if the role exists
   */
  public Role createRole(Role role) {
    if (roles.putIfAbsent(role.id(), role) != null) {
      throw new IllegalArgumentException("Role already exists: " + role.id());
    }
    audit(AuditEventType.ROLE_CHANGED, "", role.id(), AuditOutcome.SUCCESS, Map.of("change", "created"));
    return role;
  }

  /**
   * Registers a permission.
   *
   * @param permission the permission
   * @return the permission
   * @throws IllegalArgumentException if the permission exists
   */
  public Permission createPermission(Permission permission) {
    if (permissions.putIfAbsent(permission.id(), permission) != null) {
      throw new IllegalArgumentException("Permission already exists: " + permission.id());
    }
    audit(AuditEventType.POLICY_CHANGED, "", permission.id(), AuditOutcome.SUCCESS, Map.of("change", "created"));
    return permission;
  }

  /**
   * Gives a user a role.
   *
   * @param userId the user id
   * @param roleId the role id
   * @return false if the user already had the role
   */
  public boolean assignRole(String userId, String roleId) {
    requireRole(roleId);
    boolean changed = updateUser(userId, user -> user.roles().contains(roleId) ? user : user.withRole(roleId));
    if (changed) {
      audit(AuditEventType.ROLE_CHANGED, userId, roleId, AuditOutcome.SUCCESS, Map.of("change", "assigned"));
    }
    return changed;
  }

  /**
   * Takes a role from a user.
   *
   * @param userId the user id
   * @param roleId the role id
   * @return false if the user did not have the role
   */
  public boolean revokeRole(String userId, String roleId) {
    boolean changed = updateUser(userId, user -> user.roles().contains(roleId) ? user.withoutRole(roleId) : user);
    if (changed) {
      audit(AuditEventType.ROLE_CHANGED, userId, roleId, AuditOutcome.SUCCESS, Map.of("change", "revoked"));
    }
    return changed;
  }

  /**
   * Grants a permission directly to a user.
   *
   * @param userId       the user id
   * @param permissionId the permission id
   * @return false if the user already had it directly
   */
  public boolean grantPermission(String userId, String permissionId) {
    if (!permissions.containsKey(permissionId)) {
      throw new IllegalArgumentException("Unknown permission: " + permissionId);
    }
    boolean changed = updateUser(userId, user -> user.directPermissions().contains(permissionId)
        ? user
        : user.withDirectPermission(permissionId));
    if (changed) {
      audit(AuditEventType.USER_CHANGED, userId, permissionId, AuditOutcome.SUCCESS, Map.of("change", "granted"));
    }
    return changed;
  }

  /**
   * Enables or disables a user.
   *
   * @param userId the user id
   * @param active the active flag
   * @return true if the flag changed
   */
  public boolean setUserActive(String userId, boolean active) {
    boolean changed = updateUser(userId, user -> user.active() == active ? user : user.withActive(active));
    if (changed) {
      audit(AuditEventType.USER_CHANGED, userId, "", AuditOutcome.SUCCESS,
          Map.of("change", active ? "enabled" : "disabled"));
    }
    return changed;
  }

  /**
   * Enables or disables a role for every user holding it.
   *
   * @param roleId the role id
   * @param active the active flag
   * @return true if the flag changed
   */
  public boolean setRoleActive(String roleId, boolean active) {
    Role before = requireRole(roleId);
    if (before.active() == active) {
      return false;
    }
    roles.put(roleId, before.withActive(active));
    users.values().stream()
        .filter(user -> user.roles().contains(roleId))
        .forEach(user -> cache.invalidateSubject(user.id()));
    audit(AuditEventType.ROLE_CHANGED, "", roleId, AuditOutcome.SUCCESS,
        Map.of("change", active ? "enabled" : "disabled"));
    return true;
  }

  public Optional<User> getUser(String userId) {
    return Optional.ofNullable(users.get(userId));
  }

  public Optional<Role> getRole(String roleId) {
    return Optional.ofNullable(roles.get(roleId));
  }

  /**
   * The user's static grants: direct permissions plus those of its active roles.
   *
   * @param userId the user id
   * @return the permissions ordered by id, empty for unknown users
   */
  public List<Permission> getUserPermissions(String userId) {
    User user = users.get(userId);
    return user == null ? List.of() : staticGrants(user);
  }

  private boolean updateUser(String userId, UnaryOperator<User> change) {
    boolean[] changed = new boolean[1];
    User updated = users.computeIfPresent(userId, (id, user) -> {
      User next = change.apply(user);
      changed[0] = next != user;
      return next;
    });
    if (updated == null) {
      throw new IllegalArgumentException("Unknown user: " + userId);
    }
    if (changed[0]) {
      cache.invalidateSubject(userId);
    }
    return changed[0];
  }

  private Role requireRole(String roleId) {
    Role role = roles.get(roleId);
    if (role == null) {
      throw new IllegalArgumentException("Unknown role: " + roleId);
    }
    return role;
  }

  // ── Policies ────────────────────────────────────────────────────────────

  public void addDynamicPolicy(DynamicPolicy policy) {
    policyEngine.addDynamicPolicy(policy);
    cache.clear();
    audit(AuditEventType.POLICY_CHANGED, "", policy.id(), AuditOutcome.SUCCESS, Map.of("change", "added"));
  }

  /**
   * Removes a dynamic policy.
   *
   * @param policyId the policy id
   * @return true if it existed
   */
  public boolean removeDynamicPolicy(String policyId) {
    boolean removed = policyEngine.removeDynamicPolicy(policyId);
    if (removed) {
      cache.clear();
      audit(AuditEventType.POLICY_CHANGED, "", policyId, AuditOutcome.SUCCESS, Map.of("change", "removed"));
    }
    return removed;
  }

  // ── Audit, maintenance and statistics ───────────────────────────────────

  public List<AuditLogEntry> getAuditLogs(AuditQuery query, int limit) {
    return auditLogger.getLogs(query, limit);
  }

  /**
   * Sweeps expired sessions and cached decisions and prunes the audit log.
   *
   * @return what was removed
   */
  public CleanupReport cleanupExpiredData() {
    CleanupReport report = new CleanupReport(
        sessionManager.sweepExpired(),
        cache.cleanupExpired(),
        auditLogger.cleanupOldLogs(config.auditLogRetention()));
    cleanupRuns.incrementAndGet();
    log.debug("Cleanup removed {}", report);
    return report;
  }

  private void runScheduledCleanup() {
    try {
      cleanupExpiredData();
    } catch (RuntimeException e) {
      log.warn("Scheduled cleanup failed", e);
    }
  }

  /**
   * Current counters.
   *
   * @return the statistics
   */
  public PermissionStatistics getStatistics() {
    long checks = totalChecks.get();
    return new PermissionStatistics(
        users.size(),
        (int) users.values().stream().filter(User::active).count(),
        roles.size(),
        (int) roles.values().stream().filter(Role::active).count(),
        permissions.size(),
        (int) permissions.values().stream().filter(Permission::active).count(),
        checks,
        grantedChecks.get(),
        deniedChecks.get(),
        checks == 0 ? 0.0 : (double) cacheHits.get() / checks,
        cleanupRuns.get(),
        cache.stats());
  }

  PermissionCache cache() {
    return cache;
  }

  private void audit(AuditEventType type, String subject, String resource, AuditOutcome outcome,
                     Map<String, String> details) {
    if (config.enableAuditLog()) {
      auditLogger.log(type, subject, resource, outcome, details);
    }
  }

  private void installDefaults() {
    createPermission(new Permission("read_data", "Read data", "Read system data", "data",
        Set.of("read", "view"), List.of(), true));
    createPermission(new Permission("write_data", "Write data", "Write system data", "data",
        Set.of("write", "create", "update"), List.of(), true));
    createPermission(new Permission("delete_data", "Delete data", "Delete system data", "data",
        Set.of("delete"), List.of(), true));
    createRole(new Role("admin", "Administrator", "Full access to system data",
        Set.of("read_data", "write_data", "delete_data"), true));
    createRole(new Role("editor", "Editor", "Reads and writes system data", Set.of("read_data", "write_data"), true));
    createRole(new Role("user", "User", "Reads system data", Set.of("read_data"), true));
  }
}
