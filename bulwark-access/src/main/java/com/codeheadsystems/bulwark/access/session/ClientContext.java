package com.codeheadsystems.bulwark.access.session;

import java.util.Map;

/**
 * Where a session was opened from.
 *
 * @param clientIp   the client ip, may be null
 * @param userAgent  the user agent, may be null
 * @param attributes free-form attributes
 */
public record ClientContext(String clientIp, String userAgent, Map<String, String> attributes) {

  public static final ClientContext UNKNOWN = new ClientContext(null, null, Map.of());

  /**
   * Instantiates a new Client context.
   */
  public ClientContext {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public static ClientContext fromIp(String clientIp) {
    return new ClientContext(clientIp, null, Map.of());
  }
}
