package com.codeheadsystems.bulwark.access.model;

import java.util.Map;

/**
 * One entry of a batch check.
 *
 * @param resource the resource
 * @param action   the action
 * @param context  request context, such as {@code clientIP}
 */
public record PermissionRequest(String resource, String action, Map<String, String> context) {

  /**
   * Instantiates a new Permission request.
   */
  public PermissionRequest {
    context = context == null ? Map.of() : Map.copyOf(context);
  }
}
