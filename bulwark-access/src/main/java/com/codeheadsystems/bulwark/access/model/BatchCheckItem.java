package com.codeheadsystems.bulwark.access.model;

/**
 * Result of one entry of a batch check.
 *
 * @param resource the resource
 * @param action   the action
 * @param granted  whether access is granted
 * @param reason   the reason, or the error message when the check failed
 */
public record BatchCheckItem(String resource, String action, boolean granted, String reason) {
}
