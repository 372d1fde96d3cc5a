package com.codeheadsystems.bulwark.access.policy;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Holds when the context's {@code clientIP} equals one of the allowed addresses or falls in
 * one of the allowed IPv4 CIDR blocks. A missing client address never matches.
 *
 * @param allowed addresses and blocks such as {@code 10.0.0.0/8}
 */
public record IpRangeCondition(@JsonProperty("allowed") List<String> allowed) implements Condition {

  /**
   * Instantiates a new Ip range condition.
   */
  public IpRangeCondition {
    allowed = allowed == null ? List.of() : List.copyOf(allowed);
  }

  @Override
  public boolean test(EvaluationContext context) {
    String clientIp = context.clientIp();
    if (clientIp == null || clientIp.isBlank()) {
      return false;
    }
    for (String entry : allowed) {
      if (entry.contains("/") ? inBlock(clientIp, entry) : entry.equals(clientIp)) {
        return true;
      }
    }
    return false;
  }

  private static boolean inBlock(String address, String cidr) {
    int slash = cidr.indexOf('/');
    int prefix = Integer.parseInt(cidr.substring(slash + 1));
    if (prefix < 0 || prefix > 32) {
      throw new IllegalArgumentException("Invalid CIDR prefix: " + cidr);
    }
    long network = parseIpv4(cidr.substring(0, slash));
    long candidate;
    try {
      candidate = parseIpv4(address);
    } catch (IllegalArgumentException e) {
      return false;
    }
    long mask = prefix == 0 ? 0L : (0xFFFFFFFFL << (32 - prefix)) & 0xFFFFFFFFL;
    return (network & mask) == (candidate & mask);
  }

  static long parseIpv4(String address) {
    String[] octets = address.trim().split("\\.", -1);
    if (octets.length != 4) {
      throw new IllegalArgumentException("Not an IPv4 address: " + address);
    }
    long value = 0;
    for (String octet : octets) {
      int part;
      try {
        part = Integer.parseInt(octet);
      } catch (NumberFormatException e) {
        throw new IllegalArgumentException("Not an IPv4 address: " + address, e);
      }
      if (part < 0 || part > 255) {
        throw new IllegalArgumentException("Not an IPv4 address: " + address);
      }
      value = (value << 8) | part;
    }
    return value;
  }
}
