package com.codeheadsystems.bulwark.transport;

import java.security.PublicKey;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Known peers' public keys, by client id. Used to verify incoming packets and to encrypt
 * asymmetric packets to a recipient.
 */
public class PeerKeyDirectory {

  private static final Logger log = LoggerFactory.getLogger(PeerKeyDirectory.class);

  private final ConcurrentHashMap<String, PublicKey> peers = new ConcurrentHashMap<>();

  public void register(String clientId, PublicKey publicKey) {
    if (clientId == null || clientId.isBlank()) {
      throw new IllegalArgumentException("clientId is required");
    }
    peers.put(clientId, Objects.requireNonNull(publicKey, "publicKey"));
    log.debug("Registered public key for peer {}", clientId);
  }

  public Optional<PublicKey> lookup(String clientId) {
    return clientId == null ? Optional.empty() : Optional.ofNullable(peers.get(clientId));
  }

  public void remove(String clientId) {
    peers.remove(clientId);
  }

  public int size() {
    return peers.size();
  }

  public void clear() {
    peers.clear();
  }
}
