package org.m2mrsp.protocol.model;

/**
 * A prepared profile with the hash computed over its canonical content.
 *
 * @param content       profile body
 * @param integrityHash lower-case hex SHA-256 of the canonical JSON of {@code content}
 * @param status        current status
 */
public record Profile(ProfileContent content, String integrityHash, ProfileStatus status) {

  public String iccid() {
    return content.iccid();
  }

  public Profile withStatus(ProfileStatus newStatus) {
    return new Profile(content, integrityHash, newStatus);
  }
}
