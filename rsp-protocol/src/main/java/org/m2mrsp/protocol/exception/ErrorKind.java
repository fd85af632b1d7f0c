package org.m2mrsp.protocol.exception;

/**
 * Closed set of failure categories surfaced by the provisioning protocol.
 * <p>
 * Every {@link RspException} carries exactly one kind so that transport adapters can map
 * failures to wire responses without inspecting exception classes.
 */
public enum ErrorKind {
  INVALID_PUBLIC_KEY,
  SIGNATURE_VERIFICATION_FAILED,
  CERTIFICATE_VERIFICATION_FAILED,
  MAC_VERIFICATION_FAILED,
  DECRYPTION_FAILED,
  INSUFFICIENT_MEMORY,
  PROFILE_NOT_FOUND,
  PROFILE_INTEGRITY_FAILED,
  INVALID_SESSION,
  SESSION_EXPIRED,
  PSK_NOT_ESTABLISHED,
  INVALID_KEY_LENGTH,
  INVALID_ISDP_STATE,
  EUICC_NOT_REGISTERED
}
