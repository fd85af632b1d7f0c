package org.m2mrsp.server.orchestrator;

import java.util.Locale;

/**
 * Steps of a provisioning run, in execution order, plus the maintenance operations the
 * orchestrator runs outside of {@link ProvisioningOrchestrator#provision}.
 */
public enum ProtocolPhase {
  REGISTRATION,
  ISDP_CREATION,
  KEY_ESTABLISHMENT,
  PROFILE_DOWNLOAD,
  PROFILE_ENABLING,
  PROFILE_DISABLING,
  ISDP_DELETION,
  TRANSPORT_REKEY;

  /**
   * Name under which the phase duration is recorded.
   *
   * @return the lower-case phase name
   */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
