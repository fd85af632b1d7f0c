package org.m2mrsp.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.List;

/**
 * Dropwizard configuration for the SM-DP / SM-SR service.
 * <p>
 * Entity certificates are issued at startup by an in-process root CA named {@code rootCaName};
 * every configured eUICC gets its own certificate from the same root and is registered with
 * SM-SR before the resources start serving.
 */
public class RspConfiguration extends Configuration {

  /**
   * Common name of the SM-DP certificate. Also used as the SM-DP host id in SCP03t key
   * derivation.
   */
  @NotEmpty
  private String smDpName = "SM-DP";

  /**
   * Common name of the SM-SR certificate.
   */
  @NotEmpty
  private String smSrName = "SM-SR";

  @NotEmpty
  private String rootCaName = "M2M RSP Root";

  /**
   * Lifetime of a key establishment or PSK re-key session, in seconds.
   */
  @Min(1)
  private long sessionTtlSeconds = 120;

  /**
   * PBKDF2-HMAC-SHA256 iterations used to stretch transport PSKs.
   */
  @Min(1000)
  private int pbkdf2Iterations = 10_000;

  /**
   * Length of the PSK SM-SR issues on registration: 16 (AES-128) or 32 (AES-256).
   */
  @Min(16)
  @Max(32)
  private int registrationPskLength = 16;

  /**
   * Bound profile package segment size in bytes.
   */
  @Min(1)
  private int segmentSize = 1024;

  /**
   * Simulated cards attached at startup.
   */
  @Valid
  @NotNull
  private List<EuiccConfiguration> euiccs = new ArrayList<>();

  @JsonProperty
  public String getSmDpName() {
    return smDpName;
  }

  @JsonProperty
  public void setSmDpName(String smDpName) {
    this.smDpName = smDpName;
  }

  @JsonProperty
  public String getSmSrName() {
    return smSrName;
  }

  @JsonProperty
  public void setSmSrName(String smSrName) {
    this.smSrName = smSrName;
  }

  @JsonProperty
  public String getRootCaName() {
    return rootCaName;
  }

  @JsonProperty
  public void setRootCaName(String rootCaName) {
    this.rootCaName = rootCaName;
  }

  @JsonProperty
  public long getSessionTtlSeconds() {
    return sessionTtlSeconds;
  }

  @JsonProperty
  public void setSessionTtlSeconds(long sessionTtlSeconds) {
    this.sessionTtlSeconds = sessionTtlSeconds;
  }

  @JsonProperty
  public int getPbkdf2Iterations() {
    return pbkdf2Iterations;
  }

  @JsonProperty
  public void setPbkdf2Iterations(int pbkdf2Iterations) {
    this.pbkdf2Iterations = pbkdf2Iterations;
  }

  @JsonProperty
  public int getRegistrationPskLength() {
    return registrationPskLength;
  }

  @JsonProperty
  public void setRegistrationPskLength(int registrationPskLength) {
    this.registrationPskLength = registrationPskLength;
  }

  @JsonProperty
  public int getSegmentSize() {
    return segmentSize;
  }

  @JsonProperty
  public void setSegmentSize(int segmentSize) {
    this.segmentSize = segmentSize;
  }

  @JsonProperty
  public List<EuiccConfiguration> getEuiccs() {
    return euiccs;
  }

  @JsonProperty
  public void setEuiccs(List<EuiccConfiguration> euiccs) {
    this.euiccs = euiccs;
  }
}
