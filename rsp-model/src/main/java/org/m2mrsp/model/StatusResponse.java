package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.LinkedHashMap;
import java.util.Map;
import org.m2mrsp.protocol.model.EntityStatus;

/**
 * Status probe: {@code {status:"active", entity, <counters>}} with the entity counters
 * flattened into the top-level object.
 */
@JsonPropertyOrder({"status", "entity"})
public class StatusResponse {

  public static final String ACTIVE = "active";

  private final String status;
  private final String entity;
  private final Map<String, Object> counters = new LinkedHashMap<>();

  @JsonCreator
  public StatusResponse(@JsonProperty("status") String status,
                        @JsonProperty("entity") String entity) {
    this.status = status;
    this.entity = entity;
  }

  public StatusResponse(EntityStatus entityStatus) {
    this(ACTIVE, entityStatus.entity());
    counters.putAll(entityStatus.counters());
  }

  @JsonProperty("status")
  public String getStatus() {
    return status;
  }

  @JsonProperty("entity")
  public String getEntity() {
    return entity;
  }

  @JsonAnyGetter
  public Map<String, Object> getCounters() {
    return counters;
  }

  @JsonAnySetter
  public void setCounter(String name, Object value) {
    counters.put(name, value);
  }
}
