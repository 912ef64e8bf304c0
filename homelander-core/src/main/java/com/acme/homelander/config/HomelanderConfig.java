package com.acme.homelander.config;

import java.util.Objects;

/**
 * Settings of one fulfillment endpoint. Pure POJO - no framework dependencies.
 */
public class HomelanderConfig {

  private String agentUserId;
  private String syncFailureErrorCode = "transientError";
  private boolean reportOnlineInExecuteStates = true;

  public HomelanderConfig() {}

  public HomelanderConfig(String agentUserId) {
    this.agentUserId = agentUserId;
  }

  public String getAgentUserId() {
    return agentUserId;
  }

  public void setAgentUserId(String agentUserId) {
    this.agentUserId = agentUserId;
  }

  /** Error code reported for the whole SYNC response when a device fails unexpectedly. */
  public String getSyncFailureErrorCode() {
    return syncFailureErrorCode;
  }

  public void setSyncFailureErrorCode(String syncFailureErrorCode) {
    this.syncFailureErrorCode = syncFailureErrorCode;
  }

  public boolean isReportOnlineInExecuteStates() {
    return reportOnlineInExecuteStates;
  }

  public void setReportOnlineInExecuteStates(boolean reportOnlineInExecuteStates) {
    this.reportOnlineInExecuteStates = reportOnlineInExecuteStates;
  }

  /**
   * @throws IllegalStateException if a required setting is missing
   */
  public void validate() {
    if (agentUserId == null || agentUserId.isBlank()) {
      throw new IllegalStateException("agentUserId is required");
    }
    Objects.requireNonNull(syncFailureErrorCode, "syncFailureErrorCode");
  }
}
