package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.SerializableError;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Routers and mesh networks: guest network, network profiles and speed tests.
 *
 * <p>The {@code supports*} attributes advertise which of the commands the device accepts.
 */
public interface NetworkControl {

  record NetworkSettings(String ssid) {}

  enum SpeedTestStatus {
    SUCCESS,
    FAILURE
  }

  record DownloadSpeedTest(
      double downloadSpeedMbps, long unixTimestampSec, SpeedTestStatus status) {}

  record UploadSpeedTest(double uploadSpeedMbps, long unixTimestampSec, SpeedTestStatus status) {}

  record ProfileState(boolean enabled) {}

  enum ErrorCode implements SerializableError {
    NETWORK_PROFILE_NOT_RECOGNIZED("networkProfileNotRecognized"),
    NETWORK_SPEED_TEST_IN_PROGRESS("networkSpeedTestInProgress");

    private final String code;

    ErrorCode(String code) {
      this.code = code;
    }

    @Override
    public String errorCode() {
      return code;
    }
  }

  default Optional<List<String>> networkProfiles() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsEnablingGuestNetwork() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsDisablingGuestNetwork() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsGettingGuestNetworkPassword() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsEnablingNetworkProfile() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsDisablingNetworkProfile() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsNetworkDownloadSpeedTest() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportsNetworkUploadSpeedTest() throws CapabilityException {
    return Optional.empty();
  }

  boolean networkEnabled() throws CapabilityException;

  NetworkSettings networkSettings() throws CapabilityException;

  default Optional<Boolean> guestNetworkEnabled() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<NetworkSettings> guestNetworkSettings() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Integer> numConnectedDevices() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> networkUsageMb() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Double> networkUsageLimitMb() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> networkUsageUnlimited() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<DownloadSpeedTest> lastNetworkDownloadSpeedTest() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<UploadSpeedTest> lastNetworkUploadSpeedTest() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> networkSpeedTestInProgress() throws CapabilityException {
    return Optional.empty();
  }

  /** Profile name to its state. */
  default Optional<Map<String, ProfileState>> networkProfilesState() throws CapabilityException {
    return Optional.empty();
  }

  void enableGuestNetwork(boolean enable) throws CapabilityException;

  void enableNetworkProfile(String profile, boolean enable) throws CapabilityException;

  String guestNetworkPassword() throws CapabilityException;

  void testNetworkSpeed(boolean download, boolean upload) throws CapabilityException;
}
