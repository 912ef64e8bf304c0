package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.List;

/** Cameras whose feed can be cast to a screen. */
public interface CameraStream {

  enum Protocol {
    HLS("hls"),
    DASH("dash"),
    SMOOTH_STREAM("smooth_stream"),
    PROGRESSIVE_MP4("progressive_mp4"),
    WEB_RTC("webrtc");

    private final String wireName;

    Protocol(String wireName) {
      this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
      return wireName;
    }
  }

  /** Where and how to fetch the stream. Only the access URL is mandatory. */
  record StreamDescriptor(
      String cameraStreamAccessUrl,
      String cameraStreamAuthToken,
      String cameraStreamReceiverAppId,
      Protocol cameraStreamProtocol) {}

  List<Protocol> supportedProtocols() throws CapabilityException;

  boolean needsAuthToken() throws CapabilityException;

  StreamDescriptor getStream(boolean streamToChromecast, List<Protocol> supportedProtocols)
      throws CapabilityException;
}
