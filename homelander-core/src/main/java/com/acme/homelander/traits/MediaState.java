package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.Optional;

/** Query-only playback and activity state of media devices. */
public interface MediaState {

  enum ActivityState {
    INACTIVE,
    STANDBY,
    ACTIVE
  }

  enum PlaybackState {
    PAUSED,
    PLAYING,
    FAST_FORWARDING,
    REWINDING,
    BUFFERING,
    STOPPED
  }

  default Optional<Boolean> supportActivityState() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> supportPlaybackState() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<ActivityState> activityState() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<PlaybackState> playbackState() throws CapabilityException {
    return Optional.empty();
  }
}
