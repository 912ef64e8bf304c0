package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.List;

/** Media playback control. */
public interface TransportControl {

  enum ControlCommand {
    CAPTION_CONTROL,
    NEXT,
    PAUSE,
    PREVIOUS,
    RESUME,
    SEEK_RELATIVE,
    SEEK_TO_POSITION,
    SET_REPEAT,
    SHUFFLE,
    STOP
  }

  List<ControlCommand> transportControlSupportedCommands() throws CapabilityException;

  void stop() throws CapabilityException;

  void next() throws CapabilityException;

  void previous() throws CapabilityException;

  void pause() throws CapabilityException;

  void resume() throws CapabilityException;

  void seekRelative(long relativePositionMs) throws CapabilityException;

  void seekToPosition(long absPositionMs) throws CapabilityException;

  void repeatMode(boolean on, boolean single) throws CapabilityException;

  void shuffle() throws CapabilityException;

  /** Either language may be null. */
  void closedCaptioningOn(Language captionLanguage, Language userQueryLanguage)
      throws CapabilityException;

  void closedCaptioningOff() throws CapabilityException;
}
