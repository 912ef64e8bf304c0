package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.List;
import java.util.Optional;

public interface Channel {

  record ChannelInfo(String key, List<String> names, String number) {}

  default Optional<List<ChannelInfo>> availableChannels() throws CapabilityException {
    return Optional.empty();
  }

  default Optional<Boolean> commandOnlyChannels() throws CapabilityException {
    return Optional.empty();
  }

  /**
   * Tune to a channel by its unique code. Name and number are what the user said and may be null.
   */
  void selectChannelById(String code, String name, String number) throws CapabilityException;

  void selectChannelByNumber(String number) throws CapabilityException;

  void relativeChannel(int change) throws CapabilityException;

  /** Go back to the previous channel. */
  void returnChannel() throws CapabilityException;
}
