package com.acme.homelander.fulfillment.request;

import com.acme.homelander.command.Command;
import com.acme.homelander.command.CommandCodec;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;

/** Every command in {@code execution} applies to every device in {@code devices}. */
public record CommandGroup(
    List<DeviceRef> devices,
    @JsonSerialize(contentUsing = CommandCodec.Serializer.class)
        @JsonDeserialize(contentUsing = CommandCodec.Deserializer.class)
        List<Command> execution) {
  public CommandGroup {
    devices = devices == null ? List.of() : List.copyOf(devices);
    execution = execution == null ? List.of() : List.copyOf(execution);
  }
}
