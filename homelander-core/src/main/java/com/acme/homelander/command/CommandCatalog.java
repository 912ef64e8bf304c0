package com.acme.homelander.command;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Wire names of EXECUTE commands, {@code action.devices.commands.*}, and their types. */
public final class CommandCatalog {
  private static final String PREFIX = "action.devices.commands.";

  private static final Map<String, Class<? extends Command>> BY_NAME = new LinkedHashMap<>();
  private static final Map<Class<? extends Command>, String> BY_TYPE = new LinkedHashMap<>();

  static {
    add("appInstall", Command.AppInstall.class);
    add("appSearch", Command.AppSearch.class);
    add("appSelect", Command.AppSelect.class);
    add("ArmDisarm", Command.ArmDisarm.class);
    add("BrightnessAbsolute", Command.BrightnessAbsolute.class);
    add("BrightnessRelative", Command.BrightnessRelative.class);
    add("GetCameraStream", Command.GetCameraStream.class);
    add("selectChannel", Command.SelectChannel.class);
    add("relativeChannel", Command.RelativeChannel.class);
    add("returnChannel", Command.ReturnChannel.class);
    add("ColorAbsolute", Command.ColorAbsolute.class);
    add("Cook", Command.Cook.class);
    add("Dispense", Command.Dispense.class);
    add("Dock", Command.Dock.class);
    add("Charge", Command.Charge.class);
    add("SetFanSpeed", Command.SetFanSpeed.class);
    add("SetFanSpeedRelative", Command.SetFanSpeedRelative.class);
    add("Reverse", Command.Reverse.class);
    add("Fill", Command.Fill.class);
    add("SetHumidity", Command.SetHumidity.class);
    add("HumidityRelative", Command.HumidityRelative.class);
    add("SetInput", Command.SetInput.class);
    add("NextInput", Command.NextInput.class);
    add("PreviousInput", Command.PreviousInput.class);
    add("ColorLoop", Command.ColorLoop.class);
    add("Sleep", Command.Sleep.class);
    add("StopEffect", Command.StopEffect.class);
    add("Wake", Command.Wake.class);
    add("Locate", Command.Locate.class);
    add("LockUnlock", Command.LockUnlock.class);
    add("SetModes", Command.SetModes.class);
    add("EnableDisableGuestNetwork", Command.EnableDisableGuestNetwork.class);
    add("EnableDisableNetworkProfile", Command.EnableDisableNetworkProfile.class);
    add("GetGuestNetworkPassword", Command.GetGuestNetworkPassword.class);
    add("TestNetworkSpeed", Command.TestNetworkSpeed.class);
    add("OnOff", Command.OnOff.class);
    add("OpenClose", Command.OpenClose.class);
    add("OpenCloseRelative", Command.OpenCloseRelative.class);
    add("Reboot", Command.Reboot.class);
    add("RotationAbsolute", Command.RotationAbsolute.class);
    add("ActivateScene", Command.ActivateScene.class);
    add("SoftwareUpdate", Command.SoftwareUpdate.class);
    add("StartStop", Command.StartStop.class);
    add("PauseUnpause", Command.PauseUnpause.class);
    add("SetTemperature", Command.SetTemperature.class);
    add("ThermostatTemperatureSetpoint", Command.ThermostatTemperatureSetpoint.class);
    add("ThermostatTemperatureSetRange", Command.ThermostatTemperatureSetRange.class);
    add("ThermostatSetMode", Command.ThermostatSetMode.class);
    add("TemperatureRelative", Command.TemperatureRelative.class);
    add("TimerStart", Command.TimerStart.class);
    add("TimerAdjust", Command.TimerAdjust.class);
    add("TimerPause", Command.TimerPause.class);
    add("TimerResume", Command.TimerResume.class);
    add("TimerCancel", Command.TimerCancel.class);
    add("SetToggles", Command.SetToggles.class);
    add("mediaStop", Command.MediaStop.class);
    add("mediaNext", Command.MediaNext.class);
    add("mediaPrevious", Command.MediaPrevious.class);
    add("mediaPause", Command.MediaPause.class);
    add("mediaResume", Command.MediaResume.class);
    add("mediaSeekRelative", Command.MediaSeekRelative.class);
    add("mediaSeekToPosition", Command.MediaSeekToPosition.class);
    add("mediaRepeatMode", Command.MediaRepeatMode.class);
    add("mediaShuffle", Command.MediaShuffle.class);
    add("mediaClosedCaptioningOn", Command.MediaClosedCaptioningOn.class);
    add("mediaClosedCaptioningOff", Command.MediaClosedCaptioningOff.class);
    add("mute", Command.Mute.class);
    add("setVolume", Command.SetVolume.class);
    add("volumeRelative", Command.VolumeRelative.class);
  }

  private CommandCatalog() {}

  private static void add(String name, Class<? extends Command> type) {
    String wireName = PREFIX + name;
    if (BY_NAME.put(wireName, type) != null || BY_TYPE.put(type, wireName) != null) {
      throw new IllegalStateException("Command registered twice: " + wireName);
    }
  }

  public static Optional<Class<? extends Command>> typeOf(String wireName) {
    return Optional.ofNullable(BY_NAME.get(wireName));
  }

  public static String nameOf(Class<? extends Command> type) {
    String name = BY_TYPE.get(type);
    if (name == null) {
      throw new IllegalArgumentException("Not a catalogued command: " + type.getName());
    }
    return name;
  }

  public static String nameOf(Command command) {
    return nameOf(command.getClass());
  }

  /** Every wire name, in catalogue order. */
  public static Map<String, Class<? extends Command>> all() {
    return Collections.unmodifiableMap(BY_NAME);
  }
}
