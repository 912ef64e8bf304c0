package com.acme.homelander.command;

import com.acme.homelander.core.Jsons;
import com.acme.homelander.device.CapabilityHandle;
import com.acme.homelander.device.Device;
import com.acme.homelander.device.Trait;
import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.DeviceErrorCode;
import com.acme.homelander.error.DomainErrorException;
import com.acme.homelander.error.ExecuteError;
import com.acme.homelander.error.UnsupportedCapabilityException;
import com.acme.homelander.traits.AppSelector;
import com.acme.homelander.traits.ArmDisarm;
import com.acme.homelander.traits.Brightness;
import com.acme.homelander.traits.CameraStream;
import com.acme.homelander.traits.Channel;
import com.acme.homelander.traits.ColorSetting;
import com.acme.homelander.traits.Cook;
import com.acme.homelander.traits.Dispense;
import com.acme.homelander.traits.Dock;
import com.acme.homelander.traits.EnergyStorage;
import com.acme.homelander.traits.FanSpeed;
import com.acme.homelander.traits.Fill;
import com.acme.homelander.traits.HumiditySetting;
import com.acme.homelander.traits.InputSelector;
import com.acme.homelander.traits.Language;
import com.acme.homelander.traits.LightEffects;
import com.acme.homelander.traits.Locator;
import com.acme.homelander.traits.LockUnlock;
import com.acme.homelander.traits.Modes;
import com.acme.homelander.traits.NetworkControl;
import com.acme.homelander.traits.OnOff;
import com.acme.homelander.traits.OpenClose;
import com.acme.homelander.traits.Reboot;
import com.acme.homelander.traits.Rotation;
import com.acme.homelander.traits.Scene;
import com.acme.homelander.traits.SoftwareUpdate;
import com.acme.homelander.traits.StartStop;
import com.acme.homelander.traits.TemperatureControl;
import com.acme.homelander.traits.TemperatureSetting;
import com.acme.homelander.traits.Timer;
import com.acme.homelander.traits.Toggles;
import com.acme.homelander.traits.TransportControl;
import com.acme.homelander.traits.Volume;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes EXECUTE commands to the capability slot they target and folds the outcome into a {@link
 * CommandOutput}. Pure POJO - no framework dependencies.
 *
 * <p>Each capability call takes the device lock on its own. Commands with several independent
 * parameters make one call per parameter present, and read-backs after a mutation use a fresh
 * call.
 */
public class CommandDispatcher {
  private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

  private final Map<Class<? extends Command>, Route<?, ?>> routes = new HashMap<>();
  private boolean reportOnline = true;

  /** Applies one command to one capability, writing any read-back into {@code states}. */
  @FunctionalInterface
  public interface CommandHandler<K extends Command, C> {
    void handle(K command, CapabilityHandle<C> capability, Map<String, Object> states)
        throws CapabilityException;
  }

  private record Route<K extends Command, C>(
      Class<K> commandType, Trait trait, Class<C> capabilityType, CommandHandler<K, C> handler) {

    CapabilityHandle<C> resolve(Device<?> device) {
      return device.capability(trait, capabilityType);
    }

    void invoke(CapabilityHandle<C> capability, Command command, Map<String, Object> states)
        throws CapabilityException {
      handler.handle(commandType.cast(command), capability, states);
    }
  }

  /** A dispatcher with a handler for every catalogued command. */
  public static CommandDispatcher standard() {
    CommandDispatcher dispatcher = new CommandDispatcher();
    registerMediaHandlers(dispatcher);
    registerLightingHandlers(dispatcher);
    registerSecurityHandlers(dispatcher);
    registerApplianceHandlers(dispatcher);
    registerClimateHandlers(dispatcher);
    registerNetworkHandlers(dispatcher);
    return dispatcher;
  }

  public CommandDispatcher reportOnline(boolean reportOnline) {
    this.reportOnline = reportOnline;
    return this;
  }

  /**
   * Register the handler for a command type.
   *
   * @throws IllegalStateException if a handler is already registered for this command type
   */
  public <K extends Command, C> void registerHandler(
      Class<K> commandType, Trait trait, Class<C> capabilityType, CommandHandler<K, C> handler) {
    if (routes.containsKey(commandType)) {
      String error = "Handler already registered for command: " + commandType.getSimpleName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    if (!capabilityType.isAssignableFrom(trait.capabilityType())) {
      throw new IllegalArgumentException(
          trait.wireName() + " is not served by " + capabilityType.getSimpleName());
    }
    routes.put(commandType, new Route<>(commandType, trait, capabilityType, handler));
  }

  public boolean handles(Class<? extends Command> commandType) {
    return routes.containsKey(commandType);
  }

  /** Capability a command needs. */
  public Trait traitFor(Command command) {
    return route(command).trait();
  }

  /**
   * Apply a command and return the state fragment it produced.
   *
   * @throws UnsupportedCapabilityException if the device lacks the capability
   * @throws CapabilityException if the capability reports a failure
   */
  public Map<String, Object> dispatch(Device<?> device, Command command)
      throws CapabilityException {
    return dispatch(route(command), device, command);
  }

  private <K extends Command, C> Map<String, Object> dispatch(
      Route<K, C> route, Device<?> device, Command command) throws CapabilityException {
    CapabilityHandle<C> capability = route.resolve(device);
    Map<String, Object> states = new LinkedHashMap<>();
    route.invoke(capability, command, states);
    return states;
  }

  /**
   * Apply a command and fold the outcome into a per-device result. Domain errors become {@code
   * ERROR} with their code; any other failure becomes {@code OFFLINE} with a debug string.
   *
   * @throws UnsupportedCapabilityException if the device lacks the capability; this is never
   *     reported as a per-command result
   */
  public CommandOutput execute(Device<?> device, Command command) {
    return execute(route(command), device, command);
  }

  private <K extends Command, C> CommandOutput execute(
      Route<K, C> route, Device<?> device, Command command) {
    String name = CommandCatalog.nameOf(command);
    CapabilityHandle<C> capability = route.resolve(device);
    log.debug("Dispatching {} to device {}", name, device.id());
    try {
      Map<String, Object> states = new LinkedHashMap<>();
      route.invoke(capability, command, states);
      if (reportOnline) {
        states.put("online", true);
      }
      return CommandOutput.success(device.id(), states);
    } catch (DomainErrorException e) {
      log.warn("Command {} on device {} failed: {}", name, device.id(), e.error().errorCode());
      return CommandOutput.from(device.id(), ExecuteError.from(e));
    } catch (CapabilityException | RuntimeException e) {
      log.error("Error executing {} on device {}", name, device.id(), e);
      return CommandOutput.from(device.id(), ExecuteError.from(e));
    }
  }

  private Route<?, ?> route(Command command) {
    Route<?, ?> route = routes.get(command.getClass());
    if (route == null) {
      String error = "No handler registered for command: " + CommandCatalog.nameOf(command);
      log.error(error);
      throw new IllegalStateException(error);
    }
    return route;
  }

  private static DomainErrorException missingParameters(Command command) {
    log.warn("No usable parameter combination in {}", command);
    return DeviceErrorCode.NOT_SUPPORTED.toException();
  }

  private static void registerMediaHandlers(CommandDispatcher d) {
    d.registerHandler(
        Command.AppInstall.class,
        Trait.APP_SELECTOR,
        AppSelector.class,
        (cmd, app, states) -> {
          if (cmd.newApplication() == null && cmd.newApplicationName() == null) {
            throw missingParameters(cmd);
          }
          if (cmd.newApplication() != null) {
            app.run(c -> c.installByKey(cmd.newApplication()));
          }
          if (cmd.newApplicationName() != null) {
            app.run(c -> c.installByName(cmd.newApplicationName()));
          }
        });
    d.registerHandler(
        Command.AppSearch.class,
        Trait.APP_SELECTOR,
        AppSelector.class,
        (cmd, app, states) -> {
          if (cmd.newApplication() == null && cmd.newApplicationName() == null) {
            throw missingParameters(cmd);
          }
          if (cmd.newApplication() != null) {
            app.run(c -> c.searchByKey(cmd.newApplication()));
          }
          if (cmd.newApplicationName() != null) {
            app.run(c -> c.searchByName(cmd.newApplicationName()));
          }
        });
    d.registerHandler(
        Command.AppSelect.class,
        Trait.APP_SELECTOR,
        AppSelector.class,
        (cmd, app, states) -> {
          if (cmd.newApplication() == null && cmd.newApplicationName() == null) {
            throw missingParameters(cmd);
          }
          if (cmd.newApplication() != null) {
            app.run(c -> c.selectByKey(cmd.newApplication()));
          }
          if (cmd.newApplicationName() != null) {
            app.run(c -> c.selectByName(cmd.newApplicationName()));
          }
        });

    d.registerHandler(
        Command.SelectChannel.class,
        Trait.CHANNEL,
        Channel.class,
        (cmd, channel, states) -> {
          if (cmd.channelCode() != null) {
            channel.run(
                c -> c.selectChannelById(cmd.channelCode(), cmd.channelName(), cmd.channelNumber()));
          } else if (cmd.channelNumber() != null) {
            channel.run(c -> c.selectChannelByNumber(cmd.channelNumber()));
          } else {
            throw missingParameters(cmd);
          }
        });
    d.registerHandler(
        Command.RelativeChannel.class,
        Trait.CHANNEL,
        Channel.class,
        (cmd, channel, states) -> channel.run(c -> c.relativeChannel(cmd.relativeChannelChange())));
    d.registerHandler(
        Command.ReturnChannel.class,
        Trait.CHANNEL,
        Channel.class,
        (cmd, channel, states) -> channel.run(Channel::returnChannel));

    d.registerHandler(
        Command.SetInput.class,
        Trait.INPUT_SELECTOR,
        InputSelector.class,
        (cmd, input, states) -> input.run(c -> c.setInput(cmd.newInput())));
    d.registerHandler(
        Command.NextInput.class,
        Trait.INPUT_SELECTOR,
        InputSelector.class,
        (cmd, input, states) -> input.run(InputSelector::nextInput));
    d.registerHandler(
        Command.PreviousInput.class,
        Trait.INPUT_SELECTOR,
        InputSelector.class,
        (cmd, input, states) -> input.run(InputSelector::previousInput));

    d.registerHandler(
        Command.MediaStop.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(TransportControl::stop));
    d.registerHandler(
        Command.MediaNext.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(TransportControl::next));
    d.registerHandler(
        Command.MediaPrevious.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(TransportControl::previous));
    d.registerHandler(
        Command.MediaPause.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(TransportControl::pause));
    d.registerHandler(
        Command.MediaResume.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(TransportControl::resume));
    d.registerHandler(
        Command.MediaSeekRelative.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(c -> c.seekRelative(cmd.relativePositionMs())));
    d.registerHandler(
        Command.MediaSeekToPosition.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(c -> c.seekToPosition(cmd.absPositionMs())));
    d.registerHandler(
        Command.MediaRepeatMode.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) ->
            media.run(c -> c.repeatMode(cmd.isOn(), Boolean.TRUE.equals(cmd.isSingle()))));
    d.registerHandler(
        Command.MediaShuffle.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(TransportControl::shuffle));
    d.registerHandler(
        Command.MediaClosedCaptioningOn.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) ->
            media.run(
                c ->
                    c.closedCaptioningOn(
                        cmd.closedCaptioningLanguage(), cmd.userQueryLanguage())));
    d.registerHandler(
        Command.MediaClosedCaptioningOff.class,
        Trait.TRANSPORT_CONTROL,
        TransportControl.class,
        (cmd, media, states) -> media.run(TransportControl::closedCaptioningOff));

    d.registerHandler(
        Command.Mute.class,
        Trait.VOLUME,
        Volume.class,
        (cmd, volume, states) -> volume.run(c -> c.mute(cmd.mute())));
    d.registerHandler(
        Command.SetVolume.class,
        Trait.VOLUME,
        Volume.class,
        (cmd, volume, states) -> volume.run(c -> c.setVolume(cmd.volumeLevel())));
    d.registerHandler(
        Command.VolumeRelative.class,
        Trait.VOLUME,
        Volume.class,
        (cmd, volume, states) -> volume.run(c -> c.adjustVolume(cmd.relativeSteps())));

    d.registerHandler(
        Command.GetCameraStream.class,
        Trait.CAMERA_STREAM,
        CameraStream.class,
        (cmd, camera, states) -> {
          List<CameraStream.Protocol> protocols =
              cmd.supportedStreamProtocols() == null
                  ? List.of()
                  : cmd.supportedStreamProtocols();
          CameraStream.StreamDescriptor stream =
              camera.read(c -> c.getStream(cmd.streamToChromecast(), protocols));
          states.putAll(Jsons.toMap(stream));
        });
  }

  private static void registerLightingHandlers(CommandDispatcher d) {
    d.registerHandler(
        Command.OnOff.class,
        Trait.ON_OFF,
        OnOff.class,
        (cmd, onOff, states) -> onOff.run(c -> c.setOn(cmd.on())));

    d.registerHandler(
        Command.BrightnessAbsolute.class,
        Trait.BRIGHTNESS,
        Brightness.class,
        (cmd, brightness, states) -> brightness.run(c -> c.setBrightness(cmd.brightness())));
    d.registerHandler(
        Command.BrightnessRelative.class,
        Trait.BRIGHTNESS,
        Brightness.class,
        (cmd, brightness, states) -> {
          if (cmd.brightnessRelativePercent() == null && cmd.brightnessRelativeWeight() == null) {
            throw missingParameters(cmd);
          }
          if (cmd.brightnessRelativePercent() != null) {
            brightness.run(c -> c.adjustBrightnessPercent(cmd.brightnessRelativePercent()));
          }
          if (cmd.brightnessRelativeWeight() != null) {
            brightness.run(c -> c.adjustBrightnessWeight(cmd.brightnessRelativeWeight()));
          }
        });

    d.registerHandler(
        Command.ColorAbsolute.class,
        Trait.COLOR_SETTING,
        ColorSetting.class,
        (cmd, color, states) -> {
          if (cmd.color() == null) {
            throw missingParameters(cmd);
          }
          color.run(c -> c.setColor(cmd.color()));
        });

    d.registerHandler(
        Command.ColorLoop.class,
        Trait.LIGHT_EFFECTS,
        LightEffects.class,
        (cmd, effects, states) -> effects.run(c -> c.colorLoop(cmd.duration())));
    d.registerHandler(
        Command.Sleep.class,
        Trait.LIGHT_EFFECTS,
        LightEffects.class,
        (cmd, effects, states) -> effects.run(c -> c.sleep(cmd.duration())));
    d.registerHandler(
        Command.Wake.class,
        Trait.LIGHT_EFFECTS,
        LightEffects.class,
        (cmd, effects, states) -> effects.run(c -> c.wake(cmd.duration())));
    d.registerHandler(
        Command.StopEffect.class,
        Trait.LIGHT_EFFECTS,
        LightEffects.class,
        (cmd, effects, states) -> effects.run(LightEffects::stopEffect));

    d.registerHandler(
        Command.ActivateScene.class,
        Trait.SCENE,
        Scene.class,
        (cmd, scene, states) -> {
          if (Boolean.TRUE.equals(cmd.deactivate())) {
            scene.run(Scene::deactivate);
          } else {
            scene.run(Scene::activate);
          }
        });
  }

  private static void registerSecurityHandlers(CommandDispatcher d) {
    d.registerHandler(
        Command.ArmDisarm.class,
        Trait.ARM_DISARM,
        ArmDisarm.class,
        (cmd, alarm, states) -> {
          if (Boolean.TRUE.equals(cmd.cancel())) {
            alarm.run(ArmDisarm::cancelArm);
          } else if (cmd.armLevel() != null) {
            alarm.run(c -> c.armWithLevel(cmd.arm(), cmd.armLevel()));
          } else {
            alarm.run(c -> c.arm(cmd.arm()));
          }
        });

    d.registerHandler(
        Command.LockUnlock.class,
        Trait.LOCK_UNLOCK,
        LockUnlock.class,
        (cmd, lock, states) -> {
          lock.run(c -> c.setLocked(cmd.lock()));
          states.put("isLocked", lock.read(LockUnlock::isLocked));
        });

    d.registerHandler(
        Command.Locate.class,
        Trait.LOCATOR,
        Locator.class,
        (cmd, locator, states) -> {
          boolean silence = Boolean.TRUE.equals(cmd.silence());
          Language lang = cmd.lang() == null ? Language.ENGLISH : cmd.lang();
          locator.run(c -> c.locate(silence, lang));
        });

    d.registerHandler(
        Command.OpenClose.class,
        Trait.OPEN_CLOSE,
        OpenClose.class,
        (cmd, door, states) -> door.run(c -> c.setOpen(cmd.openPercent(), cmd.openDirection())));
    d.registerHandler(
        Command.OpenCloseRelative.class,
        Trait.OPEN_CLOSE,
        OpenClose.class,
        (cmd, door, states) ->
            door.run(c -> c.adjustOpen(cmd.openRelativePercent(), cmd.openDirection())));

    d.registerHandler(
        Command.RotationAbsolute.class,
        Trait.ROTATION,
        Rotation.class,
        (cmd, rotation, states) -> {
          if (cmd.rotationDegrees() != null) {
            rotation.run(c -> c.rotateToDegrees(cmd.rotationDegrees()));
          } else if (cmd.rotationPercent() != null) {
            rotation.run(c -> c.rotateToPercent(cmd.rotationPercent()));
          } else {
            throw missingParameters(cmd);
          }
        });
  }

  private static void registerApplianceHandlers(CommandDispatcher d) {
    d.registerHandler(
        Command.Cook.class,
        Trait.COOK,
        Cook.class,
        (cmd, cook, states) -> {
          if (cmd.start()) {
            Cook.CookingConfig config =
                new Cook.CookingConfig(
                    cmd.cookingMode(), cmd.foodPreset(), cmd.quantity(), cmd.unit());
            cook.run(c -> c.startCooking(config));
          } else {
            cook.run(Cook::stopCooking);
          }
        });

    d.registerHandler(
        Command.Dispense.class,
        Trait.DISPENSE,
        Dispense.class,
        (cmd, dispense, states) -> {
          if (cmd.item() != null) {
            if (cmd.amount() == null || cmd.unit() == null) {
              throw missingParameters(cmd);
            }
            dispense.run(c -> c.dispenseAmount(cmd.item(), cmd.amount(), cmd.unit()));
          } else if (cmd.presetName() != null) {
            dispense.run(c -> c.dispensePreset(cmd.presetName()));
          } else {
            dispense.run(Dispense::dispenseDefault);
          }
        });

    d.registerHandler(
        Command.Dock.class, Trait.DOCK, Dock.class, (cmd, dock, states) -> dock.run(Dock::dock));

    d.registerHandler(
        Command.Charge.class,
        Trait.ENERGY_STORAGE,
        EnergyStorage.class,
        (cmd, battery, states) -> battery.run(c -> c.charge(cmd.charge())));

    d.registerHandler(
        Command.Fill.class,
        Trait.FILL,
        Fill.class,
        (cmd, fill, states) -> {
          if (cmd.fillLevel() != null) {
            fill.run(c -> c.fillToLevel(cmd.fill(), cmd.fillLevel()));
          } else if (cmd.fillPercent() != null) {
            fill.run(c -> c.fillToPercent(cmd.fill(), cmd.fillPercent()));
          } else {
            fill.run(c -> c.fill(cmd.fill()));
          }
        });

    d.registerHandler(
        Command.SetModes.class,
        Trait.MODES,
        Modes.class,
        (cmd, modes, states) -> {
          if (cmd.updateModeSettings() == null || cmd.updateModeSettings().isEmpty()) {
            throw missingParameters(cmd);
          }
          for (Map.Entry<String, String> entry : cmd.updateModeSettings().entrySet()) {
            modes.run(c -> c.updateMode(entry.getKey(), entry.getValue()));
          }
        });

    d.registerHandler(
        Command.SetToggles.class,
        Trait.TOGGLES,
        Toggles.class,
        (cmd, toggles, states) -> {
          if (cmd.updateToggleSettings() == null || cmd.updateToggleSettings().isEmpty()) {
            throw missingParameters(cmd);
          }
          for (Map.Entry<String, Boolean> entry : cmd.updateToggleSettings().entrySet()) {
            toggles.run(c -> c.setToggle(entry.getKey(), entry.getValue()));
          }
        });

    d.registerHandler(
        Command.StartStop.class,
        Trait.START_STOP,
        StartStop.class,
        (cmd, device, states) -> {
          List<String> zones = cmd.zone() != null ? List.of(cmd.zone()) : cmd.multipleZones();
          device.run(c -> c.startStop(cmd.start(), zones));
        });
    d.registerHandler(
        Command.PauseUnpause.class,
        Trait.START_STOP,
        StartStop.class,
        (cmd, device, states) -> device.run(c -> c.pause(cmd.pause())));

    d.registerHandler(
        Command.TimerStart.class,
        Trait.TIMER,
        Timer.class,
        (cmd, timer, states) -> timer.run(c -> c.startTimer(cmd.timerTimeSec())));
    d.registerHandler(
        Command.TimerAdjust.class,
        Trait.TIMER,
        Timer.class,
        (cmd, timer, states) -> timer.run(c -> c.adjustTimer(cmd.timerTimeSec())));
    d.registerHandler(
        Command.TimerPause.class,
        Trait.TIMER,
        Timer.class,
        (cmd, timer, states) -> timer.run(Timer::pauseTimer));
    d.registerHandler(
        Command.TimerResume.class,
        Trait.TIMER,
        Timer.class,
        (cmd, timer, states) -> timer.run(Timer::resumeTimer));
    d.registerHandler(
        Command.TimerCancel.class,
        Trait.TIMER,
        Timer.class,
        (cmd, timer, states) -> timer.run(Timer::cancelTimer));

    d.registerHandler(
        Command.Reboot.class,
        Trait.REBOOT,
        Reboot.class,
        (cmd, device, states) -> device.run(Reboot::reboot));
    d.registerHandler(
        Command.SoftwareUpdate.class,
        Trait.SOFTWARE_UPDATE,
        SoftwareUpdate.class,
        (cmd, device, states) -> device.run(SoftwareUpdate::softwareUpdate));
  }

  private static void registerClimateHandlers(CommandDispatcher d) {
    d.registerHandler(
        Command.SetFanSpeed.class,
        Trait.FAN_SPEED,
        FanSpeed.class,
        (cmd, fan, states) -> {
          if (cmd.fanSpeed() != null) {
            fan.run(c -> c.setFanSpeedSetting(cmd.fanSpeed()));
          } else if (cmd.fanSpeedPercent() != null) {
            fan.run(c -> c.setFanSpeedPercent(cmd.fanSpeedPercent()));
          } else {
            throw missingParameters(cmd);
          }
        });
    d.registerHandler(
        Command.SetFanSpeedRelative.class,
        Trait.FAN_SPEED,
        FanSpeed.class,
        (cmd, fan, states) -> {
          if (cmd.fanSpeedRelativeWeight() != null) {
            fan.run(c -> c.adjustFanSpeedWeight(cmd.fanSpeedRelativeWeight()));
          } else if (cmd.fanSpeedRelativePercent() != null) {
            fan.run(c -> c.adjustFanSpeedPercent(cmd.fanSpeedRelativePercent()));
          } else {
            throw missingParameters(cmd);
          }
        });
    d.registerHandler(
        Command.Reverse.class,
        Trait.FAN_SPEED,
        FanSpeed.class,
        (cmd, fan, states) -> fan.run(FanSpeed::reverse));

    d.registerHandler(
        Command.SetHumidity.class,
        Trait.HUMIDITY_SETTING,
        HumiditySetting.class,
        (cmd, humidity, states) -> humidity.run(c -> c.setHumidity(cmd.humidity())));
    d.registerHandler(
        Command.HumidityRelative.class,
        Trait.HUMIDITY_SETTING,
        HumiditySetting.class,
        (cmd, humidity, states) -> {
          if (cmd.humidityRelativePercent() == null && cmd.humidityRelativeWeight() == null) {
            throw missingParameters(cmd);
          }
          if (cmd.humidityRelativePercent() != null) {
            humidity.run(c -> c.adjustHumidityPercent(cmd.humidityRelativePercent()));
          }
          if (cmd.humidityRelativeWeight() != null) {
            humidity.run(c -> c.adjustHumidityWeight(cmd.humidityRelativeWeight()));
          }
        });

    d.registerHandler(
        Command.SetTemperature.class,
        Trait.TEMPERATURE_CONTROL,
        TemperatureControl.class,
        (cmd, control, states) -> control.run(c -> c.setTemperature(cmd.temperature())));

    d.registerHandler(
        Command.ThermostatTemperatureSetpoint.class,
        Trait.TEMPERATURE_SETTING,
        TemperatureSetting.class,
        (cmd, thermostat, states) ->
            thermostat.run(c -> c.setThermostatSetpoint(cmd.thermostatTemperatureSetpoint())));
    d.registerHandler(
        Command.ThermostatTemperatureSetRange.class,
        Trait.TEMPERATURE_SETTING,
        TemperatureSetting.class,
        (cmd, thermostat, states) ->
            thermostat.run(
                c ->
                    c.setThermostatRange(
                        cmd.thermostatTemperatureSetpointHigh(),
                        cmd.thermostatTemperatureSetpointLow())));
    d.registerHandler(
        Command.ThermostatSetMode.class,
        Trait.TEMPERATURE_SETTING,
        TemperatureSetting.class,
        (cmd, thermostat, states) -> {
          if (cmd.thermostatMode() == null) {
            throw missingParameters(cmd);
          }
          thermostat.run(c -> c.setThermostatMode(cmd.thermostatMode()));
        });
    d.registerHandler(
        Command.TemperatureRelative.class,
        Trait.TEMPERATURE_SETTING,
        TemperatureSetting.class,
        (cmd, thermostat, states) -> {
          if (cmd.thermostatTemperatureRelativeDegree() == null
              && cmd.thermostatTemperatureRelativeWeight() == null) {
            throw missingParameters(cmd);
          }
          if (cmd.thermostatTemperatureRelativeDegree() != null) {
            thermostat.run(
                c -> c.adjustSetpointDegrees(cmd.thermostatTemperatureRelativeDegree()));
          }
          if (cmd.thermostatTemperatureRelativeWeight() != null) {
            thermostat.run(
                c -> c.adjustSetpointWeight(cmd.thermostatTemperatureRelativeWeight()));
          }
        });
  }

  private static void registerNetworkHandlers(CommandDispatcher d) {
    d.registerHandler(
        Command.EnableDisableGuestNetwork.class,
        Trait.NETWORK_CONTROL,
        NetworkControl.class,
        (cmd, network, states) -> network.run(c -> c.enableGuestNetwork(cmd.enable())));
    d.registerHandler(
        Command.EnableDisableNetworkProfile.class,
        Trait.NETWORK_CONTROL,
        NetworkControl.class,
        (cmd, network, states) ->
            network.run(c -> c.enableNetworkProfile(cmd.profile(), cmd.enable())));
    d.registerHandler(
        Command.GetGuestNetworkPassword.class,
        Trait.NETWORK_CONTROL,
        NetworkControl.class,
        (cmd, network, states) ->
            states.put("guestNetworkPassword", network.read(NetworkControl::guestNetworkPassword)));
    d.registerHandler(
        Command.TestNetworkSpeed.class,
        Trait.NETWORK_CONTROL,
        NetworkControl.class,
        (cmd, network, states) ->
            network.run(
                c -> c.testNetworkSpeed(cmd.testDownloadSpeed(), cmd.testUploadSpeed())));
  }
}
