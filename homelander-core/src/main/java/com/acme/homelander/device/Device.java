package com.acme.homelander.device;

import com.acme.homelander.error.UnsupportedCapabilityException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry entry for one concrete device. Holds the device instance behind a single lock, one
 * optional slot per {@link Trait} and the ordered list of populated slots.
 *
 * <p>Capabilities are registered during setup, before the device is handed to the orchestrator.
 * Every accessor takes the lock for one call and releases it before returning.
 */
public class Device<T extends GoogleHomeDevice> {
  private static final Logger log = LoggerFactory.getLogger(Device.class);

  private final String id;
  private final DeviceType type;
  private final T device;
  private final ReentrantLock lock = new ReentrantLock();
  private final Map<Trait, CapabilityHandle<?>> slots = new EnumMap<>(Trait.class);
  private final List<Trait> traits = new ArrayList<>();

  public Device(String id, DeviceType type, T device) {
    this.id = Objects.requireNonNull(id, "id");
    this.type = Objects.requireNonNull(type, "type");
    this.device = Objects.requireNonNull(device, "device");
  }

  /**
   * Populate the slot for a capability and append its tag to the active list.
   *
   * @throws IllegalArgumentException if the device does not implement the capability interface
   * @throws IllegalStateException if the capability is already registered
   */
  public Device<T> register(Trait trait) {
    if (!trait.capabilityType().isInstance(device)) {
      String error =
          "Device "
              + id
              + " ("
              + device.getClass().getName()
              + ") does not implement "
              + trait.capabilityType().getSimpleName();
      log.error(error);
      throw new IllegalArgumentException(error);
    }
    if (slots.containsKey(trait)) {
      String error = "Capability already registered on device " + id + ": " + trait.wireName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.debug("Registering {} on device {}", trait.wireName(), id);
    slots.put(trait, new CapabilityHandle<>(trait, lock, trait.capabilityType().cast(device)));
    traits.add(trait);
    return this;
  }

  public Device<T> register(Trait... traits) {
    for (Trait trait : traits) {
      register(trait);
    }
    return this;
  }

  public String id() {
    return id;
  }

  public DeviceType type() {
    return type;
  }

  /** Populated capabilities in registration order. */
  public List<Trait> traits() {
    return Collections.unmodifiableList(traits);
  }

  public boolean supports(Trait trait) {
    return slots.containsKey(trait);
  }

  /**
   * Handle for a populated slot.
   *
   * @throws UnsupportedCapabilityException if the slot is empty
   */
  public <C> CapabilityHandle<C> capability(Trait trait, Class<C> type) {
    return findCapability(trait, type)
        .orElseThrow(() -> new UnsupportedCapabilityException(id, trait));
  }

  @SuppressWarnings("unchecked")
  public <C> Optional<CapabilityHandle<C>> findCapability(Trait trait, Class<C> type) {
    if (!type.isAssignableFrom(trait.capabilityType())) {
      throw new IllegalArgumentException(
          trait.wireName() + " is not served by " + type.getSimpleName());
    }
    return Optional.ofNullable((CapabilityHandle<C>) slots.get(trait));
  }

  public DeviceName deviceName() {
    return withDevice(GoogleHomeDevice::deviceName);
  }

  public DeviceInfo deviceInfo() {
    return withDevice(GoogleHomeDevice::deviceInfo);
  }

  public boolean willReportState() {
    return withDevice(GoogleHomeDevice::willReportState);
  }

  public Optional<String> roomHint() {
    return withDevice(GoogleHomeDevice::roomHint);
  }

  public boolean isOnline() {
    return withDevice(GoogleHomeDevice::isOnline);
  }

  public DeviceIdentity identity() {
    return new DeviceIdentity(
        deviceName(), deviceInfo(), willReportState(), roomHint(), isOnline());
  }

  public void disconnect() {
    lock.lock();
    try {
      device.disconnect();
    } finally {
      lock.unlock();
    }
  }

  /** Run one call against the concrete device under the device lock. */
  public <R> R withDevice(Function<? super T, R> call) {
    lock.lock();
    try {
      return call.apply(device);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "Device{id=" + id + ", type=" + type + ", traits=" + traits + "}";
  }
}
