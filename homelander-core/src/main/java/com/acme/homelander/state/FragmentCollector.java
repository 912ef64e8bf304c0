package com.acme.homelander.state;

import com.acme.homelander.device.Device;
import com.acme.homelander.device.Trait;
import com.acme.homelander.error.CapabilityException;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds one flat fragment for a device by asking each populated capability, in registration
 * order, to contribute its fields. Capabilities without a contributor add nothing.
 */
public abstract class FragmentCollector {
  private static final Logger log = LoggerFactory.getLogger(FragmentCollector.class);

  private final Map<Trait, Contribution<?>> contributions = new EnumMap<>(Trait.class);

  private record Contribution<C>(Trait trait, Class<C> type, FragmentContributor<C> contributor) {
    void apply(Device<?> device, Map<String, Object> fragment) throws CapabilityException {
      contributor.contribute(device.capability(trait, type), fragment);
    }
  }

  /**
   * @throws IllegalStateException if a contributor is already registered for this capability
   */
  public <C> void registerContributor(
      Trait trait, Class<C> type, FragmentContributor<C> contributor) {
    if (contributions.containsKey(trait)) {
      String error = "Contributor already registered for " + trait.wireName();
      log.error(error);
      throw new IllegalStateException(error);
    }
    if (!type.isAssignableFrom(trait.capabilityType())) {
      throw new IllegalArgumentException(
          trait.wireName() + " is not served by " + type.getSimpleName());
    }
    contributions.put(trait, new Contribution<>(trait, type, contributor));
  }

  public boolean contributes(Trait trait) {
    return contributions.containsKey(trait);
  }

  /** Collect the fragment of every populated capability. */
  public Map<String, Object> collect(Device<?> device) throws CapabilityException {
    Map<String, Object> fragment = new LinkedHashMap<>();
    for (Trait trait : device.traits()) {
      Contribution<?> contribution = contributions.get(trait);
      if (contribution != null) {
        contribution.apply(device, fragment);
      }
    }
    return fragment;
  }
}
