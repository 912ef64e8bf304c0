package com.acme.homelander.device;

import com.acme.homelander.error.CapabilityException;
import java.util.concurrent.locks.Lock;

/**
 * One populated capability slot. Every handle of a device aliases the same instance and shares
 * the device lock; the lock is held for exactly one call.
 */
public final class CapabilityHandle<C> {
  private final Trait trait;
  private final Lock lock;
  private final C capability;

  CapabilityHandle(Trait trait, Lock lock, C capability) {
    this.trait = trait;
    this.lock = lock;
    this.capability = capability;
  }

  public Trait trait() {
    return trait;
  }

  public <R> R read(CapabilityCall<? super C, R> call) throws CapabilityException {
    lock.lock();
    try {
      return call.call(capability);
    } finally {
      lock.unlock();
    }
  }

  public void run(CapabilityAction<? super C> action) throws CapabilityException {
    lock.lock();
    try {
      action.run(capability);
    } finally {
      lock.unlock();
    }
  }
}
