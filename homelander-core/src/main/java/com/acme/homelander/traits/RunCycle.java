package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.List;

/** Appliances that run through cycles, reporting progress. Query only. */
public interface RunCycle {

  record Cycle(String currentCycle, String nextCycle, Language lang) {}

  List<Cycle> currentRunCycle() throws CapabilityException;

  /** Seconds left in the whole run. */
  int currentTotalRemainingTime() throws CapabilityException;

  int currentCycleRemainingTime() throws CapabilityException;
}
