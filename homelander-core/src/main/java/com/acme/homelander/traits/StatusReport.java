package com.acme.homelander.traits;

import com.acme.homelander.error.CapabilityException;
import java.util.List;

public interface StatusReport {

  record Status(boolean blocking, String deviceTarget, int priority, String statusCode) {}

  List<Status> currentStatusReport() throws CapabilityException;
}
