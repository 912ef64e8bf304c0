package com.acme.homelander.fulfillment;

import com.acme.homelander.command.Command;
import com.acme.homelander.command.CommandDispatcher;
import com.acme.homelander.config.HomelanderConfig;
import com.acme.homelander.core.Jsons;
import com.acme.homelander.device.Device;
import com.acme.homelander.error.CapabilityException;
import com.acme.homelander.error.DomainErrorException;
import com.acme.homelander.error.InvalidRequestException;
import com.acme.homelander.fulfillment.request.CommandGroup;
import com.acme.homelander.fulfillment.request.DeviceRef;
import com.acme.homelander.fulfillment.request.ExecuteRequest;
import com.acme.homelander.fulfillment.request.Input;
import com.acme.homelander.fulfillment.request.QueryRequest;
import com.acme.homelander.fulfillment.request.Request;
import com.acme.homelander.fulfillment.response.CommandResult;
import com.acme.homelander.fulfillment.response.DisconnectResponse;
import com.acme.homelander.fulfillment.response.ExecuteResponse;
import com.acme.homelander.fulfillment.response.QueryDeviceState;
import com.acme.homelander.fulfillment.response.QueryResponse;
import com.acme.homelander.fulfillment.response.Response;
import com.acme.homelander.fulfillment.response.ResponsePayload;
import com.acme.homelander.fulfillment.response.SyncDevice;
import com.acme.homelander.fulfillment.response.SyncResponse;
import com.acme.homelander.state.QueryStateCollector;
import com.acme.homelander.state.SyncAttributeCollector;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fulfillment endpoint for one user's home. Owns the registered devices and answers SYNC, QUERY,
 * EXECUTE and DISCONNECT requests, one request at a time.
 *
 * <p>Devices are added during setup. Removing a device while requests are served must be
 * serialized by the caller.
 */
public class Homelander {
  private static final Logger log = LoggerFactory.getLogger(Homelander.class);

  private final HomelanderConfig config;
  private final List<Device<?>> devices = new ArrayList<>();
  private final CommandDispatcher dispatcher;
  private final SyncAttributeCollector syncCollector;
  private final QueryStateCollector queryCollector;

  public Homelander(String agentUserId) {
    this(new HomelanderConfig(agentUserId));
  }

  public Homelander(HomelanderConfig config) {
    this(
        config,
        CommandDispatcher.standard(),
        SyncAttributeCollector.standard(),
        QueryStateCollector.standard());
  }

  public Homelander(
      HomelanderConfig config,
      CommandDispatcher dispatcher,
      SyncAttributeCollector syncCollector,
      QueryStateCollector queryCollector) {
    config.validate();
    this.config = config;
    this.dispatcher = dispatcher.reportOnline(config.isReportOnlineInExecuteStates());
    this.syncCollector = syncCollector;
    this.queryCollector = queryCollector;
  }

  public String agentUserId() {
    return config.getAgentUserId();
  }

  public void addDevice(Device<?> device) {
    log.info("Adding device {} ({}) with traits {}", device.id(), device.type(), device.traits());
    devices.add(device);
  }

  /** Remove every device with this id, disconnecting each. Returns how many were removed. */
  public int removeDevice(String id) {
    int removed = 0;
    Iterator<Device<?>> it = devices.iterator();
    while (it.hasNext()) {
      Device<?> device = it.next();
      if (device.id().equals(id)) {
        it.remove();
        device.disconnect();
        removed++;
      }
    }
    log.info("Removed {} device(s) with id {}", removed, id);
    return removed;
  }

  public List<Device<?>> devices() {
    return Collections.unmodifiableList(devices);
  }

  /** First registered device with this id. */
  public Optional<Device<?>> findDevice(String id) {
    for (Device<?> device : devices) {
      if (device.id().equals(id)) {
        return Optional.of(device);
      }
    }
    return Optional.empty();
  }

  /**
   * Parse a request, handle it and serialize the response.
   *
   * @throws InvalidRequestException if the request JSON cannot be read
   */
  public String handleJson(String requestJson) {
    Request request;
    try {
      request = Jsons.mapper().readValue(requestJson, Request.class);
    } catch (Exception e) {
      throw new InvalidRequestException("Malformed fulfillment request: " + e.getMessage(), e);
    }
    return Jsons.toJson(handleRequest(request));
  }

  /**
   * Handle a request. Only the first input is acted upon; further inputs are logged and ignored.
   *
   * @throws InvalidRequestException if the request has no input, or a QUERY or EXECUTE input
   *     without payload
   * @throws com.acme.homelander.error.UnsupportedCapabilityException if a command targets a
   *     capability the device never registered
   */
  public synchronized Response handleRequest(Request request) {
    if (request.inputs().isEmpty()) {
      throw new InvalidRequestException("Request " + request.requestId() + " has no inputs");
    }
    if (request.inputs().size() > 1) {
      log.warn(
          "Request {} has {} inputs, only the first is handled",
          request.requestId(),
          request.inputs().size());
    }
    Input input = request.inputs().get(0);
    ResponsePayload payload;
    if (input instanceof Input.Sync) {
      log.info("Handling SYNC request {}", request.requestId());
      payload = sync();
    } else if (input instanceof Input.Query query) {
      log.info("Handling QUERY request {}", request.requestId());
      payload = query(requirePayload(request, query.payload()));
    } else if (input instanceof Input.Execute execute) {
      log.info("Handling EXECUTE request {}", request.requestId());
      payload = execute(requirePayload(request, execute.payload()));
    } else {
      log.info("Handling DISCONNECT request {}", request.requestId());
      payload = disconnect();
    }
    return new Response(request.requestId(), payload);
  }

  private static <P> P requirePayload(Request request, P payload) {
    if (payload == null) {
      throw new InvalidRequestException("Request " + request.requestId() + " has no payload");
    }
    return payload;
  }

  /**
   * SYNC every device. Any failure replaces the whole device list with a single error code.
   */
  public SyncResponse sync() {
    List<SyncDevice> synced = new ArrayList<>(devices.size());
    try {
      for (Device<?> device : devices) {
        synced.add(syncCollector.sync(device));
      }
    } catch (DomainErrorException e) {
      log.error("SYNC failed: {}", e.error().errorCode());
      return SyncResponse.failed(config.getAgentUserId(), e.error().errorCode(), null);
    } catch (CapabilityException | RuntimeException e) {
      log.error("SYNC failed", e);
      return SyncResponse.failed(
          config.getAgentUserId(), config.getSyncFailureErrorCode(), e.getMessage());
    }
    return SyncResponse.of(config.getAgentUserId(), synced);
  }

  /** QUERY each requested id. Unknown ids are left out; repeated ids share one entry. */
  public QueryResponse query(QueryRequest request) {
    Map<String, QueryDeviceState> states = new LinkedHashMap<>();
    for (DeviceRef ref : request.devices()) {
      Optional<Device<?>> device = findDevice(ref.id());
      if (device.isEmpty()) {
        log.warn("QUERY for unknown device {}", ref.id());
        continue;
      }
      states.put(ref.id(), queryCollector.query(device.get()));
    }
    return QueryResponse.of(states);
  }

  /**
   * Run every command of every group against every targeted device, in request order: groups,
   * then device ids, then commands. Unknown ids are skipped. Each result carries one id.
   */
  public ExecuteResponse execute(ExecuteRequest request) {
    List<CommandResult> results = new ArrayList<>();
    for (CommandGroup group : request.commands()) {
      for (DeviceRef ref : group.devices()) {
        Optional<Device<?>> device = findDevice(ref.id());
        if (device.isEmpty()) {
          log.warn("EXECUTE for unknown device {}", ref.id());
          continue;
        }
        for (Command command : group.execution()) {
          results.add(CommandResult.from(dispatcher.execute(device.get(), command)));
        }
      }
    }
    return ExecuteResponse.of(results);
  }

  public DisconnectResponse disconnect() {
    for (Device<?> device : devices) {
      device.disconnect();
    }
    return new DisconnectResponse();
  }
}
