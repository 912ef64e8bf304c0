package com.acme.homelander.cli.service;

import com.acme.homelander.cli.config.CliConfiguration;
import com.acme.homelander.cli.demo.DemoHome;
import com.acme.homelander.core.Jsons;
import com.acme.homelander.device.Device;
import com.acme.homelander.fulfillment.Homelander;
import com.acme.homelander.fulfillment.request.CommandGroup;
import com.acme.homelander.fulfillment.request.DeviceRef;
import com.acme.homelander.fulfillment.request.ExecuteRequest;
import com.acme.homelander.fulfillment.request.Input;
import com.acme.homelander.fulfillment.request.QueryRequest;
import com.acme.homelander.fulfillment.request.Request;
import com.acme.homelander.fulfillment.response.Response;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Builds fulfillment requests for the CLI commands and runs them against the demo home.
 */
public class HomeService {
    private static final Logger logger = LoggerFactory.getLogger(HomeService.class);
    private static final String COMMAND_PREFIX = "action.devices.commands.";
    private static HomeService instance;
    private final CliConfiguration config;
    private final Homelander homelander;

    private HomeService() {
        this.config = CliConfiguration.getInstance();
        this.homelander = DemoHome.create(config.toHomelanderConfig(), config.isDemoLockJammed());
        logger.info("Home service initialized for agent user {}", homelander.agentUserId());
    }

    public static synchronized HomeService getInstance() {
        if (instance == null) {
            instance = new HomeService();
        }
        return instance;
    }

    /** Handle a raw fulfillment request and return the response JSON. */
    public String fulfill(String requestJson) throws IOException {
        JsonNode request = Jsons.mapper().readTree(requestJson);
        JsonNode requestId = request.get("requestId");
        MDC.put("requestId", requestId != null ? requestId.asText() : "-");
        try {
            return render(Jsons.mapper().readTree(homelander.handleJson(requestJson)));
        } finally {
            MDC.remove("requestId");
        }
    }

    public String sync() {
        return handle(new Input.Sync());
    }

    public String query(List<String> deviceIds) {
        List<DeviceRef> refs = new ArrayList<>();
        for (String id : deviceIds) {
            refs.add(DeviceRef.of(id));
        }
        return handle(new Input.Query(new QueryRequest(refs)));
    }

    /**
     * Run one command against one device.
     *
     * @param commandName full {@code action.devices.commands.X} name or just {@code X}
     * @param paramsJson params object, may be null
     * @throws IOException if the params or the command name cannot be read
     */
    public String execute(String deviceId, String commandName, String paramsJson) throws IOException {
        ObjectNode entry = Jsons.mapper().createObjectNode();
        entry.put("command", commandName.startsWith(COMMAND_PREFIX) ? commandName : COMMAND_PREFIX + commandName);
        if (paramsJson != null) {
            entry.set("params", Jsons.mapper().readTree(paramsJson));
        }
        ObjectNode group = Jsons.mapper().createObjectNode();
        group.putArray("devices").addObject().put("id", deviceId);
        group.putArray("execution").add(entry);

        CommandGroup commands = Jsons.mapper().treeToValue(group, CommandGroup.class);
        return handle(new Input.Execute(new ExecuteRequest(List.of(commands))));
    }

    /** Registered devices with their traits. */
    public String devices() {
        List<Map<String, Object>> devices = new ArrayList<>();
        for (Device<?> device : homelander.devices()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", device.id());
            entry.put("type", device.type());
            entry.put("name", device.deviceName().name());
            entry.put("traits", device.traits());
            devices.add(entry);
        }
        return render(devices);
    }

    private String handle(Input input) {
        String requestId = UUID.randomUUID().toString();
        MDC.put("requestId", requestId);
        try {
            Response response = homelander.handleRequest(new Request(requestId, List.of(input)));
            return render(response);
        } finally {
            MDC.remove("requestId");
        }
    }

    private String render(Object value) {
        return config.isPrettyOutput() ? Jsons.toPrettyJson(value) : Jsons.toJson(value);
    }
}
