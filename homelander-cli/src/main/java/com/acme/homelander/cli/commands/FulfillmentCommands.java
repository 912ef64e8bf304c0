package com.acme.homelander.cli.commands;

import com.acme.homelander.cli.service.HomeService;
import com.acme.homelander.error.InvalidRequestException;
import com.acme.homelander.error.UnsupportedCapabilityException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Fulfillment intents against the demo home. Each command prints the response JSON on stdout and
 * returns 1 for a rejected request, 2 for unreadable input.
 */
public final class FulfillmentCommands {
    static final int REJECTED = 1;
    static final int BAD_INPUT = 2;

    private FulfillmentCommands() {
    }

    @Command(name = "fulfill", description = "Handle a raw fulfillment request file ('-' reads stdin)")
    public static class Fulfill implements Callable<Integer> {
        @Parameters(index = "0", description = "Path to the request JSON, or - for stdin")
        private String request;

        @Override
        public Integer call() {
            String json;
            try {
                json = "-".equals(request)
                        ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
                        : Files.readString(new File(request).toPath());
            } catch (IOException e) {
                System.err.println("Cannot read request " + request + ": " + e.getMessage());
                return BAD_INPUT;
            }
            try {
                System.out.println(HomeService.getInstance().fulfill(json));
                return 0;
            } catch (InvalidRequestException | IOException e) {
                System.err.println("Invalid request: " + e.getMessage());
                return BAD_INPUT;
            } catch (UnsupportedCapabilityException e) {
                System.err.println("Request rejected: " + e.getMessage());
                return REJECTED;
            }
        }
    }

    @Command(name = "sync", description = "List the demo devices as a SYNC response")
    public static class Sync implements Callable<Integer> {
        @Override
        public Integer call() {
            System.out.println(HomeService.getInstance().sync());
            return 0;
        }
    }

    @Command(name = "query", description = "Query the state of one or more devices")
    public static class Query implements Callable<Integer> {
        @Parameters(arity = "1..*", description = "Device ids")
        private List<String> deviceIds;

        @Override
        public Integer call() {
            System.out.println(HomeService.getInstance().query(deviceIds));
            return 0;
        }
    }

    @Command(name = "execute", description = "Run one command against one device")
    public static class Execute implements Callable<Integer> {
        @Parameters(index = "0", description = "Device id")
        private String deviceId;

        @Parameters(index = "1", description = "Command name, e.g. OnOff or action.devices.commands.OnOff")
        private String command;

        @Option(names = {"-p", "--params"}, description = "Command params as a JSON object, e.g. {\"on\":true}")
        private String params;

        @Override
        public Integer call() {
            try {
                System.out.println(HomeService.getInstance().execute(deviceId, command, params));
                return 0;
            } catch (IOException e) {
                System.err.println("Invalid command: " + e.getMessage());
                return BAD_INPUT;
            } catch (UnsupportedCapabilityException e) {
                System.err.println("Command rejected: " + e.getMessage());
                return REJECTED;
            }
        }
    }

    @Command(name = "devices", description = "List the demo devices and their traits")
    public static class Devices implements Callable<Integer> {
        @Override
        public Integer call() {
            System.out.println(HomeService.getInstance().devices());
            return 0;
        }
    }
}
