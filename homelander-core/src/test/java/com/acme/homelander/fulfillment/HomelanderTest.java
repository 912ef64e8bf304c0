package com.acme.homelander.fulfillment;

import com.acme.homelander.command.Command;
import com.acme.homelander.command.ExecuteStatus;
import com.acme.homelander.config.HomelanderConfig;
import com.acme.homelander.core.Jsons;
import com.acme.homelander.device.Device;
import com.acme.homelander.device.DeviceType;
import com.acme.homelander.device.Trait;
import com.acme.homelander.error.InfrastructureException;
import com.acme.homelander.error.InvalidRequestException;
import com.acme.homelander.error.UnsupportedCapabilityException;
import com.acme.homelander.fulfillment.request.CommandGroup;
import com.acme.homelander.fulfillment.request.DeviceRef;
import com.acme.homelander.fulfillment.request.ExecuteRequest;
import com.acme.homelander.fulfillment.request.Input;
import com.acme.homelander.fulfillment.request.QueryRequest;
import com.acme.homelander.fulfillment.request.Request;
import com.acme.homelander.fulfillment.response.CommandResult;
import com.acme.homelander.fulfillment.response.ExecuteResponse;
import com.acme.homelander.fulfillment.response.QueryDeviceState;
import com.acme.homelander.fulfillment.response.QueryResponse;
import com.acme.homelander.fulfillment.response.QueryStatus;
import com.acme.homelander.fulfillment.response.Response;
import com.acme.homelander.fulfillment.response.SyncResponse;
import com.acme.homelander.testing.TestLight;
import com.acme.homelander.testing.TestLock;
import com.acme.homelander.testing.TestSwitch;
import com.acme.homelander.traits.LockUnlock;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Homelander
 */
class HomelanderTest {

    private Homelander homelander;
    private TestSwitch plug;
    private TestLock lock;

    @BeforeEach
    void setUp() {
        homelander = new Homelander("user-42");
        plug = new TestSwitch("Plug");
        lock = new TestLock("Front door", true);
        homelander.addDevice(new Device<>("plug-1", DeviceType.OUTLET, plug).register(Trait.ON_OFF));
        homelander.addDevice(new Device<>("door-1", DeviceType.LOCK, lock).register(Trait.LOCK_UNLOCK));
    }

    private static Request execute(String requestId, CommandGroup... groups) {
        return new Request(requestId, List.of(new Input.Execute(new ExecuteRequest(List.of(groups)))));
    }

    private static Request query(String requestId, String... ids) {
        List<DeviceRef> refs = Arrays.stream(ids).map(DeviceRef::of).toList();
        return new Request(requestId, List.of(new Input.Query(new QueryRequest(refs))));
    }

    private static CommandGroup group(String id, Command... commands) {
        return new CommandGroup(List.of(DeviceRef.of(id)), List.of(commands));
    }

    @Nested
    @DisplayName("End-to-end Scenario Tests")
    class ScenarioTests {

        @Test
        @DisplayName("OnOff - should execute and then query as on")
        void testOnOffThenQuery() {
            ExecuteResponse executed = (ExecuteResponse) homelander
                    .handleRequest(execute("r1", group("plug-1", new Command.OnOff(true))))
                    .payload();
            QueryResponse queried = (QueryResponse) homelander.handleRequest(query("r2", "plug-1")).payload();

            assertThat(executed.commands()).singleElement()
                    .satisfies(r -> assertThat(r.status()).isEqualTo(ExecuteStatus.SUCCESS));
            QueryDeviceState state = queried.devices().get("plug-1");
            assertThat(state.status()).isEqualTo(QueryStatus.SUCCESS);
            assertThat(state.online()).isTrue();
            assertThat(state.on()).isTrue();
        }

        @Test
        @DisplayName("OnOff - should query an offline device as OFFLINE with on defaulted")
        void testOfflineQuery() {
            plug.setOnline(false);

            QueryResponse queried = (QueryResponse) homelander.handleRequest(query("r1", "plug-1")).payload();

            assertThat(Jsons.toJson(queried.devices().get("plug-1")))
                    .isEqualTo("{\"status\":\"OFFLINE\",\"online\":false,\"on\":true}");
        }

        @Test
        @DisplayName("LockUnlock - should surface alreadyLocked as ERROR")
        void testAlreadyLocked() {
            ExecuteResponse executed = (ExecuteResponse) homelander
                    .handleRequest(execute("r1", group("door-1", new Command.LockUnlock(true, null))))
                    .payload();

            CommandResult result = executed.commands().get(0);
            assertThat(result.status()).isEqualTo(ExecuteStatus.ERROR);
            assertThat(result.errorCode()).isEqualTo("alreadyLocked");
            assertThat(result.states()).isNull();
        }

        @Test
        @DisplayName("execute - should give one single-id result per targeted device")
        void testTwoGroups() {
            ExecuteResponse executed = (ExecuteResponse) homelander.handleRequest(execute("r1",
                    group("door-1", new Command.LockUnlock(false, null)),
                    group("plug-1", new Command.OnOff(true)))).payload();

            assertThat(executed.commands()).hasSize(2);
            assertThat(executed.commands()).allSatisfy(r -> assertThat(r.ids()).hasSize(1));
            assertThat(executed.commands()).extracting(r -> r.ids().get(0))
                    .containsExactly("door-1", "plug-1");
            assertThat(executed.commands().get(0).states()).containsEntry("isLocked", false);
            assertThat(lock.isLocked()).isFalse();
            assertThat(plug.isOn()).isTrue();
        }
    }

    @Nested
    @DisplayName("Batch Tests")
    class BatchTests {

        @Test
        @DisplayName("execute - should keep going after one device fails")
        void testFailureDoesNotAbortBatch() {
            lock.setJammed(true);
            homelander.addDevice(new Device<>("door-2", DeviceType.LOCK, new TestLock("Back door", true))
                    .register(Trait.LOCK_UNLOCK));

            ExecuteResponse executed = (ExecuteResponse) homelander.handleRequest(execute("r1",
                    group("door-1", new Command.LockUnlock(false, null)),
                    group("door-2", new Command.LockUnlock(false, null)))).payload();

            assertThat(executed.commands()).extracting(CommandResult::errorCode)
                    .containsExactly(LockUnlock.ErrorCode.DEVICE_JAMMING_DETECTED.errorCode(), null);
            assertThat(executed.commands().get(1).status()).isEqualTo(ExecuteStatus.SUCCESS);
        }

        @Test
        @DisplayName("execute - should fail loudly for a device lacking the capability")
        void testMissingCapabilityIsFatal() {
            assertThatThrownBy(() -> homelander.handleRequest(
                    execute("r1", group("plug-1", new Command.LockUnlock(true, null)))))
                    .isInstanceOf(UnsupportedCapabilityException.class)
                    .hasMessageContaining("plug-1");
        }

        @Test
        @DisplayName("execute - should skip unknown device ids")
        void testUnknownIdsSkipped() {
            ExecuteResponse executed = (ExecuteResponse) homelander.handleRequest(execute("r1",
                    new CommandGroup(List.of(DeviceRef.of("ghost"), DeviceRef.of("plug-1")),
                            List.of(new Command.OnOff(true), new Command.OnOff(false))))).payload();

            assertThat(executed.commands()).hasSize(2);
            assertThat(executed.commands()).allSatisfy(r -> assertThat(r.ids()).containsExactly("plug-1"));
        }

        @Test
        @DisplayName("query - should omit unknown ids and use the first match for duplicates")
        void testQueryUnknownAndDuplicate() {
            TestSwitch twin = new TestSwitch("Twin");
            twin.setOnline(false);
            homelander.addDevice(new Device<>("plug-1", DeviceType.OUTLET, twin).register(Trait.ON_OFF));

            QueryResponse queried = (QueryResponse) homelander
                    .handleRequest(query("r1", "ghost", "plug-1", "plug-1")).payload();

            assertThat(queried.devices()).containsOnlyKeys("plug-1");
            assertThat(queried.devices().get("plug-1").status()).isEqualTo(QueryStatus.SUCCESS);
        }
    }

    @Nested
    @DisplayName("SYNC Tests")
    class SyncTests {

        @Test
        @DisplayName("sync - should list every device with the agent user id")
        void testSync() {
            SyncResponse synced = (SyncResponse) homelander
                    .handleRequest(new Request("r1", List.of(new Input.Sync()))).payload();

            assertThat(synced.agentUserId()).isEqualTo("user-42");
            assertThat(synced.errorCode()).isNull();
            assertThat(synced.devices()).extracting(d -> d.id()).containsExactly("plug-1", "door-1");
        }

        @Test
        @DisplayName("sync - should degrade the whole response when one device fails")
        void testSyncDegrades() {
            TestLight light = new TestLight("Lamp");
            light.failWith(new InfrastructureException("bulb unreachable"));
            homelander.addDevice(new Device<>("lamp-1", DeviceType.LIGHT, light).register(Trait.COLOR_SETTING));

            SyncResponse synced = homelander.sync();

            assertThat(synced.errorCode()).isEqualTo("transientError");
            assertThat(synced.debugString()).isEqualTo("bulb unreachable");
            assertThat(synced.devices()).isEmpty();
        }

        @Test
        @DisplayName("sync - should degrade with a domain error code")
        void testSyncDegradesWithDomainCode() {
            HomelanderConfig config = new HomelanderConfig("user-42");
            config.setSyncFailureErrorCode("hardError");
            Homelander custom = new Homelander(config);
            TestLight light = new TestLight("Lamp");
            light.failWith(LockUnlock.ErrorCode.REMOTE_SET_DISABLED.toException());
            custom.addDevice(new Device<>("lamp-1", DeviceType.LIGHT, light).register(Trait.COLOR_SETTING));

            assertThat(custom.sync().errorCode()).isEqualTo("remoteSetDisabled");

            light.failWith(new InfrastructureException("bulb unreachable"));
            assertThat(custom.sync().errorCode()).isEqualTo("hardError");
        }

        @Test
        @DisplayName("sync - should be idempotent")
        void testSyncIdempotent() {
            assertThat(homelander.sync()).isEqualTo(homelander.sync());
        }
    }

    @Nested
    @DisplayName("Request Handling Tests")
    class RequestTests {

        @Test
        @DisplayName("handleRequest - should reject a request without inputs")
        void testNoInputs() {
            assertThatThrownBy(() -> homelander.handleRequest(new Request("r1", List.of())))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessageContaining("r1");
        }

        @Test
        @DisplayName("handleRequest - should act on the first input only")
        void testFirstInputOnly() {
            Request request = new Request("r1", List.of(
                    new Input.Sync(),
                    new Input.Execute(new ExecuteRequest(List.of(group("plug-1", new Command.OnOff(true)))))));

            Response response = homelander.handleRequest(request);

            assertThat(response.requestId()).isEqualTo("r1");
            assertThat(response.payload()).isInstanceOf(SyncResponse.class);
            assertThat(plug.isOn()).isFalse();
        }

        @Test
        @DisplayName("handleRequest - should disconnect every device")
        void testDisconnect() {
            homelander.handleRequest(new Request("r1", List.of(new Input.Disconnect())));

            assertThat(plug.isDisconnected()).isTrue();
            assertThat(lock.isDisconnected()).isTrue();
        }

        @Test
        @DisplayName("removeDevice - should remove and disconnect every match")
        void testRemoveDevice() {
            homelander.addDevice(new Device<>("plug-1", DeviceType.OUTLET, new TestSwitch("Twin"))
                    .register(Trait.ON_OFF));

            assertThat(homelander.removeDevice("plug-1")).isEqualTo(2);
            assertThat(homelander.removeDevice("plug-1")).isZero();
            assertThat(plug.isDisconnected()).isTrue();
            assertThat(homelander.devices()).extracting(Device::id).containsExactly("door-1");
            assertThat(homelander.findDevice("plug-1")).isEmpty();
        }

        @Test
        @DisplayName("constructor - should require an agent user id")
        void testRequiresAgentUserId() {
            assertThatThrownBy(() -> new Homelander(""))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("JSON Round-trip Tests")
    class JsonTests {

        @Test
        @DisplayName("handleJson - should answer an EXECUTE request in wire format")
        void testExecuteJson() throws Exception {
            String request = """
                    {"requestId": "ff36a3cc",
                     "inputs": [{"intent": "action.devices.EXECUTE",
                                 "payload": {"commands": [{
                                   "devices": [{"id": "plug-1", "customData": {"hub": 3}}],
                                   "execution": [{"command": "action.devices.commands.OnOff",
                                                  "params": {"on": true}}]}]}}]}
                    """;

            JsonNode response = Jsons.mapper().readTree(homelander.handleJson(request));

            assertThat(response.get("requestId").asText()).isEqualTo("ff36a3cc");
            JsonNode result = response.get("payload").get("commands").get(0);
            assertThat(result.get("ids").toString()).isEqualTo("[\"plug-1\"]");
            assertThat(result.get("status").asText()).isEqualTo("SUCCESS");
            assertThat(result.get("states").get("online").asBoolean()).isTrue();
            assertThat(result.has("errorCode")).isFalse();
        }

        @Test
        @DisplayName("handleJson - should answer a SYNC request in wire format")
        void testSyncJson() throws Exception {
            JsonNode response = Jsons.mapper().readTree(homelander.handleJson(
                    "{\"requestId\":\"r9\",\"inputs\":[{\"intent\":\"action.devices.SYNC\"}]}"));

            JsonNode payload = response.get("payload");
            assertThat(payload.get("agentUserId").asText()).isEqualTo("user-42");
            assertThat(payload.get("devices").get(1).get("type").asText()).isEqualTo("action.devices.types.LOCK");
            assertThat(payload.get("devices").get(1).get("traits").get(0).asText())
                    .isEqualTo("action.devices.traits.LockUnlock");
        }

        @Test
        @DisplayName("handleJson - should answer a QUERY request in wire format")
        void testQueryJson() throws Exception {
            JsonNode response = Jsons.mapper().readTree(homelander.handleJson(
                    "{\"requestId\":\"r3\",\"inputs\":[{\"intent\":\"action.devices.QUERY\","
                            + "\"payload\":{\"devices\":[{\"id\":\"door-1\"}]}}]}"));

            JsonNode door = response.get("payload").get("devices").get("door-1");
            assertThat(door.get("status").asText()).isEqualTo("SUCCESS");
            assertThat(door.get("isLocked").asBoolean()).isTrue();
            assertThat(door.get("isJammed").asBoolean()).isFalse();
        }

        @Test
        @DisplayName("handleJson - should reject malformed requests")
        void testMalformedJson() {
            assertThatThrownBy(() -> homelander.handleJson("{\"requestId\":"))
                    .isInstanceOf(InvalidRequestException.class);
            assertThatThrownBy(() -> homelander.handleJson(
                    "{\"requestId\":\"r1\",\"inputs\":[{\"intent\":\"action.devices.REBOOT\"}]}"))
                    .isInstanceOf(InvalidRequestException.class);
        }

        @Test
        @DisplayName("handleJson - should reject an input without payload")
        void testInputWithoutPayload() {
            assertThatThrownBy(() -> homelander.handleJson(
                    "{\"requestId\":\"r4\",\"inputs\":[{\"intent\":\"action.devices.QUERY\"}]}"))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessageContaining("r4");
            assertThatThrownBy(() -> homelander.handleJson(
                    "{\"requestId\":\"r5\",\"inputs\":[{\"intent\":\"action.devices.EXECUTE\"}]}"))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessageContaining("r5");
        }

        @Test
        @DisplayName("handleJson - should reject LockUnlock without lock and leave the lock alone")
        void testLockUnlockWithoutLock() {
            String request = """
                    {"requestId": "r6",
                     "inputs": [{"intent": "action.devices.EXECUTE",
                                 "payload": {"commands": [{
                                   "devices": [{"id": "door-1"}],
                                   "execution": [{"command": "action.devices.commands.LockUnlock"}]}]}}]}
                    """;

            assertThatThrownBy(() -> homelander.handleJson(request))
                    .isInstanceOf(InvalidRequestException.class)
                    .hasMessageContaining("lock");
            assertThat(lock.isLocked()).isTrue();
        }

        @Test
        @DisplayName("handleJson - should reject an explicit null for a required flag")
        void testNullRequiredFlag() {
            String request = """
                    {"requestId": "r7",
                     "inputs": [{"intent": "action.devices.EXECUTE",
                                 "payload": {"commands": [{
                                   "devices": [{"id": "plug-1"}],
                                   "execution": [{"command": "action.devices.commands.OnOff",
                                                  "params": {"on": null}}]}]}}]}
                    """;

            assertThatThrownBy(() -> homelander.handleJson(request))
                    .isInstanceOf(InvalidRequestException.class);
        }
    }
}
