package com.e2eq.apiversion.negotiation;

import com.e2eq.apiversion.exceptions.RequestCancelledException;
import com.e2eq.apiversion.exceptions.RequestDecodeException;
import com.e2eq.apiversion.exceptions.RequestVersionException;
import com.e2eq.apiversion.exceptions.ResourceNotFoundException;
import com.e2eq.apiversion.fixtures.FixtureSupport;
import com.e2eq.apiversion.fixtures.InMemoryStorageBackend;
import com.e2eq.apiversion.fixtures.infra.v1.Device;
import com.e2eq.apiversion.model.Metadata;
import com.e2eq.apiversion.model.VersionedResource;
import com.e2eq.apiversion.runtime.ApiVersioning;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class VersionedRequestPipelineTest {

    private static final String GROUP = "infra.example.io";

    private static ApiVersioning versioning;
    private InMemoryStorageBackend storage;
    private ObjectMapper mapper;

    @BeforeAll
    static void bootstrap() {
        versioning = FixtureSupport.bootstrap();
    }

    @BeforeEach
    void setUp() {
        storage = new InMemoryStorageBackend();
        mapper = versioning.objectMapper();
    }

    private HubHandler create() {
        return hub -> {
            Metadata meta = hub.getMetadata() == null ? new Metadata() : hub.getMetadata();
            meta.setUid("dev-0000abcd");
            hub.setMetadata(meta);
            storage.save(hub.getKind(), meta.getUid(), mapper.valueToTree(hub));
            return hub;
        };
    }

    private HubHandler.Reader read(String uid) {
        return () -> storage.load("Device", uid).map(this::toHub);
    }

    private Device toHub(JsonNode node) {
        try {
            return mapper.treeToValue(node, Device.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static final String BETA_BODY = "{"
            + "\"apiVersion\":\"infra.example.io/v1beta1\","
            + "\"kind\":\"Device\","
            + "\"metadata\":{\"name\":\"edge-1\"},"
            + "\"spec\":{\"name\":\"edge-1\",\"ipAddress\":\"10.0.0.5\",\"tags\":{\"env\":\"prod\"}}"
            + "}";

    @Test
    void testWriteStoresHubAndAnswersInRequestedVersion() {
        VersionedResponse response = versioning.pipeline().handleWrite(
                VersionedRequest.write(GROUP, "Device", BETA_BODY, null), create());

        assertEquals("infra.example.io/v1beta1", response.apiVersion());
        assertEquals(VersionSource.BODY, response.version().source());
        assertEquals("infra.example.io/v1beta1", response.body().get("apiVersion").asText());

        JsonNode stored = storage.load("Device", "dev-0000abcd").orElseThrow();
        assertEquals("infra.example.io/v1", stored.get("apiVersion").asText());
        assertEquals("10.0.0.5", stored.get("spec").get("ipAddress").asText());
        assertEquals("dev-0000abcd", stored.get("metadata").get("uid").asText());
    }

    @Test
    void testNarrowerVersionReadDropsTags() {
        versioning.pipeline().handleWrite(VersionedRequest.write(GROUP, "Device", BETA_BODY, null), create());

        VersionedResponse response = versioning.pipeline().handleRead(
                VersionedRequest.read(GROUP, "Device", "dev-0000abcd", "application/json; api-version=v1alpha1"),
                read("dev-0000abcd"));

        assertEquals("infra.example.io/v1alpha1", response.body().get("apiVersion").asText());
        assertEquals("10.0.0.5", response.body().get("spec").get("ipAddress").asText());
        assertFalse(response.body().get("spec").has("tags"));
        assertEquals("dev-0000abcd", response.body().get("metadata").get("uid").asText());
    }

    @Test
    void testListUsesResolvedVersion() {
        versioning.pipeline().handleWrite(VersionedRequest.write(GROUP, "Device", BETA_BODY, null), create());

        VersionedResponse response = versioning.pipeline().handleList(
                VersionedRequest.read(GROUP, "Device", null, "application/json; api-version=v1beta1"),
                () -> storage.loadAll("Device").stream().map(this::toHub).toList());

        assertEquals("DeviceList", response.body().get("kind").asText());
        assertEquals(1, response.body().get("items").size());
        assertEquals("prod", response.body().get("items").get(0).get("spec").get("tags").get("env").asText());
    }

    @Test
    void testDecodeErrors() {
        VersionedRequestPipeline pipeline = versioning.pipeline();
        assertThrows(RequestDecodeException.class,
                () -> pipeline.handleWrite(VersionedRequest.write(GROUP, "Device", "{not json", null), create()));
        assertThrows(RequestDecodeException.class,
                () -> pipeline.handleWrite(VersionedRequest.write(GROUP, "Device", "[]", null), create()));
        assertThrows(RequestDecodeException.class,
                () -> pipeline.handleWrite(VersionedRequest.write(GROUP, "Device", null, null), create()));

        // tags do not exist in v1alpha1
        String unknownField = "{\"apiVersion\":\"infra.example.io/v1alpha1\",\"spec\":{\"tags\":{\"a\":\"b\"}}}";
        RequestDecodeException ex = assertThrows(RequestDecodeException.class,
                () -> pipeline.handleWrite(VersionedRequest.write(GROUP, "Device", unknownField, null), create()));
        assertTrue(ex.getMessage().contains("infra.example.io/v1alpha1"));

        String wrongKind = "{\"apiVersion\":\"infra.example.io/v1\",\"kind\":\"Switch\",\"spec\":{}}";
        assertThrows(RequestDecodeException.class,
                () -> pipeline.handleWrite(VersionedRequest.write(GROUP, "Device", wrongKind, null), create()));

        assertThrows(RequestDecodeException.class,
                () -> pipeline.handleWrite(VersionedRequest.write(GROUP, "Switch", "{\"spec\":{}}", null), create()));
        assertTrue(storage.loadAll("Device").isEmpty());
    }

    @Test
    void testUnsupportedVersionIsNeverDispatched() {
        String body = "{\"apiVersion\":\"infra.example.io/v9\",\"spec\":{}}";
        AtomicBoolean dispatched = new AtomicBoolean();
        assertThrows(RequestVersionException.class, () -> versioning.pipeline().handleWrite(
                VersionedRequest.write(GROUP, "Device", body, null), hub -> {
                    dispatched.set(true);
                    return hub;
                }));
        assertFalse(dispatched.get());
    }

    @Test
    void testCancelledRequestSkipsDispatch() {
        AtomicBoolean dispatched = new AtomicBoolean();
        VersionedRequest request = VersionedRequest.write(GROUP, "Device", BETA_BODY, null).withCancellation(() -> true);
        assertThrows(RequestCancelledException.class, () -> versioning.pipeline().handleWrite(request, hub -> {
            dispatched.set(true);
            return hub;
        }));
        assertFalse(dispatched.get());
    }

    @Test
    void testMissingReadTarget() {
        ResourceNotFoundException ex = assertThrows(ResourceNotFoundException.class,
                () -> versioning.pipeline().handleRead(VersionedRequest.read(GROUP, "Device", "dev-missing", null),
                        Optional::empty));
        assertEquals("Device 'dev-missing' not found", ex.getMessage());
    }

    @Test
    void testResolveOnly() {
        ResolvedVersion version = versioning.pipeline().resolveOnly(
                VersionedRequest.read("legacy.example.io", "Device", "x", null));
        assertEquals("v1alpha1", version.version());
        assertEquals(VersionSource.DEFAULT, version.source());
    }

    @Test
    void testHandlerOnlySeesHub() {
        versioning.pipeline().handleWrite(VersionedRequest.write(GROUP, "Device", BETA_BODY, null), hub -> {
            assertInstanceOf(Device.class, hub);
            assertEquals("infra.example.io/v1", hub.getApiVersion());
            return hub;
        });
    }

    @Test
    void testRenamedFieldReachesHub() {
        String body = "{\"apiVersion\":\"legacy.example.io/v1alpha1\",\"kind\":\"Device\","
                + "\"spec\":{\"ipAddress\":\"10.0.0.9\",\"hostname\":\"sw-9\"}}";
        VersionedResource<?, ?>[] seen = new VersionedResource<?, ?>[1];
        VersionedResponse response = versioning.pipeline().handleWrite(
                VersionedRequest.write("legacy.example.io", "Device", body, null), hub -> {
                    seen[0] = hub;
                    return hub;
                });

        com.e2eq.apiversion.fixtures.legacy.v1.Device hub = (com.e2eq.apiversion.fixtures.legacy.v1.Device) seen[0];
        assertEquals("10.0.0.9", hub.getSpec().getIp());
        assertEquals("10.0.0.9", response.body().get("spec").get("ipAddress").asText());
    }
}
