package com.e2eq.apiversion.rest.service;

import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiGroup;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiResource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResourceNamesTest {

    private final ApiGroup group = new ApiGroup("iot.example.io", "v1", null, List.of("v1"),
            "com.example.iot", Map.of("Sensor", new ApiResource("Sensor", null)), null);

    @Test
    void testPlural() {
        assertEquals("sensors", ResourceNames.plural("Sensor"));
    }

    @Test
    void testKindForPlural() {
        assertEquals(Optional.of("Sensor"), ResourceNames.kindFor(group, "sensors"));
        assertEquals(Optional.of("Sensor"), ResourceNames.kindFor(group, "Sensors"));
        assertTrue(ResourceNames.kindFor(group, "gateways").isEmpty());
    }

    @Test
    void testStorageKindIsGroupQualified() {
        assertEquals("sensors.iot.example.io", ResourceNames.storageKind("iot.example.io", "Sensor"));
    }
}
