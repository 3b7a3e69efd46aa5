package com.e2eq.apiversion.runtime;

import com.e2eq.apiversion.fixtures.infra.v1alpha1.DeviceStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ObjectMappersTest {

    @Test
    void testUnknownPropertiesAreIgnoredLikeQuarkus() throws Exception {
        ObjectMapper mapper = ObjectMappers.create();
        DeviceStatus status = mapper.readValue("{\"phase\":\"Ready\",\"health\":\"Good\"}", DeviceStatus.class);
        assertEquals("Ready", status.getPhase());
    }

    @Test
    void testInstantsAreWrittenAsIsoText() throws Exception {
        String json = ObjectMappers.create().writeValueAsString(Map.of("at", Instant.parse("2025-01-01T00:00:00Z")));
        assertEquals("{\"at\":\"2025-01-01T00:00:00Z\"}", json);
    }
}
