package com.e2eq.apiversion.registry;

import com.e2eq.apiversion.registry.ApiVersions.GroupVersion;
import com.e2eq.apiversion.registry.ApiVersions.Stability;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApiVersionsTest {

    @Test
    void testVersionFormat() {
        assertTrue(ApiVersions.isValidVersion("v1"));
        assertTrue(ApiVersions.isValidVersion("v1alpha1"));
        assertTrue(ApiVersions.isValidVersion("v12beta3"));
        assertFalse(ApiVersions.isValidVersion("v1alpha"));
        assertFalse(ApiVersions.isValidVersion("1"));
        assertFalse(ApiVersions.isValidVersion("v1gamma1"));
        assertFalse(ApiVersions.isValidVersion(null));
    }

    @Test
    void testStability() {
        assertEquals(Stability.ALPHA, ApiVersions.stability("v1alpha1"));
        assertEquals(Stability.BETA, ApiVersions.stability("v2beta1"));
        assertEquals(Stability.STABLE, ApiVersions.stability("v1"));
        assertEquals("beta", Stability.BETA.label());
    }

    @Test
    void testParseAndFormat() {
        assertEquals(new GroupVersion("infra.example.io", "v1beta1"), ApiVersions.parse("infra.example.io/v1beta1"));
        GroupVersion bare = ApiVersions.parse("v1");
        assertFalse(bare.hasGroup());
        assertEquals("v1", bare.toString());
        assertEquals("infra.example.io/v1", ApiVersions.format("infra.example.io", "v1"));
    }
}
