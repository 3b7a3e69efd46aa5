package com.e2eq.apiversion.negotiation;

import com.e2eq.apiversion.exceptions.RequestVersionException;
import com.e2eq.apiversion.fixtures.FixtureSupport;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VersionNegotiatorTest {

    private final VersionNegotiator negotiator =
            new VersionNegotiator(SchemaVersionRegistry.fromConfig(FixtureSupport.config()));

    @Test
    void testDefaultsToPreferredVersion() {
        ResolvedVersion resolved = negotiator.resolve("infra.example.io", null, null);
        assertEquals("v1", resolved.version());
        assertEquals(VersionSource.DEFAULT, resolved.source());
        assertEquals("infra.example.io/v1", resolved.apiVersion());

        assertEquals("v1alpha1", negotiator.resolve("legacy.example.io", null, "application/json").version());
    }

    @Test
    void testBodyWinsOverAcceptHeader() {
        ResolvedVersion resolved = negotiator.resolve("infra.example.io", "infra.example.io/v1beta1",
                "application/json; api-version=v1alpha1");
        assertEquals("v1beta1", resolved.version());
        assertEquals(VersionSource.BODY, resolved.source());

        assertEquals("v1alpha1", negotiator.resolve("infra.example.io", "v1alpha1", null).version());
    }

    @Test
    void testAcceptHeaderParameter() {
        ResolvedVersion resolved = negotiator.resolve("infra.example.io", null,
                "application/json; api-version=\"infra.example.io/v1alpha1\"");
        assertEquals("v1alpha1", resolved.version());
        assertEquals(VersionSource.ACCEPT_HEADER, resolved.source());
    }

    @Test
    void testAcceptHeaderForms() {
        assertEquals("v1beta1", VersionNegotiator.acceptedVersion("application/json;version=v1beta1").orElseThrow());
        assertEquals("v1", VersionNegotiator.acceptedVersion("text/html, application/json; v=v1").orElseThrow());
        assertEquals("v1beta1", VersionNegotiator.acceptedVersion(
                "application/json;v=v1;api-version=v1beta1").orElseThrow());
        assertTrue(VersionNegotiator.acceptedVersion("application/json; q=0.9").isEmpty());
        assertTrue(VersionNegotiator.acceptedVersion(null).isEmpty());
    }

    @Test
    void testUnsupportedVersionIsRejected() {
        RequestVersionException ex = assertThrows(RequestVersionException.class,
                () -> negotiator.resolve("infra.example.io", null, "application/json; api-version=v9"));
        assertEquals("v9", ex.getRequestedVersion());
        assertEquals(VersionSource.ACCEPT_HEADER, ex.getSource());
        assertEquals(List.of("v1alpha1", "v1beta1", "v1"), ex.getSupportedVersions());

        RequestVersionException body = assertThrows(RequestVersionException.class,
                () -> negotiator.resolve("infra.example.io", "infra.example.io/v9", null));
        assertEquals(VersionSource.BODY, body.getSource());
    }

    @Test
    void testGroupMismatchAndUnknownGroup() {
        RequestVersionException mismatch = assertThrows(RequestVersionException.class,
                () -> negotiator.resolve("infra.example.io", "legacy.example.io/v1", null));
        assertTrue(mismatch.getMessage().contains("belongs to group legacy.example.io"));

        assertThrows(RequestVersionException.class, () -> negotiator.resolve("nope.example.io", null, null));
    }
}
