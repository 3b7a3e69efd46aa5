package com.e2eq.apiversion.catalog;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TypeKeyTest {

    static class Device {
        static class Spec {
        }
    }

    static class Switch {
        static class Spec {
        }
    }

    @Test
    void testMemberClassesOfOnePackageDoNotCollide() {
        TypeKey device = TypeKey.of(Device.Spec.class);
        TypeKey sw = TypeKey.of(Switch.Spec.class);
        assertNotEquals(device, sw);
        assertEquals("TypeKeyTest.Device.Spec", device.typeName());
        assertEquals("com.e2eq.apiversion.catalog", device.packagePath());
    }

    @Test
    void testParseSplitsAtFirstTypeSegment() {
        assertEquals(new TypeKey("com.acme.netmodel", "NetDeviceSpec"), TypeKey.parse("com.acme.netmodel.NetDeviceSpec"));
        assertEquals(new TypeKey("com.acme.netmodel", "NetDevice.Spec"), TypeKey.parse("com.acme.netmodel.NetDevice.Spec"));
        assertEquals(new TypeKey("", "NetDevice.Spec"), TypeKey.parse("NetDevice.Spec"));
        assertEquals(new TypeKey("", "spec"), TypeKey.parse("spec"));
        assertEquals(new TypeKey("com.acme", "thing"), TypeKey.parse("com.acme.thing"));
    }

    @Test
    void testQualifiedNameRoundTrips() {
        TypeKey key = TypeKey.of(Device.Spec.class);
        assertEquals(key, TypeKey.parse(key.qualifiedName()));
    }
}
