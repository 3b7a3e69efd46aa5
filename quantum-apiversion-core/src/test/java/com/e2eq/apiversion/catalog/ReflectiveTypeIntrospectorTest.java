package com.e2eq.apiversion.catalog;

import com.e2eq.apiversion.fixtures.netmodel.NetDeviceSpec;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReflectiveTypeIntrospectorTest {

    static class Base {
        protected String id;
    }

    static class Child extends Base {
        static int counter;
        transient String cache;
        @JsonIgnore
        String secret;
        Optional<Long> maybe;
        Object payload;
        @JsonProperty(value = "labels", required = true)
        List<String> tags;
    }

    private final ReflectiveTypeIntrospector introspector = new ReflectiveTypeIntrospector();

    @Test
    void testFixtureSpec() {
        TypeInfo info = introspector.introspect(com.e2eq.apiversion.fixtures.infra.v1beta1.DeviceSpec.class);
        assertEquals("DeviceSpec", info.name());
        assertEquals("com.e2eq.apiversion.fixtures.infra.v1beta1", info.owningPackage());
        assertEquals(List.of("name", "ipAddress", "location", "deviceType", "tags", "description"),
                info.fields().stream().map(FieldMeta::name).toList());
        assertTrue(info.fieldByName("name").orElseThrow().required());
        assertFalse(info.fieldByName("location").orElseThrow().required());
        assertEquals("map[string]string", info.fieldByName("tags").orElseThrow().declaredType());
    }

    @Test
    void testStatusCollectionsAndPrimitives() {
        TypeInfo info = introspector.introspect(com.e2eq.apiversion.fixtures.infra.v1.DeviceStatus.class);
        assertEquals("boolean", info.fieldByName("ready").orElseThrow().declaredType());
        assertEquals("[]com.e2eq.apiversion.fixtures.infra.v1.Condition",
                info.fieldByName("conditions").orElseThrow().declaredType());
    }

    @Test
    void testWireTagFromAnnotation() {
        TypeInfo info = introspector.introspect(NetDeviceSpec.class);
        FieldMeta address = info.fieldByName("address").orElseThrow();
        assertEquals("ipAddress", address.wireTag());
        assertEquals(address, info.fieldByJsonName("ipAddress").orElseThrow());
        assertEquals("int", info.fieldByName("port").orElseThrow().declaredType());
    }

    @Test
    void testSkipsStaticTransientAndIgnoredAndIncludesSuperclass() {
        TypeInfo info = introspector.introspect(Child.class);
        assertEquals(List.of("id", "maybe", "payload", "tags"),
                info.fields().stream().map(FieldMeta::name).toList());
        assertEquals("*long", info.fieldByName("maybe").orElseThrow().declaredType());
        assertEquals(TypeNames.OPAQUE, info.fieldByName("payload").orElseThrow().declaredType());

        FieldMeta tags = info.fieldByName("tags").orElseThrow();
        assertEquals("labels", tags.jsonName());
        assertEquals("[]string", tags.declaredType());
        assertTrue(tags.required());
    }

    @Test
    void testNestedClassesAreNamedAfterTheirEnclosingClass() {
        TypeInfo info = introspector.introspect(Child.class);
        assertEquals("ReflectiveTypeIntrospectorTest.Child", info.name());
        assertEquals(TypeKey.of(Child.class), info.key());
        assertNotEquals(TypeKey.of(Base.class), info.key());
    }

    @Test
    void testReferencedTypesLookThroughCollections() {
        assertEquals(Set.of(com.e2eq.apiversion.fixtures.infra.v1.Condition.class),
                introspector.referencedTypes(com.e2eq.apiversion.fixtures.infra.v1.DeviceStatus.class));
        assertTrue(introspector.referencedTypes(Child.class).isEmpty());
    }
}
