package com.e2eq.apiversion.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SourceTypeScannerTest {

    private static final String DEVICE_SPEC = String.join("\n",
            "package com.acme.netmodel;",
            "",
            "import com.fasterxml.jackson.annotation.JsonProperty;",
            "import jakarta.validation.constraints.NotNull;",
            "import java.util.*;",
            "",
            "public class DeviceSpec {",
            "    public static final String KIND = \"Device\";",
            "    @JsonProperty(\"ipAddress\")",
            "    private String address;",
            "    @JsonProperty(value = \"port\", required = true)",
            "    private Integer port;",
            "    @NotNull",
            "    private List<String> tags;",
            "    private Map<String, List<Integer>> ranges;",
            "    private Optional<java.time.Instant> seen;",
            "    private transient String cache;",
            "    private int[] ids;",
            "",
            "    public static class Inner {",
            "        private long count;",
            "    }",
            "}",
            "",
            "record Pair<T>(T first, @JsonProperty(\"second\") String value) {}",
            "");

    @TempDir
    Path dir;

    @Test
    void testClassFieldsAreCatalogued() throws Exception {
        Path file = Files.writeString(dir.resolve("DeviceSpec.java"), DEVICE_SPEC);
        List<TypeInfo> types = new SourceTypeScanner().scanFile(file);

        TypeInfo spec = byName(types, "DeviceSpec");
        assertEquals("com.acme.netmodel", spec.owningPackage());
        assertEquals(List.of("address", "port", "tags", "ranges", "seen", "ids"),
                spec.fields().stream().map(FieldMeta::name).toList());

        FieldMeta address = spec.fieldByName("address").orElseThrow();
        assertEquals("string", address.declaredType());
        assertEquals("ipAddress", address.wireTag());
        assertEquals("ipAddress", address.jsonName());
        assertFalse(address.required());

        FieldMeta port = spec.fieldByName("port").orElseThrow();
        assertEquals("int", port.declaredType());
        assertEquals("port", port.wireTag());
        assertTrue(port.required());

        assertTrue(spec.fieldByName("tags").orElseThrow().required());
        assertEquals("[]string", spec.fieldByName("tags").orElseThrow().declaredType());
        assertEquals("map[string][]int", spec.fieldByName("ranges").orElseThrow().declaredType());
        assertEquals("*java.time.Instant", spec.fieldByName("seen").orElseThrow().declaredType());
        assertEquals("[]int", spec.fieldByName("ids").orElseThrow().declaredType());
    }

    @Test
    void testNestedTypesAndRecords() throws Exception {
        Path file = Files.writeString(dir.resolve("DeviceSpec.java"), DEVICE_SPEC);
        List<TypeInfo> types = new SourceTypeScanner().scanFile(file);

        assertEquals(3, types.size());
        TypeInfo inner = byName(types, "DeviceSpec.Inner");
        assertEquals("long", inner.fieldByName("count").orElseThrow().declaredType());
        assertEquals(new TypeKey("com.acme.netmodel", "DeviceSpec.Inner"), inner.key());

        TypeInfo pair = byName(types, "Pair");
        assertEquals(TypeNames.OPAQUE, pair.fieldByName("first").orElseThrow().declaredType());
        assertEquals("second", pair.fieldByName("value").orElseThrow().jsonName());
    }

    @Test
    void testUnparseableFilesAreSkipped() throws Exception {
        Files.writeString(dir.resolve("Broken.java"), "package x; public class Broken { private String name");
        Files.writeString(dir.resolve("Ok.java"), "package x; public class Ok { private String name; }");
        Files.writeString(dir.resolve("notes.txt"), "not java");

        List<TypeInfo> types = new SourceTypeScanner().scanDirectory(dir, false);
        assertEquals(1, types.size());
        assertEquals("Ok", types.get(0).name());
    }

    @Test
    void testInterfacesAndEnumsAreIgnored() throws Exception {
        Path file = Files.writeString(dir.resolve("Shapes.java"), String.join("\n",
                "package x;",
                "interface Named { String name(); }",
                "enum Phase { PENDING, READY }",
                "class Holder { Phase phase; }"));
        List<TypeInfo> types = new SourceTypeScanner().scanFile(file);
        assertEquals(1, types.size());
        assertEquals("Phase", types.get(0).fieldByName("phase").orElseThrow().declaredType());
    }

    private static TypeInfo byName(List<TypeInfo> types, String name) {
        return types.stream().filter(t -> t.name().equals(name)).findFirst()
                .orElseThrow(() -> new AssertionError("missing type " + name));
    }
}
