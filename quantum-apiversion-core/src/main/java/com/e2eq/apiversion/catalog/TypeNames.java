package com.e2eq.apiversion.catalog;

import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;

import static java.util.Map.entry;

/**
 * Normalized type strings shared by the source scanner and the reflective introspector.
 * <ul>
 *     <li>scalars and their boxes: {@code int}, {@code long}, {@code boolean}, ..., {@code string}</li>
 *     <li>arrays and collections: {@code []E}</li>
 *     <li>maps: {@code map[K]V}</li>
 *     <li>{@code Optional<E>}: {@code *E}</li>
 *     <li>named types as written, qualified or not</li>
 *     <li>anything else: {@link #OPAQUE}</li>
 * </ul>
 */
public final class TypeNames {

    /** Marker for shapes the catalog does not model. Compatible with every other type. */
    public static final String OPAQUE = "any";

    private static final Map<String, String> SCALARS = Map.ofEntries(
            entry("int", "int"), entry("Integer", "int"),
            entry("long", "long"), entry("Long", "long"),
            entry("short", "short"), entry("Short", "short"),
            entry("byte", "byte"), entry("Byte", "byte"),
            entry("char", "char"), entry("Character", "char"),
            entry("float", "float"), entry("Float", "float"),
            entry("double", "double"), entry("Double", "double"),
            entry("boolean", "boolean"), entry("Boolean", "boolean"),
            entry("String", "string"), entry("CharSequence", "string"),
            entry("Object", OPAQUE)
    );

    private static final Set<String> COLLECTIONS = Set.of(
            "Iterable", "Collection", "List", "ArrayList", "LinkedList",
            "Set", "HashSet", "LinkedHashSet", "TreeSet", "SortedSet", "NavigableSet",
            "Queue", "Deque", "ArrayDeque");

    private static final Set<String> MAPS = Set.of(
            "Map", "HashMap", "LinkedHashMap", "TreeMap", "SortedMap", "NavigableMap",
            "ConcurrentMap", "ConcurrentHashMap");

    private TypeNames() {}

    /** Canonical name for a scalar or box, or the name unchanged. */
    public static String named(String name) {
        String simple = simpleName(name);
        if (SCALARS.containsKey(simple) && (simple.equals(name) || name.equals("java.lang." + simple))) {
            return SCALARS.get(simple);
        }
        return name;
    }

    public static String sliceOf(String element) {
        return "[]" + element;
    }

    public static String mapOf(String key, String value) {
        return "map[" + key + "]" + value;
    }

    public static String pointerOf(String element) {
        return "*" + element;
    }

    public static boolean isCollection(String name) {
        return COLLECTIONS.contains(simpleName(name));
    }

    public static boolean isMap(String name) {
        return MAPS.contains(simpleName(name));
    }

    public static boolean isOptional(String name) {
        return "Optional".equals(simpleName(name));
    }

    public static String simpleName(String name) {
        int idx = name.lastIndexOf('.');
        return idx < 0 ? name : name.substring(idx + 1);
    }

    /**
     * Whether values of the two declared types can be copied into each other without coercion.
     * Package qualifiers are ignored, {@link #OPAQUE} matches anything and {@code *E} matches {@code E}.
     */
    public static boolean compatible(String a, String b) {
        return compatible(a, b, (x, y) -> simpleName(x).equals(simpleName(y)));
    }

    /**
     * Like {@link #compatible(String, String)}, but two named (non scalar) types are compared
     * by {@code namedTypes} once collections, maps and optionals have been looked through.
     */
    public static boolean compatible(String a, String b, BiPredicate<String, String> namedTypes) {
        if (OPAQUE.equals(a) || OPAQUE.equals(b)) {
            return true;
        }
        if (a.startsWith("*")) {
            return compatible(a.substring(1), b.startsWith("*") ? b.substring(1) : b, namedTypes);
        }
        if (b.startsWith("*")) {
            return compatible(a, b.substring(1), namedTypes);
        }
        if (a.startsWith("[]") || b.startsWith("[]")) {
            return a.startsWith("[]") && b.startsWith("[]") && compatible(a.substring(2), b.substring(2), namedTypes);
        }
        if (a.startsWith("map[") || b.startsWith("map[")) {
            if (!a.startsWith("map[") || !b.startsWith("map[")) {
                return false;
            }
            String[] left = splitMap(a);
            String[] right = splitMap(b);
            return compatible(left[0], right[0], namedTypes) && compatible(left[1], right[1], namedTypes);
        }
        boolean scalarA = isScalar(a);
        boolean scalarB = isScalar(b);
        if (scalarA || scalarB) {
            return a.equals(b);
        }
        return namedTypes.test(a, b);
    }

    private static boolean isScalar(String name) {
        return SCALARS.containsValue(name) && !OPAQUE.equals(name);
    }

    // map[K]V -> {K, V}; K may itself contain brackets
    static String[] splitMap(String mapType) {
        int depth = 0;
        for (int i = 3; i < mapType.length(); i++) {
            char c = mapType.charAt(i);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) {
                    return new String[]{mapType.substring(4, i), mapType.substring(i + 1)};
                }
            }
        }
        return new String[]{OPAQUE, OPAQUE};
    }
}
