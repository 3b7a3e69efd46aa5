package com.e2eq.apiversion.catalog;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.lang.reflect.Field;
import java.lang.reflect.GenericArrayType;
import java.lang.reflect.Modifier;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds a {@link TypeInfo} from a compiled class by walking its declared fields, superclass
 * fields first. Produces the same field contract as {@link SourceTypeScanner}; named field types
 * are written fully qualified.
 */
public final class ReflectiveTypeIntrospector {

    public TypeInfo introspect(Class<?> type) {
        List<FieldMeta> fields = new ArrayList<>();
        for (Field f : mappedFields(type)) {
            fields.add(fieldOf(f));
        }
        return new TypeInfo(TypeKey.nestedName(type), type.getPackageName(), fields);
    }

    /**
     * Classes the mapped fields of {@code type} are built from, looking through arrays,
     * collections, maps and {@code Optional}. JDK classes, primitives and enums are left out.
     */
    public Set<Class<?>> referencedTypes(Class<?> type) {
        Set<Class<?>> out = new LinkedHashSet<>();
        for (Field f : mappedFields(type)) {
            collectClasses(f.getGenericType(), out);
        }
        return out;
    }

    private static List<Field> mappedFields(Class<?> type) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.push(c);
        }
        List<Field> fields = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field f : c.getDeclaredFields()) {
                int mod = f.getModifiers();
                if (Modifier.isStatic(mod) || Modifier.isTransient(mod) || f.isSynthetic()) {
                    continue;
                }
                if (f.isAnnotationPresent(JsonIgnore.class)) {
                    continue;
                }
                fields.add(f);
            }
        }
        return fields;
    }

    private static void collectClasses(Type type, Set<Class<?>> out) {
        if (type instanceof Class) {
            Class<?> c = (Class<?>) type;
            if (c.isArray()) {
                collectClasses(c.getComponentType(), out);
            } else if (!c.isPrimitive() && !c.isEnum() && !isJdk(c)) {
                out.add(c);
            }
        } else if (type instanceof ParameterizedType) {
            ParameterizedType pt = (ParameterizedType) type;
            collectClasses(pt.getRawType(), out);
            for (Type arg : pt.getActualTypeArguments()) {
                collectClasses(arg, out);
            }
        } else if (type instanceof GenericArrayType) {
            collectClasses(((GenericArrayType) type).getGenericComponentType(), out);
        }
    }

    private static boolean isJdk(Class<?> c) {
        String pkg = c.getPackageName();
        return pkg.startsWith("java.") || pkg.startsWith("javax.") || pkg.startsWith("jdk.");
    }

    private FieldMeta fieldOf(Field f) {
        String wireTag = "";
        boolean required = false;
        JsonProperty jp = f.getAnnotation(JsonProperty.class);
        if (jp != null) {
            wireTag = WireTags.nameOf(jp.value());
            required = jp.required();
        }
        if (f.isAnnotationPresent(NotNull.class) || f.isAnnotationPresent(NotBlank.class)
                || f.isAnnotationPresent(NotEmpty.class)) {
            required = true;
        }
        return new FieldMeta(f.getName(), normalize(f.getGenericType()), wireTag, required);
    }

    static String normalize(Type type) {
        if (type instanceof Class) {
            Class<?> c = (Class<?>) type;
            if (c.isArray()) {
                return TypeNames.sliceOf(normalize(c.getComponentType()));
            }
            if (Collection.class.isAssignableFrom(c)) {
                return TypeNames.sliceOf(TypeNames.OPAQUE);
            }
            if (Map.class.isAssignableFrom(c)) {
                return TypeNames.mapOf(TypeNames.OPAQUE, TypeNames.OPAQUE);
            }
            if (c == Optional.class) {
                return TypeNames.pointerOf(TypeNames.OPAQUE);
            }
            if (c.isPrimitive() || "java.lang".equals(c.getPackageName())) {
                return TypeNames.named(c.getSimpleName());
            }
            return TypeKey.of(c).qualifiedName();
        }
        if (type instanceof ParameterizedType) {
            ParameterizedType pt = (ParameterizedType) type;
            Class<?> raw = (Class<?>) pt.getRawType();
            Type[] args = pt.getActualTypeArguments();
            if (Collection.class.isAssignableFrom(raw) && args.length == 1) {
                return TypeNames.sliceOf(normalize(args[0]));
            }
            if (Map.class.isAssignableFrom(raw) && args.length == 2) {
                return TypeNames.mapOf(normalize(args[0]), normalize(args[1]));
            }
            if (raw == Optional.class && args.length == 1) {
                return TypeNames.pointerOf(normalize(args[0]));
            }
            return normalize(raw);
        }
        if (type instanceof GenericArrayType) {
            return TypeNames.sliceOf(normalize(((GenericArrayType) type).getGenericComponentType()));
        }
        // type variables and wildcards
        return TypeNames.OPAQUE;
    }
}
