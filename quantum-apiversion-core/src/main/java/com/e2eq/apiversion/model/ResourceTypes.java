package com.e2eq.apiversion.model;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Resolves the spec and status classes bound by a {@link VersionedResource} subclass.
 */
public final class ResourceTypes {
    private ResourceTypes() {}

    public static Class<?> specType(Class<?> envelope) {
        return typeArgument(envelope, 0);
    }

    public static Class<?> statusType(Class<?> envelope) {
        return typeArgument(envelope, 1);
    }

    private static Class<?> typeArgument(Class<?> envelope, int index) {
        for (Class<?> c = envelope; c != null && c != Object.class; c = c.getSuperclass()) {
            Type parent = c.getGenericSuperclass();
            if (!(parent instanceof ParameterizedType)) {
                continue;
            }
            ParameterizedType pt = (ParameterizedType) parent;
            if (pt.getRawType() != VersionedResource.class) {
                continue;
            }
            Type arg = pt.getActualTypeArguments()[index];
            if (arg instanceof Class) {
                return (Class<?>) arg;
            }
            if (arg instanceof ParameterizedType) {
                return (Class<?>) ((ParameterizedType) arg).getRawType();
            }
            break;
        }
        throw new IllegalArgumentException(envelope.getName()
                + " must extend VersionedResource with concrete spec and status types");
    }
}
