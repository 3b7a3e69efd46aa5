package com.e2eq.apiversion.conversion;

import com.e2eq.apiversion.exceptions.RuntimeConversionException;
import com.e2eq.apiversion.model.VersionedResource;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable lookup of generated converters by {@link ConverterKey}.
 */
public final class ConverterRegistry {

    private final Map<ConverterKey, Converter<?, ?>> converters;
    private final Map<ConverterKey, ResourceBinding> bindings;

    public ConverterRegistry(Map<ConverterKey, Converter<?, ?>> converters, Map<ConverterKey, ResourceBinding> bindings) {
        this.converters = Collections.unmodifiableMap(new LinkedHashMap<>(converters));
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Optional<Converter<?, ?>> find(ConverterKey key) {
        return Optional.ofNullable(converters.get(key));
    }

    /** The converter for {@code key}. A missing converter means bootstrap and configuration disagree. */
    public Converter<?, ?> get(ConverterKey key) {
        Converter<?, ?> converter = converters.get(key);
        if (converter == null) {
            throw new RuntimeConversionException("no converter generated for " + key, null);
        }
        return converter;
    }

    /**
     * Typed lookup, checked against the classes bound at bootstrap.
     *
     * @throws IllegalArgumentException when the requested classes are not the bound ones
     */
    @SuppressWarnings("unchecked")
    public <H extends VersionedResource<?, ?>, S extends VersionedResource<?, ?>> Converter<H, S> get(
            ConverterKey key, Class<H> hubType, Class<S> spokeType) {
        Converter<?, ?> converter = get(key);
        if (converter.hubType() != hubType || converter.spokeType() != spokeType) {
            throw new IllegalArgumentException(String.format("%s converts %s <-> %s, not %s <-> %s", key,
                    converter.spokeType().getName(), converter.hubType().getName(),
                    spokeType.getName(), hubType.getName()));
        }
        return (Converter<H, S>) converter;
    }

    public Optional<ResourceBinding> binding(ConverterKey key) {
        return Optional.ofNullable(bindings.get(key));
    }

    public List<ConversionPlan> plans() {
        return converters.values().stream().map(Converter::plan).collect(Collectors.toList());
    }

    public Collection<ConverterKey> keys() {
        return converters.keySet();
    }

    public int size() {
        return converters.size();
    }
}
