package com.e2eq.apiversion.conversion;

import com.e2eq.apiversion.exceptions.RuntimeConversionException;
import com.e2eq.apiversion.model.VersionedResource;
import com.e2eq.apiversion.negotiation.PipelineStage;

/**
 * Converts between one spoke version of a kind and its hub. Implementations are stateless and
 * may be shared between threads.
 *
 * @param <H> hub envelope type
 * @param <S> spoke envelope type
 */
public interface Converter<H extends VersionedResource<?, ?>, S extends VersionedResource<?, ?>> {

    /** Spoke to hub. Hub fields without a spoke counterpart are zero-valued. */
    H convertTo(S spoke);

    /** Hub to spoke. Spoke fields without a hub counterpart are zero-valued. */
    S convertFrom(H hub);

    ConversionPlan plan();

    Class<H> hubType();

    Class<S> spokeType();

    default ConverterKey key() {
        return plan().key();
    }

    /** Untyped {@link #convertTo}; the argument must be an instance of {@link #spokeType()}. */
    default H toHub(VersionedResource<?, ?> spoke) {
        return convertTo(checked(spokeType(), spoke, PipelineStage.CONVERT_TO_HUB));
    }

    /** Untyped {@link #convertFrom}; the argument must be an instance of {@link #hubType()}. */
    default S fromHub(VersionedResource<?, ?> hub) {
        return convertFrom(checked(hubType(), hub, PipelineStage.CONVERT_HUB_TO_RESPONSE_SPOKE));
    }

    private static <T> T checked(Class<T> type, Object value, PipelineStage stage) {
        if (value != null && !type.isInstance(value)) {
            throw new RuntimeConversionException(stage, String.format("expected %s but got %s",
                    type.getName(), value.getClass().getName()), null);
        }
        return type.cast(value);
    }
}
