package com.e2eq.apiversion.negotiation;

import com.e2eq.apiversion.conversion.Converter;
import com.e2eq.apiversion.conversion.ConverterKey;
import com.e2eq.apiversion.conversion.ConverterRegistry;
import com.e2eq.apiversion.exceptions.RequestCancelledException;
import com.e2eq.apiversion.exceptions.RequestDecodeException;
import com.e2eq.apiversion.exceptions.ResourceNotFoundException;
import com.e2eq.apiversion.exceptions.RuntimeConversionException;
import com.e2eq.apiversion.model.VersionedResource;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Runs a request through resolve, decode, convert to hub, dispatch, convert back and encode.
 * The handler never sees a spoke and the client never sees the hub unless it asked for it.
 */
public final class VersionedRequestPipeline {

    private static final Logger LOG = Logger.getLogger(VersionedRequestPipeline.class);

    private final SchemaVersionRegistry registry;
    private final VersionNegotiator negotiator;
    private final ConverterRegistry converters;
    private final ObjectMapper mapper;

    public VersionedRequestPipeline(SchemaVersionRegistry registry, VersionNegotiator negotiator,
                                    ConverterRegistry converters, ObjectMapper mapper) {
        this.registry = registry;
        this.negotiator = negotiator;
        this.converters = converters;
        this.mapper = mapper;
    }

    /** Create or update: the body is decoded as the resolved spoke and the handler returns the stored hub. */
    public VersionedResponse handleWrite(VersionedRequest request, HubHandler handler) {
        // RECEIVE_REQUEST
        ObjectNode body = parseBody(request);

        // RESOLVE_VERSION
        JsonNode apiVersionNode = body.get("apiVersion");
        if (apiVersionNode != null && !apiVersionNode.isNull() && !apiVersionNode.isTextual()) {
            throw new RequestDecodeException("apiVersion must be a string");
        }
        String bodyApiVersion = apiVersionNode == null || apiVersionNode.isNull() ? null : apiVersionNode.asText();
        ResolvedVersion version = negotiator.resolve(request.group(), bodyApiVersion, request.acceptHeader());
        Converter<?, ?> converter = converterFor(version, request.kind());

        // DECODE_AS_SPOKE
        VersionedResource<?, ?> spoke = decode(body, converter, version, request.kind());

        // CONVERT_TO_HUB
        VersionedResource<?, ?> hub = convert(PipelineStage.CONVERT_TO_HUB, () -> converter.toHub(spoke));

        // DISPATCH
        checkCancelled(request);
        VersionedResource<?, ?> result = handler.handle(hub);

        return encode(version, converter, result);
    }

    public VersionedResponse handleRead(VersionedRequest request, HubHandler.Reader reader) {
        ResolvedVersion version = negotiator.resolve(request.group(), null, request.acceptHeader());
        Converter<?, ?> converter = converterFor(version, request.kind());
        checkCancelled(request);
        Optional<? extends VersionedResource<?, ?>> hub = reader.read();
        if (hub.isEmpty()) {
            throw new ResourceNotFoundException(request.kind(), request.uid());
        }
        return encode(version, converter, hub.get());
    }

    /**
     * Lists hubs and returns {@code {"apiVersion", "kind": "<Kind>List", "items": [...]}} in the
     * resolved version.
     */
    public VersionedResponse handleList(VersionedRequest request, HubHandler.Lister lister) {
        ResolvedVersion version = negotiator.resolve(request.group(), null, request.acceptHeader());
        Converter<?, ?> converter = converterFor(version, request.kind());
        checkCancelled(request);

        ObjectNode list = mapper.createObjectNode();
        list.put("apiVersion", version.apiVersion());
        list.put("kind", request.kind() + "List");
        ArrayNode items = list.putArray("items");
        for (VersionedResource<?, ?> hub : lister.list()) {
            items.add(encode(version, converter, hub).body());
        }
        return new VersionedResponse(version, list);
    }

    /** Resolves the version and checks the kind without touching a body, for deletes and discovery. */
    public ResolvedVersion resolveOnly(VersionedRequest request) {
        ResolvedVersion version = negotiator.resolve(request.group(), null, request.acceptHeader());
        converterFor(version, request.kind());
        checkCancelled(request);
        return version;
    }

    private ObjectNode parseBody(VersionedRequest request) {
        if (request.body() == null || request.body().isBlank()) {
            throw new RequestDecodeException("request body is required");
        }
        JsonNode node;
        try {
            node = mapper.readTree(request.body());
        } catch (JsonProcessingException e) {
            throw new RequestDecodeException("request body is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (!(node instanceof ObjectNode)) {
            throw new RequestDecodeException("request body must be a JSON object");
        }
        return (ObjectNode) node;
    }

    private Converter<?, ?> converterFor(ResolvedVersion version, String kind) {
        if (registry.resource(version.group(), kind).isEmpty()) {
            throw new RequestDecodeException("kind " + kind + " is not served by " + version.group());
        }
        return converters.get(new ConverterKey(version.group(), version.version(), kind));
    }

    private VersionedResource<?, ?> decode(ObjectNode body, Converter<?, ?> converter, ResolvedVersion version,
                                           String kind) {
        JsonNode kindNode = body.get("kind");
        if (kindNode != null && !kindNode.isNull() && !kind.equals(kindNode.asText())) {
            throw new RequestDecodeException("kind " + kindNode.asText() + " does not match " + kind);
        }
        VersionedResource<?, ?> spoke;
        try {
            spoke = mapper.readerFor(converter.spokeType())
                    .with(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(body);
        } catch (IOException | IllegalArgumentException e) {
            throw new RequestDecodeException(String.format("body does not fit %s %s: %s",
                    version.apiVersion(), kind, e.getMessage()), e);
        }
        spoke.setApiVersion(version.apiVersion());
        spoke.setKind(kind);
        return spoke;
    }

    private VersionedResponse encode(ResolvedVersion version, Converter<?, ?> converter, VersionedResource<?, ?> hub) {
        // CONVERT_HUB_TO_RESPONSE_SPOKE
        VersionedResource<?, ?> spoke = convert(PipelineStage.CONVERT_HUB_TO_RESPONSE_SPOKE, () -> converter.fromHub(hub));
        // ENCODE_RESPONSE
        JsonNode out = convert(PipelineStage.ENCODE_RESPONSE, () -> mapper.valueToTree(spoke));
        return new VersionedResponse(version, out);
    }

    private <T> T convert(PipelineStage stage, Supplier<T> step) {
        try {
            return step.get();
        } catch (RuntimeConversionException e) {
            LOG.errorf(e, "Conversion failed at %s; generated converters and configuration have drifted", stage);
            throw e;
        } catch (IllegalArgumentException e) {
            LOG.errorf(e, "Conversion failed at %s; generated converters and configuration have drifted", stage);
            throw new RuntimeConversionException(stage, "conversion failed at " + stage, e);
        }
    }

    private static void checkCancelled(VersionedRequest request) {
        if (request.isCancelled()) {
            throw new RequestCancelledException(String.format("request for %s %s was cancelled before dispatch",
                    request.group(), request.kind()));
        }
    }
}
