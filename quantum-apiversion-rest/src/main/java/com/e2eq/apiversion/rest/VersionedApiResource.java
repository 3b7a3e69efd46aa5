package com.e2eq.apiversion.rest;

import com.e2eq.apiversion.exceptions.ResourceNotFoundException;
import com.e2eq.apiversion.negotiation.ResolvedVersion;
import com.e2eq.apiversion.negotiation.VersionedRequest;
import com.e2eq.apiversion.negotiation.VersionedRequestPipeline;
import com.e2eq.apiversion.negotiation.VersionedResponse;
import com.e2eq.apiversion.registry.ApiVersions;
import com.e2eq.apiversion.registry.SchemaVersionRegistry;
import com.e2eq.apiversion.registry.SchemaVersionRegistry.ApiGroup;
import com.e2eq.apiversion.rest.models.GroupDiscovery;
import com.e2eq.apiversion.rest.models.GroupSummary;
import com.e2eq.apiversion.rest.service.ResourceNames;
import com.e2eq.apiversion.rest.service.StorageBackedHubHandler;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Versioned CRUD surface. Clients pick a version with {@code apiVersion} in the body or an
 * {@code api-version} parameter on the Accept header; every answer names the version it was
 * encoded in with {@value #API_VERSION_HEADER}.
 */
@Path("/apis")
@Tag(name = "apis", description = "Versioned resources and API group discovery")
public class VersionedApiResource {

    public static final String API_VERSION_HEADER = "X-Api-Version";

    private final SchemaVersionRegistry registry;
    private final VersionedRequestPipeline pipeline;
    private final StorageBackedHubHandler handler;

    @Inject
    public VersionedApiResource(SchemaVersionRegistry registry, VersionedRequestPipeline pipeline,
                                StorageBackedHubHandler handler) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.handler = handler;
    }

    @GET
    @Produces(MediaType.APPLICATION_JSON)
    public List<GroupSummary> listGroups() {
        return registry.groups().stream()
                .map(g -> new GroupSummary(g.name(), g.preferredVersion(), g.versions()))
                .collect(Collectors.toList());
    }

    @GET
    @Path("/{group}")
    @Produces(MediaType.APPLICATION_JSON)
    public GroupDiscovery discover(@PathParam("group") String group) {
        ApiGroup apiGroup = group(group);
        List<GroupDiscovery.VersionEntry> versions = apiGroup.versions().stream()
                .map(v -> new GroupDiscovery.VersionEntry(v, apiGroup.apiVersion(v),
                        ApiVersions.stability(v).label(), apiGroup.isHub(v)))
                .collect(Collectors.toList());
        List<GroupDiscovery.KindEntry> kinds = apiGroup.resources().keySet().stream()
                .map(kind -> new GroupDiscovery.KindEntry(kind, ResourceNames.plural(kind)))
                .collect(Collectors.toList());
        return new GroupDiscovery(apiGroup.name(), apiGroup.storageVersion(), apiGroup.preferredVersion(),
                versions, kinds);
    }

    @POST
    @Path("/{group}/{plural}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response create(@PathParam("group") String group, @PathParam("plural") String plural,
                           @HeaderParam(HttpHeaders.ACCEPT) String accept, String body) {
        String kind = kindFor(group, plural);
        VersionedResponse response = pipeline.handleWrite(VersionedRequest.write(group, kind, body, accept),
                handler.creator(group, kind));
        return respond(Response.status(Response.Status.CREATED), response);
    }

    @GET
    @Path("/{group}/{plural}")
    @Produces(MediaType.APPLICATION_JSON)
    public Response list(@PathParam("group") String group, @PathParam("plural") String plural,
                         @HeaderParam(HttpHeaders.ACCEPT) String accept) {
        String kind = kindFor(group, plural);
        VersionedResponse response = pipeline.handleList(VersionedRequest.read(group, kind, null, accept),
                handler.lister(group, kind));
        return respond(Response.ok(), response);
    }

    @GET
    @Path("/{group}/{plural}/{uid}")
    @Produces(MediaType.APPLICATION_JSON)
    public Response get(@PathParam("group") String group, @PathParam("plural") String plural,
                        @PathParam("uid") String uid, @HeaderParam(HttpHeaders.ACCEPT) String accept) {
        String kind = kindFor(group, plural);
        VersionedResponse response = pipeline.handleRead(VersionedRequest.read(group, kind, uid, accept),
                handler.reader(group, kind, uid));
        return respond(Response.ok(), response);
    }

    @PUT
    @Path("/{group}/{plural}/{uid}")
    @Consumes(MediaType.APPLICATION_JSON)
    @Produces(MediaType.APPLICATION_JSON)
    public Response update(@PathParam("group") String group, @PathParam("plural") String plural,
                           @PathParam("uid") String uid, @HeaderParam(HttpHeaders.ACCEPT) String accept,
                           String body) {
        String kind = kindFor(group, plural);
        VersionedRequest request = VersionedRequest.write(group, kind, body, accept).withUid(uid);
        VersionedResponse response = pipeline.handleWrite(request, handler.updater(group, kind, uid));
        return respond(Response.ok(), response);
    }

    @DELETE
    @Path("/{group}/{plural}/{uid}")
    public Response delete(@PathParam("group") String group, @PathParam("plural") String plural,
                           @PathParam("uid") String uid, @HeaderParam(HttpHeaders.ACCEPT) String accept) {
        String kind = kindFor(group, plural);
        ResolvedVersion version = pipeline.resolveOnly(VersionedRequest.read(group, kind, uid, accept));
        if (!handler.delete(group, kind, uid)) {
            throw new ResourceNotFoundException(kind, uid);
        }
        return Response.noContent().header(API_VERSION_HEADER, version.apiVersion()).build();
    }

    private ApiGroup group(String group) {
        return registry.group(group).orElseThrow(() -> new ResourceNotFoundException("ApiGroup", group));
    }

    private String kindFor(String group, String plural) {
        return ResourceNames.kindFor(group(group), plural)
                .orElseThrow(() -> new ResourceNotFoundException("Resource type", group + "/" + plural));
    }

    private static Response respond(Response.ResponseBuilder builder, VersionedResponse response) {
        return builder.header(API_VERSION_HEADER, response.apiVersion())
                .type(MediaType.APPLICATION_JSON_TYPE)
                .entity(response.body())
                .build();
    }
}
