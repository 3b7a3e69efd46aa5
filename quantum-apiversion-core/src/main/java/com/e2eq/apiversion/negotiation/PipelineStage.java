package com.e2eq.apiversion.negotiation;

/** Ordered stages a versioned request passes through. */
public enum PipelineStage {
    RECEIVE_REQUEST,
    RESOLVE_VERSION,
    DECODE_AS_SPOKE,
    CONVERT_TO_HUB,
    DISPATCH,
    CONVERT_HUB_TO_RESPONSE_SPOKE,
    ENCODE_RESPONSE
}
