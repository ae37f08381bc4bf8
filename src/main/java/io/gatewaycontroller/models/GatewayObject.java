package io.gatewaycontroller.models;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * A gateway status object as observed from the watch source.
 * The payload is kept unstructured; fields are extracted on demand.
 */
@Data
@AllArgsConstructor
public class GatewayObject {
    /** Identity in {@code namespace/name} form. */
    private final String key;
    /** Store revision the object was last modified at. */
    private final long revision;
    private final JsonNode object;
}
