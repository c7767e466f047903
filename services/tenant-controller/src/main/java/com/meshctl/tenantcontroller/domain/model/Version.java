package com.meshctl.tenantcontroller.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Versioning metadata for one service of one tenant.
 *
 * <p>Only {@code service} is interpreted by the controller. Every other JSON property (default
 * version, selectors, weights...) is kept verbatim, in order, and written back unchanged.
 */
@JsonPropertyOrder({"service"})
public final class Version {

    private final String service;
    private final Map<String, JsonNode> attributes;

    @JsonCreator
    public Version(@JsonProperty("service") String service) {
        this(service, new LinkedHashMap<>());
    }

    private Version(String service, Map<String, JsonNode> attributes) {
        this.service = service;
        this.attributes = attributes;
    }

    /** Creates a version with the given opaque attributes. */
    public static Version of(String service, Map<String, JsonNode> attributes) {
        return new Version(service, new LinkedHashMap<>(attributes));
    }

    @JsonProperty("service")
    public String service() {
        return service;
    }

    @JsonAnyGetter
    public Map<String, JsonNode> attributes() {
        return Collections.unmodifiableMap(attributes);
    }

    @JsonAnySetter
    private void putAttribute(String name, JsonNode value) {
        attributes.put(name, value);
    }

    /** Returns a copy bound to the given service, keeping every other attribute. */
    public Version withService(String service) {
        return new Version(service, new LinkedHashMap<>(attributes));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Version other)) {
            return false;
        }
        return Objects.equals(service, other.service) && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, attributes);
    }

    @Override
    public String toString() {
        return "Version[service=" + service + ", attributes=" + attributes + "]";
    }
}
