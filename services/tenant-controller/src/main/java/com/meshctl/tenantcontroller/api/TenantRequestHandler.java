package com.meshctl.tenantcontroller.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.meshctl.security.TenantIdentity;
import com.meshctl.tenantcontroller.domain.error.ControllerException;
import com.meshctl.tenantcontroller.domain.model.TenantEntry;
import com.meshctl.tenantcontroller.domain.model.TenantInfo;
import com.meshctl.tenantcontroller.domain.model.Version;
import com.meshctl.tenantcontroller.domain.ports.ConfigurationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Handlers for the tenant and service-version operations.
 *
 * <p>Every handler follows the same steps: check identity, decode the payload, make exactly one
 * store call, shape the response. Validation failures are raised before the store is contacted.
 * Nothing is thrown to the caller: any failure, classified or not, goes through the {@link
 * ErrorResponder} at the handler boundary.
 *
 * <p>Identity for everything except create comes from the verified request identity and never
 * from the payload; create is the only operation that takes the tenant ID from the body, because
 * no identity exists yet.
 */
@Component
public class TenantRequestHandler {

    private static final Logger log = LoggerFactory.getLogger(TenantRequestHandler.class);

    private final ConfigurationStore store;
    private final ObjectMapper objectMapper;
    private final ObjectMapper payloadMapper;
    private final ErrorResponder errorResponder;

    public TenantRequestHandler(
            ConfigurationStore store, ObjectMapper objectMapper, ErrorResponder errorResponder) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.payloadMapper = strictPayloadMapper(objectMapper);
        this.errorResponder = errorResponder;
    }

    /**
     * Copy of the application mapper that decodes scalars only from their own JSON type: a
     * fractional, quoted or boolean port and a numeric or boolean string field are malformed
     * payloads rather than values to coerce.
     */
    private static ObjectMapper strictPayloadMapper(ObjectMapper objectMapper) {
        ObjectMapper strict =
                objectMapper.copy().disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);
        strict.coercionConfigFor(LogicalType.Integer)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.String, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.EmptyString, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        strict.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return strict;
    }

    /** Registers a tenant under the ID carried in the payload. */
    public HandlerResult createTenant(InboundRequest request, String body) {
        try {
            TenantInfo tenantInfo = decode(body, TenantInfo.class);
            if (tenantInfo.id() == null || tenantInfo.id().isBlank()) {
                throw ControllerException.invalidInput("tenant id is required");
            }
            store.create(tenantInfo.id(), tenantInfo);
            return HandlerResult.success(ResponseEntity.status(HttpStatus.CREATED).build());
        } catch (RuntimeException e) {
            return errorResponder.respond(request, e);
        }
    }

    /** Replaces the caller's configuration. Any {@code id} in the body is ignored. */
    public HandlerResult updateTenant(InboundRequest request, String body) {
        try {
            TenantIdentity tenant = request.requireIdentity();
            TenantInfo tenantInfo = decode(body, TenantInfo.class);
            store.set(tenant.tenantId(), tenantInfo.withId(tenant.tenantId()));
            return HandlerResult.success(ResponseEntity.ok().build());
        } catch (RuntimeException e) {
            return errorResponder.respond(request, e);
        }
    }

    /** Returns the caller's configuration rebuilt from the stored proxy config. */
    public HandlerResult readTenant(InboundRequest request) {
        try {
            TenantIdentity tenant = request.requireIdentity();
            TenantEntry entry = store.get(tenant.tenantId());
            return HandlerResult.success(
                    ResponseEntity.ok(TenantInfo.fromEntry(entry).withId(tenant.tenantId())));
        } catch (RuntimeException e) {
            return errorResponder.respond(request, e);
        }
    }

    /** Removes the caller's configuration; the store cascades to its versions. */
    public HandlerResult deleteTenant(InboundRequest request) {
        try {
            TenantIdentity tenant = request.requireIdentity();
            store.delete(tenant.tenantId());
            return HandlerResult.success(ResponseEntity.ok().build());
        } catch (RuntimeException e) {
            return errorResponder.respond(request, e);
        }
    }

    /** Creates or replaces the version record of {@code service}; the path wins over the body. */
    public HandlerResult setServiceVersion(InboundRequest request, String service, String body) {
        try {
            TenantIdentity tenant = request.requireIdentity();
            Version version = decode(body, Version.class).withService(service);
            store.setVersion(tenant.tenantId(), version);
            return HandlerResult.success(ResponseEntity.ok().build());
        } catch (RuntimeException e) {
            return errorResponder.respond(request, e);
        }
    }

    /** Returns the stored version record of {@code service} verbatim. */
    public HandlerResult getServiceVersion(InboundRequest request, String service) {
        TenantIdentity tenant;
        Version version;
        try {
            tenant = request.requireIdentity();
            version = store.getVersion(tenant.tenantId(), service);
        } catch (RuntimeException e) {
            return errorResponder.respond(request, e);
        }

        try {
            String json = objectMapper.writeValueAsString(version);
            return HandlerResult.success(
                    ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(json));
        } catch (JsonProcessingException e) {
            // Non-fatal: the read had no side effect, so there is nothing to undo.
            log.warn(
                    "Could not write JSON response for version information: "
                            + "tenant_id={} service={} request_id={}",
                    tenant.tenantId(),
                    service,
                    request.correlationId(),
                    e);
            return HandlerResult.failure(ResponseEntity.ok().build());
        }
    }

    /** Removes the version record of {@code service}. */
    public HandlerResult deleteServiceVersion(InboundRequest request, String service) {
        try {
            TenantIdentity tenant = request.requireIdentity();
            store.deleteVersion(tenant.tenantId(), service);
            return HandlerResult.success(ResponseEntity.ok().build());
        } catch (RuntimeException e) {
            return errorResponder.respond(request, e);
        }
    }

    private <T> T decode(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw ControllerException.malformedPayload("request body is empty", null);
        }
        T value;
        try {
            value = payloadMapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw ControllerException.malformedPayload("request body is not valid JSON", e);
        }
        if (value == null) {
            throw ControllerException.malformedPayload("request body is null", null);
        }
        return value;
    }
}
