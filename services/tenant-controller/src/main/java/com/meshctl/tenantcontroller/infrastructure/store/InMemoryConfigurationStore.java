package com.meshctl.tenantcontroller.infrastructure.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.meshctl.tenantcontroller.domain.error.ControllerException;
import com.meshctl.tenantcontroller.domain.model.ProxyConfig;
import com.meshctl.tenantcontroller.domain.model.TenantEntry;
import com.meshctl.tenantcontroller.domain.model.TenantInfo;
import com.meshctl.tenantcontroller.domain.model.Version;
import com.meshctl.tenantcontroller.domain.ports.ConfigurationStore;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConfigurationStore} held entirely in process memory.
 *
 * <p>Used for local development, tests, and single-replica deployments where configuration is
 * re-registered on restart. Tenants live in a concurrent map; create and replace use atomic map
 * operations so concurrent requests for the same tenant cannot both win a create. Versions are
 * kept inside the tenant record, which makes delete cascade for free.
 *
 * <p>Semantic validation (port range, known load-balance mode, non-blank service) is reported as
 * {@code INVALID_RULE}; unknown tenants and versions as {@code NOT_FOUND}.
 */
public class InMemoryConfigurationStore implements ConfigurationStore {

    static final String TENANT_EXISTS = "error_tenant_exists";
    static final String TENANT_NOT_FOUND = "error_tenant_not_found";
    static final String VERSION_NOT_FOUND = "error_version_not_found";
    static final String INVALID_PORT = "error_invalid_port";
    static final String INVALID_LOAD_BALANCE = "error_invalid_load_balance";
    static final String INVALID_SERVICE = "error_invalid_service";

    private static final int MAX_PORT = 65535;

    private static final Logger log = LoggerFactory.getLogger(InMemoryConfigurationStore.class);

    private final ConcurrentMap<String, TenantRecord> tenants = new ConcurrentHashMap<>();
    private final Set<String> loadBalanceModes;

    /**
     * @param loadBalanceModes accepted load-balance tokens; an empty token is always accepted and
     *     means "proxy default"
     */
    public InMemoryConfigurationStore(Collection<String> loadBalanceModes) {
        this.loadBalanceModes = Set.copyOf(loadBalanceModes);
    }

    @Override
    public void create(String tenantId, TenantInfo tenantInfo) {
        ProxyConfig config = validated(tenantInfo);
        if (tenants.putIfAbsent(tenantId, new TenantRecord(config)) != null) {
            throw ControllerException.invalidRule(TENANT_EXISTS);
        }
        log.info("Registered tenant {}", tenantId);
    }

    @Override
    public void set(String tenantId, TenantInfo tenantInfo) {
        ProxyConfig config = validated(tenantInfo);
        TenantRecord updated =
                tenants.computeIfPresent(tenantId, (id, current) -> current.withConfig(config));
        if (updated == null) {
            throw ControllerException.notFound(TENANT_NOT_FOUND);
        }
    }

    @Override
    public TenantEntry get(String tenantId) {
        return new TenantEntry(tenantId, copyOf(requireTenant(tenantId).config()));
    }

    @Override
    public void delete(String tenantId) {
        if (tenants.remove(tenantId) == null) {
            throw ControllerException.notFound(TENANT_NOT_FOUND);
        }
        log.info("Removed tenant {}", tenantId);
    }

    @Override
    public void setVersion(String tenantId, Version version) {
        if (version.service() == null || version.service().isBlank()) {
            throw ControllerException.invalidRule(INVALID_SERVICE);
        }
        requireTenant(tenantId).versions().put(version.service(), copyOf(version));
    }

    @Override
    public Version getVersion(String tenantId, String service) {
        Version version = requireTenant(tenantId).versions().get(service);
        if (version == null) {
            throw ControllerException.notFound(VERSION_NOT_FOUND);
        }
        return copyOf(version);
    }

    @Override
    public void deleteVersion(String tenantId, String service) {
        if (requireTenant(tenantId).versions().remove(service) == null) {
            throw ControllerException.notFound(VERSION_NOT_FOUND);
        }
    }

    private TenantRecord requireTenant(String tenantId) {
        TenantRecord record = tenants.get(tenantId);
        if (record == null) {
            throw ControllerException.notFound(TENANT_NOT_FOUND);
        }
        return record;
    }

    private ProxyConfig validated(TenantInfo tenantInfo) {
        if (tenantInfo.port() < 0 || tenantInfo.port() > MAX_PORT) {
            throw ControllerException.invalidRule(INVALID_PORT);
        }
        String loadBalance = tenantInfo.loadBalance();
        if (loadBalance != null
                && !loadBalance.isEmpty()
                && !loadBalanceModes.contains(loadBalance)) {
            throw ControllerException.invalidRule(INVALID_LOAD_BALANCE);
        }
        return copyOf(tenantInfo.toProxyConfig());
    }

    // JSON nodes are mutable, so nothing handed in or out may share them with stored state.
    private static ProxyConfig copyOf(ProxyConfig config) {
        return new ProxyConfig(
                copyOfNode(config.credentials()),
                config.loadBalance(),
                config.port(),
                config.reqTrackingHeader(),
                config.filters().stream().map(InMemoryConfigurationStore::copyOfNode).toList());
    }

    private static Version copyOf(Version version) {
        Map<String, JsonNode> attributes = new LinkedHashMap<>();
        version.attributes().forEach((name, value) -> attributes.put(name, copyOfNode(value)));
        return Version.of(version.service(), attributes);
    }

    private static JsonNode copyOfNode(JsonNode node) {
        return node == null ? null : node.deepCopy();
    }

    private record TenantRecord(ProxyConfig config, ConcurrentMap<String, Version> versions) {

        TenantRecord(ProxyConfig config) {
            this(config, new ConcurrentHashMap<>());
        }

        TenantRecord withConfig(ProxyConfig replacement) {
            return new TenantRecord(replacement, versions);
        }
    }
}
