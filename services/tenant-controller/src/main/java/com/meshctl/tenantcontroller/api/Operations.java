package com.meshctl.tenantcontroller.api;

/** Operation names used as metric keys for the API routes. */
public final class Operations {

    public static final String TENANTS_CREATE = "tenants_create";
    public static final String TENANTS_UPDATE = "tenants_update";
    public static final String TENANTS_READ = "tenants_read";
    public static final String TENANTS_DELETE = "tenants_delete";

    /** Shared by set and delete: both mutate the version record. */
    public static final String VERSIONS_UPDATE = "versions_update";

    public static final String VERSIONS_READ = "versions_read";

    private Operations() {
        // constants
    }
}
