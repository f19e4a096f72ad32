package com.keystone.security.testing;

import com.keystone.security.Principal;
import com.keystone.security.SystemRole;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ready-made {@link Principal}s for tests.
 *
 * <p>Lives in the main source set so other modules can use it through a regular dependency.
 */
public final class TestPrincipals {

    public static final String DEFAULT_TENANT = "test-tenant-001";
    public static final String DEFAULT_USER = "test-user-001";

    private TestPrincipals() {
        // utility class
    }

    /** A {@code user} of the default tenant. */
    public static Principal create() {
        return create(DEFAULT_USER, DEFAULT_TENANT, SystemRole.USER.value());
    }

    public static Principal forTenant(String tenantId, String... roles) {
        return create(DEFAULT_USER, tenantId, roles);
    }

    public static Principal withRoles(SystemRole... roles) {
        return create(DEFAULT_USER, DEFAULT_TENANT,
                Arrays.stream(roles).map(SystemRole::value).toArray(String[]::new));
    }

    public static Principal create(String principalId, String tenantId, String... roles) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        Set<String> roleSet = Arrays.stream(roles).collect(Collectors.toSet());
        return new Principal(principalId, tenantId, roleSet, now, now.plus(1, ChronoUnit.HOURS));
    }
}
