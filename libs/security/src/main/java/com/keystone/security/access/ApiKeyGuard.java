package com.keystone.security.access;

import com.keystone.security.DenialReason;
import com.keystone.security.SecurityHeaders;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Optional;

/**
 * Requires the internal API key on operations flagged {@link OperationPolicy#apiKeyRequired()}.
 * Keys are compared in constant time. Without a configured key every such operation is denied.
 */
public final class ApiKeyGuard implements AccessGuard {

    private final byte[] expectedKey;

    /**
     * @param expectedKey the configured internal key, null if none
     */
    public ApiKeyGuard(String expectedKey) {
        this.expectedKey = expectedKey == null ? null : expectedKey.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String name() {
        return "api-key";
    }

    @Override
    public GuardVerdict evaluate(AccessRequest request) {
        if (!request.policy().apiKeyRequired()) {
            return GuardVerdict.skip();
        }
        Optional<String> presented = request.request().header(SecurityHeaders.API_KEY);
        if (presented.isEmpty()) {
            return GuardVerdict.deny(DenialReason.UNAUTHENTICATED, "API key is required");
        }
        if (expectedKey == null
                || !MessageDigest.isEqual(expectedKey, presented.get().getBytes(StandardCharsets.UTF_8))) {
            return GuardVerdict.deny(DenialReason.UNAUTHENTICATED, "Invalid API key");
        }
        return GuardVerdict.allow();
    }
}
