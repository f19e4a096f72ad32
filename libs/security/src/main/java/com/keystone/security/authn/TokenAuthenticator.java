package com.keystone.security.authn;

import com.keystone.security.InvalidCredentialException;
import com.keystone.security.Principal;

/** Turns a bearer credential into a {@link Principal}. */
@FunctionalInterface
public interface TokenAuthenticator {

    /**
     * @param token the raw bearer credential
     * @return the authenticated principal, never partially populated
     * @throws InvalidCredentialException if the credential is not valid
     */
    Principal authenticate(String token);
}
