package com.keystone.security.authn;

import com.keystone.security.AccessDeniedException;
import com.keystone.security.DenialReason;
import com.keystone.security.InvalidCredentialException;
import com.keystone.security.Principal;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a delegate authenticator (for example one that fetches keys from a remote service) with an
 * upper bound on how long verification may take. Verification that does not finish in time is
 * denied as {@link DenialReason#UNAUTHENTICATED}.
 */
public final class TimeBoundedTokenAuthenticator implements TokenAuthenticator {

    private static final Logger log = LoggerFactory.getLogger(TimeBoundedTokenAuthenticator.class);

    private final TokenAuthenticator delegate;
    private final Duration timeout;
    private final ExecutorService executor;

    public TimeBoundedTokenAuthenticator(TokenAuthenticator delegate, Duration timeout, ExecutorService executor) {
        if (delegate == null || timeout == null || executor == null) {
            throw new IllegalArgumentException("delegate, timeout and executor must not be null");
        }
        this.delegate = delegate;
        this.timeout = timeout;
        this.executor = executor;
    }

    @Override
    public Principal authenticate(String token) {
        Future<Principal> future = executor.submit(() -> delegate.authenticate(token));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Credential verification timed out after {} ms", timeout.toMillis());
            throw new AccessDeniedException(DenialReason.UNAUTHENTICATED,
                    "Credential verification timed out");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AccessDeniedException(DenialReason.UNAUTHENTICATED,
                    "Credential verification interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new InvalidCredentialException("Credential verification failed", cause);
        }
    }
}
