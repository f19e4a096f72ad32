package com.keystone.tenantapi.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.keystone.context.ContextHandle;
import com.keystone.context.RequestContextHolder;
import com.keystone.persistence.DuplicateRecordException;
import com.keystone.persistence.OptimisticConflictException;
import com.keystone.persistence.RecordNotFoundException;
import com.keystone.persistence.TenantScopeViolationException;
import com.keystone.persistence.UnavailableException;
import com.keystone.security.AccessDeniedException;
import com.keystone.security.DenialReason;
import com.keystone.security.InvalidCredentialException;
import com.keystone.security.TenantMismatchException;
import com.keystone.security.tenant.TenantLookupException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Nested
    @DisplayName("access denials")
    class Denials {

        @Test
        @DisplayName("maps a rejected credential to 401")
        void invalidCredentialIs401() {
            ProblemDetail result = handler.handleInvalidCredential(new InvalidCredentialException("token expired"));

            assertThat(result.getStatus()).isEqualTo(401);
            assertThat(result.getProperties()).containsEntry("reason", "unauthenticated");
        }

        @ParameterizedTest
        @EnumSource(value = DenialReason.class, names = {"UNAUTHENTICATED", "TENANT_REQUIRED"})
        @DisplayName("maps missing identity to 401")
        void missingIdentityIs401(DenialReason reason) {
            ProblemDetail result = handler.handleAccessDenied(new AccessDeniedException(reason, "denied"));

            assertThat(result.getStatus()).isEqualTo(401);
            assertThat(result.getProperties()).containsEntry("reason", reason.code());
        }

        @ParameterizedTest
        @EnumSource(value = DenialReason.class, names = {"TENANT_INACTIVE", "INSUFFICIENT_ROLE", "INSUFFICIENT_PERMISSION"})
        @DisplayName("maps a known but unauthorised caller to 403")
        void unauthorisedIs403(DenialReason reason) {
            ProblemDetail result = handler.handleAccessDenied(new AccessDeniedException(reason, "denied"));

            assertThat(result.getStatus()).isEqualTo(403);
            assertThat(result.getProperties()).containsEntry("reason", reason.code());
        }

        @Test
        @DisplayName("maps a tenant mismatch to 403 without echoing either tenant id")
        void tenantMismatchIs403() {
            ProblemDetail result = handler.handleTenantMismatch(new TenantMismatchException("t1", "t2"));

            assertThat(result.getStatus()).isEqualTo(403);
            assertThat(result.getProperties()).containsEntry("reason", "tenant_mismatch");
            assertThat(result.getDetail()).doesNotContain("t1").doesNotContain("t2");
        }
    }

    @Nested
    @DisplayName("data errors")
    class DataErrors {

        @Test
        @DisplayName("maps a stale version to 409 with the current version")
        void conflictIs409() {
            ProblemDetail result = handler.handleConflict(new OptimisticConflictException("User", "u-1", 1, 3));

            assertThat(result.getStatus()).isEqualTo(409);
            assertThat(result.getProperties()).containsEntry("currentVersion", 3L);
        }

        @Test
        @DisplayName("maps a duplicate to 409")
        void duplicateIs409() {
            ProblemDetail result = handler.handleDuplicate(new DuplicateRecordException("User", "email", "a@b.c"));

            assertThat(result.getStatus()).isEqualTo(409);
        }

        @Test
        @DisplayName("maps a missing record to 404")
        void notFoundIs404() {
            ProblemDetail result = handler.handleNotFound(new RecordNotFoundException("User", "u-9"));

            assertThat(result.getStatus()).isEqualTo(404);
        }

        @Test
        @DisplayName("maps an unavailable store or directory to 503, never a denial")
        void unavailableIs503() {
            ProblemDetail store = handler.handleUnavailable(
                    new UnavailableException("store down", new IllegalStateException("connection refused")));
            ProblemDetail directory = handler.handleUnavailable(new TenantLookupException("timed out"));

            assertThat(store.getStatus()).isEqualTo(503);
            assertThat(directory.getStatus()).isEqualTo(503);
            assertThat(store.getProperties()).doesNotContainKey("reason");
        }

        @Test
        @DisplayName("maps a scope violation to 500 without leaking its message")
        void scopeViolationIs500() {
            ProblemDetail result = handler.handleScopeViolation(
                    new TenantScopeViolationException("User", "User read without a resolved tenant"));

            assertThat(result.getStatus()).isEqualTo(500);
            assertThat(result.getDetail()).doesNotContain("User");
        }
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Test
    @DisplayName("keeps the status of Spring's own error responses")
    void keepsErrorResponseStatus() {
        ProblemDetail result = handler.handleErrorResponse(new NoResourceFoundException(HttpMethod.GET, "missing"));

        assertThat(result.getStatus()).isEqualTo(HttpStatus.NOT_FOUND.value());
    }

    @Test
    @DisplayName("maps generic Exception to 500 Internal Server Error")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("something broke"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getTitle()).isEqualTo("Internal Server Error");
        assertThat(result.getDetail()).doesNotContain("something broke");
    }

    @Test
    @DisplayName("error response includes timestamp and the request id of the active context")
    void errorResponseIncludesRequestId() {
        ProblemDetail result;
        try (ContextHandle ignored = RequestContextHolder.begin("req-42")) {
            result = handler.handleGeneric(new RuntimeException("oops"));
        }

        assertThat(result.getProperties()).containsKey("timestamp").containsEntry("requestId", "req-42");
    }
}
