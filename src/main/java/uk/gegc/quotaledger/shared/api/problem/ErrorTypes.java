package uk.gegc.quotaledger.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 Problem Detail type URIs returned by the quota API.
 *
 * @see ProblemDetailBuilder
 * @see <a href="https://www.rfc-editor.org/rfc/rfc7807">RFC 7807</a>
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://quota-ledger.gegc.uk/docs/errors";

    // ==================== Resource Errors ====================
    public static final URI USAGE_SESSION_NOT_FOUND = URI.create(BASE_URL + "/usage-session-not-found");

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI TYPE_MISMATCH = URI.create(BASE_URL + "/type-mismatch");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");

    // ==================== Quota Errors ====================
    public static final URI INSUFFICIENT_QUOTA = URI.create(BASE_URL + "/insufficient-quota");
    public static final URI INVALID_QUOTA_REQUEST = URI.create(BASE_URL + "/invalid-quota-request");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");

    // ==================== Server Errors ====================
    public static final URI STORAGE_ERROR = URI.create(BASE_URL + "/storage-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
