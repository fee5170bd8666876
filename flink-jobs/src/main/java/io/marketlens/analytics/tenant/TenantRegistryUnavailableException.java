package io.marketlens.analytics.tenant;

/**
 * The connection registry could not be consulted; no tenant can be resolved safely.
 */
public class TenantRegistryUnavailableException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public TenantRegistryUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
