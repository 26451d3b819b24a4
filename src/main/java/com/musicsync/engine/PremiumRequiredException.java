package com.musicsync.engine;

/**
 * The remote operation is blocked by the account tier.
 */
public class PremiumRequiredException extends SyncException {
    public PremiumRequiredException(String message) {
        super(ErrorKind.PREMIUM_REQUIRED, message);
    }

    public PremiumRequiredException(String message, Throwable cause) {
        super(ErrorKind.PREMIUM_REQUIRED, message, cause);
    }
}
