package de.htwsaar.tierstore.engine.usage;

/**
 * Harte Grenzen, gegen die eine Reservierung atomar geprüft wird. 0 = unbegrenzt.
 */
public record UsageLimits(long maxBytes, long maxFiles, long maxTransferBytes, long maxRequests) {

    public static final UsageLimits NONE = new UsageLimits(0, 0, 0, 0);
}
