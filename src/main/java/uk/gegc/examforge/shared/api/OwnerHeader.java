package uk.gegc.examforge.shared.api;

/**
 * The upstream gateway authenticates callers and forwards their opaque id in this header.
 */
public final class OwnerHeader {

    public static final String NAME = "X-Owner-Id";

    private OwnerHeader() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
