package warden.core.model.identity;

/**
 * Source of a client identity key.
 */
public enum IdentityKind {
    /** Authenticated user id. */
    USER,
    /** Client IP address. */
    IP
}
