package agora.market.exception;

/**
 * Failure categories. The HTTP layer maps each to a status code.
 */
public enum ErrorKind {
    /** Bad input; nothing was mutated */
    VALIDATION,

    /** Referenced entity does not exist */
    NOT_FOUND,

    /** Valid input rejected by a business rule */
    BUSINESS_RULE,

    /** Ledger integrity check failed */
    INVARIANT,

    /** An external collaborator failed */
    COLLABORATOR,

    /** Persistence failed; in-memory state was rolled back */
    STORAGE
}
