package io.histingest.market.transform;

/**
 * Raised by {@link FieldReader} for a missing or malformed field; converted to a result by the transformer.
 */
class FieldException extends RuntimeException {
    private final String code;

    FieldException(String code, String message) {
        super(message);
        this.code = code;
    }

    String code() { return code; }
}
