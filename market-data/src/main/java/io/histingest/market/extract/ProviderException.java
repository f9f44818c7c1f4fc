package io.histingest.market.extract;

import io.histingest.core.ErrorKind;
import io.histingest.core.PipelineException;

/**
 * Failure reported by an {@link Extractor}. Transient failures (timeouts, rate limits, dropped
 * connections) may succeed on retry; permanent ones (unknown symbol, unavailable dataset) never will.
 */
public class ProviderException extends PipelineException {

    private ProviderException(ErrorKind kind, String code, String message, String remediation, Throwable cause) {
        super(kind, code, message, remediation, cause);
    }

    public static ProviderException transientFailure(String code, String message, Throwable cause) {
        return new ProviderException(ErrorKind.PROVIDER_TRANSIENT, code, message, null, cause);
    }

    public static ProviderException permanentFailure(String code, String message, String remediation) {
        return new ProviderException(ErrorKind.PROVIDER_PERMANENT, code, message, remediation, null);
    }

    public boolean isTransient() { return kind().isTransient(); }
}
