package io.histingest.market.transform;

import io.histingest.core.Result;
import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.model.RawRecord;
import io.histingest.market.schema.SchemaRef;

/**
 * Maps a provider record to its canonical form. Pure and total: malformed input comes back as a
 * {@link io.histingest.core.ErrorKind#TRANSFORM} error, never as an exception.
 */
@FunctionalInterface
public interface RecordTransformer {
    Result<CanonicalRecord> transform(RawRecord raw, SchemaRef schema);
}
