package io.histingest.market.storage;

import io.histingest.core.Result;
import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.schema.SchemaRef;

import java.util.List;

/**
 * Persists validated records. Storing the same records again leaves the store unchanged.
 * Failures come back as {@code STORAGE_TRANSIENT} or {@code STORAGE_PERMANENT} errors; a failed
 * call writes nothing.
 */
public interface StorageLoader {
    Result<StoreCounts> store(List<CanonicalRecord> records, SchemaRef schema);
}
