package io.histingest.market.validate;

import io.histingest.market.model.CanonicalRecord;

import java.util.List;

/**
 * Partition of a batch: every input record lands in exactly one list, in input order.
 */
public record ValidationResult(List<CanonicalRecord> valid, List<Violation> invalid) {
    public ValidationResult {
        valid = List.copyOf(valid);
        invalid = List.copyOf(invalid);
    }

    public int size() { return valid.size() + invalid.size(); }
}
