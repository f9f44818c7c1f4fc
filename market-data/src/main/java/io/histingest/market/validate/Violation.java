package io.histingest.market.validate;

import io.histingest.market.model.CanonicalRecord;

/**
 * @param ruleId id of the first rule the record failed
 */
public record Violation(CanonicalRecord record, String ruleId, String message) {
}
