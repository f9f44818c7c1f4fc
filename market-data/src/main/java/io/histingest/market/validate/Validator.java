package io.histingest.market.validate;

import io.histingest.market.model.CanonicalRecord;
import io.histingest.market.schema.SchemaRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a batch into valid records and violations. Stateless; the outcome for a record
 * does not depend on its neighbours.
 */
public class Validator {
    public static final String SCHEMA_MISMATCH = "schema_mismatch";

    private final SchemaRules rules;

    public Validator(SchemaRules rules) {
        this.rules = rules;
    }

    public ValidationResult validate(List<? extends CanonicalRecord> batch, SchemaRef schema) {
        RuleSet ruleSet = rules.forSchema(schema.type());
        List<CanonicalRecord> valid = new ArrayList<>(batch.size());
        List<Violation> invalid = new ArrayList<>();
        for (CanonicalRecord r : batch) {
            Violation v = check(r, schema, ruleSet);
            if (v == null) valid.add(r);
            else invalid.add(v);
        }
        return new ValidationResult(valid, invalid);
    }

    private static Violation check(CanonicalRecord r, SchemaRef schema, RuleSet ruleSet) {
        if (r.schema() != schema.type()) {
            return new Violation(r, SCHEMA_MISMATCH, r.schema() + " record in a " + schema + " batch");
        }
        for (SchemaRule<?> rule : ruleSet.rules()) {
            if (!rule.test(r)) return new Violation(r, rule.id(), rule.description());
        }
        return null;
    }
}
