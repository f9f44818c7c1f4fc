package io.histingest.market.validate;

import io.histingest.market.model.CanonicalRecord;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * A named predicate over one record variant. The id doubles as the quarantine reason.
 */
public final class SchemaRule<R extends CanonicalRecord> {
    private final String id;
    private final String description;
    private final Class<R> type;
    private final Predicate<R> check;

    private SchemaRule(String id, String description, Class<R> type, Predicate<R> check) {
        this.id = Objects.requireNonNull(id, "id");
        this.description = description;
        this.type = Objects.requireNonNull(type, "type");
        this.check = Objects.requireNonNull(check, "check");
    }

    public static <R extends CanonicalRecord> SchemaRule<R> of(String id, String description, Class<R> type, Predicate<R> check) {
        return new SchemaRule<>(id, description, type, check);
    }

    public String id() { return id; }
    public String description() { return description; }

    /**
     * @return true when the record passes; records of another variant never pass
     */
    public boolean test(CanonicalRecord record) {
        if (!type.isInstance(record)) return false;
        return check.test(type.cast(record));
    }

    @Override
    public String toString() { return id; }
}
