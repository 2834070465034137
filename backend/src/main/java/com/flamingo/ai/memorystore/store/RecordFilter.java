package com.flamingo.ai.memorystore.store;

import com.flamingo.ai.memorystore.domain.enums.RecordField;
import com.flamingo.ai.memorystore.domain.record.VectorRecord;
import java.util.List;
import java.util.Objects;

/**
 * Predicate over record attributes, composed at query time. In-memory stores evaluate it with
 * {@link #matches(VectorRecord)}; other stores translate the tree into their own query language.
 */
public sealed interface RecordFilter
    permits RecordFilter.All, RecordFilter.FieldEquals, RecordFilter.And, RecordFilter.Or {

  boolean matches(VectorRecord<?> record);

  static RecordFilter all() {
    return All.INSTANCE;
  }

  static RecordFilter eq(RecordField field, String value) {
    return new FieldEquals(field, value);
  }

  static RecordFilter and(RecordFilter... filters) {
    return new And(List.of(filters));
  }

  static RecordFilter or(RecordFilter... filters) {
    return new Or(List.of(filters));
  }

  /** Matches every record. */
  final class All implements RecordFilter {
    private static final All INSTANCE = new All();

    private All() {}

    @Override
    public boolean matches(VectorRecord<?> record) {
      return true;
    }

    @Override
    public String toString() {
      return "all";
    }
  }

  /** Matches records whose attribute equals the value exactly. */
  record FieldEquals(RecordField field, String value) implements RecordFilter {
    public FieldEquals {
      Objects.requireNonNull(field, "field");
      Objects.requireNonNull(value, "value");
    }

    @Override
    public boolean matches(VectorRecord<?> record) {
      return value.equals(record.attribute(field));
    }

    @Override
    public String toString() {
      return field.getFieldName() + "=" + value;
    }
  }

  /** Matches records that satisfy every operand. */
  record And(List<RecordFilter> operands) implements RecordFilter {
    @Override
    public boolean matches(VectorRecord<?> record) {
      return operands.stream().allMatch(f -> f.matches(record));
    }

    @Override
    public String toString() {
      return operands.toString().replace(", ", " AND ");
    }
  }

  /** Matches records that satisfy at least one operand. */
  record Or(List<RecordFilter> operands) implements RecordFilter {
    @Override
    public boolean matches(VectorRecord<?> record) {
      return operands.stream().anyMatch(f -> f.matches(record));
    }

    @Override
    public String toString() {
      return operands.toString().replace(", ", " OR ");
    }
  }
}
