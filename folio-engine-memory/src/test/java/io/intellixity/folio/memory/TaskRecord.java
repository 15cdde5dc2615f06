package io.intellixity.folio.memory;

import io.intellixity.folio.binding.PropertyAccessor;
import io.intellixity.folio.record.PageRecord;
import io.intellixity.folio.record.RecordContext;
import io.intellixity.folio.record.RecordType;
import io.intellixity.folio.schema.DateRange;

import java.util.List;

final class TaskRecord extends PageRecord {
  static final PropertyAccessor<String> NAME = PropertyAccessor.text("Name");
  static final PropertyAccessor<String> PRIORITY = PropertyAccessor.option("Priority");
  static final PropertyAccessor<DateRange> DUE = PropertyAccessor.date("Due Date");
  static final PropertyAccessor<Number> ESTIMATE = PropertyAccessor.number("Estimate");
  static final PropertyAccessor<List<String>> TAGS = PropertyAccessor.list("Tags");
  static final PropertyAccessor<Boolean> DONE = PropertyAccessor.checkbox("Done");

  static final RecordType<TaskRecord> TYPE = RecordType.builder("tasks", TaskRecord::new)
      .property(NAME, "title")
      .property(PRIORITY, "select", "High", "Low")
      .property(DUE, "date")
      .property(ESTIMATE, "number")
      .property(TAGS, "multi_select")
      .property(DONE, "checkbox")
      .property(PropertyAccessor.timestamp("Created"), "created_time")
      .build();

  TaskRecord(RecordContext ctx) {
    super(ctx);
  }

  String name() { return get(NAME); }
}
