package io.intellixity.folio.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Remote create/update capability. {@code properties} uses the partial-update wire shape
 * {@code {"<name>": {"<type-tag>": <payload>}}}. Every operation returns the record as stored.
 */
public interface RecordStore {
  RawRecord create(CollectionRef collection, ObjectNode properties);

  RawRecord update(String recordId, ObjectNode properties);

  RawRecord retrieve(String recordId);

  RawRecord setArchived(String recordId, boolean archived);
}
