package io.intellixity.folio.exec;

import java.util.Objects;

/** Opaque reference to a remote collection (database id). */
public record CollectionRef(String id) {
  public CollectionRef {
    Objects.requireNonNull(id, "id");
    if (id.isBlank()) throw new IllegalArgumentException("collection id must not be blank");
  }

  public static CollectionRef of(String id) {
    return new CollectionRef(id);
  }

  @Override
  public String toString() {
    return id;
  }
}
