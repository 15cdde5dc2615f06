package io.intellixity.folio.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Remote query capability. Implementations own transport, authentication, timeouts and retries;
 * any runtime exception they throw is reported to callers as a {@link RemoteFetchException}.
 */
public interface CollectionEndpoint {
  /**
   * Runs one page of a query.
   *
   * @param payload the compiled request ({@code filter}, {@code sorts}, {@code start_cursor}, {@code page_size})
   */
  PageResult query(CollectionRef collection, ObjectNode payload);
}
