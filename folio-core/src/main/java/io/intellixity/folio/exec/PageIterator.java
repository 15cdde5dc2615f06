package io.intellixity.folio.exec;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.query.Query;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pagination engine: a lazy, forward-only sequence over every page of a query.
 * <p>
 * Nothing is fetched until the first {@link #hasNext()}/{@link #next()}. Each batch is drained
 * before the next request is issued; follow-up requests carry the previous batch's cursor as
 * {@code start_cursor} and are otherwise identical. The sequence ends when the endpoint reports
 * no more pages or when {@code resultCap} records have been yielded; once the cap is reached no
 * further fetch happens, even if the current batch has more records.
 * <p>
 * Not restartable and not thread-safe. A failed fetch ends the sequence with a
 * {@link RemoteFetchException}; records already yielded are unaffected.
 */
public final class PageIterator<T> implements Iterator<T> {
  private static final Logger log = LoggerFactory.getLogger(PageIterator.class);

  public enum State { FETCHING, EXHAUSTED }

  private final CollectionEndpoint endpoint;
  private final CollectionRef collection;
  private final Query query;
  private final Integer resultCap;
  private final Function<RawRecord, T> mapper;

  private final Deque<RawRecord> buffer = new ArrayDeque<>();
  private State state = State.FETCHING;
  private String nextCursor;
  private int fetchCount;
  private long yieldedCount;

  public PageIterator(CollectionEndpoint endpoint,
                      CollectionRef collection,
                      Query query,
                      Integer resultCap,
                      Function<RawRecord, T> mapper) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.collection = Objects.requireNonNull(collection, "collection");
    this.query = Objects.requireNonNull(query, "query");
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    if (resultCap != null && resultCap <= 0) throw new IllegalArgumentException("resultCap must be > 0");
    this.resultCap = resultCap;
  }

  @Override
  public boolean hasNext() {
    if (capReached()) {
      if (state != State.EXHAUSTED) {
        log.debug("folio.page_cap collection={} cap={} fetches={}", collection, resultCap, fetchCount);
        state = State.EXHAUSTED;
        buffer.clear();
      }
      return false;
    }
    while (buffer.isEmpty() && state == State.FETCHING) {
      fetchNextBatch();
    }
    return !buffer.isEmpty();
  }

  @Override
  public T next() {
    if (!hasNext()) throw new NoSuchElementException();
    RawRecord raw = buffer.poll();
    yieldedCount++;
    return mapper.apply(raw);
  }

  public State state() { return state; }

  /** Number of endpoint calls issued so far. */
  public int fetchCount() { return fetchCount; }

  /** Number of records handed to the caller so far. */
  public long yieldedCount() { return yieldedCount; }

  /** Remaining elements as a sequential stream; consuming it advances this iterator. */
  public Stream<T> stream() {
    return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL), false);
  }

  /** Drains the remaining elements. */
  public List<T> toList() {
    List<T> out = new ArrayList<>();
    forEachRemaining(out::add);
    return out;
  }

  private boolean capReached() {
    return resultCap != null && yieldedCount >= resultCap;
  }

  private void fetchNextBatch() {
    Query request = (fetchCount == 0) ? query : query.withStartCursor(nextCursor);
    ObjectNode payload = request.toPayload();
    log.debug("folio.page_fetch collection={} page={} cursor={}", collection, fetchCount + 1, request.startCursor());

    PageResult page;
    try {
      page = endpoint.query(collection, payload);
    } catch (RuntimeException e) {
      state = State.EXHAUSTED;
      if (e instanceof RemoteFetchException rf) {
        throw new RemoteFetchException(rf.getMessage(), yieldedCount, rf.getCause());
      }
      throw new RemoteFetchException(
          "Fetching page " + (fetchCount + 1) + " of collection " + collection + " failed after "
              + yieldedCount + " records: " + e.getMessage(),
          yieldedCount, e);
    }
    fetchCount++;

    if (page == null) {
      state = State.EXHAUSTED;
      throw new RemoteFetchException("Endpoint returned no page for collection " + collection, yieldedCount, null);
    }

    buffer.addAll(page.records());
    log.debug("folio.page_done collection={} page={} batch={} hasMore={}",
        collection, fetchCount, page.records().size(), page.hasMore());

    if (!page.hasMore()) {
      state = State.EXHAUSTED;
    } else if (page.nextCursor() == null || page.nextCursor().isBlank()) {
      log.warn("folio.page_cursor_missing collection={} page={}; treating as last page", collection, fetchCount);
      state = State.EXHAUSTED;
    } else {
      nextCursor = page.nextCursor();
    }
  }
}
