package com.example.txflow.core.reactive;

import com.example.txflow.core.Row;
import java.util.List;
import reactor.core.publisher.Mono;

/**
 * What a {@link ReactiveUnitOfWork} sees: a query executor bound to the transaction's handle,
 * plus the raw handle. The executor owns BEGIN, COMMIT, ROLLBACK and disposal.
 */
public final class ReactiveSession {

  private final ReactiveHandle handle;

  ReactiveSession(final ReactiveHandle handle) {
    this.handle = handle;
  }

  public Mono<List<Row>> query(final String sql, final Object... params) {
    return handle.query(sql, params);
  }

  public Mono<Integer> update(final String sql, final Object... params) {
    return handle.update(sql, params);
  }

  public ReactiveHandle handle() {
    return handle;
  }
}
