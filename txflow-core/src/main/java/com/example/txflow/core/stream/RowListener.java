package com.example.txflow.core.stream;

import com.example.txflow.core.Row;

/** Receives the events of a {@link RowEventSource}. */
public interface RowListener {

  /** A row arrived. */
  void onRow(Row row);

  /** The query failed; no further events follow. */
  void onError(Throwable error);

  /** The result was read to its end; no further events follow. */
  void onEnd();
}
