package com.example.txflow.core.stream;

/**
 * Push-style streaming query result with manual flow control.
 *
 * <p>After {@link #start(RowListener)} the source delivers rows until it is {@linkplain #pause()
 * paused}, and continues once {@linkplain #resume() resumed}. A paused source delivers nothing.
 * Exactly one terminal event ({@link RowListener#onEnd()} or {@link RowListener#onError}) ends
 * the stream.
 */
public interface RowEventSource {

  /**
   * Sends the query and starts delivering events to {@code listener}. Events may be delivered on
   * the calling thread before this method returns.
   *
   * @param listener event receiver
   * @throws IllegalStateException if the source was already started
   */
  void start(RowListener listener);

  /** Stops row delivery until {@link #resume()}. */
  void pause();

  /** Continues row delivery. */
  void resume();
}
