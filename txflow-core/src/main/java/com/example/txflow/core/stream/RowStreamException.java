package com.example.txflow.core.stream;

/** Unchecked carrier for a checked driver error raised while streaming rows. */
public final class RowStreamException extends RuntimeException {

  public RowStreamException(final Throwable cause) {
    super(cause.getMessage(), cause);
  }
}
