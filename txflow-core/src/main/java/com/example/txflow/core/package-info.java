/**
 * Root package for the txflow library.
 *
 * <p>This package holds the transaction protocol shared by both concurrency idioms, and the pool
 * and handle contracts every other package builds on.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.txflow.core.TransactionFlow} – the transaction protocol, implemented
 *       once over an abstract {@link com.example.txflow.core.TransactionSteps} sequence.
 *   <li>{@link com.example.txflow.core.TransactionException} – the single error shape of a failed
 *       run, with its {@link com.example.txflow.core.TransactionState} snapshot.
 *   <li>{@link com.example.txflow.core.ConnectionPool} and {@link
 *       com.example.txflow.core.PooledHandle} – exclusively leased sessions and their release or
 *       destroy disposition.
 *   <li>{@link com.example.txflow.core.Row} – immutable result row.
 *   <li>{@link com.example.txflow.core.jdbc.TransactionExecutor} – blocking idiom.
 *   <li>{@link com.example.txflow.core.reactive.ReactiveTransactionExecutor} – non-blocking
 *       idiom, {@code Mono} or single terminal callback.
 *   <li>{@link com.example.txflow.core.stream.RowStreamIterator} – backpressured row iteration.
 *   <li>{@link com.example.txflow.core.jdbc.DbClient} – start/stop lifecycle over one pool.
 * </ul>
 */
package com.example.txflow.core;
