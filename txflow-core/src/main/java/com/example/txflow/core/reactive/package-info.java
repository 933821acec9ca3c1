/**
 * Non-blocking transaction idiom on Project Reactor.
 *
 * <p>{@link com.example.txflow.core.reactive.OffloadingReactivePool} adapts a blocking {@link
 * com.example.txflow.core.ConnectionPool} by running each driver call on a {@link
 * reactor.core.scheduler.Scheduler}.
 */
package com.example.txflow.core.reactive;
