/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cooperative cancellation signal shared between the caller of a request
 * and the code executing it.
 * <p>
 * The caller keeps the token and calls {@link #cancel()}; blocking code
 * either polls {@link #isCancellationRequested()} or {@link #register(Runnable)
 * registers} a callback that unblocks it. Cancellation is one-way and
 * permanent.
 */
public final class CancellationToken {
	private static final Logger LOG = LoggerFactory
			.getLogger(CancellationToken.class);

	/** A token that is never cancelled. */
	public static final CancellationToken NONE = new CancellationToken(false);

	private final boolean cancellable;

	private final List<Runnable> callbacks = new ArrayList<>();

	private volatile boolean cancelled;

	/**
	 * Create a new token that has not been cancelled.
	 */
	public CancellationToken() {
		this(true);
	}

	private CancellationToken(boolean cancellable) {
		this.cancellable = cancellable;
	}

	/**
	 * Request cancellation and run every registered callback once.
	 *
	 * @throws UnsupportedOperationException
	 *             if called on {@link #NONE}
	 */
	public void cancel() {
		if (!cancellable) {
			throw new UnsupportedOperationException();
		}
		List<Runnable> toRun;
		synchronized (callbacks) {
			if (cancelled) {
				return;
			}
			cancelled = true;
			toRun = new ArrayList<>(callbacks);
			callbacks.clear();
		}
		for (Runnable r : toRun) {
			runCallback(r);
		}
	}

	/**
	 * @return whether {@link #cancel()} has been called
	 */
	public boolean isCancellationRequested() {
		return cancelled;
	}

	/**
	 * Throw if cancellation was requested.
	 *
	 * @throws CancellationException
	 *             if {@link #cancel()} has been called
	 */
	public void throwIfCancellationRequested() throws CancellationException {
		if (cancelled) {
			throw new CancellationException();
		}
	}

	/**
	 * Register a callback to run when the token is cancelled. If the token
	 * is already cancelled the callback runs immediately on the calling
	 * thread.
	 *
	 * @param callback
	 *            action to run on cancellation; must not block
	 * @return a registration whose {@code close()} removes the callback
	 */
	public Registration register(Runnable callback) {
		if (!cancellable) {
			return () -> {
				// nothing was registered
			};
		}
		synchronized (callbacks) {
			if (!cancelled) {
				callbacks.add(callback);
				return () -> {
					synchronized (callbacks) {
						callbacks.remove(callback);
					}
				};
			}
		}
		runCallback(callback);
		return () -> {
			// already ran
		};
	}

	private static void runCallback(Runnable r) {
		try {
			r.run();
		} catch (RuntimeException e) {
			LOG.warn("Cancellation callback failed", e); //$NON-NLS-1$
		}
	}

	/**
	 * Handle for a registered cancellation callback.
	 */
	@FunctionalInterface
	public interface Registration extends AutoCloseable {
		/**
		 * Remove the callback; has no effect once the token was cancelled.
		 */
		@Override
		void close();
	}
}
