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

import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting gate bounding the number of HTTP attempts in flight.
 * <p>
 * One instance is meant to be shared by every
 * {@link org.gvfs.http.HttpRequestor} of a process (see
 * {@link #getDefault()}), so the bound applies to the total outbound fan-out
 * no matter how many requestors exist. The throttle is still passed to each
 * requestor explicitly; tests and embedders may use private instances.
 * <p>
 * The number of available slots always stays within {@code [0, capacity]}.
 */
public class ConnectionThrottle {

	private static final class DefaultHolder {
		static final ConnectionThrottle INSTANCE = new ConnectionThrottle(
				Runtime.getRuntime().availableProcessors());
	}

	/**
	 * Get the process-wide throttle, sized to the number of available
	 * processors when first used.
	 *
	 * @return the process-wide throttle
	 */
	public static ConnectionThrottle getDefault() {
		return DefaultHolder.INSTANCE;
	}

	private final int capacity;

	private final ReentrantLock lock = new ReentrantLock();

	private final Condition changed = lock.newCondition();

	private int available;

	/**
	 * Create a throttle with all slots available.
	 *
	 * @param capacity
	 *            maximum number of concurrently held slots; must be positive
	 */
	public ConnectionThrottle(int capacity) {
		if (capacity <= 0) {
			throw new IllegalArgumentException(String.valueOf(capacity));
		}
		this.capacity = capacity;
		this.available = capacity;
	}

	/**
	 * @return the maximum number of slots
	 */
	public int getCapacity() {
		return capacity;
	}

	/**
	 * @return the number of slots currently free; a snapshot only
	 */
	public int getAvailableSlots() {
		lock.lock();
		try {
			return available;
		} finally {
			lock.unlock();
		}
	}

	/**
	 * Take one slot, waiting as long as necessary.
	 *
	 * @param token
	 *            cancels the wait; no slot is held when the wait is cancelled
	 * @throws CancellationException
	 *             if {@code token} was cancelled before a slot was obtained,
	 *             or the waiting thread was interrupted
	 */
	public void acquire(CancellationToken token) throws CancellationException {
		token.throwIfCancellationRequested();
		try (CancellationToken.Registration r = token.register(this::wakeUp)) {
			lock.lock();
			try {
				while (available == 0) {
					token.throwIfCancellationRequested();
					changed.await();
				}
				// A slot is free; a concurrent cancel loses to it.
				available--;
			} finally {
				lock.unlock();
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			CancellationException ce = new CancellationException();
			ce.initCause(e);
			throw ce;
		}
	}

	/**
	 * Return one slot. Never blocks; releasing more slots than were acquired
	 * leaves the throttle at capacity.
	 */
	public void release() {
		lock.lock();
		try {
			if (available < capacity) {
				available++;
			}
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}

	private void wakeUp() {
		lock.lock();
		try {
			changed.signalAll();
		} finally {
			lock.unlock();
		}
	}
}
