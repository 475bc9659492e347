/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http.tracing;

/**
 * Sink for structured events emitted by the request layer.
 * <p>
 * Implementations must be thread safe; events are emitted concurrently by
 * independent request attempts.
 */
public interface Tracer {

	/**
	 * Record an event.
	 *
	 * @param level
	 *            severity
	 * @param eventName
	 *            stable name of the event, e.g. {@code NetworkResponse}
	 * @param metadata
	 *            payload of the event
	 */
	void relatedEvent(EventLevel level, String eventName,
			EventMetadata metadata);

	/**
	 * Record an error.
	 *
	 * @param metadata
	 *            payload of the event
	 * @param message
	 *            human readable description
	 */
	void relatedError(EventMetadata metadata, String message);

	/**
	 * Record an error without further payload.
	 *
	 * @param message
	 *            human readable description
	 */
	default void relatedError(String message) {
		relatedError(new EventMetadata(), message);
	}
}
