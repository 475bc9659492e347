/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.junit;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.gvfs.http.tracing.EventLevel;
import org.gvfs.http.tracing.EventMetadata;
import org.gvfs.http.tracing.Tracer;

/**
 * Tracer keeping every event in memory.
 */
public class RecordingTracer implements Tracer {

	/**
	 * A recorded event or error.
	 */
	public static final class Event {
		/** Level of the event; {@link EventLevel#ERROR} for errors. */
		public final EventLevel level;

		/** Event name, or the message of an error. */
		public final String name;

		/** Payload of the event. */
		public final EventMetadata metadata;

		Event(EventLevel level, String name, EventMetadata metadata) {
			this.level = level;
			this.name = name;
			this.metadata = metadata;
		}

		@Override
		public String toString() {
			return level + " " + name + " " + metadata;
		}
	}

	private final List<Event> events = new ArrayList<>();

	private final List<Event> errors = new ArrayList<>();

	@Override
	public synchronized void relatedEvent(EventLevel level, String eventName,
			EventMetadata metadata) {
		events.add(new Event(level, eventName, metadata));
	}

	@Override
	public synchronized void relatedError(EventMetadata metadata,
			String message) {
		errors.add(new Event(EventLevel.ERROR, message, metadata));
	}

	/**
	 * @return all events, in order
	 */
	public synchronized List<Event> getEvents() {
		return new ArrayList<>(events);
	}

	/**
	 * @param name
	 *            event name
	 * @return the events with the given name, in order
	 */
	public synchronized List<Event> getEvents(String name) {
		return events.stream().filter(e -> e.name.equals(name))
				.collect(Collectors.toList());
	}

	/**
	 * @return all errors, in order
	 */
	public synchronized List<Event> getErrors() {
		return new ArrayList<>(errors);
	}
}
