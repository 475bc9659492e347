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

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

/**
 * {@link Tracer} writing every event as one JSON object to SLF4J.
 * <p>
 * The log line is {@code <eventName> <json>}. Errors are logged at
 * {@code ERROR} with the message added to the payload under
 * {@code "ErrorMessage"}.
 */
public class Slf4jTracer implements Tracer {

	private static final String ERROR_MESSAGE = "ErrorMessage"; //$NON-NLS-1$

	private static final String ERROR_EVENT = "Error"; //$NON-NLS-1$

	private static final Gson GSON = new GsonBuilder()
			.registerTypeHierarchyAdapter(Throwable.class,
					new ThrowableAdapter())
			.serializeNulls().disableHtmlEscaping().create();

	private final Logger log;

	/**
	 * Create a tracer logging to the logger of this class.
	 */
	public Slf4jTracer() {
		this(LoggerFactory.getLogger(Slf4jTracer.class));
	}

	/**
	 * Create a tracer logging to the given logger.
	 *
	 * @param log
	 *            the target logger
	 */
	public Slf4jTracer(Logger log) {
		this.log = log;
	}

	@Override
	public void relatedEvent(EventLevel level, String eventName,
			EventMetadata metadata) {
		switch (level) {
		case LOG_ALWAYS:
		case INFORMATIONAL:
			if (log.isInfoEnabled()) {
				log.info("{} {}", eventName, toJson(metadata)); //$NON-NLS-1$
			}
			break;
		case ERROR:
			if (log.isErrorEnabled()) {
				log.error("{} {}", eventName, toJson(metadata)); //$NON-NLS-1$
			}
			break;
		case WARNING:
			if (log.isWarnEnabled()) {
				log.warn("{} {}", eventName, toJson(metadata)); //$NON-NLS-1$
			}
			break;
		case VERBOSE:
		default:
			if (log.isDebugEnabled()) {
				log.debug("{} {}", eventName, toJson(metadata)); //$NON-NLS-1$
			}
			break;
		}
	}

	@Override
	public void relatedError(EventMetadata metadata, String message) {
		if (log.isErrorEnabled()) {
			EventMetadata copy = new EventMetadata();
			metadata.asMap().forEach(copy::add);
			copy.add(ERROR_MESSAGE, message);
			log.error("{} {}", ERROR_EVENT, toJson(copy)); //$NON-NLS-1$
		}
	}

	/**
	 * Render a payload the way it is logged.
	 *
	 * @param metadata
	 *            payload to render
	 * @return a JSON object
	 */
	public static String toJson(EventMetadata metadata) {
		return GSON.toJson(metadata.asMap());
	}

	private static class ThrowableAdapter extends TypeAdapter<Throwable> {
		@Override
		public void write(JsonWriter out, Throwable value) throws IOException {
			if (value == null) {
				out.nullValue();
			} else {
				out.value(value.toString());
			}
		}

		@Override
		public Throwable read(JsonReader in) {
			throw new UnsupportedOperationException();
		}
	}
}
