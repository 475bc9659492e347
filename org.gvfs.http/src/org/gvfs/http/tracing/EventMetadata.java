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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ordered key/value payload of a traced event.
 * <p>
 * Not thread safe; a record is filled by one thread and then handed to a
 * {@link Tracer}.
 */
public class EventMetadata {
	private final Map<String, Object> values = new LinkedHashMap<>();

	/**
	 * Add or replace a value.
	 *
	 * @param key
	 *            name of the value
	 * @param value
	 *            the value; {@link Throwable}s are kept as is and rendered by
	 *            the tracer
	 * @return {@code this}
	 */
	public EventMetadata add(String key, Object value) {
		values.put(key, value);
		return this;
	}

	/**
	 * @param key
	 *            name of the value
	 * @return the value, or {@code null} if absent
	 */
	public Object get(String key) {
		return values.get(key);
	}

	/**
	 * @param key
	 *            name of the value
	 * @return whether a value was added under {@code key}
	 */
	public boolean containsKey(String key) {
		return values.containsKey(key);
	}

	/**
	 * @return unmodifiable view of all values in insertion order
	 */
	public Map<String, Object> asMap() {
		return Collections.unmodifiableMap(values);
	}

	@Override
	public String toString() {
		return values.toString();
	}
}
