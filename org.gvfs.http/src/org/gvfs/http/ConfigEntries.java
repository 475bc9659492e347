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

import java.text.MessageFormat;
import java.util.Locale;
import java.util.Map;

import org.gvfs.annotations.Nullable;
import org.gvfs.http.internal.HttpText;
import org.gvfs.util.StringUtils;

/**
 * Reads values out of a flat map of git config entries ("section.key" to
 * value). Section and key names are matched ignoring case, as git does. A
 * key mapped to {@code null} is a bare key, which git reads as boolean
 * {@code true}.
 */
final class ConfigEntries {
	private final Map<String, String> entries;

	ConfigEntries(Map<String, String> entries) {
		this.entries = entries;
	}

	private Map.Entry<String, String> find(String key) {
		for (Map.Entry<String, String> e : entries.entrySet()) {
			if (e.getKey() != null && e.getKey().toLowerCase(Locale.ROOT)
					.equals(key.toLowerCase(Locale.ROOT))) {
				return e;
			}
		}
		return null;
	}

	@Nullable
	String getString(String key) {
		Map.Entry<String, String> e = find(key);
		return e == null ? null : e.getValue();
	}

	boolean getBoolean(String key, boolean defaultValue) {
		Map.Entry<String, String> e = find(key);
		if (e == null) {
			return defaultValue;
		}
		if (e.getValue() == null) {
			return true;
		}
		Boolean b = StringUtils.toBooleanOrNull(e.getValue());
		if (b == null) {
			throw invalid(key, e.getValue());
		}
		return b.booleanValue();
	}

	int getInt(String key, int defaultValue) {
		String value = getString(key);
		if (value == null) {
			return defaultValue;
		}
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			IllegalArgumentException iae = invalid(key, value);
			iae.initCause(e);
			throw iae;
		}
	}

	static IllegalArgumentException invalid(String key, @Nullable String value) {
		return new IllegalArgumentException(MessageFormat
				.format(HttpText.get().invalidConfigValue, key, value));
	}
}
