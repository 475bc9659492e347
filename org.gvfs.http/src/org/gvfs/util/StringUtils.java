/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.util;

import org.gvfs.annotations.Nullable;

/**
 * Miscellaneous string comparison utility methods.
 */
public final class StringUtils {

	private StringUtils() {
		// utility class
	}

	/**
	 * Parse a string as a standard git boolean value.
	 * <p>
	 * The terms {@code yes}, {@code true}, {@code 1}, {@code on} can all be
	 * used to mean {@code true}. The terms {@code no}, {@code false},
	 * {@code 0}, {@code off} and the empty string mean {@code false}.
	 * Comparisons ignore case.
	 *
	 * @param stringValue
	 *            the string to parse
	 * @return the boolean interpretation of {@code stringValue}, or
	 *         {@code null} if it is not a boolean value
	 */
	@Nullable
	public static Boolean toBooleanOrNull(@Nullable String stringValue) {
		if (stringValue == null) {
			return null;
		}
		String v = stringValue.trim();
		if (v.equalsIgnoreCase("yes") //$NON-NLS-1$
				|| v.equalsIgnoreCase("true") //$NON-NLS-1$
				|| v.equals("1") //$NON-NLS-1$
				|| v.equalsIgnoreCase("on")) { //$NON-NLS-1$
			return Boolean.TRUE;
		} else if (v.isEmpty() || v.equalsIgnoreCase("no") //$NON-NLS-1$
				|| v.equalsIgnoreCase("false") //$NON-NLS-1$
				|| v.equals("0") //$NON-NLS-1$
				|| v.equalsIgnoreCase("off")) { //$NON-NLS-1$
			return Boolean.FALSE;
		}
		return null;
	}

	/**
	 * Test if a string is empty or null.
	 *
	 * @param stringValue
	 *            the string to check
	 * @return {@code true} if the string is {@code null} or empty
	 */
	public static boolean isEmptyOrNull(@Nullable String stringValue) {
		return stringValue == null || stringValue.isEmpty();
	}

	/**
	 * @param stringValue
	 *            a string, possibly {@code null}
	 * @return {@code stringValue}, or the empty string if it is {@code null}
	 */
	public static String nullToEmpty(@Nullable String stringValue) {
		return stringValue == null ? "" : stringValue; //$NON-NLS-1$
	}
}
