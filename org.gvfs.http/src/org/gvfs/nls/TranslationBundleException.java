/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.nls;

import java.util.Locale;

import org.gvfs.annotations.Nullable;

/**
 * Thrown when a {@link TranslationBundle} cannot be loaded, either because its
 * resource bundle is missing or because one of its messages has no
 * translation.
 */
public class TranslationBundleException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final Class<?> bundleClass;

	private final Locale locale;

	private final String key;

	/**
	 * Constructor for TranslationBundleException.
	 *
	 * @param bundleClass
	 *            the bundle that failed to load
	 * @param locale
	 *            the requested locale
	 * @param key
	 *            the missing message key, or {@code null} if the whole
	 *            resource bundle is missing
	 * @param cause
	 *            the original exception
	 */
	public TranslationBundleException(Class<?> bundleClass, Locale locale,
			@Nullable String key, Exception cause) {
		super(key == null
				? "Loading of translation bundle failed for [" //-NLS-1$
						+ bundleClass.getName() + ", " + locale + "]" //-NLS-1$ //-NLS-2$
				: "Translation missing for [" + bundleClass.getName() + ", " //-NLS-1$ //-NLS-2$
						+ locale + ", " + key + "]", //-NLS-1$ //-NLS-2$
				cause);
		this.bundleClass = bundleClass;
		this.locale = locale;
		this.key = key;
	}

	/**
	 * @return the bundle that failed to load
	 */
	public Class<?> getBundleClass() {
		return bundleClass;
	}

	/**
	 * @return the requested locale
	 */
	public Locale getLocale() {
		return locale;
	}

	/**
	 * @return the missing message key, or {@code null} if the resource bundle
	 *         itself could not be found
	 */
	@Nullable
	public String getKey() {
		return key;
	}
}
