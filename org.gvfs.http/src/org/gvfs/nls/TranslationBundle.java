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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Base class for message bundles.
 * <p>
 * A concrete bundle declares one {@code public String} field per message.
 * Loading the bundle reads the {@link ResourceBundle} whose base name is the
 * fully qualified class name of the bundle and injects each field from the
 * property of the same name. A field without a property is an error: the
 * whole bundle fails to load rather than leaving a {@code null} message
 * behind.
 * <p>
 * Bundles are obtained through {@link NLS#getBundleFor(Class)}, never
 * instantiated directly by callers.
 */
public abstract class TranslationBundle {

	private Locale effectiveLocale;

	private ResourceBundle resourceBundle;

	/**
	 * Get the locale of the resource bundle the messages were read from.
	 *
	 * @return the locale of the resource bundle the messages were read from
	 */
	public Locale effectiveLocale() {
		return effectiveLocale;
	}

	/**
	 * Get the underlying resource bundle.
	 *
	 * @return the resource bundle backing this translation bundle
	 */
	public ResourceBundle resourceBundle() {
		return resourceBundle;
	}

	void load(Locale locale) throws TranslationBundleException {
		Class<? extends TranslationBundle> type = getClass();
		try {
			resourceBundle = ResourceBundle.getBundle(type.getName(), locale,
					type.getClassLoader());
		} catch (MissingResourceException e) {
			throw new TranslationBundleException(type, locale, null, e);
		}
		effectiveLocale = resourceBundle.getLocale();

		for (Field field : type.getFields()) {
			if (field.getType() != String.class
					|| Modifier.isStatic(field.getModifiers())) {
				continue;
			}
			try {
				field.set(this, resourceBundle.getString(field.getName()));
			} catch (MissingResourceException e) {
				throw new TranslationBundleException(type, locale,
						field.getName(), e);
			} catch (IllegalAccessException e) {
				throw new IllegalStateException(e);
			}
		}
	}
}
