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

import java.lang.reflect.InvocationTargetException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-thread access to {@link TranslationBundle} instances.
 * <p>
 * Each thread can select its own locale with {@link #setLocale(Locale)};
 * threads that never do use the JVM default locale. Loaded bundles are cached
 * per locale for the lifetime of the class loader, so the reflection cost of
 * loading is paid once per (locale, bundle) pair.
 */
public class NLS {

	private static final InheritableThreadLocal<Locale> local = new InheritableThreadLocal<>();

	private static final Map<Locale, Map<Class<?>, TranslationBundle>> cache = new ConcurrentHashMap<>();

	private NLS() {
		// static access only
	}

	/**
	 * Set the locale used by {@link #getBundleFor(Class)} in the calling
	 * thread and the threads it starts afterwards.
	 *
	 * @param locale
	 *            the preferred locale
	 */
	public static void setLocale(Locale locale) {
		local.set(locale);
	}

	/**
	 * Use the JVM default locale in the calling thread.
	 */
	public static void useJVMDefaultLocale() {
		local.set(Locale.getDefault());
	}

	/**
	 * Get the bundle of the given type for the calling thread's locale.
	 *
	 * @param <T>
	 *            bundle type
	 * @param type
	 *            required bundle type
	 * @return a loaded instance of {@code type}
	 * @throws TranslationBundleException
	 *             if the bundle or one of its messages is missing
	 */
	public static <T extends TranslationBundle> T getBundleFor(Class<T> type) {
		Locale locale = local.get();
		if (locale == null) {
			locale = Locale.getDefault();
			local.set(locale);
		}
		Map<Class<?>, TranslationBundle> bundles = cache
				.computeIfAbsent(locale, l -> new ConcurrentHashMap<>());
		final Locale l = locale;
		return type.cast(bundles.computeIfAbsent(type, t -> load(type, l)));
	}

	private static <T extends TranslationBundle> T load(Class<T> type,
			Locale locale) {
		T bundle;
		try {
			bundle = type.getDeclaredConstructor().newInstance();
		} catch (InstantiationException | IllegalAccessException
				| InvocationTargetException | NoSuchMethodException e) {
			throw new IllegalStateException(e);
		}
		bundle.load(locale);
		return bundle;
	}
}
