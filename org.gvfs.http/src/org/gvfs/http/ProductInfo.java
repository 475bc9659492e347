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

import java.io.File;

import org.gvfs.annotations.Nullable;
import org.gvfs.util.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Name and version of the embedding application, sent as the
 * {@code User-Agent} of every request.
 */
public final class ProductInfo {
	private static final Logger LOG = LoggerFactory
			.getLogger(ProductInfo.class);

	private static final String UNKNOWN_VERSION = "0.0.0"; //$NON-NLS-1$

	private static final String DEFAULT_NAME = "gvfs-http"; //$NON-NLS-1$

	private static final class Holder {
		static final ProductInfo DETECTED = detect();
	}

	private final String name;

	private final String version;

	/**
	 * Constructor for ProductInfo.
	 *
	 * @param name
	 *            product name; must not contain whitespace or '/'
	 * @param version
	 *            product version; must not contain whitespace
	 */
	public ProductInfo(String name, String version) {
		if (name.isEmpty() || !isToken(name) || name.indexOf('/') >= 0
				|| version.isEmpty() || !isToken(version)) {
			throw new IllegalArgumentException(name + '/' + version);
		}
		this.name = name;
		this.version = version;
	}

	/**
	 * Get the product information of the running application, detected once
	 * from the main class (or jar) named on the command line and the
	 * implementation version in its manifest.
	 *
	 * @return the detected product information
	 */
	public static ProductInfo detected() {
		return Holder.DETECTED;
	}

	private static ProductInfo detect() {
		String command = System.getProperty("sun.java.command"); //$NON-NLS-1$
		String entry = StringUtils.isEmptyOrNull(command) ? null
				: command.trim().split("\\s+")[0]; //$NON-NLS-1$
		String name = entryName(entry);
		String version = entryVersion(entry);
		ProductInfo info = new ProductInfo(name, version);
		LOG.debug("Detected product {}", info); //$NON-NLS-1$
		return info;
	}

	static String entryName(@Nullable String entry) {
		if (StringUtils.isEmptyOrNull(entry)) {
			return DEFAULT_NAME;
		}
		if (entry.endsWith(".jar")) { //$NON-NLS-1$
			String file = new File(entry).getName();
			return file.substring(0, file.length() - 4);
		}
		int dot = entry.lastIndexOf('.');
		String simple = dot >= 0 ? entry.substring(dot + 1) : entry;
		return simple.isEmpty() || !isToken(simple) ? DEFAULT_NAME : simple;
	}

	private static String entryVersion(@Nullable String entry) {
		String version = null;
		if (entry != null && !entry.endsWith(".jar")) { //$NON-NLS-1$
			try {
				Class<?> main = Class.forName(entry, false,
						ProductInfo.class.getClassLoader());
				version = main.getPackage() == null ? null
						: main.getPackage().getImplementationVersion();
			} catch (ClassNotFoundException | LinkageError e) {
				LOG.debug("Cannot load main class {}", entry, e); //$NON-NLS-1$
			}
		}
		if (version == null) {
			Package p = ProductInfo.class.getPackage();
			version = p == null ? null : p.getImplementationVersion();
		}
		return version == null || !isToken(version) ? UNKNOWN_VERSION
				: version;
	}

	private static boolean isToken(String s) {
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c <= ' ' || c >= 127) {
				return false;
			}
		}
		return true;
	}

	/**
	 * @return the product name
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return the product version
	 */
	public String getVersion() {
		return version;
	}

	/**
	 * @return the {@code User-Agent} header value, "name/version"
	 */
	public String toUserAgent() {
		return name + '/' + version;
	}

	@Override
	public String toString() {
		return toUserAgent();
	}
}
