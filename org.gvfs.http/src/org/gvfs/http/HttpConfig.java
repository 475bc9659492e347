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

import java.util.Map;

import org.gvfs.annotations.Nullable;
import org.gvfs.util.StringUtils;

/**
 * The "http.*" git config values governing TLS for a requestor.
 */
public class HttpConfig {

	/** git config key for the "sslVerify" setting. */
	public static final String SSL_VERIFY_KEY = "http.sslVerify"; //$NON-NLS-1$

	/** git config key for the "sslCert" setting. */
	public static final String SSL_CERT_KEY = "http.sslCert"; //$NON-NLS-1$

	/** git config key for the "sslCertPasswordProtected" setting. */
	public static final String SSL_CERT_PASSWORD_PROTECTED_KEY = "http.sslCertPasswordProtected"; //$NON-NLS-1$

	private final boolean sslVerify;

	@Nullable
	private final String sslCert;

	private final boolean sslCertPasswordProtected;

	/**
	 * Constructor for HttpConfig.
	 *
	 * @param sslVerify
	 *            whether server certificates are verified
	 * @param sslCert
	 *            client certificate file path or subject name; {@code null}
	 *            or empty for none
	 * @param sslCertPasswordProtected
	 *            whether the certificate file needs a password
	 */
	public HttpConfig(boolean sslVerify, @Nullable String sslCert,
			boolean sslCertPasswordProtected) {
		this.sslVerify = sslVerify;
		this.sslCert = StringUtils.isEmptyOrNull(sslCert) ? null : sslCert;
		this.sslCertPasswordProtected = sslCertPasswordProtected;
	}

	/**
	 * Create a configuration with defaults: verification on and no client
	 * certificate.
	 */
	public HttpConfig() {
		this(true, null, false);
	}

	/**
	 * Read the configuration from git config entries.
	 *
	 * @param config
	 *            git config entries keyed "section.key"; a {@code null} value
	 *            marks a bare key
	 * @return the configuration
	 * @throws IllegalArgumentException
	 *             if a boolean value is not a git boolean
	 */
	public static HttpConfig fromConfig(Map<String, String> config) {
		ConfigEntries entries = new ConfigEntries(config);
		return new HttpConfig(entries.getBoolean(SSL_VERIFY_KEY, true),
				entries.getString(SSL_CERT_KEY),
				entries.getBoolean(SSL_CERT_PASSWORD_PROTECTED_KEY, false));
	}

	/**
	 * @return whether server certificates are verified
	 */
	public boolean isSslVerify() {
		return sslVerify;
	}

	/**
	 * @return the client certificate identifier, or {@code null} if none is
	 *         configured
	 */
	@Nullable
	public String getSslCert() {
		return sslCert;
	}

	/**
	 * @return whether the client certificate file is password protected
	 */
	public boolean isSslCertPasswordProtected() {
		return sslCertPasswordProtected;
	}
}
