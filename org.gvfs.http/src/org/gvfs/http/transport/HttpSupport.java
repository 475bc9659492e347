/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http.transport;

import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import javax.net.ssl.SSLContext;

import org.apache.http.impl.EnglishReasonPhraseCatalog;
import org.gvfs.http.internal.HttpText;

/**
 * Constants and helpers for the HTTP wire contract.
 */
public class HttpSupport {
	/** The {@code GET} HTTP method. */
	public static final String METHOD_GET = "GET"; //$NON-NLS-1$

	/** The {@code HEAD} HTTP method. */
	public static final String METHOD_HEAD = "HEAD"; //$NON-NLS-1$

	/** The {@code POST} HTTP method. */
	public static final String METHOD_POST = "POST"; //$NON-NLS-1$

	/** The {@code PUT} HTTP method. */
	public static final String METHOD_PUT = "PUT"; //$NON-NLS-1$

	/** The {@code User-Agent} header. */
	public static final String HDR_USER_AGENT = "User-Agent"; //$NON-NLS-1$

	/** The {@code Accept} header. */
	public static final String HDR_ACCEPT = "Accept"; //$NON-NLS-1$

	/** The {@code Content-Type} header. */
	public static final String HDR_CONTENT_TYPE = "Content-Type"; //$NON-NLS-1$

	/** The {@code Authorization} header. */
	public static final String HDR_AUTHORIZATION = "Authorization"; //$NON-NLS-1$

	/**
	 * Header asking Azure DevOps style servers to answer 401 instead of
	 * redirecting to an interactive sign-in page.
	 */
	public static final String HDR_FED_AUTH_REDIRECT = "X-TFS-FedAuthRedirect"; //$NON-NLS-1$

	/** Value of {@link #HDR_FED_AUTH_REDIRECT} suppressing the redirect. */
	public static final String FED_AUTH_REDIRECT_SUPPRESS = "Suppress"; //$NON-NLS-1$

	/** Header naming the cache server that answered. */
	public static final String HDR_CACHE_NAME = "X-Cache-Name"; //$NON-NLS-1$

	/** The Basic authentication scheme. */
	public static final String AUTH_SCHEME_BASIC = "Basic"; //$NON-NLS-1$

	/** Media type of request bodies. */
	public static final String APPLICATION_JSON = "application/json"; //$NON-NLS-1$

	private static final int MIN_TLS_MINOR = 2;

	private static final String TLS_PREFIX = "TLSv1."; //$NON-NLS-1$

	private static final class TlsHolder {
		static final String[] PROTOCOLS = detectTlsProtocols();
	}

	private HttpSupport() {
		// static helpers only
	}

	/**
	 * Get the TLS protocol versions every connection is restricted to: those
	 * supported by this JVM that are TLSv1.2 or newer. Computed once per
	 * process.
	 *
	 * @return the enabled protocol names, newest first
	 * @throws IllegalStateException
	 *             if the JVM supports no such protocol
	 */
	public static String[] tlsProtocols() {
		return TlsHolder.PROTOCOLS.clone();
	}

	/**
	 * Select the protocol names that are TLSv1.2 or newer.
	 *
	 * @param supported
	 *            protocol names as reported by an {@link SSLContext}
	 * @return the acceptable names, newest first
	 */
	static List<String> filterTlsProtocols(String[] supported) {
		List<String> result = new ArrayList<>();
		for (String p : supported) {
			if (!p.startsWith(TLS_PREFIX)) {
				continue;
			}
			try {
				int minor = Integer.parseInt(p.substring(TLS_PREFIX.length()));
				if (minor >= MIN_TLS_MINOR) {
					result.add(p);
				}
			} catch (NumberFormatException e) {
				// not a TLS version we know how to rank
			}
		}
		result.sort((a, b) -> b.compareTo(a));
		return result;
	}

	private static String[] detectTlsProtocols() {
		try {
			List<String> protocols = filterTlsProtocols(SSLContext.getDefault()
					.getSupportedSSLParameters().getProtocols());
			if (protocols.isEmpty()) {
				throw new IllegalStateException(
						HttpText.get().tlsProtocolsUnavailable);
			}
			return protocols.toArray(new String[0]);
		} catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException(
					HttpText.get().tlsProtocolsUnavailable, e);
		}
	}

	/**
	 * @param statusCode
	 *            HTTP status code
	 * @return whether the status is a redirect the server may send instead of
	 *         an authentication challenge
	 */
	public static boolean isRedirect(int statusCode) {
		switch (statusCode) {
		case HttpConnection.HTTP_MOVED_PERM:
		case HttpConnection.HTTP_MOVED_TEMP:
		case HttpConnection.HTTP_SEE_OTHER:
		case HttpConnection.HTTP_11_MOVED_TEMP:
		case HttpConnection.HTTP_11_MOVED_PERM:
			return true;
		default:
			return false;
		}
	}

	/**
	 * Get the English reason phrase of a status code, e.g.
	 * {@code Unauthorized} for 401.
	 *
	 * @param statusCode
	 *            HTTP status code
	 * @return the reason phrase, or the code itself if it has none
	 */
	public static String reasonPhrase(int statusCode) {
		String reason = null;
		if (statusCode >= 100 && statusCode < 600) {
			reason = EnglishReasonPhraseCatalog.INSTANCE.getReason(statusCode,
					Locale.ENGLISH);
		}
		return reason != null ? reason : String.valueOf(statusCode);
	}
}
