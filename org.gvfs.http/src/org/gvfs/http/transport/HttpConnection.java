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

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;

import org.gvfs.annotations.NonNull;
import org.gvfs.annotations.Nullable;

/**
 * One HTTP exchange: a request that is configured, sent once, and whose
 * response is then read.
 * <p>
 * The request is sent by the first call to {@link #getResponseCode()}. Only
 * the status line and headers are read at that point; the body is read
 * lazily from {@link #getInputStream()} or {@link #getResponseBody()}.
 * {@link #close()} disposes of the response and must be called exactly once
 * when the exchange is no longer needed.
 */
public interface HttpConnection extends Closeable {
	/** HTTP 200 OK */
	int HTTP_OK = java.net.HttpURLConnection.HTTP_OK;

	/** HTTP 301 Moved Permanently */
	int HTTP_MOVED_PERM = java.net.HttpURLConnection.HTTP_MOVED_PERM;

	/** HTTP 302 Found */
	int HTTP_MOVED_TEMP = java.net.HttpURLConnection.HTTP_MOVED_TEMP;

	/** HTTP 303 See Other */
	int HTTP_SEE_OTHER = java.net.HttpURLConnection.HTTP_SEE_OTHER;

	/**
	 * HTTP 1.1 additional "temporary redirect" status code; value = 307.
	 *
	 * @see <a href="https://tools.ietf.org/html/rfc7231#section-6.4.7">RFC
	 *      7231, section 6.4.7: 307 Temporary Redirect</a>
	 */
	int HTTP_11_MOVED_TEMP = 307;

	/**
	 * HTTP 1.1 additional "permanent redirect" status code; value = 308.
	 *
	 * @see <a href="https://tools.ietf.org/html/rfc7538#section-3">RFC 7538,
	 *      section 3: 308 Permanent Redirect</a>
	 */
	int HTTP_11_MOVED_PERM = 308;

	/** HTTP 400 Bad Request */
	int HTTP_BAD_REQUEST = java.net.HttpURLConnection.HTTP_BAD_REQUEST;

	/** HTTP 401 Unauthorized */
	int HTTP_UNAUTHORIZED = java.net.HttpURLConnection.HTTP_UNAUTHORIZED;

	/** HTTP 408 Request Timeout */
	int HTTP_CLIENT_TIMEOUT = java.net.HttpURLConnection.HTTP_CLIENT_TIMEOUT;

	/** HTTP 500 Internal Server Error */
	int HTTP_INTERNAL_ERROR = java.net.HttpURLConnection.HTTP_INTERNAL_ERROR;

	/**
	 * @return the target of the request
	 */
	URI getURI();

	/**
	 * @return the HTTP method of the request
	 */
	String getRequestMethod();

	/**
	 * Add a request header. Must be called before the request is sent.
	 *
	 * @param key
	 *            header name
	 * @param value
	 *            header value
	 */
	void setRequestProperty(@NonNull String key, @NonNull String value);

	/**
	 * Set a UTF-8 encoded request body. Must be called before the request is
	 * sent.
	 *
	 * @param content
	 *            the body
	 * @param mediaType
	 *            media type of the body without charset, e.g.
	 *            {@code application/json}
	 */
	void setRequestBody(@NonNull String content, @NonNull String mediaType);

	/**
	 * Send the request if it has not been sent yet and return the status.
	 *
	 * @return the HTTP status code
	 * @throws IOException
	 *             if the request could not be sent or the response headers
	 *             could not be read
	 */
	int getResponseCode() throws IOException;

	/**
	 * Get the first value of a response header. Header names are case
	 * insensitive.
	 *
	 * @param name
	 *            header name
	 * @return the value, or {@code null} if the header is absent
	 */
	@Nullable
	String getHeaderField(@NonNull String name);

	/**
	 * @return the {@code Content-Type} of the response body, or {@code null}
	 */
	@Nullable
	String getContentType();

	/**
	 * Open the response body. The stream is owned by the connection and
	 * closed by {@link #close()}.
	 *
	 * @return the body stream; empty if the response has no body
	 * @throws IOException
	 *             if the body cannot be opened
	 */
	InputStream getInputStream() throws IOException;

	/**
	 * Read the whole response body as UTF-8 text.
	 *
	 * @return the body, empty if the response has none
	 * @throws IOException
	 *             if the body cannot be read
	 */
	String getResponseBody() throws IOException;

	/**
	 * Abort the exchange from another thread. A blocked
	 * {@link #getResponseCode()} fails with an
	 * {@link java.io.InterruptedIOException}.
	 */
	void abort();
}
