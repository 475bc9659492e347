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

import java.io.InputStream;
import java.text.MessageFormat;
import java.util.concurrent.atomic.AtomicBoolean;

import org.gvfs.annotations.Nullable;
import org.gvfs.http.errors.HttpRequestException;
import org.gvfs.http.internal.HttpText;
import org.gvfs.http.transport.HttpConnection;

/**
 * Outcome of one request attempt.
 * <p>
 * A successful result owns the response body stream and the connection
 * slot used by the attempt. Both are given back by {@link #release()}
 * (or {@link #close()}), which must happen once the body has been read or
 * abandoned. Failed results are released before they are handed out.
 */
public final class RequestAttemptResult implements AutoCloseable {
	private static final Runnable NOTHING = () -> {
		// nothing held
	};

	private final long requestId;

	private final int statusCode;

	@Nullable
	private final HttpRequestException error;

	private final boolean shouldRetry;

	@Nullable
	private final String contentType;

	@Nullable
	private final InputStream stream;

	private final Runnable onRelease;

	private final AtomicBoolean released = new AtomicBoolean();

	private RequestAttemptResult(long requestId, int statusCode,
			@Nullable HttpRequestException error, boolean shouldRetry,
			@Nullable String contentType, @Nullable InputStream stream,
			Runnable onRelease) {
		this.requestId = requestId;
		this.statusCode = statusCode;
		this.error = error;
		this.shouldRetry = shouldRetry;
		this.contentType = contentType;
		this.stream = stream;
		this.onRelease = onRelease;
	}

	/**
	 * Create a successful result.
	 *
	 * @param requestId
	 *            id of the attempt
	 * @param contentType
	 *            content type of the body
	 * @param stream
	 *            the unread response body
	 * @param onRelease
	 *            disposes the response and returns the connection slot
	 * @return the result
	 */
	static RequestAttemptResult success(long requestId, String contentType,
			InputStream stream, Runnable onRelease) {
		return new RequestAttemptResult(requestId, HttpConnection.HTTP_OK,
				null, false, contentType, stream, onRelease);
	}

	/**
	 * Create a failed result.
	 *
	 * @param requestId
	 *            id of the attempt
	 * @param error
	 *            the classified error; its status becomes the result's
	 * @param shouldRetry
	 *            whether the attempt should be retried
	 * @param onRelease
	 *            disposes the response and returns the connection slot;
	 *            {@code null} if nothing is held
	 * @return the result
	 */
	static RequestAttemptResult failure(long requestId,
			HttpRequestException error, boolean shouldRetry,
			@Nullable Runnable onRelease) {
		return new RequestAttemptResult(requestId, error.getStatusCode(),
				error, shouldRetry, null, null,
				onRelease != null ? onRelease : NOTHING);
	}

	/**
	 * @return id of the attempt
	 */
	public long getRequestId() {
		return requestId;
	}

	/**
	 * @return HTTP status of the attempt; synthesized (401, 408, 500) for
	 *         attempts that got no response
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * @return whether the server answered 200
	 */
	public boolean isSucceeded() {
		return error == null;
	}

	/**
	 * @return the error, or {@code null} for a successful attempt
	 */
	@Nullable
	public HttpRequestException getError() {
		return error;
	}

	/**
	 * @return whether the caller's retry loop should try again
	 */
	public boolean shouldRetry() {
		return shouldRetry;
	}

	/**
	 * @return content type of the body, or {@code null} for a failed attempt
	 */
	@Nullable
	public String getContentType() {
		return contentType;
	}

	/**
	 * @return the response body, or {@code null} for a failed attempt. Valid
	 *         until the result is released.
	 */
	@Nullable
	public InputStream getStream() {
		return stream;
	}

	/**
	 * @return whether the result has been released
	 */
	public boolean isReleased() {
		return released.get();
	}

	/**
	 * Dispose the response and return the connection slot.
	 *
	 * @throws IllegalStateException
	 *             if the result was already released
	 */
	public void release() {
		if (!released.compareAndSet(false, true)) {
			throw new IllegalStateException(MessageFormat.format(
					HttpText.get().resultAlreadyReleased,
					String.valueOf(requestId)));
		}
		onRelease.run();
	}

	/**
	 * Release the result unless it has been released already.
	 */
	@Override
	public void close() {
		if (released.compareAndSet(false, true)) {
			onRelease.run();
		}
	}

	@Override
	public String toString() {
		return "RequestAttemptResult[" + requestId + ", " + statusCode //$NON-NLS-1$ //$NON-NLS-2$
				+ (error != null ? ", " + error.getKind() : "") //$NON-NLS-1$ //$NON-NLS-2$
				+ ", retry=" + shouldRetry + "]"; //$NON-NLS-1$ //$NON-NLS-2$
	}
}
