/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http.errors;

import java.io.IOException;

import org.gvfs.annotations.Nullable;

/**
 * Describes why a single HTTP attempt did not succeed.
 * <p>
 * Instances are carried by {@link org.gvfs.http.RequestAttemptResult} and are
 * not thrown by the request layer itself; the caller's retry loop decides
 * whether to throw, log or retry.
 */
public class HttpRequestException extends IOException {
	private static final long serialVersionUID = 1L;

	/**
	 * Classified reason for a failed attempt.
	 */
	public enum Kind {
		/** The credential backend could not supply a token. */
		AUTHENTICATION_UNAVAILABLE,

		/** The server answered with a non-200 status. */
		SERVER_ERROR,

		/** The request exceeded the configured timeout. */
		TIMEOUT,

		/** TLS negotiation rejected the server or the client certificate. */
		CERTIFICATE_TRUST_REJECTED,

		/** Any other network level failure. */
		TRANSPORT_FAILURE
	}

	/**
	 * Finer grained cause of a {@link Kind#TRANSPORT_FAILURE}. All of them
	 * are retried.
	 */
	public enum TransportFailure {
		/** Host name could not be resolved. */
		UNKNOWN_HOST,

		/** Nothing accepted the TCP connection. */
		CONNECTION_REFUSED,

		/** The connection broke while in use. */
		CONNECTION_RESET,

		/** Not further classified. */
		OTHER
	}

	private final Kind kind;

	private final int statusCode;

	@Nullable
	private final TransportFailure transportFailure;

	/**
	 * Constructor for HttpRequestException.
	 *
	 * @param kind
	 *            classified reason
	 * @param statusCode
	 *            HTTP status of the attempt, real or synthesized
	 * @param message
	 *            description suitable for end users
	 */
	public HttpRequestException(Kind kind, int statusCode, String message) {
		this(kind, statusCode, message, null, null);
	}

	/**
	 * Constructor for HttpRequestException.
	 *
	 * @param kind
	 *            classified reason
	 * @param statusCode
	 *            HTTP status of the attempt, real or synthesized
	 * @param message
	 *            description suitable for end users
	 * @param transportFailure
	 *            sub-kind for {@link Kind#TRANSPORT_FAILURE}, otherwise
	 *            {@code null}
	 * @param cause
	 *            underlying exception, may be {@code null}
	 */
	public HttpRequestException(Kind kind, int statusCode, String message,
			@Nullable TransportFailure transportFailure,
			@Nullable Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = statusCode;
		this.transportFailure = transportFailure;
	}

	/**
	 * @return the classified reason
	 */
	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the HTTP status code associated with the failure
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * @return the transport sub-kind, or {@code null} unless
	 *         {@link #getKind()} is {@link Kind#TRANSPORT_FAILURE}
	 */
	@Nullable
	public TransportFailure getTransportFailure() {
		return transportFailure;
	}
}
