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

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.URI;
import java.net.UnknownHostException;
import java.text.MessageFormat;
import java.util.Locale;
import java.util.concurrent.CancellationException;

import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLPeerUnverifiedException;

import org.apache.http.NoHttpResponseException;
import org.gvfs.annotations.Nullable;
import org.gvfs.http.errors.HttpRequestException;
import org.gvfs.http.errors.HttpRequestException.Kind;
import org.gvfs.http.errors.HttpRequestException.TransportFailure;
import org.gvfs.http.internal.HttpText;
import org.gvfs.http.transport.HttpConnection;
import org.gvfs.http.transport.HttpSupport;

/**
 * Decides whether a failed request attempt is worth retrying and how to
 * describe it.
 * <p>
 * Classification is a pure function of its arguments. The state of the
 * credential backend is passed in by the caller as observed at the time of
 * the attempt.
 */
public final class ResponseClassifier {

	/**
	 * Outcome of classifying one failed attempt.
	 */
	public static final class Classification {
		private final int statusCode;

		private final boolean shouldRetry;

		private final String message;

		private final boolean revokeCredentials;

		private final Kind kind;

		@Nullable
		private final TransportFailure transportFailure;

		Classification(int statusCode, boolean shouldRetry, String message,
				boolean revokeCredentials, Kind kind,
				@Nullable TransportFailure transportFailure) {
			this.statusCode = statusCode;
			this.shouldRetry = shouldRetry;
			this.message = message;
			this.revokeCredentials = revokeCredentials;
			this.kind = kind;
			this.transportFailure = transportFailure;
		}

		/**
		 * @return the HTTP status of the attempt, synthesized for transport
		 *         failures
		 */
		public int getStatusCode() {
			return statusCode;
		}

		/**
		 * @return whether the attempt should be retried
		 */
		public boolean shouldRetry() {
			return shouldRetry;
		}

		/**
		 * @return the error message
		 */
		public String getMessage() {
			return message;
		}

		/**
		 * @return whether the credential used for the attempt must be
		 *         revoked
		 */
		public boolean isRevokeCredentials() {
			return revokeCredentials;
		}

		/**
		 * @return the kind of failure
		 */
		public Kind getKind() {
			return kind;
		}

		/**
		 * @return the transport sub-kind, or {@code null}
		 */
		@Nullable
		public TransportFailure getTransportFailure() {
			return transportFailure;
		}

		/**
		 * Create the exception describing this classification.
		 *
		 * @param cause
		 *            underlying exception, may be {@code null}
		 * @return the exception
		 */
		public HttpRequestException toException(@Nullable Throwable cause) {
			return new HttpRequestException(kind, statusCode, message,
					transportFailure, cause);
		}

		@Override
		public String toString() {
			return "Classification[" + statusCode + ", retry=" + shouldRetry //$NON-NLS-1$ //$NON-NLS-2$
					+ ", revoke=" + revokeCredentials + ", " + kind + "]"; //$NON-NLS-1$ //$NON-NLS-2$ //$NON-NLS-3$
		}
	}

	private ResponseClassifier() {
		// static helpers only
	}

	/**
	 * Whether a status is transient: request timeout, unauthorized (the
	 * credential may be renewed) and every 5xx.
	 *
	 * @param statusCode
	 *            HTTP status code
	 * @return whether an attempt ending with this status should be retried
	 */
	public static boolean shouldRetry(int statusCode) {
		return statusCode == HttpConnection.HTTP_CLIENT_TIMEOUT
				|| statusCode == HttpConnection.HTTP_UNAUTHORIZED
				|| (statusCode >= 500 && statusCode < 600);
	}

	/**
	 * Classify a response with a status other than 200.
	 *
	 * @param statusCode
	 *            HTTP status code of the response
	 * @param anonymous
	 *            whether the request was sent without credentials
	 * @param backingOff
	 *            whether the credential backend has recently renewed the
	 *            credential already
	 * @param serverMessage
	 *            body of the error response
	 * @return the classification
	 */
	public static Classification classify(int statusCode, boolean anonymous,
			boolean backingOff, String serverMessage) {
		String code = String.valueOf(statusCode);
		String reason = HttpSupport.reasonPhrase(statusCode);
		if (statusCode == HttpConnection.HTTP_UNAUTHORIZED && anonymous) {
			return new Classification(statusCode, false,
					HttpText.get().anonymousRequestRejected, false,
					Kind.SERVER_ERROR, null);
		}
		if (statusCode == HttpConnection.HTTP_UNAUTHORIZED
				|| statusCode == HttpConnection.HTTP_BAD_REQUEST
				|| HttpSupport.isRedirect(statusCode)) {
			String pattern = backingOff
					? HttpText.get().serverErrorCodeAfterRenewal
					: HttpText.get().serverErrorCodeCredentialsExpired;
			return new Classification(statusCode, shouldRetry(statusCode),
					MessageFormat.format(pattern, code, reason, serverMessage),
					true, Kind.SERVER_ERROR, null);
		}
		return new Classification(statusCode, shouldRetry(statusCode),
				MessageFormat.format(HttpText.get().serverErrorCode, code,
						reason, serverMessage),
				false, Kind.SERVER_ERROR, null);
	}

	/**
	 * Classify an exception raised while sending a request or reading the
	 * response headers.
	 *
	 * @param e
	 *            the exception
	 * @param uri
	 *            target of the request
	 * @param token
	 *            cancellation token of the attempt
	 * @return the classification
	 * @throws CancellationException
	 *             if {@code token} has been cancelled; the attempt failed
	 *             because it was aborted
	 */
	public static Classification classify(IOException e, URI uri,
			CancellationToken token) throws CancellationException {
		if (token.isCancellationRequested()) {
			CancellationException ce = new CancellationException();
			ce.initCause(e);
			throw ce;
		}
		if (e instanceof SSLHandshakeException
				|| e instanceof SSLPeerUnverifiedException) {
			return new Classification(HttpConnection.HTTP_UNAUTHORIZED, false,
					MessageFormat.format(
							HttpText.get().certificateTrustRejected, uri,
							e.getMessage()),
					false, Kind.CERTIFICATE_TRUST_REJECTED, null);
		}
		if (e instanceof InterruptedIOException) {
			return new Classification(HttpConnection.HTTP_CLIENT_TIMEOUT, true,
					MessageFormat.format(HttpText.get().requestTimedOut, uri),
					false, Kind.TIMEOUT, null);
		}
		return new Classification(HttpConnection.HTTP_INTERNAL_ERROR, true,
				MessageFormat.format(HttpText.get().transportFailure, uri,
						e.getMessage()),
				false, Kind.TRANSPORT_FAILURE, transportFailure(e));
	}

	/**
	 * Refine a transport failure. The sub-kind is informational only; every
	 * transport failure is retried.
	 *
	 * @param e
	 *            the exception, or any exception in its cause chain
	 * @return the sub-kind
	 */
	static TransportFailure transportFailure(Throwable e) {
		for (Throwable t = e; t != null; t = t.getCause()) {
			if (t instanceof UnknownHostException) {
				return TransportFailure.UNKNOWN_HOST;
			}
			if (t instanceof ConnectException) {
				return TransportFailure.CONNECTION_REFUSED;
			}
			if (t instanceof NoHttpResponseException) {
				return TransportFailure.CONNECTION_RESET;
			}
			if (t instanceof SocketException && t.getMessage() != null
					&& t.getMessage().toLowerCase(Locale.ROOT)
							.contains("reset")) { //$NON-NLS-1$
				return TransportFailure.CONNECTION_RESET;
			}
			if (t.getCause() == t) {
				break;
			}
		}
		return TransportFailure.OTHER;
	}
}
