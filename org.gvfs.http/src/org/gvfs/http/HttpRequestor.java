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
import java.io.InputStream;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicLong;

import org.gvfs.annotations.Nullable;
import org.gvfs.http.ResponseClassifier.Classification;
import org.gvfs.http.auth.GitAuthentication;
import org.gvfs.http.cert.CertificateLoader;
import org.gvfs.http.cert.CertificatePasswordProvider;
import org.gvfs.http.cert.CertificateStore;
import org.gvfs.http.cert.ClientCertificate;
import org.gvfs.http.errors.AuthenticationUnavailableException;
import org.gvfs.http.errors.HttpRequestException;
import org.gvfs.http.errors.HttpRequestException.Kind;
import org.gvfs.http.tracing.EventLevel;
import org.gvfs.http.tracing.EventMetadata;
import org.gvfs.http.tracing.Tracer;
import org.gvfs.http.transport.HttpClientConnectionFactory;
import org.gvfs.http.transport.HttpConnection;
import org.gvfs.http.transport.HttpConnectionFactory;
import org.gvfs.http.transport.HttpSupport;
import org.gvfs.util.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends single authenticated request attempts to a GVFS server.
 * <p>
 * Each attempt takes a slot of a shared {@link ConnectionThrottle}, sends
 * the request with the current credential and classifies the outcome.
 * Attempts never throw for failed requests: the outcome, including whether
 * a retry may help, is returned as a {@link RequestAttemptResult}. Only
 * cancellation ends an attempt abruptly.
 * <p>
 * Instances are thread safe. Retrying is left to the caller.
 */
public class HttpRequestor implements AutoCloseable {
	private static final Logger LOG = LoggerFactory
			.getLogger(HttpRequestor.class);

	/** Name of the telemetry event emitted for every attempt. */
	public static final String NETWORK_RESPONSE_EVENT = "NetworkResponse"; //$NON-NLS-1$

	static final String REQUEST_ID = "RequestId"; //$NON-NLS-1$

	static final String AVAILABLE_CONNECTIONS = "availableConnections"; //$NON-NLS-1$

	static final String CACHE_NAME = "CacheName"; //$NON-NLS-1$

	static final String STATUS_CODE = "StatusCode"; //$NON-NLS-1$

	static final String CONTENT_TYPE = "ContentType"; //$NON-NLS-1$

	static final String CONNECTION_WAIT = "connectionWaitTimeMS"; //$NON-NLS-1$

	static final String RESPONSE_WAIT = "responseWaitTimeMS"; //$NON-NLS-1$

	private static final AtomicLong REQUEST_COUNT = new AtomicLong();

	private final Tracer tracer;

	private final RetryConfig retryConfig;

	private final GitAuthentication authentication;

	private final ConnectionThrottle throttle;

	private final HttpConnectionFactory connectionFactory;

	private final String userAgent;

	@Nullable
	private final CertificateLoader certificateLoader;

	/**
	 * Create a requestor using the platform certificate store and the
	 * detected product information.
	 *
	 * @param tracer
	 *            receives telemetry and errors
	 * @param retryConfig
	 *            supplies the request timeout
	 * @param httpConfig
	 *            TLS settings
	 * @param authentication
	 *            the credential backend
	 * @param throttle
	 *            bounds concurrent attempts; usually
	 *            {@link ConnectionThrottle#getDefault()}
	 * @param passwordProvider
	 *            asked for the client certificate's password if it is
	 *            password protected
	 * @throws GeneralSecurityException
	 *             if no TLS context can be set up
	 */
	public HttpRequestor(Tracer tracer, RetryConfig retryConfig,
			HttpConfig httpConfig, GitAuthentication authentication,
			ConnectionThrottle throttle,
			CertificatePasswordProvider passwordProvider)
			throws GeneralSecurityException {
		this(tracer, retryConfig, httpConfig, authentication, throttle,
				passwordProvider, CertificateStore.platform(),
				ProductInfo.detected());
	}

	/**
	 * Create a requestor.
	 *
	 * @param tracer
	 *            receives telemetry and errors
	 * @param retryConfig
	 *            supplies the request timeout
	 * @param httpConfig
	 *            TLS settings
	 * @param authentication
	 *            the credential backend
	 * @param throttle
	 *            bounds concurrent attempts
	 * @param passwordProvider
	 *            asked for the client certificate's password if it is
	 *            password protected
	 * @param store
	 *            searched for the client certificate if it is not a file;
	 *            closed with this requestor
	 * @param productInfo
	 *            names the application in the {@code User-Agent}
	 * @throws GeneralSecurityException
	 *             if no TLS context can be set up
	 */
	public HttpRequestor(Tracer tracer, RetryConfig retryConfig,
			HttpConfig httpConfig, GitAuthentication authentication,
			ConnectionThrottle throttle,
			CertificatePasswordProvider passwordProvider,
			CertificateStore store, ProductInfo productInfo)
			throws GeneralSecurityException {
		this.tracer = tracer;
		this.retryConfig = retryConfig;
		this.authentication = authentication;
		this.throttle = throttle;
		this.userAgent = productInfo.toUserAgent();
		CertificateLoader loader = new CertificateLoader(tracer, store);
		try {
			ClientCertificate certificate = null;
			String certificateId = httpConfig.getSslCert();
			if (certificateId != null) {
				certificate = loader.resolve(certificateId,
						httpConfig.isSslCertPasswordProtected()
								? passwordProvider
								: null,
						httpConfig.isSslVerify());
			}
			this.connectionFactory = new HttpClientConnectionFactory(
					httpConfig.isSslVerify(), certificate,
					retryConfig.getTimeout(), throttle.getCapacity());
		} catch (GeneralSecurityException | RuntimeException e) {
			loader.close();
			throw e;
		}
		this.certificateLoader = loader;
	}

	/**
	 * Create a requestor sending through the given connections.
	 *
	 * @param tracer
	 *            receives telemetry and errors
	 * @param retryConfig
	 *            retry limits of the caller
	 * @param authentication
	 *            the credential backend
	 * @param throttle
	 *            bounds concurrent attempts
	 * @param connectionFactory
	 *            opens connections; closed with this requestor
	 * @param productInfo
	 *            names the application in the {@code User-Agent}
	 */
	public HttpRequestor(Tracer tracer, RetryConfig retryConfig,
			GitAuthentication authentication, ConnectionThrottle throttle,
			HttpConnectionFactory connectionFactory, ProductInfo productInfo) {
		this.tracer = tracer;
		this.retryConfig = retryConfig;
		this.authentication = authentication;
		this.throttle = throttle;
		this.connectionFactory = connectionFactory;
		this.userAgent = productInfo.toUserAgent();
		this.certificateLoader = null;
	}

	/**
	 * Get a new request id, unique and increasing within the process.
	 *
	 * @return the id
	 */
	public static long newRequestId() {
		return REQUEST_COUNT.incrementAndGet();
	}

	/**
	 * @return the retry configuration this requestor was created with
	 */
	public RetryConfig getRetryConfig() {
		return retryConfig;
	}

	/**
	 * Send one request attempt.
	 *
	 * @param requestId
	 *            id of the attempt, see {@link #newRequestId()}
	 * @param uri
	 *            target of the request
	 * @param method
	 *            HTTP method
	 * @param body
	 *            JSON request body; {@code null} for none
	 * @param token
	 *            cancels waiting for a connection slot and the request
	 *            itself
	 * @param acceptType
	 *            value of the {@code Accept} header; {@code null} for none
	 * @return the outcome; a successful outcome must be released by the
	 *         caller
	 * @throws CancellationException
	 *             if {@code token} was cancelled before the attempt
	 *             completed
	 */
	public RequestAttemptResult sendRequest(long requestId, URI uri,
			String method, @Nullable String body, CancellationToken token,
			@Nullable String acceptType) throws CancellationException {
		String credentials = null;
		if (!authentication.isAnonymous()) {
			try {
				credentials = authentication.getCredentials();
			} catch (AuthenticationUnavailableException e) {
				RequestAttemptResult noAttempt = RequestAttemptResult.failure(
						requestId,
						new HttpRequestException(
								Kind.AUTHENTICATION_UNAVAILABLE,
								HttpConnection.HTTP_UNAUTHORIZED,
								e.getMessage(), null, e),
						true, null);
				noAttempt.close();
				return noAttempt;
			}
		}

		EventMetadata metadata = new EventMetadata();
		metadata.add(REQUEST_ID, Long.valueOf(requestId));
		metadata.add(AVAILABLE_CONNECTIONS,
				Integer.valueOf(throttle.getAvailableSlots()));

		long start = System.nanoTime();
		throttle.acquire(token);
		long connectionWait = System.nanoTime() - start;
		long responseWait = 0;

		RequestAttemptResult result = null;
		HttpConnection conn = null;
		CancellationToken.Registration abortOnCancel = null;
		try {
			conn = connectionFactory.create(uri, method);
			conn.setRequestProperty(HttpSupport.HDR_FED_AUTH_REDIRECT,
					HttpSupport.FED_AUTH_REDIRECT_SUPPRESS);
			conn.setRequestProperty(HttpSupport.HDR_USER_AGENT, userAgent);
			if (!StringUtils.isEmptyOrNull(credentials)) {
				conn.setRequestProperty(HttpSupport.HDR_AUTHORIZATION,
						HttpSupport.AUTH_SCHEME_BASIC + ' ' + credentials);
			}
			if (acceptType != null) {
				conn.setRequestProperty(HttpSupport.HDR_ACCEPT, acceptType);
			}
			if (body != null) {
				conn.setRequestBody(body, HttpSupport.APPLICATION_JSON);
			}
			abortOnCancel = token.register(conn::abort);

			int status;
			start = System.nanoTime();
			try {
				status = conn.getResponseCode();
			} finally {
				responseWait = System.nanoTime() - start;
			}
			metadata.add(CACHE_NAME, StringUtils.nullToEmpty(
					conn.getHeaderField(HttpSupport.HDR_CACHE_NAME)));
			metadata.add(STATUS_CODE, Integer.valueOf(status));

			if (status == HttpConnection.HTTP_OK) {
				String contentType = StringUtils
						.nullToEmpty(conn.getContentType());
				metadata.add(CONTENT_TYPE, contentType);
				authentication.confirmCredentialsWorked(credentials);
				InputStream stream = conn.getInputStream();
				result = RequestAttemptResult.success(requestId, contentType,
						stream, releaser(conn, abortOnCancel));
			} else {
				String serverMessage = conn.getResponseBody();
				Classification c = ResponseClassifier.classify(status,
						authentication.isAnonymous(),
						authentication.isBackingOff(), serverMessage);
				if (c.isRevokeCredentials()) {
					authentication.revoke(credentials);
				}
				result = RequestAttemptResult.failure(requestId,
						c.toException(null), c.shouldRetry(),
						releaser(conn, abortOnCancel));
				result.close();
			}
		} catch (IOException e) {
			Classification c = ResponseClassifier.classify(e, uri, token);
			LOG.debug("Request {} to {} failed: {}", Long.valueOf(requestId), //$NON-NLS-1$
					uri, c, e);
			result = RequestAttemptResult.failure(requestId,
					c.toException(e), c.shouldRetry(),
					releaser(conn, abortOnCancel));
			result.close();
		} finally {
			metadata.add(CONNECTION_WAIT, formatMillis(connectionWait));
			metadata.add(RESPONSE_WAIT, formatMillis(responseWait));
			tracer.relatedEvent(EventLevel.INFORMATIONAL,
					NETWORK_RESPONSE_EVENT, metadata);
			if (result == null) {
				// Unexpected failure or cancellation: nobody else will
				// release what this attempt holds.
				releaser(conn, abortOnCancel).run();
			}
		}
		return result;
	}

	private Runnable releaser(@Nullable HttpConnection conn,
			@Nullable CancellationToken.Registration abortOnCancel) {
		return () -> {
			try {
				if (abortOnCancel != null) {
					abortOnCancel.close();
				}
				if (conn != null) {
					conn.close();
				}
			} catch (IOException e) {
				LOG.warn("Closing the response from {} failed", //$NON-NLS-1$
						conn.getURI(), e);
			} finally {
				throttle.release();
			}
		};
	}

	static String formatMillis(long nanos) {
		return String.format(Locale.ROOT, "%.4f", //$NON-NLS-1$
				Double.valueOf(nanos / 1_000_000.0));
	}

	/**
	 * Close the HTTP client and the certificate store. Results that are
	 * still open must not be used afterwards.
	 */
	@Override
	public void close() {
		connectionFactory.close();
		if (certificateLoader != null) {
			certificateLoader.close();
		}
	}
}
