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

import java.io.IOException;
import java.net.URI;
import java.security.GeneralSecurityException;
import java.time.Duration;

import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;

import org.apache.http.client.config.RequestConfig;
import org.apache.http.config.Registry;
import org.apache.http.config.RegistryBuilder;
import org.apache.http.conn.socket.ConnectionSocketFactory;
import org.apache.http.conn.socket.PlainConnectionSocketFactory;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.gvfs.annotations.Nullable;
import org.gvfs.http.cert.ClientCertificate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link HttpConnectionFactory} returning {@link HttpClientConnection}s
 * backed by one pooled Apache {@code HttpClient}.
 * <p>
 * The client never follows redirects and never retries on its own: both are
 * decisions of the request layer above it. Connections are restricted to
 * {@link HttpSupport#tlsProtocols()}.
 */
public class HttpClientConnectionFactory implements HttpConnectionFactory {
	private static final Logger LOG = LoggerFactory
			.getLogger(HttpClientConnectionFactory.class);

	private static final String HTTP = "http"; //$NON-NLS-1$

	private static final String HTTPS = "https"; //$NON-NLS-1$

	private final CloseableHttpClient client;

	/**
	 * Create a factory.
	 *
	 * @param sslVerify
	 *            whether server certificates and host names are checked;
	 *            {@code false} trusts every server
	 * @param clientCertificate
	 *            certificate presented to servers asking for one, or
	 *            {@code null}
	 * @param timeout
	 *            limit applied to connecting, to each socket read and to
	 *            waiting for a pooled connection
	 * @param maxConnections
	 *            size of the connection pool, per route and in total
	 * @throws GeneralSecurityException
	 *             if the TLS context cannot be created
	 */
	public HttpClientConnectionFactory(boolean sslVerify,
			@Nullable ClientCertificate clientCertificate, Duration timeout,
			int maxConnections) throws GeneralSecurityException {
		SSLContext ctx = SSLContext.getInstance("TLS"); //$NON-NLS-1$
		KeyManager[] km = clientCertificate != null
				? clientCertificate.getKeyManagers()
				: null;
		TrustManager[] tm = sslVerify ? null
				: new TrustManager[] { new NoCheckX509TrustManager() };
		ctx.init(km, tm, null);
		HostnameVerifier hostnameVerifier = sslVerify
				? SSLConnectionSocketFactory.getDefaultHostnameVerifier()
				: NoopHostnameVerifier.INSTANCE;

		Registry<ConnectionSocketFactory> sockets = RegistryBuilder
				.<ConnectionSocketFactory> create()
				.register(HTTP, PlainConnectionSocketFactory.getSocketFactory())
				.register(HTTPS,
						new SSLConnectionSocketFactory(ctx,
								HttpSupport.tlsProtocols(), null,
								hostnameVerifier))
				.build();
		PoolingHttpClientConnectionManager pool = new PoolingHttpClientConnectionManager(
				sockets);
		pool.setMaxTotal(maxConnections);
		pool.setDefaultMaxPerRoute(maxConnections);

		int millis = (int) Math.min(timeout.toMillis(), Integer.MAX_VALUE);
		RequestConfig requestConfig = RequestConfig.custom()
				.setConnectTimeout(millis).setSocketTimeout(millis)
				.setConnectionRequestTimeout(millis)
				.setRedirectsEnabled(false).build();

		client = HttpClients.custom().setConnectionManager(pool)
				.setDefaultRequestConfig(requestConfig)
				.disableRedirectHandling().disableAutomaticRetries()
				.disableContentCompression().disableCookieManagement()
				.build();
		if (LOG.isDebugEnabled()) {
			LOG.debug(
					"HTTP client created: sslVerify={}, clientCertificate={}, timeout={}ms, maxConnections={}", //$NON-NLS-1$
					Boolean.valueOf(sslVerify),
					clientCertificate != null ? clientCertificate.getAlias()
							: null,
					Integer.valueOf(millis), Integer.valueOf(maxConnections));
		}
	}

	@Override
	public HttpConnection create(URI uri, String method) throws IOException {
		return new HttpClientConnection(client, uri, method);
	}

	@Override
	public void close() {
		try {
			client.close();
		} catch (IOException e) {
			LOG.warn("Closing the HTTP client failed", e); //$NON-NLS-1$
		}
	}
}
