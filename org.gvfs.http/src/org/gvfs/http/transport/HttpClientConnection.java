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

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ProtocolException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.entity.ContentType;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.gvfs.annotations.NonNull;
import org.gvfs.http.internal.HttpText;

/**
 * A {@link HttpConnection} which uses Apache {@code HttpClient}.
 * <p>
 * The response entity is streamed: Apache reads the status line and headers
 * in {@code execute} and leaves the body on the wire until it is read.
 */
public class HttpClientConnection implements HttpConnection {
	private static final Set<String> METHODS = new HashSet<>(
			Arrays.asList(HttpSupport.METHOD_GET, HttpSupport.METHOD_HEAD,
					HttpSupport.METHOD_POST, HttpSupport.METHOD_PUT,
					"DELETE", "PATCH", "OPTIONS")); //$NON-NLS-1$ //$NON-NLS-2$ //$NON-NLS-3$

	private final CloseableHttpClient client;

	private final URI uri;

	private final String method;

	private final RequestBuilder builder;

	private volatile HttpUriRequest request;

	private volatile boolean aborted;

	private CloseableHttpResponse response;

	/**
	 * Constructor for HttpClientConnection.
	 *
	 * @param client
	 *            client sending the request; not closed by this connection
	 * @param uri
	 *            target of the request
	 * @param method
	 *            HTTP method
	 * @throws ProtocolException
	 *             if {@code method} is not a supported HTTP method
	 */
	public HttpClientConnection(CloseableHttpClient client, URI uri,
			String method) throws ProtocolException {
		String m = method.toUpperCase(Locale.ROOT);
		if (!METHODS.contains(m)) {
			throw new ProtocolException(MessageFormat
					.format(HttpText.get().unsupportedHttpMethod, method));
		}
		this.client = client;
		this.uri = uri;
		this.method = m;
		this.builder = RequestBuilder.create(m).setUri(uri);
	}

	@Override
	public URI getURI() {
		return uri;
	}

	@Override
	public String getRequestMethod() {
		return method;
	}

	@Override
	public void setRequestProperty(@NonNull String key, @NonNull String value) {
		builder.addHeader(key, value);
	}

	@Override
	public void setRequestBody(@NonNull String content,
			@NonNull String mediaType) {
		builder.setEntity(new StringEntity(content,
				ContentType.create(mediaType, StandardCharsets.UTF_8)));
	}

	@Override
	public int getResponseCode() throws IOException {
		execute();
		return response.getStatusLine().getStatusCode();
	}

	private void execute() throws IOException {
		if (response == null) {
			HttpUriRequest req = builder.build();
			request = req;
			if (aborted) {
				req.abort();
			}
			response = client.execute(req);
		}
	}

	@Override
	public String getHeaderField(@NonNull String name) {
		Header header = response.getFirstHeader(name);
		return header == null ? null : header.getValue();
	}

	@Override
	public String getContentType() {
		HttpEntity entity = response.getEntity();
		if (entity != null && entity.getContentType() != null) {
			return entity.getContentType().getValue();
		}
		return getHeaderField(HttpSupport.HDR_CONTENT_TYPE);
	}

	@Override
	public InputStream getInputStream() throws IOException {
		HttpEntity entity = response.getEntity();
		if (entity == null) {
			return new ByteArrayInputStream(new byte[0]);
		}
		return entity.getContent();
	}

	@Override
	public String getResponseBody() throws IOException {
		HttpEntity entity = response.getEntity();
		if (entity == null) {
			return ""; //$NON-NLS-1$
		}
		return EntityUtils.toString(entity, StandardCharsets.UTF_8);
	}

	@Override
	public void abort() {
		aborted = true;
		HttpUriRequest req = request;
		if (req != null) {
			req.abort();
		}
	}

	@Override
	public void close() throws IOException {
		if (response != null) {
			// Closing without consuming drops the connection instead of
			// draining a possibly large body.
			response.close();
		}
	}
}
