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
import java.net.URI;

/**
 * Creates {@link HttpConnection}s sharing one client configuration (TLS
 * material, timeouts, connection pool).
 */
public interface HttpConnectionFactory extends Closeable {

	/**
	 * Create a connection; nothing is sent yet.
	 *
	 * @param uri
	 *            target of the request
	 * @param method
	 *            HTTP method, e.g. {@link HttpSupport#METHOD_GET}
	 * @return a new connection
	 * @throws IOException
	 *             if the connection cannot be created
	 */
	HttpConnection create(URI uri, String method) throws IOException;

	/**
	 * Release the client and everything it holds.
	 */
	@Override
	void close();
}
