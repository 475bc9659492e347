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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.InterruptedIOException;
import java.net.ProtocolException;
import java.net.URI;
import java.time.Duration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class HttpClientConnectionTest {

	private static final URI TARGET = URI.create("http://127.0.0.1:1/gvfs/config");

	private HttpClientConnectionFactory factory;

	@BeforeEach
	public void setup() throws Exception {
		factory = new HttpClientConnectionFactory(true, null,
				Duration.ofSeconds(5), 2);
	}

	@AfterEach
	public void tearDown() {
		factory.close();
	}

	@Test
	void testUnsupportedMethod() {
		assertThrows(ProtocolException.class,
				() -> factory.create(TARGET, "BREW"));
	}

	@Test
	void testMethodIsNormalized() throws Exception {
		try (HttpConnection c = factory.create(TARGET, "post")) {
			assertEquals("POST", c.getRequestMethod());
			assertEquals(TARGET, c.getURI());
		}
	}

	@Test
	void testAbortBeforeSend() throws Exception {
		try (HttpConnection c = factory.create(TARGET, "GET")) {
			c.abort();
			assertThrows(InterruptedIOException.class, c::getResponseCode);
		}
	}
}
