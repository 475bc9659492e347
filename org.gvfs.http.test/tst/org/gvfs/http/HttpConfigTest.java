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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class HttpConfigTest {

	@Test
	void testDefaults() {
		HttpConfig c = HttpConfig.fromConfig(Collections.emptyMap());
		assertTrue(c.isSslVerify());
		assertNull(c.getSslCert());
		assertFalse(c.isSslCertPasswordProtected());
	}

	@Test
	void testKeysAreCaseInsensitive() {
		Map<String, String> config = new HashMap<>();
		config.put("HTTP.SSLVERIFY", "false");
		config.put("http.sslcert", "/home/user/client.p12");
		config.put("http.sslCertPasswordProtected", "yes");
		HttpConfig c = HttpConfig.fromConfig(config);
		assertFalse(c.isSslVerify());
		assertEquals("/home/user/client.p12", c.getSslCert());
		assertTrue(c.isSslCertPasswordProtected());
	}

	@Test
	void testBareKeyMeansTrue() {
		Map<String, String> config = new HashMap<>();
		config.put(HttpConfig.SSL_VERIFY_KEY, "off");
		config.put(HttpConfig.SSL_CERT_PASSWORD_PROTECTED_KEY, null);
		HttpConfig c = HttpConfig.fromConfig(config);
		assertFalse(c.isSslVerify());
		assertTrue(c.isSslCertPasswordProtected());
	}

	@Test
	void testEmptyCertIsUnset() {
		assertNull(new HttpConfig(true, "", false).getSslCert());
	}

	@Test
	void testInvalidBoolean() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> HttpConfig.fromConfig(Collections
						.singletonMap(HttpConfig.SSL_VERIFY_KEY, "sometimes")));
		assertTrue(e.getMessage().contains(HttpConfig.SSL_VERIFY_KEY),
				e.getMessage());
		assertTrue(e.getMessage().contains("sometimes"), e.getMessage());
	}
}
