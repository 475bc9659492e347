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
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

public class RetryConfigTest {

	@Test
	void testDefaults() {
		RetryConfig c = RetryConfig.fromConfig(Collections.emptyMap());
		assertEquals(RetryConfig.DEFAULT_MAX_RETRIES, c.getMaxRetries());
		assertEquals(RetryConfig.DEFAULT_TIMEOUT, c.getTimeout());
	}

	@Test
	void testFromConfig() {
		Map<String, String> config = new HashMap<>();
		config.put("gvfs.max-retries", "0");
		config.put("gvfs.timeout-seconds", " 90 ");
		RetryConfig c = RetryConfig.fromConfig(config);
		assertEquals(0, c.getMaxRetries());
		assertEquals(Duration.ofSeconds(90), c.getTimeout());
	}

	@Test
	void testRejectsNegativeRetries() {
		assertThrows(IllegalArgumentException.class,
				() -> new RetryConfig(-1, Duration.ofSeconds(1)));
	}

	@Test
	void testRejectsNonPositiveTimeout() {
		assertThrows(IllegalArgumentException.class,
				() -> new RetryConfig(1, Duration.ZERO));
		assertThrows(IllegalArgumentException.class,
				() -> RetryConfig.fromConfig(Collections
						.singletonMap(RetryConfig.TIMEOUT_SECONDS_KEY, "-5")));
	}

	@Test
	void testRejectsNonNumeric() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> RetryConfig.fromConfig(Collections
						.singletonMap(RetryConfig.MAX_RETRIES_KEY, "many")));
		assertInstanceOf(NumberFormatException.class, e.getCause());
	}
}
