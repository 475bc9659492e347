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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.util.concurrent.atomic.AtomicInteger;

import org.gvfs.http.errors.HttpRequestException;
import org.gvfs.http.errors.HttpRequestException.Kind;
import org.junit.jupiter.api.Test;

public class RequestAttemptResultTest {

	@Test
	void testSuccess() {
		AtomicInteger releases = new AtomicInteger();
		RequestAttemptResult r = RequestAttemptResult.success(3,
				"application/json",
				new ByteArrayInputStream("{}".getBytes(UTF_8)),
				releases::incrementAndGet);
		assertTrue(r.isSucceeded());
		assertEquals(200, r.getStatusCode());
		assertEquals("application/json", r.getContentType());
		assertFalse(r.shouldRetry());
		assertNull(r.getError());
		assertFalse(r.isReleased());

		r.release();
		assertTrue(r.isReleased());
		assertEquals(1, releases.get());
	}

	@Test
	void testSecondReleaseFails() {
		AtomicInteger releases = new AtomicInteger();
		RequestAttemptResult r = RequestAttemptResult.success(4, "",
				new ByteArrayInputStream(new byte[0]),
				releases::incrementAndGet);
		r.release();
		IllegalStateException e = assertThrows(IllegalStateException.class,
				r::release);
		assertTrue(e.getMessage().contains("4"));
		assertEquals(1, releases.get());
	}

	@Test
	void testCloseIsIdempotent() {
		AtomicInteger releases = new AtomicInteger();
		try (RequestAttemptResult r = RequestAttemptResult.success(5, "",
				new ByteArrayInputStream(new byte[0]),
				releases::incrementAndGet)) {
			r.close();
		}
		assertEquals(1, releases.get());
	}

	@Test
	void testFailure() {
		HttpRequestException error = new HttpRequestException(
				Kind.SERVER_ERROR, 503, "unavailable");
		RequestAttemptResult r = RequestAttemptResult.failure(6, error, true,
				null);
		assertFalse(r.isSucceeded());
		assertEquals(503, r.getStatusCode());
		assertTrue(r.shouldRetry());
		assertEquals(error, r.getError());
		assertNull(r.getStream());
		assertNull(r.getContentType());
		r.close();
		assertTrue(r.isReleased());
	}
}
