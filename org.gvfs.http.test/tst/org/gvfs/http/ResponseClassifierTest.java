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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.util.concurrent.CancellationException;

import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLPeerUnverifiedException;

import org.apache.http.NoHttpResponseException;
import org.apache.http.conn.ConnectTimeoutException;
import org.apache.http.conn.HttpHostConnectException;
import org.apache.http.impl.execchain.RequestAbortedException;
import org.gvfs.http.ResponseClassifier.Classification;
import org.gvfs.http.errors.HttpRequestException;
import org.gvfs.http.errors.HttpRequestException.Kind;
import org.gvfs.http.errors.HttpRequestException.TransportFailure;
import org.junit.jupiter.api.Test;

public class ResponseClassifierTest {

	private static final URI TARGET = URI
			.create("https://example.com/gvfs/objects");

	@Test
	void testTransientStatusesAreRetried() {
		assertTrue(ResponseClassifier.classify(408, false, false, "")
				.shouldRetry());
		assertTrue(ResponseClassifier.classify(401, false, false, "")
				.shouldRetry());
		for (int status = 500; status < 600; status++) {
			Classification c = ResponseClassifier.classify(status, false,
					false, "");
			assertTrue(c.shouldRetry(), "status " + status);
			assertFalse(c.isRevokeCredentials(), "status " + status);
		}
	}

	@Test
	void testOtherStatusesAreNotRetried() {
		for (int status : new int[] { 201, 204, 400, 403, 404, 409, 429,
				301, 302, 303, 307, 308 }) {
			assertFalse(ResponseClassifier.shouldRetry(status),
					"status " + status);
		}
	}

	@Test
	void testGenericMessage() {
		Classification c = ResponseClassifier.classify(404, false, false,
				"no such object");
		assertEquals(404, c.getStatusCode());
		assertFalse(c.shouldRetry());
		assertFalse(c.isRevokeCredentials());
		assertEquals(Kind.SERVER_ERROR, c.getKind());
		assertEquals(
				"Server returned error code 404 (Not Found). Original error message from server: no such object",
				c.getMessage());
	}

	@Test
	void testAnonymousUnauthorized() {
		Classification c = ResponseClassifier.classify(401, true, false,
				"go away");
		assertFalse(c.shouldRetry());
		assertFalse(c.isRevokeCredentials());
		assertEquals("Anonymous request was rejected with a 401",
				c.getMessage());
	}

	@Test
	void testUnauthorizedAsksForNewCredentials() {
		Classification c = ResponseClassifier.classify(401, false, false,
				"expired");
		assertTrue(c.shouldRetry());
		assertTrue(c.isRevokeCredentials());
		assertEquals(
				"Server returned error code 401 (Unauthorized). Your PAT may be expired and we are asking for a new one. Original error message from server: expired",
				c.getMessage());
	}

	@Test
	void testUnauthorizedAfterRenewal() {
		Classification c = ResponseClassifier.classify(401, false, true,
				"denied");
		assertTrue(c.shouldRetry());
		assertTrue(c.isRevokeCredentials());
		assertTrue(c.getMessage()
				.contains("You may not have access to this repo"));
		assertTrue(c.getMessage().endsWith("denied"));
	}

	@Test
	void testBadRequestAndRedirectsRevoke() {
		for (int status : new int[] { 400, 301, 302, 303, 307, 308 }) {
			Classification c = ResponseClassifier.classify(status, false,
					false, "");
			assertTrue(c.isRevokeCredentials(), "status " + status);
			assertFalse(c.shouldRetry(), "status " + status);
			assertTrue(c.getMessage().contains("asking for a new one"),
					"status " + status);
		}
	}

	@Test
	void testAnonymousBadRequestStillRevokes() {
		Classification c = ResponseClassifier.classify(400, true, false, "");
		assertTrue(c.isRevokeCredentials());
		assertFalse(c.shouldRetry());
	}

	@Test
	void testCancellationWins() {
		CancellationToken token = new CancellationToken();
		token.cancel();
		IOException cause = new SocketException("Socket closed");
		CancellationException e = assertThrows(CancellationException.class,
				() -> ResponseClassifier.classify(cause, TARGET, token));
		assertSame(cause, e.getCause());
	}

	@Test
	void testTimeouts() {
		for (IOException e : new IOException[] {
				new SocketTimeoutException("Read timed out"),
				new ConnectTimeoutException("connect timed out"),
				new RequestAbortedException("Request aborted") }) {
			Classification c = ResponseClassifier.classify(e, TARGET,
					new CancellationToken());
			assertEquals(408, c.getStatusCode());
			assertTrue(c.shouldRetry());
			assertEquals(Kind.TIMEOUT, c.getKind());
			assertEquals("Request to " + TARGET + " timed out", c.getMessage());
		}
	}

	@Test
	void testTrustRejection() {
		for (IOException e : new IOException[] {
				new SSLHandshakeException("PKIX path building failed"),
				new SSLPeerUnverifiedException("peer not authenticated") }) {
			Classification c = ResponseClassifier.classify(e, TARGET,
					CancellationToken.NONE);
			assertEquals(401, c.getStatusCode());
			assertFalse(c.shouldRetry());
			assertFalse(c.isRevokeCredentials());
			assertEquals(Kind.CERTIFICATE_TRUST_REJECTED, c.getKind());
		}
	}

	@Test
	void testTransportFailures() {
		assertTransportFailure(new UnknownHostException("example.com"),
				TransportFailure.UNKNOWN_HOST);
		assertTransportFailure(new ConnectException("Connection refused"),
				TransportFailure.CONNECTION_REFUSED);
		assertTransportFailure(
				new HttpHostConnectException(
						new ConnectException("Connection refused"), null),
				TransportFailure.CONNECTION_REFUSED);
		assertTransportFailure(new SocketException("Connection reset"),
				TransportFailure.CONNECTION_RESET);
		assertTransportFailure(
				new NoHttpResponseException("failed to respond"),
				TransportFailure.CONNECTION_RESET);
		assertTransportFailure(new IOException("something else"),
				TransportFailure.OTHER);
	}

	private static void assertTransportFailure(IOException e,
			TransportFailure expected) {
		Classification c = ResponseClassifier.classify(e, TARGET,
				CancellationToken.NONE);
		assertEquals(500, c.getStatusCode());
		assertTrue(c.shouldRetry());
		assertEquals(Kind.TRANSPORT_FAILURE, c.getKind());
		assertEquals(expected, c.getTransportFailure());

		HttpRequestException ex = c.toException(e);
		assertSame(e, ex.getCause());
		assertEquals(expected, ex.getTransportFailure());
		assertEquals(500, ex.getStatusCode());
	}

	@Test
	void testServerErrorsHaveNoTransportFailure() {
		assertNull(ResponseClassifier.classify(503, false, false, "")
				.getTransportFailure());
	}
}
