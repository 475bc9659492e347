/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http.tracing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;

public class Slf4jTracerTest {

	private Logger log;

	private Slf4jTracer tracer;

	@BeforeEach
	public void setup() {
		log = mock(Logger.class);
		when(log.isInfoEnabled()).thenReturn(true);
		when(log.isErrorEnabled()).thenReturn(true);
		when(log.isWarnEnabled()).thenReturn(true);
		tracer = new Slf4jTracer(log);
	}

	@Test
	void testInformationalEvent() {
		EventMetadata m = new EventMetadata().add("RequestId", Long.valueOf(7))
				.add("CacheName", "").add("responseWaitTimeMS", "1.2500");
		tracer.relatedEvent(EventLevel.INFORMATIONAL, "NetworkResponse", m);
		verify(log).info("{} {}", "NetworkResponse",
				"{\"RequestId\":7,\"CacheName\":\"\",\"responseWaitTimeMS\":\"1.2500\"}");
	}

	@Test
	void testLevels() {
		EventMetadata m = new EventMetadata();
		tracer.relatedEvent(EventLevel.ERROR, "E", m);
		tracer.relatedEvent(EventLevel.WARNING, "W", m);
		tracer.relatedEvent(EventLevel.LOG_ALWAYS, "A", m);
		tracer.relatedEvent(EventLevel.VERBOSE, "V", m);
		verify(log).error("{} {}", "E", "{}");
		verify(log).warn("{} {}", "W", "{}");
		verify(log).info("{} {}", "A", "{}");
		verify(log, never()).debug(anyString(), anyString(), anyString());
	}

	@Test
	void testErrorAddsMessage() {
		EventMetadata m = new EventMetadata().add("Exception",
				new IOException("boom"));
		tracer.relatedError(m, "Error, while loading certificate from disk");
		verify(log).error("{} {}", "Error",
				"{\"Exception\":\"java.io.IOException: boom\",\"ErrorMessage\":\"Error, while loading certificate from disk\"}");
		assertFalse(m.containsKey("ErrorMessage"));
	}

	@Test
	void testNullsAreKept() {
		assertEquals("{\"ContentType\":null}",
				Slf4jTracer.toJson(new EventMetadata().add("ContentType", null)));
	}
}
