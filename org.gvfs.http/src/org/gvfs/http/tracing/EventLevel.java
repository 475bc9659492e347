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

/**
 * Severity of a traced event.
 */
public enum EventLevel {
	/** Always recorded. */
	LOG_ALWAYS,

	/** Failures that need attention. */
	ERROR,

	/** Unexpected but recoverable conditions. */
	WARNING,

	/** Regular operational events. */
	INFORMATIONAL,

	/** Detailed diagnostics. */
	VERBOSE
}
