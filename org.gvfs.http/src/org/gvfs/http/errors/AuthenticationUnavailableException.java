/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http.errors;

/**
 * Thrown by a {@link org.gvfs.http.auth.GitAuthentication} that cannot supply
 * credentials for a request.
 */
public class AuthenticationUnavailableException extends Exception {
	private static final long serialVersionUID = 1L;

	/**
	 * Constructor for AuthenticationUnavailableException.
	 *
	 * @param message
	 *            error message, which may be shown to an end-user.
	 */
	public AuthenticationUnavailableException(String message) {
		super(message);
	}

	/**
	 * Constructor for AuthenticationUnavailableException.
	 *
	 * @param message
	 *            error message, which may be shown to an end-user.
	 * @param cause
	 *            the underlying failure
	 */
	public AuthenticationUnavailableException(String message,
			Throwable cause) {
		super(message, cause);
	}
}
