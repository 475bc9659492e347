/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http.cert;

/**
 * Thrown when the password of a client certificate cannot be obtained.
 */
public class CertificatePasswordException extends Exception {
	private static final long serialVersionUID = 1L;

	/**
	 * Constructor for CertificatePasswordException.
	 *
	 * @param message
	 *            why the password is unavailable
	 */
	public CertificatePasswordException(String message) {
		super(message);
	}

	/**
	 * Constructor for CertificatePasswordException.
	 *
	 * @param message
	 *            why the password is unavailable
	 * @param cause
	 *            the underlying failure
	 */
	public CertificatePasswordException(String message, Throwable cause) {
		super(message, cause);
	}
}
