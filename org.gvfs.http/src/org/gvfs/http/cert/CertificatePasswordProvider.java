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
 * Supplies the password protecting a client certificate file.
 */
@FunctionalInterface
public interface CertificatePasswordProvider {

	/**
	 * Get the password for a certificate. The caller clears the returned
	 * array once the certificate has been loaded.
	 *
	 * @param certificateId
	 *            path of the certificate file
	 * @return the password
	 * @throws CertificatePasswordException
	 *             if no password can be obtained
	 */
	char[] getPassword(String certificateId)
			throws CertificatePasswordException;
}
