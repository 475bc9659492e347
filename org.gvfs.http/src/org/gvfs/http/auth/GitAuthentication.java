/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http.auth;

import org.gvfs.annotations.Nullable;
import org.gvfs.http.errors.AuthenticationUnavailableException;

/**
 * Source of the credentials sent with each request.
 * <p>
 * The backend owns the credential lifecycle: it obtains a token, learns from
 * the request layer whether the token worked, and throws a token away when
 * the server rejects it. Implementations are called concurrently from
 * independent request attempts and must serialize internally.
 */
public interface GitAuthentication {

	/**
	 * @return {@code true} if requests are sent without credentials
	 */
	boolean isAnonymous();

	/**
	 * @return {@code true} if the backend renewed its credentials recently
	 *         and will not renew them again for a while
	 */
	boolean isBackingOff();

	/**
	 * Get the value for a Basic {@code Authorization} header.
	 *
	 * @return the encoded credentials
	 * @throws AuthenticationUnavailableException
	 *             if no credentials can be produced; the message explains why
	 */
	String getCredentials() throws AuthenticationUnavailableException;

	/**
	 * Report that a request using {@code credentials} was accepted.
	 *
	 * @param credentials
	 *            the credentials that worked, {@code null} when anonymous
	 */
	void confirmCredentialsWorked(@Nullable String credentials);

	/**
	 * Report that the server rejected {@code credentials}; the backend should
	 * not hand them out again.
	 *
	 * @param credentials
	 *            the rejected credentials, {@code null} when anonymous
	 */
	void revoke(@Nullable String credentials);
}
