/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.http.internal;

import org.gvfs.nls.NLS;
import org.gvfs.nls.TranslationBundle;

/**
 * Translation bundle for the HTTP request layer
 */
public class HttpText extends TranslationBundle {

	/**
	 * Get an instance of this translation bundle.
	 *
	 * @return an instance of this translation bundle
	 */
	public static HttpText get() {
		return NLS.getBundleFor(HttpText.class);
	}

	// @formatter:off
	/***/ public String anonymousRequestRejected;
	/***/ public String certificateHasNoPrivateKey;
	/***/ public String certificateLoadFromDiskFailed;
	/***/ public String certificateNotFound;
	/***/ public String certificatePasswordHelperFailed;
	/***/ public String certificatePasswordMissing;
	/***/ public String certificatePasswordUnavailable;
	/***/ public String certificateStoreSearchFailed;
	/***/ public String certificateStoreUnavailable;
	/***/ public String certificateTrustRejected;
	/***/ public String invalidConfigValue;
	/***/ public String requestTimedOut;
	/***/ public String resultAlreadyReleased;
	/***/ public String serverErrorCode;
	/***/ public String serverErrorCodeAfterRenewal;
	/***/ public String serverErrorCodeCredentialsExpired;
	/***/ public String tlsProtocolsUnavailable;
	/***/ public String transportFailure;
	/***/ public String unsupportedHttpMethod;
}
