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

import java.time.Duration;
import java.util.Map;

/**
 * Timeout and retry limits handed to requestors and to the retry loop
 * driving them.
 */
public class RetryConfig {

	/** Config key for the request timeout in seconds. */
	public static final String TIMEOUT_SECONDS_KEY = "gvfs.timeout-seconds"; //$NON-NLS-1$

	/** Config key for the maximum number of retries. */
	public static final String MAX_RETRIES_KEY = "gvfs.max-retries"; //$NON-NLS-1$

	/** Default request timeout. */
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

	/** Default maximum number of retries. */
	public static final int DEFAULT_MAX_RETRIES = 6;

	private final int maxRetries;

	private final Duration timeout;

	/**
	 * Create a configuration with the default limits.
	 */
	public RetryConfig() {
		this(DEFAULT_MAX_RETRIES, DEFAULT_TIMEOUT);
	}

	/**
	 * Constructor for RetryConfig.
	 *
	 * @param maxRetries
	 *            maximum number of retries; not negative
	 * @param timeout
	 *            time allowed for one attempt; positive
	 */
	public RetryConfig(int maxRetries, Duration timeout) {
		if (maxRetries < 0) {
			throw ConfigEntries.invalid(MAX_RETRIES_KEY,
					String.valueOf(maxRetries));
		}
		if (timeout.isZero() || timeout.isNegative()) {
			throw ConfigEntries.invalid(TIMEOUT_SECONDS_KEY,
					String.valueOf(timeout.getSeconds()));
		}
		this.maxRetries = maxRetries;
		this.timeout = timeout;
	}

	/**
	 * Read the configuration from git config entries.
	 *
	 * @param config
	 *            git config entries keyed "section.key"
	 * @return the configuration
	 * @throws IllegalArgumentException
	 *             if a value is not a valid number
	 */
	public static RetryConfig fromConfig(Map<String, String> config) {
		ConfigEntries entries = new ConfigEntries(config);
		int retries = entries.getInt(MAX_RETRIES_KEY, DEFAULT_MAX_RETRIES);
		int seconds = entries.getInt(TIMEOUT_SECONDS_KEY,
				(int) DEFAULT_TIMEOUT.getSeconds());
		return new RetryConfig(retries, Duration.ofSeconds(seconds));
	}

	/**
	 * @return maximum number of retries
	 */
	public int getMaxRetries() {
		return maxRetries;
	}

	/**
	 * @return time allowed for one attempt
	 */
	public Duration getTimeout() {
		return timeout;
	}
}
