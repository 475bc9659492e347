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

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.util.Arrays;
import java.util.Locale;

import org.gvfs.annotations.Nullable;
import org.gvfs.http.internal.HttpText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read-only handle on the certificate store searched for client certificates
 * that are not given as a file.
 * <p>
 * The underlying {@link KeyStore} is opened on first use and then reused for
 * the lifetime of the handle.
 */
public class CertificateStore implements AutoCloseable {
	private static final Logger LOG = LoggerFactory
			.getLogger(CertificateStore.class);

	/**
	 * Opens the key store backing a {@link CertificateStore}.
	 */
	@FunctionalInterface
	public interface Opener {
		/**
		 * @param password
		 *            a copy of the store's password, or {@code null}; it is
		 *            zero-filled once this method returns
		 * @return the opened key store
		 * @throws GeneralSecurityException
		 *             if the store cannot be read
		 * @throws IOException
		 *             if the store cannot be read
		 */
		KeyStore open(@Nullable char[] password)
				throws GeneralSecurityException, IOException;
	}

	private final Opener opener;

	@Nullable
	private final char[] keyPassword;

	private final Object lock = new Object();

	private volatile KeyStore keyStore;

	private boolean closed;

	/**
	 * Constructor for CertificateStore.
	 *
	 * @param opener
	 *            opens the key store on first use
	 * @param keyPassword
	 *            password protecting the store and its private keys, or
	 *            {@code null} if they need none
	 */
	public CertificateStore(Opener opener, @Nullable char[] keyPassword) {
		this.opener = opener;
		this.keyPassword = keyPassword == null ? null : keyPassword.clone();
	}

	/**
	 * Create a handle on the platform's personal certificate store: the
	 * Windows "MY" store, the macOS keychain, or elsewhere the key store
	 * named by the {@code javax.net.ssl.keyStore} system properties.
	 *
	 * @return a handle on the platform store; nothing is opened yet
	 */
	public static CertificateStore platform() {
		String os = System.getProperty("os.name", "") //$NON-NLS-1$ //$NON-NLS-2$
				.toLowerCase(Locale.ROOT);
		if (os.startsWith("windows")) { //$NON-NLS-1$
			return new CertificateStore(
					noPassword -> openBuiltIn("Windows-MY"), null); //$NON-NLS-1$
		}
		if (os.startsWith("mac")) { //$NON-NLS-1$
			return new CertificateStore(
					noPassword -> openBuiltIn("KeychainStore"), null); //$NON-NLS-1$
		}
		String pw = System.getProperty("javax.net.ssl.keyStorePassword"); //$NON-NLS-1$
		char[] password = pw == null ? null : pw.toCharArray();
		try {
			return new CertificateStore(
					CertificateStore::openFromSystemProperties, password);
		} finally {
			if (password != null) {
				Arrays.fill(password, '\0');
			}
		}
	}

	private static KeyStore openBuiltIn(String type)
			throws GeneralSecurityException, IOException {
		KeyStore ks = KeyStore.getInstance(type);
		ks.load(null, null);
		return ks;
	}

	private static KeyStore openFromSystemProperties(
			@Nullable char[] password)
			throws GeneralSecurityException, IOException {
		String path = System.getProperty("javax.net.ssl.keyStore"); //$NON-NLS-1$
		if (path == null || path.isEmpty() || "NONE".equals(path)) { //$NON-NLS-1$
			throw new KeyStoreException(
					HttpText.get().certificateStoreUnavailable);
		}
		String type = System.getProperty("javax.net.ssl.keyStoreType"); //$NON-NLS-1$
		if (type == null || type.isEmpty()) {
			return KeyStore.getInstance(new File(path), password);
		}
		KeyStore ks = KeyStore.getInstance(type);
		try (InputStream in = new FileInputStream(path)) {
			ks.load(in, password);
		}
		return ks;
	}

	/**
	 * Get the key store, opening it if this is the first use.
	 *
	 * @return the opened key store
	 * @throws GeneralSecurityException
	 *             if the store cannot be opened
	 * @throws IOException
	 *             if the store cannot be opened
	 */
	public KeyStore getKeyStore() throws GeneralSecurityException, IOException {
		KeyStore ks = keyStore;
		if (ks != null) {
			return ks;
		}
		synchronized (lock) {
			if (closed) {
				throw new IllegalStateException();
			}
			if (keyStore == null) {
				char[] password = keyPassword == null ? null
						: keyPassword.clone();
				try {
					keyStore = opener.open(password);
				} finally {
					if (password != null) {
						Arrays.fill(password, '\0');
					}
				}
				LOG.debug("Opened certificate store of type {}", //$NON-NLS-1$
						keyStore.getType());
			}
			return keyStore;
		}
	}

	/**
	 * @return whether the key store has been opened
	 */
	public boolean isOpen() {
		return keyStore != null;
	}

	/**
	 * @return a copy of the password protecting the private keys, or
	 *         {@code null}
	 */
	@Nullable
	public char[] getKeyPassword() {
		return keyPassword == null ? null : keyPassword.clone();
	}

	@Override
	public void close() {
		synchronized (lock) {
			closed = true;
			keyStore = null;
			if (keyPassword != null) {
				Arrays.fill(keyPassword, '\0');
			}
		}
	}
}
