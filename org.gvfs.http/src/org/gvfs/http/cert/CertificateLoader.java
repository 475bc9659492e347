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
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;

import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;

import org.gvfs.annotations.Nullable;
import org.gvfs.http.internal.HttpText;
import org.gvfs.http.tracing.EventMetadata;
import org.gvfs.http.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the client certificate configured by {@code http.sslCert}.
 * <p>
 * An identifier naming an existing file is loaded as a PKCS#12 (or other
 * key store) file. Any other identifier is matched against the subject names
 * of the entries in a {@link CertificateStore}. Failures are reported to the
 * {@link Tracer} and yield no certificate; they never fail the caller.
 */
public class CertificateLoader implements AutoCloseable {
	private static final Logger LOG = LoggerFactory
			.getLogger(CertificateLoader.class);

	static final String EXCEPTION_KEY = "Exception"; //$NON-NLS-1$

	private final Tracer tracer;

	private final CertificateStore store;

	private final X509TrustManager trustManager;

	/**
	 * Create a loader validating chains against the JVM's default trust
	 * store.
	 *
	 * @param tracer
	 *            receives errors
	 * @param store
	 *            searched for identifiers that are not files
	 * @throws GeneralSecurityException
	 *             if the default trust manager cannot be created
	 */
	public CertificateLoader(Tracer tracer, CertificateStore store)
			throws GeneralSecurityException {
		this(tracer, store, defaultTrustManager());
	}

	/**
	 * Constructor for CertificateLoader.
	 *
	 * @param tracer
	 *            receives errors
	 * @param store
	 *            searched for identifiers that are not files
	 * @param trustManager
	 *            decides whether a certificate chain is trusted when only
	 *            valid certificates are wanted
	 */
	public CertificateLoader(Tracer tracer, CertificateStore store,
			X509TrustManager trustManager) {
		this.tracer = tracer;
		this.store = store;
		this.trustManager = trustManager;
	}

	/**
	 * Get the JVM's default X.509 trust manager.
	 *
	 * @return the default trust manager
	 * @throws GeneralSecurityException
	 *             if none is available
	 */
	public static X509TrustManager defaultTrustManager()
			throws GeneralSecurityException {
		TrustManagerFactory tmf = TrustManagerFactory
				.getInstance(TrustManagerFactory.getDefaultAlgorithm());
		tmf.init((KeyStore) null);
		for (TrustManager tm : tmf.getTrustManagers()) {
			if (tm instanceof X509TrustManager) {
				return (X509TrustManager) tm;
			}
		}
		throw new GeneralSecurityException(
				"No X509TrustManager in " + tmf.getAlgorithm()); //$NON-NLS-1$
	}

	/**
	 * Resolve a certificate identifier.
	 *
	 * @param certificateId
	 *            a file path or a subject name fragment
	 * @param passwordProvider
	 *            asked for the file's password; {@code null} if the file is
	 *            not password protected. Never consulted for store lookups.
	 * @param requireValid
	 *            whether to reject certificates that are expired or not
	 *            trusted
	 * @return the certificate, or {@code null} if none could be resolved
	 */
	@Nullable
	public ClientCertificate resolve(String certificateId,
			@Nullable CertificatePasswordProvider passwordProvider,
			boolean requireValid) {
		File file = new File(certificateId);
		if (file.isFile()) {
			return loadFromFile(file, certificateId, passwordProvider,
					requireValid);
		}
		ClientCertificate found;
		try {
			found = findInStore(certificateId, requireValid);
		} catch (GeneralSecurityException | IOException e) {
			tracer.relatedError(new EventMetadata().add(EXCEPTION_KEY, e),
					MessageFormat.format(
							HttpText.get().certificateStoreSearchFailed,
							certificateId));
			return null;
		}
		if (found != null) {
			return found;
		}
		tracer.relatedError(MessageFormat
				.format(HttpText.get().certificateNotFound, certificateId));
		return null;
	}

	@Nullable
	private ClientCertificate loadFromFile(File file, String certificateId,
			@Nullable CertificatePasswordProvider passwordProvider,
			boolean requireValid) {
		char[] password = passwordFor(certificateId, passwordProvider);
		try {
			KeyStore ks = KeyStore.getInstance(file, password);
			ClientCertificate cert = firstKeyEntry(ks,
					password != null ? password : new char[0], null);
			if (cert == null) {
				tracer.relatedError(MessageFormat.format(
						HttpText.get().certificateHasNoPrivateKey,
						certificateId));
				return null;
			}
			if (requireValid && !isValid(cert.getChain())) {
				LOG.debug("Ignoring certificate {} which is not valid", //$NON-NLS-1$
						certificateId);
				return null;
			}
			return cert;
		} catch (GeneralSecurityException | IOException e) {
			tracer.relatedError(new EventMetadata().add(EXCEPTION_KEY, e),
					HttpText.get().certificateLoadFromDiskFailed);
			return null;
		} finally {
			if (password != null) {
				Arrays.fill(password, '\0');
			}
		}
	}

	@Nullable
	private char[] passwordFor(String certificateId,
			@Nullable CertificatePasswordProvider passwordProvider) {
		if (passwordProvider == null) {
			return null;
		}
		try {
			return passwordProvider.getPassword(certificateId);
		} catch (CertificatePasswordException e) {
			tracer.relatedError(new EventMetadata().add(EXCEPTION_KEY, e),
					MessageFormat.format(
							HttpText.get().certificatePasswordUnavailable,
							certificateId, e.getMessage()));
			return null;
		}
	}

	@Nullable
	private ClientCertificate findInStore(String subjectName,
			boolean requireValid)
			throws GeneralSecurityException, IOException {
		KeyStore ks = store.getKeyStore();
		char[] keyPassword = store.getKeyPassword();
		try {
			String needle = subjectName.toLowerCase(Locale.ROOT);
			for (String alias : Collections.list(ks.aliases())) {
				if (!ks.isKeyEntry(alias)) {
					continue;
				}
				X509Certificate[] chain = x509Chain(
						ks.getCertificateChain(alias));
				if (chain == null || !chain[0].getSubjectX500Principal()
						.getName().toLowerCase(Locale.ROOT).contains(needle)) {
					continue;
				}
				if (requireValid && !isValid(chain)) {
					continue;
				}
				ClientCertificate cert = firstKeyEntry(ks, keyPassword, alias);
				if (cert != null) {
					return cert;
				}
			}
			return null;
		} finally {
			if (keyPassword != null) {
				Arrays.fill(keyPassword, '\0');
			}
		}
	}

	@Nullable
	private static ClientCertificate firstKeyEntry(KeyStore ks,
			@Nullable char[] keyPassword, @Nullable String onlyAlias)
			throws GeneralSecurityException {
		Iterable<String> aliases = onlyAlias != null
				? Collections.singletonList(onlyAlias)
				: Collections.list(ks.aliases());
		for (String alias : aliases) {
			if (!ks.isKeyEntry(alias)) {
				continue;
			}
			Key key = ks.getKey(alias, keyPassword);
			X509Certificate[] chain = x509Chain(ks.getCertificateChain(alias));
			if (key instanceof PrivateKey && chain != null) {
				return new ClientCertificate(alias, (PrivateKey) key, chain);
			}
		}
		return null;
	}

	@Nullable
	private static X509Certificate[] x509Chain(
			@Nullable Certificate[] chain) {
		if (chain == null || chain.length == 0) {
			return null;
		}
		X509Certificate[] result = new X509Certificate[chain.length];
		for (int i = 0; i < chain.length; i++) {
			if (!(chain[i] instanceof X509Certificate)) {
				return null;
			}
			result[i] = (X509Certificate) chain[i];
		}
		return result;
	}

	/**
	 * Check that every certificate of a chain is within its validity period
	 * and that the chain is trusted for client authentication.
	 *
	 * @param chain
	 *            certificate chain, leaf first
	 * @return whether the chain is valid
	 */
	boolean isValid(X509Certificate[] chain) {
		try {
			for (X509Certificate c : chain) {
				c.checkValidity();
			}
			trustManager.checkClientTrusted(chain,
					chain[0].getPublicKey().getAlgorithm());
			return true;
		} catch (CertificateException e) {
			LOG.debug("Certificate {} is not valid: {}", //$NON-NLS-1$
					chain[0].getSubjectX500Principal(), e.getMessage());
			return false;
		}
	}

	@Override
	public void close() {
		store.close();
	}
}
