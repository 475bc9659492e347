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

import java.net.Socket;
import java.security.Principal;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Arrays;

import javax.net.ssl.KeyManager;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedKeyManager;

import org.gvfs.annotations.Nullable;

/**
 * A certificate chain with its private key, ready to be presented to servers
 * requesting TLS client authentication.
 */
public final class ClientCertificate {
	private final String alias;

	private final PrivateKey privateKey;

	private final X509Certificate[] chain;

	/**
	 * Constructor for ClientCertificate.
	 *
	 * @param alias
	 *            name of the entry the certificate was read from
	 * @param privateKey
	 *            key matching the first certificate of {@code chain}
	 * @param chain
	 *            certificate chain, leaf first; must not be empty
	 */
	public ClientCertificate(String alias, PrivateKey privateKey,
			X509Certificate[] chain) {
		if (chain.length == 0) {
			throw new IllegalArgumentException();
		}
		this.alias = alias;
		this.privateKey = privateKey;
		this.chain = chain.clone();
	}

	/**
	 * @return name of the entry the certificate was read from
	 */
	public String getAlias() {
		return alias;
	}

	/**
	 * @return the leaf certificate
	 */
	public X509Certificate getCertificate() {
		return chain[0];
	}

	/**
	 * @return the certificate chain, leaf first
	 */
	public X509Certificate[] getChain() {
		return chain.clone();
	}

	/**
	 * @return the private key of the leaf certificate
	 */
	public PrivateKey getPrivateKey() {
		return privateKey;
	}

	/**
	 * Get key managers that always offer this certificate. The key is used
	 * as is, so keys that cannot be exported from their store (for example
	 * from a platform store) work too.
	 *
	 * @return key managers for {@link javax.net.ssl.SSLContext#init}
	 */
	public KeyManager[] getKeyManagers() {
		return new KeyManager[] { new SingleEntryKeyManager() };
	}

	@Override
	public String toString() {
		return "ClientCertificate[" + alias + ", " //$NON-NLS-1$ //$NON-NLS-2$
				+ chain[0].getSubjectX500Principal().getName() + "]"; //$NON-NLS-1$
	}

	private class SingleEntryKeyManager extends X509ExtendedKeyManager {

		@Nullable
		private String aliasFor(String[] keyTypes) {
			if (keyTypes == null) {
				return alias;
			}
			String algorithm = privateKey.getAlgorithm();
			return Arrays.asList(keyTypes).contains(algorithm) ? alias : null;
		}

		@Override
		public String[] getClientAliases(String keyType, Principal[] issuers) {
			String a = aliasFor(new String[] { keyType });
			return a == null ? null : new String[] { a };
		}

		@Override
		public String chooseClientAlias(String[] keyType, Principal[] issuers,
				Socket socket) {
			return aliasFor(keyType);
		}

		@Override
		public String chooseEngineClientAlias(String[] keyType,
				Principal[] issuers, SSLEngine engine) {
			return aliasFor(keyType);
		}

		@Override
		public String[] getServerAliases(String keyType, Principal[] issuers) {
			return null;
		}

		@Override
		public String chooseServerAlias(String keyType, Principal[] issuers,
				Socket socket) {
			return null;
		}

		@Override
		public X509Certificate[] getCertificateChain(String a) {
			return alias.equals(a) ? chain.clone() : null;
		}

		@Override
		public PrivateKey getPrivateKey(String a) {
			return alias.equals(a) ? privateKey : null;
		}
	}
}
