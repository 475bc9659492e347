/*
 * Copyright (C) 2026, The GVFS for Java contributors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.gvfs.junit;

import java.io.IOException;
import java.io.OutputStream;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.concurrent.atomic.AtomicLong;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/**
 * Creates throw-away self-signed certificates and key stores for tests.
 */
public final class TestCertificates {
	private static final AtomicLong SERIAL = new AtomicLong(
			System.currentTimeMillis());

	private TestCertificates() {
		// utility class
	}

	/**
	 * A key pair together with its self-signed certificate.
	 */
	public static final class Identity {
		/** The key pair. */
		public final KeyPair keyPair;

		/** The certificate of {@link #keyPair}'s public key. */
		public final X509Certificate certificate;

		Identity(KeyPair keyPair, X509Certificate certificate) {
			this.keyPair = keyPair;
			this.certificate = certificate;
		}

		/**
		 * Put this identity into a new in-memory PKCS#12 key store.
		 *
		 * @param alias
		 *            entry name
		 * @param password
		 *            protects the store and the key
		 * @return the key store
		 * @throws GeneralSecurityException
		 *             on failure
		 * @throws IOException
		 *             on failure
		 */
		public KeyStore toKeyStore(String alias, char[] password)
				throws GeneralSecurityException, IOException {
			KeyStore ks = KeyStore.getInstance("PKCS12");
			ks.load(null, null);
			addTo(ks, alias, password);
			return ks;
		}

		/**
		 * Add this identity as a key entry.
		 *
		 * @param ks
		 *            target store
		 * @param alias
		 *            entry name
		 * @param password
		 *            protects the key
		 * @throws GeneralSecurityException
		 *             on failure
		 */
		public void addTo(KeyStore ks, String alias, char[] password)
				throws GeneralSecurityException {
			ks.setKeyEntry(alias, keyPair.getPrivate(), password,
					new Certificate[] { certificate });
		}

		/**
		 * Write this identity to a PKCS#12 file.
		 *
		 * @param file
		 *            target file
		 * @param alias
		 *            entry name
		 * @param password
		 *            protects the file and the key
		 * @return {@code file}
		 * @throws GeneralSecurityException
		 *             on failure
		 * @throws IOException
		 *             on failure
		 */
		public Path writePkcs12(Path file, String alias, char[] password)
				throws GeneralSecurityException, IOException {
			KeyStore ks = toKeyStore(alias, password);
			try (OutputStream out = Files.newOutputStream(file)) {
				ks.store(out, password);
			}
			return file;
		}
	}

	/**
	 * Create an identity valid from yesterday for a year.
	 *
	 * @param subject
	 *            distinguished name, e.g. "CN=Alice, O=Contoso"
	 * @return the identity
	 * @throws Exception
	 *             on failure
	 */
	public static Identity valid(String subject) throws Exception {
		Instant now = Instant.now();
		return create(subject, now.minus(Duration.ofDays(1)),
				now.plus(Duration.ofDays(365)));
	}

	/**
	 * Create an identity that expired yesterday.
	 *
	 * @param subject
	 *            distinguished name
	 * @return the identity
	 * @throws Exception
	 *             on failure
	 */
	public static Identity expired(String subject) throws Exception {
		Instant now = Instant.now();
		return create(subject, now.minus(Duration.ofDays(365)),
				now.minus(Duration.ofDays(1)));
	}

	private static Identity create(String subject, Instant notBefore,
			Instant notAfter) throws GeneralSecurityException,
			OperatorCreationException, CertIOException {
		KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
		generator.initialize(2048);
		KeyPair keyPair = generator.generateKeyPair();
		X500Name name = new X500Name(subject);
		X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
				name, BigInteger.valueOf(SERIAL.incrementAndGet()),
				Date.from(notBefore), Date.from(notAfter), name,
				keyPair.getPublic());
		builder.addExtension(Extension.basicConstraints, true,
				new BasicConstraints(false));
		ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA")
				.build(keyPair.getPrivate());
		X509Certificate certificate = new JcaX509CertificateConverter()
				.getCertificate(builder.build(signer));
		return new Identity(keyPair, certificate);
	}
}
