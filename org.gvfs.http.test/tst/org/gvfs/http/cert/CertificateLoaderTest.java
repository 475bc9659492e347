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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.concurrent.atomic.AtomicInteger;

import javax.net.ssl.X509TrustManager;

import org.gvfs.http.tracing.EventMetadata;
import org.gvfs.junit.RecordingTracer;
import org.gvfs.junit.TestCertificates;
import org.gvfs.junit.TestCertificates.Identity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CertificateLoaderTest {

	private static final char[] PASSWORD = "s3cret".toCharArray();

	@TempDir
	Path tmp;

	private RecordingTracer tracer;

	private X509TrustManager trustManager;

	private AtomicInteger storeOpened;

	private KeyStore storeContents;

	private CertificateStore store;

	private CertificateLoader loader;

	@BeforeEach
	public void setup() throws Exception {
		tracer = new RecordingTracer();
		trustManager = mock(X509TrustManager.class);
		storeOpened = new AtomicInteger();
		storeContents = KeyStore.getInstance("PKCS12");
		storeContents.load(null, null);
		store = new CertificateStore(storePassword -> {
			storeOpened.incrementAndGet();
			return storeContents;
		}, PASSWORD);
		loader = new CertificateLoader(tracer, store, trustManager);
	}

	private static CertificatePasswordProvider password(char[] pw) {
		return id -> pw.clone();
	}

	@Test
	void testLoadsFileWithCorrectPassword() throws Exception {
		Identity alice = TestCertificates.valid("CN=Alice, O=Contoso");
		Path file = alice.writePkcs12(tmp.resolve("alice.pfx"), "alice",
				PASSWORD);

		ClientCertificate cert = loader.resolve(file.toString(),
				password(PASSWORD), true);
		assertNotNull(cert);
		assertEquals("alice", cert.getAlias());
		assertEquals(alice.certificate, cert.getCertificate());
		assertEquals(alice.keyPair.getPrivate().getAlgorithm(),
				cert.getPrivateKey().getAlgorithm());
		assertTrue(tracer.getErrors().isEmpty());
		assertFalse(store.isOpen());
	}

	@Test
	void testWrongPasswordIsLoggedNotThrown() throws Exception {
		Path file = TestCertificates.valid("CN=Alice").writePkcs12(
				tmp.resolve("alice.pfx"), "alice", PASSWORD);

		assertNull(loader.resolve(file.toString(),
				password("wrong".toCharArray()), false));
		assertEquals(1, tracer.getErrors().size());
		RecordingTracer.Event error = tracer.getErrors().get(0);
		assertEquals("Error, while loading certificate from disk", error.name);
		assertTrue(error.metadata.containsKey("Exception"));
	}

	@Test
	void testPasswordProviderFailure() throws Exception {
		Path file = TestCertificates.valid("CN=Alice").writePkcs12(
				tmp.resolve("alice.pfx"), "alice", PASSWORD);
		CertificatePasswordProvider failing = id -> {
			throw new CertificatePasswordException("helper exited with 1");
		};

		assertNull(loader.resolve(file.toString(), failing, false));
		assertFalse(tracer.getErrors().isEmpty());
		assertTrue(tracer.getErrors().get(0).name
				.contains("helper exited with 1"));
	}

	@Test
	void testFileWithoutPrivateKey() throws Exception {
		Identity alice = TestCertificates.valid("CN=Alice");
		KeyStore ks = KeyStore.getInstance("PKCS12");
		ks.load(null, null);
		ks.setCertificateEntry("alice", alice.certificate);
		Path file = tmp.resolve("trusted.p12");
		try (OutputStream out = Files.newOutputStream(file)) {
			ks.store(out, PASSWORD);
		}

		assertNull(loader.resolve(file.toString(), password(PASSWORD), false));
		assertEquals(1, tracer.getErrors().size());
		assertTrue(tracer.getErrors().get(0).name.contains(file.toString()));
	}

	@Test
	void testExpiredFileRejectedOnlyWhenValidityRequired() throws Exception {
		Path file = TestCertificates.expired("CN=Old").writePkcs12(
				tmp.resolve("old.pfx"), "old", PASSWORD);

		assertNull(loader.resolve(file.toString(), password(PASSWORD), true));
		assertTrue(tracer.getErrors().isEmpty());
		assertNotNull(
				loader.resolve(file.toString(), password(PASSWORD), false));
	}

	@Test
	void testUntrustedFileRejectedWhenValidityRequired() throws Exception {
		Path file = TestCertificates.valid("CN=Alice").writePkcs12(
				tmp.resolve("alice.pfx"), "alice", PASSWORD);
		doThrow(new CertificateException("untrusted")).when(trustManager)
				.checkClientTrusted(any(X509Certificate[].class), anyString());

		assertNull(loader.resolve(file.toString(), password(PASSWORD), true));
		assertNotNull(
				loader.resolve(file.toString(), password(PASSWORD), false));
	}

	@Test
	void testFindsStoreEntryBySubjectName() throws Exception {
		TestCertificates.valid("CN=Bob, O=Fabrikam").addTo(storeContents,
				"bob", PASSWORD);
		TestCertificates.valid("CN=Alice Example, O=Contoso")
				.addTo(storeContents, "alice", PASSWORD);
		CertificatePasswordProvider provider = mock(
				CertificatePasswordProvider.class);

		ClientCertificate cert = loader.resolve("alice example", provider,
				true);
		assertNotNull(cert);
		assertEquals("alice", cert.getAlias());
		verifyNoInteractions(provider);
		assertTrue(tracer.getErrors().isEmpty());
	}

	@Test
	void testStoreIsOpenedOnce() throws Exception {
		TestCertificates.valid("CN=Alice").addTo(storeContents, "alice",
				PASSWORD);
		assertNotNull(loader.resolve("Alice", null, false));
		assertNotNull(loader.resolve("Alice", null, false));
		assertNull(loader.resolve("Carol", null, false));
		assertEquals(1, storeOpened.get());
	}

	@Test
	void testStoreSkipsExpiredWhenValidityRequired() throws Exception {
		TestCertificates.expired("CN=Alice").addTo(storeContents, "old",
				PASSWORD);
		TestCertificates.valid("CN=Alice").addTo(storeContents, "new",
				PASSWORD);
		assertEquals("new", loader.resolve("alice", null, true).getAlias());
	}

	@Test
	void testNotFound() {
		assertNull(loader.resolve("CN=Nobody", null, false));
		assertEquals(1, tracer.getErrors().size());
		assertEquals("Certificate CN=Nobody not found",
				tracer.getErrors().get(0).name);
	}

	@Test
	void testStoreFailureIsLogged() {
		CertificateLoader broken = new CertificateLoader(tracer,
				new CertificateStore(storePassword -> {
					throw new KeyStoreException("store locked");
				}, null), trustManager);

		assertNull(broken.resolve("Alice", null, false));
		assertEquals(1, tracer.getErrors().size());
		RecordingTracer.Event error = tracer.getErrors().get(0);
		assertEquals("Error, while searching for certificate Alice in store",
				error.name);
		EventMetadata m = error.metadata;
		assertInstanceOf(KeyStoreException.class, m.get("Exception"));
	}

	@Test
	void testCloseClosesStore() throws Exception {
		TestCertificates.valid("CN=Alice").addTo(storeContents, "alice",
				PASSWORD);
		assertNotNull(loader.resolve("Alice", null, false));
		assertTrue(store.isOpen());
		loader.close();
		assertFalse(store.isOpen());
		assertThrows(IllegalStateException.class, store::getKeyStore);
	}
}
