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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class ProductInfoTest {

	@Test
	void testEntryName() {
		assertEquals("scalar", ProductInfo.entryName("/opt/gvfs/scalar.jar"));
		assertEquals("Main", ProductInfo.entryName("org.example.tool.Main"));
		assertEquals("Main", ProductInfo.entryName("Main"));
		assertEquals("gvfs-http", ProductInfo.entryName(null));
		assertEquals("gvfs-http", ProductInfo.entryName(""));
		assertEquals("gvfs-http", ProductInfo.entryName("org.example."));
	}

	@Test
	void testUserAgent() {
		ProductInfo info = new ProductInfo("scalar", "1.2.3");
		assertEquals("scalar/1.2.3", info.toUserAgent());
		assertEquals("scalar/1.2.3", info.toString());
	}

	@Test
	void testInvalidNames() {
		assertThrows(IllegalArgumentException.class,
				() -> new ProductInfo("", "1.0"));
		assertThrows(IllegalArgumentException.class,
				() -> new ProductInfo("a/b", "1.0"));
		assertThrows(IllegalArgumentException.class,
				() -> new ProductInfo("my tool", "1.0"));
		assertThrows(IllegalArgumentException.class,
				() -> new ProductInfo("tool", ""));
	}

	@Test
	void testDetectedIsStable() {
		ProductInfo info = ProductInfo.detected();
		assertSame(info, ProductInfo.detected());
		assertFalse(info.getName().isEmpty());
		assertFalse(info.getVersion().isEmpty());
	}
}
