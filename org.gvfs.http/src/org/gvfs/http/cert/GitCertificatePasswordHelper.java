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

import java.io.IOException;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.List;

import org.gvfs.http.internal.HttpText;

/**
 * Obtains certificate passwords from the git credential helpers configured
 * for the user, by running {@code git credential fill} with the
 * {@code cert} protocol.
 */
public class GitCertificatePasswordHelper
		implements CertificatePasswordProvider {

	private static final String PASSWORD_PREFIX = "password="; //$NON-NLS-1$

	private static final long TIMEOUT_MILLIS = 60_000;

	private final String gitExecutable;

	private final GitProcessRunner runner;

	/**
	 * Create a helper running {@code git} from the {@code PATH}.
	 */
	public GitCertificatePasswordHelper() {
		this("git", new GitProcessRunner()); //$NON-NLS-1$
	}

	/**
	 * Constructor for GitCertificatePasswordHelper.
	 *
	 * @param gitExecutable
	 *            path or name of the git executable
	 * @param runner
	 *            runs the git process
	 */
	public GitCertificatePasswordHelper(String gitExecutable,
			GitProcessRunner runner) {
		this.gitExecutable = gitExecutable;
		this.runner = runner;
	}

	@Override
	public char[] getPassword(String certificateId)
			throws CertificatePasswordException {
		String input = "protocol=cert\npath=" + certificateId //$NON-NLS-1$
				+ "\nusername=\n\n"; //$NON-NLS-1$
		GitProcessRunner.ExecutionResult result;
		try {
			result = runner.run(
					List.of(gitExecutable, "credential", "fill"), //$NON-NLS-1$ //$NON-NLS-2$
					input, TIMEOUT_MILLIS);
		} catch (IOException e) {
			throw new CertificatePasswordException(e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CertificatePasswordException(e.toString(), e);
		}
		if (result.getRc() != 0) {
			throw new CertificatePasswordException(MessageFormat.format(
					HttpText.get().certificatePasswordHelperFailed,
					certificateId, String.valueOf(result.getRc()),
					result.getStderr().trim()));
		}
		char[] password = parsePassword(result.getStdout());
		if (password == null) {
			throw new CertificatePasswordException(MessageFormat.format(
					HttpText.get().certificatePasswordMissing,
					certificateId));
		}
		return password;
	}

	static char[] parsePassword(String output) {
		return Arrays.stream(output.split("\r?\n")) //$NON-NLS-1$
				.filter(l -> l.startsWith(PASSWORD_PREFIX))
				.map(l -> l.substring(PASSWORD_PREFIX.length()).toCharArray())
				.findFirst().orElse(null);
	}
}
