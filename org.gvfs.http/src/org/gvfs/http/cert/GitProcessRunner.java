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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.gvfs.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs git as an external process and collects its output.
 */
public class GitProcessRunner {

	private static final Logger LOG = LoggerFactory
			.getLogger(GitProcessRunner.class);

	/**
	 * Outcome of a finished process.
	 */
	public static final class ExecutionResult {
		private final int rc;

		private final String stdout;

		private final String stderr;

		/**
		 * Constructor for ExecutionResult.
		 *
		 * @param rc
		 *            exit code
		 * @param stdout
		 *            captured standard output
		 * @param stderr
		 *            captured standard error
		 */
		public ExecutionResult(int rc, String stdout, String stderr) {
			this.rc = rc;
			this.stdout = stdout;
			this.stderr = stderr;
		}

		/**
		 * @return the exit code
		 */
		public int getRc() {
			return rc;
		}

		/**
		 * @return the captured standard output
		 */
		public String getStdout() {
			return stdout;
		}

		/**
		 * @return the captured standard error
		 */
		public String getStderr() {
			return stderr;
		}
	}

	/**
	 * Runs a command to completion. Standard output is never logged since it
	 * may carry secrets.
	 *
	 * @param command
	 *            the program and its arguments
	 * @param stdin
	 *            text written to the process' standard input; may be
	 *            {@code null}
	 * @param timeoutMillis
	 *            how long to wait for the process to exit
	 * @return the execution result
	 * @throws IOException
	 *             if the process cannot be started or does not finish in time
	 * @throws InterruptedException
	 *             if the calling thread was interrupted while waiting
	 */
	public ExecutionResult run(List<String> command, @Nullable String stdin,
			long timeoutMillis) throws IOException, InterruptedException {
		String cmd = String.join(" ", command); //$NON-NLS-1$
		LOG.debug("Spawning process: {}", cmd); //$NON-NLS-1$
		Process process = new ProcessBuilder(command).start();
		StreamGobbler out = new StreamGobbler("git-stdout", //$NON-NLS-1$
				process.getInputStream());
		StreamGobbler err = new StreamGobbler("git-stderr", //$NON-NLS-1$
				process.getErrorStream());
		out.start();
		err.start();
		try {
			try (OutputStream in = process.getOutputStream()) {
				if (stdin != null) {
					in.write(stdin.getBytes(StandardCharsets.UTF_8));
				}
			}
			if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
				throw new IOException("Process did not finish in time: " //$NON-NLS-1$
						+ cmd);
			}
			// a grandchild may still hold the pipes open
			out.join(timeoutMillis);
			err.join(timeoutMillis);
			int rc = process.exitValue();
			String errText = err.text();
			LOG.debug("stderr:\n{}", errText); //$NON-NLS-1$
			LOG.debug("Spawned process exited with exit code {}", rc); //$NON-NLS-1$
			return new ExecutionResult(rc, out.text(), errText);
		} finally {
			if (process.isAlive()) {
				process.destroyForcibly();
			}
		}
	}

	private static class StreamGobbler extends Thread {
		private final InputStream in;

		private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

		StreamGobbler(String name, InputStream in) {
			super(name);
			setDaemon(true);
			this.in = in;
		}

		@Override
		public void run() {
			try (InputStream s = in) {
				s.transferTo(buffer);
			} catch (IOException e) {
				LOG.warn("Error reading process output", e); //$NON-NLS-1$
			}
		}

		String text() {
			return new String(buffer.toByteArray(), StandardCharsets.UTF_8);
		}
	}
}
