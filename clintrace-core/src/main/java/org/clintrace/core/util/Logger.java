package org.clintrace.core.util;

/*
 * This file is part of ClinTrace.
 *
 * Copyright (C) 2025 The ClinTrace Authors
 *
 * ClinTrace is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * ClinTrace is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ClinTrace.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.io.PrintStream;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Static, dependency-free logger used across ClinTrace.
 *
 * <p>Each line carries a timestamp, the thread name, the level and, while a
 * document is being extracted on the current thread, its id. INFO and below go
 * to stdout, WARN and ERROR to stderr. System properties
 * {@code clintrace.log.level} (default INFO) and {@code clintrace.log.datetime}
 * (default {@code yyyy-MM-dd HH:mm:ss}) are read once.</p>
 */
public final class Logger {

	public enum Level {
		TRACE, DEBUG, INFO, WARN, ERROR;

		static Level parse(String s, Level fallback) {
			if (s == null)
				return fallback;
			try {
				return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
			} catch (IllegalArgumentException ex) {
				return fallback;
			}
		}
	}

	private static final Level MIN_LEVEL = Level.parse(System.getProperty("clintrace.log.level"), Level.INFO);

	private static final DateTimeFormatter TS = DateTimeFormatter
			.ofPattern(System.getProperty("clintrace.log.datetime", "yyyy-MM-dd HH:mm:ss"));

	/** Document under extraction on this thread, if any. */
	private static final ThreadLocal<String> DOCUMENT = new ThreadLocal<>();

	private Logger() {
	}

	// ---- document scope ----

	/** Tags subsequent lines from this thread with a document id until {@link #clearDocument()}. */
	public static void setDocument(String documentId) {
		if (documentId == null)
			DOCUMENT.remove();
		else
			DOCUMENT.set(documentId);
	}

	public static void clearDocument() {
		DOCUMENT.remove();
	}

	static String currentDocument() {
		return DOCUMENT.get();
	}

	// ---- API ----

	public static boolean isEnabled(Level level) {
		return level.ordinal() >= MIN_LEVEL.ordinal();
	}

	public static void debug(String msg, Object... args) {
		log(Level.DEBUG, null, msg, args);
	}

	public static void info(String msg, Object... args) {
		log(Level.INFO, null, msg, args);
	}

	public static void warn(String msg, Object... args) {
		log(Level.WARN, null, msg, args);
	}

	public static void error(String msg, Object... args) {
		log(Level.ERROR, null, msg, args);
	}

	public static void error(String msg, Throwable t, Object... args) {
		log(Level.ERROR, t, msg, args);
	}

	// ---- output ----

	private static void log(Level level, Throwable t, String msg, Object... args) {
		if (!isEnabled(level))
			return;
		String line = line(LocalDateTime.now().format(TS), Thread.currentThread().getName(), level,
				DOCUMENT.get(), format(msg, args));
		PrintStream out = level.ordinal() >= Level.WARN.ordinal() ? System.err : System.out;
		synchronized (Logger.class) {
			out.println(line);
			if (t != null)
				t.printStackTrace(out);
		}
	}

	static String line(String timestamp, String thread, Level level, String documentId, String body) {
		StringBuilder sb = new StringBuilder(body.length() + 64);
		sb.append('[').append(timestamp).append("] [").append(thread).append("] ").append(level);
		if (documentId != null)
			sb.append(" [doc ").append(documentId).append(']');
		return sb.append(' ').append(body).toString();
	}

	/**
	 * Substitutes each {@code {}} with the next argument. Arguments left over are
	 * appended, placeholders left over stay literal.
	 */
	static String format(String template, Object... args) {
		if (template == null)
			return "null";
		if (args == null || args.length == 0)
			return template;
		StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
		int next = 0;
		int i = 0;
		while (i < template.length()) {
			int at = template.indexOf("{}", i);
			if (at < 0 || next >= args.length) {
				sb.append(template, i, template.length());
				break;
			}
			sb.append(template, i, at).append(args[next++]);
			i = at + 2;
		}
		while (next < args.length)
			sb.append(' ').append(args[next++]);
		return sb.toString();
	}
}
