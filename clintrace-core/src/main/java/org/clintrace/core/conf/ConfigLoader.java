package org.clintrace.core.conf;

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

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.clintrace.core.learning.LearningSettings;
import org.clintrace.core.util.Logger;

/**
 * Loads ClinTrace configuration from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/clintrace.properties</code> from
 * the classpath. You can override this by setting the system property
 * <code>clintrace.config</code> to an absolute path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>All directory-like values are normalized to end with a trailing slash
 * (e.g. <code>/path/to/dir/</code>).</li>
 * <li>Numeric values that do not parse fall back to their defaults with a
 * warning.</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/clintrace.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "clintrace.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_DOCUMENT_PATH = "DOCUMENT_PATH";
	private static final String K_DOCUMENT_MANIFEST = "DOCUMENT_MANIFEST";
	private static final String K_CSV_OUTPUT_PATH = "CSV_OUTPUT_PATH";
	private static final String K_PATTERN_FILE = "PATTERN_FILE";

	private static final String K_PARALLEL_DOCUMENT_LIMIT = "PARALLEL_DOCUMENT_LIMIT";

	// Learning loop
	private static final String K_LEARNING_MATCH_THRESHOLD = "LEARNING_MATCH_THRESHOLD";
	private static final String K_LEARNING_SUCCESS_THRESHOLD = "LEARNING_SUCCESS_THRESHOLD";
	private static final String K_LEARNING_EMA_ALPHA = "LEARNING_EMA_ALPHA";
	private static final String K_LEARNING_CONTEXT_BONUS = "LEARNING_CONTEXT_BONUS";

	private static final String K_CACHE_TTL_SECONDS = "CACHE_TTL_SECONDS";
	private static final String K_FALLBACK_ENABLED = "FALLBACK_ENABLED";

	private static final String DEFAULT_MANIFEST = "documents.csv";
	private static final long DEFAULT_CACHE_TTL_SECONDS = 3600L;

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		// 1) explicit file via system property?
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		// 2) fallback to classpath resource
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Validates presence of keys the command-line runner requires and the ranges
	 * of the learning constants. This does not fail; it returns a list of
	 * human-readable issues so the caller can decide how to proceed.
	 *
	 * @return list of error strings; empty if all required keys look OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_DOCUMENT_PATH, issues);
		requireNonBlank(K_CSV_OUTPUT_PATH, issues);

		String docs = properties.getProperty(K_DOCUMENT_PATH);
		String out = properties.getProperty(K_CSV_OUTPUT_PATH);
		if (docs != null && out != null) {
			String nDocs = normalizedDir(docs);
			if (!nDocs.isBlank() && nDocs.equals(normalizedDir(out))) {
				issues.add("CSV_OUTPUT_PATH must differ from DOCUMENT_PATH.");
			}
		}

		requireFraction(K_LEARNING_MATCH_THRESHOLD, issues);
		requireFraction(K_LEARNING_SUCCESS_THRESHOLD, issues);
		requireFraction(K_LEARNING_EMA_ALPHA, issues);
		requireFraction(K_LEARNING_CONTEXT_BONUS, issues);
		return issues;
	}

	/** Directory holding the input documents and their manifest. */
	public String getDocumentPath() {
		return normalizedDir(getRequired(K_DOCUMENT_PATH));
	}

	/** CSV manifest file name under {@link #getDocumentPath()}. */
	public String getDocumentManifest() {
		return getOptional(K_DOCUMENT_MANIFEST, DEFAULT_MANIFEST);
	}

	/** Directory for generated CSV files. */
	public String getCsvOutputPath() {
		return normalizedDir(getRequired(K_CSV_OUTPUT_PATH));
	}

	/** Optional CSV with learning-pattern state; empty when not configured. */
	public String getPatternFile() {
		return getOptional(K_PATTERN_FILE, "");
	}

	/**
	 * Worker threads for per-document extraction. Defaults to half the available
	 * cores and never exceeds the core count.
	 */
	public int getParallelDocumentLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, cores / 2);

		String raw = getOptional(K_PARALLEL_DOCUMENT_LIMIT, null);
		if (raw != null) {
			try {
				int val = Integer.parseInt(raw.trim());
				if (val <= 0)
					return defaultLimit;
				// sanity cap: never exceed core count
				return Math.min(val, cores);
			} catch (NumberFormatException nfe) {
				Logger.warn("Invalid integer for parallel limit: '{}'. Using default {}", raw, defaultLimit);
			}
		}
		return defaultLimit;
	}

	public LearningSettings getLearningSettings() {
		return LearningSettings.builder()
				.matchThreshold(getDouble(K_LEARNING_MATCH_THRESHOLD, LearningSettings.DEFAULT_MATCH_THRESHOLD))
				.successThreshold(getDouble(K_LEARNING_SUCCESS_THRESHOLD, LearningSettings.DEFAULT_SUCCESS_THRESHOLD))
				.emaAlpha(getDouble(K_LEARNING_EMA_ALPHA, LearningSettings.DEFAULT_EMA_ALPHA))
				.contextBonus(getDouble(K_LEARNING_CONTEXT_BONUS, LearningSettings.DEFAULT_CONTEXT_BONUS)).build();
	}

	/** Time-to-live for memoized stage results. */
	public Duration getCacheTtl() {
		String raw = getOptional(K_CACHE_TTL_SECONDS, null);
		if (raw != null) {
			try {
				long seconds = Long.parseLong(raw.trim());
				if (seconds > 0)
					return Duration.ofSeconds(seconds);
			} catch (NumberFormatException nfe) {
				Logger.warn("Invalid integer for {}: '{}'. Using default {}", K_CACHE_TTL_SECONDS, raw,
						DEFAULT_CACHE_TTL_SECONDS);
			}
		}
		return Duration.ofSeconds(DEFAULT_CACHE_TTL_SECONDS);
	}

	/** Whether a configured fallback extraction capability should be used. */
	public boolean isFallbackEnabled() {
		return Boolean.parseBoolean(getOptional(K_FALLBACK_ENABLED, "false"));
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private double getDouble(String key, double defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		try {
			return Double.parseDouble(raw);
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid number for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
	}

	private String normalizedDir(String path) {
		if (path == null || path.isBlank())
			return path;
		String p = path.trim();
		if (!p.endsWith("/"))
			p = p + "/";
		return p;
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}

	private void requireFraction(String key, List<String> issues) {
		String raw = getOptional(key, null);
		if (raw == null)
			return;
		try {
			double d = Double.parseDouble(raw);
			if (d < 0.0 || d > 1.0) {
				issues.add(key + " must be within [0,1]: " + raw);
			}
		} catch (NumberFormatException nfe) {
			issues.add(key + " is not a number: " + raw);
		}
	}
}
