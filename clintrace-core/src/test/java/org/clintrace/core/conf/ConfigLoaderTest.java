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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Properties;

import org.clintrace.core.learning.LearningSettings;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	private Properties minimalRequiredProps() {
		Properties p = new Properties();
		p.setProperty("DOCUMENT_PATH", "/data/documents");
		p.setProperty("CSV_OUTPUT_PATH", "/out/csv");
		return p;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void loads_from_file_and_normalizes_dirs_and_defaults() throws Exception {
		Path f = writePropsFile(minimalRequiredProps(), "conf1.properties");

		ConfigLoader loader = new ConfigLoader(f);

		assertEquals("/data/documents/", loader.getDocumentPath());
		assertEquals("/out/csv/", loader.getCsvOutputPath());
		assertEquals("documents.csv", loader.getDocumentManifest());
		assertEquals("", loader.getPatternFile());
		assertEquals(Duration.ofSeconds(3600), loader.getCacheTtl());
		assertFalse(loader.isFallbackEnabled());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void learning_settings_default_and_override() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("LEARNING_EMA_ALPHA", "0.3");
		p.setProperty("LEARNING_MATCH_THRESHOLD", "not-a-number");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "learning.properties"));

		LearningSettings s = loader.getLearningSettings();
		assertEquals(0.3, s.getEmaAlpha(), 1e-9);
		assertEquals(LearningSettings.DEFAULT_MATCH_THRESHOLD, s.getMatchThreshold(), 1e-9);
		assertEquals(LearningSettings.DEFAULT_SUCCESS_THRESHOLD, s.getSuccessThreshold(), 1e-9);
		assertEquals(LearningSettings.DEFAULT_CONTEXT_BONUS, s.getContextBonus(), 1e-9);
	}

	@Test
	void validate_reports_missing_required_and_bad_fractions() throws Exception {
		Properties p = new Properties();
		p.setProperty("LEARNING_SUCCESS_THRESHOLD", "1.5");
		p.setProperty("LEARNING_CONTEXT_BONUS", "abc");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "conf_missing.properties"));

		List<String> issues = loader.validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DOCUMENT_PATH")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: CSV_OUTPUT_PATH")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("LEARNING_SUCCESS_THRESHOLD must be within [0,1]")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("LEARNING_CONTEXT_BONUS is not a number")));
	}

	@Test
	void system_property_override_loads_external_file() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("CSV_OUTPUT_PATH", "/csv/path");
		p.setProperty("DOCUMENT_MANIFEST", "manifest.csv");
		Path f = writePropsFile(p, "override.properties");

		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toAbsolutePath().toString());

		ConfigLoader loader = new ConfigLoader();

		assertEquals("/csv/path/", loader.getCsvOutputPath());
		assertEquals("manifest.csv", loader.getDocumentManifest());
	}

	@Test
	void default_classpath_resource_is_complete() {
		ConfigLoader loader = new ConfigLoader();
		assertTrue(loader.validate().isEmpty());
		assertEquals("data/output/", loader.getCsvOutputPath());
	}

	@Test
	void parallel_limit_caps_at_cores() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("PARALLEL_DOCUMENT_LIMIT", "9999");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "parallel.properties"));

		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		assertEquals(cores, loader.getParallelDocumentLimit());
	}

	@Test
	void required_getters_throw_when_missing() throws Exception {
		ConfigLoader loader = new ConfigLoader(writePropsFile(new Properties(), "missing_required.properties"));

		assertThrows(IllegalStateException.class, loader::getDocumentPath);
		assertThrows(IllegalStateException.class, loader::getCsvOutputPath);
	}

	@Test
	void validate_flags_when_output_and_document_paths_are_the_same() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("DOCUMENT_PATH", "/data/same");
		p.setProperty("CSV_OUTPUT_PATH", "/data/same/");
		ConfigLoader loader = new ConfigLoader(writePropsFile(p, "same_dirs.properties"));

		assertTrue(loader.validate().stream().anyMatch(s -> s.contains("CSV_OUTPUT_PATH must differ")));
	}

	@Test
	void unreadable_file_is_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(tmp.resolve("nope.properties")));
	}
}
