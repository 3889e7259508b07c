package org.clintrace.core;

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
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.clintrace.core.conf.ConfigLoader;
import org.clintrace.core.om.ExtractionSource;
import org.clintrace.core.om.PipelineResult;
import org.clintrace.core.processing.extract.FallbackExtractionCapability;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ClinTraceMainTest {

	@TempDir
	Path tmp;

	private Path docs;
	private Path out;

	@BeforeEach
	void setUp() throws Exception {
		docs = Files.createDirectories(tmp.resolve("documents"));
		out = tmp.resolve("output");
		Files.writeString(docs.resolve("adm.txt"),
				"Admitted to the neurosurgery ICU.\nSodium 124 mEq/L", StandardCharsets.UTF_8);
		Files.writeString(docs.resolve("pn.txt"), "The hospital course was complicated.", StandardCharsets.UTF_8);
		Files.writeString(docs.resolve("documents.csv"), String.join("\n",
				"id,file,type,timestamp,author,specialty",
				"adm,adm.txt,ADMISSION_NOTE,2024-03-01T08:00,dr.lee,neurosurgery",
				"pn,pn.txt,PROGRESS_NOTE,2024-03-02T09:00,dr.lee,neurosurgery",
				"lost,lost.txt,PROGRESS_NOTE,2024-03-03T09:00,dr.lee,neurosurgery"), StandardCharsets.UTF_8);
	}

	private ConfigLoader config(boolean fallback) throws Exception {
		Path props = tmp.resolve("clintrace.properties");
		Files.writeString(props, String.join("\n",
				"DOCUMENT_PATH=" + docs,
				"CSV_OUTPUT_PATH=" + out,
				"PATTERN_FILE=" + tmp.resolve("patterns.csv"),
				"PARALLEL_DOCUMENT_LIMIT=2",
				"FALLBACK_ENABLED=" + fallback), StandardCharsets.UTF_8);
		return new ConfigLoader(props);
	}

	@Test
	void run_writes_every_report() throws Exception {
		ConfigLoader cfg = config(false);
		assertTrue(cfg.validate().isEmpty());

		PipelineResult result = new ClinTraceMain(cfg, null).run();

		assertEquals(1, result.getMetrics().getFailedDocumentCount());
		for (String name : List.of("facts.csv", "uncertainties.csv", "timeline.csv", "progressions.csv",
				"patterns.csv")) {
			assertTrue(Files.exists(out.resolve(name)), name);
		}
		List<String> uncertainties = Files.readAllLines(out.resolve("uncertainties.csv"), StandardCharsets.UTF_8);
		assertTrue(uncertainties.get(0).startsWith("id,severity,stage,issue_code"));
		assertTrue(uncertainties.stream().anyMatch(l -> l.contains("CRITICAL_LAB_VALUE")));
	}

	@Test
	void fallback_is_used_only_when_enabled() throws Exception {
		FallbackExtractionCapability fallback = mock(FallbackExtractionCapability.class);
		when(fallback.extract(anyString(), anyString())).thenReturn("NONE");
		when(fallback.extract(startsWith("List any complications"), anyString()))
				.thenReturn("Pneumonia");

		PipelineResult disabled = new ClinTraceMain(config(false), fallback).run();
		assertTrue(disabled.getFacts().stream().noneMatch(f -> f.getSource() == ExtractionSource.LLM_FALLBACK));

		PipelineResult enabled = new ClinTraceMain(config(true), fallback).run();
		assertTrue(enabled.getFacts().stream()
				.anyMatch(f -> f.getSource() == ExtractionSource.LLM_FALLBACK && f.getText().equals("Pneumonia")));
	}
}
