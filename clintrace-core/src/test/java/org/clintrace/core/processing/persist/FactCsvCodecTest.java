package org.clintrace.core.processing.persist;

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

import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.clintrace.core.om.ApprovalStatus;
import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.ConceptKind;
import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.ExtractionSource;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LabSeverity;
import org.clintrace.core.om.LearningPattern;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FactCsvCodecTest {

	private static final LocalDateTime TS = LocalDateTime.of(2024, 7, 2, 14, 5);

	@TempDir
	Path tmp;

	@Test
	void facts_survive_a_write_and_read() throws Exception {
		Fact lab = Fact.builder().text("Sodium 124 mEq/L").documentId("pn-3").line(4).documentTimestamp(TS)
				.documentType(DocumentType.PROGRESS_NOTE).type(FactType.LAB_VALUE).confidence(0.95)
				.requiresValidation(true).clinicalSignificance("CRITICAL")
				.normalizedValue(ClinicalConcept.builder().kind(ConceptKind.LAB).name("sodium").value(124.0)
						.unit("mEq/L").normalLow(135.0).normalHigh(145.0).severity(LabSeverity.CRITICAL)
						.implication("Hyponatremia - evaluate for SIADH, or cerebral salt wasting").build())
				.attributes(Map.of(FactAttribute.CONTEXT, "POD#2: Sodium 124 mEq/L, \"rechecked\"",
						FactAttribute.FAMILY, "sodium"))
				.build().withResolvedTimestamp(TS.minusHours(6), "post_operative_day", 0.95);

		Fact corrected = Fact.builder().text("Keppra 500 mg\nbid").documentId("discharge").line(9)
				.documentTimestamp(TS).type(FactType.MEDICATION).confidence(0.9).duplicateCount(2)
				.source(ExtractionSource.LLM_FALLBACK).build()
				.withCorrection("levetiracetam 500 mg bid", "abc123", 0.81);

		Fact bare = Fact.builder().text("Aneurysmal SAH").type(FactType.DIAGNOSIS).confidence(0.9).build();

		Path file = tmp.resolve("out/facts.csv");
		FactCsvCodec.write(List.of(lab, corrected, bare), file);
		List<Fact> back = FactCsvCodec.read(file);

		assertEquals(List.of(lab, corrected, bare), back);
		assertEquals(corrected.getId(), back.get(1).getId());
		assertEquals("Keppra 500 mg\nbid", back.get(1).getOriginalText());
	}

	@Test
	void header_names_every_column() throws Exception {
		StringWriter w = new StringWriter();
		FactCsvCodec.write(List.of(), w);
		assertEquals(String.join(",", FactCsvCodec.HEADER), w.toString().trim());
		assertTrue(FactCsvCodec.read(new StringReader(w.toString())).isEmpty());
	}

	@Test
	void patterns_survive_a_write_and_read() throws Exception {
		LearningPattern p = LearningPattern.builder().id("p1").factType(FactType.COMPLICATION)
				.originalText("CSF leek").correctedText("CSF leak").context("operative, note")
				.status(ApprovalStatus.APPROVED).createdBy("rn.cho").createdAt(TS).reviewedBy("dr.lee")
				.reviewedAt(TS.plusHours(1)).successRate(0.84).applicationCount(3).outcomeCount(2).overrideCount(1)
				.build();
		LearningPattern pending = LearningPattern.builder().id("p2").factType(FactType.MEDICATION)
				.originalText("ancef").correctedText("cefazolin").createdAt(TS).build();

		Path file = tmp.resolve("patterns.csv");
		PatternCsvCodec.write(List.of(p, pending), file);

		assertEquals(List.of(p, pending), PatternCsvCodec.read(file));
		assertTrue(PatternCsvCodec.read(tmp.resolve("missing.csv")).isEmpty());
	}

	@Test
	void map_cells_keep_separators() throws Exception {
		Map<String, String> m = Map.of("context", "a, b = c", "family", "gcs");
		assertEquals(m, CsvSupport.decodeMap(CsvSupport.encodeMap(m)));
		assertTrue(CsvSupport.decodeMap("").isEmpty());
	}
}
