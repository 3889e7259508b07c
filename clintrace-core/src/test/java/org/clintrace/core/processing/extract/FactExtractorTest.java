package org.clintrace.core.processing.extract;

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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.ExtractionSource;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.FindingKind;
import org.clintrace.core.om.LabSeverity;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class FactExtractorTest {

	private static final LocalDateTime T0 = LocalDateTime.of(2024, 3, 4, 9, 0);

	private static ClinicalKnowledgeBase kb;

	@BeforeAll
	static void load() {
		kb = ClinicalKnowledgeBase.loadDefault();
	}

	private static ClinicalDocument doc(String id, DocumentType type, String content) {
		return ClinicalDocument.builder().id(id).type(type).timestamp(T0).content(content).build();
	}

	private static List<Fact> ofType(List<Fact> facts, FactType type) {
		return facts.stream().filter(f -> f.getType() == type).collect(Collectors.toList());
	}

	@Test
	void corrected_lab_is_renormalized_from_its_new_text() {
		FactExtractor extractor = new FactExtractor(kb);
		Fact na = ofType(extractor.extract(doc("pn1", DocumentType.PROGRESS_NOTE, "Sodium 124 mEq/L today.")),
				FactType.LAB_VALUE).get(0);

		Fact fixed = extractor.renormalize(na.withCorrection("Sodium 134 mEq/L", "p1", 0.9));

		assertEquals(134.0, fixed.numericValue(), 1e-9);
		assertEquals(LabSeverity.LOW, fixed.getNormalizedValue().getSeverity());
		assertEquals("ABNORMAL", fixed.getClinicalSignificance());
		assertFalse(fixed.isRequiresValidation());
		assertEquals("sodium", fixed.attribute(FactAttribute.FAMILY));
		assertEquals("Sodium 124 mEq/L today.", fixed.attribute(FactAttribute.CONTEXT));
		assertEquals(na.getId(), fixed.getId());
		assertEquals("p1", fixed.getCorrectionPatternId());

		Fact unparsed = extractor.renormalize(na.withCorrection("Sodium pending", "p2", 0.9));
		assertNull(unparsed.getNormalizedValue());
		assertNull(unparsed.getClinicalSignificance());
		assertNull(unparsed.attribute(FactAttribute.FAMILY));

		Fact leak = Fact.builder().type(FactType.COMPLICATION).text("CSF leek").documentId("pn1").line(2)
				.confidence(0.9).build().withCorrection("CSF leak", "p3", 0.9);
		assertSame(leak, extractor.renormalize(leak));
	}

	@Test
	void critical_sodium_is_normalized_and_flagged() {
		FactExtractor extractor = new FactExtractor(kb);
		List<Fact> labs = ofType(extractor.extract(doc("pn1", DocumentType.PROGRESS_NOTE, "Sodium 124 mEq/L today.")),
				FactType.LAB_VALUE);

		assertEquals(1, labs.size());
		Fact na = labs.get(0);
		assertEquals("sodium", na.conceptName());
		assertEquals(124.0, na.numericValue());
		assertEquals(LabSeverity.CRITICAL, na.getNormalizedValue().getSeverity());
		assertTrue(na.isRequiresValidation());
		assertEquals("pn1", na.getDocumentId());
		assertEquals(1, na.getLine());
		assertEquals(T0, na.getDocumentTimestamp());
		assertEquals(ExtractionSource.PATTERN, na.getSource());
	}

	@Test
	void negated_complication_becomes_a_finding_only() {
		FactExtractor extractor = new FactExtractor(kb);
		List<Fact> facts = extractor.extract(doc("op1", DocumentType.OPERATIVE_NOTE,
				"Procedure: right pterional craniotomy\nNo complications noted."));

		assertTrue(ofType(facts, FactType.COMPLICATION).isEmpty());
		List<Fact> findings = ofType(facts, FactType.FINDING);
		assertEquals(1, findings.size());
		assertEquals(FindingKind.NO_COMPLICATIONS, findings.get(0).finding());
		assertEquals(2, findings.get(0).getLine());

		List<Fact> procedures = ofType(facts, FactType.PROCEDURE);
		assertFalse(procedures.isEmpty());
		assertTrue(procedures.get(0).isSurgical());
	}

	@Test
	void narrative_complication_is_extracted() {
		FactExtractor extractor = new FactExtractor(kb);
		List<Fact> complications = ofType(extractor.extract(doc("pn2", DocumentType.PROGRESS_NOTE,
				"Patient developed CSF leak overnight.")), FactType.COMPLICATION);

		assertEquals(1, complications.size());
		assertEquals("CSF leak overnight", complications.get(0).getText());
		assertTrue(complications.get(0).isRequiresValidation());
	}

	@Test
	void null_content_is_rejected_and_blank_content_is_empty() {
		FactExtractor extractor = new FactExtractor(kb);
		assertThrows(IllegalArgumentException.class, () -> extractor.extract(null));
		assertThrows(IllegalArgumentException.class,
				() -> extractor.extract(doc("bad", DocumentType.PROGRESS_NOTE, null)));
		assertTrue(extractor.extract(doc("empty", DocumentType.PROGRESS_NOTE, "  \n ")).isEmpty());
	}

	@Test
	void output_is_ordered_by_line() {
		FactExtractor extractor = new FactExtractor(kb);
		List<Fact> facts = extractor.extract(doc("pn3", DocumentType.PROGRESS_NOTE,
				"Sodium 131 mEq/L\nPatient developed vasospasm.\nHemoglobin 10.2 g/dL"));
		for (int i = 1; i < facts.size(); i++) {
			assertTrue(facts.get(i - 1).getLine() <= facts.get(i).getLine());
		}
	}

	@Test
	void deduplicate_keeps_highest_confidence_and_counts() {
		Fact a = Fact.builder().text("Nimodipine 60 mg").documentId("d1").line(1).documentTimestamp(T0)
				.type(FactType.MEDICATION).confidence(0.85).build();
		Fact b = a.toBuilder().line(4).text("nimodipine  60 MG").confidence(0.95).build();
		Fact c = a.toBuilder().line(7).confidence(0.90).duplicateCount(2).build();
		Fact other = a.toBuilder().documentTimestamp(T0.plusDays(1)).build();

		List<Fact> out = FactExtractor.deduplicate(List.of(a, b, c, other));

		assertEquals(2, out.size());
		assertEquals(4, out.get(0).getLine());
		assertEquals(0.95, out.get(0).getConfidence());
		assertEquals(4, out.get(0).getDuplicateCount());
		assertEquals(other, out.get(1));
	}

	@Test
	void fallback_fills_a_type_patterns_missed() {
		FallbackExtractionCapability fallback = mock(FallbackExtractionCapability.class);
		when(fallback.extract(anyString(), anyString())).thenReturn("NONE");
		when(fallback.extract(startsWith("List any complications"), anyString())).thenReturn("Wound infection\n");

		FactExtractor extractor = new FactExtractor(kb, fallback);
		List<Fact> complications = ofType(extractor.extract(doc("pn4", DocumentType.PROGRESS_NOTE,
				"The postoperative course was complicated.")), FactType.COMPLICATION);

		assertEquals(1, complications.size());
		Fact f = complications.get(0);
		assertEquals("Wound infection", f.getText());
		assertEquals(ExtractionSource.LLM_FALLBACK, f.getSource());
		assertEquals(FactExtractor.FALLBACK_CONFIDENCE, f.getConfidence());
		assertEquals(0, f.getLine());
		assertEquals(1, FactExtractor.stats(complications).getFromFallback());
	}

	@Test
	void failing_fallback_is_treated_as_nothing_found() {
		FallbackExtractionCapability fallback = mock(FallbackExtractionCapability.class);
		when(fallback.extract(anyString(), anyString())).thenThrow(new IllegalStateException("service down"));

		FactExtractor extractor = new FactExtractor(kb, fallback);
		List<Fact> facts = extractor.extract(doc("pn5", DocumentType.PROGRESS_NOTE,
				"The postoperative course was complicated."));

		assertTrue(ofType(facts, FactType.COMPLICATION).isEmpty());
	}

	@Test
	void fallback_is_not_consulted_for_tabular_documents() {
		FallbackExtractionCapability fallback = mock(FallbackExtractionCapability.class);
		FactExtractor extractor = new FactExtractor(kb, fallback);
		extractor.extract(doc("lab1", DocumentType.LAB_REPORT, "Comment: hemolyzed sample, complicated draw"));
		verify(fallback, never()).extract(anyString(), anyString());
	}

	@Test
	void classifier_uses_id_then_header() {
		DocumentClassifier classifier = new DocumentClassifier();
		assertEquals(DocumentType.OPERATIVE_NOTE,
				classifier.classify(ClinicalDocument.builder().id("op_note_1").content("text").build()));
		assertEquals(DocumentType.DISCHARGE_SUMMARY, classifier.classify(ClinicalDocument.builder().id("doc7")
				.type(DocumentType.UNKNOWN).content("DISCHARGE SUMMARY\nHospital course...").build()));
		assertEquals(DocumentType.CONSULT_NOTE, classifier.classify(ClinicalDocument.builder().id("doc8")
				.type(DocumentType.CONSULT_NOTE).content("Discharge planning discussed").build()));
		assertEquals(DocumentType.UNKNOWN,
				classifier.classify(ClinicalDocument.builder().id("x").content("hello").build()));
	}

	@Test
	void html_is_reduced_to_lines() {
		String text = TextCleaner.clean("<html><body><p>Sodium 124&nbsp;mEq/L</p><p>No complications noted.</p></body></html>");
		assertFalse(text.contains("<"));
		assertTrue(text.contains("Sodium 124 mEq/L"));
		assertTrue(text.contains("\nNo complications noted."));
		assertEquals("", TextCleaner.clean(null));
	}
}
