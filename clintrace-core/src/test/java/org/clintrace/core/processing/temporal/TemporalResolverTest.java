package org.clintrace.core.processing.temporal;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.TemporalConflict;
import org.clintrace.core.om.UncertaintySeverity;
import org.junit.jupiter.api.Test;

class TemporalResolverTest {

	private static final LocalDateTime DAY0 = LocalDateTime.of(2024, 5, 1, 8, 0);

	private final TemporalResolver resolver = new TemporalResolver();

	private static Fact admission(LocalDateTime ts) {
		return Fact.builder().text("Admitted to neurosurgery ICU").documentId("adm").line(1).documentTimestamp(ts)
				.documentType(DocumentType.ADMISSION_NOTE).type(FactType.ADMISSION).confidence(0.95).build();
	}

	private static Fact surgery(String docId, LocalDateTime ts) {
		return Fact.builder().text("craniotomy").documentId(docId).line(1).documentTimestamp(ts)
				.documentType(DocumentType.OPERATIVE_NOTE).type(FactType.PROCEDURE).surgical(true).confidence(0.95)
				.build();
	}

	private static Fact reference(String text, LocalDateTime ts) {
		return Fact.builder().text(text).documentId("pn").line(3).documentTimestamp(ts)
				.documentType(DocumentType.PROGRESS_NOTE).type(FactType.TEMPORAL_REFERENCE).confidence(0.80).build();
	}

	private static Fact find(List<Fact> facts, String id) {
		return facts.stream().filter(f -> f.getId().equals(id)).findFirst().orElseThrow();
	}

	@Test
	void pod_counts_from_most_recent_surgery() {
		Fact pod = reference("POD#2", DAY0.plusDays(6));
		TemporalResolution r = resolver.resolve(List.of(admission(DAY0), surgery("op1", DAY0),
				surgery("op2", DAY0.plusDays(5)), pod));

		Fact resolved = find(r.getFacts(), pod.getId());
		assertEquals(DAY0.plusDays(7), resolved.getResolvedTimestamp());
		assertEquals("post_operative_day", resolved.getResolutionMethod());
		assertEquals(0.95, resolved.getConfidence(), 1e-9);
		assertTrue(r.getConflicts().isEmpty());
		assertEquals(1, r.getStats().getResolved());
		assertEquals(1.0, r.getStats().getResolutionRate(), 1e-9);
	}

	@Test
	void hospital_day_one_is_admission_day() {
		Fact hd1 = reference("HD 1: pain controlled", DAY0.plusHours(4));
		Fact hd3 = reference("HD#3", DAY0.plusDays(2));
		TemporalResolution r = resolver.resolve(List.of(admission(DAY0), hd1, hd3));

		assertEquals(DAY0, find(r.getFacts(), hd1.getId()).getResolvedTimestamp());
		assertEquals(DAY0.plusDays(2), find(r.getFacts(), hd3.getId()).getResolvedTimestamp());
		assertEquals(Map.of("hospital_day", 2), r.getStats().getByMethod());
	}

	@Test
	void missing_anchor_yields_conflict_and_unresolved_fact() {
		Fact pod = reference("POD 3", DAY0.plusDays(3));
		TemporalResolution r = resolver.resolve(List.of(admission(DAY0), pod));

		assertFalse(find(r.getFacts(), pod.getId()).isResolved());
		assertEquals(1, r.getConflicts().size());
		TemporalConflict c = r.getConflicts().get(0);
		assertEquals(TemporalConflict.Kind.POD_WITHOUT_SURGERY, c.getKind());
		assertEquals(UncertaintySeverity.HIGH, c.getSeverity());
		assertSame(pod, c.getFact());
		assertEquals(0, r.getStats().getResolved());
		assertEquals(1, r.getStats().getFailed());
	}

	@Test
	void surgery_after_the_document_is_not_an_anchor() {
		Fact pod = reference("POD#1", DAY0.plusDays(1));
		TemporalResolution r = resolver.resolve(List.of(surgery("op1", DAY0.plusDays(2)), pod));

		assertEquals(TemporalConflict.Kind.POD_WITHOUT_SURGERY, r.getConflicts().get(0).getKind());
	}

	@Test
	void reference_before_admission_is_a_conflict() {
		Fact yesterday = reference("yesterday", DAY0.plusHours(2));
		TemporalResolution r = resolver.resolve(List.of(admission(DAY0), yesterday));

		assertFalse(find(r.getFacts(), yesterday.getId()).isResolved());
		assertEquals(TemporalConflict.Kind.BEFORE_ADMISSION, r.getConflicts().get(0).getKind());
	}

	@Test
	void document_relative_references() {
		LocalDateTime ts = LocalDateTime.of(2024, 5, 3, 14, 30);
		Fact overnight = reference("overnight", ts);
		Fact morning = reference("this morning", ts);
		Fact lastNight = reference("last night", ts);
		Fact later = reference("6 hours later", ts);
		Fact today = reference("today", ts);

		TemporalResolution r = resolver.resolve(List.of(admission(DAY0), overnight, morning, lastNight, later, today));

		assertEquals(LocalDateTime.of(2024, 5, 4, 8, 0), find(r.getFacts(), overnight.getId()).getResolvedTimestamp());
		assertEquals(LocalDateTime.of(2024, 5, 3, 8, 0), find(r.getFacts(), morning.getId()).getResolvedTimestamp());
		assertEquals(LocalDateTime.of(2024, 5, 2, 22, 0), find(r.getFacts(), lastNight.getId()).getResolvedTimestamp());
		assertEquals(ts.plusHours(6), find(r.getFacts(), later.getId()).getResolvedTimestamp());
		assertEquals(ts.toLocalDate().atStartOfDay(), find(r.getFacts(), today.getId()).getResolvedTimestamp());
		assertEquals(5, r.getStats().getResolved());
	}

	@Test
	void context_line_is_used_when_text_has_no_reference() {
		Fact lab = Fact.builder().text("Sodium 128").documentId("pn").line(2).documentTimestamp(DAY0.plusDays(1))
				.type(FactType.LAB_VALUE).confidence(0.95)
				.attributes(Map.of(FactAttribute.CONTEXT, "Sodium 128 this morning")).build();
		TemporalResolution r = resolver.resolve(List.of(admission(DAY0), lab));

		Fact resolved = find(r.getFacts(), lab.getId());
		assertEquals(DAY0.plusDays(1).toLocalDate().atTime(8, 0), resolved.getResolvedTimestamp());
		assertEquals(0.95, resolved.getConfidence(), 1e-9);
	}

	@Test
	void missing_document_time_is_unresolved() {
		Fact f = reference("overnight", null);
		TemporalResolution r = resolver.resolve(List.of(f));

		assertNull(r.getFacts().get(0).getResolvedTimestamp());
		assertEquals(TemporalConflict.Kind.UNRESOLVED, r.getConflicts().get(0).getKind());
		assertEquals(UncertaintySeverity.MEDIUM, r.getConflicts().get(0).getSeverity());
	}

	@Test
	void facts_without_references_pass_through_unchanged() {
		Fact plain = Fact.builder().text("Nimodipine 60 mg").documentId("pn").line(1).documentTimestamp(DAY0)
				.type(FactType.MEDICATION).confidence(0.9).build();
		TemporalResolution r = resolver.resolve(List.of(plain));
		assertSame(plain, r.getFacts().get(0));
		assertEquals(0, r.getStats().getTotalReferences());
	}
}
