package org.clintrace.core.learning;

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
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.clintrace.core.om.ApprovalStatus;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LearningPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FeedbackManagerTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-04-01T10:00:00Z"), ZoneOffset.UTC);

	private FeedbackManager manager;

	@BeforeEach
	void setUp() {
		LearningSettings settings = LearningSettings.defaults();
		manager = new FeedbackManager(settings, new PatternMatcher(settings), CLOCK);
	}

	private static Fact fact(FactType type, String text, int line) {
		return Fact.builder().type(type).text(text).documentId("pn").line(line)
				.documentTimestamp(LocalDateTime.of(2024, 3, 30, 8, 0)).confidence(0.9).build();
	}

	@Test
	void submit_is_pending_until_approved() {
		String id = manager.submit(FactType.MEDICATION, "nimodipine 60 mg", "nimodipine 60 mg q4h", null, "rn.smith");

		LearningPattern p = manager.findPattern(id).orElseThrow();
		assertEquals(ApprovalStatus.PENDING, p.getStatus());
		assertEquals(LocalDateTime.of(2024, 4, 1, 10, 0), p.getCreatedAt());
		assertEquals(1, manager.pendingPatterns().size());

		Fact f = fact(FactType.MEDICATION, "Nimodipine 60 mg PO", 3);
		assertEquals(0, manager.applyCorrections(List.of(f)).getCorrectionsApplied());

		assertTrue(manager.approve(id, "dr.jones"));
		CorrectionResult r = manager.applyCorrections(List.of(f));

		assertEquals(1, r.getCorrectionsApplied());
		Fact corrected = r.getFacts().get(0);
		assertEquals("nimodipine 60 mg q4h PO", corrected.getText());
		assertEquals("Nimodipine 60 mg PO", corrected.getOriginalText());
		assertEquals(id, corrected.getCorrectionPatternId());
		assertTrue(corrected.isCorrectionApplied());
		assertEquals(f.getId(), corrected.getId());
		assertEquals(0.9, corrected.getConfidence(), 1e-9);
		assertEquals(1, manager.findPattern(id).orElseThrow().getApplicationCount());
	}

	@Test
	void duplicate_submission_returns_existing_id() {
		String a = manager.submit(FactType.LAB_VALUE, "Na 13O", "Na 130", null, "u1");
		String b = manager.submit(FactType.LAB_VALUE, " Na 13O ", "Na 130", "lab", "u2");
		assertEquals(a, b);
		assertEquals(1, manager.snapshot().size());
	}

	@Test
	void invalid_submission_is_rejected() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
				() -> manager.submit(FactType.LAB_VALUE, "Na 130", "na 130", null, "u1"));
		assertTrue(e.getMessage().startsWith("Invalid correction:"));
		assertThrows(IllegalArgumentException.class, () -> manager.submit(null, "Na 130", "Na 131", null, "u1"));
		assertTrue(manager.snapshot().isEmpty());
	}

	@Test
	void unknown_pattern_operations_return_false() {
		assertFalse(manager.approve("missing", "dr.jones"));
		assertFalse(manager.reject("missing", "dr.jones", "n/a"));
		assertFalse(manager.recordOutcome("missing", true));
	}

	@Test
	void rejected_pattern_is_never_applied() {
		String id = manager.submit(FactType.COMPLICATION, "CSF leek", "CSF leak", null, "u1");
		assertTrue(manager.reject(id, "dr.jones", "spelling variant is rare"));

		Fact f = fact(FactType.COMPLICATION, "CSF leek", 1);
		assertEquals(List.of(f), manager.applyCorrections(List.of(f)).getFacts());
		assertEquals("spelling variant is rare", manager.findPattern(id).orElseThrow().getRejectionReason());
	}

	@Test
	void overridden_pattern_decays_out_of_the_active_set() {
		String id = manager.submit(FactType.MEDICATION, "keppra", "levetiracetam", null, "u1");
		manager.approve(id, "dr.jones");

		for (int i = 1; i <= 5; i++) {
			assertEquals(1, manager.applyCorrections(List.of(fact(FactType.MEDICATION, "Keppra 500 mg", i)))
					.getCorrectionsApplied());
		}
		List<Boolean> outcomes = new ArrayList<>(List.of(true, true, true, false, false));
		Collections.shuffle(outcomes, new Random(7));
		for (boolean overridden : outcomes) {
			assertTrue(manager.recordOutcome(id, overridden));
		}
		assertFalse(manager.recordOutcome(id, false));

		LearningPattern p = manager.findPattern(id).orElseThrow();
		assertTrue(p.getSuccessRate() < LearningSettings.DEFAULT_SUCCESS_THRESHOLD, "rate " + p.getSuccessRate());
		assertEquals(ApprovalStatus.APPROVED, p.getStatus());
		assertEquals(3, p.getOverrideCount());
		assertEquals(5, p.getApplicationCount());

		Fact sixth = fact(FactType.MEDICATION, "Keppra 500 mg", 6);
		CorrectionResult r = manager.applyCorrections(List.of(sixth));
		assertEquals(0, r.getCorrectionsApplied());
		assertEquals(sixth, r.getFacts().get(0));
		assertEquals(1, manager.approvedPatterns().size());
		assertTrue(manager.activeSnapshot().isEmpty());
	}

	@Test
	void every_outcome_order_of_three_overrides_in_five_deactivates() {
		double alpha = LearningSettings.DEFAULT_EMA_ALPHA;
		for (int mask = 0; mask < 32; mask++) {
			if (Integer.bitCount(mask) != 3)
				continue;
			double rate = 1.0;
			for (int i = 0; i < 5; i++) {
				boolean overridden = (mask & (1 << i)) != 0;
				rate = (1 - alpha) * rate + alpha * (overridden ? 0.0 : 1.0);
			}
			assertTrue(rate < LearningSettings.DEFAULT_SUCCESS_THRESHOLD, "mask " + mask + " rate " + rate);
		}
	}

	@Test
	void confirmed_corrections_keep_a_pattern_active() {
		String id = manager.submit(FactType.MEDICATION, "keppra", "levetiracetam", null, "u1");
		manager.approve(id, "dr.jones");
		manager.applyCorrections(List.of(fact(FactType.MEDICATION, "keppra", 1), fact(FactType.MEDICATION, "keppra", 2)));

		assertTrue(manager.recordOutcome(id, true));
		assertTrue(manager.recordOutcome(id, false));

		LearningPattern p = manager.findPattern(id).orElseThrow();
		assertEquals(0.84, p.getSuccessRate(), 1e-9);
		assertEquals(1, manager.activeSnapshot().size());
		Fact f = manager.applyCorrections(List.of(fact(FactType.MEDICATION, "keppra", 3))).getFacts().get(0);
		assertEquals(0.9 * 0.84, f.getConfidence(), 1e-9);
	}

	@Test
	void corrections_only_come_from_active_patterns() {
		Random random = new Random(20240401L);
		String[] words = { "nimodipine", "heparin", "keppra", "decadron", "mannitol", "zofran", "tylenol", "ancef",
				"dilantin", "lovenox", "protonix", "colace" };

		Set<String> activeIds = new HashSet<>();
		List<String> originals = new ArrayList<>();
		for (int i = 0; i < words.length; i++) {
			String original = words[i] + " " + (10 + random.nextInt(90)) + " mg";
			originals.add(original);
			String id = manager.submit(FactType.MEDICATION, original, original + " verified", null, "u" + i);
			switch (random.nextInt(4)) {
			case 0:
				break;
			case 1:
				manager.reject(id, "dr.jones", "no");
				break;
			case 2:
				manager.approve(id, "dr.jones");
				LearningPattern decayed = manager.findPattern(id).orElseThrow();
				decayed.setSuccessRate(0.5 + random.nextDouble() * 0.19);
				manager.load(List.of(decayed));
				break;
			default:
				manager.approve(id, "dr.jones");
				activeIds.add(id);
			}
		}
		// Adversarial entries: approved but decayed, a pending lookalike and a rejected one.
		manager.load(List.of(LearningPattern.builder().id("decayed-wildcard").factType(FactType.MEDICATION)
				.originalText("mg").correctedText("milligram").status(ApprovalStatus.APPROVED).successRate(0.1).build()));
		manager.submit(FactType.MEDICATION, "mg", "mcg", null, "adversary");
		manager.reject(manager.submit(FactType.MEDICATION, " mg ", "units", null, "adversary"), "dr.jones", "no");

		List<Fact> facts = new ArrayList<>();
		for (int i = 0; i < 200; i++) {
			String text = originals.get(random.nextInt(originals.size()));
			if (random.nextBoolean())
				text = text.toUpperCase() + " PO daily";
			facts.add(fact(FactType.MEDICATION, text, i + 1));
		}

		CorrectionResult r = manager.applyCorrections(facts);

		assertEquals(facts.size(), r.getFacts().size());
		int corrected = 0;
		for (int i = 0; i < facts.size(); i++) {
			Fact out = r.getFacts().get(i);
			if (out.isCorrectionApplied()) {
				corrected++;
				assertTrue(activeIds.contains(out.getCorrectionPatternId()), out.getCorrectionPatternId());
				assertNotNull(out.getOriginalText());
			} else {
				assertEquals(facts.get(i), out);
			}
		}
		assertEquals(corrected, r.getCorrectionsApplied());
		assertEquals(corrected, r.getApplicationsByPattern().values().stream().mapToInt(Integer::intValue).sum());
	}

	@Test
	void statistics_summarize_review_state() {
		String a = manager.submit(FactType.MEDICATION, "keppra", "levetiracetam", null, "u1");
		String b = manager.submit(FactType.MEDICATION, "decadron", "dexamethasone", null, "u1");
		manager.submit(FactType.MEDICATION, "ancef", "cefazolin", null, "u1");
		manager.approve(a, "dr.jones");
		manager.reject(b, "dr.jones", "brand names are accepted");
		manager.applyCorrections(List.of(fact(FactType.MEDICATION, "keppra", 1)));

		LearningStatistics s = manager.statistics();
		assertEquals(3, s.getTotalPatterns());
		assertEquals(1, s.getPending());
		assertEquals(1, s.getApproved());
		assertEquals(1, s.getRejected());
		assertEquals(1, s.getActive());
		assertEquals(1.0 / 3, s.getApprovalRate(), 1e-9);
		assertEquals(1, s.getTotalApplications());
		assertEquals(1.0, s.getAverageSuccessRate(), 1e-9);
	}
}
