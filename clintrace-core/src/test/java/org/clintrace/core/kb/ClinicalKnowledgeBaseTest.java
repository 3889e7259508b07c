package org.clintrace.core.kb;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.LabSeverity;
import org.clintrace.core.om.TrendDirection;
import org.clintrace.core.om.UncertaintySeverity;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ClinicalKnowledgeBaseTest {

	private static ClinicalKnowledgeBase kb;

	@BeforeAll
	static void load() {
		kb = ClinicalKnowledgeBase.loadDefault();
	}

	@Test
	void critical_boundaries_are_inclusive() {
		assertEquals(LabSeverity.CRITICAL, kb.classifyLab("sodium", 125));
		assertEquals(LabSeverity.CRITICAL, kb.classifyLab("sodium", 124));
		assertEquals(LabSeverity.LOW, kb.classifyLab("sodium", 126));
		assertEquals(LabSeverity.NORMAL, kb.classifyLab("sodium", 140));
		assertEquals(LabSeverity.HIGH, kb.classifyLab("sodium", 150));
		assertEquals(LabSeverity.CRITICAL, kb.classifyLab("sodium", 155));
		assertEquals(LabSeverity.UNKNOWN, kb.classifyLab("troponin", 1.0));
	}

	@Test
	void aliases_normalize_to_canonical_lab() {
		ClinicalConcept c = kb.normalizeLab("Na", 124);
		assertEquals("sodium", c.getName());
		assertEquals(124.0, c.getValue());
		assertEquals(LabSeverity.CRITICAL, c.getSeverity());
		assertEquals("mEq/L", c.getUnit());
		assertTrue(c.getImplication().startsWith("Hyponatremia"));

		assertEquals("hemoglobin", kb.canonicalLabName("Hgb"));
		assertEquals("platelets", kb.canonicalLabName("PLT"));
		assertNull(kb.canonicalLabName("troponin"));
	}

	@Test
	void medication_lookup_and_dose_conversion() {
		MedicationInfo heparin = kb.medication("Heparin").orElseThrow();
		assertEquals("Anticoagulant", heparin.getDrugClass());
		assertTrue(kb.isHighRiskMedication("insulin glargine"));
		assertFalse(kb.isHighRiskMedication("cefazolin"));

		assertEquals(2.0, kb.doseInReferenceUnit("cefazolin", 2000, "mg"), 1e-9);
		assertNull(kb.doseInReferenceUnit("cefazolin", 2, "units"));
		assertNull(kb.doseInReferenceUnit("unknownol", 2, "mg"));
	}

	@Test
	void scores_resolve_through_aliases_and_ranges() {
		assertEquals("gcs", kb.score("Glasgow Coma Scale").orElseThrow().getName());
		assertEquals("hunt-hess", kb.score("Hunt and Hess").orElseThrow().getName());
		assertTrue(kb.isValidScore("nihss", 42));
		assertFalse(kb.isValidScore("nihss", 43));
		assertFalse(kb.isValidScore("gcs", 2));
		assertTrue(kb.isCriticalScore("gcs", 8));
		assertFalse(kb.isCriticalScore("gcs", 9));
		assertTrue(kb.isCriticalScore("nihss", 21));
	}

	@Test
	void trend_interpretation_follows_polarity() {
		assertEquals(TrendDirection.IMPROVING, kb.interpretTrend("nihss", List.of(12.0, 8.0, 4.0)));
		assertEquals(TrendDirection.WORSENING, kb.interpretTrend("nihss", List.of(4.0, 9.0)));
		assertEquals(TrendDirection.IMPROVING, kb.interpretTrend("gcs", List.of(9.0, 14.0)));
		assertEquals(TrendDirection.WORSENING, kb.interpretTrend("gcs", List.of(14.0, 10.0)));
		assertEquals(TrendDirection.STABLE, kb.interpretTrend("gcs", List.of(14.0, 13.0)));
		assertEquals(TrendDirection.IMPROVING, kb.interpretTrend("sodium", List.of(120.0, 134.0)));
		assertEquals(TrendDirection.WORSENING, kb.interpretTrend("sodium", List.of(134.0, 118.0)));
		assertEquals(TrendDirection.STABLE, kb.interpretTrend("sodium", List.of(138.0, 141.0)));
		assertEquals(TrendDirection.WORSENING, kb.interpretTrend("sodium", List.of(138.0, 128.0)));
		assertEquals(TrendDirection.WORSENING, kb.interpretTrend("sodium", List.of(145.0, 146.0)));
		assertEquals(TrendDirection.IMPROVING, kb.interpretTrend("sodium", List.of(130.0, 136.0)));
		assertEquals(TrendDirection.STABLE, kb.interpretTrend("sodium", List.of(130.0, 132.0)));
		assertEquals(TrendDirection.STABLE, kb.interpretTrend("nihss", List.of(5.0)));
	}

	@Test
	void interactions_cover_pairs_and_class_rules() {
		List<MedicationInteraction> found = kb.findInteractions(List.of("Heparin", "warfarin", "cefazolin"));

		assertEquals(2, found.size());
		MedicationInteraction classRule = found.get(0);
		assertEquals(List.of("heparin", "warfarin"), classRule.getMedications());
		assertEquals(UncertaintySeverity.HIGH, classRule.getSeverity());
		assertTrue(found.get(1).getDescription().contains("heparin and warfarin"));

		List<MedicationInteraction> opioids = kb.findInteractions(List.of("morphine", "fentanyl"));
		assertEquals(1, opioids.size());
		assertEquals(UncertaintySeverity.MEDIUM, opioids.get(0).getSeverity());

		assertTrue(kb.findInteractions(List.of("morphine", "cefazolin")).isEmpty());
	}
}
