package org.clintrace.core.processing.validate;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.ConceptKind;
import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.FindingKind;
import org.clintrace.core.om.TemporalConflict;
import org.clintrace.core.om.Uncertainty;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.om.ValidationStage;
import org.clintrace.core.processing.timeline.TimelineBuilder;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ValidatorTest {

	private static final LocalDateTime DAY1 = LocalDateTime.of(2024, 2, 12, 9, 0);
	private static final LocalDateTime DAY2 = DAY1.plusDays(1);

	private static ClinicalKnowledgeBase kb;

	@BeforeAll
	static void load() {
		kb = ClinicalKnowledgeBase.loadDefault();
	}

	// ---- fixtures ----

	private static Fact.FactBuilder fact(FactType type, String text, LocalDateTime ts) {
		return Fact.builder().type(type).text(text).documentId("note-" + ts.getDayOfMonth()).line(1)
				.documentTimestamp(ts).documentType(DocumentType.PROGRESS_NOTE).confidence(0.9);
	}

	private static Fact lab(String name, double value, LocalDateTime ts) {
		return fact(FactType.LAB_VALUE, name + " " + value, ts)
				.normalizedValue(kb.normalizeLab(name, value)).attributes(Map.of(FactAttribute.FAMILY, name)).build();
	}

	private static Fact score(String name, double value, LocalDateTime ts) {
		return fact(FactType.CLINICAL_SCORE, name.toUpperCase() + " " + value, ts)
				.normalizedValue(ClinicalConcept.builder().kind(ConceptKind.SCORE).name(name).value(value).build())
				.attributes(Map.of(FactAttribute.FAMILY, name)).build();
	}

	private static Fact medication(String name, double dose, String unit, LocalDateTime ts) {
		return fact(FactType.MEDICATION, name + " " + dose + " " + unit, ts).normalizedValue(
				ClinicalConcept.builder().kind(ConceptKind.MEDICATION).name(name).value(dose).unit(unit).build())
				.build();
	}

	private static Fact finding(FindingKind kind, String text, LocalDateTime ts) {
		return fact(FactType.FINDING, text, ts).attributes(Map.of(FactAttribute.FINDING, kind.name())).build();
	}

	/** A record that passes every stage, plus the given facts. */
	private static List<Fact> complete(Fact... extra) {
		List<Fact> facts = new ArrayList<>();
		facts.add(fact(FactType.DIAGNOSIS, "Aneurysmal subarachnoid hemorrhage", DAY1).build());
		facts.add(fact(FactType.PROCEDURE, "Right pterional craniotomy", DAY1).surgical(true)
				.documentType(DocumentType.OPERATIVE_NOTE).build());
		facts.add(medication("nimodipine", 60, "mg", DAY2).toBuilder().documentId("discharge")
				.documentType(DocumentType.DISCHARGE_SUMMARY).build());
		facts.add(fact(FactType.RECOMMENDATION, "Follow up in neurosurgery clinic in 2 weeks", DAY2).build());
		facts.addAll(Arrays.asList(extra));
		return facts;
	}

	private static List<Uncertainty> run(List<Fact> facts) {
		return validate(facts).getUncertainties();
	}

	private static ValidationResult validate(List<Fact> facts) {
		return new Validator(kb).validate(facts, new TimelineBuilder(kb).build(facts));
	}

	private static List<Uncertainty> withCode(List<Uncertainty> all, String code) {
		return all.stream().filter(u -> code.equals(u.getIssueCode())).collect(Collectors.toList());
	}

	// ---- tests ----

	@Test
	void complete_record_has_no_issues() {
		ValidationResult r = validate(complete());
		assertTrue(r.getUncertainties().isEmpty(), () -> r.getUncertainties().toString());
		assertFalse(r.hasBlockingIssues());
		assertEquals(0, r.getCountBySeverity().get(UncertaintySeverity.HIGH));
		assertEquals(4, r.getFacts().size());
	}

	@Test
	void critical_sodium_boundary() {
		List<Uncertainty> critical = withCode(run(complete(lab("sodium", 124, DAY1))), IssueCodes.CRITICAL_LAB_VALUE);
		assertEquals(1, critical.size());
		assertEquals(UncertaintySeverity.HIGH, critical.get(0).getSeverity());
		assertEquals(ValidationStage.CLINICAL_RULE, critical.get(0).getStage());
		assertTrue(critical.get(0).getDescription().contains("sodium"));

		assertTrue(withCode(run(complete(lab("sodium", 126, DAY1))), IssueCodes.CRITICAL_LAB_VALUE).isEmpty());
	}

	@Test
	void no_complications_statement_contradicted_once() {
		Fact statement = finding(FindingKind.NO_COMPLICATIONS, "No complications noted", DAY1);
		Fact leak = fact(FactType.COMPLICATION, "CSF leak", DAY2).build();
		Fact seizure = fact(FactType.COMPLICATION, "seizure", DAY2.plusHours(3)).build();

		List<Uncertainty> found = withCode(run(complete(statement, leak, seizure)),
				IssueCodes.CONTRADICTORY_STATEMENTS);

		assertEquals(1, found.size());
		Uncertainty u = found.get(0);
		assertEquals(UncertaintySeverity.HIGH, u.getSeverity());
		assertEquals(List.of(statement.getId(), leak.getId(), seizure.getId()), u.getFactIds());
	}

	@Test
	void earlier_complication_does_not_contradict_later_statement() {
		Fact leak = fact(FactType.COMPLICATION, "CSF leak", DAY1).build();
		Fact statement = finding(FindingKind.NO_COMPLICATIONS, "No new complications", DAY2);
		assertTrue(withCode(run(complete(leak, statement)), IssueCodes.CONTRADICTORY_STATEMENTS).isEmpty());
	}

	@Test
	void empty_record_reports_missing_sections() {
		ValidationResult r = validate(List.of());
		List<Uncertainty> missing = withCode(r.getUncertainties(), IssueCodes.MISSING_INFORMATION);
		assertEquals(4, missing.size());
		assertEquals(3, r.getCountBySeverity().get(UncertaintySeverity.HIGH));
		assertEquals(1, r.getCountBySeverity().get(UncertaintySeverity.MEDIUM));
		assertTrue(r.hasBlockingIssues());
	}

	@Test
	void non_operative_decision_satisfies_procedure_requirement() {
		List<Fact> facts = new ArrayList<>(complete());
		facts.removeIf(f -> f.getType() == FactType.PROCEDURE);
		facts.add(finding(FindingKind.NON_OPERATIVE, "Conservative management", DAY1));
		assertTrue(run(facts).isEmpty());
	}

	@Test
	void documentation_gap_over_three_days() {
		List<Uncertainty> gaps = withCode(run(complete(fact(FactType.VITAL_SIGN, "HR 72", DAY2.plusDays(4)).build())),
				IssueCodes.DOCUMENTATION_GAP);
		assertEquals(1, gaps.size());
		assertEquals(UncertaintySeverity.MEDIUM, gaps.get(0).getSeverity());

		assertTrue(withCode(run(complete(fact(FactType.VITAL_SIGN, "HR 72", DAY2.plusDays(3)).build())),
				IssueCodes.DOCUMENTATION_GAP).isEmpty());
	}

	@Test
	void interacting_anticoagulants() {
		Fact heparin = medication("heparin", 5000, "units", DAY1);
		Fact warfarin = medication("warfarin", 5, "mg", DAY1);

		List<Uncertainty> found = withCode(run(complete(heparin, warfarin)), IssueCodes.MEDICATION_INTERACTION);

		assertEquals(2, found.size());
		assertTrue(found.stream().allMatch(u -> u.getSeverity() == UncertaintySeverity.HIGH));
		assertTrue(found.stream().anyMatch(u -> u.getFactIds().equals(List.of(heparin.getId(), warfarin.getId()))));
	}

	@Test
	void dose_above_maximum_after_unit_conversion() {
		List<Uncertainty> found = withCode(run(complete(medication("cefazolin", 4000, "mg", DAY1))),
				IssueCodes.EXCESSIVE_MEDICATION_DOSE);
		assertEquals(1, found.size());
		assertEquals(UncertaintySeverity.HIGH, found.get(0).getSeverity());

		assertTrue(withCode(run(complete(medication("cefazolin", 2, "g", DAY1))),
				IssueCodes.EXCESSIVE_MEDICATION_DOSE).isEmpty());
	}

	@Test
	void score_outside_scale_is_invalid() {
		List<Uncertainty> found = run(complete(score("gcs", 17, DAY1)));
		assertEquals(1, withCode(found, IssueCodes.INVALID_SCORE_RANGE).size());
		assertTrue(withCode(found, IssueCodes.CRITICAL_SCORE_VALUE).isEmpty());
	}

	@Test
	void conflicting_values_within_an_hour() {
		Fact a = lab("sodium", 130, DAY1);
		Fact b = lab("sodium", 146, DAY1.plusMinutes(30));
		Fact later = lab("sodium", 146, DAY1.plusHours(3));

		List<Uncertainty> found = withCode(run(complete(a, b, later)), IssueCodes.CONFLICTING_INFORMATION);

		assertEquals(1, found.size());
		assertEquals(List.of(a.getId(), b.getId()), found.get(0).getFactIds());
	}

	@Test
	void stable_for_discharge_with_recent_critical_score() {
		Fact stable = finding(FindingKind.STABLE_FOR_DISCHARGE, "Stable for discharge", DAY2);
		Fact gcs = score("gcs", 7, DAY2.minusHours(5));

		List<Uncertainty> found = withCode(run(complete(stable, gcs)), IssueCodes.DISCHARGE_STATUS_CONTRADICTION);

		assertEquals(1, found.size());
		assertEquals(List.of(stable.getId(), gcs.getId()), found.get(0).getFactIds());
	}

	@Test
	void improving_statement_against_worsening_trend() {
		Fact improving = fact(FactType.FINDING, "NIHSS improving", DAY2)
				.attributes(Map.of(FactAttribute.FINDING, FindingKind.IMPROVING.name(), FactAttribute.FAMILY, "nihss"))
				.build();
		List<Uncertainty> found = withCode(
				run(complete(score("nihss", 4, DAY1), score("nihss", 10, DAY2), improving)),
				IssueCodes.TREND_CONTRADICTION);

		assertEquals(1, found.size());
		assertEquals(UncertaintySeverity.MEDIUM, found.get(0).getSeverity());
		assertEquals(improving.getId(), found.get(0).getFactIds().get(0));
	}

	@Test
	void improving_statement_against_sodium_leaving_normal_range() {
		Fact improving = finding(FindingKind.IMPROVING, "Headache improving", DAY2);
		List<Uncertainty> found = withCode(
				run(complete(lab("sodium", 138, DAY1), lab("sodium", 128, DAY2), improving)),
				IssueCodes.TREND_CONTRADICTION);

		assertEquals(1, found.size());
		assertTrue(found.get(0).getDescription().contains("sodium is worsening"), found.get(0).getDescription());
	}

	@Test
	void temporal_conflicts_become_uncertainties() {
		List<Fact> facts = complete();
		Fact pod = fact(FactType.TEMPORAL_REFERENCE, "POD#2", DAY2).build();
		TemporalConflict conflict = new TemporalConflict(TemporalConflict.Kind.POD_WITHOUT_SURGERY, pod,
				"Post-operative day reference without a preceding surgery", UncertaintySeverity.HIGH);

		List<Uncertainty> found = new Validator(kb)
				.validate(facts, new TimelineBuilder(kb).build(facts), List.of(conflict)).getUncertainties();

		assertEquals(1, found.size());
		assertEquals(IssueCodes.MISSING_TEMPORAL_ANCHOR, found.get(0).getIssueCode());
		assertEquals(ValidationStage.TEMPORAL, found.get(0).getStage());
	}

	@Test
	void registered_rule_runs_in_clinical_stage() {
		Validator validator = new Validator(kb).registerRule(FactType.DIAGNOSIS,
				(f, ctx) -> List.of(new Uncertainty(ValidationStage.CLINICAL_RULE, UncertaintySeverity.LOW,
						"UNCODED_DIAGNOSIS", "Diagnosis has no code: " + f.getText(), "Add a code", List.of(f))));
		List<Fact> facts = complete();

		List<Uncertainty> found = validator.validate(facts, new TimelineBuilder(kb).build(facts)).getUncertainties();

		assertEquals(1, found.size());
		assertEquals("UNCODED_DIAGNOSIS", found.get(0).getIssueCode());
	}

	@Test
	void format_stage_flags_missing_provenance() {
		Fact orphan = Fact.builder().type(FactType.VITAL_SIGN).text("BP 120/80").documentId(" ").confidence(0.9)
				.build();
		List<Uncertainty> format = run(complete(orphan)).stream()
				.filter(u -> u.getStage() == ValidationStage.FORMAT).collect(Collectors.toList());
		assertEquals(2, format.size());
		assertTrue(format.stream().allMatch(u -> IssueCodes.FORMAT_ERROR.equals(u.getIssueCode())));
	}
}
