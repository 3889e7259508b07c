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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.kb.MedicationInfo;
import org.clintrace.core.kb.ScoreReference;
import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LabSeverity;
import org.clintrace.core.om.Uncertainty;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.om.ValidationStage;

/**
 * Knowledge-base rules per fact type: lab critical thresholds (inclusive),
 * score ranges and critical values, maximum single medication doses.
 */
class ClinicalRuleCheck implements ValidationCheck {

	private final Map<FactType, FactRule> rules = new EnumMap<>(FactType.class);

	ClinicalRuleCheck() {
		rules.put(FactType.LAB_VALUE, this::labRule);
		rules.put(FactType.CLINICAL_SCORE, this::scoreRule);
		rules.put(FactType.MEDICATION, this::doseRule);
	}

	/** Adds or replaces the rule for one fact type. */
	void register(FactType type, FactRule rule) {
		rules.put(type, rule);
	}

	@Override
	public ValidationStage stage() {
		return ValidationStage.CLINICAL_RULE;
	}

	@Override
	public List<Uncertainty> check(ValidationContext ctx) {
		List<Uncertainty> out = new ArrayList<>();
		for (Fact f : ctx.getFacts()) {
			FactRule rule = f.getType() == null ? null : rules.get(f.getType());
			if (rule != null)
				out.addAll(rule.validate(f, ctx));
		}
		return out;
	}

	private List<Uncertainty> labRule(Fact f, ValidationContext ctx) {
		ClinicalConcept c = f.getNormalizedValue();
		if (c == null || !c.hasValue())
			return Collections.emptyList();
		LabSeverity severity = ctx.getKnowledgeBase().classifyLab(c.getName(), c.getValue());
		if (severity != LabSeverity.CRITICAL)
			return Collections.emptyList();
		String implication = c.getImplication() == null ? "" : " (" + c.getImplication() + ")";
		return List.of(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.CRITICAL_LAB_VALUE,
				"Critical " + c.getName() + " value " + format(c.getValue()) + implication,
				"Confirm the result and document the clinical response", List.of(f)));
	}

	private List<Uncertainty> scoreRule(Fact f, ValidationContext ctx) {
		ClinicalConcept c = f.getNormalizedValue();
		if (c == null || !c.hasValue())
			return Collections.emptyList();
		Optional<ScoreReference> ref = ctx.getKnowledgeBase().score(c.getName());
		if (ref.isEmpty())
			return Collections.emptyList();
		ScoreReference s = ref.get();
		if (!s.isValid(c.getValue())) {
			return List.of(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.INVALID_SCORE_RANGE,
					s.getName().toUpperCase() + " value " + format(c.getValue()) + " is outside " + s.getMin() + "-"
							+ s.getMax(),
					"Verify the recorded score", List.of(f)));
		}
		if (s.isCritical(c.getValue())) {
			return List.of(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.CRITICAL_SCORE_VALUE,
					s.getName().toUpperCase() + " value " + format(c.getValue()) + " is in the critical range",
					"Confirm the score and document the clinical response", List.of(f)));
		}
		return Collections.emptyList();
	}

	private List<Uncertainty> doseRule(Fact f, ValidationContext ctx) {
		ClinicalConcept c = f.getNormalizedValue();
		if (c == null || !c.hasValue())
			return Collections.emptyList();
		ClinicalKnowledgeBase kb = ctx.getKnowledgeBase();
		Optional<MedicationInfo> info = kb.medication(c.getName());
		Double dose = kb.doseInReferenceUnit(c.getName(), c.getValue(), c.getUnit());
		if (info.isEmpty() || dose == null || dose <= info.get().getMaxSingleDose())
			return Collections.emptyList();
		MedicationInfo m = info.get();
		return List.of(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.EXCESSIVE_MEDICATION_DOSE,
				m.getName() + " dose " + format(c.getValue()) + " " + c.getUnit() + " exceeds maximum single dose "
						+ format(m.getMaxSingleDose()) + " " + m.getDoseUnit(),
				"Verify the dose with pharmacy", List.of(f)));
	}

	static String format(double v) {
		return v == Math.rint(v) ? String.valueOf((long) v) : String.valueOf(v);
	}
}
