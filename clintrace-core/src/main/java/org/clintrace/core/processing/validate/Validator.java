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

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.TemporalConflict;
import org.clintrace.core.om.Timeline;
import org.clintrace.core.om.Uncertainty;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.util.Logger;

/**
 * Runs the six validation stages in order. Every stage runs regardless of what
 * earlier stages found. Facts are returned as given; every finding is an
 * {@link Uncertainty}.
 */
public class Validator {

	private final ClinicalKnowledgeBase knowledgeBase;
	private final ClinicalRuleCheck clinicalRules = new ClinicalRuleCheck();
	private final List<ValidationCheck> stages;

	public Validator(ClinicalKnowledgeBase knowledgeBase) {
		this.knowledgeBase = knowledgeBase;
		this.stages = List.of(new FormatCheck(), clinicalRules, new TemporalConsistencyCheck(), new CrossFactCheck(),
				new ContradictionCheck(), new CompletenessCheck());
	}

	/** Adds or replaces the clinical rule for a fact type. */
	public Validator registerRule(FactType type, FactRule rule) {
		clinicalRules.register(type, rule);
		return this;
	}

	public ValidationResult validate(List<Fact> facts, Timeline timeline) {
		return validate(facts, timeline, Collections.emptyList());
	}

	/**
	 * @param conflicts temporal conflicts from resolution; reported in the
	 *                  temporal stage
	 */
	public ValidationResult validate(List<Fact> facts, Timeline timeline, List<TemporalConflict> conflicts) {
		// Fact construction already bounds confidence to [0,1], so the list passes through as is.
		List<Fact> out = List.copyOf(facts);
		ValidationContext ctx = new ValidationContext(out, timeline, conflicts, knowledgeBase);

		List<Uncertainty> uncertainties = new ArrayList<>();
		for (ValidationCheck stage : stages) {
			List<Uncertainty> found = stage.check(ctx);
			Logger.debug("Validation stage {}: {} issues", stage.stage(), found.size());
			uncertainties.addAll(found);
		}

		Map<UncertaintySeverity, Integer> counts = new EnumMap<>(UncertaintySeverity.class);
		for (UncertaintySeverity s : UncertaintySeverity.values())
			counts.put(s, 0);
		uncertainties.forEach(u -> counts.merge(u.getSeverity(), 1, Integer::sum));
		Logger.info("Validation: {} uncertainties (HIGH={}, MEDIUM={}, LOW={})", uncertainties.size(),
				counts.get(UncertaintySeverity.HIGH), counts.get(UncertaintySeverity.MEDIUM),
				counts.get(UncertaintySeverity.LOW));
		return new ValidationResult(out, Collections.unmodifiableList(uncertainties), counts);
	}
}
