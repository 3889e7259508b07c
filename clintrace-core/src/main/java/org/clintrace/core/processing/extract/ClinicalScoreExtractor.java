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

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.kb.ScoreReference;
import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.ConceptKind;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LabSeverity;

/**
 * Clinical scores and grades ("NIHSS: 6", "GCS 14/15", "Hunt-Hess grade III").
 * Out-of-range values still extract, at low confidence and flagged.
 */
final class ClinicalScoreExtractor extends AbstractPatternExtractor {

	static final double CONFIDENCE = 0.95;
	static final double INVALID_CONFIDENCE = 0.70;

	ClinicalScoreExtractor(ClinicalKnowledgeBase kb) {
		super(List.of(Pattern.compile("\\b(" + alternation(kb.scoreSurfaceForms()) + ")"
				+ "(?:\\s+(?:score|grade|scale))?\\s*(?:of|was|is|=|:|-)?\\s*"
				+ "(\\d{1,3}|(?-i:IV|V|I{1,3}))\\b(?:\\s*/\\s*\\d{1,2})?", Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.CLINICAL_SCORE;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		ScoreReference ref = ctx.getKnowledgeBase().score(m.group(1)).orElse(null);
		if (ref == null)
			return null;
		double value = parseScore(m.group(2));
		boolean valid = ref.isValid(value);
		boolean critical = ref.isCritical(value);

		LabSeverity severity = !valid ? LabSeverity.UNKNOWN : critical ? LabSeverity.CRITICAL : LabSeverity.NORMAL;
		ClinicalConcept concept = ClinicalConcept.builder().kind(ConceptKind.SCORE).name(ref.getName()).value(value)
				.normalLow((double) ref.getMin()).normalHigh((double) ref.getMax()).severity(severity)
				.implication(ref.getDescription()).build();

		String significance = !valid ? "INVALID_RANGE" : critical ? "CRITICAL" : null;
		return factAt(ctx, lineNo, line, trimPunctuation(m.group()), valid ? CONFIDENCE : INVALID_CONFIDENCE)
				.normalizedValue(concept).requiresValidation(!valid || critical).clinicalSignificance(significance)
				.attributes(attrs(line, FactAttribute.FAMILY, ref.getName())).build();
	}

	static double parseScore(String raw) {
		switch (raw) {
		case "I":
			return 1;
		case "II":
			return 2;
		case "III":
			return 3;
		case "IV":
			return 4;
		case "V":
			return 5;
		default:
			return Double.parseDouble(raw);
		}
	}
}
