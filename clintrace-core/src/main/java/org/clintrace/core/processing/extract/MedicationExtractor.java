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
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.kb.MedicationInfo;
import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.ConceptKind;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;

/**
 * Medications: tabulated drugs first, then high-risk terms, then unknown
 * drug-like names that carry a dose.
 */
final class MedicationExtractor extends AbstractPatternExtractor {

	static final double KNOWN_CONFIDENCE = 0.95;
	static final double UNKNOWN_CONFIDENCE = 0.85;

	private static final String DOSE_TAIL = "(?:\\s*(\\d+(?:\\.\\d+)?)\\s*(mg|mcg|µg|ug|gm|g|units?|u|mEq|mL)\\b(?!\\s*/\\s*(?:dL|L|mL)\\b))?"
			+ "(?:\\s*/\\s*(?:kg|hr|h)\\b)?"
			+ "(?:\\s+(PO|IV|IVP|SC|SQ|subq|IM|PR|NG|PEG)\\b)?"
			+ "(?:\\s+(q\\s?\\d+\\s?h(?:rs?)?|every\\s+\\d+\\s+hours|daily|qd|bid|tid|qid|qhs|prn|once|x\\s?1)\\b)?";

	private static final String UNKNOWN_NAME = "([A-Za-z]{3,}(?:ine|ole|ide|ate|one|cin|mycin|pril|sartan|statin|azole|pam|lam|olol|xaban|parin|mab|phen|done|zine|tide|pine))";
	private static final String REQUIRED_DOSE = "\\s+(\\d+(?:\\.\\d+)?)\\s*(mg|mcg|g|units?)\\b(?!\\s*/\\s*(?:dL|L|mL)\\b)"
			+ "(?:\\s+(PO|IV|IVP|SC|SQ|subq|IM|PR|NG|PEG)\\b)?"
			+ "(?:\\s+(q\\s?\\d+\\s?h(?:rs?)?|every\\s+\\d+\\s+hours|daily|qd|bid|tid|qid|qhs|prn|once|x\\s?1)\\b)?";

	private static final int KNOWN = 0;
	private static final int HIGH_RISK_TERM = 1;

	MedicationExtractor(ClinicalKnowledgeBase kb) {
		super(List.of(
				Pattern.compile("\\b(" + alternation(kb.medicationNames()) + ")\\b" + DOSE_TAIL,
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b((?:" + alternation(kb.highRiskTerms()) + ")[A-Za-z]*)\\b" + DOSE_TAIL,
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b" + UNKNOWN_NAME + "\\b" + REQUIRED_DOSE, Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.MEDICATION;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		ClinicalKnowledgeBase kb = ctx.getKnowledgeBase();
		String name = m.group(1).toLowerCase(Locale.ROOT);
		if (patternIndex > HIGH_RISK_TERM && (kb.canonicalLabName(name) != null || kb.score(name).isPresent()))
			return null;

		Optional<MedicationInfo> info = kb.medication(name);
		double confidence = patternIndex == KNOWN && info.isPresent() ? KNOWN_CONFIDENCE : UNKNOWN_CONFIDENCE;
		boolean highRisk = kb.isHighRiskMedication(name);

		Double dose = m.group(2) == null ? null : Double.valueOf(m.group(2));
		String unit = m.group(3);
		ClinicalConcept concept = ClinicalConcept.builder().kind(ConceptKind.MEDICATION).name(name).value(dose)
				.unit(unit).build();

		return factAt(ctx, lineNo, line, trimPunctuation(m.group()), confidence).normalizedValue(concept)
				.requiresValidation(highRisk).clinicalSignificance(highRisk ? "HIGH_RISK_MEDICATION" : null)
				.attributes(attrs(line,
						FactAttribute.ROUTE, m.group(4),
						FactAttribute.FREQUENCY, m.group(5),
						FactAttribute.DRUG_CLASS, info.map(MedicationInfo::getDrugClass).orElse(null),
						FactAttribute.DRUG_SUBCLASS, info.map(MedicationInfo::getSubclass).orElse(null),
						FactAttribute.INDICATIONS, info.map(i -> String.join("; ", i.getIndications())).orElse(null),
						FactAttribute.MONITORING, info.map(i -> String.join("; ", i.getMonitoring())).orElse(null)))
				.build();
	}

	@Override
	public String fallbackInstruction() {
		return "List the medications administered or prescribed in this note, one per line, with dose, route and "
				+ "frequency when stated. Answer NONE if no medication is documented.";
	}

	@Override
	public boolean plausiblyPresent(ExtractionContext ctx) {
		return ctx.isNarrative()
				&& ctx.mentionsAny("medication", " mg", "dose", "started on", "given", "administered", "prescribed");
	}
}
