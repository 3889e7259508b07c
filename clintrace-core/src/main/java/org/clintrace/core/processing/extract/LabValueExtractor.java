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
import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LabSeverity;

/**
 * Lab values, normalized against the reference ranges. Analytes missing from
 * the knowledge base are kept when they carry a lab unit, at reduced
 * confidence and UNKNOWN severity.
 */
final class LabValueExtractor extends AbstractPatternExtractor {

	static final double KNOWN_CONFIDENCE = 0.95;
	static final double UNKNOWN_CONFIDENCE = 0.85;
	static final double LAB_REPORT_BOOST = 0.02;
	static final double MAX_CONFIDENCE = 0.98;

	private static final String LAB_UNITS = "mEq/L|mmol/L|mg/dL|g/dL|K/uL|K/µL|x10\\^?9/L|10\\^3/uL|/uL|ng/mL|U/L|IU/L|mg/L|pg/mL|µmol/L|umol/L|%";

	private static final int KNOWN = 0;

	LabValueExtractor(ClinicalKnowledgeBase kb) {
		super(List.of(
				Pattern.compile("\\b(" + alternation(kb.labSurfaceForms()) + ")\\b(?:\\s+(?:level|count|value))?"
						+ "\\s*(?:of|was|is|=|:)?\\s*(\\d+(?:\\.\\d+)?)(?:\\s*(" + LAB_UNITS + "))?",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b([A-Za-z][A-Za-z]{1,20}(?:\\s[A-Za-z]{2,20})?)\\s*(?::|=|\\bwas\\b|\\bof\\b)?\\s*"
						+ "(\\d+(?:\\.\\d+)?)\\s*(" + LAB_UNITS.replace("|%", "") + ")(?![A-Za-z])")));
	}

	@Override
	public FactType type() {
		return FactType.LAB_VALUE;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		ClinicalKnowledgeBase kb = ctx.getKnowledgeBase();
		String name = m.group(1).trim();
		if (patternIndex != KNOWN && (kb.canonicalLabName(name) != null || kb.medication(name).isPresent()))
			return null;
		double value = Double.parseDouble(m.group(2));

		ClinicalConcept concept = kb.normalizeLab(name, value);
		if (concept.getUnit() == null && m.group(3) != null) {
			concept = concept.toBuilder().unit(m.group(3)).build();
		}
		double confidence = concept.getSeverity() == LabSeverity.UNKNOWN ? UNKNOWN_CONFIDENCE : KNOWN_CONFIDENCE;
		if (ctx.getDocumentType() == DocumentType.LAB_REPORT) {
			confidence = Math.min(MAX_CONFIDENCE, confidence + LAB_REPORT_BOOST);
		}

		LabSeverity severity = concept.getSeverity();
		String significance = null;
		if (severity == LabSeverity.CRITICAL) {
			significance = "CRITICAL";
		} else if (severity.isAbnormal()) {
			significance = "ABNORMAL";
		}

		return factAt(ctx, lineNo, line, trimPunctuation(m.group()), confidence).normalizedValue(concept)
				.requiresValidation(severity == LabSeverity.CRITICAL).clinicalSignificance(significance)
				.attributes(attrs(line, FactAttribute.FAMILY,
						severity == LabSeverity.UNKNOWN ? null : concept.getName()))
				.build();
	}
}
