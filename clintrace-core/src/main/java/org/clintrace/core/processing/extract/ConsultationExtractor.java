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

import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;
import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;

/**
 * Specialist consultations and their recommendations.
 */
final class ConsultationExtractor extends AbstractPatternExtractor {

	static final double CONFIDENCE = 0.88;

	private static final String SPECIALTIES = "neurology|neurosurgery|neuro-?critical care|infectious diseases?|(?-i:ID)|"
			+ "cardiology|nephrology|endocrinology|endocrine|hematology|thrombosis|critical care|pulmonology|"
			+ "physical therapy|occupational therapy|speech(?:-language)? (?:therapy|pathology)|palliative care|"
			+ "psychiatry|social work|case management|rehabilitation";

	private static final int SPECIALTY_RECOMMENDATION = 0;
	private static final int CONSULT_NOTE_RECOMMENDATION = 1;

	ConsultationExtractor() {
		super(List.of(
				Pattern.compile("\\b(" + SPECIALTIES + ")\\s+(?:consult(?:ation)?\\s+|service\\s+|team\\s+)?"
						+ "(?:recommend(?:s|ed|ations?)?|recs)\\b\\s*:?\\s*(.+)$", Pattern.CASE_INSENSITIVE),
				Pattern.compile("^\\s*(?:recommendations?|recs)\\s*:\\s*(.+)$", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:consult(?:ed|ation)?\\s+(?:to|with|from|by)?\\s*(" + SPECIALTIES + ")|("
						+ SPECIALTIES + ")\\s+(?:was\\s+)?consult(?:ed|ation)?)\\b", Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.CONSULTATION;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		String specialty;
		switch (patternIndex) {
		case SPECIALTY_RECOMMENDATION:
			specialty = m.group(1);
			break;
		case CONSULT_NOTE_RECOMMENDATION:
			if (ctx.getDocumentType() != DocumentType.CONSULT_NOTE)
				return null;
			specialty = ctx.getDocument().getSpecialty();
			break;
		default:
			specialty = m.group(1) != null ? m.group(1) : m.group(2);
			break;
		}
		return factAt(ctx, lineNo, line, trimPunctuation(m.group()), CONFIDENCE)
				.attributes(attrs(line, FactAttribute.SPECIALTY, canonicalSpecialty(specialty))).build();
	}

	static String canonicalSpecialty(String raw) {
		if (StringUtils.isBlank(raw))
			return null;
		String s = raw.trim();
		if (s.equals("ID"))
			return "Infectious Disease";
		return Arrays.stream(s.toLowerCase().split("\\s+")).map(StringUtils::capitalize)
				.collect(Collectors.joining(" "));
	}

	@Override
	public String fallbackInstruction() {
		return "List specialist consultations and their recommendations, one per line, prefixed with the specialty. "
				+ "Answer NONE if no consultation is documented.";
	}

	@Override
	public boolean plausiblyPresent(ExtractionContext ctx) {
		return ctx.isNarrative() && ctx.mentionsAny("consult", "recommend");
	}
}
