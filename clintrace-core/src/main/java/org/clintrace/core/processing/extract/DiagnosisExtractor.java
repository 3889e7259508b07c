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

import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;

final class DiagnosisExtractor extends AbstractPatternExtractor {

	static final double HEADER_CONFIDENCE = 0.90;
	static final double NARRATIVE_CONFIDENCE = 0.85;

	DiagnosisExtractor() {
		super(List.of(
				Pattern.compile("^\\s*(?:(?:admission|admitting|primary|principal|discharge|final|working|pre-?operative|post-?operative|secondary)\\s+)?"
						+ "(?:diagnosis|diagnoses|dx|impression|assessment)\\s*:\\s*(.+)$", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:diagnosed with|admitted (?:for|with)|presents? with|presenting with|found to have)\\s+"
						+ "(?:an?\\s+|the\\s+)?([^.;]+)", Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.DIAGNOSIS;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		String text = trimPunctuation(m.group(1));
		if (text == null || text.isBlank())
			return null;
		return factAt(ctx, lineNo, line, text, patternIndex == 0 ? HEADER_CONFIDENCE : NARRATIVE_CONFIDENCE)
				.build();
	}

	@Override
	public String fallbackInstruction() {
		return "State the primary diagnosis for this admission in a single line. "
				+ "Answer NONE if no diagnosis is documented.";
	}

	@Override
	public boolean plausiblyPresent(ExtractionContext ctx) {
		return ctx.isNarrative() && ctx.mentionsAny("diagnos", "impression", "assessment", "presents", "history of");
	}
}
