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

/**
 * Complications. Negated mentions and "Complications: None" produce nothing
 * here; the latter is picked up as a narrative finding.
 */
final class ComplicationExtractor extends AbstractPatternExtractor {

	static final double HEADER_CONFIDENCE = 0.92;
	static final double NARRATIVE_CONFIDENCE = 0.90;

	private static final Pattern NONE_VALUE = Pattern.compile(
			"^(?:none|no|nil|n/?a|none (?:noted|apparent|encountered|identified))\\b", Pattern.CASE_INSENSITIVE);
	private static final Pattern QUALIFIER_AFTER = Pattern.compile("^\\s*(?:prophylaxis|precautions|scale|risk)\\b",
			Pattern.CASE_INSENSITIVE);

	private static final String TERMS = "CSF leak|cerebrospinal fluid leak|vasospasm|hydrocephalus|rebleed(?:ing)?|re-?hemorrhage|"
			+ "(?:epidural |subdural |wound )?hematoma|seizures?|(?:wound |surgical site )?infection|meningitis|ventriculitis|"
			+ "wound dehiscence|DVT|deep vein thrombosis|pulmonary embol(?:ism|us)|pneumonia|infarct(?:ion)?|"
			+ "hyponatremia|SIADH|cerebral salt wasting|delirium|UTI|sepsis";

	ComplicationExtractor() {
		super(List.of(
				Pattern.compile("^\\s*(?:(?:post|intra)-?operative\\s+)?complications?\\s*:\\s*(.+)$",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:complicated by|developed|new onset(?: of)?)\\s+(?:an?\\s+|a new\\s+)?([^.;,]+)",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(" + TERMS + ")\\b", Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.COMPLICATION;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		String text = trimPunctuation(m.group(1));
		if (text == null || text.isBlank())
			return null;
		if (patternIndex == 0 && NONE_VALUE.matcher(text).find())
			return null;
		if (patternIndex > 0) {
			if (isNegated(line, m.start()))
				return null;
			if (QUALIFIER_AFTER.matcher(line.substring(m.end())).find())
				return null;
		}
		return factAt(ctx, lineNo, line, text, patternIndex == 0 ? HEADER_CONFIDENCE : NARRATIVE_CONFIDENCE)
				.requiresValidation(true).clinicalSignificance("CRITICAL").build();
	}

	@Override
	public String fallbackInstruction() {
		return "List any complications the patient experienced, one per line. "
				+ "Answer NONE if no complication is documented.";
	}

	@Override
	public boolean plausiblyPresent(ExtractionContext ctx) {
		return ctx.isNarrative() && ctx.mentionsAny("complicat", "leak", "infection", "bleed", "hemorrhage");
	}
}
