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
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;

/** Follow-up appointments and discharge instructions. */
final class RecommendationExtractor extends AbstractPatternExtractor {

	static final double CONFIDENCE = 0.90;

	private static final String[] KINDS = { "FOLLOW_UP", "INSTRUCTIONS", "INSTRUCTIONS" };

	RecommendationExtractor() {
		super(List.of(
				Pattern.compile("\\b(?:follow[- ]?up|f/u)\\b[^.;]*", Pattern.CASE_INSENSITIVE),
				Pattern.compile("^\\s*(?:discharge\\s+)?instructions?\\s*:\\s*(.+)$", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\breturn to (?:the )?(?:ED|emergency (?:department|room)|clinic)\\b[^.;]*",
						Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.RECOMMENDATION;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		return factAt(ctx, lineNo, line, trimPunctuation(m.group()), CONFIDENCE)
				.attributes(attrs(line, FactAttribute.RECOMMENDATION_KIND, KINDS[patternIndex])).build();
	}
}
