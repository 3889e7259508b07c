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

import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;

/**
 * One admission anchor per admission note: the first admission statement, or
 * the note's first line when it has none.
 */
final class AdmissionExtractor extends AbstractPatternExtractor {

	static final double CONFIDENCE = 0.95;

	AdmissionExtractor() {
		super(List.of(
				Pattern.compile("^\\s*(?:admission date|date of admission|admitted(?: on)?)\\b\\s*:?\\s*(.*)$",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:was\\s+)?admitted to (?:the )?[A-Za-z -]*?(?:ICU|unit|service|floor|hospital|neurosurgery)\\b",
						Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.ADMISSION;
	}

	@Override
	public List<Fact> extract(ExtractionContext ctx) {
		if (ctx.getDocumentType() != DocumentType.ADMISSION_NOTE)
			return List.of();
		List<Fact> found = super.extract(ctx);
		if (!found.isEmpty())
			return List.of(found.get(0));
		List<String> lines = ctx.getLines();
		for (int i = 0; i < lines.size(); i++) {
			if (!lines.get(i).isBlank()) {
				return List.of(anchor(ctx, i + 1, lines.get(i), lines.get(i)));
			}
		}
		return List.of();
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		return anchor(ctx, lineNo, line, m.group());
	}

	private Fact anchor(ExtractionContext ctx, int lineNo, String line, String text) {
		return factAt(ctx, lineNo, line, trimPunctuation(text), CONFIDENCE).clinicalSignificance("ANCHOR").build();
	}
}
