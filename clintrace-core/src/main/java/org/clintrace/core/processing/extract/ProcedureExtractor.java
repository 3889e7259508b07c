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
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;

/**
 * Procedures. Anything documented in an operative note, other than a
 * "status post" history mention, is a surgery anchor.
 */
final class ProcedureExtractor extends AbstractPatternExtractor {

	static final double HEADER_CONFIDENCE = 0.95;
	static final double NARRATIVE_CONFIDENCE = 0.90;

	static final Pattern REVISION = Pattern.compile(
			"\\b(?:revision|re-?operation|re-?exploration|return(?:ed)? to (?:the )?(?:OR|operating room)|taken back to (?:the )?(?:OR|operating room))\\b",
			Pattern.CASE_INSENSITIVE);

	private static final String PROCEDURE_NAMES = "(?:(?:left|right|bilateral|bifrontal|pterional|suboccipital|decompressive|lumbar|cervical|endovascular|stereotactic)\\s+)*"
			+ "(?:craniotomy|craniectomy|cranioplasty|aneurysm clipping|clipping|coil(?:ing)? embolization|coiling|embolization|"
			+ "ventriculostomy|EVD placement|external ventricular drain(?: placement)?|laminectomy|discectomy|fusion|"
			+ "(?:VP )?shunt (?:placement|revision)|thrombectomy|biopsy|resection|(?:wound )?revision|re-?operation|"
			+ "re-?exploration|lumbar drain(?: placement)?|angiogram)";

	private static final int HEADER = 0;
	private static final int HISTORY = 2;

	ProcedureExtractor() {
		super(List.of(
				Pattern.compile("^\\s*(?:procedures?|operations?|surgery)(?:\\s+performed)?\\s*:\\s*(.+)$",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:underwent|taken to the (?:OR|operating room) for|taken back to the (?:OR|operating room) for|returned to the (?:OR|operating room) for|performed)\\s+(?:an?\\s+|the\\s+)?([^.;,]+)",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:s/p|status post)\\s+(?:an?\\s+|the\\s+)?([^.;,]+)", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(" + PROCEDURE_NAMES + "(?:\\s+(?:of|for)\\s+[^.;,]+)?)", Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.PROCEDURE;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		if (patternIndex > HISTORY && isNegated(line, m.start()))
			return null;
		String text = trimPunctuation(m.group(1));
		if (text == null || text.isBlank())
			return null;
		boolean surgical = ctx.getDocumentType() == DocumentType.OPERATIVE_NOTE && patternIndex != HISTORY;
		boolean revision = REVISION.matcher(m.group()).find();
		return factAt(ctx, lineNo, line, text, patternIndex == HEADER ? HEADER_CONFIDENCE : NARRATIVE_CONFIDENCE)
				.surgical(surgical).clinicalSignificance(surgical ? "HIGH" : null)
				.attributes(attrs(line, FactAttribute.REVISION, revision ? "true" : null)).build();
	}

	@Override
	public String fallbackInstruction() {
		return "List the procedures or operations performed during this encounter, one per line. "
				+ "Answer NONE if no procedure is documented.";
	}

	@Override
	public boolean plausiblyPresent(ExtractionContext ctx) {
		return ctx.isNarrative() && ctx.mentionsAny("procedure", "surgery", "operat", "underwent");
	}
}
