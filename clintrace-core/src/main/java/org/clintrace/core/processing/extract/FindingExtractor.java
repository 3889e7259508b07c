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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.FindingKind;

/**
 * Narrative assertions the validator checks structured facts against.
 */
final class FindingExtractor extends AbstractPatternExtractor {

	static final double CONFIDENCE = 0.90;

	private static final FindingKind[] KINDS = { FindingKind.NO_COMPLICATIONS, FindingKind.NON_OPERATIVE,
			FindingKind.STABLE_FOR_DISCHARGE, FindingKind.PROCEDURE_SUCCESSFUL, FindingKind.IMPROVING };

	private static final String PROCEDURE_WORDS = "procedure|surgery|operation|clipping|coiling|craniotomy|embolization|resection";

	private final Pattern familyPattern;

	FindingExtractor(ClinicalKnowledgeBase kb) {
		super(List.of(
				Pattern.compile("\\b(?:no\\s+(?:(?:intra|post)-?operative\\s+|immediate\\s+|surgical\\s+|apparent\\s+)?complications?"
						+ "(?:\\s+(?:were\\s+)?(?:noted|occurred|encountered|identified|reported))?"
						+ "|without\\s+(?:any\\s+)?(?:apparent\\s+)?complications?"
						+ "|complications?\\s*:\\s*(?:none|nil|n/?a)\\b|uncomplicated)", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:non-?operative(?:\\s+management)?|conservative(?:ly)?\\s+manage(?:d|ment)|medical management"
						+ "|not a surgical candidate|no surgical intervention|surgery (?:was )?not indicated)\\b",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:stable\\s+for\\s+discharge|medically\\s+stable(?:\\s+for\\s+discharge)?"
						+ "|discharged?\\s+(?:home\\s+)?in\\s+(?:good|stable)\\s+condition"
						+ "|condition\\s+(?:at|on)\\s+discharge\\s*:\\s*(?:stable|good)|ready\\s+for\\s+discharge)\\b",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:(?:" + PROCEDURE_WORDS + ")\\b[^.;]*?\\b(?:successful(?:ly)?|went well|without incident)"
						+ "|successful(?:ly)?\\s+(?:\\w+\\s+){0,3}?(?:" + PROCEDURE_WORDS + "|completed)"
						+ "|tolerated the procedure well)\\b", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:improving|improved|improvement|getting\\s+better|better\\s+today)\\b",
						Pattern.CASE_INSENSITIVE)));
		Pattern families = null;
		String forms = alternation(kb.scoreSurfaceForms());
		String labs = alternation(kb.labSurfaceForms());
		if (!forms.isEmpty() || !labs.isEmpty()) {
			families = Pattern.compile("\\b(" + forms + (forms.isEmpty() || labs.isEmpty() ? "" : "|") + labs + ")\\b",
					Pattern.CASE_INSENSITIVE);
		}
		this.familyPattern = families;
	}

	@Override
	public FactType type() {
		return FactType.FINDING;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		FindingKind kind = KINDS[patternIndex];
		if (kind == FindingKind.IMPROVING && isNegated(line, m.start()))
			return null;
		String family = kind == FindingKind.IMPROVING ? familyOf(ctx.getKnowledgeBase(), line) : null;
		return factAt(ctx, lineNo, line, trimPunctuation(m.group()), CONFIDENCE)
				.attributes(attrs(line, FactAttribute.FINDING, kind.name(), FactAttribute.FAMILY, family)).build();
	}

	/** Measurement family named on the line, e.g. "NIHSS improving" refers to nihss. */
	private String familyOf(ClinicalKnowledgeBase kb, String line) {
		if (familyPattern == null)
			return null;
		Matcher fm = familyPattern.matcher(line);
		if (!fm.find())
			return null;
		String surface = fm.group(1).toLowerCase(Locale.ROOT);
		if (kb.score(surface).isPresent())
			return kb.score(surface).get().getName();
		return kb.canonicalLabName(surface);
	}
}
