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

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.clintrace.core.om.ExtractionSource;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;

/**
 * Runs an ordered list of patterns over each line. A span matched by an
 * earlier pattern is not offered to later ones.
 */
abstract class AbstractPatternExtractor implements EntityExtractor {

	private static final Pattern NEGATION = Pattern.compile(
			"\\b(?:no|not|denies|denied|negative for|without|free of|r/o|rule out|ruled out|resolved)\\b",
			Pattern.CASE_INSENSITIVE);

	private final List<Pattern> patterns;

	protected AbstractPatternExtractor(List<Pattern> patterns) {
		this.patterns = List.copyOf(patterns);
	}

	@Override
	public List<Fact> extract(ExtractionContext ctx) {
		List<Fact> out = new ArrayList<>();
		SpanTracker spans = new SpanTracker();
		List<String> lines = ctx.getLines();
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			if (line.isBlank())
				continue;
			for (int p = 0; p < patterns.size(); p++) {
				Matcher m = patterns.get(p).matcher(line);
				while (m.find()) {
					if (m.end() == m.start() || !spans.claim(i, m.start(), m.end()))
						continue;
					Fact f = toFact(ctx, i + 1, line, m, p);
					if (f != null)
						out.add(f);
				}
			}
		}
		return out;
	}

	/**
	 * Builds the fact for one match, or returns null to drop it. The span stays
	 * claimed either way.
	 */
	protected abstract Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex);

	/** Builder pre-filled with provenance for a pattern match on {@code line}. */
	protected Fact.FactBuilder factAt(ExtractionContext ctx, int lineNo, String line, String text,
			double confidence) {
		Map<String, String> attrs = new HashMap<>();
		attrs.put(FactAttribute.CONTEXT, line.trim());
		return Fact.builder().text(text).documentId(ctx.getDocument().getId()).line(lineNo)
				.documentTimestamp(ctx.getDocument().getTimestamp()).documentType(ctx.getDocumentType())
				.type(type()).confidence(confidence).source(ExtractionSource.PATTERN).attributes(attrs);
	}

	/** Adds attributes on top of those set by {@link #factAt}. */
	protected static Map<String, String> attrs(String line, String... keyValues) {
		Map<String, String> attrs = new HashMap<>();
		attrs.put(FactAttribute.CONTEXT, line.trim());
		for (int i = 0; i + 1 < keyValues.length; i += 2) {
			if (keyValues[i + 1] != null)
				attrs.put(keyValues[i], keyValues[i + 1]);
		}
		return attrs;
	}

	/**
	 * True when a negation cue appears in the same clause before {@code start}
	 * ("no CSF leak", "negative for hydrocephalus").
	 */
	protected static boolean isNegated(String line, int start) {
		int clauseStart = 0;
		for (int i = start - 1; i >= 0; i--) {
			char c = line.charAt(i);
			if (c == '.' || c == ';' || c == ':') {
				clauseStart = i + 1;
				break;
			}
		}
		String clause = line.substring(clauseStart, start);
		int but = clause.toLowerCase().lastIndexOf(" but ");
		if (but >= 0)
			clause = clause.substring(but + 5);
		return NEGATION.matcher(clause).find();
	}

	/**
	 * Regex alternation over surface forms, longest first, with any run of
	 * spaces or hyphens matching flexibly.
	 */
	protected static String alternation(Collection<String> forms) {
		return forms.stream().filter(s -> s != null && !s.isBlank()).distinct()
				.sorted((a, b) -> b.length() != a.length() ? b.length() - a.length() : a.compareTo(b))
				.map(AbstractPatternExtractor::flexible).collect(Collectors.joining("|"));
	}

	private static String flexible(String form) {
		String[] parts = form.trim().split("[\\s-]+");
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < parts.length; i++) {
			if (i > 0)
				sb.append("[\\s-]+");
			sb.append(Pattern.quote(parts[i]));
		}
		return sb.toString();
	}

	protected static String trimPunctuation(String s) {
		return s == null ? null : s.trim().replaceAll("[\\s.,;:]+$", "");
	}
}
