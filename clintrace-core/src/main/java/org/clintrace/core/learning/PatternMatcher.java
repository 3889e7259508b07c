package org.clintrace.core.learning;

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
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.LearningPattern;
import org.clintrace.core.util.ContentHash;

import opennlp.tools.stemmer.snowball.SnowballStemmer;
import opennlp.tools.tokenize.SimpleTokenizer;

/**
 * Similarity between a fact and a learning pattern.
 *
 * <p>A pattern whose original text contains, or is contained in, the fact text
 * scores 1.0. Otherwise the score is the larger of the Jaccard similarity of
 * the stemmed token sets and the Ratcliff/Obershelp ratio of the normalized
 * texts, plus a flat bonus when the pattern's context matches the fact.</p>
 */
public class PatternMatcher {

	/** Shortest original text a pattern may carry. */
	public static final int MIN_ORIGINAL_LENGTH = 2;

	private static final ThreadLocal<SnowballStemmer> STEMMER = ThreadLocal
			.withInitial(() -> new SnowballStemmer(SnowballStemmer.ALGORITHM.ENGLISH));

	private final LearningSettings settings;

	public PatternMatcher(LearningSettings settings) {
		this.settings = settings;
	}

	public LearningSettings getSettings() {
		return settings;
	}

	/**
	 * Match score in [0,1]; 0 when the fact type differs from the pattern's.
	 */
	public double score(Fact fact, LearningPattern pattern) {
		if (fact.getType() == null || fact.getType() != pattern.getFactType())
			return 0.0;
		String text = ContentHash.normalize(fact.getText());
		String original = ContentHash.normalize(pattern.getOriginalText());
		if (text.isEmpty() || original.isEmpty())
			return 0.0;
		if (text.contains(original) || original.contains(text))
			return 1.0;
		double similarity = Math.max(jaccard(stems(text), stems(original)), sequenceRatio(text, original));
		if (contextMatches(fact, pattern.getContext()))
			similarity += settings.getContextBonus();
		return Math.min(1.0, similarity);
	}

	/**
	 * Active patterns scoring at or above the match threshold, best first. Ties
	 * keep the order of {@code patterns}.
	 */
	public List<PatternMatch> findMatches(Fact fact, Collection<LearningPattern> patterns) {
		List<PatternMatch> out = new ArrayList<>();
		for (LearningPattern p : patterns) {
			if (!p.isActive(settings.getSuccessThreshold()))
				continue;
			double s = score(fact, p);
			if (s >= settings.getMatchThreshold())
				out.add(new PatternMatch(p, s));
		}
		out.sort(Comparator.comparingDouble(PatternMatch::getScore).reversed());
		return out;
	}

	public Optional<PatternMatch> findBestMatch(Fact fact, Collection<LearningPattern> patterns) {
		List<PatternMatch> matches = findMatches(fact, patterns);
		return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
	}

	/** Problems that make a pattern unusable; empty when it is well formed. */
	public List<String> validatePattern(LearningPattern pattern) {
		List<String> issues = new ArrayList<>();
		if (pattern.getFactType() == null)
			issues.add("Fact type is required.");
		if (StringUtils.isBlank(pattern.getOriginalText()))
			issues.add("Original text is required.");
		else if (pattern.getOriginalText().trim().length() < MIN_ORIGINAL_LENGTH)
			issues.add("Original text must be at least " + MIN_ORIGINAL_LENGTH + " characters.");
		if (StringUtils.isBlank(pattern.getCorrectedText()))
			issues.add("Corrected text is required.");
		if (StringUtils.isNoneBlank(pattern.getOriginalText(), pattern.getCorrectedText()) && ContentHash
				.normalize(pattern.getOriginalText()).equals(ContentHash.normalize(pattern.getCorrectedText())))
			issues.add("Corrected text is identical to the original text.");
		return issues;
	}

	// ---- similarity ----------------------------------------------------------------

	private boolean contextMatches(Fact fact, String context) {
		if (StringUtils.isBlank(context))
			return false;
		String c = context.trim();
		if (c.equalsIgnoreCase(fact.getType().getLabel()) || c.equalsIgnoreCase(fact.getType().name()))
			return true;
		if (fact.getDocumentType() != null && c.equalsIgnoreCase(fact.getDocumentType().name()))
			return true;
		if (c.equalsIgnoreCase(fact.getDocumentId()))
			return true;
		String line = fact.attribute(FactAttribute.CONTEXT);
		return line != null && jaccard(stems(ContentHash.normalize(c)), stems(ContentHash.normalize(line))) > 0.5;
	}

	static Set<String> stems(String text) {
		SnowballStemmer stemmer = STEMMER.get();
		Set<String> out = new LinkedHashSet<>();
		for (String token : SimpleTokenizer.INSTANCE.tokenize(text.toLowerCase(Locale.ROOT))) {
			if (token.chars().allMatch(ch -> !Character.isLetterOrDigit(ch)))
				continue;
			out.add(stemmer.stem(token).toString());
		}
		return out;
	}

	static double jaccard(Set<String> a, Set<String> b) {
		if (a.isEmpty() && b.isEmpty())
			return 0.0;
		Set<String> union = new LinkedHashSet<>(a);
		union.addAll(b);
		int common = 0;
		for (String s : a) {
			if (b.contains(s))
				common++;
		}
		return (double) common / union.size();
	}

	/** Ratcliff/Obershelp: twice the matched characters over the total length. */
	static double sequenceRatio(String a, String b) {
		int total = a.length() + b.length();
		if (total == 0)
			return 0.0;
		return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
	}

	private static int matchingCharacters(String a, int aLo, int aHi, String b, int bLo, int bHi) {
		int bestI = aLo;
		int bestJ = bLo;
		int bestSize = 0;
		int[] prev = new int[bHi - bLo + 1];
		for (int i = aLo; i < aHi; i++) {
			int[] cur = new int[bHi - bLo + 1];
			for (int j = bLo; j < bHi; j++) {
				if (a.charAt(i) == b.charAt(j)) {
					int k = prev[j - bLo] + 1;
					cur[j - bLo + 1] = k;
					if (k > bestSize) {
						bestSize = k;
						bestI = i - k + 1;
						bestJ = j - k + 1;
					}
				}
			}
			prev = cur;
		}
		if (bestSize == 0)
			return 0;
		return bestSize + matchingCharacters(a, aLo, bestI, b, bLo, bestJ)
				+ matchingCharacters(a, bestI + bestSize, aHi, b, bestJ + bestSize, bHi);
	}
}
