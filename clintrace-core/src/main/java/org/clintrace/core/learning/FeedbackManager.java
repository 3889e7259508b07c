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

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import org.clintrace.core.om.ApprovalStatus;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LearningPattern;
import org.clintrace.core.util.ContentHash;
import org.clintrace.core.util.Logger;

import org.apache.commons.lang3.StringUtils;

/**
 * Owns the learning patterns: submission, review, application and outcome
 * tracking.
 *
 * <p>Patterns start PENDING and are applied only while active, that is APPROVED
 * with a success rate at or above the threshold. A correction pass works on a
 * copy of the active set taken once at its start, so reviews made while a pass
 * runs take effect on the next pass.</p>
 *
 * <p>Who may approve or reject is the caller's concern; the reviewer identity is
 * recorded as given.</p>
 */
public class FeedbackManager {

	private final LearningSettings settings;
	private final PatternMatcher matcher;
	private final Clock clock;

	// guarded by this
	private final Map<String, LearningPattern> patterns = new LinkedHashMap<>();

	public FeedbackManager(LearningSettings settings) {
		this(settings, new PatternMatcher(settings), Clock.systemDefaultZone());
	}

	public FeedbackManager(LearningSettings settings, PatternMatcher matcher, Clock clock) {
		this.settings = settings;
		this.matcher = matcher;
		this.clock = clock;
	}

	public LearningSettings getSettings() {
		return settings;
	}

	// ---- feedback side ----------------------------------------------------------------

	/**
	 * Stores a correction as a PENDING pattern. Submitting the same correction
	 * again returns the existing id.
	 *
	 * @throws IllegalArgumentException when the correction is malformed
	 */
	public synchronized String submit(FactType factType, String originalText, String correctedText, String context,
			String submitter) {
		LearningPattern candidate = LearningPattern.builder().factType(factType).originalText(originalText)
				.correctedText(correctedText).context(context).build();
		List<String> issues = matcher.validatePattern(candidate);
		if (!issues.isEmpty()) {
			throw new IllegalArgumentException("Invalid correction: " + String.join(" ", issues));
		}
		String id = ContentHash.sha256(factType, originalText.trim(), correctedText.trim());
		if (patterns.containsKey(id)) {
			Logger.info("Correction already submitted as pattern {}", id);
			return id;
		}
		candidate.setId(id);
		candidate.setOriginalText(originalText.trim());
		candidate.setCorrectedText(correctedText.trim());
		candidate.setCreatedBy(submitter);
		candidate.setCreatedAt(LocalDateTime.now(clock));
		patterns.put(id, candidate);
		Logger.info("Pattern {} submitted by {} for {}: '{}' -> '{}'", id, submitter, factType, originalText,
				correctedText);
		return id;
	}

	// ---- approval side ----------------------------------------------------------------

	public synchronized boolean approve(String patternId, String approver) {
		LearningPattern p = patterns.get(patternId);
		if (p == null) {
			Logger.error("Cannot approve unknown pattern {}", patternId);
			return false;
		}
		p.setStatus(ApprovalStatus.APPROVED);
		p.setReviewedBy(approver);
		p.setReviewedAt(LocalDateTime.now(clock));
		p.setRejectionReason(null);
		Logger.info("Pattern {} approved by {}", patternId, approver);
		return true;
	}

	public synchronized boolean reject(String patternId, String approver, String reason) {
		LearningPattern p = patterns.get(patternId);
		if (p == null) {
			Logger.error("Cannot reject unknown pattern {}", patternId);
			return false;
		}
		p.setStatus(ApprovalStatus.REJECTED);
		p.setReviewedBy(approver);
		p.setReviewedAt(LocalDateTime.now(clock));
		p.setRejectionReason(reason);
		Logger.info("Pattern {} rejected by {}: {}", patternId, approver, reason);
		return true;
	}

	// ---- application side -------------------------------------------------------------

	/**
	 * Rewrites each fact matched by an active pattern. The best match at or above
	 * the match threshold wins; the corrected fact's confidence is scaled by the
	 * pattern's success rate. Facts already corrected are left alone.
	 */
	public CorrectionResult applyCorrections(List<Fact> facts) {
		return applyCorrections(facts, activeSnapshot());
	}

	/**
	 * Correction pass against a snapshot taken earlier with
	 * {@link #activeSnapshot()}. Patterns in the snapshot that are no longer
	 * active are still skipped.
	 */
	public CorrectionResult applyCorrections(List<Fact> facts, List<LearningPattern> snapshot) {
		List<LearningPattern> active = new ArrayList<>();
		for (LearningPattern p : snapshot) {
			if (p.isActive(settings.getSuccessThreshold()))
				active.add(p);
		}
		if (active.isEmpty()) {
			return new CorrectionResult(List.copyOf(facts), 0, Map.of());
		}

		List<Fact> out = new ArrayList<>(facts.size());
		Map<String, Integer> applied = new TreeMap<>();
		for (Fact fact : facts) {
			Optional<PatternMatch> best = fact.isCorrectionApplied() ? Optional.empty()
					: matcher.findBestMatch(fact, active);
			if (best.isEmpty()) {
				out.add(fact);
				continue;
			}
			LearningPattern p = best.get().getPattern();
			double confidence = Math.max(0.0, Math.min(1.0, fact.getConfidence() * p.getSuccessRate()));
			out.add(fact.withCorrection(correctedText(fact.getText(), p), p.getId(), confidence));
			applied.merge(p.getId(), 1, Integer::sum);
		}

		int total = 0;
		synchronized (this) {
			for (Map.Entry<String, Integer> e : applied.entrySet()) {
				total += e.getValue();
				LearningPattern stored = patterns.get(e.getKey());
				if (stored != null)
					stored.setApplicationCount(stored.getApplicationCount() + e.getValue());
			}
		}
		Logger.info("Applied {} corrections from {} active patterns", total, active.size());
		return new CorrectionResult(out, total, applied);
	}

	/** Replaces the pattern's original span when present, else the whole text. */
	static String correctedText(String text, LearningPattern p) {
		String original = p.getOriginalText();
		if (StringUtils.containsIgnoreCase(text, original))
			return StringUtils.replaceIgnoreCase(text, original, p.getCorrectedText());
		return p.getCorrectedText();
	}

	/**
	 * Records whether a reviewer overrode a correction made by this pattern. An
	 * override feeds 0.0 into the success-rate moving average, a confirmation 1.0.
	 * Each application accepts one outcome; further reports are ignored.
	 *
	 * @return false when the pattern is unknown or has no unreported application
	 */
	public synchronized boolean recordOutcome(String patternId, boolean overridden) {
		LearningPattern p = patterns.get(patternId);
		if (p == null) {
			Logger.error("Outcome reported for unknown pattern {}", patternId);
			return false;
		}
		if (p.getOutcomeCount() >= p.getApplicationCount()) {
			Logger.warn("Pattern {} has no application awaiting an outcome", patternId);
			return false;
		}
		boolean wasActive = p.isActive(settings.getSuccessThreshold());
		double alpha = settings.getEmaAlpha();
		p.setSuccessRate((1.0 - alpha) * p.getSuccessRate() + alpha * (overridden ? 0.0 : 1.0));
		p.setOutcomeCount(p.getOutcomeCount() + 1);
		if (overridden)
			p.setOverrideCount(p.getOverrideCount() + 1);
		if (wasActive && !p.isActive(settings.getSuccessThreshold())) {
			Logger.warn("Pattern {} deactivated: success rate {} below {}", patternId,
					String.format("%.3f", p.getSuccessRate()), settings.getSuccessThreshold());
		}
		return true;
	}

	// ---- queries ---------------------------------------------------------------------

	public synchronized List<LearningPattern> pendingPatterns() {
		return patterns.values().stream().filter(p -> p.getStatus() == ApprovalStatus.PENDING)
				.sorted(Comparator.comparing(LearningPattern::getCreatedAt,
						Comparator.nullsLast(Comparator.naturalOrder())))
				.map(LearningPattern::copy).collect(Collectors.toList());
	}

	/** Approved patterns, including deactivated ones, most used first. */
	public synchronized List<LearningPattern> approvedPatterns() {
		return patterns.values().stream().filter(p -> p.getStatus() == ApprovalStatus.APPROVED)
				.sorted(Comparator.comparingInt(LearningPattern::getApplicationCount).reversed())
				.map(LearningPattern::copy).collect(Collectors.toList());
	}

	public synchronized Optional<LearningPattern> findPattern(String patternId) {
		return Optional.ofNullable(patterns.get(patternId)).map(LearningPattern::copy);
	}

	public synchronized LearningStatistics statistics() {
		int pending = 0;
		int approved = 0;
		int rejected = 0;
		int active = 0;
		long applications = 0;
		double rateSum = 0.0;
		for (LearningPattern p : patterns.values()) {
			applications += p.getApplicationCount();
			switch (p.getStatus()) {
			case PENDING:
				pending++;
				break;
			case APPROVED:
				approved++;
				rateSum += p.getSuccessRate();
				if (p.isActive(settings.getSuccessThreshold()))
					active++;
				break;
			case REJECTED:
				rejected++;
				break;
			}
		}
		int total = patterns.size();
		return new LearningStatistics(total, pending, approved, rejected, active,
				total == 0 ? 0.0 : (double) approved / total, applications,
				approved == 0 ? 0.0 : rateSum / approved);
	}

	// ---- persistence collaborator -------------------------------------------------------

	/** Adds stored patterns, replacing any held under the same id. */
	public synchronized void load(Collection<LearningPattern> stored) {
		for (LearningPattern p : stored) {
			if (StringUtils.isBlank(p.getId())) {
				Logger.warn("Skipping stored pattern without id: {}", p.getOriginalText());
				continue;
			}
			patterns.put(p.getId(), p.copy());
		}
		Logger.info("Loaded {} learning patterns", stored.size());
	}

	/** Copies of every pattern, in submission order. */
	public synchronized List<LearningPattern> snapshot() {
		return patterns.values().stream().map(LearningPattern::copy).collect(Collectors.toList());
	}

	/** Copies of the patterns that are active right now. */
	public synchronized List<LearningPattern> activeSnapshot() {
		return patterns.values().stream().filter(p -> p.isActive(settings.getSuccessThreshold()))
				.map(LearningPattern::copy).collect(Collectors.toList());
	}
}
