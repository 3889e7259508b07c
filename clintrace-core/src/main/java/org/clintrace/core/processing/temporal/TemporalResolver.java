package org.clintrace.core.processing.temporal;

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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.clintrace.core.kb.TemporalPatternType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.TemporalConflict;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.util.Logger;

/**
 * Converts relative time expressions into absolute timestamps.
 *
 * <p>Two passes over the full fact set. The first collects anchors (admissions
 * and surgical procedures) ordered by their document timestamp. The second
 * matches every other fact's text, then its source line, against the temporal
 * pattern catalog and computes the absolute time:</p>
 * <ul>
 * <li>POD#N: most recent surgery at or before the fact's document time, plus N days</li>
 * <li>HD#N: most recent admission at or before the fact's document time, plus N-1 days</li>
 * <li>everything else: arithmetic on the fact's own document timestamp</li>
 * </ul>
 * Failures become {@link TemporalConflict}s and the fact is kept unresolved.
 */
public class TemporalResolver {

	/** Confidence gain once a reference has been anchored. */
	public static final double CONFIDENCE_BOOST = 0.15;
	public static final double MAX_RESOLVED_CONFIDENCE = 0.95;

	private static final LocalTime MORNING = LocalTime.of(8, 0);
	private static final LocalTime EVENING = LocalTime.of(18, 0);
	private static final LocalTime NIGHT = LocalTime.of(22, 0);

	public TemporalResolution resolve(List<Fact> facts) {
		List<LocalDateTime> surgeries = anchorTimes(facts, FactType.PROCEDURE);
		List<LocalDateTime> admissions = anchorTimes(facts, FactType.ADMISSION);
		LocalDate earliestAdmission = admissions.isEmpty() ? null : admissions.get(0).toLocalDate();

		List<Fact> out = new ArrayList<>(facts.size());
		List<TemporalConflict> conflicts = new ArrayList<>();
		Map<String, Integer> byMethod = new TreeMap<>();
		int total = 0;
		int resolved = 0;

		for (Fact fact : facts) {
			if (fact.isAnchor() || fact.isResolved()) {
				out.add(fact);
				continue;
			}
			Optional<TemporalPatternType.Match> match = findReference(fact);
			if (match.isEmpty()) {
				out.add(fact);
				continue;
			}
			total++;
			TemporalPatternType.Match m = match.get();
			LocalDateTime ts = fact.getDocumentTimestamp();
			if (ts == null) {
				conflicts.add(new TemporalConflict(TemporalConflict.Kind.UNRESOLVED, fact,
						"Relative reference '" + m.getExpression() + "' has no document timestamp",
						UncertaintySeverity.MEDIUM));
				out.add(fact);
				continue;
			}

			LocalDateTime absolute;
			switch (m.getType()) {
			case POST_OPERATIVE_DAY: {
				LocalDateTime surgery = mostRecentAtOrBefore(surgeries, ts);
				if (surgery == null) {
					conflicts.add(new TemporalConflict(TemporalConflict.Kind.POD_WITHOUT_SURGERY, fact,
							"Post-operative day reference '" + m.getExpression() + "' without a preceding surgery",
							UncertaintySeverity.HIGH));
					out.add(fact);
					continue;
				}
				absolute = surgery.plusDays(m.getOffset());
				break;
			}
			case HOSPITAL_DAY: {
				LocalDateTime admission = mostRecentAtOrBefore(admissions, ts);
				if (admission == null) {
					conflicts.add(new TemporalConflict(TemporalConflict.Kind.HD_WITHOUT_ADMISSION, fact,
							"Hospital day reference '" + m.getExpression() + "' without a preceding admission",
							UncertaintySeverity.HIGH));
					out.add(fact);
					continue;
				}
				absolute = admission.plusDays(Math.max(0, m.getOffset() - 1L));
				break;
			}
			default:
				absolute = relativeToDocument(m, ts);
			}

			if (earliestAdmission != null && absolute.toLocalDate().isBefore(earliestAdmission)) {
				conflicts.add(new TemporalConflict(TemporalConflict.Kind.BEFORE_ADMISSION, fact,
						"Reference '" + m.getExpression() + "' resolves to " + absolute.toLocalDate()
								+ ", before admission on " + earliestAdmission,
						UncertaintySeverity.HIGH));
				out.add(fact);
				continue;
			}

			double c = fact.getConfidence();
			double boosted = Math.max(c, Math.min(MAX_RESOLVED_CONFIDENCE, c + CONFIDENCE_BOOST));
			out.add(fact.withResolvedTimestamp(absolute, m.getType().methodName(), boosted));
			byMethod.merge(m.getType().methodName(), 1, Integer::sum);
			resolved++;
		}

		ResolutionStats stats = new ResolutionStats(total, resolved, total - resolved, byMethod);
		Logger.info("Temporal references: {} found, {} resolved, {} conflicts", total, resolved, conflicts.size());
		return new TemporalResolution(out, conflicts, stats);
	}

	/** Date arithmetic for references that need no anchor. */
	static LocalDateTime relativeToDocument(TemporalPatternType.Match m, LocalDateTime ts) {
		switch (m.getType()) {
		case HOURS_AFTER:
			return ts.plusHours(m.getOffset());
		case DAYS_AFTER:
			return ts.plusDays(m.getOffset());
		case TWO_DAYS_AFTER:
			return ts.plusDays(2);
		case FOLLOWING_DAY:
			return ts.plusDays(1);
		case OVERNIGHT:
			return ts.toLocalDate().plusDays(1).atTime(MORNING);
		case THIS_MORNING:
			return ts.toLocalDate().atTime(MORNING);
		case LAST_NIGHT:
			return ts.toLocalDate().minusDays(1).atTime(NIGHT);
		case YESTERDAY:
			return ts.minusDays(1);
		case TONIGHT:
			return ts.toLocalDate().atTime(EVENING);
		case TODAY:
			return ts.toLocalDate().atStartOfDay();
		default:
			throw new IllegalArgumentException("Anchored reference type " + m.getType());
		}
	}

	private static Optional<TemporalPatternType.Match> findReference(Fact fact) {
		Optional<TemporalPatternType.Match> m = TemporalPatternType.firstMatch(fact.getText());
		if (m.isPresent())
			return m;
		return TemporalPatternType.firstMatch(fact.attribute(FactAttribute.CONTEXT));
	}

	private static List<LocalDateTime> anchorTimes(List<Fact> facts, FactType type) {
		List<LocalDateTime> out = new ArrayList<>();
		for (Fact f : facts) {
			if (f.isAnchor() && f.getType() == type && f.effectiveTimestamp() != null)
				out.add(f.effectiveTimestamp());
		}
		out.sort(Comparator.naturalOrder());
		return out;
	}

	/** Last element of a sorted list that is not after {@code ts}, or null. */
	static LocalDateTime mostRecentAtOrBefore(List<LocalDateTime> sorted, LocalDateTime ts) {
		LocalDateTime best = null;
		for (LocalDateTime a : sorted) {
			if (a.isAfter(ts))
				break;
			best = a;
		}
		return best;
	}
}
