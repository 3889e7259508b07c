package org.clintrace.core.processing.timeline;

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
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.KeyEvent;
import org.clintrace.core.om.LabSeverity;
import org.clintrace.core.om.Progression;
import org.clintrace.core.om.Timeline;
import org.clintrace.core.om.TrendDirection;
import org.clintrace.core.util.Logger;

/**
 * Groups facts by effective date and derives key events, per-family
 * progression and stay metadata.
 */
public class TimelineBuilder {

	/** Display order within one day. */
	static final Comparator<Fact> WITHIN_DAY = Comparator
			.comparing(Fact::effectiveTimestamp, Comparator.nullsLast(Comparator.naturalOrder()))
			.thenComparing(Comparator.comparingDouble(Fact::getConfidence).reversed())
			.thenComparing(Fact::getDocumentId, Comparator.nullsLast(Comparator.naturalOrder()))
			.thenComparingInt(Fact::getLine)
			.thenComparing(Fact::getText);

	private final ClinicalKnowledgeBase knowledgeBase;

	public TimelineBuilder(ClinicalKnowledgeBase knowledgeBase) {
		this.knowledgeBase = knowledgeBase;
	}

	public Timeline build(List<Fact> facts) {
		return build(facts, Collections.emptyList());
	}

	/**
	 * @param documents source documents; their timestamps bound the stay when no
	 *                  fact carries a date
	 */
	public Timeline build(List<Fact> facts, Collection<ClinicalDocument> documents) {
		SortedMap<LocalDate, List<Fact>> byDate = new TreeMap<>();
		List<Fact> undated = new ArrayList<>();
		for (Fact f : facts) {
			LocalDate d = f.effectiveDate();
			if (d == null) {
				undated.add(f);
			} else {
				byDate.computeIfAbsent(d, k -> new ArrayList<>()).add(f);
			}
		}
		SortedMap<LocalDate, List<Fact>> grouped = new TreeMap<>();
		for (Map.Entry<LocalDate, List<Fact>> e : byDate.entrySet()) {
			List<Fact> day = e.getValue();
			day.sort(WITHIN_DAY);
			grouped.put(e.getKey(), Collections.unmodifiableList(day));
		}
		List<Fact> ordered = new ArrayList<>();
		grouped.values().forEach(ordered::addAll);

		LocalDate admission = admissionDate(ordered, grouped, documents);
		LocalDate discharge = dischargeDate(grouped, documents);
		long los = admission == null || discharge == null ? 0
				: Math.max(0, ChronoUnit.DAYS.between(admission, discharge)) + 1;

		List<Fact> complications = new ArrayList<>();
		List<Fact> interventions = new ArrayList<>();
		for (Fact f : ordered) {
			if (f.getType() == FactType.COMPLICATION)
				complications.add(f);
			else if (f.getType() == FactType.PROCEDURE || f.getType() == FactType.MEDICATION)
				interventions.add(f);
		}

		Timeline timeline = new Timeline(Collections.unmodifiableSortedMap(grouped), List.copyOf(undated),
				keyEvents(ordered), progressions(ordered), complications, interventions, admission, discharge, los);
		Logger.info("Timeline: {} days, {} key events, {} progressions, stay {} days", grouped.size(),
				timeline.getKeyEvents().size(), timeline.getProgressions().size(), los);
		return timeline;
	}

	// ---- key events ------------------------------------------------------------

	List<KeyEvent> keyEvents(List<Fact> ordered) {
		List<KeyEvent> events = new ArrayList<>();
		for (Fact f : ordered) {
			KeyEvent.Kind kind = keyEventKind(f);
			if (kind != null)
				events.add(new KeyEvent(f.effectiveTimestamp(), kind, f));
		}
		events.sort(Comparator.comparing(KeyEvent::getTimestamp).thenComparing(KeyEvent::getKind));
		return events;
	}

	private static KeyEvent.Kind keyEventKind(Fact f) {
		switch (f.getType()) {
		case ADMISSION:
			return KeyEvent.Kind.ADMISSION;
		case PROCEDURE:
			return f.isSurgical() ? KeyEvent.Kind.SURGERY : null;
		case COMPLICATION:
			return KeyEvent.Kind.COMPLICATION;
		case LAB_VALUE:
			return f.getNormalizedValue() != null && f.getNormalizedValue().getSeverity() == LabSeverity.CRITICAL
					? KeyEvent.Kind.CRITICAL_LAB
					: null;
		default:
			return null;
		}
	}

	// ---- progression -------------------------------------------------------------

	/**
	 * One progression per measurement family with at least two values. Only
	 * families with a polarity in the knowledge base are tracked; invalid score
	 * values are left out of the series.
	 */
	Map<String, Progression> progressions(List<Fact> ordered) {
		Map<String, List<Progression.Point>> series = new TreeMap<>();
		for (Fact f : ordered) {
			if (f.getType() != FactType.CLINICAL_SCORE && f.getType() != FactType.LAB_VALUE)
				continue;
			String family = f.attribute(FactAttribute.FAMILY);
			Double value = f.numericValue();
			if (family == null || value == null || knowledgeBase.polarityOf(family) == null)
				continue;
			if (f.getType() == FactType.CLINICAL_SCORE && !knowledgeBase.isValidScore(family, value))
				continue;
			series.computeIfAbsent(family, k -> new ArrayList<>())
					.add(new Progression.Point(f.effectiveTimestamp(), value, f));
		}

		Map<String, Progression> out = new TreeMap<>();
		for (Map.Entry<String, List<Progression.Point>> e : series.entrySet()) {
			List<Progression.Point> points = e.getValue();
			if (points.size() < 2)
				continue;
			List<Double> values = new ArrayList<>(points.size());
			points.forEach(p -> values.add(p.getValue()));
			TrendDirection direction = knowledgeBase.interpretTrend(e.getKey(), values);
			out.put(e.getKey(), new Progression(e.getKey(), List.copyOf(points), direction));
		}
		return Collections.unmodifiableMap(out);
	}

	// ---- stay metadata -------------------------------------------------------------

	private static LocalDate admissionDate(List<Fact> ordered, SortedMap<LocalDate, List<Fact>> grouped,
			Collection<ClinicalDocument> documents) {
		for (Fact f : ordered) {
			if (f.getType() == FactType.ADMISSION)
				return f.effectiveDate();
		}
		if (!grouped.isEmpty())
			return grouped.firstKey();
		return documents.stream().map(ClinicalDocument::getTimestamp).filter(t -> t != null)
				.min(Comparator.naturalOrder()).map(LocalDateTime::toLocalDate).orElse(null);
	}

	private static LocalDate dischargeDate(SortedMap<LocalDate, List<Fact>> grouped,
			Collection<ClinicalDocument> documents) {
		if (!grouped.isEmpty())
			return grouped.lastKey();
		return documents.stream().map(ClinicalDocument::getTimestamp).filter(t -> t != null)
				.max(Comparator.naturalOrder()).map(LocalDateTime::toLocalDate).orElse(null);
	}
}
