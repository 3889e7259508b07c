package org.clintrace.core.om;

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
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

import lombok.Value;

/**
 * Chronological view over a fact set: facts grouped by calendar date, key
 * events, per-family progression and stay metadata.
 */
@Value
public class Timeline {

	SortedMap<LocalDate, List<Fact>> factsByDate;
	/** Facts with neither a resolved nor a document timestamp. */
	List<Fact> undatedFacts;
	List<KeyEvent> keyEvents;
	Map<String, Progression> progressions;
	List<Fact> complications;
	List<Fact> interventions;
	LocalDate admissionDate;
	LocalDate dischargeDate;
	long lengthOfStayDays;

	/** All dated facts in display order. */
	public List<Fact> allFacts() {
		List<Fact> out = new ArrayList<>();
		factsByDate.values().forEach(out::addAll);
		return out;
	}

	public Optional<Progression> progression(String family) {
		return Optional.ofNullable(progressions.get(family));
	}

	public TimelineSummary summary() {
		Map<FactType, Integer> counts = new EnumMap<>(FactType.class);
		for (Fact f : allFacts()) {
			counts.merge(f.getType(), 1, Integer::sum);
		}
		for (Fact f : undatedFacts) {
			counts.merge(f.getType(), 1, Integer::sum);
		}
		return new TimelineSummary(counts, factsByDate.size(), keyEvents.size(), admissionDate, dischargeDate,
				lengthOfStayDays);
	}
}
