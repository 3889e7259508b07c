package org.clintrace.core.processing.validate;

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

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.FindingKind;
import org.clintrace.core.om.TemporalConflict;
import org.clintrace.core.om.Timeline;

/**
 * Everything a validation stage may read. Stages never modify it.
 */
public final class ValidationContext {

	private final List<Fact> facts;
	private final Timeline timeline;
	private final List<TemporalConflict> conflicts;
	private final ClinicalKnowledgeBase knowledgeBase;

	ValidationContext(List<Fact> facts, Timeline timeline, List<TemporalConflict> conflicts,
			ClinicalKnowledgeBase knowledgeBase) {
		this.facts = facts;
		this.timeline = timeline;
		this.conflicts = conflicts;
		this.knowledgeBase = knowledgeBase;
	}

	public List<Fact> getFacts() {
		return facts;
	}

	public Timeline getTimeline() {
		return timeline;
	}

	public List<TemporalConflict> getConflicts() {
		return conflicts;
	}

	public ClinicalKnowledgeBase getKnowledgeBase() {
		return knowledgeBase;
	}

	public List<Fact> ofType(FactType type) {
		return facts.stream().filter(f -> f.getType() == type).collect(Collectors.toList());
	}

	public List<Fact> findings(FindingKind kind) {
		return facts.stream().filter(f -> f.getType() == FactType.FINDING && f.finding() == kind)
				.collect(Collectors.toList());
	}

	/** Latest effective timestamp over all facts, or null. */
	public LocalDateTime latestTimestamp() {
		return facts.stream().map(Fact::effectiveTimestamp).filter(Objects::nonNull).max(LocalDateTime::compareTo)
				.orElse(null);
	}
}
