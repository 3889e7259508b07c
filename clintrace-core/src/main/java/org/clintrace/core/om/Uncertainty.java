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

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.clintrace.core.util.ContentHash;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * An issue flagged by the validator for human review. Everything but the
 * resolution state is fixed at creation; equality follows the content-derived
 * id, so resolving does not change it.
 */
@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public final class Uncertainty {

	@EqualsAndHashCode.Include
	private final String id;
	private final UncertaintySeverity severity;
	private final ValidationStage stage;
	/** Machine-readable issue code, e.g. CRITICAL_LAB_VALUE. */
	private final String issueCode;
	private final String description;
	private final String suggestedResolution;
	private final List<Fact> facts;

	private boolean resolved;
	private String resolution;
	private String resolvedBy;

	public Uncertainty(ValidationStage stage, UncertaintySeverity severity, String issueCode, String description,
			String suggestedResolution, List<Fact> facts) {
		this.stage = stage;
		this.severity = severity;
		this.issueCode = issueCode;
		this.description = description;
		this.suggestedResolution = suggestedResolution;
		this.facts = facts == null ? Collections.emptyList() : List.copyOf(facts);
		this.id = ContentHash.shortHash(16, stage, issueCode, description, getFactIds());
	}

	public List<String> getFactIds() {
		return facts.stream().map(Fact::getId).collect(Collectors.toList());
	}

	/**
	 * Marks this uncertainty as resolved by a reviewer.
	 *
	 * @throws IllegalStateException if already resolved
	 */
	public synchronized void resolve(String resolutionText, String reviewer) {
		if (resolved) {
			throw new IllegalStateException("Uncertainty " + id + " is already resolved");
		}
		this.resolved = true;
		this.resolution = resolutionText;
		this.resolvedBy = reviewer;
	}

	public boolean isBlocking() {
		return !resolved && severity == UncertaintySeverity.HIGH;
	}
}
