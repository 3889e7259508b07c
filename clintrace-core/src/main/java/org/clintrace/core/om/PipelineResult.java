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

import java.util.List;

import lombok.Value;

/**
 * Output contract of a pipeline run: validated facts, the timeline, the
 * uncertainties for review and the run's metrics.
 */
@Value
public class PipelineResult {
	List<Fact> facts;
	Timeline timeline;
	List<Uncertainty> uncertainties;
	List<TemporalConflict> temporalConflicts;
	ProcessingMetrics metrics;

	public boolean hasBlockingUncertainties() {
		return uncertainties.stream().anyMatch(Uncertainty::isBlocking);
	}
}
