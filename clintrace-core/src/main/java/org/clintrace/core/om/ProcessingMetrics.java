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

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;

/**
 * Counters and timings for one pipeline run.
 */
@Data
public class ProcessingMetrics {

	private int documentCount;
	/** Document id to failure reason, in document order. */
	private Map<String, String> failedDocuments;
	/** Stage name to wall-clock milliseconds, in execution order. */
	private Map<String, Long> stageTimingsMillis;
	private Map<FactType, Integer> factCountsByType;
	private int totalFacts;
	private int duplicatesCollapsed;
	private int patternsApplied;
	private int temporalReferencesResolved;
	private int temporalConflicts;
	private Map<UncertaintySeverity, Integer> uncertaintyCounts;
	private int cacheHits;
	private int cacheMisses;
	private boolean servedFromCache;

	public ProcessingMetrics() {
		failedDocuments = new LinkedHashMap<>();
		stageTimingsMillis = new LinkedHashMap<>();
		factCountsByType = new EnumMap<>(FactType.class);
		uncertaintyCounts = new EnumMap<>(UncertaintySeverity.class);
	}

	public void recordStage(String stage, long startNanos) {
		stageTimingsMillis.put(stage, (System.nanoTime() - startNanos) / 1_000_000L);
	}

	public int getFailedDocumentCount() {
		return failedDocuments.size();
	}
}
