package org.clintrace.core.processing;

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

import org.clintrace.core.om.Fact;

import lombok.Value;

/**
 * Result of extracting one document: its facts, or the reason it failed.
 */
@Value
public class ExtractionOutcome {
	String documentId;
	List<Fact> facts;
	/** Null on success. */
	String failureReason;

	public static ExtractionOutcome success(String documentId, List<Fact> facts) {
		return new ExtractionOutcome(documentId, List.copyOf(facts), null);
	}

	public static ExtractionOutcome failure(String documentId, String reason) {
		return new ExtractionOutcome(documentId, List.of(), reason == null ? "unknown error" : reason);
	}

	public boolean isSuccess() {
		return failureReason == null;
	}
}
