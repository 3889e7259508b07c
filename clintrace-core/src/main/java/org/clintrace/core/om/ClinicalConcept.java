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

import lombok.Builder;
import lombok.Value;

/**
 * Structured value behind a fact, e.g. a lab result normalized to a number plus
 * a severity, or a medication with its dose.
 */
@Value
@Builder(toBuilder = true)
public class ClinicalConcept {
	ConceptKind kind;
	/** Canonical lower-case name ("sodium", "nimodipine", "gcs"). */
	String name;
	Double value;
	/** Diastolic pressure for blood pressure readings. */
	Double secondaryValue;
	String unit;
	Double normalLow;
	Double normalHigh;
	LabSeverity severity;
	String implication;

	public boolean hasValue() {
		return value != null && !value.isNaN();
	}
}
