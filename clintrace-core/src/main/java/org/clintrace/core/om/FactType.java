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

import java.util.Locale;

/**
 * Type tag of an extracted {@link Fact}.
 */
public enum FactType {
	MEDICATION("medication"),
	LAB_VALUE("lab_value"),
	CLINICAL_SCORE("clinical_score"),
	VITAL_SIGN("vital_sign"),
	PROCEDURE("procedure"),
	CONSULTATION("consultation"),
	COMPLICATION("complication"),
	TEMPORAL_REFERENCE("temporal_reference"),
	DIAGNOSIS("diagnosis"),
	/** Admission anchor for hospital-day arithmetic. */
	ADMISSION("admission"),
	/** Narrative assertion ("No complications noted", "stable for discharge"). */
	FINDING("finding"),
	/** Follow-up appointments and discharge instructions. */
	RECOMMENDATION("recommendation");

	private final String label;

	FactType(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	/**
	 * Accepts the label ("lab_value") or the constant name ("LAB_VALUE").
	 *
	 * @throws IllegalArgumentException for unknown values
	 */
	public static FactType fromLabel(String value) {
		if (value == null)
			throw new IllegalArgumentException("Fact type is null");
		String v = value.trim();
		for (FactType t : values()) {
			if (t.label.equalsIgnoreCase(v) || t.name().equalsIgnoreCase(v))
				return t;
		}
		throw new IllegalArgumentException("Unknown fact type: " + value);
	}

	@Override
	public String toString() {
		return label.toUpperCase(Locale.ROOT);
	}
}
