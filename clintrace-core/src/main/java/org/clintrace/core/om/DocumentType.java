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

public enum DocumentType {
	ADMISSION_NOTE,
	OPERATIVE_NOTE,
	PROGRESS_NOTE,
	CONSULT_NOTE,
	LAB_REPORT,
	NURSING_NOTE,
	IMAGING_REPORT,
	DISCHARGE_SUMMARY,
	UNKNOWN;

	/** Lenient parse: blank or unknown values map to {@link #UNKNOWN}. */
	public static DocumentType parse(String value) {
		if (value == null || value.isBlank())
			return UNKNOWN;
		String v = value.trim().toUpperCase().replace(' ', '_').replace('-', '_');
		for (DocumentType t : values()) {
			if (t.name().equals(v))
				return t;
		}
		return UNKNOWN;
	}

	/** Narrative documents are prose written by clinicians, not tabular output. */
	public boolean isNarrative() {
		return this != LAB_REPORT && this != UNKNOWN;
	}
}
