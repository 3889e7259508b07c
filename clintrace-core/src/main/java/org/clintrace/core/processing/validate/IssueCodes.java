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

/** Machine-readable codes carried by {@link org.clintrace.core.om.Uncertainty}. */
public final class IssueCodes {

	public static final String FORMAT_ERROR = "FORMAT_ERROR";

	public static final String CRITICAL_LAB_VALUE = "CRITICAL_LAB_VALUE";
	public static final String INVALID_SCORE_RANGE = "INVALID_SCORE_RANGE";
	public static final String CRITICAL_SCORE_VALUE = "CRITICAL_SCORE_VALUE";
	public static final String EXCESSIVE_MEDICATION_DOSE = "EXCESSIVE_MEDICATION_DOSE";

	public static final String TEMPORAL_INCONSISTENCY = "TEMPORAL_INCONSISTENCY";
	public static final String MISSING_TEMPORAL_ANCHOR = "MISSING_TEMPORAL_ANCHOR";
	public static final String UNRESOLVED_TEMPORAL_REFERENCE = "UNRESOLVED_TEMPORAL_REFERENCE";
	public static final String DOCUMENTATION_GAP = "DOCUMENTATION_GAP";

	public static final String CONFLICTING_INFORMATION = "CONFLICTING_INFORMATION";
	public static final String MEDICATION_INTERACTION = "MEDICATION_INTERACTION";

	public static final String CONTRADICTORY_STATEMENTS = "CONTRADICTORY_STATEMENTS";
	public static final String CONTRADICTORY_OUTCOMES = "CONTRADICTORY_OUTCOMES";
	public static final String DISCHARGE_STATUS_CONTRADICTION = "DISCHARGE_STATUS_CONTRADICTION";
	public static final String TREND_CONTRADICTION = "TREND_CONTRADICTION";

	public static final String MISSING_INFORMATION = "MISSING_INFORMATION";

	private IssueCodes() {
	}
}
