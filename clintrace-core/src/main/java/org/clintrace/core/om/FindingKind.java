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

/**
 * Narrative assertions the contradiction and completeness checks look for.
 */
public enum FindingKind {
	NO_COMPLICATIONS,
	PROCEDURE_SUCCESSFUL,
	STABLE_FOR_DISCHARGE,
	IMPROVING,
	/** "conservative management", "not a surgical candidate". */
	NON_OPERATIVE
}
