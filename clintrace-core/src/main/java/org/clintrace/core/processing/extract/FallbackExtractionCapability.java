package org.clintrace.core.processing.extract;

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
 * Optional external capability consulted when pattern extraction finds nothing
 * for an entity type in a narrative document. Implementations return the
 * extracted text, or {@link #NONE} when nothing was found.
 */
@FunctionalInterface
public interface FallbackExtractionCapability {

	/** Sentinel meaning "nothing found". Compared case-insensitively. */
	String NONE = "NONE";

	/**
	 * @param instruction entity-type specific instruction
	 * @param documentText cleaned document text
	 * @return extracted text, {@link #NONE}, or null
	 */
	String extract(String instruction, String documentText);

	static boolean isNone(String response) {
		return response == null || response.isBlank() || NONE.equalsIgnoreCase(response.trim());
	}
}
