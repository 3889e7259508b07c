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
 * Provenance of a fact: matched by a pattern, or returned by the optional
 * fallback capability.
 */
public enum ExtractionSource {
	PATTERN("pattern"),
	LLM_FALLBACK("llm_fallback");

	private final String tag;

	ExtractionSource(String tag) {
		this.tag = tag;
	}

	public String getTag() {
		return tag;
	}

	public static ExtractionSource fromTag(String tag) {
		for (ExtractionSource s : values()) {
			if (s.tag.equalsIgnoreCase(tag) || s.name().equalsIgnoreCase(tag))
				return s;
		}
		throw new IllegalArgumentException("Unknown extraction source: " + tag);
	}
}
