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

import java.util.List;

import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;

/**
 * Extraction strategy for one entity type. Implementations hold no per-call
 * state and may be shared across extraction threads.
 */
public interface EntityExtractor {

	FactType type();

	List<Fact> extract(ExtractionContext ctx);

	/**
	 * Instruction for the fallback capability, or null when this type is never
	 * delegated.
	 */
	default String fallbackInstruction() {
		return null;
	}

	/**
	 * Whether the document plausibly mentions this type in prose, so that an empty
	 * pattern result is worth a fallback call.
	 */
	default boolean plausiblyPresent(ExtractionContext ctx) {
		return false;
	}
}
