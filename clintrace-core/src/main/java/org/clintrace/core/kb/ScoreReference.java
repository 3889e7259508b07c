package org.clintrace.core.kb;

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

import lombok.Builder;
import lombok.Value;

/**
 * Valid range, polarity and critical thresholds of a clinical score. A score is
 * critical when it is at or below {@code criticalAtOrBelow} or at or above
 * {@code criticalAtOrAbove}.
 */
@Value
@Builder
public class ScoreReference {
	String name;
	List<String> aliases;
	int min;
	int max;
	Polarity polarity;
	Double criticalAtOrBelow;
	Double criticalAtOrAbove;
	String description;

	public boolean isValid(double value) {
		return value >= min && value <= max && value == Math.rint(value);
	}

	public boolean isCritical(double value) {
		if (!isValid(value))
			return false;
		return (criticalAtOrBelow != null && value <= criticalAtOrBelow)
				|| (criticalAtOrAbove != null && value >= criticalAtOrAbove);
	}
}
