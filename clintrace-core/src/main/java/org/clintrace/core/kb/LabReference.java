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

import lombok.Builder;
import lombok.Value;

/** Reference range and critical thresholds for one lab analyte. */
@Value
@Builder
public class LabReference {
	String name;
	String unit;
	double normalLow;
	double normalHigh;
	double criticalLow;
	double criticalHigh;
	String lowImplication;
	String highImplication;

	/** Distance from the normal range; zero inside it. */
	public double distanceFromNormal(double value) {
		if (value < normalLow)
			return normalLow - value;
		if (value > normalHigh)
			return value - normalHigh;
		return 0.0;
	}
}
