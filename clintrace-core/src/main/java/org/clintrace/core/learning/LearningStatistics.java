package org.clintrace.core.learning;

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

import lombok.Value;

@Value
public class LearningStatistics {
	int totalPatterns;
	int pending;
	int approved;
	int rejected;
	/** Approved patterns still at or above the success threshold. */
	int active;
	/** Approved over all submitted patterns; 0 when there are none. */
	double approvalRate;
	long totalApplications;
	double averageSuccessRate;
}
