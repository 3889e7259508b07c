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

import java.time.LocalDateTime;
import java.util.List;

import lombok.Value;

/**
 * Date-ordered course of one measurement family with its overall direction.
 */
@Value
public class Progression {

	@Value
	public static class Point {
		LocalDateTime timestamp;
		double value;
		Fact fact;
	}

	String family;
	List<Point> points;
	TrendDirection direction;

	public double getFirstValue() {
		return points.get(0).getValue();
	}

	public double getLastValue() {
		return points.get(points.size() - 1).getValue();
	}

	public double getChange() {
		return getLastValue() - getFirstValue();
	}
}
