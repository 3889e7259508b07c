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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Remembers which character ranges of which lines an earlier pattern already
 * claimed. Used so the first matching pattern wins a span.
 */
final class SpanTracker {

	private final Map<Integer, List<int[]>> claimed = new HashMap<>();

	/** Claims [start,end) on the line; false if it overlaps an earlier claim. */
	boolean claim(int line, int start, int end) {
		List<int[]> spans = claimed.computeIfAbsent(line, k -> new ArrayList<>());
		for (int[] s : spans) {
			if (start < s[1] && s[0] < end)
				return false;
		}
		spans.add(new int[] { start, end });
		return true;
	}
}
