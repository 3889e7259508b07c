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

import lombok.Builder;
import lombok.Value;

/**
 * Constants of the correction-learning loop.
 *
 * <p>Success-rate weighting: every application of a pattern receives exactly
 * one outcome report. A reviewer override feeds 0.0 into the exponential moving
 * average, a confirmation feeds 1.0:
 * {@code rate = (1 - emaAlpha) * rate + emaAlpha * outcome}. With the default
 * alpha of 0.2, three overrides among five applications always push a fresh
 * pattern below 0.70.</p>
 */
@Value
@Builder(toBuilder = true)
public class LearningSettings {

	public static final double DEFAULT_MATCH_THRESHOLD = 0.70;
	public static final double DEFAULT_SUCCESS_THRESHOLD = 0.70;
	public static final double DEFAULT_EMA_ALPHA = 0.20;
	public static final double DEFAULT_CONTEXT_BONUS = 0.10;

	@Builder.Default
	double matchThreshold = DEFAULT_MATCH_THRESHOLD;
	@Builder.Default
	double successThreshold = DEFAULT_SUCCESS_THRESHOLD;
	@Builder.Default
	double emaAlpha = DEFAULT_EMA_ALPHA;
	@Builder.Default
	double contextBonus = DEFAULT_CONTEXT_BONUS;

	public static LearningSettings defaults() {
		return LearningSettings.builder().build();
	}
}
