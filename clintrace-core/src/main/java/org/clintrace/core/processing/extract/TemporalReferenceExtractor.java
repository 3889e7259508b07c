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

import java.util.Arrays;
import java.util.stream.Collectors;
import java.util.regex.Matcher;

import org.clintrace.core.kb.TemporalPatternType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;

/**
 * Relative time expressions ("POD#2", "overnight", "6 hours later"). The fact
 * text is the expression itself; its line is kept as context.
 */
final class TemporalReferenceExtractor extends AbstractPatternExtractor {

	static final double CONFIDENCE = 0.80;

	private static final TemporalPatternType[] TYPES = TemporalPatternType.values();

	TemporalReferenceExtractor() {
		super(Arrays.stream(TYPES).map(TemporalPatternType::getPattern).collect(Collectors.toList()));
	}

	@Override
	public FactType type() {
		return FactType.TEMPORAL_REFERENCE;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		TemporalPatternType t = TYPES[patternIndex];
		return factAt(ctx, lineNo, line, m.group(), CONFIDENCE)
				.attributes(attrs(line, FactAttribute.TEMPORAL_TYPE, t.name(), FactAttribute.EXPRESSION, m.group()))
				.build();
	}
}
