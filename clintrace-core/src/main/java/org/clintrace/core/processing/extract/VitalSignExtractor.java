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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.ConceptKind;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;

final class VitalSignExtractor extends AbstractPatternExtractor {

	static final double CONFIDENCE = 0.90;

	private static final String[] FAMILIES = { "bp", "hr", "spo2", "temp", "rr", "icp" };
	private static final String[] UNITS = { "mmHg", "bpm", "%", null, "/min", "mmHg" };

	VitalSignExtractor() {
		super(List.of(
				Pattern.compile("\\b(?:BP|blood pressure)\\s*:?\\s*(\\d{2,3})\\s*/\\s*(\\d{2,3})", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:HR|heart rate|pulse)\\s*:?\\s*(\\d{2,3})\\b", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:SpO2|O2 sat(?:uration)?|oxygen saturation)\\s*:?\\s*(\\d{2,3})\\s*%?",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:Temp|Tmax|temperature)\\s*:?\\s*(\\d{2,3}(?:\\.\\d)?)\\s*°?\\s*([CF])?\\b",
						Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\b(?:RR|resp(?:iratory)? rate)\\s*:?\\s*(\\d{1,2})\\b", Pattern.CASE_INSENSITIVE),
				Pattern.compile("\\bICP\\s*:?\\s*(\\d{1,2})\\b", Pattern.CASE_INSENSITIVE)));
	}

	@Override
	public FactType type() {
		return FactType.VITAL_SIGN;
	}

	@Override
	protected Fact toFact(ExtractionContext ctx, int lineNo, String line, Matcher m, int patternIndex) {
		String family = FAMILIES[patternIndex];
		double value = Double.parseDouble(m.group(1));
		Double secondary = null;
		String unit = UNITS[patternIndex];
		if (patternIndex == 0) {
			secondary = Double.valueOf(m.group(2));
		} else if (patternIndex == 3) {
			unit = m.group(2) != null ? m.group(2).toUpperCase() : (value > 50 ? "F" : "C");
		}
		ClinicalConcept concept = ClinicalConcept.builder().kind(ConceptKind.VITAL).name(family).value(value)
				.secondaryValue(secondary).unit(unit).build();
		return factAt(ctx, lineNo, line, trimPunctuation(m.group()), CONFIDENCE).normalizedValue(concept)
				.attributes(attrs(line, FactAttribute.FAMILY, family)).build();
	}
}
