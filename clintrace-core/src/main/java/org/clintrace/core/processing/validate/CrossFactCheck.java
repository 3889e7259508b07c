package org.clintrace.core.processing.validate;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.clintrace.core.kb.MedicationInteraction;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.Uncertainty;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.om.ValidationStage;

/**
 * Pairwise checks: the same measurement recorded with materially different
 * values within an hour, and co-present interacting medications.
 */
class CrossFactCheck implements ValidationCheck {

	static final Duration WINDOW = Duration.ofHours(1);
	/** Relative difference above which two lab or vital readings conflict. */
	static final double MATERIAL_FRACTION = 0.10;
	/** Absolute difference above which two scores conflict. */
	static final double MATERIAL_SCORE_POINTS = 1.0;

	@Override
	public ValidationStage stage() {
		return ValidationStage.CROSS_FACT;
	}

	@Override
	public List<Uncertainty> check(ValidationContext ctx) {
		List<Uncertainty> out = new ArrayList<>();
		conflictingValues(ctx.getFacts(), out);
		interactions(ctx, out);
		return out;
	}

	private void conflictingValues(List<Fact> facts, List<Uncertainty> out) {
		List<Fact> measured = new ArrayList<>();
		for (Fact f : facts) {
			if (f.numericValue() != null && f.effectiveTimestamp() != null && familyOf(f) != null
					&& f.getType() != FactType.MEDICATION)
				measured.add(f);
		}
		for (int i = 0; i < measured.size(); i++) {
			Fact a = measured.get(i);
			for (int j = i + 1; j < measured.size(); j++) {
				Fact b = measured.get(j);
				if (a.getType() != b.getType() || !familyOf(a).equals(familyOf(b)))
					continue;
				Duration apart = Duration.between(a.effectiveTimestamp(), b.effectiveTimestamp()).abs();
				if (apart.compareTo(WINDOW) > 0 || !materiallyDifferent(a, b))
					continue;
				out.add(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.CONFLICTING_INFORMATION,
						"Conflicting " + familyOf(a) + " values within " + apart.toMinutes() + " minutes: '" + a.getText()
								+ "' vs '" + b.getText() + "'",
						"Confirm which value is correct", List.of(a, b)));
			}
		}
	}

	static boolean materiallyDifferent(Fact a, Fact b) {
		double x = a.numericValue();
		double y = b.numericValue();
		if (a.getType() == FactType.CLINICAL_SCORE)
			return Math.abs(x - y) > MATERIAL_SCORE_POINTS;
		double scale = Math.max(Math.abs(x), Math.abs(y));
		return scale > 0 && Math.abs(x - y) / scale > MATERIAL_FRACTION;
	}

	private static String familyOf(Fact f) {
		String family = f.attribute(FactAttribute.FAMILY);
		if (family == null)
			family = f.conceptName();
		return family == null ? null : family.toLowerCase(Locale.ROOT);
	}

	private void interactions(ValidationContext ctx, List<Uncertainty> out) {
		List<Fact> medications = ctx.ofType(FactType.MEDICATION);
		List<String> names = new ArrayList<>();
		for (Fact f : medications) {
			if (f.conceptName() != null)
				names.add(f.conceptName());
		}
		for (MedicationInteraction mi : ctx.getKnowledgeBase().findInteractions(names)) {
			List<Fact> involved = new ArrayList<>();
			for (Fact f : medications) {
				if (f.conceptName() != null && mi.getMedications().contains(f.conceptName().toLowerCase(Locale.ROOT)))
					involved.add(f);
			}
			out.add(new Uncertainty(stage(), mi.getSeverity(), IssueCodes.MEDICATION_INTERACTION,
					mi.getDescription() + " [" + String.join(", ", mi.getMedications()) + "]",
					"Review the medication list with pharmacy", involved));
		}
	}
}
