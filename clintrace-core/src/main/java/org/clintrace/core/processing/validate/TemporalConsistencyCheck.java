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

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.clintrace.core.om.Fact;
import org.clintrace.core.om.TemporalConflict;
import org.clintrace.core.om.Timeline;
import org.clintrace.core.om.Uncertainty;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.om.ValidationStage;

/**
 * Stay ordering, facts dated before admission, documentation gaps and the
 * conflicts reported by temporal resolution.
 */
class TemporalConsistencyCheck implements ValidationCheck {

	/** Consecutive documented days further apart than this are a gap. */
	static final long MAX_GAP_DAYS = 3;

	@Override
	public ValidationStage stage() {
		return ValidationStage.TEMPORAL;
	}

	@Override
	public List<Uncertainty> check(ValidationContext ctx) {
		List<Uncertainty> out = new ArrayList<>();
		Timeline t = ctx.getTimeline();

		if (t.getAdmissionDate() != null && t.getDischargeDate() != null
				&& t.getDischargeDate().isBefore(t.getAdmissionDate())) {
			out.add(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.TEMPORAL_INCONSISTENCY,
					"Discharge date " + t.getDischargeDate() + " precedes admission date " + t.getAdmissionDate(),
					"Correct the admission or discharge date", List.of()));
		}

		Set<String> conflicted = new HashSet<>();
		for (TemporalConflict c : ctx.getConflicts()) {
			conflicted.add(c.getFact().getId());
			out.add(new Uncertainty(stage(), c.getSeverity(), codeOf(c.getKind()), c.getDescription(),
					resolutionOf(c.getKind()), List.of(c.getFact())));
		}

		if (t.getAdmissionDate() != null) {
			for (Map.Entry<LocalDate, List<Fact>> day : t.getFactsByDate().headMap(t.getAdmissionDate()).entrySet()) {
				for (Fact f : day.getValue()) {
					if (conflicted.contains(f.getId()))
						continue;
					out.add(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.TEMPORAL_INCONSISTENCY,
							"Fact dated " + day.getKey() + " precedes admission on " + t.getAdmissionDate() + ": "
									+ f.getText(),
							"Check the document date or mark the fact as history", List.of(f)));
				}
			}
		}

		LocalDate previous = null;
		for (Map.Entry<LocalDate, List<Fact>> day : t.getFactsByDate().entrySet()) {
			if (previous != null) {
				long gap = ChronoUnit.DAYS.between(previous, day.getKey());
				if (gap > MAX_GAP_DAYS) {
					List<Fact> before = t.getFactsByDate().get(previous);
					out.add(new Uncertainty(stage(), UncertaintySeverity.MEDIUM, IssueCodes.DOCUMENTATION_GAP,
							"No documentation for " + gap + " days between " + previous + " and " + day.getKey(),
							"Locate the missing notes",
							List.of(before.get(before.size() - 1), day.getValue().get(0))));
				}
			}
			previous = day.getKey();
		}
		return out;
	}

	private static String codeOf(TemporalConflict.Kind kind) {
		switch (kind) {
		case POD_WITHOUT_SURGERY:
		case HD_WITHOUT_ADMISSION:
			return IssueCodes.MISSING_TEMPORAL_ANCHOR;
		case UNRESOLVED:
			return IssueCodes.UNRESOLVED_TEMPORAL_REFERENCE;
		default:
			return IssueCodes.TEMPORAL_INCONSISTENCY;
		}
	}

	private static String resolutionOf(TemporalConflict.Kind kind) {
		switch (kind) {
		case POD_WITHOUT_SURGERY:
			return "Add the operative note or the surgery date";
		case HD_WITHOUT_ADMISSION:
			return "Add the admission note or the admission date";
		case BEFORE_ADMISSION:
			return "Check the anchor event and the relative reference";
		default:
			return "Supply the document date";
		}
	}
}
