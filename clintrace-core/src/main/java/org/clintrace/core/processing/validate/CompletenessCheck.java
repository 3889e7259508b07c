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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.FindingKind;
import org.clintrace.core.om.Uncertainty;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.om.ValidationStage;

/**
 * Required content of a complete record: a diagnosis, a procedure or a
 * documented non-operative decision, discharge medications, and a follow-up or
 * discharge instruction.
 */
class CompletenessCheck implements ValidationCheck {

	@Override
	public ValidationStage stage() {
		return ValidationStage.COMPLETENESS;
	}

	@Override
	public List<Uncertainty> check(ValidationContext ctx) {
		List<Uncertainty> out = new ArrayList<>();
		if (ctx.ofType(FactType.DIAGNOSIS).isEmpty()) {
			out.add(missing(UncertaintySeverity.HIGH, "No diagnosis documented", "Add the primary diagnosis"));
		}
		if (ctx.ofType(FactType.PROCEDURE).isEmpty() && ctx.findings(FindingKind.NON_OPERATIVE).isEmpty()) {
			out.add(missing(UncertaintySeverity.HIGH, "No procedure and no documented reason for non-operative care",
					"Document the procedure or the rationale for conservative management"));
		}
		if (dischargeMedications(ctx).isEmpty()) {
			out.add(missing(UncertaintySeverity.HIGH, "No discharge medications documented",
					"Add the discharge medication list"));
		}
		if (ctx.ofType(FactType.RECOMMENDATION).isEmpty()) {
			out.add(missing(UncertaintySeverity.MEDIUM, "No follow-up or discharge instructions documented",
					"Add follow-up appointments and discharge instructions"));
		}
		return out;
	}

	static List<Fact> dischargeMedications(ValidationContext ctx) {
		LocalDate discharge = ctx.getTimeline().getDischargeDate();
		List<Fact> out = new ArrayList<>();
		for (Fact f : ctx.ofType(FactType.MEDICATION)) {
			boolean fromSummary = f.getDocumentType() == DocumentType.DISCHARGE_SUMMARY;
			boolean fromDischargeDoc = f.getDocumentId() != null
					&& f.getDocumentId().toLowerCase(Locale.ROOT).contains("discharge");
			boolean onDischargeDay = discharge != null && discharge.equals(f.effectiveDate());
			if (fromSummary || fromDischargeDoc || onDischargeDay)
				out.add(f);
		}
		return out;
	}

	private Uncertainty missing(UncertaintySeverity severity, String description, String resolution) {
		return new Uncertainty(stage(), severity, IssueCodes.MISSING_INFORMATION, description, resolution, List.of());
	}
}
