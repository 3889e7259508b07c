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

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.Uncertainty;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.om.ValidationStage;

/**
 * Required fields and parseable values. Text and confidence are enforced when
 * the fact is built, so this stage looks at provenance and typed values.
 */
class FormatCheck implements ValidationCheck {

	@Override
	public ValidationStage stage() {
		return ValidationStage.FORMAT;
	}

	@Override
	public List<Uncertainty> check(ValidationContext ctx) {
		List<Uncertainty> out = new ArrayList<>();
		for (Fact f : ctx.getFacts()) {
			if (f.getType() == null) {
				out.add(issue(UncertaintySeverity.HIGH, "Fact has no type: " + f.getText(),
						"Assign a fact type or discard the fact", f));
				continue;
			}
			if (StringUtils.isBlank(f.getDocumentId())) {
				out.add(issue(UncertaintySeverity.MEDIUM, "Fact has no source document: " + f.getText(),
						"Trace the fact back to its source document", f));
			}
			if (f.effectiveTimestamp() == null) {
				out.add(issue(UncertaintySeverity.MEDIUM, "Fact has no timestamp: " + f.getText(),
						"Supply the document date", f));
			}
			if (f.getType() == FactType.LAB_VALUE && f.numericValue() == null) {
				out.add(issue(UncertaintySeverity.LOW, "Lab value could not be parsed: " + f.getText(),
						"Enter the numeric result", f));
			}
		}
		return out;
	}

	private Uncertainty issue(UncertaintySeverity severity, String description, String resolution, Fact f) {
		return new Uncertainty(stage(), severity, IssueCodes.FORMAT_ERROR, description, resolution, List.of(f));
	}
}
