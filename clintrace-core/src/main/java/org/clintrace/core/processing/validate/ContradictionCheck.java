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
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.FindingKind;
import org.clintrace.core.om.LabSeverity;
import org.clintrace.core.om.Progression;
import org.clintrace.core.om.TrendDirection;
import org.clintrace.core.om.Uncertainty;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.om.ValidationStage;

/**
 * Narrative statements checked against structured facts and computed trends.
 * Each narrative statement yields at most one uncertainty per rule, listing the
 * statement first and the contradicting facts after it.
 */
class ContradictionCheck implements ValidationCheck {

	static final long DISCHARGE_WINDOW_HOURS = 48;

	@Override
	public ValidationStage stage() {
		return ValidationStage.CONTRADICTION;
	}

	@Override
	public List<Uncertainty> check(ValidationContext ctx) {
		List<Uncertainty> out = new ArrayList<>();
		noComplications(ctx, out);
		successfulProcedure(ctx, out);
		stableForDischarge(ctx, out);
		improving(ctx, out);
		return out;
	}

	// "No complications" vs a complication on the same or a later date.
	private void noComplications(ValidationContext ctx, List<Uncertainty> out) {
		List<Fact> complications = ctx.ofType(FactType.COMPLICATION);
		for (Fact statement : ctx.findings(FindingKind.NO_COMPLICATIONS)) {
			LocalDate from = statement.effectiveDate();
			List<Fact> involved = new ArrayList<>();
			involved.add(statement);
			for (Fact c : complications) {
				LocalDate d = c.effectiveDate();
				if (from == null || d == null || !d.isBefore(from))
					involved.add(c);
			}
			if (involved.size() > 1) {
				out.add(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.CONTRADICTORY_STATEMENTS,
						"'" + statement.getText() + "' contradicts documented complication(s): " + texts(involved),
						"Reconcile the complication status with the treating team", involved));
			}
		}
	}

	// "Successful procedure" vs a revision or reoperation.
	private void successfulProcedure(ValidationContext ctx, List<Uncertainty> out) {
		List<Fact> revisions = new ArrayList<>();
		for (Fact p : ctx.ofType(FactType.PROCEDURE)) {
			if ("true".equals(p.attribute(FactAttribute.REVISION)))
				revisions.add(p);
		}
		if (revisions.isEmpty())
			return;
		for (Fact statement : ctx.findings(FindingKind.PROCEDURE_SUCCESSFUL)) {
			List<Fact> involved = new ArrayList<>();
			involved.add(statement);
			involved.addAll(revisions);
			out.add(new Uncertainty(stage(), UncertaintySeverity.MEDIUM, IssueCodes.CONTRADICTORY_OUTCOMES,
					"'" + statement.getText() + "' while a revision was documented: " + texts(involved),
					"Clarify the procedure outcome", involved));
		}
	}

	// "Stable for discharge" vs a critical lab or score in the last 48 hours.
	private void stableForDischarge(ValidationContext ctx, List<Uncertainty> out) {
		List<Fact> statements = ctx.findings(FindingKind.STABLE_FOR_DISCHARGE);
		LocalDateTime end = ctx.latestTimestamp();
		if (statements.isEmpty() || end == null)
			return;
		LocalDateTime start = end.minusHours(DISCHARGE_WINDOW_HOURS);
		List<Fact> critical = new ArrayList<>();
		for (Fact f : ctx.getFacts()) {
			LocalDateTime ts = f.effectiveTimestamp();
			if (ts == null || ts.isBefore(start) || ts.isAfter(end))
				continue;
			if (isCritical(f, ctx))
				critical.add(f);
		}
		if (critical.isEmpty())
			return;
		for (Fact statement : statements) {
			List<Fact> involved = new ArrayList<>();
			involved.add(statement);
			involved.addAll(critical);
			out.add(new Uncertainty(stage(), UncertaintySeverity.HIGH, IssueCodes.DISCHARGE_STATUS_CONTRADICTION,
					"'" + statement.getText() + "' with critical values within 48 hours of discharge: "
							+ texts(involved),
					"Confirm discharge readiness with the attending", involved));
		}
	}

	private static boolean isCritical(Fact f, ValidationContext ctx) {
		ClinicalConcept c = f.getNormalizedValue();
		if (c == null || !c.hasValue())
			return false;
		if (f.getType() == FactType.LAB_VALUE)
			return ctx.getKnowledgeBase().classifyLab(c.getName(), c.getValue()) == LabSeverity.CRITICAL;
		if (f.getType() == FactType.CLINICAL_SCORE)
			return ctx.getKnowledgeBase().isCriticalScore(c.getName(), c.getValue());
		return false;
	}

	// "Improving" vs a worsening progression of the same family, or any family
	// when the statement names none.
	private void improving(ValidationContext ctx, List<Uncertainty> out) {
		for (Fact statement : ctx.findings(FindingKind.IMPROVING)) {
			String family = statement.attribute(FactAttribute.FAMILY);
			for (Progression p : ctx.getTimeline().getProgressions().values()) {
				if (p.getDirection() != TrendDirection.WORSENING)
					continue;
				if (family != null && !family.equals(p.getFamily()))
					continue;
				List<Fact> involved = new ArrayList<>();
				involved.add(statement);
				p.getPoints().forEach(pt -> involved.add(pt.getFact()));
				out.add(new Uncertainty(stage(), UncertaintySeverity.MEDIUM, IssueCodes.TREND_CONTRADICTION,
						"'" + statement.getText() + "' while " + p.getFamily() + " is worsening ("
								+ ClinicalRuleCheck.format(p.getFirstValue()) + " -> "
								+ ClinicalRuleCheck.format(p.getLastValue()) + ")",
						"Review the trend with the treating team", involved));
			}
		}
	}

	private static String texts(List<Fact> facts) {
		StringBuilder sb = new StringBuilder();
		for (int i = 1; i < facts.size(); i++) {
			if (sb.length() > 0)
				sb.append("; ");
			sb.append(facts.get(i).getText());
		}
		return sb.toString();
	}
}
