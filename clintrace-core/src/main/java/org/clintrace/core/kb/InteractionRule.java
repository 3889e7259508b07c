package org.clintrace.core.kb;

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

import org.clintrace.core.om.UncertaintySeverity;

import lombok.Value;

/**
 * Either a named drug pair or a class rule. Class rules use {@code class:Name}
 * on the left; with {@code *} on the right they fire on any member of the
 * class, with {@code >1} they fire when two or more distinct members are
 * present.
 */
@Value
public class InteractionRule {
	String left;
	String right;
	UncertaintySeverity severity;
	String description;

	public boolean isClassRule() {
		return left.startsWith("class:");
	}

	public String getDrugClass() {
		return isClassRule() ? left.substring("class:".length()) : null;
	}
}
