package org.clintrace.core.om;

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

/** Keys used in {@link Fact#getAttributes()}. */
public final class FactAttribute {

	public static final String CONTEXT = "context";
	public static final String DRUG_CLASS = "drug_class";
	public static final String DRUG_SUBCLASS = "drug_subclass";
	public static final String INDICATIONS = "indications";
	public static final String MONITORING = "monitoring";
	public static final String ROUTE = "route";
	public static final String FREQUENCY = "frequency";
	public static final String SPECIALTY = "specialty";
	public static final String EXPRESSION = "expression";
	public static final String TEMPORAL_TYPE = "temporal_type";
	public static final String FINDING = "finding";
	/** Measurement family a finding or measurement refers to ("nihss", "sodium"). */
	public static final String FAMILY = "family";
	public static final String REVISION = "revision";
	public static final String RECOMMENDATION_KIND = "recommendation_kind";

	private FactAttribute() {
	}
}
