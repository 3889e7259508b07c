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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import org.apache.commons.lang3.StringUtils;
import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.ConceptKind;
import org.clintrace.core.om.LabSeverity;
import org.clintrace.core.om.TrendDirection;

/**
 * Immutable clinical reference tables with the small lookup and
 * interpretation functions the extractor, timeline builder and validator
 * share. Construct directly to swap tables in tests, or use
 * {@link #loadDefault()} for the bundled CSV tables.
 */
public final class ClinicalKnowledgeBase {

	/** Relative change under which a lab series counts as stable. */
	static final double LAB_STABLE_FRACTION = 0.10;

	private final Map<String, LabReference> labs;
	private final Map<String, String> labAliases;
	private final Map<String, MedicationInfo> medications;
	private final Set<String> highRiskTerms;
	private final Map<String, ScoreReference> scores;
	/** Alphanumeric-only alias key to canonical score name. */
	private final Map<String, String> scoreKeys;
	private final List<InteractionRule> interactions;

	public ClinicalKnowledgeBase(Collection<LabReference> labs, Map<String, String> labAliases,
			Collection<MedicationInfo> medications, Collection<String> highRiskTerms, Collection<ScoreReference> scores,
			Collection<InteractionRule> interactions) {
		Map<String, LabReference> l = new LinkedHashMap<>();
		for (LabReference r : labs) {
			l.put(key(r.getName()), r);
		}
		this.labs = Collections.unmodifiableMap(l);

		Map<String, String> a = new LinkedHashMap<>();
		if (labAliases != null) {
			labAliases.forEach((alias, canonical) -> a.put(key(alias), key(canonical)));
		}
		this.labAliases = Collections.unmodifiableMap(a);

		Map<String, MedicationInfo> m = new LinkedHashMap<>();
		for (MedicationInfo info : medications) {
			m.put(key(info.getName()), info);
		}
		this.medications = Collections.unmodifiableMap(m);

		Set<String> hr = new LinkedHashSet<>();
		if (highRiskTerms != null) {
			highRiskTerms.forEach(t -> hr.add(key(t)));
		}
		this.highRiskTerms = Collections.unmodifiableSet(hr);

		Map<String, ScoreReference> s = new LinkedHashMap<>();
		Map<String, String> sk = new LinkedHashMap<>();
		for (ScoreReference ref : scores) {
			String canonical = key(ref.getName());
			s.put(canonical, ref);
			sk.put(scoreKey(ref.getName()), canonical);
			if (ref.getAliases() != null) {
				ref.getAliases().forEach(alias -> sk.put(scoreKey(alias), canonical));
			}
		}
		this.scores = Collections.unmodifiableMap(s);
		this.scoreKeys = Collections.unmodifiableMap(sk);

		this.interactions = interactions == null ? List.of() : List.copyOf(interactions);
	}

	/** Tables bundled under {@code kb/} on the classpath. */
	public static ClinicalKnowledgeBase loadDefault() {
		return new KnowledgeBaseLoader().load();
	}

	// ---- labs -----------------------------------------------------------------

	/** Canonical lab name for a name or alias ("Na" to "sodium"), or null. */
	public String canonicalLabName(String name) {
		if (StringUtils.isBlank(name))
			return null;
		String k = key(name);
		if (labs.containsKey(k))
			return k;
		String aliased = labAliases.get(k);
		return aliased != null && labs.containsKey(aliased) ? aliased : null;
	}

	public Optional<LabReference> lab(String name) {
		String canonical = canonicalLabName(name);
		return canonical == null ? Optional.empty() : Optional.of(labs.get(canonical));
	}

	/** Lab names plus aliases, as they may appear in text. */
	public Set<String> labSurfaceForms() {
		Set<String> out = new LinkedHashSet<>(labs.keySet());
		out.addAll(labAliases.keySet());
		return out;
	}

	/**
	 * Severity of a lab value. Critical thresholds are inclusive: a value equal to
	 * the critical low or critical high is itself critical.
	 */
	public LabSeverity classifyLab(String name, double value) {
		Optional<LabReference> ref = lab(name);
		if (ref.isEmpty() || Double.isNaN(value))
			return LabSeverity.UNKNOWN;
		LabReference r = ref.get();
		if (value <= r.getCriticalLow() || value >= r.getCriticalHigh())
			return LabSeverity.CRITICAL;
		if (value < r.getNormalLow())
			return LabSeverity.LOW;
		if (value > r.getNormalHigh())
			return LabSeverity.HIGH;
		return LabSeverity.NORMAL;
	}

	/** Structured lab value; unknown analytes keep their raw name and UNKNOWN severity. */
	public ClinicalConcept normalizeLab(String name, double value) {
		Optional<LabReference> ref = lab(name);
		if (ref.isEmpty()) {
			return ClinicalConcept.builder().kind(ConceptKind.LAB).name(key(name)).value(value)
					.severity(LabSeverity.UNKNOWN).build();
		}
		LabReference r = ref.get();
		LabSeverity severity = classifyLab(name, value);
		String implication = null;
		if (severity.isAbnormal()) {
			implication = value < r.getNormalLow() ? r.getLowImplication() : r.getHighImplication();
		}
		return ClinicalConcept.builder().kind(ConceptKind.LAB).name(r.getName()).value(value).unit(r.getUnit())
				.normalLow(r.getNormalLow()).normalHigh(r.getNormalHigh()).severity(severity)
				.implication(implication).build();
	}

	// ---- medications ------------------------------------------------------------

	public Optional<MedicationInfo> medication(String name) {
		if (StringUtils.isBlank(name))
			return Optional.empty();
		return Optional.ofNullable(medications.get(key(name)));
	}

	public Set<String> medicationNames() {
		return medications.keySet();
	}

	public Set<String> highRiskTerms() {
		return highRiskTerms;
	}

	/** Tabulated high-risk drugs, plus any name containing a high-risk term. */
	public boolean isHighRiskMedication(String name) {
		if (StringUtils.isBlank(name))
			return false;
		Optional<MedicationInfo> info = medication(name);
		if (info.isPresent() && info.get().isHighRisk())
			return true;
		String k = key(name);
		return highRiskTerms.stream().anyMatch(k::contains);
	}

	/**
	 * Dose converted into the unit of the drug's maximum-dose entry, or null
	 * when the drug has no entry or the units are not convertible.
	 */
	public Double doseInReferenceUnit(String name, double dose, String unit) {
		Optional<MedicationInfo> info = medication(name);
		if (info.isEmpty() || info.get().getMaxSingleDose() == null)
			return null;
		return convertDose(dose, unit, info.get().getDoseUnit());
	}

	static Double convertDose(double value, String fromUnit, String toUnit) {
		String from = normalizeUnit(fromUnit);
		String to = normalizeUnit(toUnit);
		if (from == null || to == null)
			return null;
		if (from.equals(to))
			return value;
		Double fromMg = massFactor(from);
		Double toMg = massFactor(to);
		if (fromMg == null || toMg == null)
			return null;
		return value * fromMg / toMg;
	}

	private static String normalizeUnit(String unit) {
		if (StringUtils.isBlank(unit))
			return null;
		String u = unit.trim().toLowerCase(Locale.ROOT);
		switch (u) {
		case "u":
		case "unit":
		case "units":
			return "units";
		case "µg":
		case "ug":
		case "mcg":
			return "mcg";
		case "gm":
		case "g":
			return "g";
		default:
			return u;
		}
	}

	private static Double massFactor(String unit) {
		switch (unit) {
		case "g":
			return 1000.0;
		case "mg":
			return 1.0;
		case "mcg":
			return 0.001;
		default:
			return null;
		}
	}

	// ---- clinical scores ----------------------------------------------------------

	public Optional<ScoreReference> score(String name) {
		if (StringUtils.isBlank(name))
			return Optional.empty();
		String canonical = scoreKeys.get(scoreKey(name));
		return canonical == null ? Optional.empty() : Optional.of(scores.get(canonical));
	}

	/** Score names and aliases as they may appear in text. */
	public Set<String> scoreSurfaceForms() {
		Set<String> out = new LinkedHashSet<>();
		for (ScoreReference ref : scores.values()) {
			out.add(ref.getName());
			if (ref.getAliases() != null)
				out.addAll(ref.getAliases());
		}
		return out;
	}

	public boolean isValidScore(String name, double value) {
		return score(name).map(s -> s.isValid(value)).orElse(false);
	}

	public boolean isCriticalScore(String name, double value) {
		return score(name).map(s -> s.isCritical(value)).orElse(false);
	}

	// ---- progression ----------------------------------------------------------------

	/** Polarity of a measurement family, or null when the family is not trackable. */
	public Polarity polarityOf(String family) {
		Optional<ScoreReference> s = score(family);
		if (s.isPresent())
			return s.get().getPolarity();
		return lab(family).isPresent() ? Polarity.TOWARD_NORMAL : null;
	}

	/**
	 * Overall direction of a date-ordered series. Scores on wide scales tolerate a
	 * one-point wobble as stable. A lab leaving the normal range worsens and one
	 * returning to it improves, whatever the size of the change; otherwise labs
	 * within ten percent of their first value are stable, and the series improves
	 * when it ends closer to the normal range than it started.
	 */
	public TrendDirection interpretTrend(String family, List<Double> values) {
		if (values == null || values.size() < 2)
			return TrendDirection.STABLE;
		double first = values.get(0);
		double last = values.get(values.size() - 1);

		Optional<ScoreReference> s = score(family);
		if (s.isPresent()) {
			double band = (s.get().getMax() - s.get().getMin()) > 10 ? 1.0 : 0.0;
			double change = last - first;
			if (Math.abs(change) <= band)
				return TrendDirection.STABLE;
			boolean lowerBetter = s.get().getPolarity() == Polarity.LOWER_IS_BETTER;
			return (change < 0) == lowerBetter ? TrendDirection.IMPROVING : TrendDirection.WORSENING;
		}

		Optional<LabReference> l = lab(family);
		if (l.isPresent()) {
			double dFirst = l.get().distanceFromNormal(first);
			double dLast = l.get().distanceFromNormal(last);
			if (dFirst == 0.0 && dLast > 0.0)
				return TrendDirection.WORSENING;
			if (dFirst > 0.0 && dLast == 0.0)
				return TrendDirection.IMPROVING;
			double base = Math.abs(first);
			double fraction = base == 0.0 ? Math.abs(last) : Math.abs(last - first) / base;
			if (fraction < LAB_STABLE_FRACTION)
				return TrendDirection.STABLE;
			if (dLast < dFirst)
				return TrendDirection.IMPROVING;
			if (dLast > dFirst)
				return TrendDirection.WORSENING;
		}
		return TrendDirection.STABLE;
	}

	// ---- interactions ---------------------------------------------------------------

	/**
	 * Interaction rules that fire for the given medication names. Output order
	 * follows rule order; medication lists are sorted.
	 */
	public List<MedicationInteraction> findInteractions(Collection<String> medicationNames) {
		Set<String> present = new TreeSet<>();
		for (String n : medicationNames) {
			if (StringUtils.isNotBlank(n))
				present.add(key(n));
		}
		List<MedicationInteraction> out = new ArrayList<>();
		for (InteractionRule rule : interactions) {
			if (rule.isClassRule()) {
				List<String> members = new ArrayList<>();
				for (String med : present) {
					medication(med).filter(i -> rule.getDrugClass().equalsIgnoreCase(i.getDrugClass()))
							.ifPresent(i -> members.add(med));
				}
				boolean fires = ">1".equals(rule.getRight()) ? members.size() > 1 : !members.isEmpty();
				if (fires) {
					out.add(new MedicationInteraction(List.copyOf(members), rule.getSeverity(), rule.getDescription()));
				}
			} else if (present.contains(key(rule.getLeft())) && present.contains(key(rule.getRight()))) {
				List<String> pair = new ArrayList<>(List.of(key(rule.getLeft()), key(rule.getRight())));
				Collections.sort(pair);
				out.add(new MedicationInteraction(pair, rule.getSeverity(), rule.getDescription()));
			}
		}
		return out;
	}

	// ---- internals ------------------------------------------------------------------

	private static String key(String name) {
		return name == null ? "" : StringUtils.normalizeSpace(name).toLowerCase(Locale.ROOT);
	}

	private static String scoreKey(String name) {
		return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
	}
}
