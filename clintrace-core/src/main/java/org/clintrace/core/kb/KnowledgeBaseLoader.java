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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;
import org.clintrace.core.om.UncertaintySeverity;
import org.clintrace.core.util.Logger;

/**
 * Reads the knowledge-base tables from CSV. Each table is looked up on the
 * classpath first and then under {@code src/main/resources} (dev/test mode).
 * A missing or unreadable table is a deployment error and fails the load.
 */
public class KnowledgeBaseLoader {

	public static final String LABS = "kb/labs.csv";
	public static final String LAB_ALIASES = "kb/lab_aliases.csv";
	public static final String MEDICATIONS = "kb/medications.csv";
	public static final String HIGH_RISK_TERMS = "kb/high_risk_terms.csv";
	public static final String SCORES = "kb/scores.csv";
	public static final String INTERACTIONS = "kb/interactions.csv";

	private static final String FS_ROOT = "src/main/resources/";

	static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
			.setIgnoreHeaderCase(true).setTrim(true).setIgnoreEmptyLines(true).setCommentMarker('#').build();

	public ClinicalKnowledgeBase load() {
		List<LabReference> labs = readTable(LABS, this::toLab);
		Map<String, String> aliases = new LinkedHashMap<>();
		for (String[] pair : readTable(LAB_ALIASES, r -> new String[] { r.get("alias"), r.get("lab") })) {
			aliases.put(pair[0], pair[1]);
		}
		List<MedicationInfo> meds = readTable(MEDICATIONS, this::toMedication);
		List<String> highRisk = readTable(HIGH_RISK_TERMS, r -> r.get("term"));
		List<ScoreReference> scores = readTable(SCORES, this::toScore);
		List<InteractionRule> interactions = readTable(INTERACTIONS, this::toInteraction);

		Logger.info("Knowledge base loaded: labs={}, aliases={}, medications={}, scores={}, interaction rules={}",
				labs.size(), aliases.size(), meds.size(), scores.size(), interactions.size());
		return new ClinicalKnowledgeBase(labs, aliases, meds, highRisk, scores, interactions);
	}

	// ---- row mappers ------------------------------------------------------------

	private LabReference toLab(CSVRecord r) {
		return LabReference.builder().name(r.get("name")).unit(r.get("unit"))
				.normalLow(Double.parseDouble(r.get("normal_low"))).normalHigh(Double.parseDouble(r.get("normal_high")))
				.criticalLow(Double.parseDouble(r.get("critical_low")))
				.criticalHigh(Double.parseDouble(r.get("critical_high"))).lowImplication(r.get("low_implication"))
				.highImplication(r.get("high_implication")).build();
	}

	private MedicationInfo toMedication(CSVRecord r) {
		String maxDose = r.get("max_single_dose");
		return MedicationInfo.builder().name(r.get("name")).drugClass(r.get("class")).subclass(r.get("subclass"))
				.indications(splitList(r.get("indications"))).contraindications(splitList(r.get("contraindications")))
				.monitoring(splitList(r.get("monitoring"))).highRisk(Boolean.parseBoolean(r.get("high_risk")))
				.maxSingleDose(StringUtils.isBlank(maxDose) ? null : Double.valueOf(maxDose))
				.doseUnit(StringUtils.trimToNull(r.get("dose_unit"))).build();
	}

	private ScoreReference toScore(CSVRecord r) {
		return ScoreReference.builder().name(r.get("name")).aliases(splitList(r.get("aliases")))
				.min(Integer.parseInt(r.get("min"))).max(Integer.parseInt(r.get("max")))
				.polarity(Polarity.valueOf(r.get("polarity")))
				.criticalAtOrBelow(optionalDouble(r.get("critical_at_or_below")))
				.criticalAtOrAbove(optionalDouble(r.get("critical_at_or_above"))).description(r.get("description"))
				.build();
	}

	private InteractionRule toInteraction(CSVRecord r) {
		return new InteractionRule(r.get("left"), r.get("right"), UncertaintySeverity.valueOf(r.get("severity")),
				r.get("description"));
	}

	// ---- helpers ----------------------------------------------------------------

	<T> List<T> readTable(String resource, Function<CSVRecord, T> mapper) {
		List<T> out = new ArrayList<>();
		try (Reader reader = open(resource); CSVParser parser = CSVParser.parse(reader, FORMAT)) {
			for (CSVRecord record : parser) {
				try {
					out.add(mapper.apply(record));
				} catch (RuntimeException e) {
					throw new IllegalStateException(
							"Bad row " + record.getRecordNumber() + " in " + resource + ": " + e.getMessage(), e);
				}
			}
		} catch (IOException e) {
			throw new IllegalStateException("Unable to read knowledge base table " + resource, e);
		}
		return out;
	}

	private Reader open(String resource) throws IOException {
		InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
		if (in == null) {
			in = KnowledgeBaseLoader.class.getClassLoader().getResourceAsStream(resource);
		}
		if (in != null) {
			return new InputStreamReader(in, StandardCharsets.UTF_8);
		}
		Path fs = Path.of(FS_ROOT + resource);
		if (Files.isReadable(fs)) {
			Logger.debug("Knowledge base: {} not on classpath, reading {}", resource, fs);
			return Files.newBufferedReader(fs, StandardCharsets.UTF_8);
		}
		throw new IOException("Resource not found on classpath or filesystem: " + resource);
	}

	private static List<String> splitList(String raw) {
		if (StringUtils.isBlank(raw))
			return List.of();
		return Arrays.stream(raw.split("\\|")).map(String::trim).filter(StringUtils::isNotEmpty)
				.collect(Collectors.toUnmodifiableList());
	}

	private static Double optionalDouble(String raw) {
		return StringUtils.isBlank(raw) ? null : Double.valueOf(raw.trim());
	}
}
