package org.clintrace.core.processing.persist;

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
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.clintrace.core.om.ClinicalConcept;
import org.clintrace.core.om.ConceptKind;
import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.ExtractionSource;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LabSeverity;
import org.clintrace.core.util.Logger;

import static org.clintrace.core.processing.persist.CsvSupport.*;

/**
 * Reads and writes facts as CSV, one row per fact with every provenance field,
 * the normalized concept and the attribute map. Reading a written file yields
 * facts equal to the ones written.
 */
public final class FactCsvCodec {

	static final String[] HEADER = { "id", "document_id", "line", "document_timestamp", "document_type", "type",
			"text", "confidence", "requires_validation", "resolved_timestamp", "resolution_method",
			"clinical_significance", "source", "surgical", "correction_applied", "correction_pattern_id",
			"original_text", "duplicate_count", "concept_kind", "concept_name", "concept_value", "concept_secondary",
			"concept_unit", "concept_normal_low", "concept_normal_high", "concept_severity", "concept_implication",
			"attributes" };

	private FactCsvCodec() {
	}

	public static void write(List<Fact> facts, Path file) throws IOException {
		if (file.getParent() != null)
			Files.createDirectories(file.getParent());
		try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			write(facts, w);
		}
	}

	public static void write(List<Fact> facts, Writer out) throws IOException {
		CSVPrinter p = new CSVPrinter(out, writeFormat(HEADER));
		for (Fact f : facts) {
			ClinicalConcept c = f.getNormalizedValue();
			p.printRecord(f.getId(), cell(f.getDocumentId()), f.getLine(), cell(f.getDocumentTimestamp()),
					cell(f.getDocumentType()), cell(f.getType()), f.getText(), f.getConfidence(),
					f.isRequiresValidation(), cell(f.getResolvedTimestamp()), cell(f.getResolutionMethod()),
					cell(f.getClinicalSignificance()), f.getSource().getTag(), f.isSurgical(), f.isCorrectionApplied(),
					cell(f.getCorrectionPatternId()), cell(f.getOriginalText()), f.getDuplicateCount(),
					c == null ? "" : cell(c.getKind()), c == null ? "" : cell(c.getName()),
					c == null ? "" : cell(c.getValue()), c == null ? "" : cell(c.getSecondaryValue()),
					c == null ? "" : cell(c.getUnit()), c == null ? "" : cell(c.getNormalLow()),
					c == null ? "" : cell(c.getNormalHigh()), c == null ? "" : cell(c.getSeverity()),
					c == null ? "" : cell(c.getImplication()), encodeMap(f.getAttributes()));
		}
		p.flush();
	}

	public static List<Fact> read(Path file) throws IOException {
		try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(r);
		}
	}

	public static List<Fact> read(Reader in) throws IOException {
		List<Fact> out = new ArrayList<>();
		CSVParser parser = CSVParser.parse(in, READ_FORMAT);
		for (CSVRecord r : parser) {
			Fact f = toFact(r);
			String storedId = text(r, "id");
			if (storedId != null && !storedId.equals(f.getId())) {
				Logger.warn("Fact id mismatch on row {}: stored {} computed {}", r.getRecordNumber(), storedId,
						f.getId());
			}
			out.add(f);
		}
		return out;
	}

	private static Fact toFact(CSVRecord r) throws IOException {
		String kind = text(r, "concept_kind");
		ClinicalConcept concept = null;
		if (kind != null) {
			String severity = text(r, "concept_severity");
			concept = ClinicalConcept.builder().kind(ConceptKind.valueOf(kind)).name(text(r, "concept_name"))
					.value(doubleOrNull(r, "concept_value")).secondaryValue(doubleOrNull(r, "concept_secondary"))
					.unit(text(r, "concept_unit")).normalLow(doubleOrNull(r, "concept_normal_low"))
					.normalHigh(doubleOrNull(r, "concept_normal_high"))
					.severity(severity == null ? null : LabSeverity.valueOf(severity))
					.implication(text(r, "concept_implication")).build();
		}
		String documentType = text(r, "document_type");
		String type = text(r, "type");
		String source = text(r, "source");
		return Fact.builder().documentId(text(r, "document_id")).line(intOrZero(r, "line"))
				.documentTimestamp(timestamp(r, "document_timestamp"))
				.documentType(documentType == null ? null : DocumentType.valueOf(documentType))
				.type(type == null ? null : FactType.fromLabel(type)).text(text(r, "text"))
				.confidence(Double.parseDouble(text(r, "confidence")))
				.requiresValidation(bool(r, "requires_validation"))
				.resolvedTimestamp(timestamp(r, "resolved_timestamp")).resolutionMethod(text(r, "resolution_method"))
				.clinicalSignificance(text(r, "clinical_significance"))
				.source(source == null ? null : ExtractionSource.fromTag(source)).surgical(bool(r, "surgical"))
				.correctionApplied(bool(r, "correction_applied"))
				.correctionPatternId(text(r, "correction_pattern_id")).originalText(text(r, "original_text"))
				.duplicateCount(intOrZero(r, "duplicate_count")).normalizedValue(concept)
				.attributes(decodeMap(text(r, "attributes"))).build();
	}
}
