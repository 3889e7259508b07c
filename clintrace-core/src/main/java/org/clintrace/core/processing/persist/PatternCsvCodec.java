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
import org.clintrace.core.om.ApprovalStatus;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LearningPattern;

import static org.clintrace.core.processing.persist.CsvSupport.*;

/**
 * Learning-pattern state as CSV, the form in which the caller hands stored
 * patterns to the feedback manager and takes them back.
 */
public final class PatternCsvCodec {

	static final String[] HEADER = { "id", "fact_type", "original_text", "corrected_text", "context", "status",
			"created_by", "created_at", "reviewed_by", "reviewed_at", "rejection_reason", "success_rate",
			"application_count", "outcome_count", "override_count" };

	private PatternCsvCodec() {
	}

	public static void write(List<LearningPattern> patterns, Path file) throws IOException {
		if (file.getParent() != null)
			Files.createDirectories(file.getParent());
		try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
			write(patterns, w);
		}
	}

	public static void write(List<LearningPattern> patterns, Writer out) throws IOException {
		CSVPrinter p = new CSVPrinter(out, writeFormat(HEADER));
		for (LearningPattern lp : patterns) {
			p.printRecord(lp.getId(), cell(lp.getFactType()), lp.getOriginalText(), lp.getCorrectedText(),
					cell(lp.getContext()), lp.getStatus(), cell(lp.getCreatedBy()), cell(lp.getCreatedAt()),
					cell(lp.getReviewedBy()), cell(lp.getReviewedAt()), cell(lp.getRejectionReason()),
					lp.getSuccessRate(), lp.getApplicationCount(), lp.getOutcomeCount(), lp.getOverrideCount());
		}
		p.flush();
	}

	/** Missing file means no stored patterns. */
	public static List<LearningPattern> read(Path file) throws IOException {
		if (!Files.exists(file))
			return new ArrayList<>();
		try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return read(r);
		}
	}

	public static List<LearningPattern> read(Reader in) throws IOException {
		List<LearningPattern> out = new ArrayList<>();
		for (CSVRecord r : CSVParser.parse(in, READ_FORMAT)) {
			String type = text(r, "fact_type");
			String status = text(r, "status");
			Double rate = doubleOrNull(r, "success_rate");
			out.add(LearningPattern.builder().id(text(r, "id")).factType(type == null ? null : FactType.fromLabel(type))
					.originalText(text(r, "original_text")).correctedText(text(r, "corrected_text"))
					.context(text(r, "context"))
					.status(status == null ? ApprovalStatus.PENDING : ApprovalStatus.valueOf(status))
					.createdBy(text(r, "created_by")).createdAt(timestamp(r, "created_at"))
					.reviewedBy(text(r, "reviewed_by")).reviewedAt(timestamp(r, "reviewed_at"))
					.rejectionReason(text(r, "rejection_reason")).successRate(rate == null ? 1.0 : rate)
					.applicationCount(intOrZero(r, "application_count")).outcomeCount(intOrZero(r, "outcome_count"))
					.overrideCount(intOrZero(r, "override_count")).build());
		}
		return out;
	}
}
