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
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.csv.CSVPrinter;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.KeyEvent;
import org.clintrace.core.om.Progression;
import org.clintrace.core.om.Timeline;
import org.clintrace.core.om.Uncertainty;

import static org.clintrace.core.processing.persist.CsvSupport.*;

/**
 * Review reports: the uncertainty list, the timeline and its progressions.
 */
public final class ReportCsvWriter {

	static final String[] UNCERTAINTY_HEADER = { "id", "severity", "stage", "issue_code", "description",
			"suggested_resolution", "fact_ids", "resolved", "resolution", "resolved_by" };
	static final String[] TIMELINE_HEADER = { "date", "timestamp", "type", "text", "document_id", "line",
			"confidence", "resolution_method", "key_event" };
	static final String[] PROGRESSION_HEADER = { "family", "direction", "points", "first_value", "last_value",
			"change" };

	private ReportCsvWriter() {
	}

	public static void writeUncertainties(List<Uncertainty> uncertainties, Path file) throws IOException {
		try (Writer w = open(file); CSVPrinter p = new CSVPrinter(w, writeFormat(UNCERTAINTY_HEADER))) {
			for (Uncertainty u : uncertainties) {
				p.printRecord(u.getId(), u.getSeverity(), u.getStage(), u.getIssueCode(), u.getDescription(),
						cell(u.getSuggestedResolution()), String.join("|", u.getFactIds()), u.isResolved(),
						cell(u.getResolution()), cell(u.getResolvedBy()));
			}
		}
	}

	public static void writeTimeline(Timeline timeline, Path file) throws IOException {
		Map<String, KeyEvent.Kind> events = new HashMap<>();
		for (KeyEvent e : timeline.getKeyEvents())
			events.put(e.getFact().getId(), e.getKind());
		try (Writer w = open(file); CSVPrinter p = new CSVPrinter(w, writeFormat(TIMELINE_HEADER))) {
			for (Map.Entry<LocalDate, List<Fact>> day : timeline.getFactsByDate().entrySet()) {
				for (Fact f : day.getValue()) {
					p.printRecord(day.getKey(), cell(f.effectiveTimestamp()), f.getType(), f.getText(),
							cell(f.getDocumentId()), f.getLine(), f.getConfidence(), cell(f.getResolutionMethod()),
							cell(events.get(f.getId())));
				}
			}
			for (Fact f : timeline.getUndatedFacts()) {
				p.printRecord("", "", f.getType(), f.getText(), cell(f.getDocumentId()), f.getLine(),
						f.getConfidence(), cell(f.getResolutionMethod()), "");
			}
		}
	}

	public static void writeProgressions(Timeline timeline, Path file) throws IOException {
		try (Writer w = open(file); CSVPrinter p = new CSVPrinter(w, writeFormat(PROGRESSION_HEADER))) {
			for (Progression pr : timeline.getProgressions().values()) {
				p.printRecord(pr.getFamily(), pr.getDirection(), pr.getPoints().size(), pr.getFirstValue(),
						pr.getLastValue(), pr.getChange());
			}
		}
	}

	private static Writer open(Path file) throws IOException {
		if (file.getParent() != null)
			Files.createDirectories(file.getParent());
		return Files.newBufferedWriter(file, StandardCharsets.UTF_8);
	}
}
