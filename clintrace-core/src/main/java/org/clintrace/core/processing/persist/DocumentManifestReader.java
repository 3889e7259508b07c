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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.DocumentType;
import org.clintrace.core.util.Logger;

import static org.clintrace.core.processing.persist.CsvSupport.*;

/**
 * Reads the document manifest ({@code id,file,type,timestamp,author,specialty})
 * and the document files it names. A document whose file is missing or
 * unreadable is returned without content so that extraction reports it as
 * failed while its siblings proceed.
 */
public class DocumentManifestReader {

	private final Path documentDir;

	public DocumentManifestReader(Path documentDir) {
		this.documentDir = documentDir;
	}

	public List<ClinicalDocument> read(String manifestName) throws IOException {
		Path manifest = documentDir.resolve(manifestName);
		List<ClinicalDocument> out = new ArrayList<>();
		try (Reader r = Files.newBufferedReader(manifest, StandardCharsets.UTF_8);
				CSVParser parser = CSVParser.parse(r, READ_FORMAT)) {
			for (CSVRecord rec : parser) {
				String id = text(rec, "id");
				String file = text(rec, "file");
				if (id == null) {
					Logger.warn("Manifest row {} has no id; skipped", rec.getRecordNumber());
					continue;
				}
				out.add(ClinicalDocument.builder().id(id).type(DocumentType.parse(text(rec, "type")))
						.timestamp(parseTimestamp(id, text(rec, "timestamp"))).author(text(rec, "author"))
						.specialty(text(rec, "specialty")).content(readContent(id, file)).build());
			}
		}
		Logger.info("Manifest {}: {} documents", manifest, out.size());
		return out;
	}

	private String readContent(String id, String file) {
		if (file == null) {
			Logger.warn("Document {} names no file", id);
			return null;
		}
		Path p = documentDir.resolve(file);
		try {
			return Files.readString(p, StandardCharsets.UTF_8);
		} catch (IOException e) {
			Logger.warn("Cannot read document {} from {}: {}", id, p, e.getMessage());
			return null;
		}
	}

	/** ISO date-time, or ISO date at start of day; null when absent or invalid. */
	static LocalDateTime parseTimestamp(String id, String raw) {
		if (raw == null)
			return null;
		String v = raw.trim();
		try {
			return v.length() <= 10 ? LocalDate.parse(v).atStartOfDay() : LocalDateTime.parse(v.replace(' ', 'T'));
		} catch (DateTimeParseException e) {
			Logger.warn("Document {} has an invalid timestamp '{}'", id, raw);
			return null;
		}
	}
}
