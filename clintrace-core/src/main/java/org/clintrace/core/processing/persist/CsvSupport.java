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
import java.io.StringReader;
import java.io.StringWriter;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/** Shared cell conversions. Null is written as the empty cell and read back as null. */
final class CsvSupport {

	static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true)
			.setIgnoreHeaderCase(true).setIgnoreEmptyLines(true).build();

	private CsvSupport() {
	}

	static CSVFormat writeFormat(String... header) {
		return CSVFormat.DEFAULT.builder().setHeader(header).build();
	}

	static String cell(Object v) {
		return v == null ? "" : String.valueOf(v);
	}

	static String text(CSVRecord r, String column) {
		if (!r.isMapped(column) || !r.isSet(column))
			return null;
		String v = r.get(column);
		return v.isEmpty() ? null : v;
	}

	static Double doubleOrNull(CSVRecord r, String column) {
		String v = text(r, column);
		return v == null ? null : Double.valueOf(v);
	}

	static int intOrZero(CSVRecord r, String column) {
		String v = text(r, column);
		return v == null ? 0 : Integer.parseInt(v.trim());
	}

	static boolean bool(CSVRecord r, String column) {
		return Boolean.parseBoolean(text(r, column));
	}

	static LocalDateTime timestamp(CSVRecord r, String column) {
		String v = text(r, column);
		return v == null ? null : LocalDateTime.parse(v.trim());
	}

	/** Encodes a map as one CSV record of {@code key=value} cells. */
	static String encodeMap(Map<String, String> map) throws IOException {
		if (map == null || map.isEmpty())
			return "";
		StringWriter w = new StringWriter();
		try (CSVPrinter p = new CSVPrinter(w, CSVFormat.DEFAULT.builder().setRecordSeparator("").build())) {
			for (Map.Entry<String, String> e : map.entrySet()) {
				p.print(e.getKey() + "=" + e.getValue());
			}
			p.println();
		}
		return w.toString();
	}

	static Map<String, String> decodeMap(String encoded) throws IOException {
		Map<String, String> out = new LinkedHashMap<>();
		if (StringUtils.isEmpty(encoded))
			return out;
		try (CSVParser parser = CSVParser.parse(new StringReader(encoded), CSVFormat.DEFAULT)) {
			for (CSVRecord rec : parser) {
				for (String cell : rec) {
					int eq = cell.indexOf('=');
					if (eq > 0)
						out.put(cell.substring(0, eq), cell.substring(eq + 1));
				}
			}
		}
		return out;
	}
}
