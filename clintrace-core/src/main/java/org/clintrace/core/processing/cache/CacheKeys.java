package org.clintrace.core.processing.cache;

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

import java.util.Collection;
import java.util.List;

import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.util.ContentHash;

/**
 * Deterministic keys over normalized document content.
 */
public final class CacheKeys {

	public static final String DOC_CLASS = "doc_class:";
	public static final String FACTS = "facts:";
	public static final String RESULT = "result:";

	private CacheKeys() {
	}

	public static String documentHash(ClinicalDocument doc) {
		return ContentHash.sha256(doc.getId(), doc.getType(), doc.getTimestamp(), doc.getAuthor(),
				doc.getSpecialty(), doc.getContent() == null ? null : ContentHash.normalize(doc.getContent()));
	}

	public static String classification(ClinicalDocument doc) {
		return DOC_CLASS + documentHash(doc);
	}

	public static String facts(ClinicalDocument doc) {
		return FACTS + documentHash(doc);
	}

	/** Whole-run key: every document plus the ids of the active patterns. */
	public static String result(Collection<ClinicalDocument> documents, List<String> activePatternIds) {
		Object[] parts = new Object[documents.size() + activePatternIds.size() + 1];
		int i = 0;
		for (ClinicalDocument d : documents)
			parts[i++] = documentHash(d);
		parts[i++] = "|patterns";
		for (String id : activePatternIds)
			parts[i++] = id;
		return RESULT + ContentHash.sha256(parts);
	}
}
