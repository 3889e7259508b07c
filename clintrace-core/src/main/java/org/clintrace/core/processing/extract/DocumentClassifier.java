package org.clintrace.core.processing.extract;

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

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.DocumentType;

/**
 * Infers a missing document type from the document id and its first lines.
 */
public class DocumentClassifier {

	private static final int HEADER_CHARS = 300;

	private static final Map<DocumentType, Pattern> RULES = new LinkedHashMap<>();
	static {
		RULES.put(DocumentType.OPERATIVE_NOTE, Pattern.compile("\\b(?:operative|op[ _-]?note|operation note|procedure note|brief op)"));
		RULES.put(DocumentType.DISCHARGE_SUMMARY, Pattern.compile("\\bdischarge"));
		RULES.put(DocumentType.ADMISSION_NOTE, Pattern.compile("\\b(?:admission|admit|h&p|history and physical)"));
		RULES.put(DocumentType.CONSULT_NOTE, Pattern.compile("\\bconsult"));
		RULES.put(DocumentType.LAB_REPORT, Pattern.compile("\\b(?:lab|laboratory|labs)\\b"));
		RULES.put(DocumentType.IMAGING_REPORT, Pattern.compile("\\b(?:imaging|radiology|ct head|mri|cta|angiogram report)\\b"));
		RULES.put(DocumentType.NURSING_NOTE, Pattern.compile("\\bnursing"));
		RULES.put(DocumentType.PROGRESS_NOTE, Pattern.compile("\\b(?:progress|daily note|pod\\s*#?\\s*\\d|hd\\s*#?\\s*\\d)"));
	}

	/** The document's own type when set, otherwise the first rule that matches. */
	public DocumentType classify(ClinicalDocument doc) {
		if (doc.getType() != null && doc.getType() != DocumentType.UNKNOWN)
			return doc.getType();
		String id = doc.getId() == null ? "" : doc.getId().toLowerCase(Locale.ROOT).replace('_', ' ');
		String content = doc.getContent() == null ? "" : doc.getContent();
		String header = content.substring(0, Math.min(HEADER_CHARS, content.length())).toLowerCase(Locale.ROOT);
		for (Map.Entry<DocumentType, Pattern> rule : RULES.entrySet()) {
			if (rule.getValue().matcher(id).find())
				return rule.getKey();
		}
		for (Map.Entry<DocumentType, Pattern> rule : RULES.entrySet()) {
			if (rule.getValue().matcher(header).find())
				return rule.getKey();
		}
		return DocumentType.UNKNOWN;
	}

	public ClinicalDocument withInferredType(ClinicalDocument doc) {
		DocumentType t = classify(doc);
		return t == doc.getType() ? doc : doc.toBuilder().type(t).build();
	}
}
