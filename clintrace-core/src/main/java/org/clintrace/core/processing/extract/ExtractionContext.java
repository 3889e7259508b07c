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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.DocumentType;

/**
 * Read-only view of one document while its strategies run.
 */
public final class ExtractionContext {

	private final ClinicalDocument document;
	private final String text;
	private final List<String> lines;
	private final ClinicalKnowledgeBase knowledgeBase;

	public ExtractionContext(ClinicalDocument document, String cleanedText, ClinicalKnowledgeBase knowledgeBase) {
		this.document = document;
		this.text = cleanedText;
		this.lines = Collections.unmodifiableList(Arrays.asList(cleanedText.split("\n", -1)));
		this.knowledgeBase = knowledgeBase;
	}

	public ClinicalDocument getDocument() {
		return document;
	}

	public DocumentType getDocumentType() {
		return document.getTypeOrUnknown();
	}

	public String getText() {
		return text;
	}

	public String getLowerText() {
		return text.toLowerCase(Locale.ROOT);
	}

	public List<String> getLines() {
		return lines;
	}

	public ClinicalKnowledgeBase getKnowledgeBase() {
		return knowledgeBase;
	}

	/**
	 * Prose rather than tabular text: a narrative document type where fewer than
	 * half of the non-blank lines look like "Label: value".
	 */
	public boolean isNarrative() {
		if (!getDocumentType().isNarrative())
			return false;
		int content = 0;
		int structured = 0;
		for (String line : lines) {
			if (line.isBlank())
				continue;
			content++;
			if (line.matches("^\\s*[A-Za-z][A-Za-z0-9 /()-]{0,30}:\\s*\\S.{0,40}$"))
				structured++;
		}
		return content > 0 && structured * 2 < content;
	}

	boolean mentionsAny(String... needles) {
		String lower = getLowerText();
		for (String n : needles) {
			if (lower.contains(n))
				return true;
		}
		return false;
	}
}
