package org.clintrace.core.om;

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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.lang3.StringUtils;
import org.clintrace.core.util.ContentHash;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * The atomic unit of extraction: a source-attributed text span with a type,
 * a confidence and an optional structured value.
 *
 * <p>Instances are immutable. The temporal resolution fields and the correction
 * fields are each set once through {@link #withResolvedTimestamp} and
 * {@link #withCorrection}, which return new instances.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Fact {

	/** Stable identity derived from provenance (document, line, type, original text). */
	private final String id;

	private final String text;
	private final String documentId;
	/** 1-based source line; 0 when the fact is not line-anchored (fallback). */
	private final int line;
	private final LocalDateTime documentTimestamp;
	private final DocumentType documentType;
	private final FactType type;
	private final double confidence;
	private final boolean requiresValidation;

	private final LocalDateTime resolvedTimestamp;
	private final String resolutionMethod;

	private final ClinicalConcept normalizedValue;
	private final String clinicalSignificance;
	private final ExtractionSource source;
	/** Procedures documented in an operative note act as surgery anchors. */
	private final boolean surgical;

	private final boolean correctionApplied;
	private final String correctionPatternId;
	/** Text as extracted, before an approved pattern rewrote it. */
	private final String originalText;

	private final int duplicateCount;
	private final Map<String, String> attributes;

	@Builder(toBuilder = true)
	private Fact(String text, String documentId, int line, LocalDateTime documentTimestamp,
			DocumentType documentType, FactType type, double confidence, boolean requiresValidation,
			LocalDateTime resolvedTimestamp, String resolutionMethod, ClinicalConcept normalizedValue,
			String clinicalSignificance, ExtractionSource source, boolean surgical, boolean correctionApplied,
			String correctionPatternId, String originalText, int duplicateCount, Map<String, String> attributes) {
		if (StringUtils.isBlank(text)) {
			throw new IllegalArgumentException("Fact text must not be empty");
		}
		if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
			throw new IllegalArgumentException("Fact confidence must be within [0,1]: " + confidence);
		}
		if (duplicateCount < 0) {
			throw new IllegalArgumentException("Duplicate count must not be negative: " + duplicateCount);
		}
		this.text = text.trim();
		this.documentId = documentId;
		this.line = line;
		this.documentTimestamp = documentTimestamp;
		this.documentType = documentType;
		this.type = type;
		this.confidence = confidence;
		this.requiresValidation = requiresValidation;
		this.resolvedTimestamp = resolvedTimestamp;
		this.resolutionMethod = resolutionMethod;
		this.normalizedValue = normalizedValue;
		this.clinicalSignificance = clinicalSignificance;
		this.source = source == null ? ExtractionSource.PATTERN : source;
		this.surgical = surgical;
		this.correctionApplied = correctionApplied;
		this.correctionPatternId = correctionPatternId;
		this.originalText = originalText;
		this.duplicateCount = duplicateCount;
		this.attributes = attributes == null || attributes.isEmpty() ? Collections.emptyMap()
				: Collections.unmodifiableMap(new TreeMap<>(attributes));
		this.id = ContentHash.shortHash(16, documentId, line, type, originalText != null ? originalText : this.text);
	}

	// ---- one-shot enrichment -------------------------------------------------

	/**
	 * Returns a copy anchored to an absolute timestamp.
	 *
	 * @throws IllegalStateException if this fact was already resolved
	 */
	public Fact withResolvedTimestamp(LocalDateTime timestamp, String method, double newConfidence) {
		if (resolvedTimestamp != null) {
			throw new IllegalStateException("Fact " + id + " already has a resolved timestamp");
		}
		if (timestamp == null) {
			throw new IllegalArgumentException("Resolved timestamp must not be null");
		}
		return toBuilder().resolvedTimestamp(timestamp).resolutionMethod(method).confidence(newConfidence).build();
	}

	/**
	 * Returns a copy whose text was rewritten by an approved learning pattern.
	 *
	 * @throws IllegalStateException if a correction was already applied
	 */
	public Fact withCorrection(String correctedText, String patternId, double newConfidence) {
		if (correctionApplied) {
			throw new IllegalStateException("Fact " + id + " was already corrected by " + correctionPatternId);
		}
		return toBuilder().text(correctedText).originalText(text).correctionApplied(true)
				.correctionPatternId(patternId).confidence(newConfidence).build();
	}

	public Fact withDuplicateCount(int count) {
		return toBuilder().duplicateCount(count).build();
	}

	// ---- derived views -------------------------------------------------------

	public boolean isResolved() {
		return resolvedTimestamp != null;
	}

	/** Resolved timestamp when available, otherwise the document timestamp. */
	public LocalDateTime effectiveTimestamp() {
		return resolvedTimestamp != null ? resolvedTimestamp : documentTimestamp;
	}

	public LocalDate effectiveDate() {
		LocalDateTime ts = effectiveTimestamp();
		return ts == null ? null : ts.toLocalDate();
	}

	public String attribute(String key) {
		return attributes.get(key);
	}

	/** Numeric value of the normalized concept, or null. */
	public Double numericValue() {
		return normalizedValue != null && normalizedValue.hasValue() ? normalizedValue.getValue() : null;
	}

	public String conceptName() {
		return normalizedValue == null ? null : normalizedValue.getName();
	}

	public FindingKind finding() {
		String f = attributes.get(FactAttribute.FINDING);
		return f == null ? null : FindingKind.valueOf(f);
	}

	/** Admission facts and surgical procedures are zero points for relative time. */
	public boolean isAnchor() {
		return type == FactType.ADMISSION || (type == FactType.PROCEDURE && surgical);
	}
}
