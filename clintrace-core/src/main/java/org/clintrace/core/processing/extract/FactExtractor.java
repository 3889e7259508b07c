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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.ExtractionSource;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactAttribute;
import org.clintrace.core.om.FactType;
import org.clintrace.core.util.ContentHash;
import org.clintrace.core.util.Logger;

/**
 * Extracts candidate facts from one document through a registry of per-type
 * strategies. Pattern matching runs first; a strategy that finds nothing in
 * prose may delegate to the optional fallback capability.
 *
 * <p>Holds no per-document state: one instance serves all extraction threads.</p>
 */
public class FactExtractor {

	/** Confidence of a fallback-sourced fact. */
	public static final double FALLBACK_CONFIDENCE = 0.85;

	private static final int MAX_FALLBACK_TEXT = 500;

	private final ClinicalKnowledgeBase knowledgeBase;
	private final FallbackExtractionCapability fallback;
	private final Map<FactType, EntityExtractor> registry = new EnumMap<>(FactType.class);

	/** Pattern-only extraction. */
	public FactExtractor(ClinicalKnowledgeBase knowledgeBase) {
		this(knowledgeBase, null);
	}

	/**
	 * @param fallback optional capability; null runs pattern-only
	 */
	public FactExtractor(ClinicalKnowledgeBase knowledgeBase, FallbackExtractionCapability fallback) {
		this.knowledgeBase = knowledgeBase;
		this.fallback = fallback;
		register(new AdmissionExtractor());
		register(new MedicationExtractor(knowledgeBase));
		register(new LabValueExtractor(knowledgeBase));
		register(new ClinicalScoreExtractor(knowledgeBase));
		register(new VitalSignExtractor());
		register(new ProcedureExtractor());
		register(new ConsultationExtractor());
		register(new ComplicationExtractor());
		register(new TemporalReferenceExtractor());
		register(new DiagnosisExtractor());
		register(new FindingExtractor(knowledgeBase));
		register(new RecommendationExtractor());
	}

	/** Adds or replaces the strategy for {@link EntityExtractor#type()}. */
	public final FactExtractor register(EntityExtractor extractor) {
		registry.put(extractor.type(), extractor);
		return this;
	}

	public Set<FactType> registeredTypes() {
		return registry.keySet();
	}

	public boolean isFallbackAvailable() {
		return fallback != null;
	}

	/**
	 * Extracts, deduplicates and orders the facts of one document.
	 *
	 * @throws IllegalArgumentException when the document or its content is null
	 */
	public List<Fact> extract(ClinicalDocument doc) {
		if (doc == null) {
			throw new IllegalArgumentException("Document is null");
		}
		if (doc.getContent() == null) {
			throw new IllegalArgumentException("Document " + doc.getId() + " has no content");
		}
		String text = TextCleaner.clean(doc.getContent());
		if (text.isEmpty()) {
			Logger.debug("Document {} is empty", doc.getId());
			return List.of();
		}

		ExtractionContext ctx = new ExtractionContext(doc, text, knowledgeBase);
		List<Fact> facts = new ArrayList<>();
		for (EntityExtractor extractor : registry.values()) {
			List<Fact> found = extractor.extract(ctx);
			if (found.isEmpty()) {
				found = tryFallback(extractor, ctx);
			}
			facts.addAll(found);
		}

		List<Fact> out = deduplicate(facts);
		out.sort(Comparator.comparingInt(Fact::getLine).thenComparing(Fact::getType).thenComparing(Fact::getText));
		Logger.debug("Document {}: {} facts ({} before dedupe)", doc.getId(), out.size(), facts.size());
		return out;
	}

	private List<Fact> tryFallback(EntityExtractor extractor, ExtractionContext ctx) {
		String instruction = extractor.fallbackInstruction();
		if (fallback == null || instruction == null || !extractor.plausiblyPresent(ctx))
			return List.of();
		String response;
		try {
			response = fallback.extract(instruction, ctx.getText());
		} catch (RuntimeException e) {
			Logger.warn("Fallback extraction failed for {} in document {}: {}", extractor.type(),
					ctx.getDocument().getId(), e.getMessage());
			return List.of();
		}
		if (FallbackExtractionCapability.isNone(response))
			return List.of();
		String text = response.trim();
		if (text.length() > MAX_FALLBACK_TEXT)
			text = text.substring(0, MAX_FALLBACK_TEXT);
		ClinicalDocument doc = ctx.getDocument();
		return List.of(Fact.builder().text(text).documentId(doc.getId()).line(0)
				.documentTimestamp(doc.getTimestamp()).documentType(ctx.getDocumentType()).type(extractor.type())
				.confidence(FALLBACK_CONFIDENCE).source(ExtractionSource.LLM_FALLBACK).build());
	}

	// ---- re-normalization ----------------------------------------------------

	/**
	 * Re-derives the structured value of a corrected fact from its new text, with
	 * the strategy registered for its type. Facts without a structured value come
	 * back unchanged. When the corrected text no longer parses, the value, the
	 * measurement family and the significance are cleared.
	 */
	public Fact renormalize(Fact fact) {
		if (fact.getNormalizedValue() == null && fact.attribute(FactAttribute.FAMILY) == null)
			return fact;
		Fact reparsed = null;
		EntityExtractor strategy = registry.get(fact.getType());
		if (strategy != null) {
			ClinicalDocument doc = ClinicalDocument.builder().id(fact.getDocumentId()).type(fact.getDocumentType())
					.timestamp(fact.getDocumentTimestamp()).content(fact.getText()).build();
			List<Fact> found = strategy.extract(new ExtractionContext(doc, TextCleaner.clean(fact.getText()),
					knowledgeBase));
			reparsed = found.isEmpty() ? null : found.get(0);
		}

		if (reparsed == null) {
			Map<String, String> attrs = new HashMap<>(fact.getAttributes());
			attrs.remove(FactAttribute.FAMILY);
			Logger.warn("Corrected {} '{}' has no structured value; cleared", fact.getType(), fact.getText());
			return fact.toBuilder().normalizedValue(null).clinicalSignificance(null).attributes(attrs).build();
		}
		// attributes follow the corrected text; the source line stays the original one
		Map<String, String> attrs = new HashMap<>(reparsed.getAttributes());
		String context = fact.attribute(FactAttribute.CONTEXT);
		if (context != null)
			attrs.put(FactAttribute.CONTEXT, context);
		return fact.toBuilder().normalizedValue(reparsed.getNormalizedValue())
				.clinicalSignificance(reparsed.getClinicalSignificance())
				.requiresValidation(reparsed.isRequiresValidation()).attributes(attrs).build();
	}

	// ---- deduplication --------------------------------------------------------

	/**
	 * Collapses facts with the same type, normalized text and document timestamp.
	 * The highest-confidence instance survives (first one on ties) and carries the
	 * number of collapsed duplicates. Input order of survivors is preserved.
	 */
	public static List<Fact> deduplicate(List<Fact> facts) {
		Map<String, List<Fact>> groups = new LinkedHashMap<>();
		for (Fact f : facts) {
			String key = f.getType() + "|" + ContentHash.normalize(f.getText()) + "|" + f.getDocumentTimestamp();
			groups.computeIfAbsent(key, k -> new ArrayList<>()).add(f);
		}
		List<Fact> out = new ArrayList<>(groups.size());
		for (List<Fact> group : groups.values()) {
			if (group.size() == 1) {
				out.add(group.get(0));
				continue;
			}
			Fact best = group.get(0);
			int duplicates = 0;
			boolean surgical = false;
			for (Fact f : group) {
				if (f.getConfidence() > best.getConfidence())
					best = f;
				duplicates += f.getDuplicateCount();
				surgical |= f.isSurgical();
			}
			duplicates += group.size() - 1;
			Fact merged = best.toBuilder().duplicateCount(duplicates).surgical(surgical).build();
			out.add(merged);
		}
		return out;
	}

	public static ExtractionStats stats(List<Fact> facts) {
		Map<FactType, Integer> byType = new EnumMap<>(FactType.class);
		double sum = 0.0;
		int validation = 0;
		int fallbackCount = 0;
		for (Fact f : facts) {
			byType.merge(f.getType(), 1, Integer::sum);
			sum += f.getConfidence();
			if (f.isRequiresValidation())
				validation++;
			if (f.getSource() == ExtractionSource.LLM_FALLBACK)
				fallbackCount++;
		}
		return new ExtractionStats(facts.size(), byType, facts.isEmpty() ? 0.0 : sum / facts.size(), validation,
				fallbackCount);
	}
}
