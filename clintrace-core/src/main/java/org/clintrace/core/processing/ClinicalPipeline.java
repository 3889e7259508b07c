package org.clintrace.core.processing;

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

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.learning.CorrectionResult;
import org.clintrace.core.learning.FeedbackManager;
import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.DocumentType;
import org.clintrace.core.om.Fact;
import org.clintrace.core.om.FactType;
import org.clintrace.core.om.LearningPattern;
import org.clintrace.core.om.PipelineResult;
import org.clintrace.core.om.ProcessingMetrics;
import org.clintrace.core.om.Timeline;
import org.clintrace.core.processing.cache.CacheKeys;
import org.clintrace.core.processing.cache.NoOpResultCache;
import org.clintrace.core.processing.cache.ResultCache;
import org.clintrace.core.processing.extract.DocumentClassifier;
import org.clintrace.core.processing.extract.FactExtractor;
import org.clintrace.core.processing.temporal.TemporalResolution;
import org.clintrace.core.processing.temporal.TemporalResolver;
import org.clintrace.core.processing.timeline.TimelineBuilder;
import org.clintrace.core.processing.validate.ValidationResult;
import org.clintrace.core.processing.validate.Validator;
import org.clintrace.core.util.Logger;

/**
 * Runs documents through classification, concurrent extraction, the learning
 * correction pass, temporal resolution, timeline building and validation.
 *
 * <p>Extraction is the only concurrent stage. Each document is extracted in its
 * own task; a task that fails yields a failed {@link ExtractionOutcome} and the
 * other documents are unaffected. Everything after extraction runs on the
 * calling thread over the complete fact set.</p>
 *
 * <p>The cache is consulted before classification, per-document extraction and
 * the whole run. Any cache failure is logged and treated as a miss.</p>
 */
public class ClinicalPipeline {

	private final DocumentClassifier classifier = new DocumentClassifier();
	private final FactExtractor extractor;
	private final FeedbackManager feedback;
	private final TemporalResolver resolver = new TemporalResolver();
	private final TimelineBuilder timelineBuilder;
	private final Validator validator;
	private final ResultCache cache;
	private final Duration cacheTtl;
	private final int parallelism;

	public ClinicalPipeline(ClinicalKnowledgeBase knowledgeBase, FactExtractor extractor, FeedbackManager feedback) {
		this(knowledgeBase, extractor, feedback, NoOpResultCache.INSTANCE, Duration.ofHours(1),
				Math.max(1, Runtime.getRuntime().availableProcessors() / 2));
	}

	public ClinicalPipeline(ClinicalKnowledgeBase knowledgeBase, FactExtractor extractor, FeedbackManager feedback,
			ResultCache cache, Duration cacheTtl, int parallelism) {
		this.extractor = extractor;
		this.feedback = feedback;
		this.timelineBuilder = new TimelineBuilder(knowledgeBase);
		this.validator = new Validator(knowledgeBase);
		this.cache = cache == null ? NoOpResultCache.INSTANCE : cache;
		this.cacheTtl = cacheTtl;
		this.parallelism = Math.max(1, parallelism);
	}

	public PipelineResult process(List<ClinicalDocument> documents) {
		ProcessingMetrics metrics = new ProcessingMetrics();
		metrics.setDocumentCount(documents.size());
		AtomicInteger hits = new AtomicInteger();
		AtomicInteger misses = new AtomicInteger();

		long t0 = System.nanoTime();
		List<ClinicalDocument> typed = new ArrayList<>(documents.size());
		for (ClinicalDocument doc : documents) {
			typed.add(classify(doc, hits, misses));
		}
		metrics.recordStage("classification", t0);

		// one snapshot serves both the result key and the correction pass
		List<LearningPattern> patterns = feedback.activeSnapshot();
		List<String> patternKeys = patterns.stream().map(p -> p.getId() + "@" + p.getSuccessRate())
				.sorted().collect(Collectors.toList());
		String resultKey = CacheKeys.result(typed, patternKeys);
		Optional<PipelineResult> cached = cacheGet(resultKey, PipelineResult.class, hits, misses);
		if (cached.isPresent()) {
			PipelineResult r = cached.get();
			metrics.setServedFromCache(true);
			metrics.setCacheHits(hits.get());
			metrics.setCacheMisses(misses.get());
			copyContentMetrics(r.getMetrics(), metrics);
			Logger.info("Pipeline result served from cache ({} documents)", documents.size());
			return new PipelineResult(r.getFacts(), r.getTimeline(), r.getUncertainties(), r.getTemporalConflicts(),
					metrics);
		}

		t0 = System.nanoTime();
		List<ExtractionOutcome> outcomes = extractAll(typed, hits, misses);
		List<Fact> extracted = new ArrayList<>();
		for (ExtractionOutcome o : outcomes) {
			if (o.isSuccess()) {
				extracted.addAll(o.getFacts());
			} else {
				metrics.getFailedDocuments().put(o.getDocumentId(), o.getFailureReason());
			}
		}
		List<Fact> facts = FactExtractor.deduplicate(extracted);
		metrics.setDuplicatesCollapsed(extracted.size() - facts.size());
		metrics.recordStage("extraction", t0);
		Logger.info("Extracted {} facts from {} documents ({} failed)", facts.size(), documents.size(),
				metrics.getFailedDocumentCount());

		t0 = System.nanoTime();
		CorrectionResult corrected = feedback.applyCorrections(facts, patterns);
		List<Fact> correctedFacts = corrected.getFacts().stream()
				.map(f -> f.isCorrectionApplied() ? extractor.renormalize(f) : f).collect(Collectors.toList());
		metrics.setPatternsApplied(corrected.getCorrectionsApplied());
		metrics.recordStage("learning", t0);

		t0 = System.nanoTime();
		TemporalResolution resolution = resolver.resolve(correctedFacts);
		metrics.setTemporalReferencesResolved(resolution.getStats().getResolved());
		metrics.setTemporalConflicts(resolution.getConflicts().size());
		metrics.recordStage("temporal", t0);

		t0 = System.nanoTime();
		Timeline timeline = timelineBuilder.build(resolution.getFacts(), typed);
		metrics.recordStage("timeline", t0);

		t0 = System.nanoTime();
		ValidationResult validation = validator.validate(resolution.getFacts(), timeline, resolution.getConflicts());
		metrics.recordStage("validation", t0);

		Map<FactType, Integer> counts = new EnumMap<>(FactType.class);
		validation.getFacts().forEach(f -> counts.merge(f.getType(), 1, Integer::sum));
		metrics.setFactCountsByType(counts);
		metrics.setTotalFacts(validation.getFacts().size());
		metrics.getUncertaintyCounts().putAll(validation.getCountBySeverity());
		metrics.setCacheHits(hits.get());
		metrics.setCacheMisses(misses.get());

		PipelineResult result = new PipelineResult(validation.getFacts(), timeline, validation.getUncertainties(),
				resolution.getConflicts(), metrics);
		if (metrics.getFailedDocumentCount() == 0) {
			cacheSet(resultKey, result);
		}
		return result;
	}

	/** Counts that describe the result itself; timings and cache counters stay per run. */
	private static void copyContentMetrics(ProcessingMetrics from, ProcessingMetrics to) {
		to.getFailedDocuments().putAll(from.getFailedDocuments());
		to.setTotalFacts(from.getTotalFacts());
		to.getFactCountsByType().putAll(from.getFactCountsByType());
		to.setDuplicatesCollapsed(from.getDuplicatesCollapsed());
		to.setPatternsApplied(from.getPatternsApplied());
		to.setTemporalReferencesResolved(from.getTemporalReferencesResolved());
		to.setTemporalConflicts(from.getTemporalConflicts());
		to.getUncertaintyCounts().putAll(from.getUncertaintyCounts());
	}

	// ---- stages -----------------------------------------------------------------------

	private ClinicalDocument classify(ClinicalDocument doc, AtomicInteger hits, AtomicInteger misses) {
		if (doc.getType() != null && doc.getType() != DocumentType.UNKNOWN)
			return doc;
		String key = CacheKeys.classification(doc);
		Optional<String> cached = cacheGet(key, String.class, hits, misses);
		if (cached.isPresent())
			return doc.toBuilder().type(DocumentType.parse(cached.get())).build();
		ClinicalDocument typed = classifier.withInferredType(doc);
		cacheSet(key, typed.getTypeOrUnknown().name());
		return typed;
	}

	private List<ExtractionOutcome> extractAll(List<ClinicalDocument> documents, AtomicInteger hits,
			AtomicInteger misses) {
		List<Callable<ExtractionOutcome>> tasks = new ArrayList<>(documents.size());
		for (ClinicalDocument doc : documents) {
			tasks.add(() -> extractOne(doc, hits, misses));
		}
		ExecutorService pool = Executors.newFixedThreadPool(Math.min(parallelism, Math.max(1, documents.size())));
		try {
			List<Future<ExtractionOutcome>> futures = pool.invokeAll(tasks);
			List<ExtractionOutcome> out = new ArrayList<>(futures.size());
			for (int i = 0; i < futures.size(); i++) {
				try {
					out.add(futures.get(i).get());
				} catch (ExecutionException e) {
					String id = documents.get(i).getId();
					Logger.error("Extraction task for document {} failed", e.getCause(), id);
					out.add(ExtractionOutcome.failure(id, String.valueOf(e.getCause())));
				}
			}
			return out;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while extracting documents", e);
		} finally {
			pool.shutdownNow();
		}
	}

	private ExtractionOutcome extractOne(ClinicalDocument doc, AtomicInteger hits, AtomicInteger misses) {
		String id = doc == null ? null : doc.getId();
		Logger.setDocument(id);
		try {
			String key = CacheKeys.facts(doc);
			Optional<ExtractionOutcome> cached = cacheGet(key, ExtractionOutcome.class, hits, misses);
			if (cached.isPresent())
				return cached.get();
			ExtractionOutcome outcome = ExtractionOutcome.success(id, extractor.extract(doc));
			cacheSet(key, outcome);
			return outcome;
		} catch (RuntimeException e) {
			Logger.error("Extraction failed for document {}: {}", id, e.getMessage());
			return ExtractionOutcome.failure(id, e.getMessage());
		} finally {
			Logger.clearDocument();
		}
	}

	// ---- cache -------------------------------------------------------------------------

	private <T> Optional<T> cacheGet(String key, Class<T> type, AtomicInteger hits, AtomicInteger misses) {
		try {
			Optional<T> v = cache.get(key, type);
			(v.isPresent() ? hits : misses).incrementAndGet();
			return v;
		} catch (RuntimeException e) {
			Logger.warn("Cache read failed for {}: {}", key, e.getMessage());
			misses.incrementAndGet();
			return Optional.empty();
		}
	}

	private void cacheSet(String key, Object value) {
		try {
			cache.set(key, value, cacheTtl);
		} catch (RuntimeException e) {
			Logger.warn("Cache write failed for {}: {}", key, e.getMessage());
		}
	}
}
