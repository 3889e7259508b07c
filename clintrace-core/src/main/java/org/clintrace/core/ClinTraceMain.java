package org.clintrace.core;

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
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.clintrace.core.conf.ConfigLoader;
import org.clintrace.core.kb.ClinicalKnowledgeBase;
import org.clintrace.core.learning.FeedbackManager;
import org.clintrace.core.learning.LearningSettings;
import org.clintrace.core.om.ClinicalDocument;
import org.clintrace.core.om.PipelineResult;
import org.clintrace.core.om.ProcessingMetrics;
import org.clintrace.core.processing.ClinicalPipeline;
import org.clintrace.core.processing.cache.InMemoryResultCache;
import org.clintrace.core.processing.extract.FactExtractor;
import org.clintrace.core.processing.extract.FallbackExtractionCapability;
import org.clintrace.core.processing.persist.DocumentManifestReader;
import org.clintrace.core.processing.persist.FactCsvCodec;
import org.clintrace.core.processing.persist.PatternCsvCodec;
import org.clintrace.core.processing.persist.ReportCsvWriter;
import org.clintrace.core.util.Logger;

/**
 * Command-line entry point: reads the document manifest named in the
 * configuration, runs the pipeline and writes the CSV reports.
 *
 * Outputs under {@code CSV_OUTPUT_PATH}: facts.csv, uncertainties.csv,
 * timeline.csv, progressions.csv and patterns.csv.
 */
public class ClinTraceMain {

	private final ConfigLoader cfg;
	private final FallbackExtractionCapability fallback;

	public ClinTraceMain() {
		this(new ConfigLoader(), null);
	}

	/**
	 * @param fallback capability used when FALLBACK_ENABLED is set; may be null
	 */
	public ClinTraceMain(ConfigLoader cfg, FallbackExtractionCapability fallback) {
		this.cfg = cfg;
		this.fallback = fallback;
	}

	public static void main(String[] args) {
		ClinTraceMain app = new ClinTraceMain();
		List<String> issues = app.cfg.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error("Configuration: {}", i));
			System.exit(2);
		}
		app.run();
	}

	PipelineResult run() {
		String docPath = cfg.getDocumentPath();
		String outPath = cfg.getCsvOutputPath();
		LearningSettings learning = cfg.getLearningSettings();

		ClinicalKnowledgeBase kb = ClinicalKnowledgeBase.loadDefault();

		FallbackExtractionCapability capability = null;
		if (cfg.isFallbackEnabled()) {
			if (fallback == null) {
				Logger.warn("FALLBACK_ENABLED is set but no fallback capability is configured; running pattern-only");
			} else {
				capability = fallback;
			}
		}
		FactExtractor extractor = new FactExtractor(kb, capability);

		FeedbackManager feedback = new FeedbackManager(learning);
		String patternFile = cfg.getPatternFile();
		try {
			if (StringUtils.isNotBlank(patternFile)) {
				feedback.load(PatternCsvCodec.read(Paths.get(patternFile)));
			}

			List<ClinicalDocument> documents = new DocumentManifestReader(Paths.get(docPath))
					.read(cfg.getDocumentManifest());

			ClinicalPipeline pipeline = new ClinicalPipeline(kb, extractor, feedback, new InMemoryResultCache(),
					cfg.getCacheTtl(), cfg.getParallelDocumentLimit());
			PipelineResult result = pipeline.process(documents);

			Path out = Paths.get(outPath);
			FactCsvCodec.write(result.getFacts(), out.resolve("facts.csv"));
			ReportCsvWriter.writeUncertainties(result.getUncertainties(), out.resolve("uncertainties.csv"));
			ReportCsvWriter.writeTimeline(result.getTimeline(), out.resolve("timeline.csv"));
			ReportCsvWriter.writeProgressions(result.getTimeline(), out.resolve("progressions.csv"));
			PatternCsvCodec.write(feedback.snapshot(), out.resolve("patterns.csv"));

			logSummary(result);
			return result;
		} catch (IOException e) {
			throw new UncheckedIOException("ClinTrace run failed", e);
		}
	}

	private static void logSummary(PipelineResult result) {
		ProcessingMetrics m = result.getMetrics();
		Logger.info("Documents: {} ({} failed)", m.getDocumentCount(), m.getFailedDocumentCount());
		Logger.info("Facts: {} {}", m.getTotalFacts(), m.getFactCountsByType());
		Logger.info("Patterns applied: {}", m.getPatternsApplied());
		Logger.info("Uncertainties: {} {}", result.getUncertainties().size(), m.getUncertaintyCounts());
		Logger.info("Stage timings (ms): {}", m.getStageTimingsMillis());
		if (result.hasBlockingUncertainties()) {
			Logger.warn("Unresolved HIGH-severity uncertainties require review");
		}
		Logger.info("End");
	}
}
