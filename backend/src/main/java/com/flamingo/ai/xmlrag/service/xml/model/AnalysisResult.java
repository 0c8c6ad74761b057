package com.flamingo.ai.xmlrag.service.xml.model;

/**
 * Classification plus the winning handler's summary.
 *
 * @param classification chosen handler and ranking
 * @param summary complete summary record
 */
public record AnalysisResult(ClassificationResult classification, SummaryRecord summary) {}
