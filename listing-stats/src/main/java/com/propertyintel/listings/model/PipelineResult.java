package com.propertyintel.listings.model;

import java.util.List;

/**
 * Everything a completed run produced: the run metadata and both output tables.
 */
public record PipelineResult(PipelineRun run,
                             List<AggregateRow> aggregates,
                             List<OfferTypeSummary> offerTypeSummaries) {}
