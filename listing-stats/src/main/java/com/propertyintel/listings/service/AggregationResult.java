package com.propertyintel.listings.service;

import com.propertyintel.listings.model.AggregateRow;
import com.propertyintel.listings.model.OfferTypeSummary;

import java.util.List;

public record AggregationResult(List<AggregateRow> rows,
                                List<OfferTypeSummary> offerTypeSummaries,
                                long rowsAggregated,
                                long skippedWithoutYear,
                                long skippedWithoutPrice) {}
