package com.delta.jobfeed.sync.enrich;

import com.delta.jobfeed.sync.model.Classification;

/**
 * Assigns job function, industry and seniority labels to a listing.
 *
 * <p>Implementations report problems through {@link Classification#success()} rather than by throwing;
 * callers treat an unsuccessful classification as "leave the labels blank".
 */
public interface Classifier {

    Classification classify(String title, String description);
}
