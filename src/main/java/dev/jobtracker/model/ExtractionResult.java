package dev.jobtracker.model;

import java.util.List;

/**
 * Output of the extraction step for one page.
 *
 * @param candidates postings that passed validation, in extraction order
 * @param dropped    raw entries discarded because they had no usable title
 * @param truncated  whether the submitted content was cut to the byte ceiling
 */
public record ExtractionResult(List<CandidatePosting> candidates, int dropped, boolean truncated) {

    public ExtractionResult {
        candidates = List.copyOf(candidates);
    }
}
