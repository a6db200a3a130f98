package com.tessera.search.sort;

import com.tessera.search.api.model.ScoreDetails;
import org.roaringbitmap.RoaringBitmap;

import java.util.List;

/**
 * Result of a bucket sort.
 *
 * @param documentIds      ranked documents of the requested window
 * @param scoreDetails     for each returned document, the scores of the buckets it went through
 * @param candidates       the sorted universe minus the documents dropped by distinct and by the
 *                         ranking score threshold
 * @param bucketCandidates union of the outermost buckets that supplied a returned document,
 *                         restricted to {@code candidates}
 */
public record BucketSortOutput(List<Integer> documentIds, List<List<ScoreDetails>> scoreDetails,
                               RoaringBitmap candidates, RoaringBitmap bucketCandidates) {

    public BucketSortOutput {
        documentIds = List.copyOf(documentIds);
        scoreDetails = List.copyOf(scoreDetails);
    }
}
