package com.tessera.search.sort;

import com.tessera.search.api.index.IndexSnapshot;
import org.roaringbitmap.RoaringBitmap;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Keeps at most one document per value of a facet field.
 *
 * <p>Documents are visited in ascending id order; a document is kept unless it shares a
 * value with a document kept before it. Every other document of the index holding a
 * value of a kept document is excluded. Documents without the field are always kept.
 */
final class DistinctFilter {

    /**
     * @param remaining documents of the input that were kept
     * @param excluded  documents of the whole index that must no longer be returned
     */
    record Output(RoaringBitmap remaining, RoaringBitmap excluded) {
    }

    private final List<RoaringBitmap> valueDocids = new ArrayList<>();

    DistinctFilter(IndexSnapshot index, String field) {
        Objects.requireNonNull(field, "field cannot be null");
        valueDocids.addAll(index.stringFacetDocids(field).values());
        valueDocids.addAll(index.numberFacetDocids(field).values());
    }

    Output apply(RoaringBitmap candidates) {
        RoaringBitmap remaining = new RoaringBitmap();
        RoaringBitmap excluded = new RoaringBitmap();
        for (int docid : candidates) {
            if (excluded.contains(docid)) {
                continue;
            }
            remaining.add(docid);
            for (RoaringBitmap docids : valueDocids) {
                if (docids.contains(docid)) {
                    excluded.or(docids);
                }
            }
        }
        excluded.andNot(remaining);
        return new Output(remaining, excluded);
    }
}
