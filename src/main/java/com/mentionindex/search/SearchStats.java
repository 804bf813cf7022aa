package com.mentionindex.search;

public record SearchStats(
        int totalPeople,
        int totalCompanies,
        long cacheHits,
        long cacheMisses,
        double cacheHitRate,
        IndexSizes indexSizes,
        long indexBuildTimeMs
) {

    public record IndexSizes(
            int names,
            int companies,
            int fullText,
            int prefixes,
            int fuzzy,
            int bigrams
    ) {
    }
}
