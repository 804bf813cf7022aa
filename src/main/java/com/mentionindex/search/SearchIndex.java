package com.mentionindex.search;

import com.mentionindex.config.Constants;
import com.mentionindex.config.EngineConfig;
import com.mentionindex.model.PersonRecord;
import com.mentionindex.scoring.RelevanceScorer;
import com.mentionindex.text.CharBigramTokenizer;
import com.mentionindex.text.FuzzyKey;
import com.mentionindex.text.NameNormalizer;
import com.mentionindex.text.Token;
import com.mentionindex.text.Tokenizer;
import com.mentionindex.text.WordTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 人员记录的多索引检索：精确姓名、公司、前缀、模糊键、双字、全文。
 *
 * <p>索引整体以快照替换，重建与清空不会暴露中间状态。所有查询先查结果缓存。
 */
public class SearchIndex {
    private static final Logger logger = LoggerFactory.getLogger(SearchIndex.class);

    private final Tokenizer wordTokenizer;
    private final Tokenizer bigramTokenizer;
    private final RelevanceScorer scorer;
    private final ResultCache<String, List<PersonRecord>> cache;

    private volatile IndexSnapshot snapshot = IndexSnapshot.EMPTY;
    private long cacheHits;
    private long cacheMisses;

    public SearchIndex() {
        this(Constants.SEARCH_CACHE_CAPACITY);
    }

    public SearchIndex(EngineConfig config) {
        this(config.getSearchCacheCapacity());
    }

    public SearchIndex(int cacheCapacity) {
        this.wordTokenizer = new WordTokenizer();
        this.bigramTokenizer = new CharBigramTokenizer();
        this.scorer = new RelevanceScorer(wordTokenizer);
        this.cache = new ResultCache<>(cacheCapacity);
    }

    /**
     * 以给定记录完整替换全部索引，同时清空缓存与计数。
     */
    public synchronized void buildIndexes(Collection<PersonRecord> records) {
        long startNanos = System.nanoTime();
        IndexSnapshot built = new IndexSnapshot();
        for (PersonRecord record : records) {
            addRecord(built, record);
        }
        built.buildTimeMs = (System.nanoTime() - startNanos) / 1_000_000;

        snapshot = built;
        cache.clear();
        cacheHits = 0;
        cacheMisses = 0;
        logger.debug("索引重建完成: {} 条记录, {} 个姓名, 用时 {}ms",
            built.totalPeople, built.nameIndex.size(), built.buildTimeMs);
    }

    public synchronized List<PersonRecord> findByName(String name) {
        String normalizedName = NameNormalizer.normalize(name);
        return cachedLookup("name:" + normalizedName,
            () -> snapshot.nameIndex.getOrDefault(normalizedName, List.of()));
    }

    public synchronized List<PersonRecord> findByCompany(String company) {
        String normalizedCompany = NameNormalizer.normalize(company);
        return cachedLookup("company:" + normalizedCompany,
            () -> snapshot.companyIndex.getOrDefault(normalizedCompany, List.of()));
    }

    /**
     * 姓名以给定前缀开头的记录，最多 {@code limit} 条。
     */
    public synchronized List<PersonRecord> findByPrefix(String prefix, int limit) {
        String normalizedPrefix = NameNormalizer.normalize(prefix);
        requireLimit(limit);
        IndexSnapshot current = snapshot;
        return cachedLookup("prefix:" + normalizedPrefix + ":" + limit,
            () -> collectRecords(current, current.prefixIndex.getOrDefault(normalizedPrefix, Set.of()), limit));
    }

    /**
     * 与查询共享模糊键的记录，最多 {@code limit} 条。
     */
    public synchronized List<PersonRecord> findFuzzy(String query, int limit) {
        String normalizedQuery = NameNormalizer.normalize(query);
        requireLimit(limit);
        IndexSnapshot current = snapshot;
        String fuzzyKey = FuzzyKey.of(normalizedQuery);
        return cachedLookup("fuzzy:" + normalizedQuery + ":" + limit,
            () -> collectRecords(current, current.fuzzyIndex.getOrDefault(fuzzyKey, Set.of()), limit));
    }

    /**
     * 姓名包含给定片段的记录，借助双字索引求交集后再校验。
     */
    public synchronized List<PersonRecord> findContaining(String fragment, int limit) {
        String normalizedFragment = NameNormalizer.normalize(fragment);
        requireLimit(limit);
        IndexSnapshot current = snapshot;
        return cachedLookup("contains:" + normalizedFragment + ":" + limit,
            () -> collectRecords(current, namesContaining(current, normalizedFragment), limit));
    }

    /**
     * 按姓名、公司、职位、部门加权评分的全文检索。
     *
     * @throws NullPointerException 查询为 null
     */
    public synchronized List<PersonRecord> searchFullText(String query, int limit) {
        Objects.requireNonNull(query, "query");
        requireLimit(limit);
        List<String> words = wordTokenizer.terms(NameNormalizer.normalize(query));
        IndexSnapshot current = snapshot;
        return cachedLookup("fulltext:" + String.join("+", words) + ":" + limit,
            () -> rankFullText(current, words, limit));
    }

    /**
     * 前缀索引原始视图，供行扫描器剪枝候选姓名。
     */
    public Set<String> namesWithPrefix(String normalizedPrefix) {
        return Collections.unmodifiableSet(snapshot.prefixIndex.getOrDefault(normalizedPrefix, Set.of()));
    }

    /**
     * 模糊键索引原始视图，供行扫描器剪枝候选姓名。
     */
    public Set<String> namesWithFuzzyKey(String fuzzyKey) {
        return Collections.unmodifiableSet(snapshot.fuzzyIndex.getOrDefault(fuzzyKey, Set.of()));
    }

    public Set<String> getAllNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(snapshot.nameIndex.keySet()));
    }

    public Set<String> getAllCompanies() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(snapshot.companyIndex.keySet()));
    }

    public boolean isEmpty() {
        return snapshot.nameIndex.isEmpty();
    }

    /**
     * 清空全部索引、缓存与计数。
     */
    public synchronized void clear() {
        snapshot = IndexSnapshot.EMPTY;
        cache.clear();
        cacheHits = 0;
        cacheMisses = 0;
    }

    public synchronized SearchStats getStats() {
        IndexSnapshot current = snapshot;
        long totalRequests = cacheHits + cacheMisses;
        return new SearchStats(
            current.totalPeople,
            current.companyIndex.size(),
            cacheHits,
            cacheMisses,
            totalRequests > 0 ? (double) cacheHits / totalRequests : 0.0,
            new SearchStats.IndexSizes(
                current.nameIndex.size(),
                current.companyIndex.size(),
                current.fullTextIndex.size(),
                current.prefixIndex.size(),
                current.fuzzyIndex.size(),
                current.bigramIndex.size()
            ),
            current.buildTimeMs
        );
    }

    private void addRecord(IndexSnapshot target, PersonRecord record) {
        String normalizedName = record.canonicalName();
        target.nameIndex.computeIfAbsent(normalizedName, key -> new ArrayList<>()).add(record);

        String normalizedCompany = NameNormalizer.normalize(record.companyName());
        if (!normalizedCompany.isEmpty()) {
            target.companyIndex.computeIfAbsent(normalizedCompany, key -> new ArrayList<>()).add(record);
        }

        indexWords(target, normalizedName, normalizedName);
        indexWords(target, NameNormalizer.normalize(record.position()), normalizedName);
        indexWords(target, NameNormalizer.normalize(record.department()), normalizedName);

        for (int end = 1; end <= normalizedName.length(); end++) {
            addToSet(target.prefixIndex, normalizedName.substring(0, end), normalizedName);
        }
        addToSet(target.fuzzyIndex, FuzzyKey.of(normalizedName), normalizedName);
        for (Token bigram : bigramTokenizer.tokenize(normalizedName)) {
            addToSet(target.bigramIndex, bigram.term(), normalizedName);
        }
        target.totalPeople++;
    }

    private void indexWords(IndexSnapshot target, String text, String owner) {
        for (String word : wordTokenizer.terms(text)) {
            addToSet(target.fullTextIndex, word, owner);
        }
    }

    private List<PersonRecord> rankFullText(IndexSnapshot current, List<String> words, int limit) {
        Set<String> candidateNames = new LinkedHashSet<>();
        for (String word : words) {
            candidateNames.addAll(current.fullTextIndex.getOrDefault(word, Set.of()));
        }

        List<ScoredRecord> scored = new ArrayList<>();
        for (String name : candidateNames) {
            for (PersonRecord person : current.nameIndex.getOrDefault(name, List.of())) {
                int score = scorer.score(person, words);
                if (score > 0) {
                    scored.add(new ScoredRecord(person, score));
                }
            }
        }
        scored.sort(Comparator.comparingInt(ScoredRecord::score).reversed());
        return scored.stream().limit(limit).map(ScoredRecord::person).toList();
    }

    private Set<String> namesContaining(IndexSnapshot current, String fragment) {
        if (fragment.isEmpty()) {
            return Set.of();
        }
        if (fragment.length() == 1) {
            Set<String> matches = new LinkedHashSet<>();
            for (String name : current.nameIndex.keySet()) {
                if (name.contains(fragment)) {
                    matches.add(name);
                }
            }
            return matches;
        }

        Set<String> candidates = null;
        for (Token bigram : bigramTokenizer.tokenize(fragment)) {
            Set<String> names = current.bigramIndex.getOrDefault(bigram.term(), Set.of());
            if (candidates == null) {
                candidates = new LinkedHashSet<>(names);
            } else {
                candidates.retainAll(names);
            }
            if (candidates.isEmpty()) {
                return Set.of();
            }
        }
        candidates.removeIf(name -> !name.contains(fragment));
        return candidates;
    }

    private List<PersonRecord> collectRecords(IndexSnapshot current, Set<String> names, int limit) {
        List<PersonRecord> results = new ArrayList<>();
        for (String name : names) {
            for (PersonRecord person : current.nameIndex.getOrDefault(name, List.of())) {
                if (results.size() >= limit) {
                    return results;
                }
                results.add(person);
            }
        }
        return results;
    }

    private List<PersonRecord> cachedLookup(String cacheKey, Supplier<List<PersonRecord>> lookup) {
        List<PersonRecord> cached = cache.get(cacheKey).orElse(null);
        if (cached != null) {
            cacheHits++;
            return cached;
        }
        List<PersonRecord> result = List.copyOf(lookup.get());
        cache.put(cacheKey, result);
        cacheMisses++;
        return result;
    }

    private static void requireLimit(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit 不能为负数: " + limit);
        }
    }

    private static void addToSet(Map<String, Set<String>> index, String key, String value) {
        index.computeIfAbsent(key, ignored -> new LinkedHashSet<>()).add(value);
    }

    private record ScoredRecord(PersonRecord person, int score) {
    }

    private static final class IndexSnapshot {
        static final IndexSnapshot EMPTY = new IndexSnapshot();

        final Map<String, List<PersonRecord>> nameIndex = new LinkedHashMap<>();
        final Map<String, List<PersonRecord>> companyIndex = new LinkedHashMap<>();
        final Map<String, Set<String>> fullTextIndex = new LinkedHashMap<>();
        final Map<String, Set<String>> prefixIndex = new LinkedHashMap<>();
        final Map<String, Set<String>> fuzzyIndex = new LinkedHashMap<>();
        final Map<String, Set<String>> bigramIndex = new LinkedHashMap<>();
        int totalPeople;
        long buildTimeMs;
    }
}
