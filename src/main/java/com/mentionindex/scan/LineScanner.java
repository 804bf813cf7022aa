package com.mentionindex.scan;

import com.mentionindex.config.Constants;
import com.mentionindex.config.EngineConfig;
import com.mentionindex.model.PersonRecord;
import com.mentionindex.search.SearchIndex;
import com.mentionindex.text.FuzzyKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * 行扫描器：在一行文本中找出所有已知姓名的整词、大小写不敏感出现。
 *
 * <p>按行长选择策略：短行用检索索引的前缀表，中等长度用词边界正则，长行用模糊键剪枝；
 * 关闭优化时逐姓名线性扫描。各策略结果一致，只是代价不同。
 */
public class LineScanner {
    private static final Logger logger = LoggerFactory.getLogger(LineScanner.class);

    private static final Comparator<Mention> MENTION_ORDER = Comparator
        .comparingInt(Mention::start)
        .thenComparingInt(Mention::end)
        .thenComparing(Mention::canonicalName);

    private final SearchIndex searchIndex;
    private final int shortLineThreshold;
    private final int longLineThreshold;
    private final int lineCacheCapacity;
    private final int metricsHistoryLimit;

    private final LinkedHashMap<LineKey, CachedScan> lineCache = new LinkedHashMap<>();
    private final Deque<ScanMetrics> metrics = new ArrayDeque<>();
    private ScanTargets targets = ScanTargets.EMPTY;

    public LineScanner(SearchIndex searchIndex) {
        this(searchIndex, EngineConfig.defaults());
    }

    public LineScanner(SearchIndex searchIndex, EngineConfig config) {
        this.searchIndex = Objects.requireNonNull(searchIndex, "searchIndex");
        this.shortLineThreshold = config.getShortLineThreshold();
        this.longLineThreshold = config.getLongLineThreshold();
        this.lineCacheCapacity = Math.max(1, config.getLineCacheCapacity());
        this.metricsHistoryLimit = Math.max(1, config.getMetricsHistoryLimit());
    }

    /**
     * 扫描一行。空行或 null 返回空列表。
     *
     * @param records 已知人员；短行与长行策略要求检索索引已由同一组记录构建
     */
    public synchronized List<Mention> scanLine(String line, List<PersonRecord> records, boolean useOptimized) {
        if (line == null || line.isEmpty()) {
            return List.of();
        }
        long startNanos = System.nanoTime();
        refreshTargets(records);

        LineKey key = new LineKey(line, useOptimized);
        CachedScan cached = lineCache.get(key);
        if (cached != null) {
            recordMetrics(cached.strategy(), startNanos, cached.mentions().size(), line.length(), true);
            return cached.mentions();
        }

        ScanStrategy strategy = selectStrategy(line.length(), useOptimized);
        if ((strategy == ScanStrategy.PREFIX_INDEX || strategy == ScanStrategy.FUZZY_KEY)
            && searchIndex.isEmpty() && !targets.isEmpty()) {
            logger.debug("检索索引为空，{} 策略回退为词边界扫描", strategy.label());
            strategy = ScanStrategy.WORD_BOUNDARY;
        }

        List<Mention> found = switch (strategy) {
            case PREFIX_INDEX -> scanWithPrefixIndex(line);
            case WORD_BOUNDARY -> scanWithWordBoundary(line);
            case FUZZY_KEY -> scanWithFuzzyKey(line);
            case LEGACY -> legacyScan(line, records);
        };
        List<Mention> results = deduplicate(found);

        cacheResults(key, new CachedScan(results, strategy));
        recordMetrics(strategy, startNanos, results.size(), line.length(), false);
        return results;
    }

    /**
     * 按行长与优化开关选择策略。
     */
    public ScanStrategy selectStrategy(int lineLength, boolean useOptimized) {
        if (!useOptimized) {
            return ScanStrategy.LEGACY;
        }
        if (lineLength < shortLineThreshold) {
            return ScanStrategy.PREFIX_INDEX;
        }
        if (lineLength < longLineThreshold) {
            return ScanStrategy.WORD_BOUNDARY;
        }
        return ScanStrategy.FUZZY_KEY;
    }

    public synchronized List<ScanMetrics> getPerformanceMetrics() {
        return List.copyOf(metrics);
    }

    public synchronized ScanSummary summary() {
        Map<ScanStrategy, Integer> strategyCounts = new EnumMap<>(ScanStrategy.class);
        for (ScanStrategy strategy : ScanStrategy.values()) {
            strategyCounts.put(strategy, 0);
        }
        if (metrics.isEmpty()) {
            return new ScanSummary(0.0, 0.0, strategyCounts);
        }

        double totalScanTime = 0.0;
        int cacheHits = 0;
        for (ScanMetrics metric : metrics) {
            totalScanTime += metric.scanTimeMs();
            if (metric.cacheHit()) {
                cacheHits++;
            }
            strategyCounts.merge(metric.strategy(), 1, Integer::sum);
        }
        return new ScanSummary(totalScanTime / metrics.size(), (double) cacheHits / metrics.size(), strategyCounts);
    }

    public synchronized int cacheSize() {
        return lineCache.size();
    }

    public synchronized void clearCache() {
        lineCache.clear();
    }

    public synchronized void clearMetrics() {
        metrics.clear();
    }

    private void refreshTargets(List<PersonRecord> records) {
        Objects.requireNonNull(records, "records");
        if (!targets.isBuiltFrom(records)) {
            targets = new ScanTargets(List.copyOf(records));
            lineCache.clear();
        }
    }

    private List<Mention> scanWithPrefixIndex(String line) {
        List<Mention> results = new ArrayList<>();
        for (int start = 0; start < line.length(); start++) {
            if (!WordBoundaries.isWordStart(line, start)) {
                continue;
            }
            String word = line.substring(start, WordBoundaries.wordEnd(line, start)).toLowerCase(Locale.ROOT);
            for (String name : searchIndex.namesWithPrefix(word)) {
                addIfMatches(results, line, start, name, ScanStrategy.PREFIX_INDEX);
            }
        }
        scanIrregularNames(results, line, ScanStrategy.PREFIX_INDEX);
        return results;
    }

    private List<Mention> scanWithWordBoundary(String line) {
        List<Mention> results = new ArrayList<>();
        for (Map.Entry<String, PersonRecord> entry : targets.byName().entrySet()) {
            Matcher matcher = targets.patternFor(entry.getKey()).matcher(line);
            int from = 0;
            while (from <= line.length() && matcher.find(from)) {
                results.add(new Mention(entry.getValue(), matcher.start(), matcher.end(), matcher.group(),
                    ScanStrategy.WORD_BOUNDARY));
                from = matcher.start() + 1;
            }
        }
        return results;
    }

    private List<Mention> scanWithFuzzyKey(String line) {
        List<Mention> results = new ArrayList<>();
        for (int start = 0; start < line.length(); start++) {
            if (!WordBoundaries.isWordStart(line, start)) {
                continue;
            }
            for (int length : targets.nameLengths()) {
                if (start + length > line.length()) {
                    break;
                }
                String candidate = line.substring(start, start + length).toLowerCase(Locale.ROOT);
                for (String name : searchIndex.namesWithFuzzyKey(FuzzyKey.of(candidate))) {
                    String matchText = targets.matchTextFor(name);
                    if (matchText != null && matchText.length() == length) {
                        addIfMatches(results, line, start, name, ScanStrategy.FUZZY_KEY);
                    }
                }
            }
        }
        scanIrregularNames(results, line, ScanStrategy.FUZZY_KEY);
        return results;
    }

    private List<Mention> legacyScan(String line, List<PersonRecord> records) {
        List<Mention> results = new ArrayList<>();
        for (PersonRecord person : records) {
            String name = ScanTargets.matchText(person);
            for (int start : WordBoundaries.findAll(line, name)) {
                results.add(new Mention(person, start, start + name.length(),
                    line.substring(start, start + name.length()), ScanStrategy.LEGACY));
            }
        }
        return results;
    }

    private void scanIrregularNames(List<Mention> results, String line, ScanStrategy strategy) {
        for (String name : targets.irregularNames()) {
            String matchText = targets.matchTextFor(name);
            for (int start : WordBoundaries.findAll(line, matchText)) {
                results.add(new Mention(targets.recordFor(name), start, start + matchText.length(),
                    line.substring(start, start + matchText.length()), strategy));
            }
        }
    }

    private void addIfMatches(List<Mention> results, String line, int start, String name, ScanStrategy strategy) {
        PersonRecord person = targets.recordFor(name);
        if (person == null) {
            return;
        }
        String matchText = targets.matchTextFor(name);
        if (WordBoundaries.matchesAt(line, start, matchText)) {
            results.add(new Mention(person, start, start + matchText.length(),
                line.substring(start, start + matchText.length()), strategy));
        }
    }

    /**
     * 同一规范化姓名在同一位置只保留一次；不同姓名的重叠出现全部保留。
     */
    private List<Mention> deduplicate(List<Mention> mentions) {
        Set<String> seen = new HashSet<>();
        List<Mention> unique = new ArrayList<>(mentions.size());
        for (Mention mention : mentions) {
            if (seen.add(mention.canonicalName() + '\u0000' + mention.start() + ':' + mention.end())) {
                unique.add(mention);
            }
        }
        unique.sort(MENTION_ORDER);
        return List.copyOf(unique);
    }

    private void cacheResults(LineKey key, CachedScan scan) {
        if (lineCache.size() >= lineCacheCapacity) {
            Iterator<LineKey> iterator = lineCache.keySet().iterator();
            int evicted = 0;
            while (iterator.hasNext() && evicted < Constants.LINE_CACHE_EVICTION_BATCH) {
                iterator.next();
                iterator.remove();
                evicted++;
            }
        }
        lineCache.put(key, scan);
    }

    private void recordMetrics(ScanStrategy strategy, long startNanos, int matchesFound, int lineLength, boolean cacheHit) {
        double scanTimeMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        metrics.addLast(new ScanMetrics(strategy, scanTimeMs, matchesFound, lineLength, cacheHit));
        while (metrics.size() > metricsHistoryLimit) {
            metrics.removeFirst();
        }
    }

    /**
     * 缓存键区分优化与线性扫描，两者记录的策略不同。
     */
    private record LineKey(String line, boolean optimized) {
    }

    private record CachedScan(List<Mention> mentions, ScanStrategy strategy) {
    }
}
