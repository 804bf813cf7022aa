package com.mentionindex.mention;

import com.mentionindex.config.EngineConfig;
import com.mentionindex.document.DefinitionMarker;
import com.mentionindex.document.DocumentMetadata;
import com.mentionindex.document.DocumentStore;
import com.mentionindex.model.MentionCount;
import com.mentionindex.model.MentionRanking;
import com.mentionindex.model.MentionType;
import com.mentionindex.model.PersonRecord;
import com.mentionindex.parser.DefinitionBlockParser;
import com.mentionindex.scan.LineScanner;
import com.mentionindex.scan.Mention;
import com.mentionindex.text.NameNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 语料级提及计数。
 *
 * <p>全量扫描整体替换计数表；同一规范化姓名的多条记录共用一个计数桶。
 * 增量重扫先扣除文档此前的贡献再计入新结果，因此依赖一次先行的全量扫描提供人员集合。
 */
public class MentionCounter {
    private static final Logger logger = LoggerFactory.getLogger(MentionCounter.class);

    private final DocumentStore documentStore;
    private final LineScanner scanner;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final boolean optimizedScan;
    private final int batchSize;
    private final Duration rescheduleDelay;
    private final IncrementalScanQueue scanQueue;

    private final Map<String, MentionTally> tallies = new LinkedHashMap<>();
    private List<PersonRecord> knownPeople;
    private MentionCountingStats stats = MentionCountingStats.EMPTY;
    private boolean processingQueue;

    public MentionCounter(DocumentStore documentStore, LineScanner scanner, EngineConfig config,
                          TaskScheduler scheduler) {
        this(documentStore, scanner, config, scheduler, Clock.systemUTC());
    }

    public MentionCounter(DocumentStore documentStore, LineScanner scanner, EngineConfig config,
                          TaskScheduler scheduler, Clock clock) {
        this.documentStore = Objects.requireNonNull(documentStore, "documentStore");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.optimizedScan = config.isOptimizedScan();
        this.batchSize = Math.max(1, config.getIncrementalBatchSize());
        this.rescheduleDelay = Duration.ofMillis(config.getIncrementalDelayMs());
        this.scanQueue = new IncrementalScanQueue(config.getScanQueueCapacity());
    }

    /**
     * 对整个语料执行全量扫描。单个文档读取失败只记录并跳过。
     */
    public synchronized void performFullScan(List<PersonRecord> people) {
        Objects.requireNonNull(people, "people");
        long startNanos = System.nanoTime();
        Instant scanStart = clock.instant();

        tallies.clear();
        knownPeople = List.copyOf(people);
        for (PersonRecord person : knownPeople) {
            tallies.computeIfAbsent(person.canonicalName(),
                name -> new MentionTally(name, person.fullName(), scanStart));
        }

        int filesScanned = 0;
        int filesWithMentions = 0;
        int mentionsFound = 0;
        for (String documentId : documentStore.listDocuments()) {
            Optional<DocumentScan> scanned = scanDocument(documentId);
            if (scanned.isEmpty() || scanned.get().definition()) {
                continue;
            }
            filesScanned++;
            List<DetectedMention> mentions = scanned.get().mentions();
            if (!mentions.isEmpty()) {
                filesWithMentions++;
                mentionsFound += mentions.size();
                addMentions(documentId, mentions);
            }
        }

        double elapsedMs = (System.nanoTime() - startNanos) / 1_000_000.0;
        stats = new MentionCountingStats(filesScanned, mentionsFound, filesWithMentions, clock.instant(),
            filesScanned > 0 ? elapsedMs / filesScanned : 0.0);
        logger.info("全量提及扫描完成: {} 个文档, {} 个文档含提及, 共 {} 次提及, 用时 {}ms",
            filesScanned, filesWithMentions, mentionsFound, String.format("%.1f", elapsedMs));
    }

    /**
     * 检测一行中的提及并按行类型分类，不修改计数。
     */
    public List<DetectedMention> detectMentions(String line, List<PersonRecord> people) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        MentionType type = TaskLines.classify(line);
        List<DetectedMention> detected = new ArrayList<>();
        for (Mention mention : scanner.scanLine(line, people, optimizedScan)) {
            detected.add(new DetectedMention(mention, type));
        }
        return detected;
    }

    public synchronized Optional<MentionCount> getMentionCount(String name) {
        MentionTally tally = tallies.get(NameNormalizer.normalize(name));
        return tally == null ? Optional.empty() : Optional.of(tally.snapshot());
    }

    public synchronized List<MentionCount> getAllMentionCounts() {
        List<MentionCount> counts = new ArrayList<>(tallies.size());
        for (MentionTally tally : tallies.values()) {
            counts.add(tally.snapshot());
        }
        return counts;
    }

    /**
     * 按总提及数降序返回前 {@code limit} 名，计数相同保持首次登记顺序。
     */
    public synchronized List<MentionRanking> getTopMentioned(int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit 不能为负数: " + limit);
        }
        return tallies.values().stream()
            .map(MentionTally::snapshot)
            .sorted(Comparator.comparingInt(MentionCount::totalMentions).reversed())
            .limit(limit)
            .map(count -> new MentionRanking(count.fullName(), count.totalMentions()))
            .toList();
    }

    public synchronized MentionCountingStats getStats() {
        return stats;
    }

    /**
     * 清空计数、统计与待扫描队列。
     */
    public synchronized void clearCounts() {
        tallies.clear();
        knownPeople = null;
        stats = MentionCountingStats.EMPTY;
        scanQueue.clear();
    }

    /**
     * 将文档加入增量扫描队列，队列由空变为非空时安排一次处理。队满时返回 false。
     */
    public synchronized boolean queueDocumentForScan(String documentId) {
        Objects.requireNonNull(documentId, "documentId");
        boolean wasIdle = scanQueue.isEmpty();
        if (!scanQueue.offer(documentId)) {
            logger.warn("增量扫描队列已满，丢弃文档: {}", documentId);
            return false;
        }
        if (wasIdle && !processingQueue) {
            scheduler.schedule(this::processScanQueue, Duration.ZERO);
        }
        return true;
    }

    /**
     * 处理一批待扫描文档；队列仍非空时延迟后再次调度自身。
     */
    public synchronized void processScanQueue() {
        if (processingQueue || scanQueue.isEmpty()) {
            return;
        }
        processingQueue = true;
        try {
            for (String documentId : scanQueue.drain(batchSize)) {
                try {
                    rescanDocument(documentId);
                } catch (RuntimeException e) {
                    logger.warn("增量重扫失败，跳过: {} ({})", documentId, e.getMessage());
                }
            }
        } finally {
            processingQueue = false;
        }
        if (!scanQueue.isEmpty()) {
            scheduler.schedule(this::processScanQueue, rescheduleDelay);
        }
    }

    /**
     * 重扫单个文档：扣除其此前贡献后计入新结果。
     * 定义文档与已删除文档的贡献为零；读取失败时保留原有贡献。
     */
    public synchronized void rescanDocument(String documentId) {
        if (knownPeople == null) {
            logger.debug("尚未执行全量扫描，忽略增量重扫: {}", documentId);
            return;
        }
        Instant now = clock.instant();
        if (!documentStore.exists(documentId)) {
            removeContribution(documentId, now);
            refreshTotals();
            logger.debug("文档已不存在，移除其提及贡献: {}", documentId);
            return;
        }

        Optional<DocumentScan> scanned = scanDocument(documentId);
        if (scanned.isEmpty()) {
            return;
        }
        removeContribution(documentId, now);
        addMentions(documentId, scanned.get().mentions());
        refreshTotals();
        logger.debug("增量重扫完成: {}, {} 次提及", documentId, scanned.get().mentions().size());
    }

    public synchronized int pendingScans() {
        return scanQueue.size();
    }

    /**
     * 扫描单个文档。读取失败返回 empty；定义文档不检测提及。
     */
    private Optional<DocumentScan> scanDocument(String documentId) {
        try {
            DocumentMetadata metadata = documentStore.metadata(documentId);
            if (DefinitionMarker.isDefinitionDocument(metadata)) {
                logger.debug("跳过定义文档: {}", documentId);
                return Optional.of(new DocumentScan(true, List.of()));
            }
            String content = documentStore.read(documentId);
            List<DetectedMention> mentions = new ArrayList<>();
            for (String line : DefinitionBlockParser.splitLines(content)) {
                mentions.addAll(detectMentions(line, knownPeople));
            }
            return Optional.of(new DocumentScan(false, mentions));
        } catch (IOException e) {
            logger.warn("读取文档失败，跳过: {} ({})", documentId, e.getMessage());
            return Optional.empty();
        }
    }

    private void addMentions(String documentId, List<DetectedMention> mentions) {
        Instant now = clock.instant();
        for (DetectedMention detected : mentions) {
            MentionTally tally = tallies.get(detected.canonicalName());
            if (tally != null) {
                tally.add(documentId, detected.type(), now);
            }
        }
    }

    private void removeContribution(String documentId, Instant at) {
        for (MentionTally tally : tallies.values()) {
            tally.removeDocument(documentId, at);
        }
    }

    private void refreshTotals() {
        int mentionsFound = 0;
        Set<String> documentsWithMentions = new HashSet<>();
        for (MentionTally tally : tallies.values()) {
            MentionCount count = tally.snapshot();
            mentionsFound += count.totalMentions();
            documentsWithMentions.addAll(count.mentionsByDocument().keySet());
        }
        stats = new MentionCountingStats(stats.totalFilesScanned(), mentionsFound, documentsWithMentions.size(),
            stats.lastFullScan(), stats.averageScanTimeMs());
    }

    private record DocumentScan(boolean definition, List<DetectedMention> mentions) {
    }
}
