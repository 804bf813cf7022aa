package com.mentionindex.mention;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mentionindex.config.EngineConfig;
import com.mentionindex.document.InMemoryDocumentStore;
import com.mentionindex.model.FileKind;
import com.mentionindex.model.FileMentionCount;
import com.mentionindex.model.MentionCount;
import com.mentionindex.model.MentionRanking;
import com.mentionindex.model.MentionType;
import com.mentionindex.model.PersonRecord;
import com.mentionindex.parser.DefinitionDocumentParser;
import com.mentionindex.parser.DefinitionLoader;
import com.mentionindex.scan.LineScanner;
import com.mentionindex.search.SearchIndex;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MentionCounterTest {

    private static final Instant NOW = Instant.parse("2026-01-15T09:30:00Z");

    private InMemoryDocumentStore store;
    private ManualTaskScheduler scheduler;
    private EngineConfig config;
    private List<PersonRecord> people;

    @BeforeEach
    void setUp() {
        store = new InMemoryDocumentStore()
            .put("companies/Acme.md",
                "---\ndef-type: consolidated\n---\n# John Smith\nPosition: Engineer\n\nWorks with Jane Doe.\n---\n")
            .put("companies/Globex.md",
                "---\nmetadata-type: consolidated\n---\n# John Smith\n---\n# Jane Doe\n---\n")
            .put("notes/meeting.md", "Met John Smith today.\n\n- [ ] Jane Doe to follow up\n")
            .put("notes/empty.md", "nothing relevant\n");
        scheduler = new ManualTaskScheduler();
        config = EngineConfig.defaults();
        people = new DefinitionLoader(store, new DefinitionDocumentParser(config)).loadMarkedDocuments();
    }

    @Test
    @DisplayName("同一人在两个公司文档中定义，只被提及一次时计数为 1")
    void testSamePersonInTwoCompaniesCountsOnce() {
        assertEquals(3, people.size());
        MentionCounter counter = newCounter();

        counter.performFullScan(people);

        MentionCount john = counter.getMentionCount("John Smith").orElseThrow();
        assertEquals(1, john.totalMentions());
        assertEquals(1, john.textMentions());
        assertEquals(0, john.taskMentions());
        assertEquals("John Smith", john.fullName());
        assertEquals(NOW, john.lastUpdated());
        assertEquals(2, counter.getAllMentionCounts().size());
    }

    @Test
    @DisplayName("定义文档正文中的姓名不计入提及")
    void testDefinitionDocumentsAreSkipped() {
        MentionCounter counter = newCounter();

        counter.performFullScan(people);

        MentionCount jane = counter.getMentionCount("jane doe").orElseThrow();
        assertEquals(1, jane.totalMentions());
        assertEquals(1, jane.taskMentions());
        assertEquals(List.of("notes/meeting.md"), new ArrayList<>(jane.mentionsByDocument().keySet()));
        FileMentionCount perFile = jane.mentionsByDocument().get("notes/meeting.md");
        assertEquals(0, perFile.textMentions());
        assertEquals(1, perFile.taskMentions());
        assertEquals(NOW, perFile.lastScanned());
    }

    @Test
    void testStatsAfterFullScan() {
        MentionCounter counter = newCounter();
        assertEquals(MentionCountingStats.EMPTY, counter.getStats());

        counter.performFullScan(people);

        MentionCountingStats stats = counter.getStats();
        assertEquals(2, stats.totalFilesScanned());
        assertEquals(1, stats.filesWithMentions());
        assertEquals(2, stats.totalMentionsFound());
        assertEquals(NOW, stats.lastFullScan());
        assertTrue(stats.averageScanTimeMs() >= 0.0);
    }

    @Test
    @DisplayName("单个文档读取失败不影响其余文档")
    void testReadFailureSkipsOnlyThatDocument() {
        store.put("notes/broken.md", "John Smith again");
        store.failOn("notes/broken.md");
        MentionCounter counter = newCounter();

        counter.performFullScan(people);

        assertEquals(1, counter.getMentionCount("John Smith").orElseThrow().totalMentions());
        assertEquals(2, counter.getStats().totalFilesScanned());
    }

    @Test
    void testFullScanReplacesPreviousCounts() {
        MentionCounter counter = newCounter();

        counter.performFullScan(people);
        counter.performFullScan(people);

        assertEquals(1, counter.getMentionCount("John Smith").orElseThrow().totalMentions());
    }

    @Test
    void testKnownPersonWithoutMentionsHasZeroCount() {
        List<PersonRecord> withExtra = new ArrayList<>(people);
        withExtra.add(new PersonRecord("Alice Wong", "", "", "", "x.md", "x.md#Alice Wong",
            FileKind.CONSOLIDATED, null, "", "", "", ""));
        MentionCounter counter = newCounter();

        counter.performFullScan(withExtra);

        MentionCount alice = counter.getMentionCount("alice wong").orElseThrow();
        assertEquals(0, alice.totalMentions());
        assertTrue(alice.mentionsByDocument().isEmpty());
        assertTrue(counter.getMentionCount("Nobody").isEmpty());
    }

    @Test
    void testTopMentioned() {
        store.put("notes/more.md", "John Smith and John Smith\n");
        MentionCounter counter = newCounter();
        counter.performFullScan(people);

        assertEquals(List.of(new MentionRanking("John Smith", 3)), counter.getTopMentioned(1));
        assertEquals(List.of(new MentionRanking("John Smith", 3), new MentionRanking("Jane Doe", 1)),
            counter.getTopMentioned(5));
        assertTrue(counter.getTopMentioned(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> counter.getTopMentioned(-1));
    }

    @Test
    void testTopMentionedKeepsRegistrationOrderOnTies() {
        MentionCounter counter = newCounter();
        counter.performFullScan(people);

        assertEquals(List.of(new MentionRanking("John Smith", 1), new MentionRanking("Jane Doe", 1)),
            counter.getTopMentioned(10));
    }

    @Test
    @DisplayName("按行类型区分任务提及与正文提及")
    void testDetectMentionsClassifiesLines() {
        MentionCounter counter = newCounter();

        List<DetectedMention> task = counter.detectMentions("- [ ] John Smith will review the draft", people);
        List<DetectedMention> text = counter.detectMentions("John Smith met John Smith again", people);

        assertEquals(1, task.size());
        assertEquals(MentionType.TASK, task.get(0).type());
        assertEquals(2, text.size());
        assertTrue(text.stream().allMatch(mention -> mention.type() == MentionType.TEXT));
        assertTrue(counter.detectMentions("   ", people).isEmpty());
    }

    @Test
    @DisplayName("增量重扫先扣除文档原有贡献再计入")
    void testIncrementalRescanReplacesDocumentContribution() {
        MentionCounter counter = newCounter();
        counter.performFullScan(people);
        store.put("notes/meeting.md", "John Smith, John Smith\n");

        assertTrue(counter.queueDocumentForScan("notes/meeting.md"));
        assertEquals(1, scheduler.pending());
        scheduler.runPending();

        MentionCount john = counter.getMentionCount("John Smith").orElseThrow();
        assertEquals(2, john.totalMentions());
        assertEquals(2, john.mentionsByDocument().get("notes/meeting.md").textMentions());
        MentionCount jane = counter.getMentionCount("Jane Doe").orElseThrow();
        assertEquals(0, jane.totalMentions());
        assertTrue(jane.mentionsByDocument().isEmpty());
        assertEquals(2, counter.getStats().totalMentionsFound());
        assertEquals(1, counter.getStats().filesWithMentions());
        assertEquals(0, counter.pendingScans());
    }

    @Test
    void testRescanDeletedDocumentRemovesContribution() {
        MentionCounter counter = newCounter();
        counter.performFullScan(people);
        store.remove("notes/meeting.md");

        counter.rescanDocument("notes/meeting.md");

        assertEquals(0, counter.getMentionCount("John Smith").orElseThrow().totalMentions());
        assertEquals(0, counter.getStats().totalMentionsFound());
    }

    @Test
    void testRescanDocumentThatBecameDefinition() {
        MentionCounter counter = newCounter();
        counter.performFullScan(people);
        store.put("notes/meeting.md", "---\ndef-type: atomic\n---\n# John Smith\n");

        counter.rescanDocument("notes/meeting.md");

        assertEquals(0, counter.getMentionCount("John Smith").orElseThrow().totalMentions());
    }

    @Test
    void testRescanReadFailureKeepsPreviousContribution() {
        MentionCounter counter = newCounter();
        counter.performFullScan(people);
        store.failOn("notes/meeting.md");

        counter.rescanDocument("notes/meeting.md");

        assertEquals(1, counter.getMentionCount("John Smith").orElseThrow().totalMentions());
    }

    @Test
    void testRescanBeforeFullScanIsIgnored() {
        MentionCounter counter = newCounter();

        counter.rescanDocument("notes/meeting.md");

        assertTrue(counter.getAllMentionCounts().isEmpty());
    }

    @Test
    @DisplayName("增量队列按批处理并延迟重新调度")
    void testQueueProcessesInBatches() {
        config.setIncrementalBatchSize(2);
        store.put("notes/new.md", "Jane Doe joined\n");
        MentionCounter counter = newCounter();
        counter.performFullScan(people);

        counter.queueDocumentForScan("notes/meeting.md");
        counter.queueDocumentForScan("notes/empty.md");
        counter.queueDocumentForScan("notes/new.md");
        assertEquals(3, counter.pendingScans());
        assertEquals(1, scheduler.pending());
        assertEquals(Duration.ZERO, scheduler.delays().get(0));

        scheduler.runPending();
        assertEquals(1, counter.pendingScans());
        assertEquals(1, scheduler.pending());
        assertEquals(Duration.ofMillis(100), scheduler.delays().get(1));

        scheduler.runPending();
        assertEquals(0, counter.pendingScans());
        assertEquals(0, scheduler.pending());
        assertEquals(2, counter.getMentionCount("Jane Doe").orElseThrow().totalMentions());
    }

    @Test
    @DisplayName("批内单个文档异常不影响其余文档")
    void testQueueSkipsDocumentThatThrows() {
        MentionCounter counter = newCounter();
        counter.performFullScan(people);
        store.rejectAsOutsideRoot("../outside.md");
        store.put("notes/meeting.md", "John Smith, John Smith\n");

        counter.queueDocumentForScan("../outside.md");
        counter.queueDocumentForScan("notes/meeting.md");
        scheduler.runPending();

        assertEquals(0, counter.pendingScans());
        assertEquals(0, scheduler.pending());
        assertEquals(2, counter.getMentionCount("John Smith").orElseThrow().totalMentions());
    }

    @Test
    void testQueueCapacityAndDuplicates() {
        config.setScanQueueCapacity(1);
        MentionCounter counter = newCounter();

        assertTrue(counter.queueDocumentForScan("notes/meeting.md"));
        assertTrue(counter.queueDocumentForScan("notes/meeting.md"));
        assertFalse(counter.queueDocumentForScan("notes/empty.md"));
        assertEquals(1, counter.pendingScans());
    }

    @Test
    void testClearCounts() {
        MentionCounter counter = newCounter();
        counter.performFullScan(people);
        counter.queueDocumentForScan("notes/meeting.md");

        counter.clearCounts();

        assertTrue(counter.getAllMentionCounts().isEmpty());
        assertEquals(MentionCountingStats.EMPTY, counter.getStats());
        assertEquals(0, counter.pendingScans());
    }

    private MentionCounter newCounter() {
        SearchIndex searchIndex = new SearchIndex(config);
        searchIndex.buildIndexes(people);
        LineScanner scanner = new LineScanner(searchIndex, config);
        return new MentionCounter(store, scanner, config, scheduler, Clock.fixed(NOW, ZoneOffset.UTC));
    }
}
