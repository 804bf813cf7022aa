package com.mentionindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mentionindex.config.Constants;
import com.mentionindex.config.DividerConfig;
import com.mentionindex.config.EngineConfig;
import com.mentionindex.document.DocumentStore;
import com.mentionindex.document.FileSystemDocumentStore;
import com.mentionindex.mention.ExecutorTaskScheduler;
import com.mentionindex.mention.MentionCounter;
import com.mentionindex.mention.MentionCountingStats;
import com.mentionindex.model.MentionRanking;
import com.mentionindex.model.PersonRecord;
import com.mentionindex.parser.DefinitionDocumentParser;
import com.mentionindex.parser.DefinitionLoader;
import com.mentionindex.scan.LineScanner;
import com.mentionindex.scan.ScanSummary;
import com.mentionindex.search.SearchIndex;
import com.mentionindex.search.SearchStats;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "mention-index",
    description = "👥 人员定义解析、姓名检索与提及统计",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.ParseSubcommand.class,
        MainCommand.SearchSubcommand.class,
        MainCommand.ScanSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--divider"}, description = "分隔行类型 (dash|underscore|both)", defaultValue = "dash")
    private String divider;

    @Option(names = {"--short-line"}, description = "短行阈值（字符数）", defaultValue = "200")
    private int shortLineThreshold;

    @Option(names = {"--long-line"}, description = "长行阈值（字符数）", defaultValue = "1000")
    private int longLineThreshold;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("👥 人员定义解析、姓名检索与提及统计");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    EngineConfig buildConfig() {
        EngineConfig config = EngineConfig.defaults();
        config.setDividerConfig(resolveDividers());
        if (shortLineThreshold <= 0 || longLineThreshold < shortLineThreshold) {
            System.err.printf("⚠️ 行长阈值 %d/%d 非法，已回退为默认值 %d/%d%n", shortLineThreshold, longLineThreshold,
                Constants.SHORT_LINE_THRESHOLD, Constants.LONG_LINE_THRESHOLD);
        } else {
            config.setShortLineThreshold(shortLineThreshold);
            config.setLongLineThreshold(longLineThreshold);
        }
        return config;
    }

    private DividerConfig resolveDividers() {
        String value = divider == null ? "dash" : divider.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "underscore" -> new DividerConfig(false, true);
            case "both" -> new DividerConfig(true, true);
            case "dash" -> DividerConfig.defaults();
            default -> {
                System.err.printf("⚠️ 未知分隔行类型 %s，已使用 dash%n", divider);
                yield DividerConfig.defaults();
            }
        };
    }

    private static int sanitizeLimit(int rawLimit) {
        if (rawLimit < 0) {
            System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
            return 0;
        }
        if (rawLimit > Constants.MAX_SEARCH_LIMIT) {
            System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_SEARCH_LIMIT);
            return Constants.MAX_SEARCH_LIMIT;
        }
        return rawLimit;
    }

    private static void printJson(Object value) throws IOException {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    }

    private static void printRecords(List<PersonRecord> records) {
        if (records.isEmpty()) {
            System.out.println("⚠️ 未找到人员记录");
            return;
        }
        int rank = 1;
        for (PersonRecord record : records) {
            System.out.println("─────────────────────────────────");
            System.out.printf("%d. %s%n", rank++, record.fullName());
            if (!record.position().isEmpty()) {
                System.out.println("   职位: " + record.position());
            }
            if (!record.department().isEmpty()) {
                System.out.println("   部门: " + record.department());
            }
            if (!record.companyName().isEmpty()) {
                System.out.println("   公司: " + record.companyName());
            }
            String location = record.sourceLineRange() == null
                ? record.sourceFileId()
                : record.sourceFileId() + ":" + (record.sourceLineRange().from() + 1) + "-" + (record.sourceLineRange().to() + 1);
            System.out.println("   来源: " + location);
        }
    }

    @Command(name = "parse", description = "📄 解析单个定义文档")
    static class ParseSubcommand implements Callable<Integer> {

        @Parameters(description = "定义文档路径", arity = "1")
        private Path file;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                String content = Files.readString(file, StandardCharsets.UTF_8);
                DefinitionDocumentParser parser = new DefinitionDocumentParser(main.buildConfig());
                List<PersonRecord> records = parser.parseDocument(file.getFileName().toString(), content);

                if ("json".equalsIgnoreCase(format)) {
                    printJson(records);
                } else {
                    printRecords(records);
                    System.out.println();
                    System.out.println("📊 共解析 " + records.size() + " 条人员记录");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 解析失败: " + exception.getMessage());
                return 1;
            }
        }
    }

    @Command(name = "search", description = "🔎 在定义目录中检索人员")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(index = "0", description = "定义文档目录")
        private Path definitionsDir;

        @Parameters(index = "1", description = "查询内容")
        private String query;

        @Option(names = {"-m", "--mode"}, description = "检索方式 (name|prefix|fuzzy|company|fulltext|contains)",
            defaultValue = "fulltext")
        private String mode;

        @Option(names = {"-l", "--limit"}, description = "返回结果数量限制，全文检索缺省为 20，其余模式缺省为 10")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.buildConfig();
                int effectiveLimit = sanitizeLimit(limit == null ? defaultLimit(config) : limit);
                DocumentStore store = new FileSystemDocumentStore(definitionsDir);
                List<PersonRecord> people = new DefinitionLoader(store, new DefinitionDocumentParser(config))
                    .loadAllDocuments();

                SearchIndex searchIndex = new SearchIndex(config);
                searchIndex.buildIndexes(people);

                long start = System.currentTimeMillis();
                List<PersonRecord> results = runQuery(searchIndex, effectiveLimit);
                long elapsed = System.currentTimeMillis() - start;

                if ("json".equalsIgnoreCase(format)) {
                    printJson(results);
                } else {
                    System.out.println("🔍 查询: \"" + query + "\" (" + mode + ")");
                    System.out.println();
                    printRecords(results);
                    System.out.println();
                    SearchStats stats = searchIndex.getStats();
                    System.out.println("📊 共 " + results.size() + " 条结果，索引 " + stats.totalPeople()
                        + " 人，用时 " + elapsed + "ms");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 检索失败: " + exception.getMessage());
                return 1;
            }
        }

        private int defaultLimit(EngineConfig config) {
            return "fulltext".equalsIgnoreCase(mode) ? Constants.DEFAULT_FULL_TEXT_LIMIT : config.getQueryLimit();
        }

        private List<PersonRecord> runQuery(SearchIndex searchIndex, int safeLimit) {
            String safeMode = mode == null ? "fulltext" : mode.toLowerCase(Locale.ROOT);
            return switch (safeMode) {
                case "name" -> searchIndex.findByName(query);
                case "company" -> searchIndex.findByCompany(query);
                case "prefix" -> searchIndex.findByPrefix(query, safeLimit);
                case "fuzzy" -> searchIndex.findFuzzy(query, safeLimit);
                case "contains" -> searchIndex.findContaining(query, safeLimit);
                case "fulltext" -> searchIndex.searchFullText(query, safeLimit);
                default -> throw new IllegalArgumentException("未知检索方式: " + mode);
            };
        }
    }

    @Command(name = "scan", description = "📊 统计语料中的人员提及")
    static class ScanSubcommand implements Callable<Integer> {

        @Parameters(description = "笔记目录", arity = "1")
        private Path vaultDir;

        @Option(names = {"--defs"}, description = "定义文档目录，缺省时使用笔记目录中带类型标记的文档")
        private Path definitionsDir;

        @Option(names = {"-t", "--top"}, description = "输出提及最多的人数", defaultValue = "10")
        private int top;

        @Option(names = {"--legacy"}, description = "关闭优化扫描，逐姓名线性匹配", defaultValue = "false")
        private boolean legacy;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            EngineConfig config = main.buildConfig();
            config.setOptimizedScan(!legacy);
            DocumentStore vault = new FileSystemDocumentStore(vaultDir);
            DefinitionDocumentParser parser = new DefinitionDocumentParser(config);

            try (ExecutorTaskScheduler scheduler = new ExecutorTaskScheduler()) {
                List<PersonRecord> people = definitionsDir == null
                    ? new DefinitionLoader(vault, parser).loadMarkedDocuments()
                    : new DefinitionLoader(new FileSystemDocumentStore(definitionsDir), parser).loadAllDocuments();

                SearchIndex searchIndex = new SearchIndex(config);
                searchIndex.buildIndexes(people);
                LineScanner scanner = new LineScanner(searchIndex, config);
                MentionCounter counter = new MentionCounter(vault, scanner, config, scheduler);

                counter.performFullScan(people);
                MentionCountingStats stats = counter.getStats();
                List<MentionRanking> ranking = counter.getTopMentioned(sanitizeLimit(top));

                if ("json".equalsIgnoreCase(format)) {
                    printJson(new ScanReport(stats, ranking, scanner.summary()));
                } else {
                    printTextReport(people.size(), stats, ranking);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 扫描失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextReport(int peopleCount, MentionCountingStats stats, List<MentionRanking> ranking) {
            System.out.println("✅ 扫描完成！");
            System.out.println("📊 统计:");
            System.out.println("   人员数: " + peopleCount);
            System.out.println("   扫描文档: " + stats.totalFilesScanned());
            System.out.println("   含提及文档: " + stats.filesWithMentions());
            System.out.println("   提及总数: " + stats.totalMentionsFound());
            System.out.printf("   平均每文档: %.2fms%n", stats.averageScanTimeMs());
            System.out.println();

            if (ranking.isEmpty()) {
                System.out.println("⚠️ 没有可排名的人员");
                return;
            }
            System.out.println("🏆 提及排行");
            int rank = 1;
            for (MentionRanking entry : ranking) {
                System.out.printf("%d. %s: %d%n", rank++, entry.fullName(), entry.count());
            }
        }
    }

    public record ScanReport(MentionCountingStats stats, List<MentionRanking> topMentioned, ScanSummary scanner) {
    }
}
