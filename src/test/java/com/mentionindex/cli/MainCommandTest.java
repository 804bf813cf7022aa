package com.mentionindex.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.mentionindex.config.DividerConfig;
import com.mentionindex.config.EngineConfig;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import picocli.CommandLine.ParseResult;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private Path definitionsDir;
    private Path vaultDir;

    @BeforeEach
    void setUp() throws Exception {
        definitionsDir = Files.createDirectories(tempDir.resolve("defs"));
        vaultDir = Files.createDirectories(tempDir.resolve("vault"));

        Files.writeString(definitionsDir.resolve("Acme.md"), String.join("\n",
            "---",
            "color: blue",
            "---",
            "# John Smith",
            "Position: Senior Engineer",
            "",
            "Backend lead",
            "---",
            "# Jane Doe",
            "Position: Product Manager",
            "---",
            ""));

        Files.createDirectories(vaultDir.resolve("companies"));
        Files.writeString(vaultDir.resolve("companies/Acme.md"),
            "---\ndef-type: consolidated\n---\n# John Smith\n---\n# Jane Doe\n---\n");
        Files.writeString(vaultDir.resolve("daily.md"),
            "Met John Smith today.\n- [ ] Jane Doe to send notes\nJohn Smith again\n");
    }

    @Test
    void testCallWithoutSubcommand() {
        MainCommand command = new MainCommand();
        assertEquals(0, command.call());
    }

    @Test
    void testHelpOptionReturnsZero() {
        int exitCode = new CommandLine(new MainCommand()).execute("--help");
        assertEquals(0, exitCode);
    }

    @Test
    void testParseGlobalOptionsAndSubcommand() {
        CommandLine commandLine = new CommandLine(new MainCommand());
        ParseResult parseResult = commandLine.parseArgs("--divider", "both", "scan", vaultDir.toString(), "--legacy");

        assertNotNull(parseResult.subcommand());
        assertEquals("scan", parseResult.subcommand().commandSpec().name());
    }

    @Test
    void testBuildConfigFromGlobalOptions() {
        MainCommand command = new MainCommand();
        new CommandLine(command).parseArgs("--divider", "underscore", "--short-line", "50", "--long-line", "500");

        EngineConfig config = command.buildConfig();

        assertEquals(new DividerConfig(false, true), config.getDividerConfig());
        assertEquals(50, config.getShortLineThreshold());
        assertEquals(500, config.getLongLineThreshold());
    }

    @Test
    void testInvalidThresholdsFallBackToDefaults() {
        MainCommand command = new MainCommand();
        new CommandLine(command).parseArgs("--short-line", "500", "--long-line", "100");

        EngineConfig config = command.buildConfig();

        assertEquals(EngineConfig.defaults().getShortLineThreshold(), config.getShortLineThreshold());
        assertEquals(EngineConfig.defaults().getLongLineThreshold(), config.getLongLineThreshold());
    }

    @Test
    void testParseSubcommandText() {
        String output = run(0, "parse", definitionsDir.resolve("Acme.md").toString());

        assertTrue(output.contains("John Smith"));
        assertTrue(output.contains("Senior Engineer"));
        assertTrue(output.contains("Acme.md:4-7"));
        assertTrue(output.contains("共解析 2 条人员记录"));
    }

    @Test
    void testParseSubcommandJson() {
        String output = run(0, "parse", definitionsDir.resolve("Acme.md").toString(), "--format", "json");

        assertTrue(output.contains("\"fullName\""));
        assertTrue(output.contains("\"companyColor\" : \"#0066cc\""));
        assertTrue(output.contains("\"sourceLineRange\""));
    }

    @Test
    void testParseMissingFileReturnsOne() {
        run(1, "parse", tempDir.resolve("missing.md").toString());
    }

    @Test
    void testSearchModes() {
        assertTrue(run(0, "search", definitionsDir.toString(), "jo", "--mode", "prefix").contains("John Smith"));
        assertTrue(run(0, "search", definitionsDir.toString(), "engineer").contains("John Smith"));
        assertTrue(run(0, "search", definitionsDir.toString(), "JANE DOE", "-m", "name").contains("Jane Doe"));
        assertTrue(run(0, "search", definitionsDir.toString(), "acme", "-m", "company").contains("Jane Doe"));
        assertTrue(run(0, "search", definitionsDir.toString(), "zzz", "-m", "fuzzy").contains("未找到人员记录"));
        assertTrue(run(0, "search", definitionsDir.toString(), "ohn", "-m", "contains", "-f", "json")
            .contains("\"fullName\" : \"John Smith\""));
    }

    @Test
    void testSearchDefaultLimitDependsOnMode() throws Exception {
        Path teamDir = Files.createDirectories(tempDir.resolve("team"));
        StringBuilder content = new StringBuilder();
        for (int index = 1; index <= 15; index++) {
            content.append("# Person ").append(index).append("\nPosition: Engineer\n---\n");
        }
        Files.writeString(teamDir.resolve("Team.md"), content.toString());

        assertTrue(run(0, "search", teamDir.toString(), "engineer").contains("共 15 条结果"));
        assertTrue(run(0, "search", teamDir.toString(), "person", "-m", "prefix").contains("共 10 条结果"));
        assertTrue(run(0, "search", teamDir.toString(), "engineer", "-l", "3").contains("共 3 条结果"));
    }

    @Test
    void testSearchUnknownModeReturnsOne() {
        run(1, "search", definitionsDir.toString(), "jo", "--mode", "soundex");
    }

    @Test
    void testScanWithMarkedDefinitions() {
        String output = run(0, "scan", vaultDir.toString());

        assertTrue(output.contains("扫描文档: 1"));
        assertTrue(output.contains("提及总数: 3"));
        assertTrue(output.contains("1. John Smith: 2"));
        assertTrue(output.contains("2. Jane Doe: 1"));
    }

    @Test
    void testScanWithSeparateDefinitionsAndJson() {
        String output = run(0, "scan", vaultDir.toString(), "--defs", definitionsDir.toString(),
            "--legacy", "--top", "1", "--format", "json");

        assertTrue(output.contains("\"topMentioned\""));
        assertTrue(output.contains("\"count\" : 2"));
        assertTrue(output.contains("\"LEGACY\""));
    }

    private static String run(int expectedExitCode, String... args) {
        ByteArrayOutputStream outputBuffer = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        int exitCode;
        try {
            System.setOut(new PrintStream(outputBuffer, true, StandardCharsets.UTF_8));
            exitCode = new CommandLine(new MainCommand()).execute(args);
        } finally {
            System.setOut(originalOut);
        }
        assertEquals(expectedExitCode, exitCode);
        return outputBuffer.toString(StandardCharsets.UTF_8);
    }
}
