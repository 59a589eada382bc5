package com.lingplug.cli;

import com.lingplug.cli.sample.EchoPlugin;
import com.lingplug.cli.sample.ShoutPlugin;
import com.lingplug.core.config.LingPlugConfig;
import com.lingplug.core.metadata.Distribution;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LingPlugCli 单元测试")
class LingPlugCliTest {

    private static final String ECHO = EchoPlugin.class.getName();
    private static final String SHOUT = ShoutPlugin.class.getName();

    @TempDir
    Path workdir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        LingPlugConfig.init(LingPlugConfig.builder().cacheEnabled(false).build());
    }

    @AfterEach
    void tearDown() {
        LingPlugConfig.clear();
    }

    private int run(String... args) {
        Terminal terminal = new Terminal(new PrintWriter(out, true), new PrintWriter(err, true));
        return new LingPlugCli().main(args, terminal);
    }

    private static String testClassesDir() throws Exception {
        return Paths.get(EchoPlugin.class.getProtectionDomain().getCodeSource().getLocation().toURI()).toString();
    }

    private void writeConfig(String mode) throws Exception {
        Files.writeString(workdir.resolve("lingplug.yml"),
                "path: '" + testClassesDir().replace('\\', '/') + "'\n"
                        + "include: ['com.lingplug.cli.sample.*']\n"
                        + "entrypointBuildMode: " + mode + "\n");
    }

    @Nested
    @DisplayName("参数处理")
    class UsageTests {

        @Test
        @DisplayName("缺少子命令")
        void missingCommand() {
            assertEquals(ExitCodes.USAGE, run());
            assertTrue(err.toString().contains("Missing command"));
        }

        @Test
        @DisplayName("未知子命令")
        void unknownCommand() {
            assertEquals(ExitCodes.USAGE, run("explode"));
            assertTrue(err.toString().contains("Unknown command [explode]"));
        }

        @Test
        @DisplayName("帮助信息列出所有子命令")
        void help() {
            assertEquals(ExitCodes.OK, run("--help"));

            String help = out.toString();
            for (String command : new String[]{"discover", "entrypoints", "resolve", "show"}) {
                assertTrue(help.contains(command), command);
            }
        }

        @Test
        @DisplayName("未知选项")
        void unknownOption() {
            assertEquals(ExitCodes.USAGE, run("--workdir", workdir.toString(), "discover", "--bogus"));
        }

        @Test
        @DisplayName("resolve 缺少 --namespace")
        void resolveRequiresNamespace() {
            assertEquals(ExitCodes.USAGE, run("resolve"));
        }

        @Test
        @DisplayName("非法输出格式")
        void invalidFormat() {
            assertEquals(ExitCodes.USAGE, run("--workdir", workdir.toString(), "discover", "-f", "toml"));
        }
    }

    @Nested
    @DisplayName("discover")
    class DiscoverTests {

        @Test
        @DisplayName("以 INI 格式输出到标准输出")
        void printsIni() throws Exception {
            int status = run("--workdir", workdir.toString(), "discover",
                    "-p", testClassesDir(), "-i", "com.lingplug.cli.sample.*", "-f", "ini");

            assertEquals(ExitCodes.OK, status, err.toString());
            assertEquals("[" + EchoPlugin.NAMESPACE + "]\n"
                    + "echo = " + ECHO + "\n"
                    + "shout = " + SHOUT + "\n\n", out.toString());
        }

        @Test
        @DisplayName("以 JSON 格式写入文件")
        void writesJsonFile() throws Exception {
            int status = run("--workdir", workdir.toString(), "discover",
                    "-p", testClassesDir(), "-i", "com.lingplug.cli.sample.*", "-e", "*Shout*", "-o", "index.json");

            assertEquals(ExitCodes.OK, status, err.toString());
            String json = Files.readString(workdir.resolve("index.json"));
            assertTrue(json.contains("\"echo=" + ECHO + "\""));
            assertFalse(json.contains("shout"));
        }

        @Test
        @DisplayName("classes 目录不存在")
        void missingClassesDir() {
            int status = run("--workdir", workdir.toString(), "discover", "-p", "does-not-exist");

            assertEquals(ExitCodes.ERROR, status);
            assertTrue(err.toString().startsWith("ERROR: "));
        }
    }

    @Nested
    @DisplayName("entrypoints 与 show")
    class EntryPointsTests {

        @Test
        @DisplayName("MANUAL 模式生成静态文件")
        void manualMode() throws Exception {
            writeConfig("manual");

            int status = run("--workdir", workdir.toString(), "entrypoints");

            assertEquals(ExitCodes.OK, status, err.toString());
            assertTrue(out.toString().contains("entry point build mode: manual"));
            String content = Files.readString(workdir.resolve("lingplug.ini"));
            assertTrue(content.contains("echo = " + ECHO));
        }

        @Test
        @DisplayName("show 打印已生成的声明文件")
        void showPrintsFile() throws IOException {
            Path file = workdir.resolve("target/classes").resolve(Distribution.ENTRY_POINTS_FILE);
            Files.createDirectories(file.getParent());
            Files.writeString(file, "[ns]\na = x.A\n");

            assertEquals(ExitCodes.OK, run("--workdir", workdir.toString(), "show"));
            assertEquals("[ns]\na = x.A\n", out.toString());
        }

        @Test
        @DisplayName("show 在文件不存在时给出提示")
        void showWithoutFile() {
            assertEquals(ExitCodes.OK, run("--workdir", workdir.toString(), "show"));
            assertTrue(out.toString().contains("No entrypoints file found"));
        }
    }

    @Nested
    @DisplayName("resolve")
    class ResolveTests {

        @Test
        @DisplayName("列出命名空间下的插件，不加载插件")
        void listsPlugins() throws IOException {
            Path distribution = workdir.resolve("dist");
            Path file = distribution.resolve(Distribution.ENTRY_POINTS_FILE);
            Files.createDirectories(file.getParent());
            Files.writeString(file, "[" + EchoPlugin.NAMESPACE + "]\n"
                    + "echo = " + ECHO + "\n"
                    + "broken = com.lingplug.does.not.Exist\n");

            int status = run("resolve", "--namespace", EchoPlugin.NAMESPACE, "--classpath", distribution.toString());

            assertEquals(ExitCodes.OK, status, err.toString());
            assertTrue(out.toString().contains("path = " + distribution));
            assertTrue(out.toString().contains(EchoPlugin.NAMESPACE + ":echo = " + ECHO));
            assertTrue(err.toString().contains("cannot resolve " + EchoPlugin.NAMESPACE + ":broken"));
        }
    }
}
