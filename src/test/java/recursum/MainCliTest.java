package recursum;

import recursum.pipeline.*;
import recursum.sources.*;
import recursum.utils.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MainCliTest {

    @TempDir
    Path dir;

    private PipelineConfig resolve(String... args) {
        CommandLine cli = MainCli.newCommandLine();
        cli.parseArgs(args);
        return ((MainCli) cli.getCommand()).resolveConfig();
    }

    @Test
    void resolveConfig_appliesOptionsAndDefaults() throws Exception {
        Files.writeString(dir.resolve("a.txt"), "a");

        PipelineConfig config = resolve("-t", "3", "-w", "2", "-f", "1.5", "-d", "12", "-a", "sha1",
                "-c", "-q", "-i", "image,Text/plain", dir.toString());

        assertEquals(InputMode.DIRECTORY, config.mode());
        assertEquals(3, config.workerCount());
        assertEquals(2, config.walkerCount());
        assertEquals(1.5, config.queueFactor());
        assertEquals(HashAlgorithm.SHA1, config.algorithm());
        assertEquals("  ", config.format().separator());
        assertTrue(config.format().hashFirst());
        assertEquals(12, config.format().digestMaxLength());
        assertTrue(config.quiet());
        assertEquals(java.util.Set.of("image", "text"), config.includeTypes());
    }

    @Test
    void resolveConfig_defaultsToTabSeparatedSha256() throws Exception {
        Path file = Files.writeString(dir.resolve("a.txt"), "a");

        PipelineConfig config = resolve(file.toString(), dir.resolve("b.txt").toString());

        assertEquals(InputMode.FILES, config.mode());
        assertEquals(HashAlgorithm.SHA256, config.algorithm());
        assertEquals("\t", config.format().separator());
        assertFalse(config.format().hashFirst());
        assertNull(config.format().digestMaxLength());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.workerCount());
    }

    @Test
    void execute_rejectsMissingInputWithInvalidInputExitCode() {
        CommandLine cli = MainCli.newCommandLine();
        StringWriter err = new StringWriter();
        cli.setErr(new PrintWriter(err));

        int exitCode = cli.execute(dir.resolve("missing").toString());

        assertEquals(ExitCode.INVALID_INPUT, exitCode);
        assertTrue(err.toString().contains("missing"), err.toString());
    }

    @Test
    void execute_rejectsOptionsWithoutInput() {
        CommandLine cli = MainCli.newCommandLine();
        StringWriter err = new StringWriter();
        cli.setErr(new PrintWriter(err));

        int exitCode = cli.execute("-q");

        assertEquals(ExitCode.INVALID_INPUT, exitCode);
        assertTrue(err.toString().contains("INPUT"), err.toString());
    }

    @Test
    void execute_rejectsUnknownAlgorithmAndBadThreadCount() throws Exception {
        Path file = Files.writeString(dir.resolve("a.txt"), "a");
        CommandLine cli = MainCli.newCommandLine();
        cli.setErr(new PrintWriter(new StringWriter()));

        assertEquals(ExitCode.INVALID_INPUT, cli.execute("-a", "meow", file.toString()));
        assertEquals(ExitCode.INVALID_INPUT, MainCli.newCommandLine().execute("-t", "0", file.toString()));
    }

    @Test
    void execute_hashesFilesToStandardOutput() throws Exception {
        Path a = Files.writeString(dir.resolve("a.txt"), "hello");
        Path b = Files.writeString(dir.resolve("b.txt"), "world");
        ByteArrayOutputStream captured = new ByteArrayOutputStream();
        PrintStream original = System.out;
        System.setOut(new PrintStream(captured, true, StandardCharsets.UTF_8));
        int exitCode;
        try {
            exitCode = MainCli.newCommandLine().execute("-q", "-a", "md5", "-s", " | ", b.toString(), a.toString());
        } finally {
            System.setOut(original);
        }

        assertEquals(ExitCode.OK, exitCode);
        assertEquals(
                b + " | 7d793037a0760186574b0282f2f435e7\n"
                        + a + " | 5d41402abc4b2a76b9719d911017c592\n",
                captured.toString(StandardCharsets.UTF_8));
    }
}
