package recursum;

import recursum.output.*;
import recursum.pipeline.*;
import recursum.processors.*;
import recursum.sources.*;
import recursum.utils.*;
import picocli.*;
import picocli.CommandLine.*;

import java.io.*;
import java.util.*;
import java.util.concurrent.*;

@Command(
    name = "recursum",
    description = "Hash lots of files fast, in parallel. Output order always matches input order.",
    mixinStandardHelpOptions = true,
    versionProvider = ManifestVersionProvider.class,
    defaultValueProvider = PropertiesDefaultProvider.class,
    sortOptions = false
)
public class MainCli implements Callable<Integer> {

    public static final String DOCS_TXT_RESOURCE_PATH = "/docs.txt";

    @Spec
    Model.CommandSpec spec;

    @Parameters(arity = "0..*",
            paramLabel = "INPUT",
            description = "One or more file names, one directory name (every file recursively will be hashed, "
                    + "in depth first order), or '-' for getting list of files from stdin (order is conserved).")
    private List<String> inputs = new ArrayList<>();

    @Option(names = {"-t", "--threads"},
            description = "Hashing threads (default: ${DEFAULT-VALUE})")
    private int threadCount = Runtime.getRuntime().availableProcessors();

    @Option(names = {"-w", "--walkers"},
            description = "Directory-walking threads, if INPUT is a directory (default: ${DEFAULT-VALUE})")
    private int walkerCount = Runtime.getRuntime().availableProcessors();

    @Option(names = {"-f", "--queue-factor"},
            description = "Paths buffered per hashing thread while walking a directory (default: ${DEFAULT-VALUE})")
    private double queueFactor = DirectoryWalkSource.DEFAULT_QUEUE_FACTOR;

    @Option(names = {"-d", "--digest-length"},
            description = "Maximum length of output hash digests.")
    private Integer digestLength;

    @Option(names = {"-a", "--algorithm"},
            converter = AlgorithmConverter.class,
            description = "Digest algorithm: md5, sha1, sha256, sha512 (default: sha256)")
    private HashAlgorithm algorithm = HashAlgorithm.SHA256;

    @Option(names = {"-s", "--separator"},
            description = "Separator. Defaults to tab unless --compatible is given. "
                    + "Use \"\\t\" for tab and \"\\0\" for null (cannot be mixed with other characters).")
    private String separator;

    @Option(names = {"-c", "--compatible"},
            description = "\"Compatible mode\", which prints the hash first and changes the default separator "
                    + "to double-space, as used by system utilities like md5sum.")
    private boolean compatible;

    @Option(names = {"-q", "--quiet"},
            description = "Do not show progress information.")
    private boolean quiet;

    @Option(names = {"-b", "--batch-size"},
            description = "Lines to batch per write (default: ${DEFAULT-VALUE})")
    private int batchSize = ResultWriter.DEFAULT_BATCH_SIZE;

    @Option(names = {"-i", "--include"}, split = ",",
            description = "While walking a directory, only hash files of these major MIME types (e.g. 'image', 'text').")
    private Set<String> includeTypes = new LinkedHashSet<>();

    @Option(names = "--docs", description = "Show project and command documentation.")
    private boolean docsRequested;

    @Override
    public Integer call() throws Exception {
        if (docsRequested) {
            return printDocs();
        }
        if (inputs.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "Missing required parameter: 'INPUT'");
        }

        new HashProcessor(resolveConfig()).run();
        return ExitCode.OK;
    }

    PipelineConfig resolveConfig() {
        try {
            InputMode mode = InputMode.of(inputs);
            OutputFormat format = OutputFormat.resolve(separator, compatible, digestLength);
            Set<String> types = new LinkedHashSet<>();
            for (String type : includeTypes) {
                types.add(MimeUtils.getMajorType(type.trim()).toLowerCase(Locale.ROOT));
            }
            return new PipelineConfig(mode, inputs, threadCount, walkerCount, queueFactor,
                    format, algorithm, batchSize, quiet, types);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private int printDocs() {
        try (InputStream in = getClass().getResourceAsStream(DOCS_TXT_RESOURCE_PATH);
             BufferedReader reader = in == null ? null : new BufferedReader(new InputStreamReader(in))) {
            if (reader == null) {
                System.err.println("Documentation not found.");
                return ExitCode.ERROR;
            }
            reader.lines().forEach(System.err::println);
        } catch (IOException e) {
            System.err.println("Error reading documentation: " + e.getMessage());
            return ExitCode.ERROR;
        }
        return ExitCode.OK;
    }

    static CommandLine newCommandLine() {
        CommandLine cli = new CommandLine(new MainCli());

        cli.setExecutionExceptionHandler(new ShortErrorHandler());
        cli.setColorScheme(Help.defaultColorScheme(Help.Ansi.AUTO));
        cli.setUsageHelpAutoWidth(true);
        return cli;
    }

    public static void main(String[] args) {
        CommandLine cli = newCommandLine();

        if (args.length == 0) {
            cli.usage(System.out);
            System.exit(ExitCode.OK);
        }

        int exitCode = cli.execute(args);
        System.exit(exitCode);
    }

    static class AlgorithmConverter implements ITypeConverter<HashAlgorithm> {
        @Override
        public HashAlgorithm convert(String value) {
            try {
                return HashAlgorithm.parse(value);
            } catch (IllegalArgumentException e) {
                throw new TypeConversionException(e.getMessage());
            }
        }
    }

    // Fatal errors print one line; bad arguments go through picocli's parameter handler instead.
    static class ShortErrorHandler implements IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd, ParseResult parseResult) {
            cmd.getErr().println(cmd.getColorScheme().errorText("ERROR: " + ex.getMessage()));
            return ExitCode.ERROR;
        }
    }

}
