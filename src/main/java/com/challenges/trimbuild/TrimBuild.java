package com.challenges.trimbuild;

import ch.qos.logback.classic.Level;
import com.challenges.trimbuild.blueprint.Blueprint;
import com.challenges.trimbuild.blueprint.BlueprintParser;
import com.challenges.trimbuild.config.TrimSettings;
import com.challenges.trimbuild.filter.TrimPolicy;
import com.challenges.trimbuild.make.Makefile;
import com.challenges.trimbuild.make.MakefileParser;
import com.challenges.trimbuild.output.BlueprintFormatter;
import com.challenges.trimbuild.output.TreeJsonWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(name = "trimbuild", mixinStandardHelpOptions = true, version = "1.0",
         description = "Remove test and benchmark sections from Android.mk and Android.bp files")
public class TrimBuild implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(TrimBuild.class);

    public enum Dialect {
        AUTO,
        MAKE,
        BLUEPRINT
    }

    @Parameters(arity = "1..*", description = "Build files to process")
    private List<File> files;

    @Option(names = {"-d", "--dialect"}, description = "File dialect: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}, by file extension)")
    private Dialect dialect = Dialect.AUTO;

    @Option(names = {"-i", "--in-place"}, description = "Rewrite the files instead of printing the result")
    private boolean inPlace = false;

    @Option(names = {"-k", "--keep-dev"}, description = "Keep test and benchmark code, only re-emit the files")
    private boolean keepDev = false;

    @Option(names = {"-c", "--compact-output"}, description = "Print each blueprint rule on a single line")
    private boolean compactOutput = false;

    @Option(names = "--indent", description = "Spaces per indent level in blueprint output")
    private Integer indent;

    @Option(names = {"-t", "--tree"}, description = "Print the parsed tree as JSON instead of the file")
    private boolean tree = false;

    @Option(names = "--config", description = "HOCON configuration file")
    private File configFile;

    @Option(names = {"-v", "--verbose"}, description = "Log debug output")
    private boolean verbose = false;

    private final PrintStream out;

    public TrimBuild() {
        this(System.out);
    }

    TrimBuild(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new TrimBuild()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        if (verbose) {
            ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME)).setLevel(Level.DEBUG);
        }

        TrimSettings settings;
        try {
            settings = TrimSettings.load(configFile);
        } catch (Exception e) {
            log.error("Failed to load configuration", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        if (compactOutput) {
            settings = settings.withPretty(false);
        }
        if (indent != null) {
            settings = settings.withIndent(indent);
        }

        int failures = 0;
        for (File file : files) {
            try {
                process(file, settings);
            } catch (Exception e) {
                // each file stands alone: report it and carry on with the rest
                log.error("Failed to process {}", file, e);
                System.err.println("Error: " + file + ": " + e.getMessage());
                failures++;
            }
        }
        return failures == 0 ? 0 : 1;
    }

    private void process(File file, TrimSettings settings) throws IOException {
        Dialect fileDialect = dialectOf(file);
        log.debug("Processing {} as {}", file, fileDialect);
        String contents = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        TrimPolicy policy = new TrimPolicy(settings);

        String result;
        if (fileDialect == Dialect.MAKE) {
            Makefile makefile = new MakefileParser().parse(contents);
            if (!keepDev) {
                policy.apply(makefile);
            }
            result = tree ? new TreeJsonWriter(true).write(makefile) : makefile.serialize();
        } else {
            Blueprint blueprint = new BlueprintParser().parse(contents);
            if (!keepDev) {
                policy.apply(blueprint);
            }
            result = tree
                    ? new TreeJsonWriter(true).write(blueprint)
                    : new BlueprintFormatter(settings.pretty(), settings.indent()).format(blueprint) + "\n";
        }

        if (inPlace && !tree) {
            Files.writeString(file.toPath(), result, StandardCharsets.UTF_8);
            log.info("Rewrote {}", file);
        } else {
            out.print(result);
            if (tree) {
                out.println();
            }
            out.flush();
        }
    }

    private Dialect dialectOf(File file) {
        if (dialect != Dialect.AUTO) {
            return dialect;
        }
        String name = file.getName().toLowerCase(Locale.ROOT);
        if (name.endsWith(".mk")) {
            return Dialect.MAKE;
        }
        if (name.endsWith(".bp")) {
            return Dialect.BLUEPRINT;
        }
        throw new IllegalArgumentException("Cannot tell the dialect of " + file + "; use --dialect");
    }
}
