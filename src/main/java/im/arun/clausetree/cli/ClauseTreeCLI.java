package im.arun.clausetree.cli;

import im.arun.clausetree.config.ClauseTreeConfig;
import im.arun.clausetree.config.ConfigLoader;
import im.arun.clausetree.service.ClauseTreeService;
import im.arun.clausetree.service.ParseResult;
import im.arun.clausetree.util.JsonSnapshots;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line entry point: parses one section of text and prints a JSON snapshot.
 */
@Command(
    name = "clausetree",
    description = "Parse enumerated legal clauses into a reviewed clause tree",
    mixinStandardHelpOptions = true,
    version = "ClauseTree 1.0"
)
public class ClauseTreeCLI implements Callable<Integer> {

    enum OutputMode { PAYLOAD, SOLUTION, GRAPH }

    @Spec
    private CommandSpec spec;

    @Option(names = {"--input"}, description = "Section text file (reads stdin when omitted)")
    private String inputPath;

    @Option(names = {"--section-key"}, description = "Section identifier (default: text::<length>)")
    private String sectionKey;

    @Option(names = {"--global-offset"}, description = "Offset of the section within its document", defaultValue = "0")
    private int globalOffset;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--set"}, description = "Configuration override, e.g. --set beam_width=32")
    private Map<String, String> overrides = new LinkedHashMap<>();

    @Option(names = {"--output-mode"}, description = "payload, solution or graph", defaultValue = "payload")
    private OutputMode outputMode;

    @Option(names = {"--output"}, description = "Output JSON file path")
    private String outputPath;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String text;
        try {
            text = readInput();
        } catch (IOException e) {
            err.println("Error: cannot read input: " + e.getMessage());
            return 1;
        }

        ClauseTreeConfig config = new ConfigLoader(configPath).load(new LinkedHashMap<>(overrides));
        ParseResult result = new ClauseTreeService(config).parse(text, sectionKey, globalOffset);

        Object snapshot;
        switch (outputMode) {
            case SOLUTION:
                snapshot = result.getSolution();
                break;
            case GRAPH:
                snapshot = result.getGraph();
                break;
            default:
                snapshot = result.getPayload();
        }

        JsonSnapshots snapshots = new JsonSnapshots();
        if (outputPath != null) {
            try {
                snapshots.write(Paths.get(outputPath), snapshot);
            } catch (UncheckedIOException e) {
                err.println("Error: cannot write output: " + e.getMessage());
                return 1;
            }
            out.println("Output written to: " + outputPath);
        } else {
            out.println(snapshots.toJson(snapshot));
        }
        out.flush();
        return 0;
    }

    private String readInput() throws IOException {
        if (inputPath == null) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return Files.readString(Paths.get(inputPath), StandardCharsets.UTF_8);
    }

    static CommandLine newCommandLine() {
        return new CommandLine(new ClauseTreeCLI()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = newCommandLine().execute(args);
        System.exit(exitCode);
    }
}
