package im.arun.netcop.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.netcop.config.ConfigLoader;
import im.arun.netcop.config.NetcopConfig;
import im.arun.netcop.exception.NetcopException;
import im.arun.netcop.service.ConfQueryService;
import im.arun.netcop.tree.ConfNode;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line front end: query or dump a device config.
 *
 * <pre>
 * netcop --file router.conf --query "interface * ip address *"
 * netcop --file router.conf --dump "interface Ethernet1" --indent 4
 * </pre>
 */
@Command(
    name = "netcop",
    description = "Query CLI-style network device configs by keyword paths with wildcards",
    mixinStandardHelpOptions = true,
    version = "netcop 1.0"
)
public class NetcopCLI implements Callable<Integer> {

    @Spec
    private CommandSpec commandSpec;

    @Option(names = {"-f", "--file"}, description = "Config file to read, '-' for standard input", required = true)
    private String file;

    @Option(names = {"-q", "--query"}, description = "Keyword path with wildcards (* ? [..]) and optional trailing ~")
    private String query;

    @Option(names = {"-d", "--dump"}, description = "Keyword path of the subtree to print")
    private String dumpKey;

    @Option(names = {"--indent"}, description = "Spaces per nesting level when dumping")
    private Integer indent;

    @Option(names = {"--no-indent"}, description = "Print dumped lines as they are")
    private boolean noIndent;

    @Option(names = {"--no-header"}, description = "Omit the [path] header when dumping")
    private boolean noHeader;

    @Option(names = {"--original"}, description = "Dump the original config lines")
    private boolean original;

    @Option(names = {"--json"}, description = "Print query results as JSON")
    private boolean json;

    @Option(names = {"--config"}, description = "YAML settings file")
    private String configPath;

    @Override
    public Integer call() throws Exception {
        PrintWriter out = commandSpec.commandLine().getOut();
        PrintWriter err = commandSpec.commandLine().getErr();

        if (query == null && dumpKey == null) {
            err.println("Error: one of --query or --dump is required");
            return 1;
        }

        NetcopConfig config = new ConfigLoader(configPath).load(userOptions());
        ConfQueryService service = new ConfQueryService(config);

        ConfNode root;
        try {
            root = loadConfig(service);
        } catch (IOException e) {
            err.println("Error reading config: " + e.getMessage());
            return 1;
        }
        if (root == null) {
            err.println("Error: config file not found: " + file);
            return 1;
        }

        try {
            if (query != null) {
                printMatches(service.query(root, query), config, out);
            }
            if (dumpKey != null && !service.dump(root, dumpKey, out)) {
                err.println("Nothing matches: " + dumpKey);
                return 1;
            }
        } catch (NetcopException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }

        out.flush();
        return 0;
    }

    private ConfNode loadConfig(ConfQueryService service) throws IOException {
        if ("-".equals(file)) {
            return service.load(System.in);
        }
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            return null;
        }
        return service.load(path);
    }

    private Map<String, Object> userOptions() {
        Map<String, Object> options = new HashMap<>();
        if (indent != null) {
            options.put("indent", indent);
        }
        if (noIndent) {
            options.put("noIndent", true);
        }
        if (noHeader) {
            options.put("showHeader", false);
        }
        if (original) {
            options.put("useOriginalText", true);
        }
        if (json) {
            options.put("outputFormat", "json");
        }
        return options;
    }

    private void printMatches(List<List<String>> matches, NetcopConfig config, PrintWriter out) throws IOException {
        if (config.isJsonOutput()) {
            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            out.println(mapper.writeValueAsString(matches));
            return;
        }
        for (List<String> match : matches) {
            out.println(String.join(" ", match));
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new NetcopCLI()).execute(args);
        System.exit(exitCode);
    }
}
