package im.arun.netcop.service;

import im.arun.netcop.config.NetcopConfig;
import im.arun.netcop.dump.ConfDumper;
import im.arun.netcop.tree.ConfNode;
import im.arun.netcop.tree.ExpandMatch;
import im.arun.netcop.tree.TreeBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads device configs and runs queries and dumps against them.
 */
public class ConfQueryService {
    private static final Logger logger = LoggerFactory.getLogger(ConfQueryService.class);

    private final NetcopConfig config;

    public ConfQueryService(NetcopConfig config) {
        this.config = config;
    }

    /**
     * Parse a config file (UTF-8).
     */
    public ConfNode load(Path path) throws IOException {
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        ConfNode root = TreeBuilder.parse(lines);
        logger.info("Loaded {} ({} lines, {} top-level keywords)", path, lines.size(), root.size());
        return root;
    }

    /**
     * Parse a config read from a stream, e.g. standard input.
     */
    public ConfNode load(InputStream in) throws IOException {
        Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8);
        ConfNode root = TreeBuilder.parse(reader);
        logger.info("Loaded config from stream ({} top-level keywords)", root.size());
        return root;
    }

    /**
     * Values captured by every match of a wildcard query, in document order.
     */
    public List<List<String>> query(ConfNode root, String pattern) {
        List<List<String>> results = root.expand(pattern)
            .map(ExpandMatch::getValues)
            .collect(Collectors.toList());
        logger.debug("Query '{}' matched {} paths", pattern, results.size());
        return results;
    }

    /**
     * Dump the subtree at {@code key} using the configured formatting.
     *
     * @return whether anything matched the key
     */
    public boolean dump(ConfNode root, String key, Writer out) throws IOException {
        ConfNode node = root.get(key);
        if (!node.isPresent()) {
            logger.debug("Nothing matches '{}'", key);
            return false;
        }
        ConfDumper.dump(node, out, config.toDumpOptions());
        return true;
    }

    public NetcopConfig getConfig() {
        return config;
    }
}
