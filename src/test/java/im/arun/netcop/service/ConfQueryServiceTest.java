package im.arun.netcop.service;

import im.arun.netcop.config.ConfigLoader;
import im.arun.netcop.config.NetcopConfig;
import im.arun.netcop.tree.ConfNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ConfQueryServiceTest {

    private static final List<String> CONFIG = List.of(
        "hostname edge-1",
        "interface Ethernet1",
        "    description uplink",
        "    ip address 10.0.0.1/31",
        "interface Ethernet2",
        "    shutdown",
        "    ip address 10.0.0.3/31",
        "");

    @TempDir
    Path tempDir;

    private ConfQueryService service;

    @BeforeEach
    void setUp() {
        NetcopConfig config = new ConfigLoader().load(Map.of("indent", 4));
        service = new ConfQueryService(config);
    }

    @Test
    void testLoadAndQueryFile() throws IOException {
        Path file = tempDir.resolve("edge-1.conf");
        Files.write(file, CONFIG, StandardCharsets.UTF_8);

        ConfNode root = service.load(file);
        assertEquals(List.of("hostname", "interface"), root.keys());
        assertEquals(List.of(
            List.of("Ethernet1", "10.0.0.1/31"),
            List.of("Ethernet2", "10.0.0.3/31")), service.query(root, "interface eth* ip address *"));
    }

    @Test
    void testLoadFromStream() throws IOException {
        byte[] bytes = String.join("\n", CONFIG).getBytes(StandardCharsets.UTF_8);
        ConfNode root = service.load(new ByteArrayInputStream(bytes));
        assertEquals("edge-1", root.get("hostname").word());
    }

    @Test
    void testDumpUsesConfiguredIndent() throws IOException {
        Path file = tempDir.resolve("edge-1.conf");
        Files.write(file, CONFIG, StandardCharsets.UTF_8);
        ConfNode root = service.load(file);

        StringWriter out = new StringWriter();
        assertTrue(service.dump(root, "interface Ethernet2", out));
        assertEquals("[interface Ethernet2]\n    shutdown\n    ip address 10.0.0.3/31\n", out.toString());

        assertFalse(service.dump(root, "interface Ethernet3", new StringWriter()));
    }
}
