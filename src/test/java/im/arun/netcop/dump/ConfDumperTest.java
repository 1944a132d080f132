package im.arun.netcop.dump;

import im.arun.netcop.tree.ConfNode;
import im.arun.netcop.tree.TreeBuilder;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ConfDumperTest {

    private static final String IOS = String.join("\n",
        "",
        "        snmp server 1",
        "        stp mode mstp 1",
        "        !",
        "        interface IF1",
        "            ip address 1.1.1.1",
        "            ip address 2.2.2.2 secondary",
        "        !",
        "        interface IF2",
        "            ip address 1.1.1.2",
        "            no ip redirects",
        "        !",
        "    ");

    private static final String JUNOS = String.join("\n",
        "",
        "        forwarding-options {",
        "            sampling { # Traffic is sampled and sent to a flow server.",
        "                input {",
        "                    rate 1; # Samples 1 out of x packets (here, a rate of 1 sample per packet).",
        "                }",
        "            }",
        "            family inet {",
        "                output {",
        "                    flow-server 10.60.2.1 { # The IP address and port of the flow server.",
        "                        port 2055;",
        "                        version 5; # Records are sent to the flow server using version 5 format.",
        "                    }",
        "                    flow-inactive-timeout 15;",
        "                    flow-active-timeout 60;",
        "                }",
        "            }",
        "        }",
        "    ");

    private static final DumpOptions FOUR_SPACES = DumpOptions.withIndent("    ");

    private static String lines(String... lines) {
        return Arrays.stream(lines).map(line -> line + "\n").collect(Collectors.joining());
    }

    @Test
    void testDumpRoot() {
        ConfNode conf = TreeBuilder.parse(IOS);
        assertEquals(lines(
            "snmp server 1",
            "stp mode mstp 1",
            "!",
            "interface IF1",
            "    ip address 1.1.1.1",
            "    ip address 2.2.2.2 secondary",
            "!",
            "interface IF2",
            "    ip address 1.1.1.2",
            "    no ip redirects",
            "!"), ConfDumper.dumpToString(conf, FOUR_SPACES));
    }

    @Test
    void testDumpContainerWithHeader() {
        ConfNode conf = TreeBuilder.parse(IOS);
        assertEquals(lines(
            "[interface IF1 ip]",
            "    address 1.1.1.1",
            "    address 2.2.2.2 secondary"), ConfDumper.dumpToString(conf.get("interface if1 ip"), FOUR_SPACES));
    }

    @Test
    void testDumpOwnLineInlineWithHeader() {
        ConfNode conf = TreeBuilder.parse(IOS);
        assertEquals("[stp] mode mstp 1\n", ConfDumper.dumpToString(conf.get("stp"), FOUR_SPACES));
    }

    @Test
    void testDumpWithoutHeader() {
        ConfNode conf = TreeBuilder.parse(IOS);
        DumpOptions options = new DumpOptions("    ", false, false);
        assertEquals(lines("address 1.1.1.1", "address 2.2.2.2 secondary"),
            ConfDumper.dumpToString(conf.get("interface IF1 ip"), options));
        assertEquals(lines("mode mstp 1"), ConfDumper.dumpToString(conf.get("stp"), options));
    }

    @Test
    void testDumpJunos() {
        ConfNode jconf = TreeBuilder.parse(JUNOS);
        assertEquals(lines(
            "forwarding-options {",
            "    sampling { # Traffic is sampled and sent to a flow server.",
            "        input {",
            "            rate 1; # Samples 1 out of x packets (here, a rate of 1 sample per packet).",
            "        }",
            "    }",
            "    family inet {",
            "        output {",
            "            flow-server 10.60.2.1 { # The IP address and port of the flow server.",
            "                port 2055;",
            "                version 5; # Records are sent to the flow server using version 5 format.",
            "            }",
            "            flow-inactive-timeout 15;",
            "            flow-active-timeout 60;",
            "        }",
            "    }",
            "}"), ConfDumper.dumpToString(jconf, FOUR_SPACES));

        String key = "forwarding-options family inet output flow-server";
        assertEquals(lines(
            "[" + key + "] 10.60.2.1 { # The IP address and port of the flow server.",
            "    port 2055;",
            "    version 5; # Records are sent to the flow server using version 5 format."),
            ConfDumper.dumpToString(jconf.get(key), FOUR_SPACES));
    }

    @Test
    void testOriginalTextRoundTrip() {
        ConfNode jconf = TreeBuilder.parse(JUNOS);
        List<String> nonBlank = Arrays.stream(JUNOS.split("\n"))
            .filter(line -> !line.isBlank())
            .collect(Collectors.toList());

        DumpOptions verbatim = new DumpOptions(null, true, true);
        assertEquals(String.join("\n", nonBlank) + "\n", ConfDumper.dumpToString(jconf, verbatim));
    }

    @Test
    void testOriginalTextReindented() {
        ConfNode conf = TreeBuilder.parse(IOS);
        DumpOptions options = new DumpOptions("  ", true, true);
        assertEquals(lines(
            "[interface IF1 ip]",
            "  ip address 1.1.1.1",
            "  ip address 2.2.2.2 secondary"), ConfDumper.dumpToString(conf.get("interface IF1 ip"), options));
    }

    @Test
    void testDumpAbsentNodeWritesNothing() throws IOException {
        ConfNode conf = TreeBuilder.parse(IOS);
        StringWriter out = new StringWriter();
        ConfDumper.dump(conf.get("interface IF9"), out);
        assertEquals("", out.toString());
        assertEquals("", ConfDumper.dumpToString(TreeBuilder.parse(""), DumpOptions.defaults()));
    }

    @Test
    void testDefaultIndent() throws IOException {
        ConfNode conf = TreeBuilder.parse("a\n b\n  c");
        StringWriter out = new StringWriter();
        ConfDumper.dump(conf, out);
        assertEquals(lines("a", "  b", "    c"), out.toString());
    }
}
