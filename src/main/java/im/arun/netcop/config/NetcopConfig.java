package im.arun.netcop.config;

import im.arun.netcop.dump.DumpOptions;
import lombok.Data;

@Data
public class NetcopConfig {
    private String indent = DumpOptions.DEFAULT_INDENT;
    private boolean noIndent = false;
    private boolean showHeader = true;
    private boolean useOriginalText = false;
    private String outputFormat = "text";

    public DumpOptions toDumpOptions() {
        return new DumpOptions(noIndent ? null : indent, showHeader, useOriginalText);
    }

    public boolean isJsonOutput() {
        return "json".equalsIgnoreCase(outputFormat);
    }
}
