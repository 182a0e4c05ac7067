package io.repoexpert.core.admin;

import io.repoexpert.core.chunk.Chunker;
import io.repoexpert.core.provider.AgentProvider;
import io.repoexpert.core.provider.Passage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Renders an agent's memory as a markdown document: one section per core memory block,
 * followed by the files its archival passages were indexed from.
 */
public final class ExportService {
    private final AgentProvider provider;
    private final AdminPort admin;

    public ExportService(AgentProvider provider) {
        this(provider, new ProviderAdminAdapter(provider));
    }

    public ExportService(AgentProvider provider, AdminPort admin) {
        this.provider = Objects.requireNonNull(provider, "provider must not be null");
        this.admin = Objects.requireNonNull(admin, "admin must not be null");
    }

    public String export(String repoName, String agentId) throws IOException {
        List<CoreMemoryBlock> blocks = admin.getCoreMemory(agentId);
        TreeSet<String> files = new TreeSet<>();
        for (Passage passage : provider.listPassages(agentId)) {
            sourcePath(passage.text()).ifPresent(files::add);
        }
        return format(repoName, agentId, blocks, new ArrayList<>(files));
    }

    static String format(String repoName, String agentId, List<CoreMemoryBlock> blocks, List<String> files) {
        List<String> lines = new ArrayList<>();
        lines.add("# " + repoName);
        lines.add("");
        lines.add("Agent: `" + agentId + "`");
        lines.add("");
        for (CoreMemoryBlock block : blocks) {
            lines.add("## " + block.label());
            lines.add("");
            lines.add(block.value());
            lines.add("");
        }
        lines.add("## Files (" + files.size() + ")");
        lines.add("");
        for (String file : files) {
            lines.add("- `" + file + "`");
        }
        return String.join("\n", lines);
    }

    /**
     * Reads the path back out of a chunk header, ignoring the continuation marker.
     */
    private static Optional<String> sourcePath(String text) {
        int newline = text.indexOf('\n');
        String firstLine = newline < 0 ? text : text.substring(0, newline);
        if (!firstLine.startsWith(Chunker.FILE_PREFIX)) {
            return Optional.empty();
        }
        String path = firstLine.substring(Chunker.FILE_PREFIX.length());
        if (path.endsWith(Chunker.CONTINUATION_SUFFIX)) {
            path = path.substring(0, path.length() - Chunker.CONTINUATION_SUFFIX.length());
        }
        return Optional.of(path);
    }
}
