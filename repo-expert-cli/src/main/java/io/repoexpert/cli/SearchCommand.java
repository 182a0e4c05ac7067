package io.repoexpert.cli;

import io.repoexpert.core.admin.AdminPort;
import io.repoexpert.core.admin.ProviderAdminAdapter;
import io.repoexpert.core.provider.Passage;
import io.repoexpert.core.state.AgentState;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "search", description = "Search archival passages of a repo agent")
public final class SearchCommand implements Callable<Integer> {
    private static final int PREVIEW_CHARS = 120;

    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Parameters(index = "0", description = "Repo name")
    String repo;

    @Parameters(index = "1", description = "Text to look for")
    String query;

    @Option(names = "--limit", defaultValue = "10", description = "Maximum number of passages")
    int limit;

    public SearchCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AgentState agent = CommandSupport.requireAgent(context.stateStore(root).load(), repo);
            AdminPort admin = new ProviderAdminAdapter(context.provider());
            List<Passage> matches = admin.searchPassages(agent.agentId(), query, limit);
            if (matches.isEmpty()) {
                System.out.println("No passages match \"" + query + "\"");
                return 0;
            }
            for (Passage passage : matches) {
                System.out.println(passage.id() + ": " + preview(passage.text()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Search command failed: " + e.getMessage());
            return 1;
        }
    }

    private String preview(String text) {
        String flat = text.replaceAll("\\s+", " ").trim();
        return flat.length() <= PREVIEW_CHARS ? flat : flat.substring(0, PREVIEW_CHARS) + "...";
    }
}
