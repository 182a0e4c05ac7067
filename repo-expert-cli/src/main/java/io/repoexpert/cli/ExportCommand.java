package io.repoexpert.cli;

import io.repoexpert.core.admin.ExportService;
import io.repoexpert.core.state.AgentState;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "export", description = "Export an agent's memory blocks and indexed files as markdown")
public final class ExportCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Parameters(index = "0", description = "Repo name")
    String repo;

    @Option(names = {"-o", "--output"}, description = "Write to this file instead of stdout")
    Path output;

    public ExportCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            AgentState agent = CommandSupport.requireAgent(context.stateStore(root).load(), repo);
            String markdown = new ExportService(context.provider()).export(repo, agent.agentId());
            if (output == null) {
                System.out.println(markdown);
            } else {
                Path parent = output.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(output, markdown + System.lineSeparator(), StandardCharsets.UTF_8);
                System.out.println("Exported \"" + repo + "\" to " + output);
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Export command failed: " + e.getMessage());
            return 1;
        }
    }
}
