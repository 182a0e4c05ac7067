package io.repoexpert.cli;

import io.repoexpert.core.ask.AskOptions;
import io.repoexpert.core.ask.AskResult;
import io.repoexpert.core.ask.AskRouter;
import io.repoexpert.core.ask.AskRoutingMode;
import io.repoexpert.core.ask.AskService;
import io.repoexpert.core.config.model.AskConfig;
import io.repoexpert.core.config.model.RepoExpertConfig;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.StateStore;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "ask", description = "Ask a repository agent a question")
public final class AskCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    @Parameters(index = "0", arity = "1", description = "Repository name")
    String repo;

    @Parameters(index = "1", arity = "0..1", description = "Question to ask; omit to ask interactively")
    String question;

    @Option(names = {"-i", "--interactive"}, description = "Read questions from stdin until EOF or \"exit\"")
    boolean interactive;

    @Option(names = {"-m", "--model"}, description = "Model override; disables routing")
    String model;

    @Option(names = "--routing", description = "Routing mode: auto, quality or speed (default: from config)")
    String routing;

    @Option(names = "--no-cache", description = "Bypass the answer cache")
    boolean noCache;

    public AskCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            RepoExpertConfig config = context.configService().load(context.configPath());
            AskConfig ask = config.ask();
            StateStore stateStore = context.stateStore(root);
            CommandSupport.requireAgent(stateStore.load(), repo);
            AskRoutingMode mode = AskRoutingMode.parse(routing != null ? routing : ask.routing());
            AskRouter router = new AskRouter(
                Duration.ofSeconds(Math.max(1, ask.timeoutSeconds())),
                Duration.ofSeconds(Math.max(1, ask.fastTimeoutSeconds()))
            );

            try (AskService service = new AskService(
                context.provider(),
                context.answerCache(),
                router,
                context.clock(),
                context.observabilityService()
            )) {
                AskOptions options = new AskOptions(model, mode, ask.fastModel(), !noCache);
                if (interactive || question == null) {
                    askInteractively(service, stateStore, options);
                } else {
                    AgentState agent = CommandSupport.requireAgent(stateStore.load(), repo);
                    System.out.println(service.ask(agent, question, options).answer());
                }
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Ask command failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Keeps one {@link AskService} and the shared answer cache alive across questions. The agent
     * state is re-read per question so a sync run elsewhere moves the cache to the new commit.
     */
    private void askInteractively(AskService service, StateStore stateStore, AskOptions options) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        System.out.println("Asking \"" + repo + "\". Enter a question per line, \"exit\" or an empty line to quit.");
        String line;
        while ((line = reader.readLine()) != null) {
            String next = line.trim();
            if (next.isEmpty() || next.equalsIgnoreCase("exit")) {
                break;
            }
            AgentState agent = CommandSupport.requireAgent(stateStore.load(), repo);
            try {
                AskResult result = service.ask(agent, next, options);
                System.out.println(result.answer());
                if (result.cacheHit()) {
                    System.out.println("  (cached)");
                }
            } catch (IOException e) {
                System.err.println("  Ask failed: " + e.getMessage());
            }
        }
    }
}
