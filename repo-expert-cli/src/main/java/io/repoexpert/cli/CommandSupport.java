package io.repoexpert.cli;

import io.repoexpert.core.config.model.RepoConfig;
import io.repoexpert.core.config.model.RepoExpertConfig;
import io.repoexpert.core.state.AgentState;
import io.repoexpert.core.state.AppState;
import java.util.ArrayList;
import java.util.List;

final class CommandSupport {

    private CommandSupport() {
    }

    static List<String> selectRepos(String repo, Iterable<String> all) {
        if (repo != null && !repo.isBlank()) {
            return List.of(repo.trim());
        }
        List<String> names = new ArrayList<>();
        all.forEach(names::add);
        return names;
    }

    static RepoConfig requireRepo(RepoExpertConfig config, String repoName) {
        RepoConfig repo = config.repos().get(repoName);
        if (repo == null) {
            throw new IllegalArgumentException("Repo \"" + repoName + "\" not found in config");
        }
        return repo;
    }

    static AgentState requireAgent(AppState state, String repoName) {
        return state.agent(repoName).orElseThrow(() -> new IllegalArgumentException(
            "No agent found for \"" + repoName + "\". Run \"repo-expert setup\" first."
        ));
    }

    static String shortCommit(String commit) {
        if (commit == null) {
            return "none";
        }
        return commit.length() > 7 ? commit.substring(0, 7) : commit;
    }
}
