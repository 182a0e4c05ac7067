package io.repoexpert.cli;

import io.repoexpert.core.doctor.CheckResult;
import io.repoexpert.core.doctor.DoctorService;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(name = "doctor", description = "Check config, credentials, repo paths and git")
public final class DoctorCommand implements Callable<Integer> {
    private final CliContext context;

    @ParentCommand
    RepoExpertCliCommand root;

    public DoctorCommand(CliContext context) {
        this.context = context;
    }

    @Override
    public Integer call() {
        try {
            DoctorService doctor = new DoctorService(
                context.configService(),
                context.configPath(),
                context.stateStore(root),
                context.provider(),
                context.changeDetector()
            );
            List<CheckResult> results = doctor.runAllChecks();
            System.out.println(DoctorService.formatReport(results));
            return DoctorService.hasFailures(results) ? 1 : 0;
        } catch (Exception e) {
            System.err.println("Doctor command failed: " + e.getMessage());
            return 1;
        }
    }
}
