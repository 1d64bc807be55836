package co.fanki.lifecyclelint.config;

import co.fanki.lifecyclelint.analysis.application.LintCommand;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * Runs the lint command once the context is up and keeps its exit code
 * for {@link org.springframework.boot.SpringApplication#exit}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
public class LintCommandRunner implements CommandLineRunner,
        ExitCodeGenerator {

    private final LintCommand command;

    private int exitCode = LintCommand.EXIT_OK;

    /**
     * Creates the runner.
     *
     * @param theCommand the command to run
     */
    public LintCommandRunner(final LintCommand theCommand) {
        this.command = theCommand;
    }

    @Override
    public void run(final String... args) {
        exitCode = command.run(args, System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

}
