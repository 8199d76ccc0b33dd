package cli;

import app.Ancombc2CliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Option handling and orchestration live in {@link Ancombc2CliApp}; this class only forwards
 * and turns the outcome into the process exit status.</p>
 */
public class Ancombc2Cli {

    public static void main(String[] args) {
        int status = Ancombc2CliApp.run(args);
        if (status != 0) System.exit(status);
    }
}
