package cli;

import app.CodeConvertCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>The orchestration lives in {@link CodeConvertCliApp}; this class only forwards and
 * turns the exit code into the process status.</p>
 */
public class CodeConvertCli {

    public static void main(String[] args) {
        int code = CodeConvertCliApp.run(args);
        if (code != 0) System.exit(code);
    }
}
