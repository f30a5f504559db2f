package cli;

import app.XlviewCliApp;

/**
 * CLI entrypoint facade.
 *
 * <p>Argument handling and wiring live in {@link XlviewCliApp} so they can be tested
 * without a JVM exit.</p>
 */
public class XlviewCli {

    public static void main(String[] args) {
        XlviewCliApp.main(args);
    }
}
