package cli;

import app.SqlFormatCliApp;

/**
 * CLI entrypoint facade. Option parsing, orchestration and reporting live in
 * {@link SqlFormatCliApp}.
 */
public class SqlFormatCli {

    public static void main(String[] args) {
        SqlFormatCliApp.main(args);
    }
}
