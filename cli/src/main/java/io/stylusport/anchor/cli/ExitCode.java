package io.stylusport.anchor.cli;

/** Process exit codes of the {@code stylusport} command. */
public enum ExitCode {
    SUCCESS(0),
    /** Bad command line arguments. */
    USAGE(1),
    /** Source could not be read or parsed. */
    PARSE_FAILURE(2),
    NORMALIZE_FAILURE(3),
    /** Report could not be written. */
    OUTPUT_FAILURE(4);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
