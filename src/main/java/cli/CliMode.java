package cli;

/** What the CLI does with its input. */
public enum CliMode {
    /** One file, explicit or detected source language. */
    CONVERT,
    /** Language identification only. */
    DETECT,
    /** Manifest-driven conversion of many files with an XLSX report. */
    BATCH
}
