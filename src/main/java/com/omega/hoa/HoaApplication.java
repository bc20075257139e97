package com.omega.hoa;

import com.omega.hoa.cli.CheckCommand;

import picocli.CommandLine;

/**
 * Main entry point for the HOA checker. Reads HOA files, reports diagnostics and optionally
 * prints every automaton in canonical form.
 */
public class HoaApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CheckCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
