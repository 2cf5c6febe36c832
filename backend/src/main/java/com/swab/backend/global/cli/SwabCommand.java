package com.swab.backend.global.cli;

import java.util.Arrays;

/**
 * Process mode selected from the command line. Anything other than a one-shot flag starts the server.
 */
public enum SwabCommand {

    SERVE(null),
    TEST("--test"),
    VALIDATE_WEBHOOK("--validate-webhook"),
    REFRESH("--refresh");

    private final String flag;

    SwabCommand(String flag) {
        this.flag = flag;
    }

    public String flag() {
        return flag;
    }

    public boolean isOneShot() {
        return this != SERVE;
    }

    /**
     * The first recognised flag wins.
     */
    public static SwabCommand resolve(String[] args) {
        if (args == null) {
            return SERVE;
        }
        for (String arg : args) {
            SwabCommand match = Arrays.stream(values())
                    .filter(command -> command.flag != null && command.flag.equals(arg))
                    .findFirst()
                    .orElse(null);
            if (match != null) {
                return match;
            }
        }
        return SERVE;
    }
}
