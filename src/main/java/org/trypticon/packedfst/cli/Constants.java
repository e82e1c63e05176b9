package org.trypticon.packedfst.cli;

/**
 * Constants shared by the commands.
 */
class Constants {
    /**
     * The application name, as shown in usage messages.
     */
    static final String APP_NAME = "packedfst";

    private Constants() {
    }
}
