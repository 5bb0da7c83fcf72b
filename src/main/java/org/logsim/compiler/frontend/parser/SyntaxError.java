package org.logsim.compiler.frontend.parser;

import org.logsim.compiler.internal.i18n.Messages;

/**
 * The syntax errors the parser reports, each with the stable number users see in messages.
 */
public enum SyntaxError {
    MISSING_DEVICES_KEYWORD(1),
    MISSING_CONNECT_KEYWORD(2),
    MISSING_MONITOR_KEYWORD(3),
    MISSING_END_KEYWORD(4),
    NO_DEVICES(5),
    MISSING_DEVICE_PARAMETER(6),
    MISSING_DEVICE_NAME(7),
    UNKNOWN_DEVICE_TYPE(8),
    INVALID_DEVICE_NAME(9),
    INVALID_CLOCK_PERIOD(10),
    INVALID_SWITCH_STATE(11),
    INVALID_FAN_IN(12),
    BAD_CONNECTION_SEPARATOR(13),
    INVALID_OUTPUT_PIN(14),
    MISSING_ARROW(15),
    MISSING_INPUT_PIN(16),
    INVALID_INPUT_PIN(17),
    BAD_MONITOR_SEPARATOR(18),
    BAD_DEVICE_SEPARATOR(19),
    MISSING_COLON(20),
    MISSING_FINAL_SEMICOLON(21),
    PREMATURE_END_OF_FILE(22),
    INVALID_WAVEFORM(23);

    private final int number;

    SyntaxError(int number) {
        this.number = number;
    }

    /**
     * @return The error number, 1 to 23.
     */
    public int number() {
        return number;
    }

    /**
     * @return The diagnostic code under which the error is recorded, e.g. {@code SYNTAX_9}.
     */
    public String code() {
        return "SYNTAX_" + number;
    }

    /**
     * @return The localized message text.
     */
    public String message() {
        return Messages.get("syntax." + number);
    }
}
