package io.github.yok.dbbridge.cli;

/**
 * Raised when the command line cannot be parsed.
 *
 * @author Yasuharu.Okawauchi
 */
public class InvalidArgumentsException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    /**
     * Creates the exception.
     *
     * @param message what is wrong with the arguments
     */
    public InvalidArgumentsException(String message) {
        super(message);
    }
}
