package io.github.yok.dbbridge.error;

import lombok.Getter;

/**
 * Raised when schema application aborts.
 *
 * <p>
 * When the failure is caused by a statement, {@link #getStatementIndex()} holds its 0-based
 * position in the schema source and {@link #getStatement()} its text. When the schema source itself
 * cannot be resolved, the index is {@code -1} and the statement is {@code null}.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Getter
public class SchemaException extends DbBridgeException {

    private static final long serialVersionUID = 1L;

    private final int statementIndex;

    private final String statement;

    /**
     * Creates an exception that is not tied to a statement.
     *
     * @param message detail message
     */
    public SchemaException(String message) {
        super(message);
        this.statementIndex = -1;
        this.statement = null;
    }

    /**
     * Creates an exception that is not tied to a statement.
     *
     * @param message detail message
     * @param cause underlying cause
     */
    public SchemaException(String message, Throwable cause) {
        super(message, cause);
        this.statementIndex = -1;
        this.statement = null;
    }

    /**
     * Creates an exception for a failing schema statement.
     *
     * @param statementIndex 0-based index of the statement in the schema source
     * @param statement statement text
     * @param cause underlying cause
     */
    public SchemaException(int statementIndex, String statement, Throwable cause) {
        super("Schema statement #" + statementIndex + " failed: " + statement, cause);
        this.statementIndex = statementIndex;
        this.statement = statement;
    }
}
