package io.github.yok.dbbridge.schema;

import com.google.common.collect.ImmutableList;
import java.util.List;
import lombok.Value;

/**
 * Ordered schema statements resolved for one dialect.
 *
 * @author Yasuharu.Okawauchi
 */
@Value
public class SchemaSource {

    // Dialect the source was resolved for
    String dialect;

    // Resource the statements were read from
    String location;

    // true when read from the dialect-qualified file, false for the generic fallback
    boolean dialectSpecific;

    // Non-blank statements in source order, without terminators
    ImmutableList<String> statements;

    /**
     * Creates a source.
     *
     * @param dialect dialect
     * @param location resource description
     * @param dialectSpecific whether the dialect-qualified file was used
     * @param statements statements in order
     */
    public SchemaSource(String dialect, String location, boolean dialectSpecific,
            List<String> statements) {
        this.dialect = dialect;
        this.location = location;
        this.dialectSpecific = dialectSpecific;
        this.statements = ImmutableList.copyOf(statements);
    }
}
