package io.github.yok.dbbridge.schema;

import com.google.common.base.Preconditions;
import io.github.yok.dbbridge.config.BackendKind;
import io.github.yok.dbbridge.error.SchemaException;
import io.github.yok.dbbridge.util.SqlScripts;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StreamUtils;

/**
 * Resolves and reads the schema source of a dialect.
 *
 * <p>
 * Under the schema location, {@code schema_<dialect>.sql} is used when it exists, otherwise
 * {@code schema.sql}. The location is a Spring resource location ({@code classpath:schema},
 * {@code file:/opt/app/schema}); a location without a prefix is taken as a file system path.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SchemaSourceLocator {

    /** File name used when no dialect-qualified schema exists. */
    public static final String GENERIC_FILE_NAME = "schema.sql";

    private final ResourceLoader resourceLoader;

    /**
     * Constructs a locator.
     *
     * @param resourceLoader loader used to open schema resources
     */
    public SchemaSourceLocator(ResourceLoader resourceLoader) {
        this.resourceLoader = Preconditions.checkNotNull(resourceLoader,
                "resourceLoader must not be null");
    }

    /**
     * Returns the dialect-qualified file name.
     *
     * @param dialect dialect name
     * @return {@code schema_<dialect>.sql}
     */
    public static String dialectFileName(String dialect) {
        return "schema_" + dialect + ".sql";
    }

    /**
     * Resolves, reads and splits the schema source.
     *
     * @param location schema directory as a resource location
     * @param dialect dialect name
     * @return statements of the selected file
     * @throws SchemaException if neither file exists or the file cannot be read
     */
    public SchemaSource locate(String location, String dialect) {
        Preconditions.checkNotNull(dialect, "dialect must not be null");
        String base = normalizeLocation(location);

        Resource specific = resourceLoader.getResource(base + dialectFileName(dialect));
        if (specific.exists()) {
            return read(specific, dialect, true);
        }
        Resource generic = resourceLoader.getResource(base + GENERIC_FILE_NAME);
        if (generic.exists()) {
            log.debug("[{}] No {} under {} → falling back to {}", dialect,
                    dialectFileName(dialect), base, GENERIC_FILE_NAME);
            return read(generic, dialect, false);
        }
        throw new SchemaException("No schema source for dialect '" + dialect + "' under " + base
                + " (looked for " + dialectFileName(dialect) + " and " + GENERIC_FILE_NAME + ")");
    }

    private SchemaSource read(Resource resource, String dialect, boolean dialectSpecific) {
        String description = resource.getDescription();
        try (InputStream in = resource.getInputStream()) {
            String script = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            // Only PostgreSQL nests block comments
            List<String> statements = SqlScripts.splitStatements(script,
                    BackendKind.POSTGRES.getDialect().equals(dialect));
            log.debug("[{}] Read {} statement(s) from {}", dialect, statements.size(),
                    description);
            return new SchemaSource(dialect, description, dialectSpecific, statements);
        } catch (IOException e) {
            throw new SchemaException("Failed to read schema source " + description, e);
        }
    }

    /**
     * Normalizes a location into a prefix ending with {@code /}.
     */
    private static String normalizeLocation(String location) {
        String base = StringUtils.isBlank(location) ? "classpath:schema" : location.trim();
        if (!base.startsWith("classpath:") && !base.startsWith("file:") && !base.contains("://")) {
            base = "file:" + base;
        }
        return base.endsWith("/") ? base : base + "/";
    }
}
