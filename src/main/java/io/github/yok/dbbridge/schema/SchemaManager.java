package io.github.yok.dbbridge.schema;

import com.google.common.base.Preconditions;
import io.github.yok.dbbridge.db.DbDriver;
import io.github.yok.dbbridge.error.QueryException;
import io.github.yok.dbbridge.error.SchemaException;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

/**
 * Applies a dialect's schema source through a connected driver.
 *
 * <h2>Procedure</h2>
 *
 * <ol>
 * <li>Resolve the schema source for {@link DbDriver#dialect()} under the driver's configured schema
 * location (see {@link SchemaSourceLocator}).</li>
 * <li>Split it into statements with the literal-aware splitter, dropping blank ones.</li>
 * <li>Pass each statement through {@link DbDriver#transformQuery(String)} and execute it, in
 * source order.</li>
 * </ol>
 *
 * <h2>Idempotency</h2>
 *
 * <p>
 * A failure the driver classifies as "object already exists" is skipped. Nothing is recorded
 * about applied statements: a second run is safe because the engine refuses duplicate creation.
 * Any other failure aborts with a {@link SchemaException} reporting the 0-based statement index
 * and text. Ordering is the schema author's responsibility.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Component
public class SchemaManager {

    private final SchemaSourceLocator locator;

    /**
     * Constructs a manager that loads schema files with the given loader.
     *
     * @param resourceLoader resource loader (the application context inside Spring)
     */
    @Autowired
    public SchemaManager(ResourceLoader resourceLoader) {
        this.locator = new SchemaSourceLocator(resourceLoader);
    }

    /**
     * Constructs a manager that resolves {@code classpath:} and {@code file:} locations.
     */
    public SchemaManager() {
        this(new DefaultResourceLoader());
    }

    /**
     * Applies the schema.
     *
     * @param driver connected driver
     * @return number of statements executed, excluding the skipped "already exists" ones
     * @throws SchemaException if the source is missing or a statement fails
     */
    public int apply(DbDriver driver) {
        Preconditions.checkNotNull(driver, "driver must not be null");
        Preconditions.checkState(driver.config() != null, "driver is not connected");
        String dialect = driver.dialect();
        SchemaSource source = locator.locate(driver.config().getSchemaLocation(), dialect);
        List<String> statements = source.getStatements();
        log.info("[{}] Applying schema from {} ({} statement(s))", dialect, source.getLocation(),
                statements.size());

        int executed = 0;
        int existing = 0;
        for (int i = 0; i < statements.size(); i++) {
            String statement = statements.get(i);
            try {
                driver.execute(driver.transformQuery(statement));
                executed++;
            } catch (QueryException e) {
                if (!driver.isObjectExistsError(e)) {
                    log.error("[{}] Schema statement #{} failed: {}", dialect, i, e.getMessage());
                    throw new SchemaException(i, statement, e);
                }
                existing++;
                log.debug("[{}] Schema statement #{} skipped, object already exists", dialect, i);
            }
        }
        log.info("[{}] Schema applied (executed={}, already existing={})", dialect, executed,
                existing);
        return executed;
    }
}
