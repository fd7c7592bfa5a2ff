package io.github.yok.dbbridge.cli;

import java.nio.file.InvalidPathException;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Parses the command line of the migration tool.
 *
 * <p>
 * Options take their value either as the next argument ({@code --batch-size 200}) or inline
 * ({@code --batch-size=200}). Connection options exist once per side with the {@code --source-}
 * and {@code --target-} prefixes.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class MigrationOptionsParser {

    /** Usage text printed on invalid arguments and for {@code --help}. */
    public static final String USAGE = String.join(System.lineSeparator(),
            "Usage: dbbridge [options]",
            "  --source-driver|--target-driver <sqlite|postgres>",
            "  --source-path|--target-path <file>          SQLite database file",
            "  --source-host|--target-host <host>          PostgreSQL host",
            "  --source-port|--target-port <port>",
            "  --source-user|--target-user <user>",
            "  --source-password|--target-password <password>",
            "  --source-db|--target-db <name>",
            "  --source-sslmode|--target-sslmode <mode>",
            "  --source-schema-location|--target-schema-location <location>",
            "  --tables <t1,t2,...>     tables in migration order (default: all, parents first)",
            "  --batch-size <rows>      rows per target transaction",
            "  --timeout <seconds>      bound of one batch attempt",
            "  --retries <attempts>     total attempts per batch",
            "  --workers <count>        concurrent batch writers (PostgreSQL targets)",
            "  --init-schema            apply the target schema before migrating",
            "  --checkpoint <file>      resume from and persist progress to a YAML file",
            "  --help                   print this text");

    /**
     * Parses arguments.
     *
     * @param args command-line arguments
     * @return parsed options
     * @throws InvalidArgumentsException on an unknown option, a missing or malformed value
     */
    public MigrationOptions parse(String... args) {
        MigrationOptions options = new MigrationOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = arg;
            String inline = null;
            int eq = arg.indexOf('=');
            if (arg.startsWith("--") && eq > 0) {
                name = arg.substring(0, eq);
                inline = arg.substring(eq + 1);
            }

            switch (name) {
                case "--init-schema":
                    options.setInitSchema(true);
                    continue;
                case "--help":
                case "-h":
                    options.setHelp(true);
                    continue;
                default:
                    break;
            }

            String value;
            if (inline != null) {
                value = inline;
            } else if (i + 1 < args.length) {
                value = args[++i];
            } else {
                throw new InvalidArgumentsException("Missing value for " + name);
            }

            switch (name) {
                case "--tables":
                    options.setTables(tableList(value));
                    break;
                case "--batch-size":
                    options.setBatchSize(positive(name, value));
                    break;
                case "--timeout":
                    options.setTimeoutSeconds(positive(name, value));
                    break;
                case "--retries":
                    options.setRetries(positive(name, value));
                    break;
                case "--workers":
                    options.setWorkers(positive(name, value));
                    break;
                case "--checkpoint":
                    try {
                        options.setCheckpoint(Paths.get(value));
                    } catch (InvalidPathException e) {
                        throw new InvalidArgumentsException("Invalid checkpoint path: " + value);
                    }
                    break;
                default:
                    if (name.startsWith("--source-")) {
                        connection(options.getSource(), name, "--source-", value);
                    } else if (name.startsWith("--target-")) {
                        connection(options.getTarget(), name, "--target-", value);
                    } else {
                        throw new InvalidArgumentsException("Unknown option: " + arg);
                    }
            }
        }
        return options;
    }

    private void connection(MigrationOptions.ConnectionOverrides overrides, String name,
            String prefix, String value) {
        switch (name.substring(prefix.length())) {
            case "driver":
                overrides.setDriver(value);
                break;
            case "path":
                overrides.setPath(value);
                break;
            case "host":
                overrides.setHost(value);
                break;
            case "port":
                overrides.setPort(positive(name, value));
                break;
            case "user":
                overrides.setUser(value);
                break;
            case "password":
                overrides.setPassword(value);
                break;
            case "db":
            case "dbname":
                overrides.setDbname(value);
                break;
            case "sslmode":
                overrides.setSslmode(value);
                break;
            case "schema-location":
                overrides.setSchemaLocation(value);
                break;
            default:
                throw new InvalidArgumentsException("Unknown option: " + name);
        }
    }

    private static List<String> tableList(String value) {
        List<String> tables = Arrays.stream(value.split(",")).map(String::trim)
                .filter(StringUtils::isNotEmpty).collect(Collectors.toList());
        if (tables.isEmpty()) {
            throw new InvalidArgumentsException("--tables needs at least one table name");
        }
        return tables;
    }

    private static int positive(String name, String value) {
        int parsed;
        try {
            parsed = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidArgumentsException(name + " expects a number: " + value);
        }
        if (parsed <= 0) {
            throw new InvalidArgumentsException(name + " must be positive: " + value);
        }
        return parsed;
    }
}
