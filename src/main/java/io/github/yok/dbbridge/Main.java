package io.github.yok.dbbridge;

import io.github.yok.dbbridge.cli.MigrationCommand;
import io.github.yok.dbbridge.config.DatabaseConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Provides the application entry point.
 *
 * <p>
 * Spring Boot binds {@link DatabaseConfig} from {@code application.yml}; the command-line
 * arguments are handed to {@link MigrationCommand}, whose result becomes the process exit code.
 * </p>
 *
 * <p>
 * Spring's own {@code --name=value} property parsing is disabled so migration options are not
 * mistaken for configuration properties. Use {@code SPRING_APPLICATION_JSON} or environment
 * variables ({@code DATABASE_SOURCE_PATH}, ...) to override configuration.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see MigrationCommand
 */
@Slf4j
@SpringBootApplication
@EnableConfigurationProperties(DatabaseConfig.class)
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    private final MigrationCommand command;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the migration's exit code.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        System.exit(SpringApplication.exit(app.run(args)));
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments
     */
    @Override
    public void run(String... args) {
        log.info("Application started ({} argument(s))", args.length);
        exitCode = command.execute(args);
        log.info("Application finished. Exit code: {}", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
