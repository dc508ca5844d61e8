package io.github.yok.schedlink;

import io.github.yok.schedlink.config.ConnectionConfig;
import io.github.yok.schedlink.config.EtlConfig;
import io.github.yok.schedlink.core.AppointmentLoader;
import io.github.yok.schedlink.core.ExtractionResult;
import io.github.yok.schedlink.core.LoadResult;
import io.github.yok.schedlink.core.SchemaBuilder;
import io.github.yok.schedlink.core.SqlServerAppointmentExtractor;
import io.github.yok.schedlink.db.SchemaResetHandlerFactory;
import io.github.yok.schedlink.infer.DictionarySexInferrer;
import io.github.yok.schedlink.util.ErrorHandler;
import io.github.yok.schedlink.util.MaskingLogUtil;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Provides the application entry point.
 *
 * <p>
 * Runs one ETL pass: extracts the HIS appointments, asks for confirmation, wipes and rebuilds the
 * analysis tables and loads the batch in one transaction.
 * </p>
 *
 * <p>
 * Arguments:
 * </p>
 * <ul>
 * <li>{@code --load} or {@code -l} runs the load (default when omitted).</li>
 * <li>{@code --yes} or {@code -y} skips the confirmation prompt even when
 * {@code etl.confirm-before-load} is {@code true}.</li>
 * </ul>
 *
 * <p>
 * Exit status: {@code 0} when the load committed, when the source had no data, when extraction
 * failed, or when the operator cancelled; {@code 1} when the load failed and was rolled back.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 * @see SqlServerAppointmentExtractor
 * @see AppointmentLoader
 */
@Slf4j
@SpringBootApplication
@RequiredArgsConstructor
public class Main implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_FAILURE = 1;

    private final ConnectionConfig connectionConfig;
    private final EtlConfig etlConfig;
    private final SchemaResetHandlerFactory resetHandlerFactory;

    private int exitCode;

    /**
     * Bootstraps the application and exits with the run's status.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Main.class);
        app.setAddCommandLineProperties(false);
        ConfigurableApplicationContext context = app.run(args);
        if (context != null) {
            System.exit(SpringApplication.exit(context));
        }
    }

    /**
     * Entry point invoked after Spring Boot starts.
     *
     * @param args command-line arguments array
     */
    @Override
    public void run(String... args) {
        log.info("Application started. Args: {}", Arrays.toString(args));

        boolean assumeYes = false;
        for (String arg : args) {
            switch (arg) {
                case "--load":
                case "-l":
                    break;
                case "--yes":
                case "-y":
                    assumeYes = true;
                    break;
                default:
                    log.warn("Unknown argument: {}", arg);
            }
        }

        try {
            log.info("Source: {}", MaskingLogUtil.maskConnection(connectionConfig.getSource()));
            log.info("Destination: {}",
                    MaskingLogUtil.maskConnection(connectionConfig.getDestination()));

            // 1) Extract
            ExtractionResult extraction =
                    new SqlServerAppointmentExtractor(connectionConfig, etlConfig).extract();
            if (!extraction.hasRecords()) {
                if (extraction.getStatus() == ExtractionResult.Status.FAILED) {
                    log.warn("Extraction failed; nothing was loaded. Cause: {}",
                            extraction.getCause().getMessage());
                } else {
                    log.warn("The source returned no appointments; nothing was loaded.");
                }
                return;
            }
            log.info("{} record(s) extracted.", extraction.getRecords().size());

            // 2) Confirm the destructive reset
            if (etlConfig.isConfirmBeforeLoad() && !assumeYes && !confirmLoad()) {
                log.warn("Load cancelled by the operator.");
                return;
            }

            // 3) Transform + load
            DictionarySexInferrer inferrer = new DictionarySexInferrer(
                    etlConfig.getNameDictionaryLocation(), etlConfig.getNameInferenceCountry());
            if (inferrer.size() == 0) {
                log.warn("Name dictionary is empty; inferred_sex will be NULL for every patient.");
            } else {
                log.info("Name dictionary ready ({} names).", inferrer.size());
            }
            AppointmentLoader loader = new AppointmentLoader(connectionConfig, etlConfig,
                    new SchemaBuilder(resetHandlerFactory.create()), inferrer);
            LoadResult result = loader.load(extraction.getRecords());
            log.info("Load completed. {} appointment(s) committed.", result.getAppointments());

        } catch (Exception e) {
            exitCode = EXIT_FAILURE;
            ErrorHandler.reportFatal("Fatal error: " + e.getMessage(), e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Asks the operator to confirm the destructive reset on standard input.
     *
     * @return {@code true} when the operator answered {@code y} or {@code yes}
     * @throws IOException if standard input cannot be read
     */
    boolean confirmLoad() throws IOException {
        System.out.print("WARNING: this wipes ALL data in the analysis database and recreates "
                + "its tables. Continue? [y/N]: ");
        System.out.flush();
        BufferedReader reader =
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String answer = reader.readLine();
        if (answer == null) {
            return false;
        }
        String normalized = answer.trim().toLowerCase(Locale.ROOT);
        return "y".equals(normalized) || "yes".equals(normalized);
    }
}
