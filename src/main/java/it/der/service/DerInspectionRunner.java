package it.der.service;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

@Component
public class DerInspectionRunner implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(DerInspectionRunner.class);

    private final DerInspectionService inspectionService;
    private final PrintStream out;
    private int failures;

    @Autowired
    public DerInspectionRunner(DerInspectionService inspectionService) {
        this(inspectionService, System.out);
    }

    DerInspectionRunner(DerInspectionService inspectionService, PrintStream out) {
        this.inspectionService = inspectionService;
        this.out = out;
    }

    @Override
    public void run(String... args) {
        if (args.length == 0) {
            logger.info("No input files given. Usage: der-codec <file.der|file.pem>...");
            return;
        }

        for (String arg : args) {
            try {
                DerInspectionService.InspectionResult result = inspectionService.inspect(Path.of(arg));
                out.println("# " + result.source());
                out.println(result.dump());
            } catch (UncheckedIOException ex) {
                failures++;
                logger.error("Cannot read {}: {}", arg, ex.getCause().getMessage());
            } catch (IllegalArgumentException ex) {
                failures++;
                logger.error("Cannot decode {}: {}", arg, ex.getMessage());
            }
        }
    }

    @Override
    public int getExitCode() {
        return failures == 0 ? 0 : 1;
    }
}
