package com.yamltest;

import com.yamltest.dto.RunResult;
import com.yamltest.infra.TestFailureException;
import com.yamltest.service.TestRunner;
import io.micronaut.context.ApplicationContext;
import io.micronaut.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Runs the definitions in one YAML file ({@code -} reads stdin) and logs the report.
 * Exits non-zero when any test fails.
 */
public class Application {

    private static final Logger log = LoggerFactory.getLogger(Application.class);

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            log.error("Usage: yamltest <file.yaml | ->");
            System.exit(2);
        }
        String yaml = args[0].equals("-")
            ? new String(System.in.readAllBytes(), StandardCharsets.UTF_8)
            : Files.readString(Path.of(args[0]));

        int status;
        try (ApplicationContext context = ApplicationContext.run()) {
            RunResult result = context.getBean(TestRunner.class).runTests(yaml);
            JsonMapper json = context.getBean(JsonMapper.class);
            log.info("Report: {}", json.writeValueAsString(result));
            status = result.allPassed() ? 0 : 1;
        } catch (TestFailureException e) {
            log.error("Could not run tests: {}", e.getMessage());
            status = 1;
        }
        System.exit(status);
    }
}
