package org.dxworks.formframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.formframe.analyzer.FormAnalyzer;
import org.dxworks.formframe.analyzer.infopath.InfoPathFormAnalyzer;
import org.dxworks.formframe.model.Analysis;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar formframe.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Directory of extracted InfoPath forms, or a single view file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Each directory holding view*.xsl files is analysed as one form.");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting form analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        FormframeConfig config = FormframeConfig.load();
        FormAnalyzer analyzer = new InfoPathFormAnalyzer(config);
        Map<Path, List<Path>> forms = ViewFileDetector.collectForms(input);
        System.out.println("Found " + forms.size() + " forms");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_forms", forms.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            forms.entrySet().parallelStream().forEach(entry -> {
                Path form = entry.getKey();
                List<Path> views = entry.getValue();
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + forms.size() + "] Analyzing form: " + form
                            + " (" + views.size() + " views)");
                }

                try {
                    Analysis analysis = analyzer.analyze(form.toString(), views);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(analysis));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception | StackOverflowError e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("form", form.toString());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + form + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error analyzing " + form + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("forms_analyzed", successCount.get());
            doneInfo.put("forms_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + successCount.get() + " forms");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }
}
