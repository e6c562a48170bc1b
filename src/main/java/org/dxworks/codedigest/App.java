package org.dxworks.codedigest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.codedigest.analysis.AnalysisClient;
import org.dxworks.codedigest.analysis.AnalysisOutcome;
import org.dxworks.codedigest.analysis.AnalysisPrompts;
import org.dxworks.codedigest.analysis.MockAnalysisClient;
import org.dxworks.codedigest.budget.BudgetFitResult;
import org.dxworks.codedigest.model.SourceUnit;
import org.dxworks.codedigest.pipeline.BatchDigester;
import org.dxworks.codedigest.pipeline.CodeDigester;
import org.dxworks.codedigest.pipeline.DigestResult;
import org.dxworks.codedigest.pipeline.UnitResult;
import org.dxworks.codedigest.pipeline.UnitStatus;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar codedigest.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a COBOL source directory or file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.err.println("Supported extensions: .cbl, .cob, .cpy, .cobol");
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

        System.out.println("Starting COBOL digest...");
        System.out.println("Input: " + input.toAbsolutePath());

        CodedigestConfig config = CodedigestConfig.load();
        List<Path> files = collectSourceFiles(input, config.getMaxFileLines());
        System.out.println("Found " + files.size() + " source files");

        Instant startTime = Instant.now();
        RunCounters counters = new RunCounters();

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            runInfo.put("context_window", config.getBudget().getContextWindow());
            runInfo.put("threads", config.getThreads());
            writeRecord(writer, runInfo);

            List<SourceUnit> units = readUnits(files, config, writer, counters);

            CodeDigester digester = new CodeDigester(config.createClassifier(), config.getThresholds(), config.getBudget());
            AnalysisClient analysisClient = config.isMockAnalysis() ? new MockAnalysisClient() : null;
            BatchDigester batch = new BatchDigester(digester, config.getThreads());

            batch.digestAll(units, result -> {
                int current = counters.progress.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] " + result.getStatus() + ": " + result.getUnitName());
                }
                try {
                    writeRecord(writer, toRecord(result, analysisClient));
                } catch (IOException e) {
                    System.err.println("Failed to write result for " + result.getUnitName() + ": " + e.getMessage());
                }
                counters.count(result);
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_digested", counters.digested.get());
            doneInfo.put("files_too_large", counters.tooLarge.get());
            doneInfo.put("files_with_errors", counters.errors.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writeRecord(writer, doneInfo);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Digest complete!");
        System.out.println("Successfully digested: " + counters.digested.get() + " files");
        if (counters.tooLarge.get() > 0) {
            System.out.println("Too large for the token budget: " + counters.tooLarge.get());
        }
        if (counters.errors.get() > 0) {
            System.out.println("Errors: " + counters.errors.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static Map<String, Object> toRecord(UnitResult result, AnalysisClient analysisClient) {
        Map<String, Object> record = new LinkedHashMap<>();
        DigestResult digest = result.getDigest();
        if (digest == null) {
            record.put("kind", "error");
            record.put("file", result.getUnitName());
            record.put("status", result.getStatus().name());
            record.put("error", result.getError());
            return record;
        }

        record.put("kind", "unit");
        record.put("file", digest.getUnitName());
        record.put("language_variant", digest.getLanguageVariant());
        record.put("status", result.getStatus().name());
        BudgetFitResult fit = digest.getFitResult();
        if (fit instanceof BudgetFitResult.Fitted fitted) {
            record.put("summary", fitted.getSummary());
            record.put("payload_tokens", fitted.getEstimatedTokens());
            record.put("allowed_response_tokens", fitted.getAllowedResponseTokens());
            record.put("shrink_steps", fitted.getStepsApplied());
            if (analysisClient != null) {
                AnalysisOutcome outcome = analysisClient.analyze(fitted.getPayload(), AnalysisPrompts.SYSTEM_PREAMBLE);
                record.put("analysis", outcome);
            }
        } else {
            record.put("error", result.getError());
        }
        record.put("metrics", digest.getMetrics());
        record.put("diagnostics", digest.getDiagnostics());
        return record;
    }

    private static List<SourceUnit> readUnits(List<Path> files, CodedigestConfig config, BufferedWriter writer,
                                              RunCounters counters) {
        List<SourceUnit> units = new ArrayList<>(files.size());
        for (Path file : files) {
            try {
                units.add(new SourceUnit(file.toString(), config.getSourceFormat(), Files.readAllBytes(file),
                        config.getDefaultEncoding()));
            } catch (IOException e) {
                System.err.println("  Error reading " + file.getFileName() + ": " + e.getMessage());
                UnitResult failed = UnitResult.failed(file.toString(), e);
                counters.count(failed);
                try {
                    writeRecord(writer, toRecord(failed, null));
                } catch (IOException ioException) {
                    System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                }
            }
        }
        return units;
    }

    private static void writeRecord(BufferedWriter writer, Map<String, Object> record) throws IOException {
        String line = MAPPER.writeValueAsString(record);
        synchronized (writer) {
            writer.write(line);
            writer.newLine();
            writer.flush();
        }
    }

    private static List<Path> collectSourceFiles(Path input, int maxFileLines) throws IOException {
        List<Path> files = new ArrayList<>();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> LanguageDetector.detectLanguage(p).isPresent())
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (withinMaxLines(input, maxFileLines) && LanguageDetector.detectLanguage(input).isPresent()) {
                files.add(input);
            }
        }

        return files;
    }

    // counts line feeds on the raw bytes, the encoding is not known yet
    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try {
            byte[] bytes = Files.readAllBytes(path);
            long count = 0;
            for (byte b : bytes) {
                if (b == '\n' && ++count > maxFileLines) {
                    System.out.println("Skipping " + path.getFileName() + ": more than " + maxFileLines + " lines");
                    return false;
                }
            }
            return true;
        } catch (IOException e) {
            // unreadable files are reported when they are read as units
            return true;
        }
    }

    private static final class RunCounters {
        private final AtomicInteger progress = new AtomicInteger(0);
        private final AtomicInteger digested = new AtomicInteger(0);
        private final AtomicInteger tooLarge = new AtomicInteger(0);
        private final AtomicInteger errors = new AtomicInteger(0);

        void count(UnitResult result) {
            if (result.getStatus() == UnitStatus.DIGESTED) {
                digested.incrementAndGet();
            } else if (result.getStatus() == UnitStatus.INPUT_TOO_LARGE) {
                tooLarge.incrementAndGet();
            } else {
                errors.incrementAndGet();
            }
        }
    }
}
