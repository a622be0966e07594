package cz.cuni.mff.d3s.ctdtlp.oracle.nuxmv;

import cz.cuni.mff.d3s.ctdtlp.oracle.common.Oracle;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleProtocolException;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleResponse;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.OracleTimeoutException;
import cz.cuni.mff.d3s.ctdtlp.oracle.common.Verdict;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Oracle backed by the nuXmv model checker, run once per query as a subprocess.
 *
 * <p>Each query writes a temporary command script, runs {@code nuXmv -source <script>},
 * waits at most the given timeout and deletes the script again on every exit path.
 */
@Slf4j
@RequiredArgsConstructor
public class NuXmvOracle implements Oracle {

    private static final long STREAM_JOIN_MILLIS = 5000;

    @Getter
    private final NuXmvConfiguration configuration;

    @Override
    public OracleResponse submit(Path model, String formula, Duration timeout) {
        String script = NuXmvCommandScript.render(model, formula);

        Path scriptFile = createScriptFile(script);
        try {
            String output = run(List.of(configuration.getBinary(), "-source", scriptFile.toString()), formula, timeout);
            Verdict verdict = VerdictParser.parse(output, formula);
            log.debug("nuXmv verdict {} for formula {}", verdict, formula);
            return OracleResponse.builder()
                    .verdict(verdict)
                    .formula(formula)
                    .rawOutput(output)
                    .build();
        } finally {
            deleteScriptFile(scriptFile);
        }
    }

    @Override
    public String getName() {
        return "nuXmv (" + configuration.getBinary() + ")";
    }

    private String run(List<String> command, String formula, Duration timeout) {
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        if (configuration.getWorkingDirectory() != null) {
            processBuilder.directory(configuration.getWorkingDirectory().toFile());
        }

        log.trace("Executing command: {}", String.join(" ", command));
        Process process;
        try {
            process = processBuilder.start();
        } catch (IOException e) {
            log.error("Failed to start nuXmv binary '{}'", configuration.getBinary(), e);
            throw new OracleProtocolException("Could not start nuXmv binary '" + configuration.getBinary() + "'",
                    formula, e);
        }

        StringBuilder output = new StringBuilder();
        StringBuilder errorOutput = new StringBuilder();
        Thread outputReader = new Thread(() -> readStream(process.getInputStream(), output));
        Thread errorReader = new Thread(() -> readStream(process.getErrorStream(), errorOutput));
        outputReader.start();
        errorReader.start();

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("nuXmv timed out after {} ms, terminating", timeout.toMillis());
                process.destroyForcibly();
                throw new OracleTimeoutException(formula, timeout);
            }
            outputReader.join(STREAM_JOIN_MILLIS);
            errorReader.join(STREAM_JOIN_MILLIS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new OracleProtocolException("Interrupted while waiting for nuXmv", formula, e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.debug("nuXmv exited with code {}", exitCode);
        }
        return output + "\n" + errorOutput;
    }

    private static Path createScriptFile(String script) {
        try {
            Path file = Files.createTempFile("ctdtlp-", ".cmd");
            Files.writeString(file, script, StandardCharsets.UTF_8);
            return file;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write nuXmv command script", e);
        }
    }

    private static void deleteScriptFile(Path scriptFile) {
        try {
            Files.deleteIfExists(scriptFile);
        } catch (IOException e) {
            log.warn("Failed to delete nuXmv command script {}", scriptFile, e);
        }
    }

    private static void readStream(InputStream inputStream, StringBuilder output) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append(System.lineSeparator());
            }
        } catch (IOException e) {
            log.error("Error reading nuXmv process stream", e);
        }
    }
}
