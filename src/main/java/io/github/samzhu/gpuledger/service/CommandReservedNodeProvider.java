package io.github.samzhu.gpuledger.service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.gpuledger.exception.NodeLookupException;

/**
 * 執行 shell 指令取得保留池節點清單。
 *
 * <p>預設指令：
 * <pre>
 * sinfo -p kempner_requeue -N 1 | grep kempner | awk '{print $1}'
 * </pre>
 *
 * <p>指令以 {@code /bin/sh -c} 執行，stdout 與 stderr 先寫入暫存檔，
 * 指令結束 (或逾時) 後才讀取；stdout 每行一個節點名稱，空白行忽略。
 *
 * <p>以下情況視為查詢失敗：
 * <ul>
 *   <li>非零結束碼或逾時</li>
 *   <li>stdout 沒有任何節點且 stderr 有輸出 (管線前段失敗時 sh 仍回傳最後一段的結束碼)</li>
 * </ul>
 */
public class CommandReservedNodeProvider implements ReservedNodeProvider {

    private static final Logger log = LoggerFactory.getLogger(CommandReservedNodeProvider.class);

    private final String command;
    private final Duration timeout;

    public CommandReservedNodeProvider(String command, Duration timeout) {
        this.command = command;
        this.timeout = timeout;
    }

    @Override
    public Set<String> fetchReservedNodes() {
        log.debug("Running reserved node command: {}", command);
        Path stdout = null;
        Path stderr = null;
        try {
            stdout = Files.createTempFile("gpuledger-nodes", ".out");
            stderr = Files.createTempFile("gpuledger-nodes", ".err");
            return run(stdout, stderr);
        } catch (IOException e) {
            throw new NodeLookupException("Failed to run reserved node command: " + command, e);
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private Set<String> run(Path stdout, Path stderr) throws IOException {
        Process process = new ProcessBuilder(List.of("/bin/sh", "-c", command))
            .redirectOutput(stdout.toFile())
            .redirectError(stderr.toFile())
            .start();

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                throw new NodeLookupException("Reserved node command timed out after " + timeout + ": " + command);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new NodeLookupException("Interrupted while waiting for reserved node command: " + command, e);
        }

        String errors = Files.readString(stderr, StandardCharsets.UTF_8).strip();
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new NodeLookupException("Reserved node command exited with code " + exitCode + ": " + command
                + (errors.isEmpty() ? "" : ", stderr: " + errors));
        }

        Set<String> nodes = new LinkedHashSet<>();
        for (String line : Files.readAllLines(stdout, StandardCharsets.UTF_8)) {
            String node = line.trim();
            if (!node.isEmpty()) {
                nodes.add(node);
            }
        }

        if (nodes.isEmpty() && !errors.isEmpty()) {
            throw new NodeLookupException("Reserved node command produced no nodes: " + command + ", stderr: " + errors);
        }
        if (!errors.isEmpty()) {
            log.warn("Reserved node command wrote to stderr: {}", errors);
        }

        log.debug("Reserved node command returned {} nodes", nodes.size());
        return Set.copyOf(nodes);
    }

    private void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Failed to delete temporary file {}: {}", file, e.getMessage());
        }
    }
}
