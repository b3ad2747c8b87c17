package io.github.samzhu.gpuledger.repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import io.github.samzhu.gpuledger.config.GpuLedgerProperties;
import io.github.samzhu.gpuledger.document.AggregateMap;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot;
import io.github.samzhu.gpuledger.document.CumulativeSnapshot.Entry;
import io.github.samzhu.gpuledger.dto.UsageScope;
import io.github.samzhu.gpuledger.exception.SnapshotFormatException;
import io.github.samzhu.gpuledger.repository.SnapshotLineCodec.SnapshotLine;

/**
 * 以文字檔儲存快照的 {@link UsageSnapshotRepository} 實作。
 *
 * <p>檔案配置 ({@code gpuledger.snapshot.directory} 目錄下)：
 * <ul>
 *   <li>{@code user_dictionary.csv} / {@code user_dictionary_sum.csv}</li>
 *   <li>{@code group_dictionary.csv} / {@code group_dictionary_sum.csv}</li>
 *   <li>{@code partition_dictionary.csv} / {@code partition_dictionary_sum.csv}</li>
 * </ul>
 *
 * <p>每行一個實體，依加權 GPU hours 由大到小排序，格式見 {@link SnapshotLineCodec}。
 *
 * <p>寫入流程：先寫入同目錄的暫存檔，再以 atomic move 取代目標檔案，
 * 讀取端只會看到完整的舊檔或新檔。
 */
@Repository
public class FileUsageSnapshotRepository implements UsageSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(FileUsageSnapshotRepository.class);

    private final Path directory;

    public FileUsageSnapshotRepository(GpuLedgerProperties properties) {
        this.directory = properties.snapshot().directory();
        log.info("FileUsageSnapshotRepository initialized: directory={}", directory);
    }

    public Path dailyFile(UsageScope scope) {
        return directory.resolve(scope.fileStem() + "_dictionary.csv");
    }

    public Path cumulativeFile(UsageScope scope) {
        return directory.resolve(scope.fileStem() + "_dictionary_sum.csv");
    }

    @Override
    public AggregateMap findDaily(UsageScope scope) {
        AggregateMap usage = new AggregateMap();
        for (SnapshotLine line : readLines(dailyFile(scope))) {
            usage.merge(line.name(), line.usage());
        }
        return usage;
    }

    @Override
    public void saveDaily(UsageScope scope, AggregateMap usage) {
        List<String> lines = usage.sortedByWeightedHoursDesc().stream()
            .map(entry -> SnapshotLineCodec.encode(entry.getKey(), entry.getValue()))
            .toList();
        writeAtomically(dailyFile(scope), lines);
        log.info("Saved daily {} usage: {} entities -> {}", scope, usage.size(), dailyFile(scope));
    }

    /**
     * 讀取累計快照。
     *
     * <p>沒有 index 的行 (舊格式) 依檔案順序，從檔案中最大 index + 1 開始配發。
     */
    @Override
    public CumulativeSnapshot findCumulative(UsageScope scope) {
        Path file = cumulativeFile(scope);
        List<SnapshotLine> lines = readLines(file);

        int nextIndex = lines.stream()
            .filter(line -> line.index() != null)
            .mapToInt(SnapshotLine::index)
            .max()
            .orElse(0) + 1;

        Set<String> names = new HashSet<>();
        List<Entry> entries = new ArrayList<>(lines.size());
        for (SnapshotLine line : lines) {
            if (!names.add(line.name())) {
                throw new SnapshotFormatException(file, line.name(), "duplicate entity name");
            }
            int index = line.index() != null ? line.index() : nextIndex++;
            entries.add(new Entry(line.name(), index, line.usage()));
        }

        try {
            return new CumulativeSnapshot(entries);
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException(file, "", e.getMessage());
        }
    }

    @Override
    public void saveCumulative(UsageScope scope, CumulativeSnapshot snapshot) {
        List<String> lines = snapshot.entries().stream()
            .sorted(Comparator
                .comparingDouble((Entry e) -> e.usage().weightedGpuHours())
                .reversed()
                .thenComparingInt(Entry::index))
            .map(entry -> SnapshotLineCodec.encode(entry.name(), entry.usage(), entry.index()))
            .toList();
        writeAtomically(cumulativeFile(scope), lines);
        log.info("Saved cumulative {} snapshot: {} entities -> {}", scope, snapshot.size(), cumulativeFile(scope));
    }

    private List<SnapshotLine> readLines(Path file) {
        if (!Files.exists(file)) {
            log.info("Snapshot file {} does not exist, starting from empty", file);
            return List.of();
        }
        try {
            List<SnapshotLine> result = new ArrayList<>();
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    result.add(SnapshotLineCodec.decode(file, line.strip()));
                }
            }
            return result;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read snapshot file " + file, e);
        }
    }

    private void writeAtomically(Path target, List<String> lines) {
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            Files.write(temp, lines, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.warn("Atomic move not supported for {}, falling back to replace", target);
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new UncheckedIOException("Failed to write snapshot file " + target, e);
        }
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Failed to delete temporary snapshot file {}: {}", temp, e.getMessage());
        }
    }
}
