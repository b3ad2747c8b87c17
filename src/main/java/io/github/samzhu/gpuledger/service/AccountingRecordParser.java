package io.github.samzhu.gpuledger.service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.gpuledger.config.GpuLedgerProperties;
import io.github.samzhu.gpuledger.dto.JobRecord;

/**
 * {@code sacct} 帳務紀錄解析服務。
 *
 * <p>只處理已結束的 GPU 作業，其餘行直接略過，不視為錯誤：
 * <ul>
 *   <li>行內需包含 GPU 標記 ({@code gpu})</li>
 *   <li>行內不可包含未結束狀態 ({@code RUNNING}、{@code PENDING})</li>
 *   <li>以 {@code |} 分隔後至少 8 個欄位</li>
 * </ul>
 *
 * <p>帳務檔常包含表頭或不完整的行，因此格式錯誤一律略過 (best-effort)。
 */
@Service
public class AccountingRecordParser {

    private static final Logger log = LoggerFactory.getLogger(AccountingRecordParser.class);

    static final int MIN_FIELDS = 8;
    private static final Pattern FIELD_DELIMITER = Pattern.compile(Pattern.quote("|"));

    private final String gpuMarker;
    private final List<String> excludedStates;

    public AccountingRecordParser(GpuLedgerProperties properties) {
        this.gpuMarker = properties.input().gpuMarker();
        this.excludedStates = List.copyOf(properties.input().excludedStates());
    }

    /**
     * 判斷此行是否為已結束的 GPU 作業。
     *
     * @param line 原始行
     * @return 若應該解析則回傳 true
     */
    public boolean qualifies(String line) {
        if (line == null || !line.contains(gpuMarker)) {
            return false;
        }
        for (String state : excludedStates) {
            if (line.contains(state)) {
                return false;
            }
        }
        return true;
    }

    /**
     * 解析單行帳務紀錄。
     *
     * @param line 原始行
     * @return 作業紀錄；不符合條件或格式錯誤時為 empty
     */
    public Optional<JobRecord> parse(String line) {
        if (!qualifies(line)) {
            return Optional.empty();
        }

        String[] fields = FIELD_DELIMITER.split(line.strip(), -1);
        if (fields.length < MIN_FIELDS) {
            log.debug("Skipping line with {} fields (need {}): {}", fields.length, MIN_FIELDS, line);
            return Optional.empty();
        }

        String userId = fields[2].trim();
        String groupId = firstToken(fields[3]);
        String partitionId = firstToken(fields[4]);
        if (userId.isEmpty() || groupId.isEmpty() || partitionId.isEmpty()) {
            log.debug("Skipping line with empty user, group or partition: {}", line);
            return Optional.empty();
        }

        return Optional.of(new JobRecord(
            userId,
            groupId,
            partitionId,
            fields[5].trim(),
            fields[6].trim(),
            fields[7].trim()));
    }

    private static String firstToken(String field) {
        int comma = field.indexOf(',');
        return (comma < 0 ? field : field.substring(0, comma)).trim();
    }
}
