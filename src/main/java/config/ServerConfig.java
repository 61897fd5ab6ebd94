package config;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;
import protocol.RespProtocol;

/**
 * 서버 설정을 관리하는 클래스
 */
@Slf4j
@Getter
@Setter
@ToString
public class ServerConfig {
    private int port = 6379;
    private String bindAddress = "0.0.0.0";

    private int maxBulkLength = RespProtocol.DEFAULT_MAX_BULK_LENGTH;
    private int maxMultibulkLength = RespProtocol.DEFAULT_MAX_MULTIBULK_LENGTH;
    private long maxQueryBufferBytes = 1024L * 1024 * 1024;  // 커넥션당 미처리 바이트 한도

    private int idleTimeoutSeconds = 0;       // 0이면 끊지 않음
    private long sweepIntervalMillis = 100;   // 0이면 백그라운드 정리 안 함

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다. 잘못된 값은 경고만 남기고 기본값을 유지합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                log.warn("Missing value for option {}", flag);
                break;
            }
            String value = args[++i];
            switch (flag) {
                case "--port":
                    Integer parsedPort = parseInt(flag, value, 0, 65535);
                    if (parsedPort != null) {
                        this.port = parsedPort;
                    }
                    break;
                case "--bind":
                    this.bindAddress = value;
                    break;
                case "--max-bulk-length":
                    Integer bulk = parseInt(flag, value, 1, Integer.MAX_VALUE);
                    if (bulk != null) {
                        this.maxBulkLength = bulk;
                    }
                    break;
                case "--max-multibulk-length":
                    Integer multibulk = parseInt(flag, value, 1, Integer.MAX_VALUE);
                    if (multibulk != null) {
                        this.maxMultibulkLength = multibulk;
                    }
                    break;
                case "--max-query-buffer":
                    Long queryBuffer = parseLong(flag, value, 1, RespProtocol.MAX_REQUEST_BUFFER_LENGTH);
                    if (queryBuffer != null) {
                        this.maxQueryBufferBytes = queryBuffer;
                    }
                    break;
                case "--idle-timeout":
                    Integer idle = parseInt(flag, value, 0, Integer.MAX_VALUE / 1000);
                    if (idle != null) {
                        this.idleTimeoutSeconds = idle;
                    }
                    break;
                case "--sweep-interval":
                    Long sweep = parseLong(flag, value, 0, Long.MAX_VALUE);
                    if (sweep != null) {
                        this.sweepIntervalMillis = sweep;
                    }
                    break;
                default:
                    log.warn("Unknown option {} ignored", flag);
                    break;
            }
        }
        log.info("Server configuration: {}", this);
    }

    private static Integer parseInt(String flag, String value, int min, int max) {
        Long parsed = parseLong(flag, value, min, max);
        return parsed == null ? null : parsed.intValue();
    }

    private static Long parseLong(String flag, String value, long min, long max) {
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < min || parsed > max) {
                log.warn("Value for {} out of range [{}, {}]: {}", flag, min, max, value);
                return null;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: {}", flag, value);
            return null;
        }
    }
}
