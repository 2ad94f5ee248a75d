package config;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * Redis 서버 설정을 관리하는 클래스
 */
@Slf4j
@Getter
@Setter
public class ServerConfig {
    private String host = "127.0.0.1";
    private int port = 6379;

    /**
     * 명령행 인수를 파싱하여 설정을 업데이트합니다.
     */
    public void parseCommandLineArgs(String[] args) {
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--bind":
                    if (i + 1 < args.length) {
                        this.host = args[++i];
                        log.info("명령행에서 바인드 주소 설정: {}", this.host);
                    }
                    break;
                case "--port":
                    if (i + 1 < args.length) {
                        try {
                            int value = Integer.parseInt(args[++i]);
                            if (value < 0 || value > 65535) {
                                throw new NumberFormatException("out of range");
                            }
                            this.port = value;
                            log.info("명령행에서 포트 설정: {}", this.port);
                        } catch (NumberFormatException e) {
                            log.warn("잘못된 포트 번호: {}", args[i]);
                        }
                    }
                    break;
                default:
                    log.warn("알 수 없는 인수 무시: {}", args[i]);
                    break;
            }
        }
    }
}
