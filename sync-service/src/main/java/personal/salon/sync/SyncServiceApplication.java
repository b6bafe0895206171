package personal.salon.sync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Sync Service Application
 * 디바이스 등록, 동기화 원장, 오프라인 큐, 알림 팬아웃, 외부 호출 보호를 담당하는 서비스
 */
@EnableScheduling  // Offline Queue Drain / Notification Delivery / Health Probe 스케줄러 활성화
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.salon.sync",
        "personal.salon.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class SyncServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(SyncServiceApplication.class, args);
    }
}
