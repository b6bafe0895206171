package personal.salon.sync.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 시간 소스 설정
 * 재시도 백오프, Circuit 타임아웃, 알림 만료 계산이 모두 이 Clock을 기준으로 동작
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
