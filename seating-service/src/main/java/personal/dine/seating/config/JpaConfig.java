package personal.dine.seating.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * JPA Auditing 활성화 (created_at, updated_at 자동 관리)
 * 애플리케이션 클래스에 두면 @WebMvcTest 슬라이스에서도 로드되므로 분리
 */
@Configuration
@EnableJpaAuditing
public class JpaConfig {
}
