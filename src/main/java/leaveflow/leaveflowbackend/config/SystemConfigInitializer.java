package leaveflow.leaveflowbackend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import leaveflow.leaveflowbackend.entity.mysql.AiSystemConfig;
import leaveflow.leaveflowbackend.enums.AiConfigKey;
import leaveflow.leaveflowbackend.repository.mysql.AiSystemConfigRepository;

/**
 * 애플리케이션 시작 시 ai_system_config 에 빠진 키를 기본값으로 채운다.
 * 이미 있는 값은 건드리지 않음
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SystemConfigInitializer implements ApplicationRunner {

    private final AiSystemConfigRepository configRepository;

    @Override
    public void run(ApplicationArguments args) {
        try {
            int created = 0;
            for (AiConfigKey key : AiConfigKey.values()) {
                if (!configRepository.existsById(key.getKey())) {
                    configRepository.save(new AiSystemConfig(key.getKey(), key.getDefaultValue(), key.getDescription()));
                    created++;
                }
            }
            if (created > 0) {
                log.info("시스템 설정 기본값 {}건 생성", created);
            }
        } catch (Exception e) {
            log.error("시스템 설정 초기화 중 오류 발생", e);
        }
    }
}
