package leaveflow.leaveflowbackend.config;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CacheConfig {

    // 조직도는 외부 동기화로만 바뀐다
    @Bean
    public CacheManager cacheManager() {
        return new ConcurrentMapCacheManager("employeeCache", "hrStaffCache");
    }
}
