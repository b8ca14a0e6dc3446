package com.commerce.sync.config;

import com.commerce.sync.service.lock.CoordinationStore;
import com.commerce.sync.service.lock.InMemoryCoordinationStore;
import com.commerce.sync.service.lock.RedisCoordinationStore;
import io.lettuce.core.ClientOptions;
import io.lettuce.core.SocketOptions;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.connection.lettuce.LettucePoolingClientConfiguration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Chooses where leases live: Redis (shared by every instance) or process memory.
 */
@Configuration
public class CoordinationStoreConfig {

    @Configuration
    @ConditionalOnProperty(name = "sync.coordination.store", havingValue = "redis", matchIfMissing = true)
    static class RedisStore {

        @Value("${spring.data.redis.host:localhost}")
        private String redisHost;

        @Value("${spring.data.redis.port:6379}")
        private Integer redisPort;

        @Value("${spring.data.redis.password:}")
        private String redisPassword;

        @Value("${spring.data.redis.database:0}")
        private Integer redisDatabase;

        @Value("${spring.data.redis.timeout:2000}")
        private Integer redisTimeout;

        @Value("${spring.data.redis.lettuce.pool.max-active:16}")
        private Integer maxActive;

        @Value("${spring.data.redis.lettuce.pool.max-idle:8}")
        private Integer maxIdle;

        @Value("${spring.data.redis.lettuce.pool.min-idle:1}")
        private Integer minIdle;

        /**
         * Lettuce with connection pooling. The command timeout bounds every lease operation.
         */
        @Bean
        public RedisConnectionFactory redisConnectionFactory() {
            RedisStandaloneConfiguration redisConfig = new RedisStandaloneConfiguration();
            redisConfig.setHostName(redisHost);
            redisConfig.setPort(redisPort);
            redisConfig.setDatabase(redisDatabase);
            if (redisPassword != null && !redisPassword.isEmpty()) {
                redisConfig.setPassword(redisPassword);
            }

            GenericObjectPoolConfig<?> poolConfig = new GenericObjectPoolConfig<>();
            poolConfig.setMaxTotal(maxActive);
            poolConfig.setMaxIdle(maxIdle);
            poolConfig.setMinIdle(minIdle);
            poolConfig.setMaxWait(Duration.ofMillis(redisTimeout));
            poolConfig.setTestOnBorrow(true);

            SocketOptions socketOptions = SocketOptions.builder()
                    .connectTimeout(Duration.ofMillis(redisTimeout))
                    .keepAlive(true)
                    .build();

            ClientOptions clientOptions = ClientOptions.builder()
                    .socketOptions(socketOptions)
                    .autoReconnect(true)
                    .build();

            LettucePoolingClientConfiguration lettuceConfig = LettucePoolingClientConfiguration.builder()
                    .poolConfig(poolConfig)
                    .clientOptions(clientOptions)
                    .commandTimeout(Duration.ofMillis(redisTimeout))
                    .build();

            return new LettuceConnectionFactory(redisConfig, lettuceConfig);
        }

        // stringRedisTemplate comes from Spring Boot's RedisAutoConfiguration
        @Bean
        public CoordinationStore coordinationStore(StringRedisTemplate stringRedisTemplate) {
            return new RedisCoordinationStore(stringRedisTemplate);
        }
    }

    @Configuration
    @ConditionalOnProperty(name = "sync.coordination.store", havingValue = "memory")
    static class InMemoryStore {

        @Bean
        public CoordinationStore coordinationStore(Clock clock) {
            return new InMemoryCoordinationStore(clock);
        }
    }
}
