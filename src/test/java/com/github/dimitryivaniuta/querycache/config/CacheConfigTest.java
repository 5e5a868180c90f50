package com.github.dimitryivaniuta.querycache.config;

import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CacheConfigTest {

    @Test
    void shouldParseFullRedisUri() {
        RedisStandaloneConfiguration c = CacheConfig.parseRedisUri("redis://cache-user:pw@redis.internal:6380/2");

        assertThat(c.getHostName()).isEqualTo("redis.internal");
        assertThat(c.getPort()).isEqualTo(6380);
        assertThat(c.getUsername()).isEqualTo("cache-user");
        assertThat(c.getPassword().get()).containsExactly("pw".toCharArray());
        assertThat(c.getDatabase()).isEqualTo(2);
    }

    @Test
    void shouldDefaultPortAndDatabase() {
        RedisStandaloneConfiguration c = CacheConfig.parseRedisUri("redis://:secret@localhost");

        assertThat(c.getPort()).isEqualTo(6379);
        assertThat(c.getDatabase()).isZero();
        assertThat(c.getUsername()).isNull();
        assertThat(c.getPassword().get()).containsExactly("secret".toCharArray());
    }

    @Test
    void shouldRejectStringsWithoutHost() {
        assertThatThrownBy(() -> CacheConfig.parseRedisUri("not a uri at all"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CacheConfig.parseRedisUri("localhost:6379"))
                .isInstanceOf(IllegalStateException.class);
    }
}
