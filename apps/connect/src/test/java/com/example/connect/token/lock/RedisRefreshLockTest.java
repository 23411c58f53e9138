package com.example.connect.token.lock;

import com.example.connect.credential.model.CredentialKey;
import com.example.connect.util.ConnectTestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ReactiveValueOperations;
import org.springframework.data.redis.core.script.RedisScript;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisRefreshLock")
class RedisRefreshLockTest {

    private static final CredentialKey KEY = new CredentialKey("user-123", "github");
    private static final String LOCK_KEY = "connect:oauth:refresh-lock:user-123:github";

    @Mock
    private ReactiveStringRedisTemplate redisTemplate;

    @Mock
    private ReactiveValueOperations<String, String> valueOps;

    private RedisRefreshLock lock;

    @BeforeEach
    void setUp() {
        lock = new RedisRefreshLock(redisTemplate, ConnectTestFixtures.properties());
    }

    @Test
    @DisplayName("Should hold the lock when SET NX succeeds")
    void acquires() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq(LOCK_KEY), anyString(), eq(Duration.ofSeconds(30)))).thenReturn(Mono.just(true));

        StepVerifier.create(lock.acquire(KEY))
                .assertNext(lease -> {
                    assertThat(lease.acquired()).isTrue();
                    assertThat(lease.owner()).isNotBlank();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should report busy when another holder owns the key")
    void busy() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(eq(LOCK_KEY), anyString(), eq(Duration.ofSeconds(30)))).thenReturn(Mono.just(false));

        StepVerifier.create(lock.acquire(KEY))
                .assertNext(lease -> assertThat(lease.acquired()).isFalse())
                .verifyComplete();
    }

    @Test
    @DisplayName("Should fall back to an unguarded lease when Redis is unreachable")
    void redisDown() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.setIfAbsent(anyString(), anyString(), ArgumentMatchers.any(Duration.class)))
                .thenReturn(Mono.error(new RedisConnectionFailureException("refused")));

        StepVerifier.create(lock.acquire(KEY))
                .assertNext(lease -> {
                    assertThat(lease.acquired()).isTrue();
                    assertThat(lease.owner()).isNull();
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should release with a compare-and-delete script")
    void releasesOwnLock() {
        when(redisTemplate.execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), anyList()))
                .thenReturn(Flux.just(1L));

        StepVerifier.create(lock.release(RefreshLease.held(KEY, "owner-1"))).verifyComplete();

        verify(redisTemplate).execute(ArgumentMatchers.<RedisScript<Long>>any(), eq(List.of(LOCK_KEY)), eq(List.of("owner-1")));
    }

    @Test
    @DisplayName("Should not touch Redis when releasing a lease it never held")
    void releaseWithoutOwner() {
        StepVerifier.create(lock.release(RefreshLease.busy(KEY))).verifyComplete();
        StepVerifier.create(lock.release(RefreshLease.unguarded(KEY))).verifyComplete();

        verify(redisTemplate, never()).execute(ArgumentMatchers.<RedisScript<Long>>any(), anyList(), anyList());
    }
}
