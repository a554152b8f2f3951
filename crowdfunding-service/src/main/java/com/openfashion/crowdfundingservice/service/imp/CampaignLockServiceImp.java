package com.openfashion.crowdfundingservice.service.imp;

import com.openfashion.crowdfundingservice.core.config.CrowdfundingProperties;
import com.openfashion.crowdfundingservice.service.CampaignLockService;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class CampaignLockServiceImp implements CampaignLockService {

    static final String KEY_PREFIX = "campaign-lock:";

    private static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then " +
                    "return redis.call('del', KEYS[1]) " +
                    "else return 0 end",
            Long.class);

    private final RedisTemplate<String, String> redisTemplate;
    private final CrowdfundingProperties properties;

    @Override
    public Optional<String> acquire(Long campaignId) {
        String ownerToken = UUID.randomUUID().toString();
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(KEY_PREFIX + campaignId, ownerToken, Duration.ofSeconds(properties.getLock().getTtlSeconds()));

        return Boolean.TRUE.equals(success) ? Optional.of(ownerToken) : Optional.empty();
    }

    @Override
    public void release(Long campaignId, String ownerToken) {
        redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(KEY_PREFIX + campaignId), ownerToken);
    }
}
