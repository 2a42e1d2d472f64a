package org.brown.greenbench.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.aggregate.MeasurementOutcome;
import org.brown.greenbench.model.SessionKey;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis Pub/Sub 으로 결과를 전송한다.
 * 채널: {prefix}{instance}:{variant}:{test}
 *
 * 전송 실패는 로그만 남긴다. 파일 싱크가 기록의 기준이다.
 */
@Slf4j
@RequiredArgsConstructor
public class RedisResultSink implements ResultSink {

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String channelPrefix;

    @Override
    public void accept(MeasurementOutcome outcome) {
        String channel = channel(outcome.getKey());
        try {
            String jsonMessage = objectMapper.writeValueAsString(outcome);
            log.info("[REDIS] Publishing outcome to channel: {}", channel);
            log.debug("   Payload: {}", jsonMessage);

            Long subscriberCount = redisTemplate.convertAndSend(channel, jsonMessage);
            if (subscriberCount != null && subscriberCount > 0) {
                log.info("[REDIS] Outcome published to {} subscriber(s) on {}", subscriberCount, channel);
            } else {
                log.warn("[REDIS] Outcome published but NO SUBSCRIBERS on channel: {}", channel);
            }
        } catch (Exception e) {
            log.error("[REDIS][FAIL] Failed to publish outcome for {} to channel={}", outcome.getKey(), channel, e);
        }
    }

    String channel(SessionKey key) {
        return channelPrefix + key.instanceId() + ":" + key.variantId() + ":" + key.testName();
    }
}
