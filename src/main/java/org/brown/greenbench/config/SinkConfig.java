package org.brown.greenbench.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.brown.greenbench.aggregate.ResultAggregator;
import org.brown.greenbench.sink.CompositeResultSink;
import org.brown.greenbench.sink.JsonFileResultSink;
import org.brown.greenbench.sink.RedisResultSink;
import org.brown.greenbench.sink.ResultSink;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 결과 싱크 구성: 파일(기본) + Redis(선택)
 */
@Slf4j
@Configuration
public class SinkConfig {

    @Bean
    public ResultSink resultSink(MeasurementProperties properties,
                                 ObjectMapper objectMapper,
                                 ObjectProvider<StringRedisTemplate> redisTemplate) {
        MeasurementProperties.SinkConfig sink = properties.getSink();
        List<ResultSink> sinks = new ArrayList<>();
        if (sink.getFile().isEnabled()) {
            Path dir = Path.of(sink.getFile().getOutputDir()).toAbsolutePath();
            log.info("File sink enabled: {}", dir);
            sinks.add(new JsonFileResultSink(objectMapper, dir));
        }
        if (sink.getRedis().isEnabled()) {
            log.info("Redis sink enabled: {}:{} (prefix {})",
                    sink.getRedis().getHost(), sink.getRedis().getPort(), sink.getRedis().getChannelPrefix());
            sinks.add(new RedisResultSink(redisTemplate.getObject(), objectMapper, sink.getRedis().getChannelPrefix()));
        }
        return new CompositeResultSink(sinks);
    }

    @Bean
    public ResultAggregator resultAggregator(ResultSink resultSink) {
        return new ResultAggregator(resultSink);
    }
}
