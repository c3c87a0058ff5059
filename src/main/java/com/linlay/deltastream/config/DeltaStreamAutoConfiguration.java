package com.linlay.deltastream.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.deltastream.processor.ChunkProcessorFactory;
import com.linlay.deltastream.sanitize.CommentaryToolCallExtractor;
import com.linlay.deltastream.sanitize.ContentSanitizer;
import com.linlay.deltastream.sanitize.LlmOutputSanitizer;
import com.linlay.deltastream.stream.DeltaStreamPump;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@AutoConfiguration
@ConditionalOnClass({Flux.class, ObjectMapper.class})
@EnableConfigurationProperties(DeltaStreamProperties.class)
public class DeltaStreamAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper deltaStreamObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public ContentSanitizer contentSanitizer() {
        return new LlmOutputSanitizer();
    }

    @Bean
    @ConditionalOnMissingBean
    public CommentaryToolCallExtractor commentaryToolCallExtractor(ObjectMapper objectMapper) {
        return new CommentaryToolCallExtractor(objectMapper);
    }

    @Bean(name = "deltaStreamScheduler")
    @ConditionalOnMissingBean(name = "deltaStreamScheduler")
    public Scheduler deltaStreamScheduler() {
        return Schedulers.parallel();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChunkProcessorFactory chunkProcessorFactory(
            DeltaStreamProperties properties,
            ContentSanitizer contentSanitizer,
            CommentaryToolCallExtractor commentaryToolCallExtractor,
            @Qualifier("deltaStreamScheduler") Scheduler deltaStreamScheduler
    ) {
        return new ChunkProcessorFactory(
                properties.toOptions(),
                contentSanitizer,
                commentaryToolCallExtractor,
                deltaStreamScheduler
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public DeltaStreamPump deltaStreamPump(
            ChunkProcessorFactory chunkProcessorFactory,
            DeltaStreamProperties properties,
            @Qualifier("deltaStreamScheduler") Scheduler deltaStreamScheduler
    ) {
        return new DeltaStreamPump(chunkProcessorFactory, properties.pollInterval(), deltaStreamScheduler);
    }
}
