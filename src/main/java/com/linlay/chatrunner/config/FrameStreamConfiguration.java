package com.linlay.chatrunner.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.chatrunner.frame.FrameCodec;
import com.linlay.chatrunner.stream.FrameFlushWriter;
import com.linlay.chatrunner.stream.FrameStreamer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FrameStreamConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FrameCodec frameCodec(ObjectMapper objectMapper) {
        return new FrameCodec(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public FrameStreamer frameStreamer(FrameCodec frameCodec, ObjectMapper objectMapper, StreamProperties properties) {
        return new FrameStreamer(frameCodec, objectMapper, properties.timeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public FrameFlushWriter frameFlushWriter() {
        return new FrameFlushWriter();
    }
}
