package com.linlay.agentreplay.autoconfigure;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentreplay.event.ArgumentsFormatter;
import com.linlay.agentreplay.event.EventPayloadDecoder;
import com.linlay.agentreplay.event.SessionEventReader;
import com.linlay.agentreplay.index.CorrelationIndexBuilder;
import com.linlay.agentreplay.service.SessionReplayService;
import com.linlay.agentreplay.state.SessionStateReducer;
import com.linlay.agentreplay.stream.LiveEventTransformer;
import com.linlay.agentreplay.transcript.ContentBlockInterleaver;
import com.linlay.agentreplay.transcript.EventMessageFormatter;
import com.linlay.agentreplay.transcript.ToolUseMerger;
import com.linlay.agentreplay.transcript.TranscriptReconstructor;
import com.linlay.agentreplay.transcript.question.AnswerMessageParser;
import com.linlay.agentreplay.transcript.question.QuestionArgumentsParser;
import com.linlay.agentreplay.transcript.question.QuestionStatusResolver;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import reactor.core.publisher.Flux;

import java.time.Clock;

@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass({Flux.class, ObjectMapper.class})
@EnableConfigurationProperties(ReplayProperties.class)
public class ReplayAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper replayObjectMapper() {
        return new ObjectMapper();
    }

    @Bean
    @ConditionalOnMissingBean
    public ArgumentsFormatter argumentsFormatter(ObjectMapper objectMapper) {
        return new ArgumentsFormatter(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionEventReader sessionEventReader(ObjectMapper objectMapper) {
        return new SessionEventReader(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventPayloadDecoder eventPayloadDecoder(ArgumentsFormatter argumentsFormatter) {
        return new EventPayloadDecoder(argumentsFormatter);
    }

    @Bean
    @ConditionalOnMissingBean
    public CorrelationIndexBuilder correlationIndexBuilder() {
        return new CorrelationIndexBuilder();
    }

    @Bean
    @ConditionalOnMissingBean
    public AnswerMessageParser answerMessageParser(ReplayProperties properties) {
        return new AnswerMessageParser(properties.answersMarker());
    }

    @Bean
    @ConditionalOnMissingBean
    public ToolUseMerger toolUseMerger(ArgumentsFormatter argumentsFormatter, ReplayProperties properties) {
        return new ToolUseMerger(argumentsFormatter, properties.unknownToolName(), properties.emptyResultPlaceholder());
    }

    @Bean
    @ConditionalOnMissingBean
    public TranscriptReconstructor transcriptReconstructor(
            ToolUseMerger toolUseMerger,
            AnswerMessageParser answerMessageParser,
            ObjectMapper objectMapper,
            ReplayProperties properties
    ) {
        ContentBlockInterleaver interleaver = new ContentBlockInterleaver(
                toolUseMerger,
                new QuestionArgumentsParser(objectMapper),
                new QuestionStatusResolver(answerMessageParser),
                answerMessageParser,
                properties.questionToolName()
        );
        return new TranscriptReconstructor(new EventMessageFormatter(answerMessageParser), interleaver);
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionStateReducer sessionStateReducer() {
        return new SessionStateReducer();
    }

    @Bean
    @ConditionalOnMissingBean
    public SessionReplayService sessionReplayService(
            SessionEventReader eventReader,
            EventPayloadDecoder payloadDecoder,
            CorrelationIndexBuilder indexBuilder,
            TranscriptReconstructor transcriptReconstructor,
            SessionStateReducer stateReducer
    ) {
        return new SessionReplayService(eventReader, payloadDecoder, indexBuilder, transcriptReconstructor, stateReducer);
    }

    @Bean
    @ConditionalOnMissingBean
    public LiveEventTransformer liveEventTransformer(ArgumentsFormatter argumentsFormatter) {
        return new LiveEventTransformer(argumentsFormatter, Clock.systemUTC());
    }
}
