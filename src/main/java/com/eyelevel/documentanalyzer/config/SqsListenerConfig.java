package com.eyelevel.documentanalyzer.config;

import io.awspring.cloud.sqs.config.SqsMessageListenerContainerFactory;
import io.awspring.cloud.sqs.listener.acknowledgement.handler.AcknowledgementMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Duration;

@Configuration
@ConditionalOnProperty(name = "app.processing.dispatch.mode", havingValue = "sqs")
public class SqsListenerConfig {

    /**
     * Creates the container factory for the document job listener. Its concurrency bounds the
     * number of documents extracted in parallel on this instance.
     */
    @Bean("documentJobContainerFactory") // referenced by name from DocumentJobConsumer
    public SqsMessageListenerContainerFactory<Object> documentJobContainerFactory(SqsAsyncClient sqsAsyncClient,
                                                                                  @Value("${app.sqs.listener.document-job-queue.concurrency-limit:10}")
                                                                                  int concurrency,
                                                                                  @Value("${app.sqs.listener.document-job-queue.max-messages-per-poll:10}")
                                                                                  int maxMessagesPerPoll,
                                                                                  @Value("${app.sqs.listener.document-job-queue.poll-timeout-seconds:10}")
                                                                                  int pollTimeoutSeconds) {

        SqsMessageListenerContainerFactory<Object> factory = new SqsMessageListenerContainerFactory<>();
        factory.setSqsAsyncClient(sqsAsyncClient);

        factory.configure(options -> options.acknowledgementMode(AcknowledgementMode.ON_SUCCESS)
                                            .maxConcurrentMessages(concurrency).maxMessagesPerPoll(maxMessagesPerPoll)
                                            .pollTimeout(Duration.ofSeconds(pollTimeoutSeconds)));
        return factory;
    }
}
