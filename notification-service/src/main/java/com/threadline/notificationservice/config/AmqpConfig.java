package com.threadline.notificationservice.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.core.*;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ configuration for notification service.
 *
 * One queue bound to every realtime.* routing key; producers route by
 * realtime.{entity_type}.{event_type}.
 */
@Configuration
public class AmqpConfig {

    public static final String DLX_NAME = "dlx";
    public static final String DLQ_NAME = "q.dlq";
    public static final String DLQ_ROUTING_KEY = "dlq";

    public static final String REALTIME_EXCHANGE = "realtime_events_exchange";
    public static final String Q_REALTIME_EVENTS = "q.notification.realtime.events";
    public static final String ROUTING_KEY_REALTIME_ALL = "realtime.#";

    @Bean
    public TopicExchange deadLetterExchange() {
        return new TopicExchange(DLX_NAME);
    }

    @Bean
    public Queue deadLetterQueue() {
        return new Queue(DLQ_NAME);
    }

    @Bean
    public Binding deadLetterBinding() {
        return BindingBuilder.bind(deadLetterQueue()).to(deadLetterExchange()).with("#");
    }

    @Bean
    public TopicExchange realtimeEventsExchange() {
        return new TopicExchange(REALTIME_EXCHANGE);
    }

    @Bean
    public Queue realtimeEventsQueue() {
        return createDurableQueue(Q_REALTIME_EVENTS);
    }

    @Bean
    public Binding realtimeEventsBinding(Queue realtimeEventsQueue, TopicExchange realtimeEventsExchange) {
        return BindingBuilder.bind(realtimeEventsQueue).to(realtimeEventsExchange).with(ROUTING_KEY_REALTIME_ALL);
    }

    @Bean
    public MessageConverter jsonMessageConverter(ObjectMapper objectMapper) {
        return new Jackson2JsonMessageConverter(objectMapper);
    }

    // Poison messages go to the DLQ instead of looping
    private Queue createDurableQueue(String queueName) {
        return QueueBuilder.durable(queueName)
                .withArgument("x-dead-letter-exchange", DLX_NAME)
                .withArgument("x-dead-letter-routing-key", DLQ_ROUTING_KEY)
                .build();
    }
}
