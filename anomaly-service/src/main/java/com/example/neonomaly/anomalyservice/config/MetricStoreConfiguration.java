package com.example.neonomaly.anomalyservice.config;

import com.example.neonomaly.metricstore.InMemoryReadingStore;
import com.example.neonomaly.metricstore.ReadingStore;
import com.example.neonomaly.metricstore.WindowReconstructor;
import com.example.neonomaly.metricstore.detection.AnomalyDetector;
import com.example.neonomaly.metricstore.registry.MetricRegistry;
import com.example.neonomaly.metricstore.registry.ServiceRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class MetricStoreConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public InMemoryReadingStore readingStore(Clock clock) {
        return new InMemoryReadingStore(clock);
    }

    @Bean
    public ServiceRegistry serviceRegistry(Clock clock) {
        return new ServiceRegistry(clock);
    }

    @Bean
    public MetricRegistry metricRegistry(ServiceRegistry serviceRegistry, ReadingStore readingStore) {
        return new MetricRegistry(serviceRegistry, readingStore);
    }

    @Bean
    public WindowReconstructor windowReconstructor(ReadingStore readingStore) {
        return new WindowReconstructor(readingStore);
    }

    @Bean
    public AnomalyDetector anomalyDetector(ServiceRegistry serviceRegistry,
                                           MetricRegistry metricRegistry,
                                           WindowReconstructor windowReconstructor) {
        return new AnomalyDetector(serviceRegistry, metricRegistry, windowReconstructor);
    }
}
