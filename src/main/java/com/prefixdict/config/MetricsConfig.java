package com.prefixdict.config;

import com.prefixdict.data.DictionaryStore;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MetricsConfig {
    @Autowired
    public MetricsConfig(MeterRegistry registry, DictionaryStore store) {
        Gauge.builder("prefixdict.words", store, DictionaryStore::wordCount)
                .description("Distinct words held by the dictionary")
                .register(registry);
    }
}
