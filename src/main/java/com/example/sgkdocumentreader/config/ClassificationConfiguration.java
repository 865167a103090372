package com.example.sgkdocumentreader.config;

import com.example.sgkdocumentreader.service.classification.ExternalDocumentClassifier;
import com.example.sgkdocumentreader.service.classification.WeightedKeywordClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Registers the bundled weighted keyword model as the external classifier
 * when enabled. Replace this bean to delegate to another model.
 */
@Configuration
public class ClassificationConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ClassificationConfiguration.class);

    @Bean
    @ConditionalOnProperty(prefix = "sgk.classification", name = "weighted-keywords", havingValue = "true")
    public ExternalDocumentClassifier weightedKeywordClassifier() {
        log.info("Delegating document classification to the weighted keyword model");
        return new WeightedKeywordClassifier();
    }
}
