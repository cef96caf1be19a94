package io.github.cyfko.formstate.spring.autoconfigure;

import io.github.cyfko.formstate.core.FormEngine;
import io.github.cyfko.formstate.core.config.FormEngineConfig;
import io.github.cyfko.formstate.core.model.FormDefinition;
import io.github.cyfko.formstate.core.spi.ExpressionEvaluator;
import io.github.cyfko.formstate.core.spi.ReferenceExtractor;
import io.github.cyfko.formstate.spring.support.FormSessionRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
@ConditionalOnClass(FormEngine.class)
@EnableConfigurationProperties(FormStateProperties.class)
public class FormStateAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FormEngineConfig formEngineConfig(FormStateProperties properties,
                                             ObjectProvider<ExpressionEvaluator> evaluator,
                                             ObjectProvider<ReferenceExtractor> extractor) {
        FormEngineConfig.Builder builder = FormEngineConfig.builder()
                .navigationPolicy(properties.getNavigationPolicy())
                .reviewEnabled(properties.getReview().isEnabled())
                .reviewFirst(properties.getReview().isFirst())
                .readOnly(properties.isReadOnly())
                .cachePolicy(properties.getCache().toPolicy());
        evaluator.ifAvailable(builder::expressionEvaluator);
        extractor.ifAvailable(builder::referenceExtractor);
        return builder.build();
    }

    @Bean
    @ConditionalOnMissingBean
    public FormSessionRegistry formSessionRegistry(FormEngineConfig config, ObjectProvider<FormDefinition> definitions) {
        List<FormDefinition> declared = definitions.orderedStream().toList();
        return new FormSessionRegistry(config, declared);
    }

}
