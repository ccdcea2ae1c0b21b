package com.venn.adapter.spring;

import com.venn.config.ConfigLoader;
import com.venn.config.RegionConfig;
import com.venn.config.VennConfig;
import com.venn.expression.SetExpressionEvaluator;
import com.venn.geometry.RegionLayout;
import com.venn.view.RenderingJsonWriter;
import com.venn.view.SetVisualizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Venn.
 */
@Configuration
@ConditionalOnProperty(prefix = "venn", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(VennProperties.class)
public class VennAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(VennAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public VennConfig vennConfig(VennProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RegionLayout regionLayout(VennConfig config) {
        log.info("Creating RegionLayout for {}: regions {}", config.name(),
                config.regions().stream().map(RegionConfig::name).toList());
        return config.createLayout();
    }

    @Bean
    @ConditionalOnMissingBean
    public SetExpressionEvaluator setExpressionEvaluator() {
        return new SetExpressionEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public SetVisualizer setVisualizer(RegionLayout layout, SetExpressionEvaluator evaluator, VennConfig config) {
        log.info("Creating SetVisualizer with default expression '{}'", config.defaultExpression());
        return new SetVisualizer(layout, evaluator, config.defaultExpression());
    }

    @Bean
    @ConditionalOnMissingBean
    public RenderingJsonWriter renderingJsonWriter() {
        return new RenderingJsonWriter();
    }
}
