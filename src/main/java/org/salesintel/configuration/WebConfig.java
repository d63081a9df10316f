package org.salesintel.configuration;

import org.salesintel.models.enums.EntityType;
import org.salesintel.models.enums.SourceSystem;
import org.salesintel.models.enums.TransformType;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;

    public WebConfig(@Value("${dashboard.cors.allowed-origins:*}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(allowedOrigins)
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS");
    }

    // Path variables use the lowercase wire names (odoo, ms365, extract_id, ...)
    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(String.class, SourceSystem.class, (Converter<String, SourceSystem>) SourceSystem::fromWireName);
        registry.addConverter(String.class, EntityType.class, (Converter<String, EntityType>) EntityType::fromWireName);
        registry.addConverter(String.class, TransformType.class, (Converter<String, TransformType>) TransformType::fromWireName);
    }
}
