package com.smallbiz.agent.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Publishes the generated iCalendar files under /calendar/** so calendar apps can subscribe.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final CalendarProperties calendarProperties;

    public WebConfig(CalendarProperties calendarProperties) {
        this.calendarProperties = calendarProperties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String location = calendarProperties.apple().root().toAbsolutePath().normalize().toUri().toString();
        if (!location.endsWith("/")) {
            location = location + "/";
        }
        registry.addResourceHandler("/calendar/**")
                .addResourceLocations(location)
                .setCachePeriod(0);
    }
}
