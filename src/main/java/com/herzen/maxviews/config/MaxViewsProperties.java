package com.herzen.maxviews.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "maxviews")
public record MaxViewsProperties(@DefaultValue("maxviews") String conditionType,
                                 @DefaultValue("r") String readCrud) {}
