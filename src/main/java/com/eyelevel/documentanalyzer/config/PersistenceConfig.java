package com.eyelevel.documentanalyzer.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Repository scanning lives here rather than on the application class so that web-layer test
 * slices do not require a persistence context.
 */
@Configuration(proxyBeanMethods = false)
@EnableJpaRepositories(basePackages = "com.eyelevel.documentanalyzer.repository")
public class PersistenceConfig {
}
