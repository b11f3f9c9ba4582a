package org.openphc.insight.realtime.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Enables the backlog, checkpoint and authorization repositories.
 */
@Configuration
@EnableJpaRepositories(basePackages = "org.openphc.insight.realtime.domain.repository")
@EnableTransactionManagement
public class JpaConfig {
}
