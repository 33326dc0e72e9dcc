package com.example.cronpurge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "purge.statements")
@Data
public class StatementStoreProperties {

    private String table = "scheduled_statements";
}
