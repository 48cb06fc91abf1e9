package com.invoice.sorter.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(InvoiceParserProperties.class)
public class ParserConfiguration {
}
