package com.example.guardianintake.config;

import com.example.guardianintake.dto.rules.CorrectionScope;
import com.example.guardianintake.dto.rules.ExtractionRules;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the correction, anchor and separator tables once at startup.
 */
@Configuration
public class ExtractionRulesConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(ExtractionRulesConfiguration.class);

    @Autowired
    private IntakeProperties intakeProperties;

    @Autowired
    private ResourceLoader resourceLoader;

    @Bean
    public ExtractionRules extractionRules(ObjectMapper objectMapper) {
        String location = intakeProperties.getRulesLocation();
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IntakeRulesException("Extraction rules not found at " + location);
        }

        try (InputStream in = resource.getInputStream()) {
            ExtractionRules rules = new ExtractionRulesLoader(objectMapper).read(in);
            logger.info("📋 Extraction rules loaded from {}", location);
            logger.info("   - {} correction rules ({} page-level)", rules.getCorrections().size(),
                       rules.rulesFor(CorrectionScope.PAGE).size());
            logger.info("   - Separator priority: {}", rules.getSeparators());
            return rules;
        } catch (IOException e) {
            throw new IntakeRulesException("Could not read extraction rules at " + location, e);
        }
    }
}
